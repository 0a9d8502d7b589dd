package com.aporkolab.reliability.spring.autoconfigure;

import com.aporkolab.reliability.connection.ConnectionManager;
import com.aporkolab.reliability.dlq.DlqListener;
import com.aporkolab.reliability.metrics.ConnectionMetrics;
import com.aporkolab.reliability.metrics.DlqMetrics;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rabbitmq.client.ConnectionFactory;

import io.micrometer.core.instrument.MeterRegistry;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring Boot Auto-Configuration for the AMQP reliability layer.
 * 
 * Automatically configures:
 * - ConnectionManager (closed with the context, connected on first use)
 * - ReliableConsumerFactory for consumers and publishers on the managed channel
 * - Connection and DLQ metrics when a MeterRegistry is present
 * 
 * Disable with: reliability.enabled=false in application.properties
 */
@AutoConfiguration
@EnableConfigurationProperties(ReliabilityProperties.class)
@ConditionalOnClass(ConnectionFactory.class)
@ConditionalOnProperty(prefix = "reliability", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ReliabilityAutoConfiguration {

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public ConnectionManager connectionManager(ReliabilityProperties properties) {
        var config = properties.getConnection();
        return ConnectionManager.builder()
                .url(config.getUrl())
                .reconnectAttempts(config.getReconnectAttempts())
                .reconnectDelayMs(config.getReconnectDelayMs())
                .maxReconnectDelayMs(config.getMaxReconnectDelayMs())
                .connectionName(config.getConnectionName())
                .build();
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public ReliableConsumerFactory reliableConsumerFactory(
            ConnectionManager connectionManager,
            ReliabilityProperties properties,
            ObjectProvider<ObjectMapper> objectMapper,
            ObjectProvider<DlqListener> dlqListener) {
        return new ReliableConsumerFactory(
                connectionManager,
                properties,
                objectMapper.getIfUnique(() -> new ObjectMapper().findAndRegisterModules()),
                dlqListener.getIfUnique(() -> DlqListener.NO_OP));
    }

    // ==================== METRICS ====================

    @Configuration
    @ConditionalOnClass(MeterRegistry.class)
    @ConditionalOnBean(MeterRegistry.class)
    @ConditionalOnProperty(prefix = "reliability.metrics", name = "enabled", havingValue = "true", matchIfMissing = true)
    static class MetricsAutoConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public ConnectionMetrics connectionMetrics(ConnectionManager connectionManager, MeterRegistry registry) {
            return new ConnectionMetrics(connectionManager, registry);
        }

        @Bean
        @ConditionalOnMissingBean
        public DlqMetrics dlqMetrics(MeterRegistry registry, ReliabilityProperties properties) {
            return new DlqMetrics(registry, properties.getDlq().getServiceName());
        }
    }
}
