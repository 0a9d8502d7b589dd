package com.aporkolab.reliability.logging;

import java.nio.charset.StandardCharsets;
import java.util.Map;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Delivery;

/**
 * Correlation ID propagation through AMQP message properties.
 * 
 * Outgoing: the current MDC correlation ID is written to the
 * {@code correlation_id} property.
 * Incoming: the ID is read from {@code correlation_id}, falling back to the
 * {@code x-correlation-id} header used by non-AMQP-native producers.
 */
public final class AmqpCorrelation {

    public static final String CORRELATION_ID_HEADER = "x-correlation-id";

    private AmqpCorrelation() {
    }

    /**
     * Returns the correlation ID of a delivery, or null if it carries none.
     */
    public static String extractCorrelationId(Delivery delivery) {
        if (delivery == null || delivery.getProperties() == null) {
            return null;
        }
        AMQP.BasicProperties properties = delivery.getProperties();
        if (properties.getCorrelationId() != null && !properties.getCorrelationId().isBlank()) {
            return properties.getCorrelationId();
        }
        Map<String, Object> headers = properties.getHeaders();
        if (headers == null) {
            return null;
        }
        Object value = headers.get(CORRELATION_ID_HEADER);
        if (value instanceof byte[] bytes) {
            return new String(bytes, StandardCharsets.UTF_8);
        }
        return value != null ? value.toString() : null;
    }

    /**
     * Opens a log scope continuing the delivery's correlation.
     */
    public static LogContext setupContext(Delivery delivery) {
        return LogContext.continueOrCreate(extractCorrelationId(delivery));
    }

    /**
     * Stamps the current correlation ID onto outgoing properties, if one is set.
     */
    public static AMQP.BasicProperties.Builder stamp(AMQP.BasicProperties.Builder builder) {
        String correlationId = LogContext.getCurrentCorrelationId();
        if (correlationId != null) {
            builder.correlationId(correlationId);
        }
        return builder;
    }
}
