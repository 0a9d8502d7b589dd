package com.aporkolab.reliability.dlq;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.aporkolab.reliability.exception.ConfigurationException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.node.TextNode;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.BuiltinExchangeType;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Delivery;

/**
 * Routes failed messages to delayed retry or to the Dead Letter Queue.
 *
 * Design decisions:
 * - Retry state lives in message headers only (no in-memory tracking)
 * - Retries go through an x-delayed-message exchange with exponential delay
 * - Terminal failures are dead-lettered with full retry context and raise an alert
 * - The original delivery is acked once the retry or dead-letter copy is published
 * - Publishes are fire-and-forget; broker I/O errors propagate to the caller
 */
public class DeadLetterQueueHandler implements DlqHandler {

    private static final Logger log = LoggerFactory.getLogger(DeadLetterQueueHandler.class);
    private static final int DEFAULT_MAX_RETRIES = 20;

    private final Channel channel;
    private final DlqTopology topology;
    private final String serviceName;
    private final int maxRetries;
    private final ObjectMapper objectMapper;
    private final ObjectReader strictReader;
    private final Clock clock;
    private final DlqListener listener;

    private DeadLetterQueueHandler(Builder builder) {
        this.channel = builder.channel;
        this.topology = new DlqTopology(builder.exchange, builder.queue);
        this.serviceName = builder.serviceName;
        this.maxRetries = builder.maxRetries;
        this.objectMapper = builder.objectMapper;
        this.strictReader = builder.objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
        this.clock = builder.clock;
        this.listener = builder.listener;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public void setup() throws IOException {
        channel.exchangeDeclare(
                topology.delayExchange(),
                DlqTopology.DELAYED_EXCHANGE_TYPE,
                true,
                false,
                Map.of(DlqTopology.DELAYED_TYPE_ARGUMENT, BuiltinExchangeType.TOPIC.getType()));

        channel.exchangeDeclare(topology.deadLetterExchange(), BuiltinExchangeType.TOPIC, true);
        channel.queueDeclare(topology.deadLetterQueue(), true, false, false, null);
        channel.queueBind(topology.deadLetterQueue(), topology.deadLetterExchange(), topology.deadLetterRoutingKey());
        channel.exchangeDeclare(DlqTopology.NOTIFICATIONS_EXCHANGE, BuiltinExchangeType.TOPIC, true);

        log.info("DLQ infrastructure asserted: delayExchange={}, dlqExchange={}, dlqQueue={}",
                topology.delayExchange(), topology.deadLetterExchange(), topology.deadLetterQueue());
    }

    @Override
    public void handleRetryableError(Delivery message, Exception error) throws IOException {
        Map<String, Object> headers = headersOf(message);
        RetryMetadata metadata = RetryMetadata.fromHeaders(headers, clock.instant());
        String errorMessage = describe(error);

        if (metadata.isExhausted(maxRetries)) {
            log.warn("Max retries exhausted, routing to DLQ: queue={}, retryCount={}, error={}",
                    topology.queue(), metadata.retryCount(), errorMessage);
            deadLetter(message, headers, metadata.withLastError(errorMessage), FailureType.MAX_RETRIES_EXCEEDED);
            return;
        }

        long delay = RetryBackoff.delayFor(metadata.retryCount());
        RetryMetadata next = metadata.nextAttempt(errorMessage);

        Map<String, Object> retryHeaders = next.mergeInto(headers);
        retryHeaders.put(RetryHeaders.DELAY, (int) delay);

        channel.basicPublish(
                topology.delayExchange(),
                message.getEnvelope().getRoutingKey(),
                persistentJson(retryHeaders),
                message.getBody());

        log.info("Message scheduled for retry: queue={}, retryCount={}, delayMs={}, error={}",
                topology.queue(), next.retryCount(), delay, errorMessage);
        listener.onRetryScheduled(topology.queue(), next.retryCount(), delay);

        channel.basicAck(message.getEnvelope().getDeliveryTag(), false);
    }

    @Override
    public void handleNonRetryableError(Delivery message, Exception error) throws IOException {
        Map<String, Object> headers = headersOf(message);
        RetryMetadata metadata = RetryMetadata.fromHeaders(headers, clock.instant());
        String errorMessage = describe(error);

        log.warn("Non-retryable error, routing directly to DLQ: queue={}, retryCount={}, error={}",
                topology.queue(), metadata.retryCount(), errorMessage);

        deadLetter(message, headers, metadata.withLastError(errorMessage), FailureType.NON_RETRYABLE);
    }

    private void deadLetter(Delivery message, Map<String, Object> headers, RetryMetadata metadata,
                            FailureType failureType) throws IOException {
        routeToDlq(message, headers, metadata);
        publishAlert(message, metadata);
        listener.onDeadLettered(topology.queue(), failureType, metadata.retryCount());
        channel.basicAck(message.getEnvelope().getDeliveryTag(), false);
    }

    private void routeToDlq(Delivery message, Map<String, Object> headers, RetryMetadata metadata) throws IOException {
        channel.basicPublish(
                topology.deadLetterExchange(),
                topology.deadLetterRoutingKey(),
                persistentJson(metadata.mergeInto(headers)),
                message.getBody());

        log.info("Message routed to DLQ: dlqQueue={}, retryCount={}, error={}",
                topology.deadLetterQueue(), metadata.retryCount(), metadata.lastError());
    }

    private void publishAlert(Delivery message, RetryMetadata metadata) throws IOException {
        String routingKey = DlqTopology.alertRoutingKey(serviceName);

        DlqAlert alert = new DlqAlert(
                serviceName,
                topology.queue(),
                metadata.lastError(),
                metadata.retryCount(),
                parseOriginalMessage(message.getBody()),
                RetryHeaders.formatTimestamp(clock.instant()));

        byte[] payload = objectMapper.writeValueAsBytes(alert);
        channel.basicPublish(DlqTopology.NOTIFICATIONS_EXCHANGE, routingKey, persistentJson(null), payload);

        log.info("DLQ alert published: exchange={}, routingKey={}, service={}",
                DlqTopology.NOTIFICATIONS_EXCHANGE, routingKey, serviceName);
    }

    /**
     * The body as JSON when it parses, otherwise the raw text.
     */
    JsonNode parseOriginalMessage(byte[] body) {
        byte[] content = body != null ? body : new byte[0];
        try {
            JsonNode parsed = strictReader.readTree(content);
            if (parsed != null && !parsed.isMissingNode()) {
                return parsed;
            }
        } catch (IOException e) {
            log.debug("Original message is not valid JSON, using raw text: {}", e.getMessage());
        }
        return TextNode.valueOf(new String(content, StandardCharsets.UTF_8));
    }

    private static AMQP.BasicProperties persistentJson(Map<String, Object> headers) {
        return new AMQP.BasicProperties.Builder()
                .deliveryMode(RetryHeaders.PERSISTENT)
                .contentType(RetryHeaders.CONTENT_TYPE_JSON)
                .headers(headers)
                .build();
    }

    private static Map<String, Object> headersOf(Delivery message) {
        AMQP.BasicProperties properties = message.getProperties();
        if (properties == null || properties.getHeaders() == null) {
            return Map.of();
        }
        return properties.getHeaders();
    }

    private static String describe(Exception error) {
        if (error == null) {
            return "Unknown error";
        }
        String message = error.getMessage();
        return message != null ? message : error.getClass().getSimpleName();
    }

    public DlqTopology getTopology() {
        return topology;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public static class Builder {
        private Channel channel;
        private String exchange;
        private String queue;
        private String serviceName;
        private int maxRetries = DEFAULT_MAX_RETRIES;
        private ObjectMapper objectMapper = new ObjectMapper();
        private Clock clock = Clock.systemUTC();
        private DlqListener listener = DlqListener.NO_OP;

        public Builder channel(Channel channel) {
            this.channel = channel;
            return this;
        }

        public Builder exchange(String exchange) {
            this.exchange = exchange;
            return this;
        }

        public Builder queue(String queue) {
            this.queue = queue;
            return this;
        }

        public Builder serviceName(String serviceName) {
            this.serviceName = serviceName;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            if (maxRetries < 0) {
                throw new ConfigurationException("maxRetries", "must be >= 0");
            }
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = ConfigurationException.requireNonNull("objectMapper", objectMapper);
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = ConfigurationException.requireNonNull("clock", clock);
            return this;
        }

        public Builder listener(DlqListener listener) {
            this.listener = listener != null ? listener : DlqListener.NO_OP;
            return this;
        }

        public DeadLetterQueueHandler build() {
            ConfigurationException.requireNonNull("channel", channel);
            ConfigurationException.requireText("exchange", exchange);
            ConfigurationException.requireText("queue", queue);
            ConfigurationException.requireText("serviceName", serviceName);
            return new DeadLetterQueueHandler(this);
        }
    }
}
