package com.aporkolab.reliability.consumer;

import java.io.IOException;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.aporkolab.reliability.dlq.DlqHandler;
import com.aporkolab.reliability.dlq.RetryMetadata;
import com.aporkolab.reliability.exception.ConfigurationException;
import com.aporkolab.reliability.exception.NonRetryableException;
import com.aporkolab.reliability.exception.RetryableException;
import com.aporkolab.reliability.logging.AmqpCorrelation;
import com.aporkolab.reliability.logging.LogContext;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.rabbitmq.client.BuiltinExchangeType;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Delivery;

/**
 * Consumes one queue with manual acknowledgement.
 *
 * Every delivery ends in exactly one of: ack after success, ack by the DLQ
 * handler after a retry or dead-letter publish, or nack without requeue when
 * the DLQ handler itself fails. Messages are never requeued in place.
 */
public class MessageConsumer {

    private static final Logger log = LoggerFactory.getLogger(MessageConsumer.class);
    private static final int DEFAULT_PREFETCH = 10;
    private static final TypeReference<Map<String, Object>> CONTENT_TYPE = new TypeReference<>() {
    };

    private final Channel channel;
    private final String exchange;
    private final String queue;
    private final String routingKey;
    private final DlqHandler dlqHandler;
    private final MessageHandler handler;
    private final int prefetchCount;
    private final ObjectReader contentReader;

    private final AtomicLong droppedCount = new AtomicLong();
    private volatile String consumerTag;

    private MessageConsumer(Builder builder) {
        this.channel = builder.channel;
        this.exchange = builder.exchange;
        this.queue = builder.queue;
        this.routingKey = builder.routingKey;
        this.dlqHandler = builder.dlqHandler;
        this.handler = builder.handler;
        this.prefetchCount = builder.prefetchCount;
        this.contentReader = builder.objectMapper.readerFor(CONTENT_TYPE)
                .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Asserts the topology, sets up the DLQ infrastructure and starts consuming.
     */
    public void start() throws IOException {
        channel.basicQos(prefetchCount);
        channel.exchangeDeclare(exchange, BuiltinExchangeType.TOPIC, true);
        channel.queueDeclare(queue, true, false, false, null);
        channel.queueBind(queue, exchange, routingKey);

        dlqHandler.setup();

        consumerTag = channel.basicConsume(queue, false,
                (tag, delivery) -> handleDelivery(delivery),
                this::onCancelled);

        log.info("Consumer started: exchange={}, queue={}, routingKey={}, prefetch={}",
                exchange, queue, routingKey, prefetchCount);
    }

    /**
     * Cancels the subscription. Deliveries already dispatched still complete.
     */
    public void stop() throws IOException {
        String tag = consumerTag;
        if (tag == null) {
            return;
        }
        consumerTag = null;
        channel.basicCancel(tag);
        log.info("Consumer stopped: queue={}", queue);
    }

    void handleDelivery(Delivery message) {
        if (message == null) {
            log.debug("Ignoring null delivery: queue={}", queue);
            return;
        }

        long deliveryTag = message.getEnvelope().getDeliveryTag();
        try (LogContext ignored = AmqpCorrelation.setupContext(message)
                .withComponent("consumer")
                .withQueue(queue)
                .withDeliveryTag(deliveryTag)) {
            try {
                Map<String, Object> content = decode(message.getBody());
                handler.handle(content, message);
                channel.basicAck(deliveryTag, false);
            } catch (Exception e) {
                handleFailure(message, e);
            }
        }
    }

    private void handleFailure(Delivery message, Exception error) {
        int retryCount = retryCountOf(message);
        log.error("Message processing failed: queue={}, error={}, retryCount={}",
                queue, error.getMessage(), retryCount, error);

        try {
            if (error instanceof NonRetryableException) {
                dlqHandler.handleNonRetryableError(message, error);
            } else {
                dlqHandler.handleRetryableError(message, error);
            }
        } catch (Exception dlqError) {
            long deliveryTag = message.getEnvelope().getDeliveryTag();
            long dropped = droppedCount.incrementAndGet();
            log.error("DLQ handling failed, message dropped: queue={}, deliveryTag={}, dropped={}, error={}",
                    queue, deliveryTag, dropped, dlqError.getMessage(), dlqError);
            nack(deliveryTag);
        }
    }

    private void nack(long deliveryTag) {
        try {
            channel.basicNack(deliveryTag, false, false);
        } catch (IOException | RuntimeException e) {
            log.error("Failed to nack message: queue={}, deliveryTag={}, error={}",
                    queue, deliveryTag, e.getMessage(), e);
        }
    }

    private Map<String, Object> decode(byte[] body) {
        Map<String, Object> content;
        try {
            content = contentReader.readValue(body);
        } catch (IOException e) {
            throw RetryableException.decodeFailure(e);
        }
        if (content == null) {
            throw RetryableException.decodeFailure(new IOException("Message body is JSON null"));
        }
        return content;
    }

    private int retryCountOf(Delivery message) {
        Map<String, Object> headers = message.getProperties() != null ? message.getProperties().getHeaders() : null;
        return RetryMetadata.fromHeaders(headers, Instant.EPOCH).retryCount();
    }

    private void onCancelled(String tag) {
        log.warn("Consumer cancelled by broker: queue={}, consumerTag={}", queue, tag);
        consumerTag = null;
    }

    public long getDroppedCount() {
        return droppedCount.get();
    }

    public boolean isConsuming() {
        return consumerTag != null;
    }

    public String getQueue() {
        return queue;
    }

    public static class Builder {
        private Channel channel;
        private String exchange;
        private String queue;
        private String routingKey;
        private DlqHandler dlqHandler;
        private MessageHandler handler;
        private int prefetchCount = DEFAULT_PREFETCH;
        private ObjectMapper objectMapper = new ObjectMapper();

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

        public Builder routingKey(String routingKey) {
            this.routingKey = routingKey;
            return this;
        }

        public Builder dlqHandler(DlqHandler dlqHandler) {
            this.dlqHandler = dlqHandler;
            return this;
        }

        public Builder handler(MessageHandler handler) {
            this.handler = handler;
            return this;
        }

        public Builder prefetchCount(int prefetchCount) {
            if (prefetchCount < 1) {
                throw new ConfigurationException("prefetchCount", "must be >= 1");
            }
            this.prefetchCount = prefetchCount;
            return this;
        }

        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = ConfigurationException.requireNonNull("objectMapper", objectMapper);
            return this;
        }

        public MessageConsumer build() {
            ConfigurationException.requireNonNull("channel", channel);
            ConfigurationException.requireText("exchange", exchange);
            ConfigurationException.requireText("queue", queue);
            ConfigurationException.requireNonNull("routingKey", routingKey);
            ConfigurationException.requireNonNull("dlqHandler", dlqHandler);
            ConfigurationException.requireNonNull("handler", handler);
            return new MessageConsumer(this);
        }
    }
}
