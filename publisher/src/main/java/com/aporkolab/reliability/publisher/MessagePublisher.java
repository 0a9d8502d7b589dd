package com.aporkolab.reliability.publisher;

import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.aporkolab.reliability.exception.ConfigurationException;
import com.aporkolab.reliability.exception.NonRetryableException;
import com.aporkolab.reliability.logging.AmqpCorrelation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.BuiltinExchangeType;
import com.rabbitmq.client.Channel;

/**
 * Publishes JSON messages to a topic exchange.
 *
 * The exchange is asserted on first use only. Messages are persistent and
 * carry the current correlation ID. There is no retry here; broker errors
 * propagate to the caller.
 */
public class MessagePublisher {

    private static final Logger log = LoggerFactory.getLogger(MessagePublisher.class);
    private static final String CONTENT_TYPE_JSON = "application/json";
    private static final int PERSISTENT = 2;

    private final Channel channel;
    private final String exchange;
    private final ObjectMapper objectMapper;

    private volatile boolean exchangeAsserted;

    public MessagePublisher(Channel channel, String exchange, ObjectMapper objectMapper) {
        this.channel = ConfigurationException.requireNonNull("channel", channel);
        this.exchange = ConfigurationException.requireText("exchange", exchange);
        this.objectMapper = ConfigurationException.requireNonNull("objectMapper", objectMapper);
    }

    public void publish(String routingKey, Object content) throws IOException {
        byte[] body = serialize(content);
        assertExchange();

        AMQP.BasicProperties properties = AmqpCorrelation.stamp(new AMQP.BasicProperties.Builder())
                .contentType(CONTENT_TYPE_JSON)
                .deliveryMode(PERSISTENT)
                .build();

        channel.basicPublish(exchange, routingKey, properties, body);
        log.debug("Message published: exchange={}, routingKey={}, bytes={}", exchange, routingKey, body.length);
    }

    private void assertExchange() throws IOException {
        if (exchangeAsserted) {
            return;
        }
        synchronized (this) {
            if (!exchangeAsserted) {
                channel.exchangeDeclare(exchange, BuiltinExchangeType.TOPIC, true);
                exchangeAsserted = true;
                log.info("Exchange asserted: exchange={}", exchange);
            }
        }
    }

    private byte[] serialize(Object content) {
        try {
            return objectMapper.writeValueAsBytes(content);
        } catch (JsonProcessingException e) {
            throw new NonRetryableException("Failed to serialize message: " + e.getOriginalMessage(),
                    "SERIALIZATION_ERROR", e)
                    .with("exchange", exchange);
        }
    }

    public String getExchange() {
        return exchange;
    }
}
