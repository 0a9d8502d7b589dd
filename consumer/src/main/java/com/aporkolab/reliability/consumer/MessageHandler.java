package com.aporkolab.reliability.consumer;

import java.util.Map;

import com.rabbitmq.client.Delivery;

/**
 * Business logic invoked for each decoded message.
 *
 * Throw {@link com.aporkolab.reliability.exception.NonRetryableException} for
 * failures that will never succeed; anything else is retried with backoff.
 */
@FunctionalInterface
public interface MessageHandler {

    void handle(Map<String, Object> content, Delivery message) throws Exception;
}
