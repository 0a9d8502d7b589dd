package com.aporkolab.reliability.dlq;

import java.io.IOException;

import com.rabbitmq.client.Delivery;

/**
 * Decides the fate of a message whose processing failed.
 *
 * Implementations own the retry policy; callers only classify the failure.
 * Broker I/O failures are not handled here and propagate to the caller.
 */
public interface DlqHandler {

    /**
     * Declare the delay, dead-letter and notification topology. Idempotent.
     */
    void setup() throws IOException;

    /**
     * Schedule a delayed retry, or dead-letter once the retry budget is spent.
     * Acknowledges the original delivery in both cases.
     */
    void handleRetryableError(Delivery message, Exception error) throws IOException;

    /**
     * Dead-letter immediately and publish an alert. Acknowledges the original delivery.
     */
    void handleNonRetryableError(Delivery message, Exception error) throws IOException;
}
