package com.aporkolab.reliability.exception;

import java.util.Map;

/**
 * Transient processing failure. The message is scheduled for a delayed retry
 * until the retry budget is exhausted, then dead-lettered.
 */
public class RetryableException extends ReliabilityException {

    public static final String DEFAULT_CODE = "RETRYABLE";

    public RetryableException(String message) {
        super(DEFAULT_CODE, message);
    }

    public RetryableException(String message, String code) {
        super(code, message);
    }

    public RetryableException(String message, String code, Map<String, ?> context) {
        super(code, message);
        withAll(context);
    }

    public RetryableException(String message, String code, Throwable cause) {
        super(code, message, cause);
    }

    /**
     * Payload could not be decoded. Treated as transient so a fixed producer
     * gets a chance to have the message redelivered.
     */
    public static RetryableException decodeFailure(Throwable cause) {
        return new RetryableException("Failed to decode message payload: " + cause.getMessage(), "DECODE_ERROR", cause);
    }
}
