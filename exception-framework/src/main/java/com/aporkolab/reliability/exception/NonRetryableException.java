package com.aporkolab.reliability.exception;

import java.util.Map;

/**
 * Permanent processing failure. The message goes straight to the dead-letter
 * queue without consuming the retry budget.
 */
public class NonRetryableException extends ReliabilityException {

    public static final String DEFAULT_CODE = "NON_RETRYABLE";

    public NonRetryableException(String message) {
        super(DEFAULT_CODE, message);
    }

    public NonRetryableException(String message, String code) {
        super(code, message);
    }

    public NonRetryableException(String message, String code, Map<String, ?> context) {
        super(code, message);
        withAll(context);
    }

    public NonRetryableException(String message, String code, Throwable cause) {
        super(code, message, cause);
    }
}
