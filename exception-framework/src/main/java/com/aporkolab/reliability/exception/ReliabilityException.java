package com.aporkolab.reliability.exception;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Base class for all exceptions raised by the reliability layer.
 * 
 * Provides:
 * - Stable error code for classification
 * - Structured context for debugging
 * - Timestamp for correlation with broker logs
 */
public abstract class ReliabilityException extends RuntimeException {

    private final String code;
    private final Map<String, Object> context;
    private final Instant timestamp;

    protected ReliabilityException(String code, String message) {
        super(message);
        this.code = code;
        this.context = new HashMap<>();
        this.timestamp = Instant.now();
    }

    protected ReliabilityException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.context = new HashMap<>();
        this.timestamp = Instant.now();
    }

    /**
     * Add contextual information for debugging.
     * Fluent API for chaining. Null values are ignored.
     */
    public ReliabilityException with(String key, Object value) {
        if (value != null) {
            this.context.put(key, value);
        }
        return this;
    }

    /**
     * Copies every entry of the given map into the context.
     */
    public ReliabilityException withAll(Map<String, ?> values) {
        if (values != null) {
            values.forEach(this::with);
        }
        return this;
    }

    public String getCode() {
        return code;
    }

    public Map<String, Object> getContext() {
        return Map.copyOf(context);
    }

    public Instant getTimestamp() {
        return timestamp;
    }
}
