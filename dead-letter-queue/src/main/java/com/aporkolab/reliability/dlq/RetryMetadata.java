package com.aporkolab.reliability.dlq;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Retry state carried in message headers, rebuilt into a typed value.
 *
 * Header values come back from the broker as Integer, Long, LongString or
 * byte[] depending on the publisher; everything is normalised here so the
 * rest of the handler never touches the raw map.
 */
public record RetryMetadata(int retryCount, String firstFailureTimestamp, String lastError) {

    /**
     * Reads retry state from headers. A missing or unreadable retry count is 0;
     * a missing first-failure timestamp is {@code now}.
     */
    public static RetryMetadata fromHeaders(Map<String, Object> headers, Instant now) {
        Map<String, Object> source = headers != null ? headers : Map.of();
        int retryCount = toRetryCount(source.get(RetryHeaders.RETRY_COUNT));
        String firstFailure = toText(source.get(RetryHeaders.FIRST_FAILURE_TIMESTAMP));
        if (firstFailure == null || firstFailure.isEmpty()) {
            firstFailure = RetryHeaders.formatTimestamp(now);
        }
        String lastError = toText(source.get(RetryHeaders.LAST_ERROR));
        return new RetryMetadata(retryCount, firstFailure, lastError);
    }

    public boolean isExhausted(int maxRetries) {
        return retryCount >= maxRetries;
    }

    /**
     * State for the next delayed redelivery.
     */
    public RetryMetadata nextAttempt(String error) {
        return new RetryMetadata(retryCount + 1, firstFailureTimestamp, error);
    }

    /**
     * Same retry count, refreshed error. Used on the dead-letter paths.
     */
    public RetryMetadata withLastError(String error) {
        return new RetryMetadata(retryCount, firstFailureTimestamp, error);
    }

    /**
     * Original headers with the retry headers added or overwritten.
     */
    public Map<String, Object> mergeInto(Map<String, Object> headers) {
        Map<String, Object> merged = new LinkedHashMap<>();
        if (headers != null) {
            merged.putAll(headers);
        }
        merged.put(RetryHeaders.RETRY_COUNT, retryCount);
        merged.put(RetryHeaders.FIRST_FAILURE_TIMESTAMP, firstFailureTimestamp);
        merged.put(RetryHeaders.LAST_ERROR, lastError);
        return merged;
    }

    private static int toRetryCount(Object value) {
        long count;
        if (value instanceof Number number) {
            count = number.longValue();
        } else {
            String text = toText(value);
            if (text == null) {
                return 0;
            }
            try {
                count = Long.parseLong(text.trim());
            } catch (NumberFormatException e) {
                return 0;
            }
        }
        if (count < 0) {
            return 0;
        }
        return (int) Math.min(count, Integer.MAX_VALUE);
    }

    private static String toText(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof byte[] bytes) {
            return new String(bytes, StandardCharsets.UTF_8);
        }
        // LongString.toString() decodes as UTF-8
        return value.toString();
    }
}
