package com.aporkolab.reliability.dlq;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Header contract shared with everything that reads dead-lettered messages.
 */
public final class RetryHeaders {

    public static final String RETRY_COUNT = "x-retry-count";
    public static final String FIRST_FAILURE_TIMESTAMP = "x-first-failure-timestamp";
    public static final String LAST_ERROR = "x-last-error";
    public static final String DELAY = "x-delay";

    public static final String CONTENT_TYPE_JSON = "application/json";
    public static final int PERSISTENT = 2;

    private static final DateTimeFormatter ISO_MILLIS =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

    private RetryHeaders() {
    }

    /**
     * ISO-8601 UTC with millisecond precision, e.g. {@code 2024-05-01T12:00:00.000Z}.
     */
    public static String formatTimestamp(Instant instant) {
        return ISO_MILLIS.format(instant);
    }
}
