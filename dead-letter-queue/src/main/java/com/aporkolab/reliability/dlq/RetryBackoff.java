package com.aporkolab.reliability.dlq;

/**
 * Delay schedule for redelivery through the delay exchange.
 *
 * <pre>
 * retry index: 0    1     2     3     4     5      ... 16        17+
 * delay (ms):  0    1000  2000  4000  8000  16000  ... 32768000  57600000 (16h cap)
 * </pre>
 */
public final class RetryBackoff {

    public static final long BASE_DELAY_MS = 1000;
    public static final long MAX_DELAY_MS = 16L * 60 * 60 * 1000;

    // 1000 * 2^16 already exceeds the cap
    private static final int MAX_EXPONENT = 16;

    private RetryBackoff() {
    }

    public static long delayFor(int retryIndex) {
        if (retryIndex <= 0) {
            return 0;
        }
        int exponent = Math.min(retryIndex - 1, MAX_EXPONENT);
        return Math.min(BASE_DELAY_MS << exponent, MAX_DELAY_MS);
    }
}
