package com.aporkolab.reliability.dlq;

/**
 * Observer for retry and dead-letter decisions, e.g. for metrics.
 * Called after the corresponding publish succeeded.
 */
public interface DlqListener {

    DlqListener NO_OP = new DlqListener() {
    };

    default void onRetryScheduled(String queue, int retryCount, long delayMs) {
    }

    default void onDeadLettered(String queue, FailureType failureType, int retryCount) {
    }
}
