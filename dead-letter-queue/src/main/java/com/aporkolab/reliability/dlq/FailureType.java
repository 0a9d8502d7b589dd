package com.aporkolab.reliability.dlq;

/**
 * Categorizes why a message was sent to the Dead Letter Queue.
 */
public enum FailureType {

    /** Retryable failure that used up its retry budget */
    MAX_RETRIES_EXCEEDED,

    /** Explicitly marked as non-retryable */
    NON_RETRYABLE
}
