package com.aporkolab.reliability.dlq;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Operator alert published once per terminal failure.
 *
 * @param originalMessage the payload parsed as JSON, or a text node with the raw body
 * @param timestamp ISO-8601 time the alert was raised
 */
public record DlqAlert(
        String service,
        String queue,
        String error,
        int retryCount,
        JsonNode originalMessage,
        String timestamp) {
}
