package com.aporkolab.reliability.dlq;

/**
 * Broker object names derived from a base exchange and queue.
 */
public record DlqTopology(String exchange, String queue) {

    public static final String NOTIFICATIONS_EXCHANGE = "notifications";
    public static final String DELAYED_EXCHANGE_TYPE = "x-delayed-message";
    public static final String DELAYED_TYPE_ARGUMENT = "x-delayed-type";

    public String delayExchange() {
        return exchange + ".delay";
    }

    public String deadLetterExchange() {
        return exchange + ".dlq";
    }

    public String deadLetterQueue() {
        return queue + ".dlq";
    }

    /**
     * Routing key of the dead-letter binding: the original queue name.
     */
    public String deadLetterRoutingKey() {
        return queue;
    }

    public static String alertRoutingKey(String serviceName) {
        return "notifications.dlq." + serviceName;
    }
}
