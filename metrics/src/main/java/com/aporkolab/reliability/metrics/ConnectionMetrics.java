package com.aporkolab.reliability.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;

import com.aporkolab.reliability.connection.ConnectionManager;
import com.aporkolab.reliability.connection.ConnectionState;

/**
 * Micrometer metrics for a {@link ConnectionManager}.
 * 
 * Provides the following metrics:
 * - amqp_connection_state (gauge): Current state (0=DISCONNECTED, 1=CONNECTING, 2=CONNECTED)
 * - amqp_connection_reconnects_total (counter): Successful automatic reconnections
 * - amqp_connection_errors_total (counter): Connection errors reported by the manager
 */
public class ConnectionMetrics {

    private static final String METRIC_PREFIX = "amqp_connection";

    private final ConnectionManager connectionManager;
    private final Counter reconnectCounter;
    private final Counter errorCounter;

    public ConnectionMetrics(ConnectionManager connectionManager, MeterRegistry registry) {
        this(connectionManager, registry, Tags.empty());
    }

    public ConnectionMetrics(ConnectionManager connectionManager, MeterRegistry registry, Tags tags) {
        this.connectionManager = connectionManager;

        this.reconnectCounter = Counter.builder(METRIC_PREFIX + "_reconnects_total")
                .description("Successful automatic reconnections")
                .tags(tags)
                .register(registry);

        this.errorCounter = Counter.builder(METRIC_PREFIX + "_errors_total")
                .description("Connection and channel errors")
                .tags(tags)
                .register(registry);

        Gauge.builder(METRIC_PREFIX + "_state", this, m -> stateToNumber(m.connectionManager.getState()))
                .description("Current connection state (0=DISCONNECTED, 1=CONNECTING, 2=CONNECTED)")
                .tags(tags)
                .strongReference(true)
                .register(registry);

        connectionManager.onReconnected(reconnectCounter::increment);
        connectionManager.onError(error -> errorCounter.increment());
    }

    public double getReconnectCount() {
        return reconnectCounter.count();
    }

    public double getErrorCount() {
        return errorCounter.count();
    }

    static double stateToNumber(ConnectionState state) {
        return switch (state) {
            case DISCONNECTED -> 0;
            case CONNECTING -> 1;
            case CONNECTED -> 2;
        };
    }
}
