package com.aporkolab.reliability.connection;

/**
 * Lifecycle of the single broker connection owned by a {@link ConnectionManager}.
 */
public enum ConnectionState {
    DISCONNECTED, // No usable channel; getChannel() fails
    CONNECTING,   // Attempt loop running
    CONNECTED     // Channel available
}
