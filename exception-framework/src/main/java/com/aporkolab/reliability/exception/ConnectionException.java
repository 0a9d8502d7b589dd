package com.aporkolab.reliability.exception;

/**
 * Broker connectivity failures: connect exhausted, no channel, close failed.
 */
public class ConnectionException extends ReliabilityException {

    public static final String CONNECT_FAILED = "ECONNFAILED";
    public static final String NO_CHANNEL = "ENOCHANNEL";
    public static final String CLOSE_FAILED = "ECLOSEFAILED";

    public ConnectionException(String message, String code) {
        super(code, message);
    }

    public ConnectionException(String message, String code, Throwable cause) {
        super(code, message, cause);
    }

    public static ConnectionException connectFailed(int attempts, Throwable lastError) {
        String lastMessage = lastError != null ? lastError.getMessage() : null;
        ConnectionException exception = new ConnectionException(
                String.format("Failed to connect after %d attempts", attempts), CONNECT_FAILED, lastError);
        exception.with("attempts", attempts);
        exception.with("lastError", lastMessage);
        return exception;
    }

    public static ConnectionException noChannel() {
        return new ConnectionException("Channel not available - call connect() first", NO_CHANNEL);
    }

    public static ConnectionException closeFailed(Throwable cause) {
        return new ConnectionException("Failed to close broker connection: " + cause.getMessage(), CLOSE_FAILED, cause);
    }
}
