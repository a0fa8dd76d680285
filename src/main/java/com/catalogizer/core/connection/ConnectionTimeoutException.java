package com.catalogizer.core.connection;

/**
 * Thrown when a connection attempt exceeded its deadline.
 */
public class ConnectionTimeoutException extends ConnectorException {

    public ConnectionTimeoutException(String sourceId, String message) {
        super(sourceId, message);
    }

    public ConnectionTimeoutException(String sourceId, String message, Throwable cause) {
        super(sourceId, message, cause);
    }

    @Override
    public boolean isTimeout() {
        return true;
    }
}
