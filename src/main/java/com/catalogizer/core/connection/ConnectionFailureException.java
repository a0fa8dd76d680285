package com.catalogizer.core.connection;

/**
 * Thrown when a connection attempt failed.
 */
public class ConnectionFailureException extends ConnectorException {

    public ConnectionFailureException(String sourceId, String message) {
        super(sourceId, message);
    }

    public ConnectionFailureException(String sourceId, String message, Throwable cause) {
        super(sourceId, message, cause);
    }

    @Override
    public boolean isTimeout() {
        return false;
    }
}
