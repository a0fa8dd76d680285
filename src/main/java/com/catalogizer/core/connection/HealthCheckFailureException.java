package com.catalogizer.core.connection;

/**
 * Thrown when a health check failed.
 */
public class HealthCheckFailureException extends ConnectorException {

    public HealthCheckFailureException(String sourceId, String message) {
        super(sourceId, message);
    }

    public HealthCheckFailureException(String sourceId, String message, Throwable cause) {
        super(sourceId, message, cause);
    }

    @Override
    public boolean isTimeout() {
        return false;
    }
}
