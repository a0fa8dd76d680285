package com.catalogizer.core.connection;

/**
 * Thrown when a health check exceeded its deadline.
 */
public class HealthCheckTimeoutException extends ConnectorException {

    public HealthCheckTimeoutException(String sourceId, String message) {
        super(sourceId, message);
    }

    public HealthCheckTimeoutException(String sourceId, String message, Throwable cause) {
        super(sourceId, message, cause);
    }

    @Override
    public boolean isTimeout() {
        return true;
    }
}
