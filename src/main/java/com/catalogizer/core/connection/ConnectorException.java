package com.catalogizer.core.connection;

import com.catalogizer.core.source.SourceException;

/**
 * Outcome of a failed connect or probe. These never reach management callers; they are
 * turned into state transitions, {@code lastError} values and events.
 */
public abstract class ConnectorException extends SourceException {

    protected ConnectorException(String sourceId, String message) {
        super(sourceId, message);
    }

    protected ConnectorException(String sourceId, String message, Throwable cause) {
        super(sourceId, message, cause);
    }

    /** True when the operation overran its deadline rather than failing outright. */
    public abstract boolean isTimeout();
}
