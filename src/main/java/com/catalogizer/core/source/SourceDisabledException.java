package com.catalogizer.core.source;

/**
 * Thrown when a reconnect is requested for a source that has been disabled.
 */
public class SourceDisabledException extends SourceException {
    public SourceDisabledException(String sourceId) {
        super(sourceId, "source is disabled: " + sourceId);
    }
}
