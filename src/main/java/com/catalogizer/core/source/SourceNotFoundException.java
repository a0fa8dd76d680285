package com.catalogizer.core.source;

/**
 * Thrown when a management call names a source id that is not registered.
 */
public class SourceNotFoundException extends SourceException {
    public SourceNotFoundException(String sourceId) {
        super(sourceId, "source not found: " + sourceId);
    }
}
