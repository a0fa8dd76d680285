package com.catalogizer.core.source;

/**
 * Thrown when a source is registered under an id that is already in use.
 */
public class DuplicateSourceException extends SourceException {
    public DuplicateSourceException(String sourceId) {
        super(sourceId, "source already registered: " + sourceId);
    }
}
