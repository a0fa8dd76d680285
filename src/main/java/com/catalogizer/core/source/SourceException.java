package com.catalogizer.core.source;

/**
 * Base type for errors raised by the source manager and its collaborators.
 */
public class SourceException extends RuntimeException {

    private final String sourceId;

    public SourceException(String sourceId, String message) {
        super(message);
        this.sourceId = sourceId;
    }

    public SourceException(String sourceId, String message, Throwable cause) {
        super(message, cause);
        this.sourceId = sourceId;
    }

    public String getSourceId() {
        return sourceId;
    }
}
