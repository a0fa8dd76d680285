package com.catalogizer.core.source;

/**
 * Immutable view of the addressing and credential fields a connector needs.
 */
public record SourceEndpoint(
    String sourceId,
    String path,
    String username,
    String password,
    String domain
) {

    @Override
    public String toString() {
        // keep credentials out of log lines
        return "SourceEndpoint[" + sourceId + " " + path + "]";
    }
}
