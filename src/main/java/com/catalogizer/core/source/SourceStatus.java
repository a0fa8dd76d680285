package com.catalogizer.core.source;

import java.time.Instant;

/**
 * Point-in-time snapshot of one source, safe to hand to API or dashboard layers.
 *
 * @param lastConnected null when the source has never connected
 * @param lastError     empty when the last attempt succeeded
 */
public record SourceStatus(
    String id,
    String name,
    String path,
    ConnectionState state,
    Instant lastConnected,
    String lastError,
    int retryAttempts,
    boolean enabled
) {}
