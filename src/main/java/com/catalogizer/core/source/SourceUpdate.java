package com.catalogizer.core.source;

import java.time.Duration;

/**
 * Partial update for a registered source. Null fields are left unchanged.
 */
public record SourceUpdate(
    String name,
    String path,
    String username,
    String password,
    String domain,
    Integer maxRetryAttempts,
    Duration retryDelay,
    Duration connectionTimeout,
    Duration healthCheckInterval,
    Boolean enabled
) {

    public static SourceUpdate rename(String name) {
        return new SourceUpdate(name, null, null, null, null, null, null, null, null, null);
    }

    public static SourceUpdate enabled(boolean enabled) {
        return new SourceUpdate(null, null, null, null, null, null, null, null, null, enabled);
    }
}
