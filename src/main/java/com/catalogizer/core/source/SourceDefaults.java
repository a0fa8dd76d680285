package com.catalogizer.core.source;

import java.time.Duration;

/**
 * Tunables applied to a source whose own value is unset (zero or null) at registration.
 *
 * @param maxRetryAttempts    failed attempts allowed before the source goes offline
 * @param retryDelay          base delay, multiplied by the attempt number for each retry
 * @param connectionTimeout   deadline for a single connect attempt
 * @param healthCheckInterval period of the source's own monitor probe
 */
public record SourceDefaults(
    int maxRetryAttempts,
    Duration retryDelay,
    Duration connectionTimeout,
    Duration healthCheckInterval
) {

    public static SourceDefaults standard() {
        return new SourceDefaults(5, Duration.ofSeconds(30), Duration.ofSeconds(30), Duration.ofSeconds(60));
    }
}
