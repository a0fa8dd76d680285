package com.catalogizer.core.manager;

import com.catalogizer.core.source.SourceDefaults;

import java.time.Duration;

/**
 * Construction-time settings for {@link ResilientSourceManager}.
 *
 * @param eventQueueCapacity  bound of the event channel
 * @param cacheSize           maximum offline cache entries
 * @param healthCheckInterval tick of the shared health checker
 * @param healthCheckTimeout  deadline for each probe dispatched by the shared checker
 * @param monitorProbeTimeout deadline for each probe of a per-source monitor
 * @param shutdownTimeout     how long {@code stop()} waits for tracked tasks
 * @param sourceDefaults      tunables for sources that leave them unset
 */
public record ManagerOptions(
    int eventQueueCapacity,
    int cacheSize,
    Duration healthCheckInterval,
    Duration healthCheckTimeout,
    Duration monitorProbeTimeout,
    Duration shutdownTimeout,
    SourceDefaults sourceDefaults
) {

    public static ManagerOptions defaults() {
        return new ManagerOptions(1000, 1000,
                Duration.ofSeconds(60), Duration.ofSeconds(30), Duration.ofSeconds(10),
                Duration.ofSeconds(60), SourceDefaults.standard());
    }
}
