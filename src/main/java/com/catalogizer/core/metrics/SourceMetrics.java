package com.catalogizer.core.metrics;

import com.catalogizer.core.source.ConnectionState;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Centralised Micrometer metrics for source connectivity.
 */
public class SourceMetrics {

    private final MeterRegistry registry;

    /** Health gauges keyed by source id, removed when the source is deregistered. */
    private final Map<String, Meter.Id> healthGauges = new ConcurrentHashMap<>();

    public SourceMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Registers the normalized health gauge for a source (1.0 connected, 0.5 reconnecting,
     * 0.0 otherwise).
     *
     * @param sourceId the source to tag the gauge with
     * @param state    live view of the source's state
     */
    public void registerSource(String sourceId, Supplier<ConnectionState> state) {
        Gauge gauge = Gauge.builder("catalogizer.source.health", state, s -> s.get().healthMetric())
                .description("Normalized source health: 1 connected, 0.5 reconnecting, 0 down")
                .tag("source", sourceId)
                .strongReference(true)
                .register(registry);
        healthGauges.put(sourceId, gauge.getId());
    }

    public void removeSource(String sourceId) {
        Meter.Id id = healthGauges.remove(sourceId);
        if (id != null) {
            registry.remove(id);
        }
    }

    /**
     * @param result "success", "failure" or "timeout"
     */
    public void recordConnectionAttempt(String result) {
        Counter.builder("catalogizer.source.connection.attempts")
                .tag("result", result)
                .register(registry)
                .increment();
    }

    public void recordHealthCheck(boolean healthy) {
        Counter.builder("catalogizer.source.health_checks")
                .tag("result", healthy ? "healthy" : "unhealthy")
                .register(registry)
                .increment();
    }

    public void recordTransition(ConnectionState state) {
        Counter.builder("catalogizer.source.transitions")
                .tag("state", state.wireName())
                .register(registry)
                .increment();
    }

    // --- Event bus and cache pressure ---

    /**
     * Records an event lost to backpressure.
     *
     * @param reason "oldest" when a queued event was drained to make room, "newest" when the
     *               incoming event itself was discarded
     */
    public void recordDroppedEvent(String reason) {
        Counter.builder("catalogizer.events.dropped")
                .description("Events discarded because the event queue was full")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordCacheEviction() {
        Counter.builder("catalogizer.cache.evictions")
                .description("Offline cache entries evicted at capacity")
                .register(registry)
                .increment();
    }
}
