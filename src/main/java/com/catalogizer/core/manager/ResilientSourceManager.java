package com.catalogizer.core.manager;

import com.catalogizer.core.cache.OfflineCache;
import com.catalogizer.core.connection.ConnectionSupervisor;
import com.catalogizer.core.connection.DeadlineExecutor;
import com.catalogizer.core.connection.SourceConnector;
import com.catalogizer.core.connection.SupervisorContext;
import com.catalogizer.core.events.SourceEvent;
import com.catalogizer.core.events.SourceEventBus;
import com.catalogizer.core.health.HealthChecker;
import com.catalogizer.core.health.SourceHealth;
import com.catalogizer.core.lifecycle.TaskTracker;
import com.catalogizer.core.metrics.SourceMetrics;
import com.catalogizer.core.source.ConnectionState;
import com.catalogizer.core.source.DuplicateSourceException;
import com.catalogizer.core.source.Source;
import com.catalogizer.core.source.SourceDisabledException;
import com.catalogizer.core.source.SourceNotFoundException;
import com.catalogizer.core.source.SourceStatus;
import com.catalogizer.core.source.SourceUpdate;
import com.catalogizer.core.source.StatusSummary;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;

/**
 * Owns the registry of remote sources and keeps each one connected despite transient and
 * permanent outages.
 *
 * <p>Responsibilities:
 * <ul>
 *   <li>Registers sources and runs one {@link ConnectionSupervisor} per source</li>
 *   <li>Routes lifecycle and file-change events from the {@link SourceEventBus}</li>
 *   <li>Parks file changes in the {@link OfflineCache} while a source is unreachable and
 *       replays them on reconnect</li>
 *   <li>Runs the shared {@link HealthChecker} and one monitor task per source</li>
 *   <li>Coordinates shutdown: stop the health ticker, broadcast shutdown, join all tasks</li>
 * </ul>
 *
 * Connection failures are never thrown to callers; they surface as state, {@code lastError}
 * and events. Only usage errors ({@link SourceNotFoundException},
 * {@link SourceDisabledException}, {@link DuplicateSourceException}) are thrown.
 */
public class ResilientSourceManager {

    private static final Logger log = LoggerFactory.getLogger(ResilientSourceManager.class);

    private static final Duration INTERRUPT_GRACE = Duration.ofSeconds(5);

    private enum Lifecycle { NEW, RUNNING, STOPPED }

    private final ManagerOptions options;
    private final SourceMetrics metrics;
    private final Clock clock;
    private final TaskTracker tasks;
    private final DeadlineExecutor deadlines;
    private final SourceEventBus eventBus;
    private final OfflineCache offlineCache;
    private final HealthChecker healthChecker;
    private final SupervisorContext supervisorContext;
    private final Instant startTime;

    /** Guarded by {@link #registryLock}; held only for membership changes and snapshots. */
    private final Map<String, ConnectionSupervisor> registry = new HashMap<>();
    private final ReentrantReadWriteLock registryLock = new ReentrantReadWriteLock();

    private final Object lifecycleLock = new Object();
    private Lifecycle lifecycle = Lifecycle.NEW;

    public ResilientSourceManager(SourceConnector connector, ManagerOptions options) {
        this(connector, options, new SourceMetrics(new SimpleMeterRegistry()), Clock.systemUTC());
    }

    public ResilientSourceManager(SourceConnector connector, ManagerOptions options,
                                  SourceMetrics metrics, Clock clock) {
        this.options = options;
        this.metrics = metrics;
        this.clock = clock;
        this.tasks = new TaskTracker("source-worker");
        this.deadlines = new DeadlineExecutor();
        this.eventBus = new SourceEventBus(options.eventQueueCapacity(), tasks, metrics);
        this.offlineCache = new OfflineCache(options.cacheSize(), clock, metrics);
        this.healthChecker = new HealthChecker(this::enabledSupervisors, tasks,
                options.healthCheckInterval(), options.healthCheckTimeout());
        this.supervisorContext = new SupervisorContext(connector, deadlines, eventBus, tasks, metrics, clock);
        this.startTime = clock.instant();
    }

    // -- lifecycle ------------------------------------------------------------

    /**
     * Starts the health checker, the event dispatcher and one monitor per enabled source.
     * Calling it again while running has no effect.
     *
     * @throws IllegalStateException if the manager has been stopped
     */
    public void start() {
        synchronized (lifecycleLock) {
            if (lifecycle == Lifecycle.STOPPED) {
                throw new IllegalStateException("manager has been stopped and cannot be restarted");
            }
            if (lifecycle == Lifecycle.RUNNING) {
                return;
            }
            lifecycle = Lifecycle.RUNNING;
        }
        log.info("Starting resilient source manager");

        healthChecker.start();
        eventBus.start(this::handleEvent);
        for (ConnectionSupervisor supervisor : enabledSupervisors()) {
            supervisor.startMonitor(options.monitorProbeTimeout());
        }
    }

    /**
     * Stops the health ticker, broadcasts shutdown and waits for every tracked task to exit.
     * Tasks still running after the shutdown timeout are interrupted and joined for a short
     * grace period, so no tracked task is left once this returns.
     * Idempotent, and safe to call without a prior {@link #start()}.
     */
    public void stop() {
        synchronized (lifecycleLock) {
            if (lifecycle == Lifecycle.STOPPED) {
                return;
            }
            lifecycle = Lifecycle.STOPPED;
        }
        log.info("Stopping resilient source manager");

        healthChecker.stop();
        tasks.shutdown();
        if (!tasks.awaitIdle(options.shutdownTimeout())) {
            log.warn("{} tasks still running after {}ms, interrupting",
                    tasks.activeCount(), options.shutdownTimeout().toMillis());
        }
        tasks.close();
        deadlines.shutdown();
        if (!tasks.awaitIdle(INTERRUPT_GRACE)) {
            log.error("{} tasks ignored interruption and are still running", tasks.activeCount());
        }
        log.info("Resilient source manager stopped");
    }

    public boolean isRunning() {
        synchronized (lifecycleLock) {
            return lifecycle == Lifecycle.RUNNING;
        }
    }

    private boolean isStopped() {
        synchronized (lifecycleLock) {
            return lifecycle == Lifecycle.STOPPED;
        }
    }

    // -- registry -------------------------------------------------------------

    /**
     * Registers a source and triggers its first connection attempt asynchronously.
     * A blank id is replaced with a generated unique one; unset tunables get defaults.
     *
     * @return the id the source is registered under
     * @throws DuplicateSourceException if the id is already registered
     * @throws IllegalStateException if the manager has been stopped
     */
    public String addSource(Source source) {
        if (isStopped()) {
            throw new IllegalStateException("manager has been stopped");
        }
        String requested = source.getId();
        String id = requested == null || requested.isBlank() ? "smb_" + UUID.randomUUID() : requested;

        ConnectionSupervisor supervisor;
        registryLock.writeLock().lock();
        try {
            if (registry.containsKey(id)) {
                throw new DuplicateSourceException(id);
            }
            source.register(id, options.sourceDefaults());
            supervisor = new ConnectionSupervisor(source, supervisorContext);
            registry.put(id, supervisor);
        } finally {
            registryLock.writeLock().unlock();
        }

        metrics.registerSource(id, source::getState);
        SourceStatus status = source.snapshot();
        log.info("Source added: id={} name={} path={}", id, status.name(), status.path());

        if (!supervisor.requestConnect()) {
            log.warn("Source {} registered while the manager was stopping, no connection attempted", id);
        }
        if (isRunning()) {
            supervisor.startMonitor(options.monitorProbeTimeout());
        }
        return id;
    }

    /**
     * Disables and deregisters a source. Its running tasks notice the disabled flag and stop
     * scheduling further work.
     *
     * @throws SourceNotFoundException if the id is not registered
     */
    public void removeSource(String sourceId) {
        ConnectionSupervisor supervisor;
        registryLock.writeLock().lock();
        try {
            supervisor = registry.get(sourceId);
            if (supervisor == null) {
                throw new SourceNotFoundException(sourceId);
            }
            supervisor.retire();
            registry.remove(sourceId);
        } finally {
            registryLock.writeLock().unlock();
        }

        metrics.removeSource(sourceId);
        int purged = offlineCache.purge(sourceId);
        log.info("Source removed: id={} (purged {} cached changes)", sourceId, purged);
    }

    /**
     * Resets the retry budget and triggers an immediate connection attempt. This is the only
     * way out of {@link ConnectionState#OFFLINE}.
     *
     * @throws SourceNotFoundException if the id is not registered
     * @throws SourceDisabledException if the source is disabled
     */
    public void forceReconnect(String sourceId) {
        ConnectionSupervisor supervisor = require(sourceId);
        if (!supervisor.source().isEnabled()) {
            throw new SourceDisabledException(sourceId);
        }
        supervisor.forceReconnect();
    }

    /**
     * Applies a partial update to a registered source. Re-enabling a disabled source starts
     * a fresh connection attempt.
     *
     * @throws SourceNotFoundException if the id is not registered
     */
    public void updateSource(String sourceId, SourceUpdate update) {
        ConnectionSupervisor supervisor = require(sourceId);
        boolean wasEnabled = supervisor.source().isEnabled();
        supervisor.source().apply(update);
        log.info("Source updated: id={}", sourceId);

        if (!wasEnabled && Boolean.TRUE.equals(update.enabled())) {
            supervisor.forceReconnect();
            if (isRunning()) {
                supervisor.startMonitor(options.monitorProbeTimeout());
            }
        }
    }

    // -- status ---------------------------------------------------------------

    /**
     * Snapshot of every registered source keyed by id. Each entry is read under its own
     * source lock, so no entry is torn.
     */
    public Map<String, SourceStatus> getSourceStatus() {
        registryLock.readLock().lock();
        try {
            Map<String, SourceStatus> status = new LinkedHashMap<>();
            for (Map.Entry<String, ConnectionSupervisor> entry : registry.entrySet()) {
                status.put(entry.getKey(), entry.getValue().status());
            }
            return status;
        } finally {
            registryLock.readLock().unlock();
        }
    }

    public Optional<SourceStatus> getSource(String sourceId) {
        registryLock.readLock().lock();
        try {
            ConnectionSupervisor supervisor = registry.get(sourceId);
            return supervisor == null ? Optional.empty() : Optional.of(supervisor.status());
        } finally {
            registryLock.readLock().unlock();
        }
    }

    public StatusSummary getStatusSummary() {
        return StatusSummary.of(getSourceStatus().values());
    }

    public List<SourceHealth> checkHealth() {
        return healthChecker.checkAll();
    }

    public boolean isSourceConnected(String sourceId) {
        return getSource(sourceId)
                .map(status -> status.state() == ConnectionState.CONNECTED)
                .orElse(false);
    }

    public Instant getStartTime() {
        return startTime;
    }

    public Duration getUptime() {
        return Duration.between(startTime, clock.instant());
    }

    // -- events ---------------------------------------------------------------

    /**
     * Reports a change observed on a source. Processed right away when the source is
     * connected, otherwise parked in the offline cache until it reconnects.
     */
    public boolean notifyFileChange(String sourceId, String path) {
        return eventBus.publish(SourceEvent.fileChange(sourceId, path, clock.instant()));
    }

    public SourceEventBus.Subscription subscribe(String sourceId, Consumer<SourceEvent> consumer) {
        return eventBus.subscribe(sourceId, consumer);
    }

    public SourceEventBus.Subscription subscribeAll(Consumer<SourceEvent> consumer) {
        return eventBus.subscribeAll(consumer);
    }

    public OfflineCache getOfflineCache() {
        return offlineCache;
    }

    public SourceEventBus getEventBus() {
        return eventBus;
    }

    public HealthChecker getHealthChecker() {
        return healthChecker;
    }

    /** Number of tracked background tasks still running. */
    public int activeTaskCount() {
        return tasks.activeCount();
    }

    void handleEvent(SourceEvent event) {
        switch (event.type()) {
            case CONNECTED -> offlineCache.processCachedChanges(event.sourceId());
            case DISCONNECTED -> offlineCache.enableOfflineMode(event.sourceId());
            case OFFLINE -> log.warn("Source {} is now offline", event.sourceId());
            case FILE_CHANGE -> onFileChange(event.sourceId(), event.path());
            case ERROR -> log.error("Source {} error: {}", event.sourceId(), event.error());
            case RECONNECTING, HEALTH_CHECK -> {
                // no owner-side handling; subscribers still receive these
            }
        }
    }

    private void onFileChange(String sourceId, String path) {
        if (isSourceConnected(sourceId)) {
            log.info("Processing file change for source {}: {}", sourceId, path);
        } else {
            offlineCache.cacheChange(sourceId, path);
        }
    }

    private ConnectionSupervisor require(String sourceId) {
        registryLock.readLock().lock();
        try {
            ConnectionSupervisor supervisor = registry.get(sourceId);
            if (supervisor == null) {
                throw new SourceNotFoundException(sourceId);
            }
            return supervisor;
        } finally {
            registryLock.readLock().unlock();
        }
    }

    private List<ConnectionSupervisor> enabledSupervisors() {
        registryLock.readLock().lock();
        try {
            var enabled = new ArrayList<ConnectionSupervisor>();
            for (ConnectionSupervisor supervisor : registry.values()) {
                if (supervisor.source().isEnabled()) {
                    enabled.add(supervisor);
                }
            }
            return enabled;
        } finally {
            registryLock.readLock().unlock();
        }
    }
}
