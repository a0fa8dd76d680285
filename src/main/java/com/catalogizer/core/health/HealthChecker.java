package com.catalogizer.core.health;

import com.catalogizer.core.connection.ConnectionSupervisor;
import com.catalogizer.core.lifecycle.TaskTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Periodically re-probes every enabled source on one shared interval fixed at construction.
 * <p>
 * Each tick snapshots the enabled sources and dispatches one probe per source as its own
 * tracked task, so a slow endpoint never delays the others. Probes only touch sources that
 * are currently connected; a failure feeds the source back into its reconnect path.
 */
public class HealthChecker {

    private static final Logger log = LoggerFactory.getLogger(HealthChecker.class);

    private final Supplier<Collection<ConnectionSupervisor>> enabledSources;
    private final TaskTracker tasks;
    private final Duration interval;
    private final Duration probeTimeout;

    private final Object lifecycleLock = new Object();
    private ScheduledExecutorService ticker;
    private boolean stopped;

    public HealthChecker(Supplier<Collection<ConnectionSupervisor>> enabledSources, TaskTracker tasks,
                         Duration interval, Duration probeTimeout) {
        this.enabledSources = enabledSources;
        this.tasks = tasks;
        this.interval = interval;
        this.probeTimeout = probeTimeout;
    }

    /** Starts the ticker. Has no effect if already started or stopped. */
    public void start() {
        synchronized (lifecycleLock) {
            if (ticker != null || stopped) {
                return;
            }
            ticker = Executors.newSingleThreadScheduledExecutor(TaskTracker.namedDaemonThreads("health-checker"));
            ticker.scheduleAtFixedRate(this::performHealthChecks,
                    interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
        }
        log.info("Health checker started (interval={}ms, timeout={}ms)", interval.toMillis(), probeTimeout.toMillis());
    }

    /** Stops the ticker; no tick starts afterwards. Safe without a prior start. */
    public void stop() {
        ScheduledExecutorService toStop;
        synchronized (lifecycleLock) {
            if (stopped) {
                return;
            }
            stopped = true;
            toStop = ticker;
        }
        if (toStop != null) {
            toStop.shutdownNow();
            log.info("Health checker stopped");
        }
    }

    public boolean isRunning() {
        synchronized (lifecycleLock) {
            return ticker != null && !stopped;
        }
    }

    /**
     * Dispatches one probe per enabled source.
     *
     * @return number of probes dispatched
     */
    public int performHealthChecks() {
        int dispatched = 0;
        for (ConnectionSupervisor supervisor : enabledSources.get()) {
            if (tasks.submit("probe-" + supervisor.sourceId(), () -> supervisor.probe(probeTimeout))) {
                dispatched++;
            }
        }
        log.debug("Dispatched {} health probes", dispatched);
        return dispatched;
    }

    /** Reports the health of each enabled source without probing it. */
    public List<SourceHealth> checkAll() {
        var results = new ArrayList<SourceHealth>();
        for (ConnectionSupervisor supervisor : enabledSources.get()) {
            results.add(SourceHealth.of(supervisor.status()));
        }
        return results;
    }
}
