package com.catalogizer.core.connection;

import com.catalogizer.core.events.SourceEvent;
import com.catalogizer.core.events.SourceEventType;
import com.catalogizer.core.logging.MdcContext;
import com.catalogizer.core.source.ConnectionState;
import com.catalogizer.core.source.Source;
import com.catalogizer.core.source.SourceStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Drives the connection state machine of a single source.
 *
 * <pre>
 * DISCONNECTED --attempt-----------------------&gt; RECONNECTING
 * RECONNECTING --success-----------------------&gt; CONNECTED
 * RECONNECTING --failure, attempts remain------&gt; DISCONNECTED (retry scheduled)
 * RECONNECTING --failure, attempts exhausted---&gt; OFFLINE
 * CONNECTED    --probe failure-----------------&gt; DISCONNECTED (immediate attempt)
 * OFFLINE      --force reconnect---------------&gt; RECONNECTING (attempts reset)
 * </pre>
 *
 * Retries back off linearly, {@code retryDelay * retryAttempts}, capped at
 * {@link #MAX_RETRY_DELAY}. Attempts for one source never overlap. Each attempt records the
 * retry generation it started under; a newer request (force reconnect, probe failure) bumps
 * the generation and so supersedes any retry still waiting out its delay.
 */
public class ConnectionSupervisor {

    private static final Logger log = LoggerFactory.getLogger(ConnectionSupervisor.class);

    public static final Duration MAX_RETRY_DELAY = Duration.ofMinutes(5);

    private static final long ANY_GENERATION = -1;

    private final Source source;
    private final String sourceId;
    private final SupervisorContext ctx;

    /** Serializes connect attempts; held across the connector call, never while reading status. */
    private final ReentrantLock attemptLock = new ReentrantLock();

    /** Bumped whenever pending retries should be abandoned. */
    private final AtomicLong retryGeneration = new AtomicLong();

    private final AtomicBoolean monitorStarted = new AtomicBoolean();
    private final AtomicBoolean retired = new AtomicBoolean();

    public ConnectionSupervisor(Source source, SupervisorContext ctx) {
        this.source = source;
        this.sourceId = source.getId();
        this.ctx = ctx;
    }

    /**
     * Linear backoff: {@code base * attempts}, never longer than five minutes.
     */
    public static Duration retryDelay(Duration base, int attempts) {
        if (attempts <= 0) {
            return Duration.ZERO;
        }
        // compare before multiplying so large bases cannot overflow
        if (base.compareTo(MAX_RETRY_DELAY.dividedBy(attempts)) > 0) {
            return MAX_RETRY_DELAY;
        }
        return base.multipliedBy(attempts);
    }

    /** Submits a connect attempt without waiting for it. */
    public boolean requestConnect() {
        return ctx.tasks().submit("connect-" + sourceId, this::attempt);
    }

    /**
     * Resets the retry budget and starts a fresh attempt, superseding any pending retry.
     * This is the only attempt allowed to leave {@link ConnectionState#OFFLINE}.
     */
    public boolean forceReconnect() {
        source.resetRetryAttempts();
        retryGeneration.incrementAndGet();
        log.info("Force reconnect initiated for source {}", sourceId);
        return ctx.tasks().submit("connect-" + sourceId, () -> runAttempt(true, ANY_GENERATION));
    }

    /**
     * Runs one connect attempt on the calling thread and applies its outcome. Only a
     * disconnected source is attempted.
     */
    public void attempt() {
        runAttempt(false, ANY_GENERATION);
    }

    /**
     * @param forced             whether the attempt may start from any state
     * @param expectedGeneration generation a retry was scheduled under, or {@link #ANY_GENERATION}
     */
    private void runAttempt(boolean forced, long expectedGeneration) {
        attemptLock.lock();
        MdcContext.setOperation(sourceId, "connect");
        try {
            if (ctx.tasks().isShutdown()) {
                return;
            }
            long generation = retryGeneration.get();
            if (expectedGeneration != ANY_GENERATION && expectedGeneration != generation) {
                log.debug("Retry for source {} superseded by a newer attempt", sourceId);
                return;
            }
            if (!source.beginAttempt(forced)) {
                log.debug("Skipping connect attempt for source {} in state {} (enabled={})",
                        sourceId, source.getState(), source.isEnabled());
                return;
            }
            ctx.metrics().recordTransition(ConnectionState.RECONNECTING);
            publish(SourceEvent.of(SourceEventType.RECONNECTING, sourceId, ctx.clock().instant()));

            try {
                ctx.deadlines().connect(ctx.connector(), source.endpoint(), source.getConnectionTimeout());
            } catch (ConnectorException e) {
                onConnectFailure(e, generation);
                return;
            }

            source.recordSuccess(ctx.clock().instant());
            ctx.metrics().recordConnectionAttempt("success");
            ctx.metrics().recordTransition(ConnectionState.CONNECTED);
            log.info("Successfully connected to source {} ({})", sourceId, source.endpoint().path());
            publish(SourceEvent.of(SourceEventType.CONNECTED, sourceId, ctx.clock().instant()));
        } finally {
            MdcContext.clear();
            attemptLock.unlock();
        }
    }

    private void onConnectFailure(ConnectorException e, long generation) {
        ConnectionState next = source.recordFailure(e.getMessage());
        int attempts = source.getRetryAttempts();
        ctx.metrics().recordConnectionAttempt(e.isTimeout() ? "timeout" : "failure");
        ctx.metrics().recordTransition(next);
        log.error("Failed to connect to source {} ({}): {} [retry_attempts={}]",
                sourceId, source.endpoint().path(), e.getMessage(), attempts);

        if (next == ConnectionState.OFFLINE) {
            log.warn("Source {} is offline after {} failed attempts; force reconnect required", sourceId, attempts);
            publish(SourceEvent.failure(SourceEventType.OFFLINE, sourceId, e.getMessage(), ctx.clock().instant())
                    .withData(Map.of("retryAttempts", attempts)));
            return;
        }

        publish(SourceEvent.failure(SourceEventType.DISCONNECTED, sourceId, e.getMessage(), ctx.clock().instant())
                .withData(Map.of("retryAttempts", attempts)));
        scheduleRetry(attempts, generation);
    }

    /**
     * @param generation generation of the attempt that failed; the retry is dropped if a
     *                   newer request has bumped it by the time the delay elapses
     */
    private void scheduleRetry(int attempts, long generation) {
        Duration delay = retryDelay(source.getRetryDelay(), attempts);
        log.info("Scheduling retry for source {} in {}ms (attempt {})", sourceId, delay.toMillis(), attempts + 1);

        ctx.tasks().submit("retry-" + sourceId, () -> {
            if (ctx.tasks().awaitShutdown(delay)) {
                return;
            }
            if (!source.isEnabled()) {
                log.debug("Source {} disabled during backoff, abandoning retry", sourceId);
                return;
            }
            runAttempt(false, generation);
        });
    }

    /**
     * Probes the source if it is connected. A failed probe demotes the source and starts an
     * immediate reconnect attempt.
     *
     * @return false if the probe ran and failed, true otherwise
     */
    public boolean probe(Duration timeout) {
        if (!source.isEnabled() || source.getState() != ConnectionState.CONNECTED) {
            return true;
        }
        MdcContext.setOperation(sourceId, "probe");
        try {
            ctx.deadlines().probe(ctx.connector(), source.endpoint(), timeout);
            ctx.metrics().recordHealthCheck(true);
            publish(SourceEvent.of(SourceEventType.HEALTH_CHECK, sourceId, ctx.clock().instant()));
            return true;
        } catch (ConnectorException e) {
            ctx.metrics().recordHealthCheck(false);
            publish(SourceEvent.failure(SourceEventType.HEALTH_CHECK, sourceId, e.getMessage(), ctx.clock().instant()));
            log.warn("Health check failed for source {}: {}", sourceId, e.getMessage());
            onProbeFailure(e);
            return false;
        } finally {
            MdcContext.clear();
        }
    }

    private void onProbeFailure(ConnectorException e) {
        if (!source.recordProbeFailure(e.getMessage())) {
            return;
        }
        ctx.metrics().recordTransition(ConnectionState.DISCONNECTED);
        publish(SourceEvent.failure(SourceEventType.DISCONNECTED, sourceId, e.getMessage(), ctx.clock().instant()));
        retryGeneration.incrementAndGet();
        requestConnect();
    }

    /**
     * Starts the source's own monitor loop, probing at the source's health-check interval
     * until shutdown or until the source is retired. Disabled sources are skipped, not
     * abandoned. Only the first call has an effect.
     */
    public boolean startMonitor(Duration probeTimeout) {
        if (!monitorStarted.compareAndSet(false, true)) {
            return false;
        }
        return ctx.tasks().submit("monitor-" + sourceId, () -> {
            while (!ctx.tasks().awaitShutdown(source.getHealthCheckInterval())) {
                if (retired.get()) {
                    log.debug("Monitor for source {} exiting, source removed", sourceId);
                    return;
                }
                probe(probeTimeout);
            }
        });
    }

    /**
     * Permanently disables the source after deregistration: pending retries are abandoned
     * and the monitor exits at its next wake-up.
     */
    public void retire() {
        retired.set(true);
        source.disable();
        retryGeneration.incrementAndGet();
    }

    public String sourceId() {
        return sourceId;
    }

    public Source source() {
        return source;
    }

    public SourceStatus status() {
        return source.snapshot();
    }

    private void publish(SourceEvent event) {
        ctx.eventBus().publish(event);
    }
}
