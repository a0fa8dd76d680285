package com.catalogizer.core.source;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * A configured remote endpoint together with its live connection state.
 * <p>
 * Identity and tunables are set by the caller before registration. Live state is
 * mutated only by the source's own supervisor and health probes, always behind this
 * source's lock, so unrelated sources never contend with each other.
 */
public class Source {

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private String id;
    private String name;
    private String path;
    private String username;
    private String password;
    private String domain;

    private int maxRetryAttempts;
    private Duration retryDelay;
    private Duration connectionTimeout;
    private Duration healthCheckInterval;

    private ConnectionState state = ConnectionState.DISCONNECTED;
    private Instant lastConnected;
    private String lastError = "";
    private int retryAttempts;
    private boolean enabled;

    public Source(String name, String path) {
        this(null, name, path);
    }

    public Source(String id, String name, String path) {
        this.id = id;
        this.name = name;
        this.path = path;
    }

    // -- registration ---------------------------------------------------------

    /**
     * Fills unset tunables from {@code defaults} and resets live state to a freshly
     * registered, enabled, disconnected source.
     */
    public void register(String assignedId, SourceDefaults defaults) {
        lock.writeLock().lock();
        try {
            this.id = assignedId;
            if (maxRetryAttempts <= 0) maxRetryAttempts = defaults.maxRetryAttempts();
            if (isUnset(retryDelay)) retryDelay = defaults.retryDelay();
            if (isUnset(connectionTimeout)) connectionTimeout = defaults.connectionTimeout();
            if (isUnset(healthCheckInterval)) healthCheckInterval = defaults.healthCheckInterval();
            state = ConnectionState.DISCONNECTED;
            retryAttempts = 0;
            lastError = "";
            enabled = true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void apply(SourceUpdate update) {
        lock.writeLock().lock();
        try {
            if (update.name() != null) name = update.name();
            if (update.path() != null) path = update.path();
            if (update.username() != null) username = update.username();
            if (update.password() != null) password = update.password();
            if (update.domain() != null) domain = update.domain();
            if (update.maxRetryAttempts() != null && update.maxRetryAttempts() > 0) {
                maxRetryAttempts = update.maxRetryAttempts();
                // a lowered limit must not leave a live source above its budget
                if (state != ConnectionState.OFFLINE && retryAttempts >= maxRetryAttempts) {
                    retryAttempts = maxRetryAttempts - 1;
                }
            }
            if (!isUnset(update.retryDelay())) retryDelay = update.retryDelay();
            if (!isUnset(update.connectionTimeout())) connectionTimeout = update.connectionTimeout();
            if (!isUnset(update.healthCheckInterval())) healthCheckInterval = update.healthCheckInterval();
            if (update.enabled() != null) enabled = update.enabled();
        } finally {
            lock.writeLock().unlock();
        }
    }

    // -- state transitions ----------------------------------------------------

    /**
     * Moves the source to {@link ConnectionState#RECONNECTING} for a new attempt. An unforced
     * attempt only starts from {@link ConnectionState#DISCONNECTED}; a forced one starts from
     * any state.
     *
     * @return false if the source is disabled or not in a state the attempt may start from
     */
    public boolean beginAttempt(boolean forced) {
        lock.writeLock().lock();
        try {
            if (!enabled || (!forced && state != ConnectionState.DISCONNECTED)) {
                return false;
            }
            state = ConnectionState.RECONNECTING;
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void recordSuccess(Instant connectedAt) {
        lock.writeLock().lock();
        try {
            state = ConnectionState.CONNECTED;
            lastConnected = connectedAt;
            lastError = "";
            retryAttempts = 0;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Records a failed connect attempt and counts it against the retry budget.
     *
     * @return {@link ConnectionState#OFFLINE} once the budget is spent, otherwise
     *         {@link ConnectionState#DISCONNECTED}
     */
    public ConnectionState recordFailure(String error) {
        lock.writeLock().lock();
        try {
            lastError = error;
            retryAttempts++;
            state = retryAttempts >= maxRetryAttempts ? ConnectionState.OFFLINE : ConnectionState.DISCONNECTED;
            return state;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Demotes a connected source after a failed health probe.
     *
     * @return false if the source was no longer connected, in which case nothing changes
     */
    public boolean recordProbeFailure(String error) {
        lock.writeLock().lock();
        try {
            if (state != ConnectionState.CONNECTED) {
                return false;
            }
            state = ConnectionState.DISCONNECTED;
            lastError = error;
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void resetRetryAttempts() {
        lock.writeLock().lock();
        try {
            retryAttempts = 0;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void disable() {
        lock.writeLock().lock();
        try {
            enabled = false;
        } finally {
            lock.writeLock().unlock();
        }
    }

    // -- reads ----------------------------------------------------------------

    public SourceStatus snapshot() {
        lock.readLock().lock();
        try {
            return new SourceStatus(id, name, path, state, lastConnected, lastError, retryAttempts, enabled);
        } finally {
            lock.readLock().unlock();
        }
    }

    public SourceEndpoint endpoint() {
        lock.readLock().lock();
        try {
            return new SourceEndpoint(id, path, username, password, domain);
        } finally {
            lock.readLock().unlock();
        }
    }

    public String getId() {
        lock.readLock().lock();
        try {
            return id;
        } finally {
            lock.readLock().unlock();
        }
    }

    public ConnectionState getState() {
        lock.readLock().lock();
        try {
            return state;
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean isEnabled() {
        lock.readLock().lock();
        try {
            return enabled;
        } finally {
            lock.readLock().unlock();
        }
    }

    public int getRetryAttempts() {
        lock.readLock().lock();
        try {
            return retryAttempts;
        } finally {
            lock.readLock().unlock();
        }
    }

    public int getMaxRetryAttempts() {
        lock.readLock().lock();
        try {
            return maxRetryAttempts;
        } finally {
            lock.readLock().unlock();
        }
    }

    public Duration getRetryDelay() {
        lock.readLock().lock();
        try {
            return retryDelay;
        } finally {
            lock.readLock().unlock();
        }
    }

    public Duration getConnectionTimeout() {
        lock.readLock().lock();
        try {
            return connectionTimeout;
        } finally {
            lock.readLock().unlock();
        }
    }

    public Duration getHealthCheckInterval() {
        lock.readLock().lock();
        try {
            return healthCheckInterval;
        } finally {
            lock.readLock().unlock();
        }
    }

    // -- pre-registration configuration ---------------------------------------

    public void setCredentials(String username, String password, String domain) {
        lock.writeLock().lock();
        try {
            this.username = username;
            this.password = password;
            this.domain = domain;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void setMaxRetryAttempts(int maxRetryAttempts) {
        lock.writeLock().lock();
        try {
            this.maxRetryAttempts = maxRetryAttempts;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void setRetryDelay(Duration retryDelay) {
        lock.writeLock().lock();
        try {
            this.retryDelay = retryDelay;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void setConnectionTimeout(Duration connectionTimeout) {
        lock.writeLock().lock();
        try {
            this.connectionTimeout = connectionTimeout;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void setHealthCheckInterval(Duration healthCheckInterval) {
        lock.writeLock().lock();
        try {
            this.healthCheckInterval = healthCheckInterval;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private static boolean isUnset(Duration duration) {
        return duration == null || duration.isZero() || duration.isNegative();
    }
}
