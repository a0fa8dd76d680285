package com.catalogizer.core.source;

/**
 * Lifecycle state of a source's connection.
 * <p>
 * {@link #OFFLINE} is terminal for automatic recovery: it is entered only after a source
 * exhausts its retry budget and is left only through an explicit force-reconnect.
 */
public enum ConnectionState {

    DISCONNECTED("disconnected", 0.0),
    RECONNECTING("reconnecting", 0.5),
    CONNECTED("connected", 1.0),
    OFFLINE("offline", 0.0);

    private final String wireName;
    private final double healthMetric;

    ConnectionState(String wireName, double healthMetric) {
        this.wireName = wireName;
        this.healthMetric = healthMetric;
    }

    /** Lowercase name used in status snapshots and log output. */
    public String wireName() {
        return wireName;
    }

    /**
     * Normalized health value for metrics collectors: 1.0 connected, 0.5 reconnecting,
     * 0.0 for disconnected and offline.
     */
    public double healthMetric() {
        return healthMetric;
    }

    @Override
    public String toString() {
        return wireName;
    }
}
