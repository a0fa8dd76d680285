package com.catalogizer.core.health;

import com.catalogizer.core.source.ConnectionState;
import com.catalogizer.core.source.SourceStatus;

import java.time.Instant;

/**
 * Health verdict for one source, derived from its last known connection state.
 *
 * @param lastConnected null when the source has never connected
 */
public record SourceHealth(
    String sourceId,
    Level level,
    String detail,
    ConnectionState state,
    int retryAttempts,
    Instant lastConnected
) {

    /** CONNECTED is UP, RECONNECTING is DEGRADED, anything else DOWN. */
    public enum Level { UP, DEGRADED, DOWN }

    public static SourceHealth of(SourceStatus status) {
        Level level = switch (status.state()) {
            case CONNECTED -> Level.UP;
            case RECONNECTING -> Level.DEGRADED;
            case DISCONNECTED, OFFLINE -> Level.DOWN;
        };
        return new SourceHealth(status.id(), level, describe(status, level), status.state(),
                status.retryAttempts(), status.lastConnected());
    }

    public boolean isUp() {
        return level == Level.UP;
    }

    private static String describe(SourceStatus status, Level level) {
        return switch (level) {
            case UP -> "Connected to " + status.path();
            case DEGRADED -> "Reconnecting to " + status.path();
            case DOWN -> status.lastError() == null || status.lastError().isEmpty()
                    ? status.state().wireName() + ": " + status.path()
                    : status.state().wireName() + ": " + status.path() + " (" + status.lastError() + ")";
        };
    }
}
