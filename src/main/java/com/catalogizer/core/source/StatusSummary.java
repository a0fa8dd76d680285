package com.catalogizer.core.source;

import java.util.Collection;

/**
 * Aggregate view over all source snapshots.
 * <p>
 * The fleet counts as healthy when no source is offline and fewer than half are
 * disconnected. An empty fleet is healthy.
 */
public record StatusSummary(
    int total,
    int connected,
    int disconnected,
    int reconnecting,
    int offline,
    boolean healthy
) {

    public static StatusSummary of(Collection<SourceStatus> statuses) {
        int connected = 0;
        int disconnected = 0;
        int reconnecting = 0;
        int offline = 0;
        for (SourceStatus status : statuses) {
            switch (status.state()) {
                case CONNECTED -> connected++;
                case DISCONNECTED -> disconnected++;
                case RECONNECTING -> reconnecting++;
                case OFFLINE -> offline++;
            }
        }
        int total = statuses.size();
        boolean healthy = total == 0 || (offline == 0 && disconnected * 2 < total);
        return new StatusSummary(total, connected, disconnected, reconnecting, offline, healthy);
    }
}
