package com.catalogizer.smb;

import com.catalogizer.core.manager.ResilientSourceManager;
import com.catalogizer.core.source.SourceStatus;
import com.catalogizer.core.source.StatusSummary;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Actuator health indicator for registered sources.
 * Reports from the latest known state; it never probes an endpoint itself.
 */
@Component
public class SourcesHealthIndicator implements HealthIndicator {

    private final ResilientSourceManager manager;

    public SourcesHealthIndicator(ResilientSourceManager manager) {
        this.manager = manager;
    }

    @Override
    public Health health() {
        var statuses = manager.getSourceStatus();
        StatusSummary summary = StatusSummary.of(statuses.values());

        Health.Builder builder;
        if (!summary.healthy()) {
            builder = Health.down();
        } else if (summary.connected() < summary.total()) {
            builder = Health.up().status("DEGRADED");
        } else {
            builder = Health.up();
        }

        builder.withDetail("total", summary.total())
                .withDetail("connected", summary.connected())
                .withDetail("disconnected", summary.disconnected())
                .withDetail("reconnecting", summary.reconnecting())
                .withDetail("offline", summary.offline())
                .withDetail("uptime", manager.getUptime().toString());

        for (SourceStatus status : statuses.values()) {
            String detail = status.state().wireName();
            if (status.lastError() != null && !status.lastError().isEmpty()) {
                detail += ": " + status.lastError();
            }
            builder.withDetail(status.id(), detail);
        }
        return builder.build();
    }
}
