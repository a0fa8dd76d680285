package com.catalogizer.core.health;

import com.catalogizer.core.source.ConnectionState;
import com.catalogizer.core.source.SourceStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class SourceHealthTest {

    private static SourceStatus status(ConnectionState state, Instant lastConnected, String lastError, int attempts) {
        return new SourceStatus("nas", "NAS", "smb://nas/share", state, lastConnected, lastError, attempts, true);
    }

    @Test
    @DisplayName("a connected source is up and keeps its last connection time")
    void connected() {
        Instant connectedAt = Instant.parse("2026-02-01T08:00:00Z");

        SourceHealth health = SourceHealth.of(status(ConnectionState.CONNECTED, connectedAt, "", 0));

        assertEquals(SourceHealth.Level.UP, health.level());
        assertTrue(health.isUp());
        assertEquals("nas", health.sourceId());
        assertEquals(connectedAt, health.lastConnected());
        assertEquals("Connected to smb://nas/share", health.detail());
    }

    @Test
    @DisplayName("a reconnecting source is degraded")
    void reconnecting() {
        SourceHealth health = SourceHealth.of(status(ConnectionState.RECONNECTING, null, "", 1));

        assertEquals(SourceHealth.Level.DEGRADED, health.level());
        assertFalse(health.isUp());
        assertEquals(1, health.retryAttempts());
        assertNull(health.lastConnected());
    }

    @Test
    @DisplayName("an offline source is down and reports its last error")
    void offline() {
        SourceHealth health = SourceHealth.of(status(ConnectionState.OFFLINE, null, "refused", 5));

        assertEquals(SourceHealth.Level.DOWN, health.level());
        assertEquals(ConnectionState.OFFLINE, health.state());
        assertEquals(5, health.retryAttempts());
        assertEquals("offline: smb://nas/share (refused)", health.detail());
    }

    @Test
    @DisplayName("a disconnected source without an error is down with a plain detail")
    void disconnectedWithoutError() {
        SourceHealth health = SourceHealth.of(status(ConnectionState.DISCONNECTED, null, "", 0));

        assertEquals(SourceHealth.Level.DOWN, health.level());
        assertEquals("disconnected: smb://nas/share", health.detail());
    }
}
