package com.catalogizer.core.source;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class SourceTest {

    private static final SourceDefaults DEFAULTS = SourceDefaults.standard();

    private Source source;

    @BeforeEach
    void setUp() {
        source = new Source("Media NAS", "smb://nas.local/media");
    }

    @Nested
    @DisplayName("register")
    class RegisterTests {

        @Test
        @DisplayName("fills unset tunables from defaults")
        void fillsDefaults() {
            source.register("nas", DEFAULTS);

            assertEquals("nas", source.getId());
            assertEquals(5, source.getMaxRetryAttempts());
            assertEquals(Duration.ofSeconds(30), source.getRetryDelay());
            assertEquals(Duration.ofSeconds(30), source.getConnectionTimeout());
            assertEquals(Duration.ofSeconds(60), source.getHealthCheckInterval());
        }

        @Test
        @DisplayName("keeps tunables the caller set")
        void keepsExplicitTunables() {
            source.setMaxRetryAttempts(2);
            source.setRetryDelay(Duration.ofMillis(50));
            source.setConnectionTimeout(Duration.ofSeconds(3));
            source.setHealthCheckInterval(Duration.ofSeconds(5));

            source.register("nas", DEFAULTS);

            assertEquals(2, source.getMaxRetryAttempts());
            assertEquals(Duration.ofMillis(50), source.getRetryDelay());
            assertEquals(Duration.ofSeconds(3), source.getConnectionTimeout());
            assertEquals(Duration.ofSeconds(5), source.getHealthCheckInterval());
        }

        @Test
        @DisplayName("resets live state to enabled and disconnected")
        void resetsLiveState() {
            source.register("nas", DEFAULTS);

            SourceStatus status = source.snapshot();
            assertEquals(ConnectionState.DISCONNECTED, status.state());
            assertEquals(0, status.retryAttempts());
            assertEquals("", status.lastError());
            assertTrue(status.enabled());
            assertNull(status.lastConnected());
        }
    }

    @Nested
    @DisplayName("state transitions")
    class TransitionTests {

        @BeforeEach
        void register() {
            source.setMaxRetryAttempts(3);
            source.register("nas", DEFAULTS);
        }

        @Test
        @DisplayName("beginAttempt moves a disconnected source to reconnecting")
        void beginAttempt() {
            assertTrue(source.beginAttempt(false));
            assertEquals(ConnectionState.RECONNECTING, source.getState());
        }

        @Test
        @DisplayName("beginAttempt refuses a disabled source even when forced")
        void beginAttemptDisabled() {
            source.disable();
            assertFalse(source.beginAttempt(false));
            assertFalse(source.beginAttempt(true));
            assertEquals(ConnectionState.DISCONNECTED, source.getState());
        }

        @Test
        @DisplayName("only a forced attempt leaves offline")
        void beginAttemptOffline() {
            source.recordFailure("e1");
            source.recordFailure("e2");
            source.recordFailure("e3");

            assertFalse(source.beginAttempt(false));
            assertEquals(ConnectionState.OFFLINE, source.getState());

            assertTrue(source.beginAttempt(true));
            assertEquals(ConnectionState.RECONNECTING, source.getState());
        }

        @Test
        @DisplayName("an unforced attempt leaves a connected source alone")
        void beginAttemptConnected() {
            source.recordSuccess(Instant.now());

            assertFalse(source.beginAttempt(false));
            assertEquals(ConnectionState.CONNECTED, source.getState());
        }

        @Test
        @DisplayName("success clears error and attempts")
        void success() {
            source.recordFailure("refused");
            Instant now = Instant.parse("2026-01-01T00:00:00Z");

            source.recordSuccess(now);

            SourceStatus status = source.snapshot();
            assertEquals(ConnectionState.CONNECTED, status.state());
            assertEquals(now, status.lastConnected());
            assertEquals("", status.lastError());
            assertEquals(0, status.retryAttempts());
        }

        @Test
        @DisplayName("failures count up until the budget is spent")
        void failuresGoOffline() {
            assertEquals(ConnectionState.DISCONNECTED, source.recordFailure("e1"));
            assertEquals(ConnectionState.DISCONNECTED, source.recordFailure("e2"));
            assertEquals(ConnectionState.OFFLINE, source.recordFailure("e3"));

            SourceStatus status = source.snapshot();
            assertEquals(3, status.retryAttempts());
            assertEquals("e3", status.lastError());
        }

        @Test
        @DisplayName("probe failure only demotes a connected source")
        void probeFailure() {
            assertFalse(source.recordProbeFailure("timeout"));
            assertEquals(ConnectionState.DISCONNECTED, source.getState());

            source.recordSuccess(Instant.now());
            assertTrue(source.recordProbeFailure("timeout"));
            assertEquals(ConnectionState.DISCONNECTED, source.getState());
            assertEquals("timeout", source.snapshot().lastError());
            assertEquals(0, source.getRetryAttempts());
        }

        @Test
        @DisplayName("probe failure leaves an offline source offline")
        void probeFailureOffline() {
            source.recordFailure("e1");
            source.recordFailure("e2");
            source.recordFailure("e3");

            assertFalse(source.recordProbeFailure("timeout"));
            assertEquals(ConnectionState.OFFLINE, source.getState());
        }
    }

    @Nested
    @DisplayName("apply")
    class ApplyTests {

        @BeforeEach
        void register() {
            source.register("nas", DEFAULTS);
        }

        @Test
        @DisplayName("null fields leave values unchanged")
        void partialUpdate() {
            source.apply(SourceUpdate.rename("Archive NAS"));

            SourceStatus status = source.snapshot();
            assertEquals("Archive NAS", status.name());
            assertEquals("smb://nas.local/media", status.path());
            assertEquals(5, source.getMaxRetryAttempts());
        }

        @Test
        @DisplayName("lowering the retry limit keeps a live source inside its budget")
        void lowerRetryLimit() {
            source.recordFailure("e1");
            source.recordFailure("e2");
            source.recordFailure("e3");

            source.apply(new SourceUpdate(null, null, null, null, null, 2, null, null, null, null));

            assertEquals(2, source.getMaxRetryAttempts());
            assertEquals(1, source.getRetryAttempts());
        }

        @Test
        @DisplayName("enabled flag can be toggled")
        void toggleEnabled() {
            source.apply(SourceUpdate.enabled(false));
            assertFalse(source.isEnabled());
            source.apply(SourceUpdate.enabled(true));
            assertTrue(source.isEnabled());
        }
    }

    @Test
    @DisplayName("endpoint carries credentials but does not print them")
    void endpointHidesCredentials() {
        source.setCredentials("catalog", "s3cret", "WORKGROUP");
        source.register("nas", DEFAULTS);

        SourceEndpoint endpoint = source.endpoint();
        assertEquals("catalog", endpoint.username());
        assertEquals("s3cret", endpoint.password());
        assertFalse(endpoint.toString().contains("s3cret"));
    }
}
