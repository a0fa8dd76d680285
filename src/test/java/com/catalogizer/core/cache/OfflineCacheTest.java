package com.catalogizer.core.cache;

import com.catalogizer.core.metrics.SourceMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class OfflineCacheTest {

    private TickingClock clock;
    private SimpleMeterRegistry registry;
    private SourceMetrics metrics;

    @BeforeEach
    void setUp() {
        clock = new TickingClock(Instant.parse("2026-03-01T10:00:00Z"));
        registry = new SimpleMeterRegistry();
        metrics = new SourceMetrics(registry);
    }

    @Test
    @DisplayName("rejects a non-positive size")
    void rejectsNonPositiveSize() {
        assertThrows(IllegalArgumentException.class, () -> new OfflineCache(0, clock, metrics));
    }

    @Nested
    @DisplayName("cacheChange")
    class CacheChangeTests {

        @Test
        @DisplayName("stores a pending change keyed by source and path")
        void storesPendingChange() {
            var cache = new OfflineCache(10, clock, metrics);

            cache.cacheChange("nas", "/docs/a.txt", Map.of("size", 42L));

            CacheEntry entry = cache.get("nas", "/docs/a.txt").orElseThrow();
            assertEquals("nas", entry.sourceId());
            assertEquals("/docs/a.txt", entry.path());
            assertEquals(42L, entry.metadata().get("size"));
            assertEquals(clock.instant(), entry.lastSeen());
            assertFalse(entry.available());
        }

        @Test
        @DisplayName("same path on different sources are separate entries")
        void separatesSources() {
            var cache = new OfflineCache(10, clock, metrics);

            cache.cacheChange("nas", "/a");
            cache.cacheChange("backup", "/a");

            assertEquals(2, cache.size());
        }

        @Test
        @DisplayName("re-caching a path replaces it without evicting")
        void replacesExistingKey() {
            var cache = new OfflineCache(2, clock, metrics);
            cache.cacheChange("nas", "/a");
            cache.cacheChange("nas", "/b");
            clock.advance(Duration.ofSeconds(1));

            cache.cacheChange("nas", "/a");

            assertEquals(2, cache.size());
            assertEquals(clock.instant(), cache.get("nas", "/a").orElseThrow().lastSeen());
            assertTrue(cache.get("nas", "/b").isPresent());
            assertNull(registry.find("catalogizer.cache.evictions").counter());
        }

        @Test
        @DisplayName("evicts the oldest entry when full")
        void evictsOldest() {
            var cache = new OfflineCache(2, clock, metrics);
            cache.cacheChange("s", "/first");
            clock.advance(Duration.ofMillis(10));
            cache.cacheChange("s", "/second");
            clock.advance(Duration.ofMillis(10));

            cache.cacheChange("s", "/third");

            assertEquals(2, cache.size());
            assertTrue(cache.get("s", "/first").isEmpty());
            assertTrue(cache.get("s", "/second").isPresent());
            assertTrue(cache.get("s", "/third").isPresent());
            assertEquals(1.0, registry.find("catalogizer.cache.evictions").counter().count());
        }

        @Test
        @DisplayName("never grows past its bound")
        void staysBounded() {
            var cache = new OfflineCache(5, clock, metrics);
            for (int i = 0; i < 50; i++) {
                clock.advance(Duration.ofMillis(1));
                cache.cacheChange("s", "/f" + i);
                assertTrue(cache.size() <= 5);
            }
            assertEquals(5, cache.size());
            assertTrue(cache.get("s", "/f49").isPresent());
            assertTrue(cache.get("s", "/f44").isEmpty());
        }
    }

    @Nested
    @DisplayName("processCachedChanges")
    class ProcessTests {

        @Test
        @DisplayName("marks only the given source's entries available")
        void marksOnlyOwnEntries() {
            var cache = new OfflineCache(10, clock, metrics);
            cache.cacheChange("nas", "/a");
            cache.cacheChange("nas", "/b");
            cache.cacheChange("backup", "/c");

            assertEquals(2, cache.processCachedChanges("nas"));

            assertTrue(cache.get("nas", "/a").orElseThrow().available());
            assertTrue(cache.get("nas", "/b").orElseThrow().available());
            assertFalse(cache.get("backup", "/c").orElseThrow().available());
            assertEquals(0, cache.pendingCount("nas"));
            assertEquals(1, cache.pendingCount("backup"));
        }

        @Test
        @DisplayName("processing twice finds nothing new")
        void idempotent() {
            var cache = new OfflineCache(10, clock, metrics);
            cache.cacheChange("nas", "/a");

            assertEquals(1, cache.processCachedChanges("nas"));
            assertEquals(0, cache.processCachedChanges("nas"));
            assertEquals(1, cache.size());
        }

        @Test
        @DisplayName("a new change after replay is pending again")
        void recachedAfterReplay() {
            var cache = new OfflineCache(10, clock, metrics);
            cache.cacheChange("nas", "/a");
            cache.processCachedChanges("nas");

            cache.cacheChange("nas", "/a");

            assertFalse(cache.get("nas", "/a").orElseThrow().available());
            assertEquals(1, cache.pendingCount("nas"));
        }
    }

    @Test
    @DisplayName("purge removes every entry of a source")
    void purge() {
        var cache = new OfflineCache(10, clock, metrics);
        cache.cacheChange("nas", "/a");
        cache.cacheChange("nas", "/b");
        cache.cacheChange("backup", "/c");

        assertEquals(2, cache.purge("nas"));

        assertTrue(cache.entries("nas").isEmpty());
        assertEquals(1, cache.entries("backup").size());
    }

    /** Clock that only moves when told to. */
    static final class TickingClock extends Clock {

        private Instant now;

        TickingClock(Instant start) {
            this.now = start;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
