package com.catalogizer.core.cache;

import com.catalogizer.core.metrics.SourceMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded store of file changes observed while a source is unreachable.
 * <p>
 * Entries are keyed by {@code sourceId:path}. At capacity, inserting a new key evicts the
 * single entry with the oldest {@code lastSeen}. The linear eviction scan is fine for the
 * modest, bounded sizes this cache is configured with. All operations share one lock that
 * is independent of any source or registry lock.
 */
public class OfflineCache {

    private static final Logger log = LoggerFactory.getLogger(OfflineCache.class);

    private final Map<String, CacheEntry> entries = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final int maxSize;
    private final Clock clock;
    private final SourceMetrics metrics;

    public OfflineCache(int maxSize, Clock clock, SourceMetrics metrics) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive: " + maxSize);
        }
        this.maxSize = maxSize;
        this.clock = clock;
        this.metrics = metrics;
    }

    public void cacheChange(String sourceId, String path) {
        cacheChange(sourceId, path, Map.of());
    }

    /**
     * Records a pending change, replacing any earlier change for the same path.
     */
    public void cacheChange(String sourceId, String path, Map<String, Object> metadata) {
        String key = CacheEntry.key(sourceId, path);
        lock.lock();
        try {
            if (!entries.containsKey(key) && entries.size() >= maxSize) {
                evictOldest();
            }
            entries.put(key, new CacheEntry(sourceId, path, Map.copyOf(metadata), clock.instant(), false));
        } finally {
            lock.unlock();
        }
        log.debug("Cached file change for source {}: {}", sourceId, path);
    }

    /**
     * Marks every pending change of a source as available. Calling it again processes nothing new.
     *
     * @return number of entries that flipped to available
     */
    public int processCachedChanges(String sourceId) {
        int processed = 0;
        lock.lock();
        try {
            for (Map.Entry<String, CacheEntry> e : entries.entrySet()) {
                CacheEntry entry = e.getValue();
                if (entry.sourceId().equals(sourceId) && !entry.available()) {
                    log.debug("Processing cached change for source {}: {}", sourceId, entry.path());
                    e.setValue(entry.markAvailable());
                    processed++;
                }
            }
        } finally {
            lock.unlock();
        }
        log.info("Processed {} cached changes for source {}", processed, sourceId);
        return processed;
    }

    /** Observability hook only: marks the start of offline operation for a source in the log. */
    public void enableOfflineMode(String sourceId) {
        log.info("Enabling offline mode for source {}", sourceId);
    }

    /**
     * Drops every entry of a source, used when the source is deregistered.
     *
     * @return number of entries removed
     */
    public int purge(String sourceId) {
        lock.lock();
        try {
            int before = entries.size();
            entries.values().removeIf(entry -> entry.sourceId().equals(sourceId));
            return before - entries.size();
        } finally {
            lock.unlock();
        }
    }

    public Optional<CacheEntry> get(String sourceId, String path) {
        lock.lock();
        try {
            return Optional.ofNullable(entries.get(CacheEntry.key(sourceId, path)));
        } finally {
            lock.unlock();
        }
    }

    public List<CacheEntry> entries(String sourceId) {
        lock.lock();
        try {
            var result = new ArrayList<CacheEntry>();
            for (CacheEntry entry : entries.values()) {
                if (entry.sourceId().equals(sourceId)) {
                    result.add(entry);
                }
            }
            return result;
        } finally {
            lock.unlock();
        }
    }

    public int pendingCount(String sourceId) {
        lock.lock();
        try {
            return (int) entries.values().stream()
                    .filter(entry -> entry.sourceId().equals(sourceId) && !entry.available())
                    .count();
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public int maxSize() {
        return maxSize;
    }

    // caller holds the lock
    private void evictOldest() {
        String oldestKey = null;
        CacheEntry oldest = null;
        for (Map.Entry<String, CacheEntry> e : entries.entrySet()) {
            if (oldest == null || e.getValue().lastSeen().isBefore(oldest.lastSeen())) {
                oldestKey = e.getKey();
                oldest = e.getValue();
            }
        }
        if (oldestKey != null) {
            entries.remove(oldestKey);
            metrics.recordCacheEviction();
            log.debug("Evicted cache entry {}", oldestKey);
        }
    }
}
