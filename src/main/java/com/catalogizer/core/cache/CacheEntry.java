package com.catalogizer.core.cache;

import java.time.Instant;
import java.util.Map;

/**
 * A file change recorded while its source was unreachable.
 *
 * @param available true once the change has been replayed after reconnection
 */
public record CacheEntry(
    String sourceId,
    String path,
    Map<String, Object> metadata,
    Instant lastSeen,
    boolean available
) {

    static String key(String sourceId, String path) {
        return sourceId + ":" + path;
    }

    CacheEntry markAvailable() {
        return new CacheEntry(sourceId, path, metadata, lastSeen, true);
    }
}
