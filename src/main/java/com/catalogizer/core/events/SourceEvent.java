package com.catalogizer.core.events;

import java.time.Instant;
import java.util.Map;

/**
 * A lifecycle, health or file-change notification about one source. Events are consumed
 * once by the bus dispatcher and never persisted.
 *
 * @param type      what happened
 * @param sourceId  the source this event belongs to
 * @param path      changed file path (only for {@link SourceEventType#FILE_CHANGE})
 * @param error     failure message, null when the event does not report an error
 * @param timestamp when the event occurred
 * @param data      additional key-value details
 */
public record SourceEvent(
    SourceEventType type,
    String sourceId,
    String path,
    String error,
    Instant timestamp,
    Map<String, Object> data
) {

    public static SourceEvent of(SourceEventType type, String sourceId, Instant timestamp) {
        return new SourceEvent(type, sourceId, null, null, timestamp, Map.of());
    }

    public static SourceEvent failure(SourceEventType type, String sourceId, String error, Instant timestamp) {
        return new SourceEvent(type, sourceId, null, error, timestamp, Map.of());
    }

    public static SourceEvent fileChange(String sourceId, String path, Instant timestamp) {
        return new SourceEvent(SourceEventType.FILE_CHANGE, sourceId, path, null, timestamp, Map.of());
    }

    public SourceEvent withData(Map<String, Object> data) {
        return new SourceEvent(type, sourceId, path, error, timestamp, data);
    }
}
