package com.catalogizer.core.events;

import com.catalogizer.core.lifecycle.TaskTracker;
import com.catalogizer.core.logging.MdcContext;
import com.catalogizer.core.metrics.SourceMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Bounded event channel with a single dispatcher task.
 * <p>
 * {@link #publish(SourceEvent)} never blocks. When the queue is full the oldest queued event
 * is drained to make room; if a concurrent producer takes that slot first, the new event is
 * dropped instead. Delivery order therefore matches publish order only while the queue has
 * room.
 * <p>
 * The dispatcher hands every event to the owner's {@link EventRouter} first, then to
 * per-source and global subscribers.
 */
public class SourceEventBus {

    private static final Logger log = LoggerFactory.getLogger(SourceEventBus.class);

    /** Upper bound on how long the dispatcher takes to notice shutdown while idle. */
    private static final long POLL_INTERVAL_MS = 100;

    private final BlockingQueue<SourceEvent> queue;
    private final int capacity;
    private final TaskTracker tasks;
    private final SourceMetrics metrics;
    private final AtomicBoolean started = new AtomicBoolean();

    /** Per-source subscribers keyed by sourceId. */
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<SourceEvent>>> sourceSubscribers =
            new ConcurrentHashMap<>();

    /** Global subscribers that receive events from all sources. */
    private final CopyOnWriteArrayList<Consumer<SourceEvent>> globalSubscribers = new CopyOnWriteArrayList<>();

    public SourceEventBus(int capacity, TaskTracker tasks, SourceMetrics metrics) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.capacity = capacity;
        this.tasks = tasks;
        this.metrics = metrics;
    }

    /**
     * Enqueues an event without blocking the caller, dropping the oldest queued event when full.
     *
     * @return false if the event itself had to be dropped
     */
    public boolean publish(SourceEvent event) {
        if (queue.offer(event)) {
            return true;
        }

        SourceEvent dropped = queue.poll();
        if (dropped != null) {
            metrics.recordDroppedEvent("oldest");
            log.warn("Event queue full, dropped oldest event {} for source {} to make room for {} for source {}",
                    dropped.type(), dropped.sourceId(), event.type(), event.sourceId());
        }

        if (queue.offer(event)) {
            return true;
        }
        metrics.recordDroppedEvent("newest");
        log.warn("Event queue still full after drain attempt, dropping {} for source {}",
                event.type(), event.sourceId());
        return false;
    }

    /**
     * Starts the dispatcher task. Subsequent calls are ignored.
     *
     * @return false if the dispatcher was already started or shutdown has begun
     */
    public boolean start(EventRouter router) {
        if (!started.compareAndSet(false, true)) {
            return false;
        }
        return tasks.submit("event-dispatcher", () -> dispatchLoop(router));
    }

    /**
     * Subscribe to events for a specific source.
     *
     * @param sourceId the source to subscribe to
     * @param consumer callback invoked on the dispatcher thread for each event
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String sourceId, Consumer<SourceEvent> consumer) {
        sourceSubscribers.computeIfAbsent(sourceId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        log.debug("Subscribed to source {}", sourceId);
        return () -> {
            CopyOnWriteArrayList<Consumer<SourceEvent>> subs = sourceSubscribers.get(sourceId);
            if (subs != null) {
                subs.remove(consumer);
            }
        };
    }

    /**
     * Subscribe to events from all sources.
     */
    public Subscription subscribeAll(Consumer<SourceEvent> consumer) {
        globalSubscribers.add(consumer);
        log.debug("Subscribed to all source events");
        return () -> globalSubscribers.remove(consumer);
    }

    public int size() {
        return queue.size();
    }

    public int capacity() {
        return capacity;
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void dispatchLoop(EventRouter router) {
        log.debug("Event dispatcher started");
        while (!tasks.isShutdown()) {
            SourceEvent event;
            try {
                event = queue.poll(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (event != null) {
                dispatch(router, event);
            }
        }
        log.debug("Event dispatcher stopped with {} events undelivered", queue.size());
    }

    void dispatch(EventRouter router, SourceEvent event) {
        log.debug("Processing event {} for source {}", event.type(), event.sourceId());
        MdcContext.setSource(event.sourceId());
        try {
            router.route(event);
        } catch (RuntimeException e) {
            log.warn("Router failed on event {} for source {}: {}", event.type(), event.sourceId(), e.getMessage(), e);
        } finally {
            MdcContext.clear();
        }

        List<Consumer<SourceEvent>> sourceSubs = sourceSubscribers.get(event.sourceId());
        if (sourceSubs != null) {
            for (Consumer<SourceEvent> subscriber : sourceSubs) {
                deliverSafely(subscriber, event);
            }
        }
        for (Consumer<SourceEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    private void deliverSafely(Consumer<SourceEvent> subscriber, SourceEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}", event.type(), e.getMessage(), e);
        }
    }
}
