package com.catalogizer.core.events;

/**
 * Owner-side handling of a dispatched event, invoked before subscribers are notified.
 */
@FunctionalInterface
public interface EventRouter {
    void route(SourceEvent event);
}
