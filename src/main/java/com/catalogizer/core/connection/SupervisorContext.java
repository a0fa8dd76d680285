package com.catalogizer.core.connection;

import com.catalogizer.core.events.SourceEventBus;
import com.catalogizer.core.lifecycle.TaskTracker;
import com.catalogizer.core.metrics.SourceMetrics;

import java.time.Clock;

/**
 * Collaborators shared by every supervisor of one manager.
 */
public record SupervisorContext(
    SourceConnector connector,
    DeadlineExecutor deadlines,
    SourceEventBus eventBus,
    TaskTracker tasks,
    SourceMetrics metrics,
    Clock clock
) {}
