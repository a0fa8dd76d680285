package com.catalogizer.core.connection;

import com.catalogizer.core.lifecycle.TaskTracker;
import com.catalogizer.core.source.SourceEndpoint;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Runs connector calls on a dedicated I/O pool and enforces an explicit deadline on each,
 * so a connector that ignores its timeout cannot stall a supervisor.
 */
public class DeadlineExecutor {

    @FunctionalInterface
    interface ConnectorCall {
        void run() throws Exception;
    }

    private final ExecutorService ioPool;

    public DeadlineExecutor() {
        this.ioPool = Executors.newCachedThreadPool(TaskTracker.namedDaemonThreads("source-io"));
    }

    /**
     * @throws ConnectionTimeoutException if the connector has not returned within {@code timeout}
     * @throws ConnectionFailureException if the connector failed
     */
    public void connect(SourceConnector connector, SourceEndpoint endpoint, Duration timeout) {
        String id = endpoint.sourceId();
        call(() -> connector.connect(endpoint, timeout), timeout,
                () -> new ConnectionTimeoutException(id, "connection timeout after " + timeout.toMillis() + "ms: " + endpoint.path()),
                cause -> new ConnectionFailureException(id, "connection failed: " + describe(cause), cause));
    }

    /**
     * @throws HealthCheckTimeoutException if the probe has not returned within {@code timeout}
     * @throws HealthCheckFailureException if the probe failed
     */
    public void probe(SourceConnector connector, SourceEndpoint endpoint, Duration timeout) {
        String id = endpoint.sourceId();
        call(() -> connector.probe(endpoint, timeout), timeout,
                () -> new HealthCheckTimeoutException(id, "health check timeout after " + timeout.toMillis() + "ms"),
                cause -> new HealthCheckFailureException(id, "health check failed: " + describe(cause), cause));
    }

    public void shutdown() {
        ioPool.shutdownNow();
    }

    private void call(ConnectorCall call, Duration timeout,
                      Supplier<ConnectorException> onTimeout,
                      Function<Throwable, ConnectorException> onFailure) {
        Future<?> future;
        try {
            future = ioPool.submit(() -> {
                call.run();
                return null;
            });
        } catch (RejectedExecutionException e) {
            throw onFailure.apply(e);
        }
        try {
            future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw onTimeout.get();
        } catch (ExecutionException e) {
            throw onFailure.apply(e.getCause() != null ? e.getCause() : e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw onFailure.apply(e);
        }
    }

    private static String describe(Throwable cause) {
        if (cause instanceof RejectedExecutionException) {
            return "executor shut down";
        }
        if (cause instanceof InterruptedException) {
            return "interrupted";
        }
        String message = cause.getMessage();
        return message != null ? message : cause.getClass().getSimpleName();
    }
}
