// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.meshnet.controller.publish;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.meshnet.controller.ControllerExecutors;
import sh.meshnet.controller.ControllerMetrics;
import sh.meshnet.core.model.Snapshot;

/**
 * Fire-and-forget decorator: {@link #publish(Snapshot)} returns immediately
 * and the delegate runs on a dedicated thread.
 *
 * <p>
 * Snapshots are delivered in submission order. Delegate failures are logged
 * at WARN and reported through {@link ControllerMetrics#onPublishFailed}.
 * Snapshots published after {@link #close()} are dropped.
 *
 * @since 0.1.0
 */
public final class AsyncSnapshotPublisher implements SnapshotPublisher, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AsyncSnapshotPublisher.class);

    static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);

    private final SnapshotPublisher delegate;
    private final ControllerMetrics metrics;
    private final ExecutorService executor;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public AsyncSnapshotPublisher(final SnapshotPublisher delegate, final ControllerMetrics metrics) {
        this(delegate, metrics, ControllerExecutors.newPublisherExecutor());
    }

    AsyncSnapshotPublisher(
            final SnapshotPublisher delegate, final ControllerMetrics metrics, final ExecutorService executor) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    @Override
    public void publish(final Snapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot");
        if (closed.get()) {
            log.debug("Publisher closed, dropping snapshot for epoch {}", snapshot.epochId());
            return;
        }
        try {
            executor.execute(() -> deliver(snapshot));
        } catch (RejectedExecutionException e) {
            log.debug("Publisher closed, dropping snapshot for epoch {}", snapshot.epochId());
        }
    }

    private void deliver(final Snapshot snapshot) {
        try {
            delegate.publish(snapshot);
        } catch (RuntimeException e) {
            log.warn("Publishing snapshot for epoch {} failed", snapshot.epochId(), e);
            metrics.onPublishFailed(snapshot.epochId(), e);
        }
    }

    /**
     * Stops accepting snapshots and waits (bounded) for queued ones to be delivered.
     */
    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("Snapshot publisher did not drain within {}", SHUTDOWN_TIMEOUT);
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                executor.shutdownNow();
            }
        }
    }
}
