// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.meshnet.controller;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives {@link EpochManager#tick()} on a single daemon thread.
 *
 * <p>
 * A failing tick is logged and the schedule continues; the manager keeps the
 * previous epoch in effect until a later tick succeeds.
 *
 * @since 0.1.0
 */
public final class EpochScheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(EpochScheduler.class);

    /** Bound on how long {@link #close()} waits for an in-flight rotation. */
    static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);

    private final EpochManager manager;
    private final Duration tickInterval;
    private final ScheduledExecutorService scheduler = ControllerExecutors.newRotationScheduler();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile ScheduledFuture<?> tickTask;

    public EpochScheduler(final EpochManager manager, final Duration tickInterval) {
        this.manager = Objects.requireNonNull(manager, "manager");
        this.tickInterval = Objects.requireNonNull(tickInterval, "tickInterval");
        if (tickInterval.isNegative() || tickInterval.isZero()) {
            throw new IllegalArgumentException("tickInterval must be > 0, got: " + tickInterval);
        }
    }

    /**
     * Starts ticking. Calling it again has no effect.
     *
     * @throws IllegalStateException if the scheduler was closed
     */
    public void start() {
        if (closed.get()) {
            throw new IllegalStateException("EpochScheduler is closed");
        }
        if (!started.compareAndSet(false, true)) {
            return;
        }
        final long millis = tickInterval.toMillis();
        tickTask = scheduler.scheduleAtFixedRate(this::tickSafely, millis, millis, TimeUnit.MILLISECONDS);
        log.info("Epoch scheduler started, tick={}ms", millis);
    }

    public boolean isRunning() {
        return started.get() && !closed.get();
    }

    void tickSafely() {
        try {
            manager.tick();
        } catch (RuntimeException e) {
            // An escaping exception would cancel the periodic task
            log.warn("Scheduled rotation failed, retrying on next tick", e);
        }
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            if (tickTask != null) {
                tickTask.cancel(false);
            }
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("Epoch scheduler did not stop within {}", SHUTDOWN_TIMEOUT);
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                scheduler.shutdownNow();
            }
        }
    }
}
