// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.meshnet.controller;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory methods for the controller's background threads.
 *
 * <p>
 * All threads are daemon platform threads with descriptive names, so a
 * controller that is never closed does not keep the JVM alive.
 *
 * @since 0.1.0
 */
public final class ControllerExecutors {

    private static final AtomicInteger PUBLISHER_THREAD_ID = new AtomicInteger(0);

    private ControllerExecutors() {
        // Utility class
    }

    /**
     * Creates the single-threaded scheduler that drives rotations.
     * The thread is named {@code meshnet-epoch-scheduler}.
     *
     * @return a single-thread scheduled executor
     */
    public static ScheduledExecutorService newRotationScheduler() {
        return Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "meshnet-epoch-scheduler");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Creates a single-threaded executor for snapshot publishing, so snapshots
     * are delivered in commit order. Threads are named {@code meshnet-publisher-N}.
     *
     * @return a single-thread executor
     */
    public static ExecutorService newPublisherExecutor() {
        return Executors.newSingleThreadExecutor(r -> {
            // Mask off sign bit to keep ids non-negative after overflow
            int id = PUBLISHER_THREAD_ID.getAndIncrement() & 0x7FFFFFFF;
            Thread t = new Thread(r, "meshnet-publisher-" + id);
            t.setDaemon(true);
            return t;
        });
    }
}
