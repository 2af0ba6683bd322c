// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.meshnet.controller;

import java.time.Duration;

import sh.meshnet.core.error.ValidationException;
import sh.meshnet.core.types.ParticipantId;

/**
 * Interface for collecting metrics from the controller.
 *
 * <p>
 * Implementations can bridge to Micrometer, Prometheus or any other
 * monitoring system. By default a no-op implementation is used
 * ({@link #noop()}).
 *
 * <p>
 * <strong>Thread Safety:</strong> implementations must be thread-safe; rotation
 * callbacks arrive on the scheduler thread, submission callbacks on caller
 * threads and publish callbacks on the publisher thread.
 */
public interface ControllerMetrics {

    /**
     * Called after an epoch is committed.
     *
     * @param epochId  the committed epoch
     * @param duration time spent building and committing it
     */
    default void onRotation(long epochId, Duration duration) {
    }

    /**
     * Called when a rotation aborts before commit.
     *
     * @param attemptedEpochId the epoch that was being built
     * @param error            the failure
     */
    default void onRotationFailed(long attemptedEpochId, Throwable error) {
    }

    default void onSubmissionAccepted(ParticipantId participantId) {
    }

    default void onSubmissionRejected(ValidationException error) {
    }

    /**
     * Called when a snapshot could not be published.
     *
     * @param epochId the snapshot's epoch
     * @param error   the failure
     */
    default void onPublishFailed(long epochId, Throwable error) {
    }

    /**
     * Returns a no-op metrics implementation that does nothing.
     *
     * @return a no-op ControllerMetrics instance
     */
    static ControllerMetrics noop() {
        return NoopMetrics.INSTANCE;
    }
}

/**
 * Internal no-op implementation of ControllerMetrics.
 */
enum NoopMetrics implements ControllerMetrics {
    INSTANCE
}
