// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.meshnet.controller.publish;

import sh.meshnet.core.error.PublishException;
import sh.meshnet.core.model.Snapshot;

/**
 * Receives one immutable {@link Snapshot} per committed epoch.
 *
 * <p>
 * Publishing happens after commit: a failing publisher never rolls an epoch
 * back. Decorators add asynchrony ({@link AsyncSnapshotPublisher}) and
 * retries ({@link RetryingSnapshotPublisher}).
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface SnapshotPublisher {

    /**
     * Publishes a snapshot.
     *
     * @param snapshot the committed snapshot
     * @throws PublishException if the snapshot could not be delivered
     */
    void publish(Snapshot snapshot);

    /**
     * Returns a publisher that discards every snapshot.
     *
     * @return a no-op publisher
     */
    static SnapshotPublisher noop() {
        return snapshot -> {
        };
    }
}
