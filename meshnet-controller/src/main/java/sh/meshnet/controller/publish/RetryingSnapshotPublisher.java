// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.meshnet.controller.publish;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.meshnet.core.error.PublishException;
import sh.meshnet.core.model.Snapshot;

/**
 * Retries a delegate publisher with exponential backoff and jitter.
 *
 * <p>
 * Only {@link PublishException} is retried; any other exception is a bug in
 * the delegate and propagates immediately. When attempts run out, the last
 * failure is rethrown as a {@link PublishException} carrying the earlier
 * failures as suppressed exceptions.
 *
 * <p>
 * <strong>Thread Interruption:</strong> if the calling thread is interrupted
 * during backoff, the loop stops and the last failure is thrown.
 *
 * @since 0.1.0
 */
public final class RetryingSnapshotPublisher implements SnapshotPublisher {

    private static final Logger log = LoggerFactory.getLogger(RetryingSnapshotPublisher.class);

    private final SnapshotPublisher delegate;
    private final PublishRetryConfig config;

    public RetryingSnapshotPublisher(final SnapshotPublisher delegate, final PublishRetryConfig config) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.config = Objects.requireNonNull(config, "config");
    }

    @Override
    public void publish(final Snapshot snapshot) {
        final long epochId = snapshot.epochId();
        final List<PublishException> failures = new ArrayList<>();
        for (int attempt = 1; attempt <= config.maxAttempts(); attempt++) {
            try {
                delegate.publish(snapshot);
                if (attempt > 1) {
                    log.info("Snapshot for epoch {} published after {} attempts", epochId, attempt);
                }
                return;
            } catch (PublishException e) {
                failures.add(e);
                if (attempt == config.maxAttempts()) {
                    break;
                }
                final double jitter = ThreadLocalRandom.current().nextDouble(config.jitterMin(), config.jitterMax());
                final long delayMillis = config.backoffMillis(attempt, jitter);
                log.debug("Publish attempt {} for epoch {} failed, retrying in {}ms", attempt, epochId, delayMillis);
                try {
                    Thread.sleep(delayMillis);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    e.addSuppressed(ie);
                    throw e;
                }
            }
        }
        throw exhausted(epochId, failures);
    }

    private static PublishException exhausted(final long epochId, final List<PublishException> failures) {
        final PublishException last = failures.get(failures.size() - 1);
        final PublishException exhausted = new PublishException(
                epochId, "gave up after " + failures.size() + " attempts", last);
        for (int i = 0; i < failures.size() - 1; i++) {
            exhausted.addSuppressed(failures.get(i));
        }
        return exhausted;
    }
}
