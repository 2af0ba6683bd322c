// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.meshnet.controller;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.meshnet.controller.publish.AsyncSnapshotPublisher;
import sh.meshnet.controller.publish.JsonFileSnapshotPublisher;
import sh.meshnet.controller.publish.PublishRetryConfig;
import sh.meshnet.controller.publish.RetryingSnapshotPublisher;
import sh.meshnet.controller.publish.SnapshotPublisher;
import sh.meshnet.core.codec.SubmissionCodec;
import sh.meshnet.core.crypto.PskDeriver;
import sh.meshnet.core.error.RotationException;
import sh.meshnet.core.error.ValidationException;
import sh.meshnet.core.membership.MembershipEngine;
import sh.meshnet.core.membership.ThresholdMembershipEngine;
import sh.meshnet.core.model.KeyMaterial;
import sh.meshnet.core.model.MembershipVerdict;
import sh.meshnet.core.model.Snapshot;
import sh.meshnet.core.model.Submission;
import sh.meshnet.core.score.InMemoryScoreStore;
import sh.meshnet.core.score.ScoreStore;
import sh.meshnet.core.score.SubmissionVerifier;
import sh.meshnet.core.types.ParticipantId;

/**
 * Entry point of the controller: accepts score submissions, answers
 * membership and key queries, and rotates epochs in the background.
 *
 * <p><strong>Usage:</strong>
 * <pre>{@code
 * try (MeshController controller = MeshController.builder()
 *         .config(ControllerConfig.fromEnvironment())
 *         .build()) {
 *     controller.start();
 *     controller.submitJson(ParticipantId.of("node-a"), payload);
 *     ParticipantConfig config = controller.participantConfig(ParticipantId.of("node-a"));
 * }
 * }</pre>
 *
 * <p>
 * Snapshots go through an {@link AsyncSnapshotPublisher}; when a status file
 * is configured a {@link JsonFileSnapshotPublisher} with retries is added.
 * Queries always reflect the last committed epoch.
 *
 * @since 0.1.0
 */
public final class MeshController implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MeshController.class);

    private final ControllerConfig config;
    private final ScoreStore store;
    private final SubmissionVerifier verifier;
    private final SubmissionCodec codec;
    private final ControllerMetrics metrics;
    private final AsyncSnapshotPublisher publisher;
    private final EpochManager epochs;
    private final EpochScheduler scheduler;

    private MeshController(final Builder builder) {
        this.config = builder.config;
        this.store = builder.store;
        this.verifier = builder.verifier;
        this.codec = new SubmissionCodec();
        this.metrics = builder.metrics;
        this.publisher = new AsyncSnapshotPublisher(composePublisher(builder), metrics);
        try {
            this.epochs = EpochManager.builder()
                    .store(store)
                    .engine(builder.engine)
                    .deriver(new PskDeriver(config.secretLength(), config.keyLength()))
                    .policy(config.policy())
                    .epochDuration(config.epochDuration())
                    .knownParticipants(config.knownParticipants())
                    .publisher(publisher)
                    .metrics(metrics)
                    .clock(builder.clock)
                    .random(builder.random)
                    .build();
        } catch (RuntimeException e) {
            publisher.close();
            throw e;
        }
        this.scheduler = new EpochScheduler(epochs, config.tickInterval());
    }

    public static Builder builder() {
        return new Builder();
    }

    private static SnapshotPublisher composePublisher(final Builder builder) {
        final SnapshotPublisher custom = builder.publisher;
        if (builder.config.statusFile() == null) {
            return custom;
        }
        final SnapshotPublisher file = new RetryingSnapshotPublisher(
                new JsonFileSnapshotPublisher(builder.config.statusFile()), builder.retryConfig);
        final ControllerMetrics metrics = builder.metrics;
        // Each sink sees every snapshot, whatever the other one did
        return snapshot -> {
            deliverTo("status file", file, snapshot, metrics);
            deliverTo("custom publisher", custom, snapshot, metrics);
        };
    }

    private static void deliverTo(
            final String sink,
            final SnapshotPublisher target,
            final Snapshot snapshot,
            final ControllerMetrics metrics) {
        try {
            target.publish(snapshot);
        } catch (RuntimeException e) {
            log.warn("Publishing snapshot for epoch {} to {} failed", snapshot.epochId(), sink, e);
            metrics.onPublishFailed(snapshot.epochId(), e);
        }
    }

    /**
     * Starts scheduled rotations.
     */
    public void start() {
        scheduler.start();
    }

    /**
     * Records a submission as the participant's latest.
     *
     * @param submission the submission
     * @throws ValidationException if the verifier rejects it
     */
    public void submit(final Submission submission) {
        Objects.requireNonNull(submission, "submission");
        try {
            verifier.verify(submission);
        } catch (ValidationException e) {
            reject(e);
            throw e;
        }
        store.submit(submission.scoreRecord());
        metrics.onSubmissionAccepted(submission.participantId());
        log.debug("Accepted submission from {}: overall={}",
                submission.participantId(), submission.scoreRecord().overall());
    }

    /**
     * Decodes and records a JSON submission.
     *
     * @param json payload
     * @return the submitting participant
     * @throws ValidationException if the payload is malformed or rejected
     */
    public ParticipantId submitJson(final String json) {
        final Submission submission;
        try {
            submission = codec.decode(json);
        } catch (ValidationException e) {
            reject(e);
            throw e;
        }
        submit(submission);
        return submission.participantId();
    }

    /**
     * Decodes and records a JSON submission sent on behalf of {@code expected}.
     *
     * @param expected participant the payload was addressed to
     * @param json     payload
     * @throws ValidationException if the payload is malformed, names another participant or is rejected
     */
    public void submitJson(final ParticipantId expected, final String json) {
        final Submission submission;
        try {
            submission = codec.decode(expected, json);
        } catch (ValidationException e) {
            reject(e);
            throw e;
        }
        submit(submission);
    }

    private void reject(final ValidationException e) {
        log.warn("Rejected submission: {}", e.getMessage());
        metrics.onSubmissionRejected(e);
    }

    public Optional<MembershipVerdict> getVerdict(final ParticipantId participantId) {
        return epochs.verdict(participantId);
    }

    /**
     * @param participantId the participant
     * @return current key, empty when DENIED or unknown
     */
    public Optional<KeyMaterial> getKeyMaterial(final ParticipantId participantId) {
        return epochs.keyMaterial(participantId);
    }

    public ParticipantConfig participantConfig(final ParticipantId participantId) {
        Objects.requireNonNull(participantId, "participantId");
        return ParticipantConfig.of(participantId, epochs.current());
    }

    public Snapshot currentSnapshot() {
        return epochs.currentSnapshot();
    }

    /**
     * Rotates immediately.
     *
     * @return the new snapshot
     * @throws RotationException if the rotation failed
     */
    public Snapshot forceRotate() {
        return epochs.forceRotate().snapshot();
    }

    public ControllerConfig config() {
        return config;
    }

    /**
     * Stops the scheduler, zeroes the live secret and drains pending publishes.
     */
    @Override
    public void close() {
        scheduler.close();
        epochs.close();
        publisher.close();
    }

    /**
     * Builder for {@link MeshController}. Everything but the configuration is
     * optional and mainly exists for tests.
     */
    public static final class Builder {
        private ControllerConfig config = ControllerConfig.defaults();
        private ScoreStore store;
        private MembershipEngine engine = new ThresholdMembershipEngine();
        private SubmissionVerifier verifier = SubmissionVerifier.acceptAll();
        private SnapshotPublisher publisher = SnapshotPublisher.noop();
        private PublishRetryConfig retryConfig = PublishRetryConfig.defaults();
        private ControllerMetrics metrics = ControllerMetrics.noop();
        private Clock clock = Clock.systemUTC();
        private SecureRandom random;

        private Builder() {}

        public Builder config(final ControllerConfig config) {
            this.config = Objects.requireNonNull(config, "config");
            return this;
        }

        public Builder store(final ScoreStore store) {
            this.store = store;
            return this;
        }

        public Builder engine(final MembershipEngine engine) {
            this.engine = Objects.requireNonNull(engine, "engine");
            return this;
        }

        public Builder verifier(final SubmissionVerifier verifier) {
            this.verifier = Objects.requireNonNull(verifier, "verifier");
            return this;
        }

        /**
         * Adds a publisher that receives every snapshot (after the status file, if any).
         *
         * @param publisher the publisher
         * @return this builder
         */
        public Builder publisher(final SnapshotPublisher publisher) {
            this.publisher = Objects.requireNonNull(publisher, "publisher");
            return this;
        }

        public Builder retryConfig(final PublishRetryConfig retryConfig) {
            this.retryConfig = Objects.requireNonNull(retryConfig, "retryConfig");
            return this;
        }

        public Builder metrics(final ControllerMetrics metrics) {
            this.metrics = Objects.requireNonNull(metrics, "metrics");
            return this;
        }

        public Builder clock(final Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public Builder random(final SecureRandom random) {
            this.random = random;
            return this;
        }

        /**
         * Builds the controller and commits epoch 1. Rotations start with {@link MeshController#start()}.
         *
         * @return the controller
         */
        public MeshController build() {
            if (store == null) {
                store = new InMemoryScoreStore();
            }
            if (random == null) {
                random = new SecureRandom();
            }
            return new MeshController(this);
        }
    }
}
