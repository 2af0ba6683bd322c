// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.meshnet.controller;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.meshnet.controller.publish.SnapshotPublisher;
import sh.meshnet.core.DebugLogger;
import sh.meshnet.core.crypto.EpochSecret;
import sh.meshnet.core.crypto.PskDeriver;
import sh.meshnet.core.error.RotationException;
import sh.meshnet.core.membership.EvaluationInput;
import sh.meshnet.core.membership.MembershipEngine;
import sh.meshnet.core.membership.MembershipPolicy;
import sh.meshnet.core.model.KeyMaterial;
import sh.meshnet.core.model.MembershipVerdict;
import sh.meshnet.core.model.ScoreRecord;
import sh.meshnet.core.model.Snapshot;
import sh.meshnet.core.score.ScoreStore;
import sh.meshnet.core.types.ParticipantId;
import sh.meshnet.primitives.SecureBytes;

/**
 * Owns the epoch clock and the current secret, and turns score records into
 * committed epochs.
 *
 * <p>
 * A rotation generates a fresh secret, evaluates every known participant
 * (configured ids plus every participant that ever submitted), derives keys
 * for the ALLOWED ones and commits the result as one {@link EpochView} with a
 * single reference swap. The previous secret is zeroed right after the swap,
 * and the snapshot is handed to the {@link SnapshotPublisher}.
 *
 * <p>
 * <strong>Concurrency:</strong> rotations are serialized by a lock; readers
 * never take it and always see a fully committed epoch. A rotation that fails
 * before commit leaves the previous epoch in effect and throws
 * {@link RotationException}.
 *
 * <p>
 * The first epoch (id 1) is built by the same pipeline when the manager is
 * constructed.
 *
 * @since 0.1.0
 */
public final class EpochManager implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(EpochManager.class);

    private final ScoreStore store;
    private final MembershipEngine engine;
    private final MembershipPolicy policy;
    private final PskDeriver deriver;
    private final Duration epochDuration;
    private final Set<ParticipantId> configuredParticipants;
    private final SnapshotPublisher publisher;
    private final ControllerMetrics metrics;
    private final Clock clock;
    private final SecureRandom random;

    private final ReentrantLock rotationLock = new ReentrantLock();
    private final AtomicReference<CommittedEpoch> committed = new AtomicReference<>();
    private volatile boolean closed;

    private EpochManager(final Builder builder) {
        this.store = Objects.requireNonNull(builder.store, "store");
        this.engine = Objects.requireNonNull(builder.engine, "engine");
        this.policy = Objects.requireNonNull(builder.policy, "policy");
        this.deriver = Objects.requireNonNull(builder.deriver, "deriver");
        this.epochDuration = Objects.requireNonNull(builder.epochDuration, "epochDuration");
        if (epochDuration.isNegative() || epochDuration.isZero()) {
            throw new IllegalArgumentException("epochDuration must be > 0, got: " + epochDuration);
        }
        this.configuredParticipants = Set.copyOf(builder.knownParticipants);
        this.publisher = Objects.requireNonNull(builder.publisher, "publisher");
        this.metrics = Objects.requireNonNull(builder.metrics, "metrics");
        this.clock = Objects.requireNonNull(builder.clock, "clock");
        this.random = Objects.requireNonNull(builder.random, "random");

        rotationLock.lock();
        try {
            final long start = System.nanoTime();
            final CommittedEpoch initial = build(1);
            committed.set(initial);
            onCommitted(initial, start);
        } finally {
            rotationLock.unlock();
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the committed epoch.
     *
     * @return the current view, never null
     */
    public EpochView current() {
        return committed.get().view;
    }

    public Snapshot currentSnapshot() {
        return current().snapshot();
    }

    public Optional<MembershipVerdict> verdict(final ParticipantId participantId) {
        return current().verdict(participantId);
    }

    /**
     * @param participantId the participant
     * @return the participant's key for the current epoch, empty if it is DENIED or unknown
     */
    public Optional<KeyMaterial> keyMaterial(final ParticipantId participantId) {
        return current().keyMaterial(participantId);
    }

    /**
     * Rotates if the current epoch has expired.
     *
     * @return true if a rotation was committed
     * @throws RotationException if the rotation failed; the current epoch stays in effect
     */
    public boolean tick() {
        if (closed) {
            return false;
        }
        rotationLock.lock();
        try {
            if (closed) {
                return false;
            }
            final Instant now = clock.instant();
            if (now.isBefore(committed.get().view.expiresAt())) {
                return false;
            }
            rotateLocked();
            return true;
        } finally {
            rotationLock.unlock();
        }
    }

    /**
     * Runs one rotation immediately, regardless of the current expiry. The next
     * scheduled rotation happens one epoch duration later.
     *
     * @return the newly committed epoch
     * @throws RotationException     if the rotation failed; the current epoch stays in effect
     * @throws IllegalStateException if the manager is closed
     */
    public EpochView forceRotate() {
        rotationLock.lock();
        try {
            if (closed) {
                throw new IllegalStateException("EpochManager is closed");
            }
            log.info("Manual rotation requested at epoch {}", committed.get().view.epochId());
            return rotateLocked();
        } finally {
            rotationLock.unlock();
        }
    }

    /**
     * Stops further rotations and zeroes the live secret. The last committed
     * view stays readable.
     */
    @Override
    public void close() {
        rotationLock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            committed.get().secret.destroy();
            log.info("EpochManager closed at epoch {}", committed.get().view.epochId());
        } finally {
            rotationLock.unlock();
        }
    }

    public boolean isClosed() {
        return closed;
    }

    private EpochView rotateLocked() {
        final long start = System.nanoTime();
        final CommittedEpoch previous = committed.get();
        final CommittedEpoch next = build(previous.view.epochId() + 1);
        committed.set(next);
        previous.secret.destroy();
        onCommitted(next, start);
        return next.view;
    }

    private CommittedEpoch build(final long epochId) {
        EpochSecret secret = null;
        try {
            final Instant now = clock.instant();
            secret = EpochSecret.generate(random, deriver.secretLength());

            final Map<ParticipantId, ScoreRecord> records = store.snapshotAll();
            final Set<ParticipantId> known = new HashSet<>(configuredParticipants);
            known.addAll(records.keySet());

            final Map<ParticipantId, MembershipVerdict> verdicts =
                    engine.evaluate(new EvaluationInput(records, known, now, epochId), policy);
            if (!verdicts.keySet().equals(known)) {
                throw new IllegalStateException("engine returned verdicts for " + verdicts.keySet()
                        + ", expected " + known);
            }

            final Map<ParticipantId, KeyMaterial> keys = new HashMap<>();
            for (MembershipVerdict verdict : verdicts.values()) {
                if (verdict.isAllowed()) {
                    final byte[] raw = deriver.derive(secret, verdict.participantId());
                    try {
                        keys.put(verdict.participantId(), new KeyMaterial(verdict.participantId(), epochId, raw));
                    } finally {
                        SecureBytes.wipe(raw);
                    }
                }
            }

            final Snapshot snapshot = new Snapshot(
                    epochId, now, now.plus(epochDuration), secret.fingerprint(), verdicts);
            return new CommittedEpoch(new EpochView(snapshot, keys), secret);
        } catch (RuntimeException e) {
            if (secret != null) {
                secret.destroy();
            }
            log.error("Rotation to epoch {} failed, keeping previous epoch", epochId, e);
            metrics.onRotationFailed(epochId, e);
            throw new RotationException(epochId, e);
        }
    }

    private void onCommitted(final CommittedEpoch epoch, final long startNanos) {
        final Snapshot snapshot = epoch.view.snapshot();
        final Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
        log.info("Epoch {} committed: secret={}, allowed={}, denied={}, expires={}",
                snapshot.epochId(), snapshot.secretFingerprint(), snapshot.allowedCount(),
                snapshot.deniedCount(), snapshot.expiresAt());
        if (log.isDebugEnabled()) {
            for (MembershipVerdict verdict : snapshot.verdicts().values()) {
                log.debug("Epoch {}: {} {} ({})", snapshot.epochId(), verdict.participantId(),
                        verdict.status(), verdict.reason());
            }
        }
        DebugLogger.logRotation("[ROTATE] epoch=%d secret=%s allowed=%s took=%dms",
                snapshot.epochId(), snapshot.secretFingerprint(), snapshot.allowedParticipants(),
                elapsed.toMillis());
        metrics.onRotation(snapshot.epochId(), elapsed);

        try {
            publisher.publish(snapshot);
        } catch (RuntimeException e) {
            log.warn("Publishing snapshot for epoch {} failed", snapshot.epochId(), e);
            metrics.onPublishFailed(snapshot.epochId(), e);
        }
    }

    private static final class CommittedEpoch {
        final EpochView view;
        final EpochSecret secret;

        CommittedEpoch(final EpochView view, final EpochSecret secret) {
            this.view = view;
            this.secret = secret;
        }
    }

    /**
     * Builder for {@link EpochManager}. Store, engine and deriver are required.
     */
    public static final class Builder {
        private ScoreStore store;
        private MembershipEngine engine;
        private PskDeriver deriver;
        private MembershipPolicy policy = MembershipPolicy.defaults();
        private Duration epochDuration = ControllerConfig.DEFAULT_EPOCH_DURATION;
        private Set<ParticipantId> knownParticipants = Set.of();
        private SnapshotPublisher publisher = SnapshotPublisher.noop();
        private ControllerMetrics metrics = ControllerMetrics.noop();
        private Clock clock = Clock.systemUTC();
        private SecureRandom random;

        private Builder() {}

        public Builder store(final ScoreStore store) {
            this.store = store;
            return this;
        }

        public Builder engine(final MembershipEngine engine) {
            this.engine = engine;
            return this;
        }

        public Builder deriver(final PskDeriver deriver) {
            this.deriver = deriver;
            return this;
        }

        public Builder policy(final MembershipPolicy policy) {
            this.policy = policy;
            return this;
        }

        public Builder epochDuration(final Duration epochDuration) {
            this.epochDuration = epochDuration;
            return this;
        }

        public Builder knownParticipants(final Set<ParticipantId> knownParticipants) {
            this.knownParticipants = Objects.requireNonNull(knownParticipants, "knownParticipants");
            return this;
        }

        public Builder publisher(final SnapshotPublisher publisher) {
            this.publisher = publisher;
            return this;
        }

        public Builder metrics(final ControllerMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder clock(final Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder random(final SecureRandom random) {
            this.random = random;
            return this;
        }

        /**
         * Builds the manager and commits epoch 1.
         *
         * @return the manager
         * @throws RotationException if the first epoch cannot be built
         */
        public EpochManager build() {
            if (random == null) {
                random = new SecureRandom();
            }
            return new EpochManager(this);
        }
    }
}
