// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.meshnet.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collectors;

import sh.meshnet.core.types.Fingerprint;
import sh.meshnet.core.types.ParticipantId;

/**
 * Immutable result of one rotation, handed to the snapshot publisher.
 *
 * <p>Carries only the fingerprint of the epoch secret, never the secret itself.
 * Every verdict must belong to {@code epochId}.
 *
 * @param epochId           the epoch
 * @param createdAt         when the epoch started
 * @param expiresAt         when the epoch is due for rotation
 * @param secretFingerprint one-way fingerprint of the epoch secret
 * @param verdicts          verdict per participant, sorted by id
 * @since 0.1.0
 */
public record Snapshot(
        long epochId,
        Instant createdAt,
        Instant expiresAt,
        Fingerprint secretFingerprint,
        Map<ParticipantId, MembershipVerdict> verdicts) {

    public Snapshot {
        Objects.requireNonNull(createdAt, "createdAt");
        Objects.requireNonNull(expiresAt, "expiresAt");
        Objects.requireNonNull(secretFingerprint, "secretFingerprint");
        Objects.requireNonNull(verdicts, "verdicts");
        if (epochId < 1) {
            throw new IllegalArgumentException("epochId must be >= 1, got: " + epochId);
        }
        if (expiresAt.isBefore(createdAt)) {
            throw new IllegalArgumentException("expiresAt must not precede createdAt");
        }
        for (Map.Entry<ParticipantId, MembershipVerdict> entry : verdicts.entrySet()) {
            final MembershipVerdict verdict = entry.getValue();
            if (!entry.getKey().equals(verdict.participantId())) {
                throw new IllegalArgumentException("verdict keyed under " + entry.getKey()
                        + " belongs to " + verdict.participantId());
            }
            if (verdict.epochId() != epochId) {
                throw new IllegalArgumentException("verdict for " + verdict.participantId()
                        + " has epoch " + verdict.epochId() + ", snapshot is epoch " + epochId);
            }
        }
        verdicts = Collections.unmodifiableMap(new TreeMap<>(verdicts));
    }

    public Optional<MembershipVerdict> verdict(final ParticipantId participantId) {
        return Optional.ofNullable(verdicts.get(participantId));
    }

    public List<ParticipantId> allowedParticipants() {
        return verdicts.values().stream()
                .filter(MembershipVerdict::isAllowed)
                .map(MembershipVerdict::participantId)
                .collect(Collectors.toUnmodifiableList());
    }

    public long allowedCount() {
        return verdicts.values().stream().filter(MembershipVerdict::isAllowed).count();
    }

    public long deniedCount() {
        return verdicts.size() - allowedCount();
    }
}
