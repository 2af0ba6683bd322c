// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.meshnet.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

import sh.meshnet.core.types.ParticipantId;

/**
 * ALLOWED/DENIED decision for one participant in one epoch.
 *
 * @param participantId the evaluated participant
 * @param status        the decision
 * @param reason        human-readable reason
 * @param evaluatedAt   evaluation time
 * @param epochId       epoch the verdict belongs to
 * @param benchmarkAge  age of the evaluated record, null when there was none
 * @since 0.1.0
 */
public record MembershipVerdict(
        ParticipantId participantId,
        MembershipStatus status,
        String reason,
        Instant evaluatedAt,
        long epochId,
        @Nullable Duration benchmarkAge) {

    public MembershipVerdict {
        Objects.requireNonNull(participantId, "participantId");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(reason, "reason");
        Objects.requireNonNull(evaluatedAt, "evaluatedAt");
        if (epochId < 1) {
            throw new IllegalArgumentException("epochId must be >= 1, got: " + epochId);
        }
    }

    public static MembershipVerdict allowed(
            final ParticipantId participantId,
            final String reason,
            final Instant evaluatedAt,
            final long epochId,
            final Duration benchmarkAge) {
        return new MembershipVerdict(participantId, MembershipStatus.ALLOWED, reason, evaluatedAt, epochId, benchmarkAge);
    }

    public static MembershipVerdict denied(
            final ParticipantId participantId,
            final String reason,
            final Instant evaluatedAt,
            final long epochId,
            final @Nullable Duration benchmarkAge) {
        return new MembershipVerdict(participantId, MembershipStatus.DENIED, reason, evaluatedAt, epochId, benchmarkAge);
    }

    public boolean isAllowed() {
        return status == MembershipStatus.ALLOWED;
    }
}
