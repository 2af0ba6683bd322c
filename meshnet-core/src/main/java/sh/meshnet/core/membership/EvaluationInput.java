// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.meshnet.core.membership;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import sh.meshnet.core.model.ScoreRecord;
import sh.meshnet.core.types.ParticipantId;

/**
 * Everything a {@link MembershipEngine} needs for one rotation.
 *
 * @param records  rotation-time copy of the score store
 * @param knownIds participants to produce a verdict for (records outside this set are ignored)
 * @param now      evaluation time
 * @param epochId  epoch the verdicts belong to
 * @since 0.1.0
 */
public record EvaluationInput(
        Map<ParticipantId, ScoreRecord> records,
        Set<ParticipantId> knownIds,
        Instant now,
        long epochId) {

    public EvaluationInput {
        records = Map.copyOf(Objects.requireNonNull(records, "records"));
        knownIds = Set.copyOf(Objects.requireNonNull(knownIds, "knownIds"));
        Objects.requireNonNull(now, "now");
        if (epochId < 1) {
            throw new IllegalArgumentException("epochId must be >= 1, got: " + epochId);
        }
    }
}
