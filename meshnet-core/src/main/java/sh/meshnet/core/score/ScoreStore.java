// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.meshnet.core.score;

import java.util.Map;
import java.util.Optional;

import sh.meshnet.core.model.ScoreRecord;
import sh.meshnet.core.types.ParticipantId;

/**
 * Holds the latest {@link ScoreRecord} per participant.
 *
 * <p>
 * Implementations must be thread-safe: submissions arrive concurrently with
 * rotations and must never block on them. A submission replaces the previous
 * record of the same participant in arrival order (not by embedded timestamp).
 *
 * @since 0.1.0
 */
public interface ScoreStore {

    /**
     * Stores {@code record}, replacing any earlier record of the same participant.
     *
     * @param record a validated score record
     */
    void submit(ScoreRecord record);

    /**
     * @param participantId the participant
     * @return the latest record, or empty if the participant never submitted
     */
    Optional<ScoreRecord> get(ParticipantId participantId);

    /**
     * Returns an immutable copy of all current records, used as the rotation-time read.
     *
     * @return participant to latest record
     */
    Map<ParticipantId, ScoreRecord> snapshotAll();

    /**
     * @return number of participants with a stored record
     */
    int size();
}
