// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.meshnet.core.score;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.meshnet.core.DebugLogger;
import sh.meshnet.core.model.ScoreRecord;
import sh.meshnet.core.types.ParticipantId;

/**
 * {@link ScoreStore} backed by a {@link ConcurrentHashMap}.
 *
 * <p>
 * Each record is replaced as a whole, so readers never see a torn entry.
 * {@link #snapshotAll()} copies the map without locking; a submission racing
 * with the copy lands either in this rotation or the next one.
 *
 * <p>
 * Known limitation: a submission carrying an older timestamp still replaces
 * a fresher record if it arrives later.
 *
 * @since 0.1.0
 */
public final class InMemoryScoreStore implements ScoreStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryScoreStore.class);

    private final ConcurrentHashMap<ParticipantId, ScoreRecord> records = new ConcurrentHashMap<>();

    @Override
    public void submit(final ScoreRecord record) {
        Objects.requireNonNull(record, "record");
        final ScoreRecord previous = records.put(record.participantId(), record);
        if (previous != null && previous.submittedAt().isAfter(record.submittedAt())) {
            log.debug("Record for {} replaced by an older timestamp ({} -> {})",
                    record.participantId(), previous.submittedAt(), record.submittedAt());
        }
        DebugLogger.logSubmission("[SCORE-STORE] participant=%s overall=%.2f suite=%s submittedAt=%s",
                record.participantId(), record.overall(), record.suiteVersion(), record.submittedAt());
    }

    @Override
    public Optional<ScoreRecord> get(final ParticipantId participantId) {
        Objects.requireNonNull(participantId, "participantId");
        return Optional.ofNullable(records.get(participantId));
    }

    @Override
    public Map<ParticipantId, ScoreRecord> snapshotAll() {
        return Map.copyOf(records);
    }

    @Override
    public int size() {
        return records.size();
    }
}
