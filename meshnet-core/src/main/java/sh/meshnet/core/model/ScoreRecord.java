// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.meshnet.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

import sh.meshnet.core.error.ValidationException;
import sh.meshnet.core.types.ParticipantId;

/**
 * Most recent benchmark result submitted by one participant.
 *
 * <p>
 * <strong>Validation</strong> (violations throw {@link ValidationException}):
 * <ul>
 * <li>{@code scores} must contain {@value #OVERALL}</li>
 * <li>every score must be a finite number in [0, 1]</li>
 * <li>score names and {@code suiteVersion} must not be blank</li>
 * </ul>
 *
 * <p>Immutable. A newer record for the same participant replaces this one in
 * the score store; records are never merged.
 *
 * @param participantId the submitting participant
 * @param submittedAt   timestamp carried by the submission (submitter's clock)
 * @param suiteVersion  version of the benchmark suite that produced the scores
 * @param scores        score name to value in [0, 1]
 * @param notes         free-form notes, may be null
 * @since 0.1.0
 */
public record ScoreRecord(
        ParticipantId participantId,
        Instant submittedAt,
        String suiteVersion,
        Map<String, Double> scores,
        @Nullable String notes) {

    /** Name of the mandatory aggregate score. */
    public static final String OVERALL = "overall";

    public ScoreRecord {
        if (participantId == null) {
            throw new ValidationException("participant_id", "is required");
        }
        if (submittedAt == null) {
            throw new ValidationException("timestamp", "is required");
        }
        if (suiteVersion == null || suiteVersion.isBlank()) {
            throw new ValidationException("suite_version", "is required");
        }
        if (scores == null || !scores.containsKey(OVERALL)) {
            throw new ValidationException("scores", "must contain \"" + OVERALL + "\"");
        }
        final Map<String, Double> copy = new LinkedHashMap<>();
        for (Map.Entry<String, Double> entry : scores.entrySet()) {
            final String name = entry.getKey();
            final Double value = entry.getValue();
            if (name == null || name.isBlank()) {
                throw new ValidationException("scores", "score names must not be blank");
            }
            if (value == null || !Double.isFinite(value) || value < 0.0 || value > 1.0) {
                throw new ValidationException("scores." + name, "must be a number in [0, 1], got " + value);
            }
            copy.put(name, value);
        }
        scores = Collections.unmodifiableMap(copy);
    }

    /**
     * @return the mandatory {@value #OVERALL} score
     */
    public double overall() {
        return scores.get(OVERALL);
    }

    public static Builder builder(final ParticipantId participantId) {
        return new Builder(participantId);
    }

    /**
     * Builder for {@link ScoreRecord}; validation happens in {@link #build()}.
     */
    public static final class Builder {
        private final ParticipantId participantId;
        private Instant submittedAt;
        private String suiteVersion;
        private final Map<String, Double> scores = new LinkedHashMap<>();
        private @Nullable String notes;

        private Builder(final ParticipantId participantId) {
            this.participantId = Objects.requireNonNull(participantId, "participantId");
        }

        public Builder submittedAt(final Instant submittedAt) {
            this.submittedAt = submittedAt;
            return this;
        }

        public Builder suiteVersion(final String suiteVersion) {
            this.suiteVersion = suiteVersion;
            return this;
        }

        public Builder overall(final double overall) {
            return score(OVERALL, overall);
        }

        public Builder score(final String name, final double value) {
            this.scores.put(name, value);
            return this;
        }

        public Builder scores(final Map<String, Double> scores) {
            this.scores.putAll(scores);
            return this;
        }

        public Builder notes(final @Nullable String notes) {
            this.notes = notes;
            return this;
        }

        public ScoreRecord build() {
            return new ScoreRecord(participantId, submittedAt, suiteVersion, scores, notes);
        }
    }
}
