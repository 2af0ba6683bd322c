// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.meshnet.core.model;

import java.util.Objects;

import org.jspecify.annotations.Nullable;

import sh.meshnet.core.error.ValidationException;
import sh.meshnet.core.types.ParticipantId;

/**
 * A score submission as received from a participant.
 *
 * <p>
 * The signature is carried but not checked by the default
 * {@link sh.meshnet.core.score.SubmissionVerifier}; a verifying implementation
 * can switch on the variant without touching the membership engine.
 *
 * @since 0.1.0
 */
public sealed interface Submission permits Submission.Unsigned, Submission.Signed {

    ScoreRecord scoreRecord();

    default ParticipantId participantId() {
        return scoreRecord().participantId();
    }

    static Submission unsigned(final ScoreRecord scoreRecord) {
        return new Unsigned(scoreRecord);
    }

    static Submission signed(final ScoreRecord scoreRecord, final String signature) {
        return new Signed(scoreRecord, signature);
    }

    /**
     * Returns a signed submission when {@code signature} is non-blank, otherwise unsigned.
     */
    static Submission of(final ScoreRecord scoreRecord, final @Nullable String signature) {
        return signature == null || signature.isBlank() ? unsigned(scoreRecord) : signed(scoreRecord, signature);
    }

    /** Submission without a signature. */
    record Unsigned(ScoreRecord scoreRecord) implements Submission {
        public Unsigned {
            Objects.requireNonNull(scoreRecord, "scoreRecord");
        }
    }

    /** Submission carrying an opaque signature string. */
    record Signed(ScoreRecord scoreRecord, String signature) implements Submission {
        public Signed {
            Objects.requireNonNull(scoreRecord, "scoreRecord");
            if (signature == null || signature.isBlank()) {
                throw new ValidationException("signature", "must not be blank for a signed submission");
            }
        }
    }
}
