// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.meshnet.core.types;

import java.util.Objects;
import java.util.regex.Pattern;

import com.fasterxml.jackson.annotation.JsonValue;

import sh.meshnet.core.error.ValidationException;

/**
 * Identifier of a participant (node) whose eligibility is evaluated every epoch.
 * <p>
 * <strong>Validation:</strong>
 * <ul>
 * <li>1 to 128 characters</li>
 * <li>No whitespace or control characters</li>
 * </ul>
 * The id is used verbatim (UTF-8) as the PSK derivation input, so no case
 * folding is applied.
 *
 * @since 0.1.0
 */
public record ParticipantId(@JsonValue String value) implements Comparable<ParticipantId> {
    private static final int MAX_LENGTH = 128;
    private static final Pattern ALLOWED = Pattern.compile("[^\\s\\p{Cntrl}]+");

    public ParticipantId {
        Objects.requireNonNull(value, "participant id");
        if (value.isEmpty() || value.length() > MAX_LENGTH) {
            throw new ValidationException("participant_id", "must be 1.." + MAX_LENGTH + " characters");
        }
        if (!ALLOWED.matcher(value).matches()) {
            throw new ValidationException("participant_id", "must not contain whitespace or control characters");
        }
    }

    public static ParticipantId of(final String value) {
        return new ParticipantId(value);
    }

    @Override
    public int compareTo(final ParticipantId other) {
        return value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return value;
    }
}
