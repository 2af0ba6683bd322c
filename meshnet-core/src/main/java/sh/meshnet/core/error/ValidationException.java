// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.meshnet.core.error;

import org.jspecify.annotations.Nullable;

/**
 * Thrown when a score submission is malformed: missing {@code overall} score,
 * out-of-range values, unparsable timestamp, invalid participant id, or a
 * rejected signature.
 *
 * <p>The submission is discarded and the score store is left unchanged.
 *
 * @since 0.1.0
 */
public final class ValidationException extends MeshnetException {

    private final @Nullable String field;

    public ValidationException(final @Nullable String field, final String message) {
        super(field == null ? message : field + ": " + message);
        this.field = field;
    }

    public ValidationException(final @Nullable String field, final String message, final Throwable cause) {
        super(field == null ? message : field + ": " + message, cause);
        this.field = field;
    }

    /**
     * Returns the name of the offending payload field, if known.
     *
     * @return the field name, or null for payload-level failures
     */
    public @Nullable String field() {
        return field;
    }
}
