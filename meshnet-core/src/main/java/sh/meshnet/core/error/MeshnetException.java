// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.meshnet.core.error;

/**
 * Base runtime exception for all meshnet failures.
 *
 * <p>
 * <strong>Exception Hierarchy:</strong>
 * <pre>
 * MeshnetException
 * ├── {@link ValidationException} - malformed submission, rejected without state change
 * ├── {@link PreconditionViolationException} - invalid secret/key length, fatal configuration bug
 * ├── {@link PublishException} - snapshot publisher failure, rotation stays committed
 * └── {@link RotationException} - rotation aborted before commit, prior epoch stays live
 * </pre>
 *
 * @since 0.1.0
 */
public sealed class MeshnetException extends RuntimeException
        permits ValidationException,
        PreconditionViolationException,
        PublishException,
        RotationException {

    public MeshnetException(final String message) {
        super(message);
    }

    public MeshnetException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
