// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.meshnet.core.error;

/**
 * Thrown when an epoch rotation fails before its new state is committed.
 *
 * <p>The previously committed epoch, its secret and its snapshot stay in effect.
 *
 * @since 0.1.0
 */
public final class RotationException extends MeshnetException {

    private final long attemptedEpochId;

    public RotationException(final long attemptedEpochId, final Throwable cause) {
        super("rotation to epoch " + attemptedEpochId + " aborted: " + cause.getMessage(), cause);
        this.attemptedEpochId = attemptedEpochId;
    }

    public long attemptedEpochId() {
        return attemptedEpochId;
    }
}
