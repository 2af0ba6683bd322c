// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.meshnet.core.error;

/**
 * Thrown by a snapshot publisher that could not expose or persist a snapshot.
 *
 * <p>The rotation that produced the snapshot remains committed.
 *
 * @since 0.1.0
 */
public final class PublishException extends MeshnetException {

    private final long epochId;

    public PublishException(final long epochId, final String message, final Throwable cause) {
        super("epoch " + epochId + ": " + message, cause);
        this.epochId = epochId;
    }

    public PublishException(final long epochId, final String message) {
        super("epoch " + epochId + ": " + message);
        this.epochId = epochId;
    }

    public long epochId() {
        return epochId;
    }
}
