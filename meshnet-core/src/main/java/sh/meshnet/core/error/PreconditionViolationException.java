// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.meshnet.core.error;

/**
 * Thrown when secret or key material does not have the configured length.
 *
 * <p>This always indicates a configuration or programming bug. It is never
 * caught inside meshnet; startup fails and a running rotation is abandoned.
 *
 * @since 0.1.0
 */
public final class PreconditionViolationException extends MeshnetException {

    public PreconditionViolationException(final String message) {
        super(message);
    }
}
