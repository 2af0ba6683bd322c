// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.meshnet.core.crypto;

import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Objects;
import java.util.function.Function;

import javax.security.auth.Destroyable;

import sh.meshnet.core.error.PreconditionViolationException;
import sh.meshnet.core.types.Fingerprint;
import sh.meshnet.primitives.SecureBytes;

/**
 * Shared secret of one epoch.
 *
 * <p>
 * The raw bytes never leave this package: callers get the {@link #fingerprint()}
 * and derive per-participant keys through {@link PskDeriver}. Once the epoch is
 * replaced the owner calls {@link #destroy()}, which zeroes the bytes; any later
 * derivation attempt fails with {@link IllegalStateException}.
 *
 * @since 0.1.0
 */
public final class EpochSecret implements Destroyable {

    /** Smallest accepted secret length in bytes. */
    public static final int MIN_LENGTH = 16;

    /** Largest accepted secret length in bytes. */
    public static final int MAX_LENGTH = 64;

    private final byte[] bytes;
    private final Fingerprint fingerprint;
    private boolean destroyed = false;

    private EpochSecret(final byte[] bytes) {
        this.bytes = bytes;
        this.fingerprint = Fingerprint.of(bytes);
    }

    /**
     * Generates a fresh secret from a cryptographically secure source.
     *
     * @param random the random source
     * @param length secret length in bytes
     * @return new secret
     * @throws PreconditionViolationException if the length is outside [{@value #MIN_LENGTH}, {@value #MAX_LENGTH}]
     */
    public static EpochSecret generate(final SecureRandom random, final int length) {
        Objects.requireNonNull(random, "random");
        checkLength(length);
        final byte[] bytes = new byte[length];
        random.nextBytes(bytes);
        return new EpochSecret(bytes);
    }

    /**
     * Wraps existing secret bytes.
     *
     * @apiNote The input array is copied and then zeroed. Pass a copy if the caller
     *          needs to keep the original bytes.
     *
     * @param secretBytes the secret (will be zeroed)
     * @return new secret
     * @throws PreconditionViolationException if the length is out of range
     */
    public static EpochSecret fromBytes(final byte[] secretBytes) {
        Objects.requireNonNull(secretBytes, "secret bytes");
        try {
            checkLength(secretBytes.length);
            return new EpochSecret(Arrays.copyOf(secretBytes, secretBytes.length));
        } finally {
            SecureBytes.wipe(secretBytes);
        }
    }

    static void checkLength(final int length) {
        if (length < MIN_LENGTH || length > MAX_LENGTH) {
            throw new PreconditionViolationException(
                    "secret length must be in [" + MIN_LENGTH + ", " + MAX_LENGTH + "] bytes, got " + length);
        }
    }

    public int length() {
        return bytes.length;
    }

    public Fingerprint fingerprint() {
        return fingerprint;
    }

    /**
     * Runs {@code action} against the raw bytes while holding the destroy lock.
     * The action must not retain or publish the array.
     */
    synchronized <T> T apply(final Function<byte[], T> action) {
        if (destroyed) {
            throw new IllegalStateException("epoch secret " + fingerprint + " has been destroyed");
        }
        return action.apply(bytes);
    }

    @Override
    public synchronized void destroy() {
        if (!destroyed) {
            SecureBytes.wipe(bytes);
            destroyed = true;
        }
    }

    @Override
    public synchronized boolean isDestroyed() {
        return destroyed;
    }

    @Override
    public String toString() {
        return "EpochSecret[" + fingerprint + (isDestroyed() ? ", destroyed]" : "]");
    }
}
