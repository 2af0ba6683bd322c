// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.meshnet.core.crypto;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

import sh.meshnet.core.error.PreconditionViolationException;
import sh.meshnet.core.types.ParticipantId;
import sh.meshnet.primitives.SecureBytes;

/**
 * Derives per-participant pre-shared keys from an epoch secret.
 *
 * <p>
 * Algorithm: {@code psk = HMAC-SHA256(key = secret, msg = UTF-8(participantId))[0, keyLength)}.
 * The result depends only on the secret bytes and the participant id, so it is
 * reproducible across calls and process restarts.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * PskDeriver deriver = new PskDeriver(32, 32);
 * byte[] psk = deriver.derive(secret, ParticipantId.of("node-a"));
 * }</pre>
 *
 * <p>Instances are immutable and thread-safe.
 *
 * @since 0.1.0
 */
public final class PskDeriver {

    /** Smallest accepted key length in bytes. */
    public static final int MIN_KEY_LENGTH = 16;

    /** Largest accepted key length in bytes (one HMAC-SHA256 block). */
    public static final int MAX_KEY_LENGTH = HmacSha256.MAC_LENGTH;

    private final int secretLength;
    private final int keyLength;

    /**
     * @param secretLength the only secret length this deriver accepts
     * @param keyLength    output key length
     * @throws PreconditionViolationException if either length is out of range
     */
    public PskDeriver(final int secretLength, final int keyLength) {
        EpochSecret.checkLength(secretLength);
        if (keyLength < MIN_KEY_LENGTH || keyLength > MAX_KEY_LENGTH) {
            throw new PreconditionViolationException(
                    "key length must be in [" + MIN_KEY_LENGTH + ", " + MAX_KEY_LENGTH + "] bytes, got " + keyLength);
        }
        this.secretLength = secretLength;
        this.keyLength = keyLength;
    }

    public int secretLength() {
        return secretLength;
    }

    public int keyLength() {
        return keyLength;
    }

    /**
     * Derives the key for {@code participant} from raw secret bytes.
     *
     * @param secret      secret bytes, exactly {@link #secretLength()} long (not modified)
     * @param participant the participant
     * @return a new array of {@link #keyLength()} bytes
     * @throws PreconditionViolationException if the secret has the wrong length
     */
    public byte[] derive(final byte[] secret, final ParticipantId participant) {
        Objects.requireNonNull(secret, "secret");
        Objects.requireNonNull(participant, "participant");
        if (secret.length != secretLength) {
            throw new PreconditionViolationException(
                    "secret must be " + secretLength + " bytes, got " + secret.length);
        }
        final byte[] mac = HmacSha256.mac(secret, participant.value().getBytes(StandardCharsets.UTF_8));
        try {
            return Arrays.copyOf(mac, keyLength);
        } finally {
            SecureBytes.wipe(mac);
        }
    }

    /**
     * Derives the key for {@code participant} from a live epoch secret.
     *
     * @param secret      the epoch secret
     * @param participant the participant
     * @return a new array of {@link #keyLength()} bytes
     * @throws IllegalStateException          if the secret has been destroyed
     * @throws PreconditionViolationException if the secret has the wrong length
     */
    public byte[] derive(final EpochSecret secret, final ParticipantId participant) {
        Objects.requireNonNull(secret, "secret");
        return secret.apply(bytes -> derive(bytes, participant));
    }
}
