// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.meshnet.core.model;

import java.util.Arrays;
import java.util.Base64;
import java.util.Objects;

import sh.meshnet.core.types.ParticipantId;
import sh.meshnet.primitives.SecureBytes;

/**
 * Pre-shared key issued to an ALLOWED participant for one epoch.
 *
 * <p>
 * DENIED participants never get an instance: absence is expressed as an empty
 * {@code Optional}, not as placeholder bytes. The key bytes are defensively
 * copied on the way in and out and never appear in {@link #toString()}.
 *
 * @param participantId the key holder
 * @param epochId       epoch the key is valid for
 * @param keyBytes      the derived key
 * @since 0.1.0
 */
public record KeyMaterial(ParticipantId participantId, long epochId, byte[] keyBytes) {

    public KeyMaterial {
        Objects.requireNonNull(participantId, "participantId");
        Objects.requireNonNull(keyBytes, "keyBytes");
        if (keyBytes.length == 0) {
            throw new IllegalArgumentException("keyBytes must not be empty");
        }
        keyBytes = keyBytes.clone();
    }

    /**
     * @return a copy of the key bytes
     */
    @Override
    public byte[] keyBytes() {
        return keyBytes.clone();
    }

    public int keyLength() {
        return keyBytes.length;
    }

    /**
     * @return the key in standard Base64, the form node agents consume
     */
    public String toBase64() {
        return Base64.getEncoder().encodeToString(keyBytes);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof KeyMaterial other)) {
            return false;
        }
        return epochId == other.epochId
                && participantId.equals(other.participantId)
                && SecureBytes.constantTimeEquals(keyBytes, other.keyBytes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(participantId, epochId, Arrays.hashCode(keyBytes));
    }

    @Override
    public String toString() {
        return "KeyMaterial[participantId=" + participantId + ", epochId=" + epochId
                + ", keyBytes=<" + keyBytes.length + " bytes redacted>]";
    }
}
