// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.meshnet.core.crypto;

import java.util.Objects;

import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.macs.HMac;
import org.bouncycastle.crypto.params.KeyParameter;

/**
 * HMAC-SHA256 (RFC 2104) backed by Bouncy Castle.
 *
 * <p>The MAC computation is data-independent in its timing with respect to the key;
 * comparisons of MAC outputs should use
 * {@link sh.meshnet.primitives.SecureBytes#constantTimeEquals(byte[], byte[])}.
 *
 * @since 0.1.0
 */
public final class HmacSha256 {

    /** Output length in bytes. */
    public static final int MAC_LENGTH = 32;

    private HmacSha256() {
        // Utility class
    }

    /**
     * Computes HMAC-SHA256 of {@code message} keyed with {@code key}.
     *
     * @param key     the MAC key (any length; long keys are hashed per RFC 2104)
     * @param message the authenticated data
     * @return 32-byte MAC
     * @throws NullPointerException if key or message is null
     */
    public static byte[] mac(final byte[] key, final byte[] message) {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(message, "message cannot be null");

        final HMac hmac = new HMac(new SHA256Digest());
        hmac.init(new KeyParameter(key));
        hmac.update(message, 0, message.length);
        final byte[] out = new byte[hmac.getMacSize()];
        hmac.doFinal(out, 0);
        return out;
    }
}
