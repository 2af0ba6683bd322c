// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.meshnet.core.types;

import java.util.Objects;
import java.util.regex.Pattern;

import com.fasterxml.jackson.annotation.JsonValue;

import sh.meshnet.core.crypto.Sha256;
import sh.meshnet.primitives.Hex;

/**
 * One-way identifier of an epoch secret: {@code "sha256:"} followed by the first
 * 16 lowercase hex characters of SHA-256(secret).
 * <p>
 * This is the only rendering of a secret that may appear in snapshots or logs.
 *
 * @since 0.1.0
 */
public record Fingerprint(@JsonValue String value) {
    private static final String PREFIX = "sha256:";
    private static final int HEX_CHARS = 16;
    private static final Pattern FORMAT = Pattern.compile("sha256:[0-9a-f]{" + HEX_CHARS + "}");

    public Fingerprint {
        Objects.requireNonNull(value, "fingerprint");
        if (!FORMAT.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid fingerprint: " + value);
        }
    }

    /**
     * Computes the fingerprint of raw secret bytes. The input is not retained.
     *
     * @param secret the secret bytes
     * @return the fingerprint
     */
    public static Fingerprint of(final byte[] secret) {
        Objects.requireNonNull(secret, "secret");
        final byte[] digest = Sha256.hash(secret);
        return new Fingerprint(PREFIX + Hex.encodeNoPrefix(digest, 0, HEX_CHARS / 2));
    }

    @Override
    public String toString() {
        return value;
    }
}
