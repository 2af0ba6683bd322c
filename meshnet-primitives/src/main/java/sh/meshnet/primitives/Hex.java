// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.meshnet.primitives;

/**
 * Lowercase hex encoding without a prefix.
 *
 * <p>Used for fingerprints and for debug renderings of non-secret byte values.
 * Never pass secret material through this class into a log line.
 *
 * @since 0.1.0
 */
public final class Hex {
    private static final char[] HEX_CHARS = "0123456789abcdef".toCharArray();

    private Hex() {
        // Utility class
    }

    /**
     * Encodes bytes as lowercase hex.
     *
     * @param bytes the bytes to encode
     * @return hex string
     * @throws IllegalArgumentException if {@code bytes} is {@code null}
     */
    public static String encodeNoPrefix(final byte[] bytes) {
        if (bytes == null) {
            throw new IllegalArgumentException("bytes cannot be null");
        }
        return encodeNoPrefix(bytes, 0, bytes.length);
    }

    /**
     * Encodes {@code length} bytes of {@code bytes} starting at {@code offset}.
     *
     * @param bytes  the source bytes
     * @param offset the first byte to encode
     * @param length the number of bytes to encode
     * @return hex string
     * @throws IllegalArgumentException if {@code bytes} is null or the range is out of bounds
     */
    public static String encodeNoPrefix(final byte[] bytes, final int offset, final int length) {
        if (bytes == null) {
            throw new IllegalArgumentException("bytes cannot be null");
        }
        if (offset < 0 || length < 0 || offset > bytes.length - length) {
            throw new IllegalArgumentException(
                    "range out of bounds: offset=" + offset + ", length=" + length + ", size=" + bytes.length);
        }

        final char[] chars = new char[length * 2];
        for (int i = 0; i < length; i++) {
            final int v = bytes[offset + i] & 0xFF;
            chars[i * 2] = HEX_CHARS[v >>> 4];
            chars[i * 2 + 1] = HEX_CHARS[v & 0x0F];
        }
        return new String(chars);
    }
}
