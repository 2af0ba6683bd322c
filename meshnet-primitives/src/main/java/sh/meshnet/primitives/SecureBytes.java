// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.meshnet.primitives;

import java.util.Arrays;

/**
 * Helpers for byte arrays that hold key material.
 *
 * @since 0.1.0
 */
public final class SecureBytes {

    private SecureBytes() {
        // Utility class
    }

    /**
     * Overwrites the array with zeros. A {@code null} array is ignored.
     *
     * @param bytes the array to clear
     */
    public static void wipe(final byte[] bytes) {
        if (bytes != null) {
            Arrays.fill(bytes, (byte) 0);
        }
    }

    /**
     * Compares two arrays in time that depends only on their lengths.
     *
     * @param a first array
     * @param b second array
     * @return true if both arrays are non-null and hold the same bytes
     */
    public static boolean constantTimeEquals(final byte[] a, final byte[] b) {
        if (a == null || b == null || a.length != b.length) {
            return false;
        }
        int diff = 0;
        for (int i = 0; i < a.length; i++) {
            diff |= a[i] ^ b[i];
        }
        return diff == 0;
    }
}
