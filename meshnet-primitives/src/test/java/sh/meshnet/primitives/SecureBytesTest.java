// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.meshnet.primitives;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class SecureBytesTest {

    @Test
    void wipeZeroesEveryByte() {
        byte[] bytes = {1, 2, 3, (byte) 0xFF};
        SecureBytes.wipe(bytes);
        assertArrayEquals(new byte[4], bytes);
    }

    @Test
    void wipeIgnoresNull() {
        assertDoesNotThrow(() -> SecureBytes.wipe(null));
    }

    @Test
    void constantTimeEqualsComparesContent() {
        assertTrue(SecureBytes.constantTimeEquals(new byte[] {1, 2}, new byte[] {1, 2}));
        assertFalse(SecureBytes.constantTimeEquals(new byte[] {1, 2}, new byte[] {1, 3}));
        assertFalse(SecureBytes.constantTimeEquals(new byte[] {1, 2}, new byte[] {1, 2, 3}));
        assertFalse(SecureBytes.constantTimeEquals(null, new byte[0]));
    }
}
