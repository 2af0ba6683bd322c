// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.meshnet.core.crypto;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import sh.meshnet.core.error.PreconditionViolationException;
import sh.meshnet.core.types.ParticipantId;
import sh.meshnet.primitives.Hex;

class PskDeriverTest {

    private static final ParticipantId NODE_A = ParticipantId.of("node-a");
    private static final ParticipantId NODE_B = ParticipantId.of("node-b");

    private static byte[] secret(final int length, final int fill) {
        final byte[] bytes = new byte[length];
        Arrays.fill(bytes, (byte) fill);
        return bytes;
    }

    @Test
    void deriveIsTruncatedHmacOfParticipantId() {
        final PskDeriver deriver = new PskDeriver(32, 32);
        final byte[] secret = secret(32, 0x42);

        final byte[] expected = HmacSha256.mac(secret, "node-a".getBytes(StandardCharsets.UTF_8));
        assertArrayEquals(expected, deriver.derive(secret, NODE_A));
    }

    @Test
    void shorterKeysArePrefixesOfTheFullKey() {
        final byte[] secret = secret(32, 0x07);
        final byte[] full = new PskDeriver(32, 32).derive(secret, NODE_A);
        final byte[] shortKey = new PskDeriver(32, 16).derive(secret, NODE_A);

        assertEquals(16, shortKey.length);
        assertArrayEquals(Arrays.copyOf(full, 16), shortKey);
    }

    @Test
    void deriveIsDeterministic() {
        final PskDeriver deriver = new PskDeriver(32, 32);
        final byte[] secret = secret(32, 0x11);

        assertArrayEquals(deriver.derive(secret, NODE_A), deriver.derive(secret.clone(), NODE_A));
        // A separate instance (e.g. after a restart) gives the same bytes
        assertArrayEquals(deriver.derive(secret, NODE_A), new PskDeriver(32, 32).derive(secret, NODE_A));
    }

    @Test
    void deriveDoesNotModifySecret() {
        final byte[] secret = secret(32, 0x33);
        new PskDeriver(32, 32).derive(secret, NODE_A);
        assertArrayEquals(secret(32, 0x33), secret);
    }

    @Test
    void differentParticipantsGetDifferentKeys() {
        final PskDeriver deriver = new PskDeriver(32, 32);
        final byte[] secret = secret(32, 0x5a);

        final Set<String> keys = new HashSet<>();
        for (int i = 0; i < 200; i++) {
            keys.add(Hex.encodeNoPrefix(deriver.derive(secret, ParticipantId.of("node-" + i))));
        }
        assertEquals(200, keys.size());
        assertFalse(Arrays.equals(deriver.derive(secret, NODE_A), deriver.derive(secret, NODE_B)));
    }

    @Test
    void differentSecretsGiveDifferentKeys() {
        final PskDeriver deriver = new PskDeriver(32, 32);
        assertFalse(Arrays.equals(
                deriver.derive(secret(32, 1), NODE_A),
                deriver.derive(secret(32, 2), NODE_A)));
    }

    @Test
    void deriveFromEpochSecretMatchesRawBytes() {
        final PskDeriver deriver = new PskDeriver(32, 32);
        final byte[] raw = secret(32, 0x21);
        final EpochSecret epochSecret = EpochSecret.fromBytes(raw.clone());

        assertArrayEquals(deriver.derive(raw, NODE_A), deriver.derive(epochSecret, NODE_A));
    }

    @Test
    void deriveFromDestroyedSecretFails() {
        final PskDeriver deriver = new PskDeriver(32, 32);
        final EpochSecret epochSecret = EpochSecret.generate(new SecureRandom(), 32);
        epochSecret.destroy();

        assertThrows(IllegalStateException.class, () -> deriver.derive(epochSecret, NODE_A));
    }

    @Test
    void wrongSecretLengthIsPreconditionViolation() {
        final PskDeriver deriver = new PskDeriver(32, 32);
        final PreconditionViolationException ex = assertThrows(PreconditionViolationException.class,
                () -> deriver.derive(new byte[31], NODE_A));
        assertTrue(ex.getMessage().contains("32"));
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 8, 15, 33, 64})
    void invalidKeyLengthIsRejected(final int keyLength) {
        assertThrows(PreconditionViolationException.class, () -> new PskDeriver(32, keyLength));
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 15, 65, 128})
    void invalidSecretLengthIsRejected(final int secretLength) {
        assertThrows(PreconditionViolationException.class, () -> new PskDeriver(secretLength, 32));
    }
}
