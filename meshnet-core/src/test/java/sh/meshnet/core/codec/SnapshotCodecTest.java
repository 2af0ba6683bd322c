// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.meshnet.core.codec;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.jupiter.api.Test;

import sh.meshnet.core.model.MembershipVerdict;
import sh.meshnet.core.model.Snapshot;
import sh.meshnet.core.types.Fingerprint;
import sh.meshnet.core.types.ParticipantId;

class SnapshotCodecTest {

    private static final Instant T0 = Instant.parse("2026-01-05T12:00:00Z");
    private static final ParticipantId A = ParticipantId.of("node-a");
    private static final ParticipantId C = ParticipantId.of("node-c");

    @Test
    void rendersEpochAndNodes() throws Exception {
        final Fingerprint fp = Fingerprint.of(new byte[] {1, 2, 3});
        final Snapshot snapshot = new Snapshot(4, T0, T0.plusSeconds(60), fp, Map.of(
                A, MembershipVerdict.allowed(A, "score and freshness satisfied", T0, 4, Duration.ofSeconds(42)),
                C, MembershipVerdict.denied(C, "no benchmark submitted", T0, 4, null)));

        final String json = new SnapshotCodec().toJson(snapshot);
        final JsonNode root = new ObjectMapper().readTree(json);

        assertEquals(4, root.path("epoch").path("id").asLong());
        assertEquals("2026-01-05T12:00:00Z", root.path("epoch").path("created_utc").asText());
        assertEquals("2026-01-05T12:01:00Z", root.path("epoch").path("expiry_utc").asText());
        assertEquals(fp.value(), root.path("epoch").path("secret_hash").asText());

        final JsonNode a = root.path("nodes").path("node-a");
        assertEquals("ALLOWED", a.path("membership").asText());
        assertEquals(42, a.path("benchmark_age_sec").asLong());

        final JsonNode c = root.path("nodes").path("node-c");
        assertEquals("DENIED", c.path("membership").asText());
        assertEquals("no benchmark submitted", c.path("reason").asText());
        assertFalse(c.has("benchmark_age_sec"));
    }

    @Test
    void outputNeverCarriesKeyFields() {
        final Snapshot snapshot = new Snapshot(1, T0, T0.plusSeconds(60), Fingerprint.of(new byte[16]),
                Map.of(A, MembershipVerdict.allowed(A, "ok", T0, 1, Duration.ZERO)));

        final String json = new SnapshotCodec().toJson(snapshot);

        assertFalse(json.contains("psk"));
        assertFalse(json.contains("key_bytes"));
    }
}
