// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.meshnet.core.codec;

import java.util.Objects;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;

import sh.meshnet.core.model.MembershipVerdict;
import sh.meshnet.core.model.Snapshot;

/**
 * Renders a {@link Snapshot} as the status document served to operators.
 *
 * <pre>{@code
 * {
 *   "epoch": {"id": 7, "created_utc": "...", "expiry_utc": "...", "secret_hash": "sha256:0123456789abcdef"},
 *   "nodes": {
 *     "node-a": {"membership": "ALLOWED", "reason": "score and freshness satisfied",
 *                "evaluated_utc": "...", "benchmark_age_sec": 42}
 *   }
 * }
 * }</pre>
 *
 * <p>Only the secret fingerprint is rendered.
 *
 * @since 0.1.0
 */
public final class SnapshotCodec {

    private final ObjectMapper mapper;

    public SnapshotCodec() {
        this(new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT));
    }

    public SnapshotCodec(final ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public ObjectNode toTree(final Snapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot");
        final ObjectNode root = mapper.createObjectNode();
        final ObjectNode epoch = root.putObject("epoch");
        epoch.put("id", snapshot.epochId());
        epoch.put("created_utc", snapshot.createdAt().toString());
        epoch.put("expiry_utc", snapshot.expiresAt().toString());
        epoch.put("secret_hash", snapshot.secretFingerprint().value());

        final ObjectNode nodes = root.putObject("nodes");
        for (MembershipVerdict verdict : snapshot.verdicts().values()) {
            final ObjectNode node = nodes.putObject(verdict.participantId().value());
            node.put("membership", verdict.status().name());
            node.put("reason", verdict.reason());
            node.put("evaluated_utc", verdict.evaluatedAt().toString());
            if (verdict.benchmarkAge() != null) {
                node.put("benchmark_age_sec", verdict.benchmarkAge().toSeconds());
            }
        }
        return root;
    }

    public String toJson(final Snapshot snapshot) {
        try {
            return mapper.writeValueAsString(toTree(snapshot));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("failed to encode snapshot " + snapshot.epochId(), e);
        }
    }
}
