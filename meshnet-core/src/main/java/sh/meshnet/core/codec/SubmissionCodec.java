// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.meshnet.core.codec;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.jspecify.annotations.Nullable;

import sh.meshnet.core.error.ValidationException;
import sh.meshnet.core.model.ScoreRecord;
import sh.meshnet.core.model.Submission;
import sh.meshnet.core.types.ParticipantId;

/**
 * Decodes benchmark submissions from their JSON payload.
 *
 * <p>
 * Expected payload:
 * <pre>{@code
 * {
 *   "participant_id": "node-a",          // "node_id" is accepted as an alias
 *   "timestamp": "2026-01-05T12:34:56Z",
 *   "suite_version": "poc-0.1",
 *   "scores": {"overall": 0.92, "refusal": 0.88},
 *   "notes": "optional",
 *   "signature": "optional"
 * }
 * }</pre>
 *
 * <p>
 * Timestamps are ISO-8601; a timestamp without offset is read as UTC. Every
 * malformed payload results in a {@link ValidationException}.
 *
 * @since 0.1.0
 */
public final class SubmissionCodec {

    private final ObjectMapper mapper;

    public SubmissionCodec() {
        this(new ObjectMapper());
    }

    public SubmissionCodec(final ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    /**
     * Decodes a submission.
     *
     * @param json the payload
     * @return the submission, signed if a non-blank signature is present
     * @throws ValidationException if the payload is malformed
     */
    public Submission decode(final String json) {
        if (json == null || json.isBlank()) {
            throw new ValidationException(null, "empty payload");
        }
        final JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ValidationException(null, "payload is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new ValidationException(null, "payload must be a JSON object");
        }

        final ParticipantId participantId = ParticipantId.of(participantField(root));
        final ScoreRecord record = ScoreRecord.builder(participantId)
                .submittedAt(parseTimestamp(requiredText(root, "timestamp")))
                .suiteVersion(requiredText(root, "suite_version"))
                .scores(parseScores(root.get("scores")))
                .notes(optionalText(root, "notes"))
                .build();
        return Submission.of(record, optionalText(root, "signature"));
    }

    /**
     * Decodes a submission addressed to {@code expected}, rejecting payloads for
     * another participant.
     *
     * @param expected participant the payload was sent for
     * @param json     the payload
     * @return the submission
     * @throws ValidationException if the payload is malformed or names another participant
     */
    public Submission decode(final ParticipantId expected, final String json) {
        Objects.requireNonNull(expected, "expected");
        final Submission submission = decode(json);
        if (!expected.equals(submission.participantId())) {
            throw new ValidationException("participant_id",
                    "mismatch: addressed to " + expected + ", payload names " + submission.participantId());
        }
        return submission;
    }

    /**
     * Encodes a submission back into its payload form (used by node-side emitters).
     *
     * @param submission the submission
     * @return JSON payload
     */
    public String encode(final Submission submission) {
        final ScoreRecord record = submission.scoreRecord();
        final ObjectNode root = mapper.createObjectNode();
        root.put("participant_id", record.participantId().value());
        root.put("timestamp", record.submittedAt().toString());
        root.put("suite_version", record.suiteVersion());
        final ObjectNode scores = root.putObject("scores");
        record.scores().forEach(scores::put);
        if (record.notes() != null) {
            root.put("notes", record.notes());
        }
        if (submission instanceof Submission.Signed signed) {
            root.put("signature", signed.signature());
        }
        try {
            return mapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("failed to encode submission", e);
        }
    }

    private static String participantField(final JsonNode root) {
        final String id = optionalText(root, "participant_id");
        if (id != null) {
            return id;
        }
        final String alias = optionalText(root, "node_id");
        if (alias != null) {
            return alias;
        }
        throw new ValidationException("participant_id", "is required");
    }

    private static String requiredText(final JsonNode root, final String field) {
        final String value = optionalText(root, field);
        if (value == null || value.isBlank()) {
            throw new ValidationException(field, "is required");
        }
        return value;
    }

    private static @Nullable String optionalText(final JsonNode root, final String field) {
        final JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isTextual()) {
            throw new ValidationException(field, "must be a string");
        }
        return node.asText();
    }

    static Instant parseTimestamp(final String value) {
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException withOffset) {
            try {
                return LocalDateTime.parse(value).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException withoutOffset) {
                throw new ValidationException("timestamp", "unparsable ISO-8601 timestamp: " + value, withOffset);
            }
        }
    }

    private static Map<String, Double> parseScores(final @Nullable JsonNode node) {
        if (node == null || node.isNull()) {
            throw new ValidationException("scores", "is required");
        }
        if (!node.isObject()) {
            throw new ValidationException("scores", "must be an object");
        }
        final Map<String, Double> scores = new LinkedHashMap<>();
        final Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            final Map.Entry<String, JsonNode> field = fields.next();
            if (!field.getValue().isNumber()) {
                throw new ValidationException("scores." + field.getKey(), "must be a number");
            }
            scores.put(field.getKey(), field.getValue().doubleValue());
        }
        return scores;
    }
}
