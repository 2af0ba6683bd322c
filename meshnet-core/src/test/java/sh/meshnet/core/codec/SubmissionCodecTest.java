// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.meshnet.core.codec;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Instant;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import sh.meshnet.core.error.ValidationException;
import sh.meshnet.core.model.ScoreRecord;
import sh.meshnet.core.model.Submission;
import sh.meshnet.core.types.ParticipantId;

class SubmissionCodecTest {

    private final SubmissionCodec codec = new SubmissionCodec();

    @Test
    void decodesFullPayload() {
        final String json = """
                {"participant_id": "node-a", "timestamp": "2026-01-05T12:34:56Z",
                 "suite_version": "poc-0.1", "scores": {"overall": 0.92, "refusal": 0.88},
                 "notes": "nightly"}
                """;

        final Submission submission = codec.decode(json);

        assertInstanceOf(Submission.Unsigned.class, submission);
        final ScoreRecord record = submission.scoreRecord();
        assertEquals(ParticipantId.of("node-a"), record.participantId());
        assertEquals(Instant.parse("2026-01-05T12:34:56Z"), record.submittedAt());
        assertEquals("poc-0.1", record.suiteVersion());
        assertEquals(0.92, record.overall());
        assertEquals(0.88, record.scores().get("refusal"));
        assertEquals("nightly", record.notes());
    }

    @Test
    void acceptsNodeIdAliasAndSignature() {
        final String json = """
                {"node_id": "node-b", "timestamp": "2026-01-05T12:34:56+02:00",
                 "suite_version": "poc-0.1", "scores": {"overall": 1}, "signature": "c2ln"}
                """;

        final Submission submission = codec.decode(json);

        assertEquals(ParticipantId.of("node-b"), submission.participantId());
        assertEquals("c2ln", assertInstanceOf(Submission.Signed.class, submission).signature());
        assertEquals(Instant.parse("2026-01-05T10:34:56Z"), submission.scoreRecord().submittedAt());
    }

    @Test
    void timestampWithoutOffsetIsUtc() {
        assertEquals(Instant.parse("2026-01-05T12:34:56Z"), SubmissionCodec.parseTimestamp("2026-01-05T12:34:56"));
    }

    @Test
    void rejectsUnparsableTimestamp() {
        final ValidationException ex =
                assertThrows(ValidationException.class, () -> SubmissionCodec.parseTimestamp("yesterday"));
        assertEquals("timestamp", ex.field());
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "",
        "not json",
        "[1, 2]",
        "{\"timestamp\": \"2026-01-05T12:34:56Z\", \"suite_version\": \"v\", \"scores\": {\"overall\": 0.9}}",
        "{\"participant_id\": \"node-a\", \"suite_version\": \"v\", \"scores\": {\"overall\": 0.9}}",
        "{\"participant_id\": \"node-a\", \"timestamp\": \"2026-01-05T12:34:56Z\", \"scores\": {\"overall\": 0.9}}",
        "{\"participant_id\": \"node-a\", \"timestamp\": \"2026-01-05T12:34:56Z\", \"suite_version\": \"v\"}",
        "{\"participant_id\": \"node-a\", \"timestamp\": \"2026-01-05T12:34:56Z\", \"suite_version\": \"v\", \"scores\": [0.9]}",
        "{\"participant_id\": \"node-a\", \"timestamp\": \"2026-01-05T12:34:56Z\", \"suite_version\": \"v\", \"scores\": {\"overall\": \"high\"}}",
        "{\"participant_id\": \"node-a\", \"timestamp\": \"2026-01-05T12:34:56Z\", \"suite_version\": \"v\", \"scores\": {\"refusal\": 0.9}}",
        "{\"participant_id\": \"node-a\", \"timestamp\": \"2026-01-05T12:34:56Z\", \"suite_version\": \"v\", \"scores\": {\"overall\": 1.5}}",
        "{\"participant_id\": 7, \"timestamp\": \"2026-01-05T12:34:56Z\", \"suite_version\": \"v\", \"scores\": {\"overall\": 0.9}}",
        "{\"participant_id\": \"node a\", \"timestamp\": \"2026-01-05T12:34:56Z\", \"suite_version\": \"v\", \"scores\": {\"overall\": 0.9}}"
    })
    void rejectsMalformedPayloads(final String json) {
        assertThrows(ValidationException.class, () -> codec.decode(json));
    }

    @Test
    void rejectsPayloadAddressedToAnotherParticipant() {
        final String json = """
                {"participant_id": "node-a", "timestamp": "2026-01-05T12:34:56Z",
                 "suite_version": "poc-0.1", "scores": {"overall": 0.92}}
                """;

        final ValidationException ex = assertThrows(ValidationException.class,
                () -> codec.decode(ParticipantId.of("node-b"), json));
        assertEquals("participant_id", ex.field());
        assertEquals(ParticipantId.of("node-a"), codec.decode(ParticipantId.of("node-a"), json).participantId());
    }

    @Test
    void encodedPayloadDecodesToSameRecord() {
        final ScoreRecord record = ScoreRecord.builder(ParticipantId.of("node-c"))
                .submittedAt(Instant.parse("2026-01-05T12:00:00Z"))
                .suiteVersion("poc-0.1")
                .overall(0.4)
                .score("latency", 0.3)
                .build();
        final Submission signed = Submission.signed(record, "sig");

        assertEquals(signed, codec.decode(codec.encode(signed)));
    }
}
