// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.meshnet.controller;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import org.jspecify.annotations.Nullable;

import sh.meshnet.core.model.KeyMaterial;
import sh.meshnet.core.model.MembershipVerdict;
import sh.meshnet.core.types.ParticipantId;

/**
 * What a node agent polls for: its membership in the current epoch and, when
 * ALLOWED, its pre-shared key.
 *
 * <p>Serializes with Jackson to the agent payload
 * {@code {"node_id", "epoch_id", "allowed", "reason", "psk_base64"?}}.
 * {@link #toString()} never prints the key.
 *
 * @param participantId the participant
 * @param epochId       the current epoch
 * @param allowed       whether the participant is ALLOWED
 * @param reason        verdict reason, or {@value #REASON_NO_DECISION}
 * @param pskBase64     base64 key, present only when allowed
 * @since 0.1.0
 */
@JsonPropertyOrder({"node_id", "epoch_id", "allowed", "reason", "psk_base64"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ParticipantConfig(
        @JsonProperty("node_id") ParticipantId participantId,
        @JsonProperty("epoch_id") long epochId,
        @JsonProperty("allowed") boolean allowed,
        @JsonProperty("reason") String reason,
        @JsonProperty("psk_base64") @Nullable String pskBase64) {

    /** Reason reported for a participant the controller has no verdict for. */
    public static final String REASON_NO_DECISION = "no membership decision";

    public ParticipantConfig {
        Objects.requireNonNull(participantId, "participantId");
        Objects.requireNonNull(reason, "reason");
        if (allowed != (pskBase64 != null)) {
            throw new IllegalArgumentException("a key is present exactly when the participant is allowed");
        }
    }

    static ParticipantConfig of(
            final ParticipantId participantId,
            final EpochView view) {
        final MembershipVerdict verdict = view.verdict(participantId).orElse(null);
        if (verdict == null) {
            return new ParticipantConfig(participantId, view.epochId(), false, REASON_NO_DECISION, null);
        }
        final KeyMaterial key = view.keyMaterial(participantId).orElse(null);
        return new ParticipantConfig(participantId, view.epochId(), key != null, verdict.reason(),
                key == null ? null : key.toBase64());
    }

    @Override
    public String toString() {
        return "ParticipantConfig[participantId=" + participantId + ", epochId=" + epochId + ", allowed=" + allowed
                + ", reason=" + reason + ", pskBase64=" + (pskBase64 == null ? "null" : "<redacted>") + "]";
    }
}
