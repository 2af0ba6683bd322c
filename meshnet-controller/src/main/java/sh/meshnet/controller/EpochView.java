// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.meshnet.controller;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import sh.meshnet.core.model.KeyMaterial;
import sh.meshnet.core.model.MembershipVerdict;
import sh.meshnet.core.model.Snapshot;
import sh.meshnet.core.types.ParticipantId;

/**
 * A committed epoch as readers see it: the snapshot plus the keys derived for
 * its ALLOWED participants.
 *
 * <p>
 * Immutable. The epoch secret is not part of the view.
 *
 * @param snapshot    the epoch's snapshot
 * @param keyMaterial derived keys, one per ALLOWED participant
 * @since 0.1.0
 */
public record EpochView(Snapshot snapshot, Map<ParticipantId, KeyMaterial> keyMaterial) {

    public EpochView {
        Objects.requireNonNull(snapshot, "snapshot");
        keyMaterial = Map.copyOf(Objects.requireNonNull(keyMaterial, "keyMaterial"));
        for (Map.Entry<ParticipantId, KeyMaterial> entry : keyMaterial.entrySet()) {
            final KeyMaterial key = entry.getValue();
            if (!entry.getKey().equals(key.participantId()) || key.epochId() != snapshot.epochId()) {
                throw new IllegalArgumentException("key material for " + entry.getKey() + " does not belong to epoch "
                        + snapshot.epochId());
            }
            final boolean allowed = snapshot.verdict(entry.getKey()).map(MembershipVerdict::isAllowed).orElse(false);
            if (!allowed) {
                throw new IllegalArgumentException("key material issued to non-ALLOWED participant " + entry.getKey());
            }
        }
    }

    public long epochId() {
        return snapshot.epochId();
    }

    public Instant expiresAt() {
        return snapshot.expiresAt();
    }

    public Optional<MembershipVerdict> verdict(final ParticipantId participantId) {
        return snapshot.verdict(participantId);
    }

    public Optional<KeyMaterial> keyMaterial(final ParticipantId participantId) {
        return Optional.ofNullable(keyMaterial.get(participantId));
    }
}
