// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.meshnet.core.membership;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.meshnet.core.model.MembershipVerdict;
import sh.meshnet.core.model.ScoreRecord;
import sh.meshnet.core.types.ParticipantId;

/**
 * Admits participants whose latest record is fresh and scores at least the threshold.
 *
 * <p>
 * Rules, applied in order per participant:
 * <ol>
 * <li>no record: DENIED {@value #REASON_NO_BENCHMARK}</li>
 * <li>{@code now - submittedAt > maxAge}: DENIED {@value #REASON_STALE}</li>
 * <li>{@code overall < threshold}: DENIED {@value #REASON_BELOW_THRESHOLD}</li>
 * <li>otherwise ALLOWED {@value #REASON_ALLOWED}</li>
 * </ol>
 *
 * <p>
 * A record stamped in the future (submitter clock ahead of ours) counts as
 * fresh and is reported with a zero age. A record that cannot be evaluated is
 * treated as missing.
 *
 * @since 0.1.0
 */
public final class ThresholdMembershipEngine implements MembershipEngine {

    public static final String REASON_NO_BENCHMARK = "no benchmark submitted";
    public static final String REASON_STALE = "benchmark stale";
    public static final String REASON_BELOW_THRESHOLD = "score below threshold";
    public static final String REASON_ALLOWED = "score and freshness satisfied";

    private static final Logger log = LoggerFactory.getLogger(ThresholdMembershipEngine.class);

    @Override
    public Map<ParticipantId, MembershipVerdict> evaluate(final EvaluationInput input, final MembershipPolicy policy) {
        Objects.requireNonNull(input, "input");
        Objects.requireNonNull(policy, "policy");

        final Map<ParticipantId, MembershipVerdict> verdicts = new HashMap<>();
        for (ParticipantId id : input.knownIds()) {
            MembershipVerdict verdict;
            try {
                verdict = evaluateOne(id, input.records().get(id), input.now(), input.epochId(), policy);
            } catch (RuntimeException e) {
                log.warn("Record for {} could not be evaluated, treating as missing", id, e);
                verdict = MembershipVerdict.denied(id, REASON_NO_BENCHMARK, input.now(), input.epochId(), null);
            }
            verdicts.put(id, verdict);
        }
        return verdicts;
    }

    static MembershipVerdict evaluateOne(
            final ParticipantId id,
            final ScoreRecord record,
            final Instant now,
            final long epochId,
            final MembershipPolicy policy) {
        if (record == null) {
            return MembershipVerdict.denied(id, REASON_NO_BENCHMARK, now, epochId, null);
        }
        if (!id.equals(record.participantId())) {
            throw new IllegalStateException("record stored under " + id + " belongs to " + record.participantId());
        }

        Duration age = Duration.between(record.submittedAt(), now);
        if (age.isNegative()) {
            age = Duration.ZERO;
        }

        if (age.compareTo(policy.maxAge()) > 0) {
            return MembershipVerdict.denied(id, REASON_STALE, now, epochId, age);
        }
        if (record.overall() < policy.threshold()) {
            return MembershipVerdict.denied(id, REASON_BELOW_THRESHOLD, now, epochId, age);
        }
        return MembershipVerdict.allowed(id, REASON_ALLOWED, now, epochId, age);
    }
}
