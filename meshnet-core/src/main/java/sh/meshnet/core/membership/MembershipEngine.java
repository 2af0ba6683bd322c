// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.meshnet.core.membership;

import java.util.Map;

import sh.meshnet.core.model.MembershipVerdict;
import sh.meshnet.core.types.ParticipantId;

/**
 * Strategy that turns score records into membership verdicts.
 *
 * <p>
 * Implementations must be pure: the result depends only on the arguments, and
 * every id in {@link EvaluationInput#knownIds()} gets exactly one verdict
 * stamped with {@link EvaluationInput#epochId()}. A failure on one
 * participant's record must not prevent the others from being evaluated.
 *
 * @see ThresholdMembershipEngine
 * @since 0.1.0
 */
@FunctionalInterface
public interface MembershipEngine {

    Map<ParticipantId, MembershipVerdict> evaluate(EvaluationInput input, MembershipPolicy policy);
}
