// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.meshnet.core.membership;

import java.time.Duration;
import java.util.Objects;

/**
 * Deployment-wide admission policy.
 *
 * @param threshold minimum {@code overall} score, in [0, 1]; a score equal to it passes
 * @param maxAge    maximum age of a record; a record exactly this old is still fresh
 * @since 0.1.0
 */
public record MembershipPolicy(double threshold, Duration maxAge) {

    /** Default threshold: 0.70. */
    public static final double DEFAULT_THRESHOLD = 0.70;

    /** Default maximum record age: 120 seconds. */
    public static final Duration DEFAULT_MAX_AGE = Duration.ofSeconds(120);

    public MembershipPolicy {
        if (!Double.isFinite(threshold) || threshold < 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("threshold must be in [0, 1], got: " + threshold);
        }
        Objects.requireNonNull(maxAge, "maxAge");
        if (maxAge.isNegative() || maxAge.isZero()) {
            throw new IllegalArgumentException("maxAge must be > 0, got: " + maxAge);
        }
    }

    public static MembershipPolicy defaults() {
        return new MembershipPolicy(DEFAULT_THRESHOLD, DEFAULT_MAX_AGE);
    }
}
