// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.meshnet.controller;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.jspecify.annotations.Nullable;

import sh.meshnet.core.crypto.PskDeriver;
import sh.meshnet.core.error.PreconditionViolationException;
import sh.meshnet.core.membership.MembershipPolicy;
import sh.meshnet.core.types.ParticipantId;

/**
 * Controller configuration, fixed for the lifetime of a {@link MeshController}.
 *
 * <ul>
 *   <li>{@code threshold} - minimum overall score (default: 0.70)</li>
 *   <li>{@code maxAge} - maximum record age (default: 120s)</li>
 *   <li>{@code epochDuration} - rotation interval (default: 60s)</li>
 *   <li>{@code tickInterval} - scheduler tick (default: {@code min(epochDuration, 1s)})</li>
 *   <li>{@code secretLength} - epoch secret length in bytes (default: 32)</li>
 *   <li>{@code keyLength} - derived key length in bytes (default: 32)</li>
 *   <li>{@code knownParticipants} - ids that get a verdict even before submitting (default: none)</li>
 *   <li>{@code statusFile} - where to write the status document, or null to skip it</li>
 * </ul>
 *
 * <p><strong>Example:</strong>
 * <pre>{@code
 * ControllerConfig config = ControllerConfig.builder()
 *     .threshold(0.8)
 *     .epochDuration(Duration.ofSeconds(30))
 *     .knownParticipants("node-a", "node-b", "node-c")
 *     .build();
 * }</pre>
 *
 * @param threshold         minimum overall score, in [0, 1]
 * @param maxAge            maximum record age (must be &gt; 0)
 * @param epochDuration     rotation interval (must be &gt; 0)
 * @param tickInterval      scheduler tick (must be &gt; 0 and not longer than epochDuration)
 * @param secretLength      secret length in bytes
 * @param keyLength         derived key length in bytes
 * @param knownParticipants configured participants
 * @param statusFile        optional status document path
 * @since 0.1.0
 */
public record ControllerConfig(
        double threshold,
        Duration maxAge,
        Duration epochDuration,
        Duration tickInterval,
        int secretLength,
        int keyLength,
        Set<ParticipantId> knownParticipants,
        @Nullable Path statusFile) {

    /** Default rotation interval: 60 seconds. */
    public static final Duration DEFAULT_EPOCH_DURATION = Duration.ofSeconds(60);

    /** Upper bound of the default tick: 1 second. */
    public static final Duration MAX_DEFAULT_TICK = Duration.ofSeconds(1);

    /** Default secret length: 32 bytes. */
    public static final int DEFAULT_SECRET_LENGTH = 32;

    /** Default key length: 32 bytes. */
    public static final int DEFAULT_KEY_LENGTH = 32;

    public static final String ENV_THRESHOLD = "THRESHOLD";
    public static final String ENV_MAX_BENCHMARK_AGE = "MAX_BENCHMARK_AGE";
    public static final String ENV_EPOCH_SECONDS = "EPOCH_SECONDS";
    public static final String ENV_TICK_MILLIS = "TICK_MILLIS";
    public static final String ENV_SECRET_LENGTH = "SECRET_LENGTH";
    public static final String ENV_KEY_LENGTH = "KEY_LENGTH";
    public static final String ENV_NODE_IDS = "NODE_IDS";
    public static final String ENV_STATUS_FILE = "STATUS_FILE";

    /**
     * Canonical constructor with validation.
     *
     * @throws IllegalArgumentException       if a policy or timing value is invalid
     * @throws PreconditionViolationException if the secret or key length is out of range
     */
    public ControllerConfig {
        // Delegates threshold/maxAge checks
        new MembershipPolicy(threshold, maxAge);
        Objects.requireNonNull(epochDuration, "epochDuration");
        if (epochDuration.isNegative() || epochDuration.isZero()) {
            throw new IllegalArgumentException("epochDuration must be > 0, got: " + epochDuration);
        }
        if (tickInterval == null) {
            tickInterval = defaultTick(epochDuration);
        }
        if (tickInterval.isNegative() || tickInterval.isZero()) {
            throw new IllegalArgumentException("tickInterval must be > 0, got: " + tickInterval);
        }
        if (tickInterval.compareTo(epochDuration) > 0) {
            throw new IllegalArgumentException(
                    "tickInterval must be <= epochDuration, got: " + tickInterval + " > " + epochDuration);
        }
        // Delegates secret/key length checks
        new PskDeriver(secretLength, keyLength);
        knownParticipants = Set.copyOf(Objects.requireNonNull(knownParticipants, "knownParticipants"));
    }

    /**
     * @return the admission policy derived from {@code threshold} and {@code maxAge}
     */
    public MembershipPolicy policy() {
        return new MembershipPolicy(threshold, maxAge);
    }

    /**
     * Returns the default configuration.
     *
     * @return 0.70 threshold, 120s max age, 60s epochs, 1s tick, 32-byte secret and keys
     */
    public static ControllerConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads the process environment.
     *
     * @return configuration with defaults for every unset variable
     * @see #fromEnvironment(Map)
     */
    public static ControllerConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Reads configuration from environment-style variables.
     *
     * <p>Recognized: {@value #ENV_THRESHOLD}, {@value #ENV_MAX_BENCHMARK_AGE} (seconds),
     * {@value #ENV_EPOCH_SECONDS}, {@value #ENV_TICK_MILLIS}, {@value #ENV_SECRET_LENGTH},
     * {@value #ENV_KEY_LENGTH}, {@value #ENV_NODE_IDS} (comma separated) and
     * {@value #ENV_STATUS_FILE}. Blank values are treated as unset.
     *
     * @param env variables
     * @return the configuration
     * @throws IllegalArgumentException if a value cannot be parsed or is invalid
     */
    public static ControllerConfig fromEnvironment(final Map<String, String> env) {
        Objects.requireNonNull(env, "env");
        final Builder builder = builder();
        final String threshold = value(env, ENV_THRESHOLD);
        if (threshold != null) {
            builder.threshold(parseDouble(ENV_THRESHOLD, threshold));
        }
        final String maxAge = value(env, ENV_MAX_BENCHMARK_AGE);
        if (maxAge != null) {
            builder.maxAge(Duration.ofSeconds(parseLong(ENV_MAX_BENCHMARK_AGE, maxAge)));
        }
        final String epochSeconds = value(env, ENV_EPOCH_SECONDS);
        if (epochSeconds != null) {
            builder.epochDuration(Duration.ofSeconds(parseLong(ENV_EPOCH_SECONDS, epochSeconds)));
        }
        final String tickMillis = value(env, ENV_TICK_MILLIS);
        if (tickMillis != null) {
            builder.tickInterval(Duration.ofMillis(parseLong(ENV_TICK_MILLIS, tickMillis)));
        }
        final String secretLength = value(env, ENV_SECRET_LENGTH);
        if (secretLength != null) {
            builder.secretLength(parseInt(ENV_SECRET_LENGTH, secretLength));
        }
        final String keyLength = value(env, ENV_KEY_LENGTH);
        if (keyLength != null) {
            builder.keyLength(parseInt(ENV_KEY_LENGTH, keyLength));
        }
        final String nodeIds = value(env, ENV_NODE_IDS);
        if (nodeIds != null) {
            builder.knownParticipants(Arrays.stream(nodeIds.split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .toArray(String[]::new));
        }
        final String statusFile = value(env, ENV_STATUS_FILE);
        if (statusFile != null) {
            builder.statusFile(Path.of(statusFile));
        }
        return builder.build();
    }

    private static @Nullable String value(final Map<String, String> env, final String name) {
        final String value = env.get(name);
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static double parseDouble(final String name, final String value) {
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " is not a number: " + value, e);
        }
    }

    private static int parseInt(final String name, final String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " is not a 32-bit integer: " + value, e);
        }
    }

    private static long parseLong(final String name, final String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " is not an integer: " + value, e);
        }
    }

    private static Duration defaultTick(final Duration epochDuration) {
        return epochDuration.compareTo(MAX_DEFAULT_TICK) < 0 ? epochDuration : MAX_DEFAULT_TICK;
    }

    /**
     * Builder for {@link ControllerConfig}; every value starts at its default.
     */
    public static final class Builder {
        private double threshold = MembershipPolicy.DEFAULT_THRESHOLD;
        private Duration maxAge = MembershipPolicy.DEFAULT_MAX_AGE;
        private Duration epochDuration = DEFAULT_EPOCH_DURATION;
        private @Nullable Duration tickInterval;
        private int secretLength = DEFAULT_SECRET_LENGTH;
        private int keyLength = DEFAULT_KEY_LENGTH;
        private final Set<ParticipantId> knownParticipants = new LinkedHashSet<>();
        private @Nullable Path statusFile;

        private Builder() {}

        public Builder threshold(final double threshold) {
            this.threshold = threshold;
            return this;
        }

        public Builder maxAge(final Duration maxAge) {
            this.maxAge = maxAge;
            return this;
        }

        public Builder epochDuration(final Duration epochDuration) {
            this.epochDuration = epochDuration;
            return this;
        }

        /**
         * Sets the scheduler tick; when unset it defaults to {@code min(epochDuration, 1s)}.
         *
         * @param tickInterval tick interval
         * @return this builder
         */
        public Builder tickInterval(final Duration tickInterval) {
            this.tickInterval = tickInterval;
            return this;
        }

        public Builder secretLength(final int secretLength) {
            this.secretLength = secretLength;
            return this;
        }

        public Builder keyLength(final int keyLength) {
            this.keyLength = keyLength;
            return this;
        }

        public Builder knownParticipants(final String... ids) {
            for (String id : ids) {
                knownParticipants.add(ParticipantId.of(id));
            }
            return this;
        }

        public Builder knownParticipants(final Set<ParticipantId> ids) {
            knownParticipants.addAll(ids);
            return this;
        }

        public Builder statusFile(final @Nullable Path statusFile) {
            this.statusFile = statusFile;
            return this;
        }

        /**
         * @return new immutable {@link ControllerConfig}
         * @throws IllegalArgumentException       if a policy or timing value is invalid
         * @throws PreconditionViolationException if the secret or key length is out of range
         */
        public ControllerConfig build() {
            return new ControllerConfig(threshold, maxAge, epochDuration, tickInterval,
                    secretLength, keyLength, knownParticipants, statusFile);
        }
    }
}
