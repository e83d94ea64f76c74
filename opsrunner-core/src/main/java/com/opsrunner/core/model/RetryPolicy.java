package com.opsrunner.core.model;

import java.time.Duration;

/**
 * Configuration for step retry behavior.
 * Immutable and reusable across steps.
 *
 * Attempt indices run 0..maxRetries inclusive: one first try plus up to
 * maxRetries retries. The wait before retry n is backoffUnit * 2^n,
 * capped at maxBackoff when one is configured.
 *
 * Invariants:
 * - maxRetries >= 0
 * - backoffUnit >= 0
 * - maxBackoff, if set, >= 0
 */
public record RetryPolicy(
    int maxRetries,
    Duration backoffUnit,
    Duration maxBackoff
) {
    public static final Duration DEFAULT_BACKOFF_UNIT = Duration.ofSeconds(1);

    public RetryPolicy {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0, got " + maxRetries);
        }
        if (backoffUnit == null || backoffUnit.isNegative()) {
            throw new IllegalArgumentException("backoffUnit must be >= 0");
        }
        if (maxBackoff != null && maxBackoff.isNegative()) {
            throw new IllegalArgumentException("maxBackoff must be >= 0");
        }
    }

    /**
     * Default retry policy: 3 retries, 2^n second backoff, no ceiling.
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(3, DEFAULT_BACKOFF_UNIT, null);
    }

    /**
     * No retry policy: single attempt only.
     */
    public static RetryPolicy noRetry() {
        return new RetryPolicy(0, Duration.ZERO, null);
    }

    /**
     * Copy of this policy with a different retry budget, keeping the backoff shape.
     */
    public RetryPolicy withMaxRetries(int retries) {
        return new RetryPolicy(retries, backoffUnit, maxBackoff);
    }

    /**
     * Compute the wait before the given retry attempt.
     *
     * @param attempt 1-indexed retry number (attempt 0 is the first try and never waits)
     * @return Duration to wait before the attempt
     */
    public Duration computeBackoff(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("Attempt number must be >= 1");
        }

        // unit * 2^attempt, saturating instead of overflowing
        double backoffMs = backoffUnit.toMillis() * Math.pow(2, attempt);
        if (maxBackoff != null) {
            backoffMs = Math.min(backoffMs, maxBackoff.toMillis());
        }
        return Duration.ofMillis((long) Math.min(backoffMs, Long.MAX_VALUE));
    }

    /**
     * Check if another attempt may follow the given one.
     *
     * @param attempt Current attempt index (0 = first try)
     * @return true if a retry can be made
     */
    public boolean hasMoreAttempts(int attempt) {
        return attempt < maxRetries;
    }

    /**
     * Total number of command invocations this policy allows.
     */
    public int maxInvocations() {
        return maxRetries + 1;
    }

    /**
     * Builder for RetryPolicy.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int maxRetries = 3;
        private Duration backoffUnit = DEFAULT_BACKOFF_UNIT;
        private Duration maxBackoff;

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder backoffUnit(Duration backoffUnit) {
            this.backoffUnit = backoffUnit;
            return this;
        }

        public Builder maxBackoff(Duration maxBackoff) {
            this.maxBackoff = maxBackoff;
            return this;
        }

        public RetryPolicy build() {
            return new RetryPolicy(maxRetries, backoffUnit, maxBackoff);
        }
    }
}
