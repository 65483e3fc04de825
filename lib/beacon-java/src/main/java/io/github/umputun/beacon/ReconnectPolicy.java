package io.github.umputun.beacon;

import io.github.umputun.beacon.errors.BeaconException;
import io.github.umputun.beacon.errors.ConnectionError;
import io.github.umputun.beacon.errors.HttpStatusError;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Decides whether a failed poll is retried and how long to wait before the next attempt.
 * Use {@link #exponential()}, {@link #linear()}, {@link #none()} or {@link #builder(Kind)}.
 */
public final class ReconnectPolicy {

    /**
     * Shape of the backoff curve.
     */
    public enum Kind {
        NONE,
        LINEAR,
        EXPONENTIAL
    }

    public static final Duration DEFAULT_BASE_DELAY = Duration.ofSeconds(2);
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(150);
    public static final Duration DEFAULT_JITTER = Duration.ofSeconds(1);
    public static final int DEFAULT_RETRY_LIMIT = 6;

    private final Kind kind;
    private final Duration baseDelay;
    private final Duration maxDelay;
    private final Duration jitter;
    private final int retryLimit;
    private final DoubleSupplier random;

    private ReconnectPolicy(Builder builder) {
        this.kind = builder.kind;
        this.baseDelay = builder.baseDelay;
        this.maxDelay = builder.maxDelay;
        this.jitter = builder.jitter;
        this.retryLimit = builder.retryLimit;
        this.random = builder.random;
    }

    /**
     * Returns a policy that never retries.
     *
     * @return the policy
     */
    public static ReconnectPolicy none() {
        return builder(Kind.NONE).build();
    }

    /**
     * Returns an exponential policy with default settings.
     *
     * @return the policy
     */
    public static ReconnectPolicy exponential() {
        return builder(Kind.EXPONENTIAL).build();
    }

    /**
     * Returns a linear policy with default settings.
     *
     * @return the policy
     */
    public static ReconnectPolicy linear() {
        return builder(Kind.LINEAR).build();
    }

    /**
     * Creates a builder for the given kind.
     *
     * @param kind the backoff shape
     * @return a new builder
     */
    public static Builder builder(Kind kind) {
        return new Builder(kind);
    }

    /**
     * Classifies a poll failure. Connection failures, 5xx and 429 responses are retryable;
     * everything else, including cancellations and decode failures, is not.
     *
     * @param error the failure
     * @return true if the poll should be retried
     */
    public boolean shouldRetry(Throwable error) {
        if (kind == Kind.NONE) {
            return false;
        }
        if (error instanceof ConnectionError) {
            return true;
        }
        if (error instanceof HttpStatusError) {
            int status = ((HttpStatusError) error).getStatusCode();
            return status >= 500 || status == 429;
        }
        return false;
    }

    /**
     * Checks if another attempt is allowed.
     *
     * @param attempt number of consecutive failed attempts so far, starting at 0
     * @return true if the attempt is under the retry limit
     */
    public boolean canRetry(int attempt) {
        return kind != Kind.NONE && attempt < retryLimit;
    }

    /**
     * Computes the delay before the given attempt.
     *
     * @param attempt zero-based attempt number
     * @return the delay including jitter
     */
    public Duration nextDelay(int attempt) {
        if (kind == Kind.NONE) {
            return Duration.ZERO;
        }
        long baseMs = baseDelay.toMillis();
        long delayMs;
        if (kind == Kind.LINEAR) {
            delayMs = baseMs;
        } else {
            int shift = Math.min(Math.max(attempt, 0), 30);
            // saturate instead of shifting bits out of a large base
            delayMs = baseMs > (Long.MAX_VALUE >> shift) ? Long.MAX_VALUE : baseMs << shift;
        }
        delayMs = Math.min(delayMs, maxDelay.toMillis());
        long jitterMs = (long) (random.getAsDouble() * jitter.toMillis());
        if (delayMs > Long.MAX_VALUE - jitterMs) {
            return Duration.ofMillis(Long.MAX_VALUE);
        }
        return Duration.ofMillis(delayMs + jitterMs);
    }

    public Kind getKind() {
        return kind;
    }

    public Duration getBaseDelay() {
        return baseDelay;
    }

    public Duration getMaxDelay() {
        return maxDelay;
    }

    public Duration getJitter() {
        return jitter;
    }

    public int getRetryLimit() {
        return retryLimit;
    }

    @Override
    public String toString() {
        return "ReconnectPolicy{" +
                "kind=" + kind +
                ", baseDelay=" + baseDelay +
                ", maxDelay=" + maxDelay +
                ", jitter=" + jitter +
                ", retryLimit=" + retryLimit +
                '}';
    }

    /**
     * Builder for ReconnectPolicy.
     */
    public static final class Builder {
        private final Kind kind;
        private Duration baseDelay = DEFAULT_BASE_DELAY;
        private Duration maxDelay = DEFAULT_MAX_DELAY;
        private Duration jitter = DEFAULT_JITTER;
        private int retryLimit = DEFAULT_RETRY_LIMIT;
        private DoubleSupplier random = () -> ThreadLocalRandom.current().nextDouble();

        private Builder(Kind kind) {
            this.kind = Objects.requireNonNull(kind, "kind cannot be null");
        }

        /**
         * Sets the delay of the first retry (and every retry for LINEAR).
         *
         * @param baseDelay the delay
         * @return this builder
         * @throws BeaconException if baseDelay is negative
         */
        public Builder baseDelay(Duration baseDelay) {
            this.baseDelay = requireNotNegative(baseDelay, "baseDelay");
            return this;
        }

        /**
         * Sets the upper bound of the delay before jitter.
         *
         * @param maxDelay the cap
         * @return this builder
         * @throws BeaconException if maxDelay is negative
         */
        public Builder maxDelay(Duration maxDelay) {
            this.maxDelay = requireNotNegative(maxDelay, "maxDelay");
            return this;
        }

        /**
         * Sets the upper bound of the random extra delay.
         *
         * @param jitter the jitter range, zero disables it
         * @return this builder
         * @throws BeaconException if jitter is negative
         */
        public Builder jitter(Duration jitter) {
            this.jitter = requireNotNegative(jitter, "jitter");
            return this;
        }

        /**
         * Sets the number of consecutive failed attempts after which the loop gives up.
         *
         * @param retryLimit the limit
         * @return this builder
         * @throws BeaconException if retryLimit is negative
         */
        public Builder retryLimit(int retryLimit) {
            if (retryLimit < 0) {
                throw new BeaconException("retryLimit cannot be negative");
            }
            this.retryLimit = retryLimit;
            return this;
        }

        /**
         * Sets the source of jitter values in [0, 1).
         *
         * @param random the supplier
         * @return this builder
         */
        public Builder random(DoubleSupplier random) {
            this.random = Objects.requireNonNull(random, "random cannot be null");
            return this;
        }

        /**
         * Builds the policy.
         *
         * @return the policy
         * @throws BeaconException if maxDelay is below baseDelay
         */
        public ReconnectPolicy build() {
            if (maxDelay.compareTo(baseDelay) < 0) {
                throw new BeaconException("maxDelay cannot be less than baseDelay");
            }
            return new ReconnectPolicy(this);
        }

        private static Duration requireNotNegative(Duration value, String name) {
            Objects.requireNonNull(value, name + " cannot be null");
            if (value.isNegative()) {
                throw new BeaconException(name + " cannot be negative");
            }
            return value;
        }
    }
}
