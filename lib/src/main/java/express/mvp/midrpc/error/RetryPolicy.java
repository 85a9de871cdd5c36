package express.mvp.midrpc.error;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Retry budget, transient-failure classifier and backoff schedule for middleware calls.
 *
 * <p>Retry {@code n} (0-based) waits {@code initialDelay * multiplier^n}, capped at {@code
 * maxDelay} and then spread by a random factor in {@code ±jitterFactor} so that clients that
 * failed together do not retry together.
 *
 * <h2>Defaults</h2>
 *
 * <table border="1">
 *   <caption>Retry policy defaults</caption>
 *   <tr><th>Parameter</th><th>Default</th></tr>
 *   <tr><td>maxRetries</td><td>3 (4 attempts)</td></tr>
 *   <tr><td>initialDelay</td><td>2s</td></tr>
 *   <tr><td>maxDelay</td><td>30s</td></tr>
 *   <tr><td>multiplier</td><td>2.0</td></tr>
 *   <tr><td>jitterFactor</td><td>0.25</td></tr>
 *   <tr><td>classifier</td><td>{@link RetryClassifier#never()}</td></tr>
 * </table>
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * RetryPolicy policy = RetryPolicy.defaults(new SocketRetryClassifier());
 * RetryContext attempts = new RetryContext("pool.query", policy.getMaxAttempts());
 * while (true) {
 *     attempts.beginAttempt();
 *     try {
 *         return client.call(ctx, "pool.query", null);
 *     } catch (RuntimeException e) {
 *         attempts.failed(e, policy.isRetriable(e));
 *         if (!policy.shouldRetry(attempts)) {
 *             throw e;
 *         }
 *         ctx.sleep(Duration.ofMillis(policy.calculateDelay(attempts)));
 *     }
 * }
 * }</pre>
 */
public final class RetryPolicy {

    /** Retries after the first attempt when none are configured. */
    public static final int DEFAULT_MAX_RETRIES = 3;

    private final int maxRetries;
    private final Duration initialDelay;
    private final Duration maxDelay;
    private final double multiplier;
    private final double jitterFactor;
    private final RetryClassifier classifier;

    private RetryPolicy(Builder b) {
        this.maxRetries = b.maxRetries;
        this.initialDelay = b.initialDelay;
        this.maxDelay = b.maxDelay;
        this.multiplier = b.multiplier;
        this.jitterFactor = b.jitterFactor;
        this.classifier = b.classifier;
    }

    /**
     * Default schedule and budget with the given classifier.
     *
     * @param classifier decides which failures are transient
     * @return the policy
     */
    public static RetryPolicy defaults(RetryClassifier classifier) {
        return builder().classifier(classifier).build();
    }

    /** A policy allowing exactly one attempt. */
    public static RetryPolicy noRetry() {
        return builder().maxRetries(0).build();
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    /** Attempt budget, the first attempt included. */
    public int getMaxAttempts() {
        return maxRetries + 1;
    }

    public boolean isRetriable(Throwable error) {
        return classifier.isRetriable(error);
    }

    /**
     * Whether the call recorded in {@code attempts} may be tried again.
     *
     * @param attempts the call's attempt ledger
     * @return true if its last failure was transient and budget is left
     */
    public boolean shouldRetry(RetryContext attempts) {
        return attempts.lastFailureTransient() && attempts.budgetLeft();
    }

    /**
     * Picks the backoff before the next attempt of a call and notes it in the ledger.
     *
     * @param attempts the call's attempt ledger
     * @return backoff in milliseconds
     */
    public long calculateDelay(RetryContext attempts) {
        long millis = delayFor(attempts.retries());
        attempts.backoffPlanned(millis);
        return millis;
    }

    /**
     * Backoff before retry {@code retryIndex}, jitter applied.
     *
     * @param retryIndex retries already made (0 for the first retry)
     * @return backoff in milliseconds, never negative
     */
    public long delayFor(int retryIndex) {
        long cap = maxDelay.toMillis();
        double base = initialDelay.toMillis();
        for (int i = 0; i < retryIndex && base < cap; i++) {
            base *= multiplier;
        }
        long delay = (long) Math.min(base, cap);
        if (jitterFactor == 0 || delay == 0) {
            return delay;
        }
        double spread = ThreadLocalRandom.current().nextDouble(-jitterFactor, jitterFactor);
        return Math.max(0, Math.round(delay * (1 + spread)));
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "RetryPolicy[maxRetries=" + maxRetries + ", initialDelay=" + initialDelay
                + ", maxDelay=" + maxDelay + ", multiplier=" + multiplier + "]";
    }

    /** Builder for {@link RetryPolicy}. */
    public static final class Builder {
        private int maxRetries = DEFAULT_MAX_RETRIES;
        private Duration initialDelay = Duration.ofSeconds(2);
        private Duration maxDelay = Duration.ofSeconds(30);
        private double multiplier = 2.0;
        private double jitterFactor = 0.25;
        private RetryClassifier classifier = RetryClassifier.never();

        private Builder() {}

        /**
         * Retries after the first attempt. {@code 0} disables retry; a negative value selects
         * {@link #DEFAULT_MAX_RETRIES}.
         *
         * @param maxRetries retry budget
         * @return this builder
         */
        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries < 0 ? DEFAULT_MAX_RETRIES : maxRetries;
            return this;
        }

        public Builder initialDelay(Duration initialDelay) {
            this.initialDelay = Objects.requireNonNull(initialDelay, "initialDelay");
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            this.maxDelay = Objects.requireNonNull(maxDelay, "maxDelay");
            return this;
        }

        /**
         * Growth factor between consecutive backoffs; {@code 1.0} keeps the delay fixed.
         *
         * @param multiplier factor, at least 1.0
         * @return this builder
         */
        public Builder backoffMultiplier(double multiplier) {
            if (!(multiplier >= 1.0)) {
                throw new IllegalArgumentException(
                        "backoff multiplier must be at least 1.0, got " + multiplier);
            }
            this.multiplier = multiplier;
            return this;
        }

        /**
         * Relative random spread applied to each backoff.
         *
         * @param jitterFactor spread between 0.0 and 1.0
         * @return this builder
         */
        public Builder jitterFactor(double jitterFactor) {
            if (!(jitterFactor >= 0 && jitterFactor <= 1.0)) {
                throw new IllegalArgumentException(
                        "jitter factor must be within [0, 1], got " + jitterFactor);
            }
            this.jitterFactor = jitterFactor;
            return this;
        }

        public Builder classifier(RetryClassifier classifier) {
            this.classifier = Objects.requireNonNull(classifier, "classifier");
            return this;
        }

        public RetryPolicy build() {
            if (initialDelay.isNegative() || maxDelay.compareTo(initialDelay) < 0) {
                throw new IllegalArgumentException(
                        "delays must satisfy 0 <= initialDelay <= maxDelay, got " + initialDelay
                                + " and " + maxDelay);
            }
            return new RetryPolicy(this);
        }
    }
}
