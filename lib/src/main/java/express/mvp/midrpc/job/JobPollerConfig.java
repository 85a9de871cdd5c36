package express.mvp.midrpc.job;

import java.time.Duration;
import java.util.Objects;

/**
 * Poll interval schedule for {@link JobPoller}.
 *
 * <p>The first wait is {@code initialInterval}; each following wait is multiplied by {@code
 * multiplier} up to {@code maxInterval}. Defaults: 500ms, 10s, 1.5.
 */
public final class JobPollerConfig {

    private static final JobPollerConfig DEFAULTS = builder().build();

    private final Duration initialInterval;
    private final Duration maxInterval;
    private final double multiplier;

    private JobPollerConfig(Builder builder) {
        this.initialInterval = builder.initialInterval;
        this.maxInterval = builder.maxInterval;
        this.multiplier = builder.multiplier;
    }

    public static JobPollerConfig defaults() {
        return DEFAULTS;
    }

    public Duration getInitialInterval() {
        return initialInterval;
    }

    public Duration getMaxInterval() {
        return maxInterval;
    }

    public double getMultiplier() {
        return multiplier;
    }

    /**
     * Returns the interval following {@code current}.
     *
     * @param current the interval just used
     * @return the next interval, capped
     */
    public Duration next(Duration current) {
        long nanos = (long) (current.toNanos() * multiplier);
        return nanos > maxInterval.toNanos() ? maxInterval : Duration.ofNanos(nanos);
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link JobPollerConfig}. */
    public static final class Builder {
        private Duration initialInterval = Duration.ofMillis(500);
        private Duration maxInterval = Duration.ofSeconds(10);
        private double multiplier = 1.5;

        public Builder initialInterval(Duration initialInterval) {
            this.initialInterval = Objects.requireNonNull(initialInterval, "initialInterval");
            return this;
        }

        public Builder maxInterval(Duration maxInterval) {
            this.maxInterval = Objects.requireNonNull(maxInterval, "maxInterval");
            return this;
        }

        public Builder multiplier(double multiplier) {
            this.multiplier = multiplier;
            return this;
        }

        public JobPollerConfig build() {
            if (initialInterval.isNegative() || initialInterval.isZero()) {
                throw new IllegalArgumentException("initialInterval must be positive");
            }
            if (maxInterval.compareTo(initialInterval) < 0) {
                throw new IllegalArgumentException("maxInterval must be >= initialInterval");
            }
            if (multiplier < 1.0) {
                throw new IllegalArgumentException("multiplier must be >= 1.0");
            }
            return new JobPollerConfig(this);
        }
    }
}
