package express.mvp.midrpc;

import express.mvp.midrpc.error.RetryPolicy;
import express.mvp.midrpc.ratelimit.TokenBucket;
import java.util.Properties;

/**
 * Settings of the admission-control and retry layer that wraps every transport.
 *
 * <h2>Configuration Options</h2>
 *
 * <table border="1">
 *   <caption>Client parameters</caption>
 *   <tr><th>Parameter</th><th>Property</th><th>Default</th><th>Description</th></tr>
 *   <tr><td>rateLimit</td><td>midrpc.client.rate-limit</td><td>300</td>
 *       <td>Calls per minute; {@code <= 0} selects the default</td></tr>
 *   <tr><td>maxRetries</td><td>midrpc.client.max-retries</td><td>3</td>
 *       <td>Retries after the first attempt; 0 disables, negative selects the default</td></tr>
 * </table>
 */
public final class ClientConfig {

    private final int rateLimit;
    private final int maxRetries;

    private ClientConfig(Builder b) {
        this.rateLimit = b.rateLimit <= 0 ? TokenBucket.DEFAULT_CALLS_PER_MINUTE : b.rateLimit;
        this.maxRetries = b.maxRetries < 0 ? RetryPolicy.DEFAULT_MAX_RETRIES : b.maxRetries;
    }

    public static ClientConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Loads settings from {@code midrpc.client.*} properties. Absent keys keep their defaults.
     *
     * @param props the properties
     * @return the configuration
     * @throws IllegalArgumentException if a value is not an integer
     */
    public static ClientConfig fromProperties(Properties props) {
        Builder b = builder();
        String v = props.getProperty("midrpc.client.rate-limit");
        if (v != null) {
            b.rateLimit(parseInt("midrpc.client.rate-limit", v));
        }
        v = props.getProperty("midrpc.client.max-retries");
        if (v != null) {
            b.maxRetries(parseInt("midrpc.client.max-retries", v));
        }
        return b.build();
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer, got \"" + value + "\"", e);
        }
    }

    /** Calls per minute admitted by the token bucket. */
    public int getRateLimit() {
        return rateLimit;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    @Override
    public String toString() {
        return "ClientConfig[rateLimit=" + rateLimit + "/min, maxRetries=" + maxRetries + "]";
    }

    /** Builder for {@link ClientConfig}. */
    public static final class Builder {
        private int rateLimit;
        private int maxRetries = -1;

        private Builder() {}

        public Builder rateLimit(int callsPerMinute) {
            this.rateLimit = callsPerMinute;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public ClientConfig build() {
            return new ClientConfig(this);
        }
    }
}
