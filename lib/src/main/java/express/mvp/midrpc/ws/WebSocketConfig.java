package express.mvp.midrpc.ws;

import express.mvp.midrpc.MiddlewareClient;
import java.time.Duration;
import java.util.Objects;
import java.util.Properties;

/**
 * Configuration for the persistent-socket transport.
 *
 * <h2>Configuration Options</h2>
 *
 * <table border="1">
 *   <caption>WebSocket transport parameters</caption>
 *   <tr><th>Parameter</th><th>Default</th><th>Description</th></tr>
 *   <tr><td>host</td><td>(required)</td><td>Middleware host</td></tr>
 *   <tr><td>username</td><td>(required)</td><td>API key owner</td></tr>
 *   <tr><td>apiKey</td><td>(required)</td><td>API key</td></tr>
 *   <tr><td>fallback</td><td>(required)</td><td>Client for version probing and file reads/removals</td></tr>
 *   <tr><td>port</td><td>443</td><td>HTTPS port</td></tr>
 *   <tr><td>tls</td><td>true</td><td>{@code wss://} when true, {@code ws://} otherwise</td></tr>
 *   <tr><td>insecureSkipVerify</td><td>false</td><td>Accept any server certificate</td></tr>
 *   <tr><td>maxConcurrent</td><td>20</td><td>Requests in flight at once</td></tr>
 *   <tr><td>connectTimeout</td><td>30s</td><td>Dial and handshake timeout</td></tr>
 *   <tr><td>pingInterval</td><td>30s</td><td>Ping interval, zero disables</td></tr>
 *   <tr><td>pingTimeout</td><td>10s</td><td>Time allowed for a pong</td></tr>
 *   <tr><td>reconnectTimeout</td><td>5m</td><td>How long a job waiter tolerates an outage</td></tr>
 *   <tr><td>mailboxCapacity</td><td>100</td><td>Owner thread mailbox size</td></tr>
 *   <tr><td>jobTimeout</td><td>30m</td><td>Job wait when the call context has no deadline</td></tr>
 * </table>
 */
public final class WebSocketConfig {

    public static final int DEFAULT_PORT = 443;
    public static final int DEFAULT_MAX_CONCURRENT = 20;
    public static final int DEFAULT_MAILBOX_CAPACITY = 100;

    private final String host;
    private final int port;
    private final String username;
    private final String apiKey;
    private final boolean tls;
    private final boolean insecureSkipVerify;
    private final int maxConcurrent;
    private final Duration connectTimeout;
    private final Duration pingInterval;
    private final Duration pingTimeout;
    private final Duration reconnectTimeout;
    private final int mailboxCapacity;
    private final Duration jobTimeout;
    private final MiddlewareClient fallback;

    private WebSocketConfig(Builder b) {
        this.host = b.host;
        this.port = b.port;
        this.username = b.username;
        this.apiKey = b.apiKey;
        this.tls = b.tls;
        this.insecureSkipVerify = b.insecureSkipVerify;
        this.maxConcurrent = b.maxConcurrent;
        this.connectTimeout = b.connectTimeout;
        this.pingInterval = b.pingInterval;
        this.pingTimeout = b.pingTimeout;
        this.reconnectTimeout = b.reconnectTimeout;
        this.mailboxCapacity = b.mailboxCapacity;
        this.jobTimeout = b.jobTimeout;
        this.fallback = b.fallback;
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    public String getUsername() {
        return username;
    }

    public String getApiKey() {
        return apiKey;
    }

    public boolean isTls() {
        return tls;
    }

    public boolean isInsecureSkipVerify() {
        return insecureSkipVerify;
    }

    public int getMaxConcurrent() {
        return maxConcurrent;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    /** Ping interval; {@link Duration#ZERO} means liveness probing is off. */
    public Duration getPingInterval() {
        return pingInterval;
    }

    public Duration getPingTimeout() {
        return pingTimeout;
    }

    public Duration getReconnectTimeout() {
        return reconnectTimeout;
    }

    public int getMailboxCapacity() {
        return mailboxCapacity;
    }

    public Duration getJobTimeout() {
        return jobTimeout;
    }

    public MiddlewareClient getFallback() {
        return fallback;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Loads settings from {@code midrpc.ws.*} properties.
     *
     * <p>Recognised keys: {@code host}, {@code port}, {@code username}, {@code api-key}, {@code
     * tls}, {@code insecure-skip-verify}, {@code max-concurrent}, {@code ping-interval-seconds},
     * {@code ping-timeout-seconds}, {@code reconnect-timeout-seconds}. The fallback client cannot
     * come from properties, so a builder is returned.
     *
     * @param props the properties
     * @return a builder pre-filled from the properties
     */
    public static Builder fromProperties(Properties props) {
        Builder b = builder()
                .host(props.getProperty("midrpc.ws.host"))
                .username(props.getProperty("midrpc.ws.username"))
                .apiKey(props.getProperty("midrpc.ws.api-key"));
        String v = props.getProperty("midrpc.ws.port");
        if (v != null) {
            b.port(parseInt("midrpc.ws.port", v));
        }
        v = props.getProperty("midrpc.ws.tls");
        if (v != null) {
            b.tls(Boolean.parseBoolean(v.trim()));
        }
        v = props.getProperty("midrpc.ws.insecure-skip-verify");
        if (v != null) {
            b.insecureSkipVerify(Boolean.parseBoolean(v.trim()));
        }
        v = props.getProperty("midrpc.ws.max-concurrent");
        if (v != null) {
            b.maxConcurrent(parseInt("midrpc.ws.max-concurrent", v));
        }
        v = props.getProperty("midrpc.ws.ping-interval-seconds");
        if (v != null) {
            b.pingInterval(Duration.ofSeconds(parseInt("midrpc.ws.ping-interval-seconds", v)));
        }
        v = props.getProperty("midrpc.ws.ping-timeout-seconds");
        if (v != null) {
            b.pingTimeout(Duration.ofSeconds(parseInt("midrpc.ws.ping-timeout-seconds", v)));
        }
        v = props.getProperty("midrpc.ws.reconnect-timeout-seconds");
        if (v != null) {
            b.reconnectTimeout(
                    Duration.ofSeconds(parseInt("midrpc.ws.reconnect-timeout-seconds", v)));
        }
        return b;
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer, got \"" + value + "\"", e);
        }
    }

    @Override
    public String toString() {
        return "WebSocketConfig[" + username + "@" + host + ":" + port + ", tls=" + tls
                + ", maxConcurrent=" + maxConcurrent + "]";
    }

    /** Builder for {@link WebSocketConfig}. */
    public static final class Builder {
        private String host;
        private int port;
        private String username;
        private String apiKey;
        private boolean tls = true;
        private boolean insecureSkipVerify;
        private int maxConcurrent;
        private Duration connectTimeout = Duration.ofSeconds(30);
        private Duration pingInterval = Duration.ofSeconds(30);
        private Duration pingTimeout = Duration.ofSeconds(10);
        private Duration reconnectTimeout = Duration.ofMinutes(5);
        private int mailboxCapacity;
        private Duration jobTimeout = Duration.ofMinutes(30);
        private MiddlewareClient fallback;

        private Builder() {}

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        /** Sets the port; zero selects {@link #DEFAULT_PORT}. */
        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder username(String username) {
            this.username = username;
            return this;
        }

        public Builder apiKey(String apiKey) {
            this.apiKey = apiKey;
            return this;
        }

        public Builder tls(boolean tls) {
            this.tls = tls;
            return this;
        }

        public Builder insecureSkipVerify(boolean insecureSkipVerify) {
            this.insecureSkipVerify = insecureSkipVerify;
            return this;
        }

        /** Sets the in-flight limit; values {@code <= 0} select the default. */
        public Builder maxConcurrent(int maxConcurrent) {
            this.maxConcurrent = maxConcurrent;
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout");
            return this;
        }

        public Builder pingInterval(Duration pingInterval) {
            this.pingInterval = Objects.requireNonNull(pingInterval, "pingInterval");
            return this;
        }

        public Builder pingTimeout(Duration pingTimeout) {
            this.pingTimeout = Objects.requireNonNull(pingTimeout, "pingTimeout");
            return this;
        }

        public Builder reconnectTimeout(Duration reconnectTimeout) {
            this.reconnectTimeout = Objects.requireNonNull(reconnectTimeout, "reconnectTimeout");
            return this;
        }

        /** Sets the owner mailbox size; values {@code <= 0} select the default. */
        public Builder mailboxCapacity(int mailboxCapacity) {
            this.mailboxCapacity = mailboxCapacity;
            return this;
        }

        public Builder jobTimeout(Duration jobTimeout) {
            this.jobTimeout = Objects.requireNonNull(jobTimeout, "jobTimeout");
            return this;
        }

        public Builder fallback(MiddlewareClient fallback) {
            this.fallback = fallback;
            return this;
        }

        /**
         * Validates and fills defaults.
         *
         * @return the configuration
         * @throws IllegalArgumentException if host, username, API key or fallback is missing
         */
        public WebSocketConfig build() {
            if (host == null || host.isBlank()) {
                throw new IllegalArgumentException("host is required");
            }
            if (username == null || username.isBlank()) {
                throw new IllegalArgumentException("username is required");
            }
            if (apiKey == null || apiKey.isBlank()) {
                throw new IllegalArgumentException("api_key is required");
            }
            if (fallback == null) {
                throw new IllegalArgumentException("fallback client is required");
            }
            if (port < 0 || port > 65535) {
                throw new IllegalArgumentException("port must be 0-65535");
            }
            if (port == 0) {
                port = DEFAULT_PORT;
            }
            if (maxConcurrent <= 0) {
                maxConcurrent = DEFAULT_MAX_CONCURRENT;
            }
            if (mailboxCapacity <= 0) {
                mailboxCapacity = DEFAULT_MAILBOX_CAPACITY;
            }
            if (pingInterval.isNegative()) {
                throw new IllegalArgumentException("pingInterval must not be negative");
            }
            if (pingTimeout.isNegative() || pingTimeout.isZero()) {
                pingTimeout = Duration.ofSeconds(10);
            }
            if (reconnectTimeout.isNegative() || reconnectTimeout.isZero()) {
                throw new IllegalArgumentException("reconnectTimeout must be positive");
            }
            if (jobTimeout.isNegative() || jobTimeout.isZero()) {
                throw new IllegalArgumentException("jobTimeout must be positive");
            }
            return new WebSocketConfig(this);
        }
    }
}
