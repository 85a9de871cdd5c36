package express.mvp.midrpc.ssh;

import java.time.Duration;
import java.util.Objects;
import java.util.Properties;

/**
 * Configuration for the shell-command transport.
 *
 * <h2>Configuration Options</h2>
 *
 * <table border="1">
 *   <caption>SSH transport parameters</caption>
 *   <tr><th>Parameter</th><th>Default</th><th>Description</th></tr>
 *   <tr><td>host</td><td>(required)</td><td>Middleware host name or address</td></tr>
 *   <tr><td>port</td><td>22</td><td>SSH port</td></tr>
 *   <tr><td>user</td><td>root</td><td>Login user; must be allowed to sudo midclt</td></tr>
 *   <tr><td>privateKey</td><td>(required)</td><td>PEM/OpenSSH private key text</td></tr>
 *   <tr><td>hostKeyFingerprint</td><td>(required)</td><td>{@code SHA256:...} fingerprint of the server key</td></tr>
 *   <tr><td>maxSessions</td><td>5</td><td>Concurrent remote commands</td></tr>
 *   <tr><td>connectTimeout</td><td>30s</td><td>Session establishment timeout</td></tr>
 *   <tr><td>jobTimeout</td><td>30m</td><td>Job wait when the call context has no deadline</td></tr>
 * </table>
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * SshConfig config = SshConfig.builder()
 *     .host("nas.example.com")
 *     .privateKey(Files.readString(Path.of("/home/me/.ssh/id_ed25519")))
 *     .hostKeyFingerprint("SHA256:3ZnTb4kRzT0n6o0S2x6yX8gk8Y3Zb0d1p5mQw9JcZbU")
 *     .build();
 * }</pre>
 */
public final class SshConfig {

    public static final int DEFAULT_PORT = 22;
    public static final String DEFAULT_USER = "root";
    public static final int DEFAULT_MAX_SESSIONS = 5;

    private final String host;
    private final int port;
    private final String user;
    private final String privateKey;
    private final String hostKeyFingerprint;
    private final int maxSessions;
    private final Duration connectTimeout;
    private final Duration jobTimeout;

    private SshConfig(Builder builder) {
        this.host = builder.host;
        this.port = builder.port;
        this.user = builder.user;
        this.privateKey = builder.privateKey;
        this.hostKeyFingerprint = builder.hostKeyFingerprint;
        this.maxSessions = builder.maxSessions;
        this.connectTimeout = builder.connectTimeout;
        this.jobTimeout = builder.jobTimeout;
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    public String getUser() {
        return user;
    }

    public String getPrivateKey() {
        return privateKey;
    }

    public String getHostKeyFingerprint() {
        return hostKeyFingerprint;
    }

    public int getMaxSessions() {
        return maxSessions;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public Duration getJobTimeout() {
        return jobTimeout;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Loads configuration from {@code midrpc.ssh.*} properties.
     *
     * <p>Recognised keys: {@code host}, {@code port}, {@code user}, {@code private-key}, {@code
     * host-key-fingerprint}, {@code max-sessions}, {@code connect-timeout-seconds}, {@code
     * job-timeout-seconds}.
     *
     * @param props the properties
     * @return the validated configuration
     * @throws IllegalArgumentException if a required key is missing or a number is malformed
     */
    public static SshConfig fromProperties(Properties props) {
        Builder b = builder()
                .host(props.getProperty("midrpc.ssh.host"))
                .user(props.getProperty("midrpc.ssh.user"))
                .privateKey(props.getProperty("midrpc.ssh.private-key"))
                .hostKeyFingerprint(props.getProperty("midrpc.ssh.host-key-fingerprint"));
        String port = props.getProperty("midrpc.ssh.port");
        if (port != null) {
            b.port(parseInt("midrpc.ssh.port", port));
        }
        String sessions = props.getProperty("midrpc.ssh.max-sessions");
        if (sessions != null) {
            b.maxSessions(parseInt("midrpc.ssh.max-sessions", sessions));
        }
        String connect = props.getProperty("midrpc.ssh.connect-timeout-seconds");
        if (connect != null) {
            b.connectTimeout(Duration.ofSeconds(parseInt("midrpc.ssh.connect-timeout-seconds", connect)));
        }
        String job = props.getProperty("midrpc.ssh.job-timeout-seconds");
        if (job != null) {
            b.jobTimeout(Duration.ofSeconds(parseInt("midrpc.ssh.job-timeout-seconds", job)));
        }
        return b.build();
    }

    static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer, got \"" + value + "\"", e);
        }
    }

    @Override
    public String toString() {
        return "SshConfig[" + user + "@" + host + ":" + port + ", maxSessions=" + maxSessions + "]";
    }

    /** Builder for {@link SshConfig}. */
    public static final class Builder {
        private String host;
        private int port;
        private String user;
        private String privateKey;
        private String hostKeyFingerprint;
        private int maxSessions;
        private Duration connectTimeout = Duration.ofSeconds(30);
        private Duration jobTimeout = Duration.ofMinutes(30);

        private Builder() {}

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        /**
         * Sets the port; zero selects {@link #DEFAULT_PORT}.
         *
         * @param port SSH port
         * @return this builder
         */
        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder user(String user) {
            this.user = user;
            return this;
        }

        public Builder privateKey(String privateKey) {
            this.privateKey = privateKey;
            return this;
        }

        public Builder hostKeyFingerprint(String hostKeyFingerprint) {
            this.hostKeyFingerprint = hostKeyFingerprint;
            return this;
        }

        /**
         * Sets the session limit; values {@code <= 0} select {@link #DEFAULT_MAX_SESSIONS}.
         *
         * @param maxSessions concurrent remote commands
         * @return this builder
         */
        public Builder maxSessions(int maxSessions) {
            this.maxSessions = maxSessions;
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout");
            return this;
        }

        public Builder jobTimeout(Duration jobTimeout) {
            this.jobTimeout = Objects.requireNonNull(jobTimeout, "jobTimeout");
            return this;
        }

        /**
         * Validates and fills defaults.
         *
         * @return the configuration
         * @throws IllegalArgumentException if host, private key or host key fingerprint is missing
         */
        public SshConfig build() {
            if (isBlank(host)) {
                throw new IllegalArgumentException("host is required");
            }
            if (isBlank(privateKey)) {
                throw new IllegalArgumentException("private_key is required");
            }
            if (isBlank(hostKeyFingerprint)) {
                throw new IllegalArgumentException("host_key_fingerprint is required");
            }
            if (port < 0 || port > 65535) {
                throw new IllegalArgumentException("port must be 0-65535");
            }
            if (port == 0) {
                port = DEFAULT_PORT;
            }
            if (isBlank(user)) {
                user = DEFAULT_USER;
            }
            if (maxSessions <= 0) {
                maxSessions = DEFAULT_MAX_SESSIONS;
            }
            if (connectTimeout.isNegative() || jobTimeout.isNegative() || jobTimeout.isZero()) {
                throw new IllegalArgumentException("timeouts must be positive");
            }
            return new SshConfig(this);
        }

        private static boolean isBlank(String s) {
            return s == null || s.isBlank();
        }
    }
}
