package express.mvp.midrpc;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Uniform contract for issuing calls to the management middleware.
 *
 * <p>Two transports implement this interface: {@link express.mvp.midrpc.ssh.SshClient}, which runs
 * one command per call over a secure shell, and {@link express.mvp.midrpc.ws.WebSocketClient},
 * which multiplexes JSON-RPC calls over one persistent socket. {@link
 * express.mvp.midrpc.ratelimit.RateLimitedClient} decorates either one with admission control and
 * bounded retry.
 *
 * <p>Methods and parameters are opaque: a method is a dotted name such as {@code pool.dataset.create}
 * and parameters are any value Jackson can serialize. A {@link java.util.List} parameter is taken as
 * the positional argument list; any other non-null value is sent as the single argument.
 *
 * <h2>Lifecycle</h2>
 *
 * <pre>{@code
 * MiddlewareClient client = ClientFactory.ssh(sshConfig, ClientConfig.defaults());
 * client.connect(CallContext.background());
 * try {
 *     JsonNode dataset = client.callAndWait(ctx, "pool.dataset.create", Map.of("name", "tank/x"));
 * } finally {
 *     client.close();
 * }
 * }</pre>
 *
 * <h2>Errors</h2>
 *
 * <p>All failures are unchecked {@link ClientException}s. Errors reported by the middleware are
 * {@link express.mvp.midrpc.error.MiddlewareError}s carrying a parsed code.
 *
 * <h2>Thread Safety</h2>
 *
 * <p>Implementations are safe for concurrent use by multiple threads.
 */
public interface MiddlewareClient extends AutoCloseable {

    /**
     * Performs the one-time connection handshake and caches the middleware version.
     *
     * @param ctx call context
     */
    void connect(CallContext ctx);

    /**
     * Returns the version cached by {@link #connect(CallContext)}.
     *
     * @return the middleware version
     * @throws IllegalStateException if called before a successful connect
     */
    Version version();

    /**
     * Invokes a method and returns its immediate result.
     *
     * @param ctx call context
     * @param method dotted method name
     * @param params parameters, or {@code null} for none
     * @return the result
     */
    JsonNode call(CallContext ctx, String method, Object params);

    /**
     * Invokes a method that starts a job and waits for the job to finish.
     *
     * <p>If the call returns something other than a job id, that result is returned as is.
     *
     * @param ctx call context
     * @param method dotted method name
     * @param params parameters, or {@code null} for none
     * @return the job result
     */
    JsonNode callAndWait(CallContext ctx, String method, Object params);

    void writeFile(CallContext ctx, String path, WriteFileParams params);

    byte[] readFile(CallContext ctx, String path);

    void deleteFile(CallContext ctx, String path);

    /**
     * Removes an empty directory.
     *
     * @param ctx call context
     * @param path directory path
     */
    void removeDir(CallContext ctx, String path);

    /**
     * Removes a path and everything below it.
     *
     * @param ctx call context
     * @param path the path to remove
     */
    void removeAll(CallContext ctx, String path);

    /**
     * Checks whether a path exists. A missing path is {@code false}, not an error.
     *
     * @param ctx call context
     * @param path the path
     * @return true if the path exists
     */
    boolean fileExists(CallContext ctx, String path);

    void chown(CallContext ctx, String path, int uid, int gid);

    void chmodRecursive(CallContext ctx, String path, int mode);

    /**
     * Creates a directory and any missing parents.
     *
     * @param ctx call context
     * @param path directory path
     * @param mode permission bits for created directories
     */
    void mkdirAll(CallContext ctx, String path, int mode);

    /** Releases all resources. Calling it more than once has no further effect. */
    @Override
    void close();
}
