package express.mvp.midrpc.ratelimit;

import com.fasterxml.jackson.databind.JsonNode;
import express.mvp.midrpc.CallCancelledException;
import express.mvp.midrpc.CallContext;
import express.mvp.midrpc.ClientConfig;
import express.mvp.midrpc.MiddlewareClient;
import express.mvp.midrpc.Version;
import express.mvp.midrpc.WriteFileParams;
import express.mvp.midrpc.error.RetryClassifier;
import express.mvp.midrpc.error.RetryContext;
import express.mvp.midrpc.error.RetryPolicy;
import java.time.Duration;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Decorator adding admission control and bounded retry to any {@link MiddlewareClient}.
 *
 * <h2>Admission</h2>
 *
 * <p>Every attempt, retries included, first takes a token from a {@link TokenBucket}. Waiting is
 * cancellable.
 *
 * <h2>Retry</h2>
 *
 * <p>{@link #call} and {@link #callAndWait} failures are classified by the policy's {@link
 * RetryClassifier}. Permanent failures propagate unchanged after one attempt. Transient ones are
 * retried with jittered exponential backoff until the policy's bound; then a {@link
 * RetriesExhaustedException} carrying the attempt count is thrown with the last failure as cause.
 * File operations and {@link #connect} are admitted through the bucket but never retried.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * MiddlewareClient client = new RateLimitedClient(
 *     new SshClient(sshConfig), ClientConfig.defaults(), new ShellRetryClassifier());
 * }</pre>
 */
public final class RateLimitedClient implements MiddlewareClient {

    private static final Logger LOGGER = Logger.getLogger(RateLimitedClient.class.getName());

    private final MiddlewareClient delegate;
    private final TokenBucket bucket;
    private final RetryPolicy policy;

    /**
     * Creates a decorator from client settings.
     *
     * @param delegate the transport
     * @param config rate limit and retry bound
     * @param classifier decides which failures are transient
     */
    public RateLimitedClient(
            MiddlewareClient delegate, ClientConfig config, RetryClassifier classifier) {
        this(
                delegate,
                new TokenBucket(config.getRateLimit()),
                RetryPolicy.builder()
                        .maxRetries(config.getMaxRetries())
                        .classifier(classifier)
                        .build());
    }

    /**
     * Creates a decorator with an explicit bucket and policy.
     *
     * @param delegate the transport
     * @param bucket admission control
     * @param policy retry bound, backoff and classifier
     */
    public RateLimitedClient(MiddlewareClient delegate, TokenBucket bucket, RetryPolicy policy) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.bucket = Objects.requireNonNull(bucket, "bucket");
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    public MiddlewareClient delegate() {
        return delegate;
    }

    @Override
    public void connect(CallContext ctx) {
        bucket.acquire(ctx);
        delegate.connect(ctx);
    }

    @Override
    public Version version() {
        return delegate.version();
    }

    @Override
    public JsonNode call(CallContext ctx, String method, Object params) {
        return withRetry(ctx, method, () -> delegate.call(ctx, method, params));
    }

    @Override
    public JsonNode callAndWait(CallContext ctx, String method, Object params) {
        return withRetry(ctx, method, () -> delegate.callAndWait(ctx, method, params));
    }

    @Override
    public void writeFile(CallContext ctx, String path, WriteFileParams params) {
        bucket.acquire(ctx);
        delegate.writeFile(ctx, path, params);
    }

    @Override
    public byte[] readFile(CallContext ctx, String path) {
        bucket.acquire(ctx);
        return delegate.readFile(ctx, path);
    }

    @Override
    public void deleteFile(CallContext ctx, String path) {
        bucket.acquire(ctx);
        delegate.deleteFile(ctx, path);
    }

    @Override
    public void removeDir(CallContext ctx, String path) {
        bucket.acquire(ctx);
        delegate.removeDir(ctx, path);
    }

    @Override
    public void removeAll(CallContext ctx, String path) {
        bucket.acquire(ctx);
        delegate.removeAll(ctx, path);
    }

    @Override
    public boolean fileExists(CallContext ctx, String path) {
        bucket.acquire(ctx);
        return delegate.fileExists(ctx, path);
    }

    @Override
    public void chown(CallContext ctx, String path, int uid, int gid) {
        bucket.acquire(ctx);
        delegate.chown(ctx, path, uid, gid);
    }

    @Override
    public void chmodRecursive(CallContext ctx, String path, int mode) {
        bucket.acquire(ctx);
        delegate.chmodRecursive(ctx, path, mode);
    }

    @Override
    public void mkdirAll(CallContext ctx, String path, int mode) {
        bucket.acquire(ctx);
        delegate.mkdirAll(ctx, path, mode);
    }

    @Override
    public void close() {
        delegate.close();
    }

    private JsonNode withRetry(CallContext ctx, String method, Supplier<JsonNode> attempt) {
        RetryContext retry = new RetryContext(method, policy.getMaxAttempts());
        while (true) {
            bucket.acquire(ctx);
            retry.beginAttempt();
            try {
                return attempt.get();
            } catch (CallCancelledException e) {
                throw e;
            } catch (RuntimeException e) {
                boolean retriable = policy.isRetriable(e);
                retry.failed(e, retriable);
                if (!retriable) {
                    throw e;
                }
                if (!policy.shouldRetry(retry)) {
                    throw new RetriesExhaustedException(method, retry.attempts(), e);
                }
                long delay = policy.calculateDelay(retry);
                if (LOGGER.isLoggable(Level.FINE)) {
                    LOGGER.fine(method + " attempt " + retry.attempts() + " failed ("
                            + e.getMessage() + "), retrying in " + delay + "ms");
                }
                ctx.sleep(Duration.ofMillis(delay));
                retry.slept(delay);
            }
        }
    }
}
