package express.mvp.midrpc.ratelimit;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import express.mvp.midrpc.CallCancelledException;
import express.mvp.midrpc.CallContext;
import express.mvp.midrpc.ClientConfig;
import express.mvp.midrpc.ClientException;
import express.mvp.midrpc.MiddlewareClient;
import express.mvp.midrpc.Version;
import express.mvp.midrpc.WriteFileParams;
import express.mvp.midrpc.error.ErrorParser;
import express.mvp.midrpc.error.MiddlewareError;
import express.mvp.midrpc.error.RetryPolicy;
import express.mvp.midrpc.error.SocketRetryClassifier;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("RateLimitedClient")
@SuppressFBWarnings(
        value = {"RV_RETURN_VALUE_IGNORED_NO_SIDE_EFFECT"},
        justification = "SpotBugs rules are intentionally relaxed for test scaffolding.")
class RateLimitedClientTest {

    private final CallContext ctx = CallContext.background();

    /** Fails the first {@code failures} calls with {@code error}, then answers "ok". */
    static final class FlakyClient implements MiddlewareClient {
        final AtomicInteger attempts = new AtomicInteger();
        final List<String> operations = Collections.synchronizedList(new ArrayList<>());
        final int failures;
        final RuntimeException error;
        volatile boolean closed;

        FlakyClient(int failures, RuntimeException error) {
            this.failures = failures;
            this.error = error;
        }

        private JsonNode attempt(String op) {
            operations.add(op);
            if (attempts.incrementAndGet() <= failures) {
                throw error;
            }
            return TextNode.valueOf("ok");
        }

        @Override
        public void connect(CallContext ctx) {
            operations.add("connect");
        }

        @Override
        public Version version() {
            return Version.parse("25.04.0");
        }

        @Override
        public JsonNode call(CallContext ctx, String method, Object params) {
            return attempt("call " + method);
        }

        @Override
        public JsonNode callAndWait(CallContext ctx, String method, Object params) {
            return attempt("callAndWait " + method);
        }

        @Override
        public void writeFile(CallContext ctx, String path, WriteFileParams params) {
            attempt("writeFile " + path);
        }

        @Override
        public byte[] readFile(CallContext ctx, String path) {
            attempt("readFile " + path);
            return new byte[0];
        }

        @Override
        public void deleteFile(CallContext ctx, String path) {
            attempt("deleteFile " + path);
        }

        @Override
        public void removeDir(CallContext ctx, String path) {
            attempt("removeDir " + path);
        }

        @Override
        public void removeAll(CallContext ctx, String path) {
            attempt("removeAll " + path);
        }

        @Override
        public boolean fileExists(CallContext ctx, String path) {
            attempt("fileExists " + path);
            return true;
        }

        @Override
        public void chown(CallContext ctx, String path, int uid, int gid) {
            attempt("chown " + path);
        }

        @Override
        public void chmodRecursive(CallContext ctx, String path, int mode) {
            attempt("chmodRecursive " + path);
        }

        @Override
        public void mkdirAll(CallContext ctx, String path, int mode) {
            attempt("mkdirAll " + path);
        }

        @Override
        public void close() {
            closed = true;
        }
    }

    private static ClientException transientError() {
        return new ClientException("read tcp: connection reset by peer");
    }

    private static RateLimitedClient limited(MiddlewareClient delegate, int maxRetries) {
        RetryPolicy policy =
                RetryPolicy.builder()
                        .maxRetries(maxRetries)
                        .initialDelay(Duration.ofMillis(1))
                        .maxDelay(Duration.ofMillis(5))
                        .classifier(new SocketRetryClassifier())
                        .build();
        return new RateLimitedClient(delegate, new TokenBucket(600_000), policy);
    }

    @Nested
    @DisplayName("Retry")
    class Retry {

        @Test
        @DisplayName("transient failures are retried until success")
        void retriesUntilSuccess() {
            FlakyClient delegate = new FlakyClient(2, transientError());

            JsonNode result = limited(delegate, 3).call(ctx, "system.info", null);

            assertEquals("ok", result.asText());
            assertEquals(3, delegate.attempts.get());
        }

        @Test
        @DisplayName("exhausting the budget reports the attempt count")
        void exhausted() {
            FlakyClient delegate = new FlakyClient(Integer.MAX_VALUE, transientError());

            RetriesExhaustedException e =
                    assertThrows(
                            RetriesExhaustedException.class,
                            () -> limited(delegate, 3).callAndWait(ctx, "app.start", "web"));

            assertEquals(4, e.getAttempts());
            assertEquals(4, delegate.attempts.get());
            assertEquals(
                    "app.start failed after 4 attempts: read tcp: connection reset by peer",
                    e.getMessage());
            assertSame(delegate.error, e.getCause());
        }

        @Test
        @DisplayName("a non-transient failure is raised after one attempt")
        void permanentFailure() {
            MiddlewareError error = ErrorParser.parse("[EINVAL] name: invalid");
            FlakyClient delegate = new FlakyClient(Integer.MAX_VALUE, error);

            MiddlewareError e =
                    assertThrows(
                            MiddlewareError.class,
                            () -> limited(delegate, 3).call(ctx, "pool.dataset.create", null));

            assertSame(error, e);
            assertEquals(1, delegate.attempts.get());
        }

        @Test
        @DisplayName("zero retries means a single attempt")
        void zeroRetries() {
            FlakyClient delegate = new FlakyClient(Integer.MAX_VALUE, transientError());

            RetriesExhaustedException e =
                    assertThrows(
                            RetriesExhaustedException.class,
                            () -> limited(delegate, 0).call(ctx, "system.info", null));

            assertEquals(1, e.getAttempts());
            assertEquals(1, delegate.attempts.get());
        }

        @Test
        @DisplayName("cancellation stops retrying")
        void cancellation() {
            FlakyClient delegate =
                    new FlakyClient(Integer.MAX_VALUE, new CallCancelledException("call cancelled", false));

            assertThrows(
                    CallCancelledException.class,
                    () -> limited(delegate, 3).call(ctx, "system.info", null));
            assertEquals(1, delegate.attempts.get());
        }

        @Test
        @DisplayName("client settings choose the retry budget")
        void fromClientConfig() {
            FlakyClient delegate = new FlakyClient(Integer.MAX_VALUE, ErrorParser.parse("[EINVAL] x"));
            RateLimitedClient client =
                    new RateLimitedClient(
                            delegate,
                            ClientConfig.builder().rateLimit(600_000).maxRetries(5).build(),
                            new SocketRetryClassifier());

            assertThrows(MiddlewareError.class, () -> client.call(ctx, "system.info", null));
            assertEquals(1, delegate.attempts.get());
        }
    }

    @Nested
    @DisplayName("Other operations")
    class OtherOperations {

        @Test
        @DisplayName("file operations are rate limited but not retried")
        void filesNotRetried() {
            FlakyClient delegate = new FlakyClient(1, transientError());
            RateLimitedClient client = limited(delegate, 3);

            ClientException e =
                    assertThrows(ClientException.class, () -> client.deleteFile(ctx, "/tmp/a"));

            assertSame(delegate.error, e);
            assertEquals(1, delegate.attempts.get());
            client.mkdirAll(ctx, "/tmp/d", 0755);
            assertEquals(List.of("deleteFile /tmp/a", "mkdirAll /tmp/d"), delegate.operations);
        }

        @Test
        @DisplayName("version and close pass through")
        void passThrough() {
            FlakyClient delegate = new FlakyClient(0, transientError());
            RateLimitedClient client = limited(delegate, 3);

            client.connect(ctx);
            assertEquals(Version.parse("25.04.0"), client.version());
            assertSame(delegate, client.delegate());
            client.close();

            assertTrue(delegate.closed);
        }

        @Test
        @DisplayName("calls are spaced by the rate limit")
        void spacing() {
            FlakyClient delegate = new FlakyClient(0, transientError());
            RateLimitedClient client =
                    new RateLimitedClient(delegate, new TokenBucket(1200), RetryPolicy.noRetry());

            long start = System.nanoTime();
            for (int i = 0; i < 3; i++) {
                client.call(ctx, "system.info", null);
            }
            long elapsedMillis = (System.nanoTime() - start) / 1_000_000;

            assertTrue(elapsedMillis >= 90, "elapsed " + elapsedMillis + "ms");
        }
    }
}
