package express.mvp.midrpc.job;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import express.mvp.midrpc.CallCancelledException;
import express.mvp.midrpc.CallContext;
import express.mvp.midrpc.error.ErrorCodes;
import express.mvp.midrpc.error.MiddlewareError;
import express.mvp.midrpc.rpc.Json;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("JobPoller")
@SuppressFBWarnings(
        value = {"RV_RETURN_VALUE_IGNORED_NO_SIDE_EFFECT"},
        justification = "SpotBugs rules are intentionally relaxed for test scaffolding.")
class JobPollerTest {

    private static final JobPollerConfig FAST =
            JobPollerConfig.builder()
                    .initialInterval(Duration.ofMillis(5))
                    .maxInterval(Duration.ofMillis(20))
                    .build();

    /** Answers {@code core.get_jobs} from a script; the last entry repeats. */
    private static final class ScriptedJobs implements RpcCaller {
        private final List<String> responses;
        private final List<String> methods = new ArrayList<>();
        private final List<Object> params = new ArrayList<>();
        private final AtomicInteger polls = new AtomicInteger();

        ScriptedJobs(String... responses) {
            this.responses = List.of(responses);
        }

        @Override
        public JsonNode call(CallContext ctx, String method, Object p) {
            methods.add(method);
            params.add(p);
            int n = polls.getAndIncrement();
            return Json.read(responses.get(Math.min(n, responses.size() - 1)));
        }
    }

    @Nested
    @DisplayName("Completion")
    class Completion {

        @Test
        @DisplayName("polls until SUCCESS and returns the result")
        void successAfterPolling() {
            ScriptedJobs jobs =
                    new ScriptedJobs(
                            "[{\"id\":1,\"state\":\"RUNNING\"}]",
                            "[{\"id\":1,\"state\":\"WAITING\"}]",
                            "[{\"id\":1,\"state\":\"SUCCESS\",\"result\":{\"id\":123}}]");
            JobPoller poller = new JobPoller(jobs, FAST);

            JsonNode result = poller.await(CallContext.background(), 1, Duration.ofSeconds(5));

            assertEquals(123, result.get("id").asInt());
            assertEquals(3, jobs.polls.get());
            assertEquals("core.get_jobs", jobs.methods.get(0));
            assertEquals(
                    "[[[\"id\",\"=\",1]]]", Json.write(jobs.params.get(0)));
        }

        @Test
        @DisplayName("unknown states keep polling")
        void unknownStateKeepsPolling() {
            ScriptedJobs jobs =
                    new ScriptedJobs(
                            "[{\"id\":1,\"state\":\"PAUSED\"}]",
                            "[{\"id\":1,\"state\":\"SUCCESS\",\"result\":true}]");

            JsonNode result =
                    new JobPoller(jobs, FAST).await(CallContext.background(), 1, Duration.ofSeconds(5));

            assertTrue(result.asBoolean());
            assertEquals(2, jobs.polls.get());
        }

        @Test
        @DisplayName("FAILED becomes a parsed error carrying the job id")
        void failed() {
            ScriptedJobs jobs =
                    new ScriptedJobs(
                            "[{\"id\":5,\"state\":\"FAILED\",\"error\":\"[EINVAL] name: bad\","
                                    + "\"logs_excerpt\":\"line 1\"}]");

            MiddlewareError e =
                    assertThrows(
                            MiddlewareError.class,
                            () -> new JobPoller(jobs, FAST)
                                    .await(CallContext.background(), 5, Duration.ofSeconds(5)));

            assertEquals(ErrorCodes.EINVAL, e.code());
            assertEquals("name", e.field());
            assertEquals(5, e.jobId());
            assertEquals("line 1", e.logsExcerpt());
        }

        @Test
        @DisplayName("ABORTED without text gets a generic message")
        void abortedWithoutText() {
            ScriptedJobs jobs = new ScriptedJobs("[{\"id\":8,\"state\":\"ABORTED\"}]");

            MiddlewareError e =
                    assertThrows(
                            MiddlewareError.class,
                            () -> new JobPoller(jobs, FAST)
                                    .await(CallContext.background(), 8, Duration.ofSeconds(5)));

            assertEquals("Job 8 aborted", e.detail());
        }

        @Test
        @DisplayName("empty job list is ENOENT")
        void notFound() {
            ScriptedJobs jobs = new ScriptedJobs("[]");

            MiddlewareError e =
                    assertThrows(
                            MiddlewareError.class,
                            () -> new JobPoller(jobs, FAST)
                                    .await(CallContext.background(), 77, Duration.ofSeconds(5)));

            assertEquals(ErrorCodes.ENOENT, e.code());
            assertEquals(77, e.jobId());
        }
    }

    @Nested
    @DisplayName("Timeouts and cancellation")
    class Timeouts {

        @Test
        @DisplayName("times out with the job id")
        void timeout() {
            ScriptedJobs jobs = new ScriptedJobs("[{\"id\":9,\"state\":\"RUNNING\"}]");

            MiddlewareError e =
                    assertThrows(
                            MiddlewareError.class,
                            () -> new JobPoller(jobs, FAST)
                                    .await(CallContext.background(), 9, Duration.ofMillis(60)));

            assertEquals(ErrorCodes.ETIMEDOUT, e.code());
            assertEquals(9, e.jobId());
        }

        @Test
        @DisplayName("context deadline is reported as a timeout")
        void contextDeadline() {
            ScriptedJobs jobs = new ScriptedJobs("[{\"id\":9,\"state\":\"RUNNING\"}]");
            CallContext ctx = CallContext.background().withTimeout(Duration.ofMillis(50));

            MiddlewareError e =
                    assertThrows(
                            MiddlewareError.class,
                            () -> new JobPoller(jobs, FAST).await(ctx, 9, Duration.ofSeconds(30)));

            assertEquals(ErrorCodes.ETIMEDOUT, e.code());
        }

        @Test
        @DisplayName("cancellation stops polling")
        void cancellation() {
            ScriptedJobs jobs = new ScriptedJobs("[{\"id\":9,\"state\":\"RUNNING\"}]");
            CallContext ctx = CallContext.background().withCancel();
            ctx.cancel();

            CallCancelledException e =
                    assertThrows(
                            CallCancelledException.class,
                            () -> new JobPoller(jobs, FAST).await(ctx, 9, Duration.ofSeconds(30)));

            assertFalse(e.isDeadlineExceeded());
        }
    }

    @Nested
    @DisplayName("Log enrichment")
    class Enrichment {

        private static final String APP_FAILURE =
                "[EFAULT] Failed 'up' action for 'web' app. Please check "
                        + "/var/log/app_lifecycle.log for more details";

        @Test
        @DisplayName("attaches the app lifecycle line")
        void enriches() {
            ScriptedJobs jobs =
                    new ScriptedJobs(
                            "[{\"id\":3,\"state\":\"FAILED\",\"error\":" + Json.write(APP_FAILURE) + "}]");
            LogReader logs =
                    (ctx, path) -> "Failed 'up' action for 'web' app: pulling\\nimage not found\\n";

            MiddlewareError e =
                    assertThrows(
                            MiddlewareError.class,
                            () -> new JobPoller(jobs, FAST, logs)
                                    .await(CallContext.background(), 3, Duration.ofSeconds(5)));

            assertEquals("image not found", e.appLifecycleError());
            assertTrue(e.getMessage().startsWith("image not found"));
        }

        @Test
        @DisplayName("a failing log read keeps the original error")
        void enrichmentFailureSwallowed() {
            ScriptedJobs jobs =
                    new ScriptedJobs(
                            "[{\"id\":3,\"state\":\"FAILED\",\"error\":" + Json.write(APP_FAILURE) + "}]");
            LogReader logs =
                    (ctx, path) -> {
                        throw new IllegalStateException("permission denied");
                    };

            MiddlewareError e =
                    assertThrows(
                            MiddlewareError.class,
                            () -> new JobPoller(jobs, FAST, logs)
                                    .await(CallContext.background(), 3, Duration.ofSeconds(5)));

            assertEquals(ErrorCodes.EFAULT, e.code());
            assertNull(e.appLifecycleError());
        }
    }
}
