package express.mvp.midrpc.job;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import express.mvp.midrpc.CallCancelledException;
import express.mvp.midrpc.CallContext;
import express.mvp.midrpc.ClientException;
import express.mvp.midrpc.error.ErrorParser;
import express.mvp.midrpc.rpc.Json;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Waits for a job by polling {@code core.get_jobs}.
 *
 * <h2>State Handling</h2>
 *
 * <ul>
 *   <li>RUNNING, WAITING and unrecognised states: keep polling
 *   <li>SUCCESS: return the job result
 *   <li>FAILED, ABORTED: throw the parsed error (see {@link JobFailures})
 *   <li>job absent: throw {@code ENOENT}
 *   <li>timeout elapsed: throw {@code ETIMEDOUT} carrying the job id
 * </ul>
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * JobPoller poller = new JobPoller(client::call, JobPollerConfig.defaults());
 * JsonNode result = poller.await(ctx, jobId, Duration.ofMinutes(30));
 * }</pre>
 */
public final class JobPoller {

    private static final Logger LOGGER = Logger.getLogger(JobPoller.class.getName());

    private final RpcCaller caller;
    private final JobPollerConfig config;
    private final LogReader logs;

    /**
     * Creates a poller that also reads app lifecycle logs through {@code caller}.
     *
     * @param caller remote caller
     * @param config poll schedule, {@code null} for defaults
     */
    public JobPoller(RpcCaller caller, JobPollerConfig config) {
        this(caller, config, LogReader.viaRpc(caller));
    }

    /**
     * Creates a poller.
     *
     * @param caller remote caller
     * @param config poll schedule, {@code null} for defaults
     * @param logs reader used for failure enrichment, {@code null} to skip it
     */
    public JobPoller(RpcCaller caller, JobPollerConfig config, LogReader logs) {
        this.caller = Objects.requireNonNull(caller, "caller");
        this.config = config != null ? config : JobPollerConfig.defaults();
        this.logs = logs;
    }

    /**
     * Polls until the job finishes or {@code timeout} elapses.
     *
     * @param ctx call context
     * @param jobId job id
     * @param timeout how long to wait
     * @return the job result
     */
    public JsonNode await(CallContext ctx, long jobId, Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        Duration interval = config.getInitialInterval();

        try {
            while (true) {
                if (System.nanoTime() - deadline >= 0) {
                    throw ErrorParser.timeoutError(jobId, timeout);
                }
                ctx.checkActive();

                Job job = fetch(ctx, jobId);
                if (job.state() == JobState.SUCCESS) {
                    return job.result();
                }
                if (job.state().isFailure()) {
                    throw JobFailures.toError(ctx, job, logs);
                }
                if (LOGGER.isLoggable(Level.FINEST)) {
                    LOGGER.finest("Job " + jobId + " is " + job.state());
                }

                long left = deadline - System.nanoTime();
                ctx.sleep(left < interval.toNanos() ? Duration.ofNanos(Math.max(0, left)) : interval);
                interval = config.next(interval);
            }
        } catch (CallCancelledException e) {
            if (e.isDeadlineExceeded()) {
                throw ErrorParser.timeoutError(jobId, timeout);
            }
            throw e;
        }
    }

    /**
     * Fetches the current state of a job.
     *
     * @param ctx call context
     * @param jobId job id
     * @return the job
     * @throws express.mvp.midrpc.error.MiddlewareError {@code ENOENT} if the job does not exist
     */
    public Job fetch(CallContext ctx, long jobId) {
        List<Object> filter = List.of(List.of("id", "=", jobId));
        JsonNode result = caller.call(ctx, "core.get_jobs", List.of(filter));
        if (result == null || !result.isArray()) {
            throw new ClientException("failed to parse job response: expected a list");
        }
        if (result.isEmpty()) {
            throw ErrorParser.jobNotFound(jobId);
        }
        try {
            return Json.MAPPER.treeToValue(result.get(0), Job.class);
        } catch (JsonProcessingException e) {
            throw new ClientException("failed to parse job response", e);
        }
    }

    /**
     * Resolves a job that is known to be terminal.
     *
     * @param ctx call context
     * @param job a job in SUCCESS, FAILED or ABORTED state
     * @return the result on success
     * @throws express.mvp.midrpc.error.MiddlewareError on failure
     */
    public JsonNode resolve(CallContext ctx, Job job) {
        if (job.state().isFailure()) {
            throw JobFailures.toError(ctx, job, logs);
        }
        return job.result();
    }
}
