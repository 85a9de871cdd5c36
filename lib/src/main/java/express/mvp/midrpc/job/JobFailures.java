package express.mvp.midrpc.job;

import express.mvp.midrpc.CallContext;
import express.mvp.midrpc.error.AppLifecycleLog;
import express.mvp.midrpc.error.ErrorParser;
import express.mvp.midrpc.error.MiddlewareError;
import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Builds the error for a failed or aborted job.
 *
 * <p>The job's error text is parsed, the job id and log excerpt are attached and, when the error
 * points at the app lifecycle log, the log is fetched and the relevant line extracted. Fetching is
 * best effort: if it fails the error is returned without it.
 */
public final class JobFailures {

    private static final Logger LOGGER = Logger.getLogger(JobFailures.class.getName());

    private JobFailures() {
        // Utility class
    }

    /**
     * Creates the error for a failed job.
     *
     * @param ctx call context used for fetching logs
     * @param job the failed job
     * @param logs reader for the app lifecycle log, may be {@code null} to skip enrichment
     * @return the error
     */
    public static MiddlewareError toError(CallContext ctx, Job job, LogReader logs) {
        String text = job.error();
        if (text == null || text.isEmpty()) {
            text = "Job " + job.id() + " " + job.state().name().toLowerCase(Locale.ROOT);
        }
        MiddlewareError error = ErrorParser.parse(text).withJobId(job.id());
        if (job.logsExcerpt() != null && !job.logsExcerpt().isEmpty()) {
            error = error.withLogsExcerpt(job.logsExcerpt());
        }
        return enrich(ctx, error, logs);
    }

    /**
     * Attaches the app lifecycle log line if the error refers to one and it can be read.
     *
     * @param ctx call context
     * @param error the parsed error
     * @param logs log reader, may be {@code null}
     * @return the enriched error, or {@code error} unchanged
     */
    public static MiddlewareError enrich(CallContext ctx, MiddlewareError error, LogReader logs) {
        if (logs == null || !error.hasAppLifecycleLog()) {
            return error;
        }
        try {
            String content = logs.read(ctx, error.logPath());
            String line = AppLifecycleLog.extract(content, error.appAction(), error.appName());
            if (!line.isEmpty()) {
                return error.withAppLifecycleError(line);
            }
        } catch (RuntimeException e) {
            LOGGER.log(Level.FINE, "Could not read " + error.logPath() + " for job " + error.jobId(), e);
        }
        return error;
    }
}
