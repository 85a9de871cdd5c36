package express.mvp.midrpc.error;

import express.mvp.midrpc.ClientException;
import java.util.Objects;

/**
 * Structured error reported by the middleware or synthesized by the client.
 *
 * <p>Instances are produced by {@link ErrorParser#parse(String)} from the raw text the middleware
 * prints or returns, and by the factory methods on {@link ErrorParser} for client-side failures
 * (connection refused, host key mismatch, timeouts). They are immutable: enrichment after the fact
 * (attaching a job id, a log excerpt or an app-lifecycle message) returns a new instance.
 *
 * <h2>Rendered Message</h2>
 *
 * <p>{@link #getMessage()} is what a user sees. When an app-lifecycle error was extracted it
 * replaces the raw message entirely; otherwise the parsed message is followed by the job log
 * excerpt. A canned suggestion, if any, is appended last:
 *
 * <pre>
 * Attribute a.b.c is required
 *
 * Job logs:
 * ...
 *
 * Suggestion: Check the configuration schema. A field may be invalid or unexpected.
 * </pre>
 */
public final class MiddlewareError extends ClientException {

    private final String code;
    private final String detail;
    private final String field;
    private final long jobId;
    private final String suggestion;
    private final String logsExcerpt;
    private final String appAction;
    private final String appName;
    private final String logPath;
    private final String appLifecycleError;
    private final String raw;

    private MiddlewareError(Builder b, Throwable cause) {
        super(render(b), cause);
        this.code = b.code;
        this.detail = b.detail;
        this.field = b.field;
        this.jobId = b.jobId;
        this.suggestion = b.suggestion;
        this.logsExcerpt = b.logsExcerpt;
        this.appAction = b.appAction;
        this.appName = b.appName;
        this.logPath = b.logPath;
        this.appLifecycleError = b.appLifecycleError;
        this.raw = b.raw;
    }

    private static String render(Builder b) {
        StringBuilder sb = new StringBuilder();
        if (!isEmpty(b.appLifecycleError)) {
            sb.append(b.appLifecycleError);
        } else {
            sb.append(b.detail);
            if (!isEmpty(b.logsExcerpt)) {
                sb.append("\n\nJob logs:\n").append(b.logsExcerpt);
            }
        }
        if (!isEmpty(b.suggestion)) {
            sb.append("\n\nSuggestion: ").append(b.suggestion);
        }
        return sb.toString();
    }

    private static boolean isEmpty(String s) {
        return s == null || s.isEmpty();
    }

    /**
     * Returns the symbolic code, e.g. {@code EINVAL}.
     *
     * @return the code, {@link ErrorCodes#UNKNOWN} if none was found
     */
    public String code() {
        return code;
    }

    /**
     * Returns the cleaned message without logs or suggestion.
     *
     * @return the message
     */
    public String detail() {
        return detail;
    }

    /** Dotted field path the error refers to, or {@code null}. */
    public String field() {
        return field;
    }

    /** Job id the error belongs to, or 0. */
    public long jobId() {
        return jobId;
    }

    public String suggestion() {
        return suggestion;
    }

    public String logsExcerpt() {
        return logsExcerpt;
    }

    /** App action named in an app-lifecycle failure (e.g. {@code up}), or {@code null}. */
    public String appAction() {
        return appAction;
    }

    public String appName() {
        return appName;
    }

    public String logPath() {
        return logPath;
    }

    public String appLifecycleError() {
        return appLifecycleError;
    }

    /** The unmodified text this error was parsed from, or {@code null} for synthesized errors. */
    public String raw() {
        return raw;
    }

    /**
     * Checks whether the error names an app-lifecycle log that can be fetched for details.
     *
     * @return true if action, app name and log path are all known
     */
    public boolean hasAppLifecycleLog() {
        return !isEmpty(logPath) && !isEmpty(appName) && !isEmpty(appAction);
    }

    public boolean hasCode(String candidate) {
        return code.equals(candidate);
    }

    public MiddlewareError withJobId(long id) {
        return toBuilder().jobId(id).build(getCause());
    }

    public MiddlewareError withLogsExcerpt(String excerpt) {
        return toBuilder().logsExcerpt(excerpt).build(getCause());
    }

    public MiddlewareError withAppLifecycleError(String message) {
        return toBuilder().appLifecycleError(message).build(getCause());
    }

    public MiddlewareError withCause(Throwable cause) {
        return toBuilder().build(cause);
    }

    Builder toBuilder() {
        Builder b = new Builder(code, detail);
        b.field = field;
        b.jobId = jobId;
        b.suggestion = suggestion;
        b.logsExcerpt = logsExcerpt;
        b.appAction = appAction;
        b.appName = appName;
        b.logPath = logPath;
        b.appLifecycleError = appLifecycleError;
        b.raw = raw;
        return b;
    }

    static Builder builder(String code, String detail) {
        return new Builder(code, detail);
    }

    static final class Builder {
        private final String code;
        private final String detail;
        private String field;
        private long jobId;
        private String suggestion;
        private String logsExcerpt;
        private String appAction;
        private String appName;
        private String logPath;
        private String appLifecycleError;
        private String raw;

        private Builder(String code, String detail) {
            this.code = Objects.requireNonNull(code, "code");
            this.detail = Objects.requireNonNull(detail, "detail");
        }

        Builder field(String field) {
            this.field = field;
            return this;
        }

        Builder jobId(long jobId) {
            this.jobId = jobId;
            return this;
        }

        Builder suggestion(String suggestion) {
            this.suggestion = suggestion;
            return this;
        }

        Builder logsExcerpt(String logsExcerpt) {
            this.logsExcerpt = logsExcerpt;
            return this;
        }

        Builder app(String action, String name, String path) {
            this.appAction = action;
            this.appName = name;
            this.logPath = path;
            return this;
        }

        Builder appLifecycleError(String appLifecycleError) {
            this.appLifecycleError = appLifecycleError;
            return this;
        }

        Builder raw(String raw) {
            this.raw = raw;
            return this;
        }

        MiddlewareError build() {
            return new MiddlewareError(this, null);
        }

        MiddlewareError build(Throwable cause) {
            return new MiddlewareError(this, cause);
        }
    }
}
