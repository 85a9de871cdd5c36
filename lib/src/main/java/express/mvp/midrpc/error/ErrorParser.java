package express.mvp.midrpc.error;

import java.time.Duration;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns raw middleware error text into {@link MiddlewareError}s.
 *
 * <h2>Parsing Rules</h2>
 *
 * <ol>
 *   <li>A leading {@code Process exited with status N:} wrapper is removed.
 *   <li>Everything from a Python traceback onwards is dropped.
 *   <li>A bracketed code ({@code [EINVAL] rest}) sets the code and the message becomes the rest;
 *       without one the code is {@link ErrorCodes#UNKNOWN} and the message is the cleaned text.
 *   <li>A dotted path before a colon at the start of the message ({@code pool.name: ...}) is
 *       recorded as the field.
 *   <li>A canned suggestion is attached for well-known codes.
 *   <li>An app-lifecycle failure ({@code Failed 'up' action for 'web' app ... app_lifecycle.log})
 *       records the action, app and log path so the log can be fetched later.
 * </ol>
 *
 * <pre>{@code
 * MiddlewareError e = ErrorParser.parse("[EINVAL] pool.name: Name is reserved");
 * e.code();   // "EINVAL"
 * e.field();  // "pool.name"
 * }</pre>
 */
public final class ErrorParser {

    private static final Pattern ERROR_CODE = Pattern.compile("\\[([A-Z]+)\\]\\s*(.*)");
    private static final Pattern FIELD = Pattern.compile("^([\\w.]+):\\s*(.*)");
    private static final Pattern PROCESS_EXIT = Pattern.compile("^Process exited with status \\d+:\\s*");
    private static final Pattern APP_LIFECYCLE =
            Pattern.compile("Failed '(\\w+)' action for '([^']+)' app.*(/var/log/app_lifecycle\\.log)");

    private static final Map<String, String> SUGGESTIONS =
            Map.of(
                    ErrorCodes.EINVAL,
                    "Check the configuration schema. A field may be invalid or unexpected.",
                    ErrorCodes.ENOENT,
                    "Resource not found. It may have been deleted outside of this client.",
                    ErrorCodes.EFAULT,
                    "Container failed to start. Check the compose configuration and image availability.",
                    ErrorCodes.EEXIST,
                    "Resource already exists. Import it or choose a different name.",
                    ErrorCodes.ENOTEMPTY,
                    "Directory or dataset has children. Delete the children first or remove recursively.");

    private ErrorParser() {
        // Utility class
    }

    /**
     * Parses raw error text.
     *
     * @param raw text printed or returned by the middleware
     * @return the structured error
     */
    public static MiddlewareError parse(String raw) {
        String text = raw == null ? "" : raw;
        String cleaned = PROCESS_EXIT.matcher(text).replaceFirst("");

        int idx = cleaned.indexOf("\nTraceback");
        if (idx != -1) {
            cleaned = cleaned.substring(0, idx).strip();
        }
        idx = cleaned.indexOf("Traceback (most recent call last)");
        if (idx != -1) {
            cleaned = cleaned.substring(0, idx).strip();
        }

        String code = ErrorCodes.UNKNOWN;
        String message = cleaned;
        String field = null;

        Matcher codeMatch = ERROR_CODE.matcher(cleaned);
        if (codeMatch.find()) {
            code = codeMatch.group(1);
            message = codeMatch.group(2).strip();
            Matcher fieldMatch = FIELD.matcher(message);
            if (fieldMatch.find()) {
                field = fieldMatch.group(1);
            }
        }

        MiddlewareError.Builder b =
                MiddlewareError.builder(code, message)
                        .field(field)
                        .suggestion(SUGGESTIONS.get(code))
                        .raw(text);

        Matcher app = APP_LIFECYCLE.matcher(text);
        if (app.find()) {
            b.app(app.group(1), app.group(2), app.group(3));
        }
        return b.build();
    }

    /**
     * Returns the canned suggestion for a code.
     *
     * @param code error code
     * @return the suggestion, or {@code null}
     */
    public static String suggestionFor(String code) {
        return SUGGESTIONS.get(code);
    }

    /**
     * Creates an error for a failed connection attempt.
     *
     * @param host target host
     * @param port target port
     * @param cause underlying failure
     * @return the error, with {@code cause} attached
     */
    public static MiddlewareError connectionError(String host, int port, Throwable cause) {
        return MiddlewareError.builder(
                        ErrorCodes.ECONNREFUSED,
                        "Cannot connect to " + host + ":" + port + ": " + describe(cause))
                .suggestion(
                        "Verify credentials, network connectivity, and that the middleware server is running.")
                .build(cause);
    }

    /**
     * Creates an error for a job (or call) that did not finish in time.
     *
     * @param jobId job id, or 0 when no job is involved
     * @param after elapsed time to report
     * @return the error
     */
    public static MiddlewareError timeoutError(long jobId, Duration after) {
        return MiddlewareError.builder(ErrorCodes.ETIMEDOUT, "Operation timed out after " + format(after))
                .jobId(jobId)
                .suggestion("Increase the timeout or check the middleware server for issues.")
                .build();
    }

    /**
     * Creates an error for a job whose connection did not come back within the reconnect window.
     *
     * @param jobId job id
     * @param window the reconnect window
     * @return the error
     */
    public static MiddlewareError reconnectTimeoutError(long jobId, Duration window) {
        return MiddlewareError.builder(
                        ErrorCodes.ETIMEDOUT,
                        "Connection was not re-established within " + format(window)
                                + " while waiting for job " + jobId)
                .jobId(jobId)
                .suggestion("Check network connectivity to the middleware server.")
                .build();
    }

    /**
     * Creates an error for a host key that does not match the pinned fingerprint.
     *
     * @param host target host
     * @param expected configured fingerprint
     * @param actual fingerprint presented by the server
     * @return the error
     */
    public static MiddlewareError hostKeyError(String host, String expected, String actual) {
        return MiddlewareError.builder(
                        ErrorCodes.EHOSTKEY,
                        "host key verification failed for " + host + ": expected " + expected
                                + ", got " + actual)
                .suggestion("Verify the fingerprint: ssh-keyscan <host> 2>/dev/null | ssh-keygen -lf -")
                .build();
    }

    /**
     * Creates an error for a job id the middleware does not know.
     *
     * @param jobId the job id
     * @return the error
     */
    public static MiddlewareError jobNotFound(long jobId) {
        return MiddlewareError.builder(ErrorCodes.ENOENT, "Job " + jobId + " not found")
                .jobId(jobId)
                .suggestion("The job may have expired or the ID is incorrect.")
                .build();
    }

    /**
     * Creates a validation error raised before anything is sent.
     *
     * @param message description of the invalid input
     * @return the error
     */
    public static MiddlewareError invalidArgument(String message) {
        return MiddlewareError.builder(ErrorCodes.EINVAL, message)
                .suggestion(SUGGESTIONS.get(ErrorCodes.EINVAL))
                .build();
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown error";
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    private static String format(Duration d) {
        if (d.toMillis() % 1000 != 0) {
            return d.toMillis() + "ms";
        }
        long s = d.getSeconds();
        if (s >= 60 && s % 60 == 0) {
            return (s / 60) + "m";
        }
        return s + "s";
    }
}
