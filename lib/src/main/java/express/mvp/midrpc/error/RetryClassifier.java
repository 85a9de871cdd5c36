package express.mvp.midrpc.error;

/**
 * Decides whether a failure is transient and worth retrying.
 *
 * <p>Each transport family has its own classifier because the same failure looks different over a
 * shell channel (text on stderr, JSch exceptions) than over the socket (JSON-RPC error codes).
 *
 * @see ShellRetryClassifier
 * @see SocketRetryClassifier
 */
@FunctionalInterface
public interface RetryClassifier {

    /**
     * Checks whether a failed attempt should be retried.
     *
     * @param error the failure, may be {@code null}
     * @return true for transient failures
     */
    boolean isRetriable(Throwable error);

    /** A classifier that never retries. */
    static RetryClassifier never() {
        return error -> false;
    }
}
