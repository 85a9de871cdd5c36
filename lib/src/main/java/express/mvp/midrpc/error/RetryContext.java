package express.mvp.midrpc.error;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;

/**
 * Attempt ledger for one retried middleware call.
 *
 * <p>{@link RetryPolicy} reads it to decide whether another attempt is allowed and how long to
 * back off; the caller reads it to report the attempt count once the budget is spent. One ledger
 * per call, confined to the calling thread.
 */
public final class RetryContext {

    private final String method;
    private final int maxAttempts;
    private int attempts;
    private RuntimeException lastFailure;
    private boolean lastFailureTransient;
    private long lastBackoffMillis;
    private long backoffTotalMillis;

    /**
     * @param method middleware method being called, used in log and error messages
     * @param maxAttempts attempt budget, the first attempt included
     */
    public RetryContext(String method, int maxAttempts) {
        this.method = method;
        this.maxAttempts = maxAttempts;
    }

    public String method() {
        return method;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    /** Attempts begun so far. */
    public int attempts() {
        return attempts;
    }

    /** Attempts beyond the first. */
    public int retries() {
        return attempts > 0 ? attempts - 1 : 0;
    }

    public boolean budgetLeft() {
        return attempts < maxAttempts;
    }

    /**
     * Counts a new attempt.
     *
     * @return the attempt number, starting at 1
     */
    public int beginAttempt() {
        attempts++;
        return attempts;
    }

    /**
     * Notes how the latest attempt failed.
     *
     * @param failure what the transport threw
     * @param isTransient the classifier's verdict
     */
    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP2",
            justification = "The failure is rethrown or wrapped as-is.")
    public void failed(RuntimeException failure, boolean isTransient) {
        lastFailure = failure;
        lastFailureTransient = isTransient;
    }

    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP",
            justification = "The failure is rethrown or wrapped as-is.")
    public RuntimeException lastFailure() {
        return lastFailure;
    }

    public boolean lastFailureTransient() {
        return lastFailureTransient;
    }

    void backoffPlanned(long millis) {
        lastBackoffMillis = millis;
    }

    /** Backoff chosen before the latest retry, in milliseconds. */
    public long lastBackoffMillis() {
        return lastBackoffMillis;
    }

    /** Adds a completed backoff sleep to the running total. */
    public void slept(long millis) {
        backoffTotalMillis += millis;
    }

    public long backoffTotalMillis() {
        return backoffTotalMillis;
    }

    @Override
    public String toString() {
        String verdict = lastFailureTransient ? "transient" : "permanent";
        return method + " attempt " + attempts + "/" + maxAttempts
                + (lastFailure == null ? "" : ", last failure " + verdict);
    }
}
