package express.mvp.midrpc;

/**
 * Thrown when a blocking client operation is abandoned because its {@link CallContext} was
 * cancelled, its deadline passed, or the waiting thread was interrupted.
 */
public class CallCancelledException extends ClientException {

    private final boolean deadlineExceeded;

    /**
     * Creates a cancellation exception.
     *
     * @param message the detail message
     * @param deadlineExceeded true when the context expired rather than being cancelled
     */
    public CallCancelledException(String message, boolean deadlineExceeded) {
        super(message);
        this.deadlineExceeded = deadlineExceeded;
    }

    /**
     * Creates a cancellation exception caused by thread interruption.
     *
     * @param message the detail message
     * @param cause the interruption
     */
    public CallCancelledException(String message, Throwable cause) {
        super(message, cause);
        this.deadlineExceeded = false;
    }

    /**
     * Returns whether the context deadline expired.
     *
     * @return true for deadline expiry, false for explicit cancellation or interruption
     */
    public boolean isDeadlineExceeded() {
        return deadlineExceeded;
    }
}
