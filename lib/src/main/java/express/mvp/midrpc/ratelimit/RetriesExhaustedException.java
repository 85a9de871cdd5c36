package express.mvp.midrpc.ratelimit;

import express.mvp.midrpc.ClientException;

/** A transient failure persisted through every allowed attempt. The last failure is the cause. */
public class RetriesExhaustedException extends ClientException {

    private final int attempts;

    public RetriesExhaustedException(String operation, int attempts, Throwable lastError) {
        super(operation + " failed after " + attempts + " attempts: " + lastError.getMessage(),
                lastError);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
