package express.mvp.midrpc.job;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A state change of a job, delivered to a waiter by the socket transport.
 *
 * @param jobId job id, 0 for synthetic events
 * @param state new state
 * @param result job result on success
 * @param error error text on failure
 */
public record JobEvent(long jobId, JobState state, JsonNode result, String error) {

    public static JobEvent disconnected(long jobId) {
        return new JobEvent(jobId, JobState.DISCONNECTED, null, null);
    }

    public static JobEvent reconnected(long jobId) {
        return new JobEvent(jobId, JobState.RECONNECTED, null, null);
    }

    /**
     * Converts a terminal event into a job so it can be resolved like a polled one.
     *
     * @return the job view of this event
     */
    public Job toJob() {
        return new Job(jobId, state, error, result, null, null);
    }
}
