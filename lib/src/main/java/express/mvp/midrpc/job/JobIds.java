package express.mvp.midrpc.job;

import com.fasterxml.jackson.databind.JsonNode;
import express.mvp.midrpc.ClientException;

/** Helpers for job ids returned by job-starting calls. */
public final class JobIds {

    private JobIds() {
        // Utility class
    }

    /**
     * Checks whether a call result is a job id.
     *
     * @param result call result
     * @return true if it is an integral number
     */
    public static boolean isJobId(JsonNode result) {
        return result != null && result.isIntegralNumber();
    }

    /**
     * Extracts the job id from a call result.
     *
     * @param result call result
     * @return the job id
     * @throws ClientException if the result is missing, null or not an integer
     */
    public static long parse(JsonNode result) {
        if (result == null || result.isMissingNode()) {
            throw new ClientException("empty job ID data");
        }
        if (result.isNull()) {
            throw new ClientException("job ID is null");
        }
        if (!result.isIntegralNumber()) {
            throw new ClientException("failed to parse job ID from " + result);
        }
        return result.asLong();
    }
}
