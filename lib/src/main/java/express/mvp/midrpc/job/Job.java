package express.mvp.midrpc.job;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * A middleware job as returned by {@code core.get_jobs}.
 *
 * @param id job id
 * @param state current state
 * @param error error text when failed, else {@code null}
 * @param result result when successful
 * @param logsExcerpt tail of the job log
 * @param logsPath path of the full job log
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Job(
        @JsonProperty("id") long id,
        @JsonProperty("state") JobState state,
        @JsonProperty("error") String error,
        @JsonProperty("result") JsonNode result,
        @JsonProperty("logs_excerpt") String logsExcerpt,
        @JsonProperty("logs_path") String logsPath) {

    public Job {
        if (state == null) {
            state = JobState.UNKNOWN;
        }
    }
}
