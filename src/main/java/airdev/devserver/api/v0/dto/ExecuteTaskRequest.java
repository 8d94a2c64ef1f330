package airdev.devserver.api.v0.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Request DTO for executing a task.
 * POST /v0/tasks/execute
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ExecuteTaskRequest(
        @JsonProperty("runID") String runId,
        @JsonProperty("slug") String slug,
        @JsonProperty("paramValues") Map<String, Object> paramValues,
        @JsonProperty("resources") Map<String, String> resources) {

    public void validate() {
        if (slug == null || slug.isBlank()) {
            throw new IllegalArgumentException("slug is required");
        }
    }
}
