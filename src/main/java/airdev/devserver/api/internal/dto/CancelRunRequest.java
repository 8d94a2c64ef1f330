package airdev.devserver.api.internal.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * POST /i/runs/cancel
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CancelRunRequest(@JsonProperty("runID") String runId) {
}
