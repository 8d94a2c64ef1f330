package airdev.devserver.api.internal.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * POST /i/prompts/submit
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SubmitPromptRequest(
        @JsonProperty("id") String id,
        @JsonProperty("runID") String runId,
        @JsonProperty("values") Map<String, Object> values) {
}
