package airdev.devserver.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Form a running task shows to a user and waits on.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Prompt(
        @JsonProperty("id") String id,
        @JsonProperty("runID") String runId,
        @JsonProperty("schema") JsonNode schema,
        @JsonProperty("values") Map<String, Object> values,
        @JsonProperty("reviewers") Reviewers reviewers,
        @JsonProperty("confirmText") String confirmText,
        @JsonProperty("cancelText") String cancelText,
        @JsonProperty("description") String description,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("submittedAt") Instant submittedAt,
        @JsonProperty("submittedBy") String submittedBy) {

    public record Reviewers(
            @JsonProperty("groups") List<String> groups,
            @JsonProperty("users") List<String> users,
            @JsonProperty("allowSelfApprovals") Boolean allowSelfApprovals) {
    }

    public boolean isSubmitted() {
        return submittedAt != null;
    }

    public Prompt submit(Map<String, Object> submittedValues, String by, Instant at) {
        return new Prompt(id, runId, schema, submittedValues, reviewers, confirmText, cancelText,
                description, createdAt, at, by);
    }
}
