package airdev.devserver.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.List;

/**
 * Rich content (markdown, table or json) a task attaches to its run.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record Display(
        @JsonProperty("id") String id,
        @JsonProperty("runID") String runId,
        @JsonProperty("kind") String kind,
        @JsonProperty("content") String content,
        @JsonProperty("rows") List<JsonNode> rows,
        @JsonProperty("columns") List<JsonNode> columns,
        @JsonProperty("value") JsonNode value,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("updatedAt") Instant updatedAt) {
}
