package airdev.devserver.service;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Deterministic identity of a task, so SDK-side discovery resolves local tasks.
 */
public record TaskMetadata(
        @JsonProperty("id") String id,
        @JsonProperty("slug") String slug,
        @JsonProperty("isLocal") boolean isLocal) {

    public static TaskMetadata local(String slug) {
        return new TaskMetadata("tsk-" + slug, slug, true);
    }
}
