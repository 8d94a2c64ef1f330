package airdev.devserver.api.v0.dto;

import airdev.devserver.model.Display;
import airdev.devserver.model.Parameter;
import airdev.devserver.model.Prompt;
import airdev.devserver.model.Run;
import airdev.devserver.model.RunStatus;
import airdev.devserver.model.StdApiRequest;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Wire form of a run, as the platform API returns it.
 * GET /v0/runs/get, POST /v0/tasks/execute
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RunResponse(
        @JsonProperty("id") String id,
        @JsonProperty("runID") String runId,
        @JsonProperty("taskID") String taskId,
        @JsonProperty("taskSlug") String taskSlug,
        @JsonProperty("taskName") String taskName,
        @JsonProperty("status") RunStatus status,
        @JsonProperty("outputs") JsonNode outputs,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("creatorID") String creatorId,
        @JsonProperty("succeededAt") Instant succeededAt,
        @JsonProperty("failedAt") Instant failedAt,
        @JsonProperty("cancelledAt") Instant cancelledAt,
        @JsonProperty("cancelledBy") String cancelledBy,
        @JsonProperty("paramValues") Map<String, Object> paramValues,
        @JsonProperty("parameters") List<Parameter> parameters,
        @JsonProperty("parentID") String parentId,
        @JsonProperty("envSlug") String envSlug,
        @JsonProperty("resources") Map<String, String> resources,
        @JsonProperty("displays") List<Display> displays,
        @JsonProperty("prompts") List<Prompt> prompts,
        @JsonProperty("isWaitingForUser") boolean waitingForUser,
        @JsonProperty("isStdAPI") boolean stdApi,
        @JsonProperty("stdAPIRequest") StdApiRequest stdApiRequest,
        @JsonProperty("remote") boolean remote) {

    /** Create response from domain model */
    public static RunResponse from(Run run) {
        String slug = run.taskId() == null || run.taskId().isEmpty() ? run.taskName() : run.taskId();
        return new RunResponse(
                run.id(),
                run.id(),
                run.taskId(),
                slug,
                run.taskName(),
                run.status(),
                run.outputs(),
                run.createdAt(),
                run.creatorId(),
                run.succeededAt(),
                run.failedAt(),
                run.cancelledAt(),
                run.cancelledBy(),
                run.paramValues(),
                run.parameters(),
                run.parentId(),
                run.envSlug(),
                run.resources(),
                run.displays(),
                run.prompts(),
                run.waitingForUser(),
                run.stdApi(),
                run.stdApiRequest(),
                run.remote());
    }

    public static List<RunResponse> fromAll(List<Run> runs) {
        return runs.stream().map(RunResponse::from).toList();
    }
}
