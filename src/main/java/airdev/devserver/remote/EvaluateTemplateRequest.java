package airdev.devserver.remote;

import airdev.devserver.model.Resource;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Batched template evaluation: every {@code {{ }}} expression inside {@code value} is expanded
 * against the run's params, resources and configs.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EvaluateTemplateRequest(
        @JsonProperty("value") Object value,
        @JsonProperty("runID") String runId,
        @JsonProperty("env") RemoteEnv env,
        @JsonProperty("resources") Map<String, Resource> resources,
        @JsonProperty("configs") Map<String, String> configs,
        @JsonProperty("paramValues") Map<String, Object> paramValues,
        @JsonProperty("taskID") String taskId,
        @JsonProperty("taskSlug") String taskSlug,
        @JsonProperty("parentRunID") String parentRunId,
        @JsonProperty("disableStrictMode") boolean disableStrictMode) {

    /** Same context, different value and strictness. */
    public EvaluateTemplateRequest with(Object newValue, boolean strict) {
        return new EvaluateTemplateRequest(newValue, runId, env, resources, configs, paramValues,
                taskId, taskSlug, parentRunId, !strict);
    }
}
