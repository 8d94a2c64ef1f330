package airdev.devserver.service;

import java.util.Map;

/**
 * A request to execute a task.
 *
 * @param runId       pre-allocated run id, may be null
 * @param slug        task slug, local or builtin
 * @param paramValues parameter values
 * @param resources   builtin alias to resource id; ignored for local tasks
 * @param parentRunId run that issued the request, from its local run token
 * @param envSlug     requested fallback env, null for the server default
 */
public record ExecuteCommand(
        String runId,
        String slug,
        Map<String, Object> paramValues,
        Map<String, String> resources,
        String parentRunId,
        String envSlug) {

    public ExecuteCommand {
        paramValues = paramValues == null ? Map.of() : paramValues;
        resources = resources == null ? Map.of() : resources;
    }
}
