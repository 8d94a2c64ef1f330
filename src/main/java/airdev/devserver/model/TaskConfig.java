package airdev.devserver.model;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Locally discovered task: what the executor needs to run it.
 *
 * @param slug           unique task slug
 * @param name           display name
 * @param kind           runtime kind
 * @param entrypoint     absolute entrypoint path, null for kinds without one
 * @param kindOptions    kind-specific options (query, method, ...), may contain templates
 * @param parameters     declared parameters
 * @param env            declared env vars
 * @param resources      resource attachments, alias to resource slug
 * @param configs        attached config variable names
 * @param definitionFile file the task was declared in
 * @param workflow       whether the task declares {@code runtime: workflow}
 */
public record TaskConfig(
        String slug,
        String name,
        TaskKind kind,
        Path entrypoint,
        Map<String, Object> kindOptions,
        List<Parameter> parameters,
        Map<String, EnvVarValue> env,
        Map<String, String> resources,
        List<String> configs,
        Path definitionFile,
        boolean workflow) {

    public TaskConfig(String slug, String name, TaskKind kind, Path entrypoint, Map<String, Object> kindOptions,
                      List<Parameter> parameters, Map<String, EnvVarValue> env, Map<String, String> resources,
                      List<String> configs, Path definitionFile) {
        this(slug, name, kind, entrypoint, kindOptions, parameters, env, resources, configs, definitionFile, false);
    }

    public TaskConfig {
        kindOptions = kindOptions == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(kindOptions));
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
        env = env == null ? Map.of() : Map.copyOf(env);
        resources = resources == null ? Map.of() : Map.copyOf(resources);
        configs = configs == null ? List.of() : List.copyOf(configs);
    }
}
