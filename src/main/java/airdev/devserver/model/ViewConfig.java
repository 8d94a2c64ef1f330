package airdev.devserver.model;

import java.nio.file.Path;
import java.util.Map;

/**
 * Locally discovered view. Only its env vars are resolved here.
 */
public record ViewConfig(
        String slug,
        String name,
        Path entrypoint,
        Map<String, EnvVarValue> env,
        Path definitionFile) {

    public ViewConfig {
        env = env == null ? Map.of() : Map.copyOf(env);
    }
}
