package airdev.devserver.runtime;

import airdev.devserver.builtins.BuiltinClient;

import java.nio.file.Path;
import java.util.Map;

/**
 * Inputs of {@link TaskRuntime#prepare}.
 *
 * @param entrypoint  absolute entrypoint path
 * @param paramValues parameter values of the run
 * @param kindOptions interpolated kind options
 * @param builtins    client for kinds that delegate to builtins
 */
public record PrepareOptions(
        Path entrypoint,
        Map<String, Object> paramValues,
        Map<String, Object> kindOptions,
        String taskSlug,
        String runId,
        BuiltinClient builtins) {

    public PrepareOptions {
        paramValues = paramValues == null ? Map.of() : paramValues;
        kindOptions = kindOptions == null ? Map.of() : kindOptions;
    }
}
