package airdev.devserver.runtime;

import airdev.devserver.builtins.BuiltinSlug;
import airdev.devserver.model.TaskKind;

import java.nio.file.Path;

/**
 * REST tasks run as the {@code rest_request} builtin with their kind options as the request.
 */
public class RestRuntime implements TaskRuntime {

    @Override
    public TaskKind kind() {
        return TaskKind.REST;
    }

    @Override
    public Path root(Path entrypoint) {
        return entrypoint == null ? null : entrypoint.toAbsolutePath().normalize().getParent();
    }

    @Override
    public boolean supportsLocalExecution() {
        return true;
    }

    @Override
    public PreparedRun prepare(PrepareOptions options) {
        return new PreparedRun(
                options.builtins().command(BuiltinSlug.request(BuiltinSlug.REST_REQUEST, options.kindOptions())),
                options.entrypoint() == null ? null : root(options.entrypoint()));
    }
}
