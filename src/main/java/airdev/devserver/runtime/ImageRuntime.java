package airdev.devserver.runtime;

import airdev.devserver.model.TaskKind;

import java.nio.file.Path;

/**
 * Docker image tasks; known but never run locally.
 */
public class ImageRuntime implements TaskRuntime {

    @Override
    public TaskKind kind() {
        return TaskKind.IMAGE;
    }

    @Override
    public Path root(Path entrypoint) {
        return entrypoint == null ? null : entrypoint.toAbsolutePath().normalize().getParent();
    }

    @Override
    public boolean supportsLocalExecution() {
        return false;
    }

    @Override
    public PreparedRun prepare(PrepareOptions options) {
        throw new UnsupportedRuntimeException("cannot run docker image tasks");
    }
}
