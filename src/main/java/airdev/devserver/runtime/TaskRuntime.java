package airdev.devserver.runtime;

import airdev.devserver.model.TaskKind;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Knows how to run one kind of task as a local process.
 */
public interface TaskRuntime {

    TaskKind kind();

    /**
     * Directory the task's dependencies and dotenv files are resolved against.
     */
    Path root(Path entrypoint);

    /** False for kinds that only run remotely. */
    boolean supportsLocalExecution();

    /**
     * Build the command line of one run.
     *
     * @throws IOException                  if a task file cannot be read
     * @throws UnsupportedRuntimeException  if the kind cannot run locally
     */
    PreparedRun prepare(PrepareOptions options) throws IOException;

    /**
     * Nearest ancestor of the entrypoint's directory holding {@code marker}, or the directory itself.
     */
    static Path findRoot(Path entrypoint, String marker) {
        Path dir = entrypoint.toAbsolutePath().normalize().getParent();
        for (Path d = dir; d != null; d = d.getParent()) {
            if (d.resolve(marker).toFile().exists()) {
                return d;
            }
        }
        return dir;
    }
}
