package airdev.devserver.runtime;

import airdev.devserver.model.TaskKind;
import airdev.devserver.util.Json;

import java.nio.file.Path;
import java.util.List;

/**
 * Runs {@code .py} entrypoints unbuffered, with parameters as one JSON argument.
 */
public class PythonRuntime implements TaskRuntime {

    private final String pythonBin;

    public PythonRuntime() {
        this("python3");
    }

    public PythonRuntime(String pythonBin) {
        this.pythonBin = pythonBin;
    }

    @Override
    public TaskKind kind() {
        return TaskKind.PYTHON;
    }

    @Override
    public Path root(Path entrypoint) {
        return TaskRuntime.findRoot(entrypoint, "requirements.txt");
    }

    @Override
    public boolean supportsLocalExecution() {
        return true;
    }

    @Override
    public PreparedRun prepare(PrepareOptions options) {
        // -u keeps python from holding logs back until exit.
        return new PreparedRun(
                List.of(pythonBin, "-u", options.entrypoint().toString(), Json.write(options.paramValues())),
                root(options.entrypoint()));
    }
}
