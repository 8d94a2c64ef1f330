package airdev.devserver.runtime;

import airdev.devserver.model.TaskKind;
import airdev.devserver.util.Json;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs JavaScript entrypoints with node and TypeScript ones through {@code npx tsx}.
 */
public class NodeRuntime implements TaskRuntime {

    @Override
    public TaskKind kind() {
        return TaskKind.NODE;
    }

    @Override
    public Path root(Path entrypoint) {
        return TaskRuntime.findRoot(entrypoint, "package.json");
    }

    @Override
    public boolean supportsLocalExecution() {
        return true;
    }

    @Override
    public PreparedRun prepare(PrepareOptions options) {
        String entry = options.entrypoint().toString();
        List<String> command = new ArrayList<>();
        if (entry.endsWith(".ts") || entry.endsWith(".tsx")) {
            command.addAll(List.of("npx", "--yes", "tsx"));
        } else {
            command.add("node");
        }
        command.add(entry);
        command.add(Json.write(options.paramValues()));
        return new PreparedRun(command, root(options.entrypoint()));
    }
}
