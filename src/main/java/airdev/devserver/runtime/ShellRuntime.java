package airdev.devserver.runtime;

import airdev.devserver.model.TaskKind;
import airdev.devserver.util.Json;
import com.fasterxml.jackson.databind.JsonNode;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Runs {@code .sh} entrypoints with bash; parameters become {@code name=value} arguments.
 */
public class ShellRuntime implements TaskRuntime {

    @Override
    public TaskKind kind() {
        return TaskKind.SHELL;
    }

    @Override
    public Path root(Path entrypoint) {
        return entrypoint.toAbsolutePath().normalize().getParent();
    }

    @Override
    public boolean supportsLocalExecution() {
        return true;
    }

    @Override
    public PreparedRun prepare(PrepareOptions options) {
        List<String> command = new ArrayList<>();
        command.add("bash");
        command.add(options.entrypoint().toString());
        for (Map.Entry<String, Object> e : options.paramValues().entrySet()) {
            command.add(e.getKey() + "=" + argument(e.getValue()));
        }
        return new PreparedRun(command, root(options.entrypoint()));
    }

    static String argument(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof String s) {
            return s;
        }
        JsonNode node = Json.mapper().valueToTree(value);
        return node.isValueNode() ? node.asText() : node.toString();
    }
}
