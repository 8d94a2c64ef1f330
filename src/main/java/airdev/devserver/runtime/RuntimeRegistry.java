package airdev.devserver.runtime;

import airdev.devserver.model.TaskKind;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Runtime lookup: by entrypoint extension first, then by task kind.
 */
public class RuntimeRegistry {

    private final Map<String, TaskRuntime> byExtension = new HashMap<>();
    private final Set<TaskRuntime> all = new LinkedHashSet<>();

    /** Registry with every built-in runtime. */
    public static RuntimeRegistry defaults() {
        RuntimeRegistry registry = new RuntimeRegistry();
        ShellRuntime shell = new ShellRuntime();
        PythonRuntime python = new PythonRuntime();
        NodeRuntime node = new NodeRuntime();
        registry.register(".sh", shell);
        registry.register(".py", python);
        for (String ext : List.of(".js", ".mjs", ".cjs", ".jsx", ".ts", ".tsx")) {
            registry.register(ext, node);
        }
        registry.register(".sql", new SqlRuntime());
        registry.register(new RestRuntime());
        registry.register(new ImageRuntime());
        return registry;
    }

    /**
     * @throws IllegalStateException if the extension is already taken
     */
    public RuntimeRegistry register(String extension, TaskRuntime runtime) {
        if (byExtension.putIfAbsent(extension, runtime) != null) {
            throw new IllegalStateException("runtime: " + extension + " already registered");
        }
        all.add(runtime);
        return this;
    }

    /** Register a runtime reachable only by kind. */
    public RuntimeRegistry register(TaskRuntime runtime) {
        all.add(runtime);
        return this;
    }

    /**
     * Find the runtime of a task.
     *
     * @param entrypoint entrypoint file, may be null for kinds without one
     * @throws UnsupportedRuntimeException if no single runtime matches
     */
    public TaskRuntime lookup(Path entrypoint, TaskKind kind) {
        String ext = extension(entrypoint);
        TaskRuntime byExt = byExtension.get(ext);
        if (byExt != null) {
            return byExt;
        }
        List<TaskRuntime> possible = new ArrayList<>();
        for (TaskRuntime runtime : all) {
            if (runtime.kind() == kind) {
                possible.add(runtime);
            }
        }
        if (possible.size() > 1) {
            throw new UnsupportedRuntimeException("found " + possible.size()
                    + " runtimes for task type at path " + entrypoint + ", expecting 1");
        }
        if (possible.isEmpty()) {
            throw new UnsupportedRuntimeException("unsupported file type: "
                    + (ext.isEmpty() ? String.valueOf(entrypoint) : ext));
        }
        return possible.get(0);
    }

    static String extension(Path path) {
        if (path == null || path.getFileName() == null) {
            return "";
        }
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot <= 0 ? "" : name.substring(dot);
    }
}
