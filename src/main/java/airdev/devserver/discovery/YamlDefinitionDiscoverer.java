package airdev.devserver.discovery;

import airdev.devserver.model.EnvVarValue;
import airdev.devserver.model.Parameter;
import airdev.devserver.model.TaskConfig;
import airdev.devserver.model.TaskKind;
import airdev.devserver.model.ViewConfig;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Reads {@code *.task.yaml} and {@code *.view.yaml} definition files.
 *
 * A task definition names its kind by the block it carries ({@code shell}, {@code python},
 * {@code node}, {@code sql}, {@code rest}, {@code docker}):
 *
 * <pre>
 * slug: hello
 * name: Hello
 * parameters:
 *   - slug: name
 *     type: shorttext
 *     default: World
 * resources:
 *   db: demo_db
 * shell:
 *   entrypoint: hello.sh
 *   envVars:
 *     GREETING: hi
 *     PASSWORD:
 *       config: DB_PASSWORD
 * </pre>
 *
 * Paths inside a definition are relative to the definition file.
 */
public class YamlDefinitionDiscoverer implements Discoverer {

    private static final Logger log = LoggerFactory.getLogger(YamlDefinitionDiscoverer.class);

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private static final List<String> TASK_SUFFIXES = List.of(".task.yaml", ".task.yml");
    private static final List<String> VIEW_SUFFIXES = List.of(".view.yaml", ".view.yml");
    private static final Set<String> SKIPPED_DIRS = Set.of("node_modules", ".git", ".airplane", "__pycache__", "venv");
    private static final Set<String> KIND_BLOCK_FIELDS = Set.of("entrypoint", "envVars", "configs");

    /** Kind-specific resource alias the builtins binary expects. */
    private static final Map<TaskKind, String> KIND_RESOURCE_ALIAS = Map.of(
            TaskKind.SQL, "db",
            TaskKind.REST, "rest");

    @Override
    public Result discover(Path root) throws IOException {
        List<TaskConfig> tasks = new ArrayList<>();
        List<ViewConfig> views = new ArrayList<>();
        List<DefinitionError> errors = new ArrayList<>();

        List<Path> files;
        try (Stream<Path> walk = Files.walk(root)) {
            files = walk
                    .filter(Files::isRegularFile)
                    .filter(p -> !isSkipped(root, p))
                    .filter(p -> hasSuffix(p, TASK_SUFFIXES) || hasSuffix(p, VIEW_SUFFIXES))
                    .sorted()
                    .collect(Collectors.toList());
        }

        for (Path file : files) {
            try {
                if (hasSuffix(file, TASK_SUFFIXES)) {
                    tasks.add(readTask(file));
                } else {
                    views.add(readView(file));
                }
            } catch (IOException | IllegalArgumentException e) {
                log.warn("Skipping definition {}: {}", file, e.getMessage());
                errors.add(new DefinitionError(file, e.getMessage()));
            }
        }
        log.info("Discovered {} tasks and {} views under {}", tasks.size(), views.size(), root);
        return new Result(tasks, views, errors);
    }

    /**
     * Parse one task definition file.
     *
     * @throws IllegalArgumentException if the definition is incomplete
     */
    public TaskConfig readTask(Path file) throws IOException {
        JsonNode def = readTree(file);
        String slug = requireText(def, "slug", file);
        String name = def.path("name").asText(slug);

        TaskKind kind = null;
        JsonNode block = null;
        for (TaskKind candidate : TaskKind.values()) {
            String key = candidate == TaskKind.IMAGE ? "docker" : candidate.wireName();
            if (def.has(key)) {
                if (kind != null) {
                    throw new IllegalArgumentException("task " + slug + " declares more than one kind");
                }
                kind = candidate;
                block = def.get(key);
            }
        }
        if (kind == null) {
            throw new IllegalArgumentException("task " + slug + " declares no kind");
        }

        Path dir = file.toAbsolutePath().normalize().getParent();
        Path entrypoint = null;
        if (block.hasNonNull("entrypoint")) {
            entrypoint = dir.resolve(block.get("entrypoint").asText()).normalize();
        }

        Map<String, Object> kindOptions = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = block.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!KIND_BLOCK_FIELDS.contains(field.getKey()) && !"resource".equals(field.getKey())) {
                kindOptions.put(field.getKey(), YAML_MAPPER.convertValue(field.getValue(), Object.class));
            }
        }

        Map<String, String> resources = readResources(def.path("resources"));
        String kindAlias = KIND_RESOURCE_ALIAS.get(kind);
        if (kindAlias != null && block.hasNonNull("resource")) {
            resources.put(kindAlias, block.get("resource").asText());
        }

        List<String> configs = new ArrayList<>();
        def.path("configs").forEach(c -> configs.add(c.asText()));
        block.path("configs").forEach(c -> configs.add(c.asText()));

        List<Parameter> parameters = def.has("parameters")
                ? YAML_MAPPER.convertValue(def.get("parameters"), new TypeReference<List<Parameter>>() { })
                : List.of();

        return new TaskConfig(slug, name, kind, entrypoint, kindOptions, parameters,
                readEnv(block.path("envVars")), resources, configs, file.toAbsolutePath().normalize(),
                "workflow".equals(def.path("runtime").asText()));
    }

    /**
     * Parse one view definition file.
     */
    public ViewConfig readView(Path file) throws IOException {
        JsonNode def = readTree(file);
        String slug = requireText(def, "slug", file);
        Path dir = file.toAbsolutePath().normalize().getParent();
        Path entrypoint = def.hasNonNull("entrypoint") ? dir.resolve(def.get("entrypoint").asText()).normalize() : null;
        return new ViewConfig(slug, def.path("name").asText(slug), entrypoint,
                readEnv(def.path("envVars")), file.toAbsolutePath().normalize());
    }

    private static JsonNode readTree(Path file) throws IOException {
        JsonNode def = YAML_MAPPER.readTree(file.toFile());
        if (def == null || !def.isObject()) {
            throw new IllegalArgumentException("expected a map at the top of " + file.getFileName());
        }
        return def;
    }

    private static Map<String, EnvVarValue> readEnv(JsonNode node) {
        Map<String, EnvVarValue> env = new LinkedHashMap<>();
        node.fields().forEachRemaining(e -> env.put(e.getKey(), YAML_MAPPER.convertValue(e.getValue(), EnvVarValue.class)));
        return env;
    }

    /** Either a map of alias to slug or a list of slugs used as their own alias. */
    private static Map<String, String> readResources(JsonNode node) {
        Map<String, String> resources = new LinkedHashMap<>();
        if (node.isObject()) {
            node.fields().forEachRemaining(e -> resources.put(e.getKey(), e.getValue().asText()));
        } else if (node.isArray()) {
            node.forEach(slug -> resources.put(slug.asText(), slug.asText()));
        }
        return resources;
    }

    private static String requireText(JsonNode def, String field, Path file) {
        JsonNode value = def.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            throw new IllegalArgumentException("missing " + field + " in " + file.getFileName());
        }
        return value.asText();
    }

    private static boolean hasSuffix(Path file, List<String> suffixes) {
        String name = file.getFileName().toString();
        return suffixes.stream().anyMatch(name::endsWith);
    }

    private static boolean isSkipped(Path root, Path file) {
        Path relative = root.relativize(file);
        for (Path part : relative) {
            if (SKIPPED_DIRS.contains(part.toString())) {
                return true;
            }
        }
        return false;
    }
}
