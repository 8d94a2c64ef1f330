package airdev.devserver.config;

import airdev.devserver.model.ConfigVar;
import airdev.devserver.model.Resource;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Developer-local overrides from {@code airplane.dev.yaml}: config variables, resources and
 * env vars. Changes are written back to the file immediately.
 *
 * <pre>
 * configVars:
 *   DB_PASSWORD: hunter2
 * resources:
 *   - slug: demo_db
 *     kind: postgres
 *     host: localhost
 * envVars:
 *   LOG_LEVEL: debug
 * </pre>
 */
public final class DevConfig {

    private static final Logger log = LoggerFactory.getLogger(DevConfig.class);

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory()
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
            .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES))
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .setSerializationInclusion(JsonInclude.Include.NON_EMPTY);

    private final Path path;
    private final Object lock = new Object();
    private final Map<String, String> configVars = new LinkedHashMap<>();
    private final Map<String, Resource> resources = new LinkedHashMap<>();
    private final Map<String, String> envVars = new LinkedHashMap<>();

    private DevConfig(Path path) {
        this.path = path;
    }

    /** Empty config that will be created at {@code path} on the first change. */
    public static DevConfig empty(Path path) {
        return new DevConfig(path);
    }

    /**
     * Load the file, or return an empty config when it does not exist.
     *
     * @throws IllegalArgumentException if the file is malformed
     * @throws UncheckedIOException     if it cannot be read
     */
    public static DevConfig load(Path path) {
        DevConfig config = new DevConfig(path);
        if (path == null || !Files.exists(path)) {
            return config;
        }
        JsonNode root;
        try {
            root = YAML.readTree(path.toFile());
        } catch (IOException e) {
            throw new UncheckedIOException("unable to read dev config " + path, e);
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            return config;
        }

        root.path("configVars").fields().forEachRemaining(e -> config.configVars.put(e.getKey(), e.getValue().asText()));
        root.path("envVars").fields().forEachRemaining(e -> config.envVars.put(e.getKey(), e.getValue().asText()));

        for (JsonNode raw : root.path("resources")) {
            if (!raw.isObject()) {
                throw new IllegalArgumentException("expected resource to be a map in " + path);
            }
            JsonNode kind = raw.get("kind");
            if (kind == null || !kind.isTextual()) {
                throw new IllegalArgumentException("missing kind property in resource");
            }
            JsonNode slug = raw.get("slug");
            if (slug == null || !slug.isTextual()) {
                throw new IllegalArgumentException("missing slug property in resource");
            }
            Map<String, Object> attributes = YAML.convertValue(raw, new TypeReference<LinkedHashMap<String, Object>>() { });
            attributes.keySet().removeAll(List.of("id", "slug", "name", "kind"));
            String name = raw.path("name").asText(slug.asText());
            config.resources.put(slug.asText(),
                    new Resource(resourceId(slug.asText()), slug.asText(), name, kind.asText(), attributes));
        }
        log.info("Loaded dev config from {} ({} configs, {} resources, {} env vars)",
                path, config.configVars.size(), config.resources.size(), config.envVars.size());
        return config;
    }

    public Path path() {
        return path;
    }

    /** Local config variables keyed by name. */
    public Map<String, ConfigVar> configVars() {
        synchronized (lock) {
            Map<String, ConfigVar> out = new LinkedHashMap<>();
            configVars.forEach((name, value) -> out.put(name, ConfigVar.local(name, value)));
            return out;
        }
    }

    /** Local resources keyed by slug. */
    public Map<String, Resource> resources() {
        synchronized (lock) {
            return new LinkedHashMap<>(resources);
        }
    }

    public Map<String, String> envVars() {
        synchronized (lock) {
            return new LinkedHashMap<>(envVars);
        }
    }

    public void setConfigVar(String name, String value) {
        synchronized (lock) {
            configVars.put(name, value);
            write();
        }
    }

    public void setEnvVar(String name, String value) {
        synchronized (lock) {
            envVars.put(name, value);
            write();
        }
        log.info("Wrote environment variable {} to dev config file", name);
    }

    /**
     * @return false if the variable was not defined
     */
    public boolean deleteEnvVar(String name) {
        synchronized (lock) {
            if (envVars.remove(name) == null) {
                return false;
            }
            write();
        }
        log.info("Deleted environment variable {} from dev config file", name);
        return true;
    }

    static String resourceId(String slug) {
        return "res-" + slug;
    }

    private void write() {
        if (path == null) {
            return;
        }
        ObjectNode root = YAML.createObjectNode();
        root.set("configVars", YAML.valueToTree(configVars));
        List<Object> rawResources = new ArrayList<>();
        for (Resource r : resources.values()) {
            Map<String, Object> raw = new LinkedHashMap<>();
            raw.put("slug", r.slug());
            raw.put("kind", r.kind());
            if (r.name() != null && !r.name().equals(r.slug())) {
                raw.put("name", r.name());
            }
            raw.putAll(r.attributes());
            rawResources.add(raw);
        }
        root.set("resources", YAML.valueToTree(rawResources));
        root.set("envVars", YAML.valueToTree(envVars));
        removeEmpty(root);
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            YAML.writeValue(path.toFile(), root);
        } catch (IOException e) {
            throw new UncheckedIOException("unable to write dev config " + path, e);
        }
    }

    private static void removeEmpty(ObjectNode root) {
        Iterator<Map.Entry<String, JsonNode>> it = root.fields();
        while (it.hasNext()) {
            JsonNode v = it.next().getValue();
            if (v.isContainerNode() && v.isEmpty()) {
                it.remove();
            }
        }
    }
}
