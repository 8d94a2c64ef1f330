package airdev.devserver.config;

import airdev.devserver.model.Resource;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DevConfigTest {

    @TempDir
    Path dir;

    @Test
    void missingFileIsEmpty() {
        DevConfig config = DevConfig.load(dir.resolve("airplane.dev.yaml"));
        assertTrue(config.configVars().isEmpty());
        assertTrue(config.resources().isEmpty());
        assertTrue(config.envVars().isEmpty());
    }

    @Test
    void loadsAllSections() throws Exception {
        Path file = Files.writeString(dir.resolve("airplane.dev.yaml"), String.join("\n",
                "configVars:",
                "  bar: baz",
                "resources:",
                "  - slug: demo_db",
                "    name: Demo DB",
                "    kind: postgres",
                "    host: localhost",
                "    port: 5432",
                "envVars:",
                "  LOG_LEVEL: debug",
                ""));

        DevConfig config = DevConfig.load(file);

        assertEquals("baz", config.configVars().get("bar").value());
        assertFalse(config.configVars().get("bar").remote());
        Resource db = config.resources().get("demo_db");
        assertEquals("res-demo_db", db.id());
        assertEquals("Demo DB", db.name());
        assertEquals("postgres", db.kind());
        assertEquals("localhost", db.attributes().get("host"));
        assertFalse(db.attributes().containsKey("slug"));
        assertEquals(Map.of("LOG_LEVEL", "debug"), config.envVars());
    }

    @Test
    void resourceWithoutKindIsRejected() throws Exception {
        Path file = Files.writeString(dir.resolve("airplane.dev.yaml"), "resources:\n  - slug: x\n");
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> DevConfig.load(file));
        assertEquals("missing kind property in resource", e.getMessage());
    }

    @Test
    void resourceWithoutSlugIsRejected() throws Exception {
        Path file = Files.writeString(dir.resolve("airplane.dev.yaml"), "resources:\n  - kind: postgres\n");
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> DevConfig.load(file));
        assertEquals("missing slug property in resource", e.getMessage());
    }

    @Test
    void envVarChangesArePersisted() throws Exception {
        Path file = dir.resolve("nested/airplane.dev.yaml");
        DevConfig config = DevConfig.load(file);

        config.setEnvVar("A", "1");
        config.setEnvVar("B", "2");
        assertTrue(config.deleteEnvVar("A"));
        assertFalse(config.deleteEnvVar("A"));

        DevConfig reloaded = DevConfig.load(file);
        assertEquals(Map.of("B", "2"), reloaded.envVars());
        String yaml = Files.readString(file);
        assertFalse(yaml.contains("configVars"), yaml);
        assertFalse(yaml.startsWith("---"), yaml);
    }

    @Test
    void writingKeepsResources() throws Exception {
        Path file = Files.writeString(dir.resolve("airplane.dev.yaml"),
                "resources:\n  - slug: api\n    kind: rest\n    baseURL: http://localhost:8080\n");
        DevConfig config = DevConfig.load(file);

        config.setConfigVar("token", "abc");

        DevConfig reloaded = DevConfig.load(file);
        assertEquals("http://localhost:8080", reloaded.resources().get("api").attributes().get("baseURL"));
        assertEquals("abc", reloaded.configVars().get("token").value());
    }
}
