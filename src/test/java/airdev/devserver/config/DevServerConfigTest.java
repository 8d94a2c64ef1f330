package airdev.devserver.config;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DevServerConfigTest {

    @Test
    void defaults() {
        DevServerConfig config = DevServerConfig.defaults();

        assertEquals(4000, config.serverPort());
        assertEquals("127.0.0.1", config.serverHost());
        assertEquals(Path.of(".").resolve("airplane.dev.yaml"), config.devConfigPath());
        assertFalse(config.hasEnvSlug());
        assertEquals(1000, config.maxChildRuns());
        assertEquals(Duration.ofSeconds(5), config.killGrace());
        assertEquals("http://127.0.0.1:4000", config.localApiHost());
    }

    @Test
    void fromEnvironment() {
        DevServerConfig config = DevServerConfig.fromEnv(Map.of(
                "AIRDEV_PORT", " 4100 ",
                "AIRDEV_DIR", "/work",
                "AIRPLANE_API_KEY", "secret-key",
                "AIRDEV_ENV_SLUG", "prod",
                "AIRDEV_MAX_OUTPUT_LINE_BYTES", "1024"));

        assertEquals(4100, config.serverPort());
        assertEquals(Path.of("/work/airplane.dev.yaml"), config.devConfigPath());
        assertEquals("secret-key", config.apiKey());
        assertTrue(config.hasEnvSlug());
        assertEquals("prod", config.envSlug());
        assertEquals(1024, config.maxOutputLineBytes());
    }

    @Test
    void blankValuesKeepDefaults() {
        DevServerConfig config = DevServerConfig.fromEnv(Map.of("AIRDEV_PORT", "  ", "AIRDEV_ENV_SLUG", ""));
        assertEquals(4000, config.serverPort());
        assertFalse(config.hasEnvSlug());
    }

    @Test
    void toStringHidesApiKey() {
        DevServerConfig config = DevServerConfig.defaults().withApiKey("super-secret");
        assertFalse(config.toString().contains("super-secret"));
    }
}
