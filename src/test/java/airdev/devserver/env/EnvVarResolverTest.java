package airdev.devserver.env;

import airdev.devserver.model.ConfigVar;
import airdev.devserver.model.EnvVarValue;
import airdev.devserver.remote.FakeRemoteApiClient;
import airdev.devserver.util.Json;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EnvVarResolverTest {

    @TempDir
    Path root;

    private final FakeRemoteApiClient remote = new FakeRemoteApiClient();
    private final EnvVarResolver resolver = new EnvVarResolver(remote, Map.of("PATH", "/usr/bin", "SECRET_HOST_VAR", "x"));

    private TemplateInterpolator interpolator(String runId) {
        return new TemplateInterpolator(remote,
                TemplateInterpolator.baseRequest(runId, null, "my_task", Map.of(), Map.of(), Map.of()));
    }

    private static Map<String, String> asMap(List<String> env) {
        Map<String, String> out = new LinkedHashMap<>();
        for (String kv : env) {
            int eq = kv.indexOf('=');
            out.put(kv.substring(0, eq), kv.substring(eq + 1));
        }
        return out;
    }

    private Path entrypoint() throws IOException {
        Path dir = Files.createDirectories(root.resolve("tasks"));
        return Files.writeString(dir.resolve("task.sh"), "echo hi\n");
    }

    @Test
    @DisplayName("Config reference resolves to the config value")
    void configReferenceResolves() throws Exception {
        TaskEnvRequest req = TaskEnvRequest.builder()
                .runId("devrun1")
                .taskSlug("my_task")
                .root(root)
                .entrypoint(entrypoint())
                .taskEnv(Map.of("FOO", EnvVarValue.fromConfig("bar")))
                .configVars(Map.of("bar", ConfigVar.local("bar", "baz")))
                .build();

        Map<String, String> env = asMap(resolver.resolveTask(req, interpolator("devrun1")));

        assertEquals("baz", env.get("FOO"));
        assertEquals("/usr/bin", env.get("PATH"));
        assertFalse(env.containsKey("SECRET_HOST_VAR"));
        assertEquals("devrun1", env.get("AIRPLANE_RUN_ID"));
        assertEquals("dev", env.get("AIRPLANE_RUNTIME"));
        assertEquals("devrun1", LocalRunToken.parseRunId(env.get("AIRPLANE_TOKEN")).orElseThrow());
        assertTrue(remote.evaluations.isEmpty(), "no template, no remote call");
    }

    @Test
    void missingConfigNamesTheConfigAndEnvVar() throws Exception {
        TaskEnvRequest req = TaskEnvRequest.builder()
                .runId("devrun1")
                .root(root)
                .entrypoint(entrypoint())
                .taskEnv(Map.of("FOO", EnvVarValue.fromConfig("bar")))
                .fallbackEnvSlug("prod")
                .build();

        EnvResolutionException e = assertThrows(EnvResolutionException.class,
                () -> resolver.resolveTask(req, interpolator("devrun1")));
        assertEquals("Config var bar not defined in airplane.dev.yaml or remotely in env prod "
                + "(referenced by env var FOO). Please use the configs tab on the left to add it.", e.getMessage());
    }

    @Test
    @DisplayName("Dotenv files override declared values, dev config overrides both")
    void layering() throws Exception {
        Path ep = entrypoint();
        Files.writeString(root.resolve(".env"), "A=root\nB=root\nC=root\n");
        Files.writeString(ep.getParent().resolve(".env"), "B=\"near\"\n");

        TaskEnvRequest req = TaskEnvRequest.builder()
                .runId("devrun1")
                .root(root)
                .entrypoint(ep)
                .taskEnv(Map.of("A", EnvVarValue.of("declared"), "D", EnvVarValue.of("declared")))
                .devConfigEnv(Map.of("C", "devconfig"))
                .build();

        Map<String, String> env = asMap(resolver.resolveTask(req, interpolator("devrun1")));
        assertEquals("root", env.get("A"));
        assertEquals("near", env.get("B"));
        assertEquals("devconfig", env.get("C"));
        assertEquals("declared", env.get("D"));
    }

    @Test
    void devConfigOverridesDeclaredValue() throws Exception {
        TaskEnvRequest req = TaskEnvRequest.builder()
                .runId("devrun1")
                .root(root)
                .entrypoint(entrypoint())
                .taskEnv(Map.of("ENV_VAR_FROM_VALUE", EnvVarValue.of("foo")))
                .devConfigEnv(Map.of("ENV_VAR_FROM_VALUE", "baz"))
                .build();

        Map<String, String> env = asMap(resolver.resolveTask(req, interpolator("devrun1")));
        assertEquals("baz", env.get("ENV_VAR_FROM_VALUE"));
    }

    @Test
    void remoteSecretsAreFetchedDecrypted() throws Exception {
        remote.configured();
        remote.secrets.put("db_password", "hunter2");

        TaskEnvRequest req = TaskEnvRequest.builder()
                .runId("devrun1")
                .root(root)
                .entrypoint(entrypoint())
                .taskEnv(Map.of("PW", EnvVarValue.fromConfig("db_password")))
                .configVars(Map.of("db_password", ConfigVar.remote("db_password", null, true, "prod")))
                .build();

        assertEquals("hunter2", asMap(resolver.resolveTask(req, interpolator("devrun1"))).get("PW"));
    }

    @Test
    void templatesAreInterpolatedRemotely() throws Exception {
        remote.configured();
        remote.evaluator = request -> {
            ObjectNode out = Json.mapper().valueToTree(request.value());
            out.put("GREETING", "hello world");
            return out;
        };

        TaskEnvRequest req = TaskEnvRequest.builder()
                .runId("devrun1")
                .root(root)
                .entrypoint(entrypoint())
                .taskEnv(Map.of("GREETING", EnvVarValue.of("hello {{params.name}}")))
                .build();

        assertEquals("hello world", asMap(resolver.resolveTask(req, interpolator("devrun1"))).get("GREETING"));
        assertEquals(1, remote.evaluations.size());
        assertFalse(remote.evaluations.get(0).disableStrictMode());
    }

    @Test
    void failedInterpolationAbortsResolution() throws Exception {
        TaskEnvRequest req = TaskEnvRequest.builder()
                .runId("devrun1")
                .root(root)
                .entrypoint(entrypoint())
                .taskEnv(Map.of("X", EnvVarValue.of("{{bad}}")))
                .build();

        assertThrows(EnvResolutionException.class, () -> resolver.resolveTask(req, interpolator("devrun1")));
    }

    @Test
    void builtinRunsOnlyGetBuiltinVars() {
        TaskEnvRequest req = TaskEnvRequest.builder()
                .runId("devrun1")
                .taskEnv(Map.of("IGNORED", EnvVarValue.of("x")))
                .build();

        Map<String, String> env = asMap(resolver.resolveTask(req, interpolator("devrun1")));
        assertFalse(env.containsKey("IGNORED"));
        assertEquals("devrun1", env.get("AIRPLANE_RUN_ID"));
    }
}
