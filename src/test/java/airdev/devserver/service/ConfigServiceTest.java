package airdev.devserver.service;

import airdev.devserver.config.DevConfig;
import airdev.devserver.model.ConfigVar;
import airdev.devserver.model.Resource;
import airdev.devserver.remote.FakeRemoteApiClient;
import airdev.devserver.remote.RemoteApiException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConfigServiceTest {

    @TempDir
    Path dir;

    private FakeRemoteApiClient remote;
    private ConfigService service;

    @BeforeEach
    void setUp() throws Exception {
        Path file = Files.writeString(dir.resolve("airplane.dev.yaml"), String.join("\n",
                "configVars:",
                "  shared: local",
                "resources:",
                "  - slug: demo_db",
                "    name: Demo DB",
                "    kind: postgres",
                ""));
        remote = new FakeRemoteApiClient().configured();
        service = new ConfigService(remote, DevConfig.load(file));
    }

    @Test
    void localConfigsWinOverRemote() {
        remote.configsByEnv.put("prod", List.of(
                ConfigVar.remote("shared", "remote", false, "prod"),
                ConfigVar.remote("only_remote", "r", false, "prod")));

        Map<String, ConfigVar> merged = service.mergedConfigs("prod");

        assertEquals("local", merged.get("shared").value());
        assertFalse(merged.get("shared").remote());
        assertTrue(merged.get("only_remote").remote());
        assertEquals(1, service.mergedConfigs(null).size());
    }

    @Test
    void remoteFailureIsWrapped() {
        FakeRemoteApiClient offline = new FakeRemoteApiClient();
        ConfigService s = new ConfigService(offline, DevConfig.empty(null));

        RemoteApiException e = assertThrows(RemoteApiException.class, () -> s.mergedResources("prod"));
        assertTrue(e.getMessage().startsWith("merging local and remote resources: "), e.getMessage());
        assertEquals(401, e.status());
    }

    @Test
    void resolvesAttachmentsBySlugOrName() {
        remote.resourcesByEnv.put("prod", List.of(new Resource("res_remote", "api", "API", "rest")));
        Map<String, Resource> all = service.mergedResources("prod");

        Map<String, Resource> resolved = service.aliasToResource(
                Map.of("db", "Demo DB", "rest", "api"), all, "prod");

        assertEquals("res-demo_db", resolved.get("db").id());
        assertEquals("res_remote", resolved.get("rest").id());
        assertEquals(Map.of("db", "res-demo_db", "rest", "res_remote"), ConfigService.aliasToId(resolved));
    }

    @Test
    void unknownResourceMessageNamesTheEnv() {
        Map<String, Resource> local = service.mergedResources(null);

        NotFoundException withoutEnv = assertThrows(NotFoundException.class,
                () -> service.aliasToResource(Map.of("db", "missing"), local, null));
        assertEquals("cannot find resource \"missing\". Is it defined in your dev config file?", withoutEnv.getMessage());

        NotFoundException withEnv = assertThrows(NotFoundException.class,
                () -> service.aliasToResource(Map.of("db", "missing"), local, "prod"));
        assertEquals("cannot find resource \"missing\". Is it defined in your dev config file or in your prod environment?",
                withEnv.getMessage());
    }

    @Test
    void envVarLifecycle() {
        service.upsertEnvVar("B_VAR", "2");
        service.upsertEnvVar("A_VAR", null);

        assertEquals("", service.envVar("A_VAR"));
        assertEquals(List.of("A_VAR", "B_VAR"), List.copyOf(service.envVars().keySet()));

        service.deleteEnvVar("A_VAR");
        NotFoundException e = assertThrows(NotFoundException.class, () -> service.deleteEnvVar("A_VAR"));
        assertEquals("Environment variable \"A_VAR\" not found in dev config file", e.getMessage());
        assertThrows(NotFoundException.class, () -> service.envVar("A_VAR"));
    }

    @Test
    void envVarNamesAreValidated() {
        assertThrows(IllegalArgumentException.class, () -> service.upsertEnvVar("1BAD", "x"));
        assertThrows(IllegalArgumentException.class, () -> service.upsertEnvVar("has-dash", "x"));
        IllegalArgumentException empty = assertThrows(IllegalArgumentException.class, () -> service.envVar(""));
        assertEquals("name cannot be empty", empty.getMessage());
    }

    @Test
    void remoteEnvIsCached() {
        assertSame(service.env("prod"), service.env("prod"));
    }
}
