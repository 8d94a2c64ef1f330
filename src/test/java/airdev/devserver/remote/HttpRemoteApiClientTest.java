package airdev.devserver.remote;

import airdev.devserver.model.ConfigVar;
import airdev.devserver.model.Resource;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the client against a local HTTP server standing in for the platform API.
 */
class HttpRemoteApiClientTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private HttpServer server;
    private HttpRemoteApiClient client;
    private final Map<String, String> lastHeaders = new ConcurrentHashMap<>();
    private final Map<String, String> lastBodies = new ConcurrentHashMap<>();
    private final Map<String, String> lastQueries = new ConcurrentHashMap<>();

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        route("/v0/templates/evaluate", 200, "{\"value\":{\"A\":\"evaluated\"}}");
        route("/v0/configs/get", 200, "{\"config\":{\"name\":\"db_pw\",\"value\":\"s3cret\",\"isSecret\":true}}");
        route("/v0/configs/list", 200, "{\"configs\":[{\"name\":\"a\",\"value\":\"1\"},{\"name\":\"b\",\"value\":\"\",\"isSecret\":true}]}");
        route("/v0/resources/list", 200, "{\"resources\":[{\"id\":\"res1\",\"slug\":\"db\",\"name\":\"DB\",\"kind\":\"postgres\",\"host\":\"localhost\"}]}");
        route("/v0/envs/get", 200, "{\"id\":\"env1\",\"slug\":\"prod\",\"name\":\"Production\",\"default\":true}");
        route("/v0/tasks/execute", 404, "{\"error\":\"task not found\"}");
        route("/v0/auth/info", 500, "boom");
        server.start();

        String host = "http://127.0.0.1:" + server.getAddress().getPort() + "/";
        client = new HttpRemoteApiClient(host, "key-123", "team-9", Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    private void route(String path, int status, String body) {
        server.createContext(path, exchange -> respond(exchange, path, status, body));
    }

    private void respond(HttpExchange exchange, String path, int status, String body) throws IOException {
        lastHeaders.put(path, exchange.getRequestHeaders().getFirst("X-Airplane-API-Key") + "|"
                + exchange.getRequestHeaders().getFirst("X-Team-ID"));
        lastBodies.put(path, new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
        String query = exchange.getRequestURI().getRawQuery();
        lastQueries.put(path, query == null ? "" : query);
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        exchange.getResponseBody().write(bytes);
        exchange.close();
    }

    @Test
    void sendsCredentialHeaders() {
        client.getEnv("prod");
        assertEquals("key-123|team-9", lastHeaders.get("/v0/envs/get"));
        assertEquals("slug=prod", lastQueries.get("/v0/envs/get"));
    }

    @Test
    void evaluateTemplateReturnsValue() throws Exception {
        EvaluateTemplateRequest request = new EvaluateTemplateRequest(Map.of("A", "{{x}}"), "run1",
                RemoteEnv.studio(), Map.of(), Map.of(), Map.of(), "run1", "task", "", false);

        JsonNode value = client.evaluateTemplate(request);

        assertEquals("evaluated", value.get("A").asText());
        JsonNode sent = MAPPER.readTree(lastBodies.get("/v0/templates/evaluate"));
        assertEquals("{{x}}", sent.get("value").get("A").asText());
        assertEquals("studio", sent.get("env").get("slug").asText());
    }

    @Test
    void getConfigDecryptsSecret() throws Exception {
        ConfigVar config = client.getConfig("db_pw", "prod", true);

        assertEquals("s3cret", config.value());
        assertTrue(config.secret());
        assertTrue(config.remote());
        assertEquals("prod", config.envSlug());
        assertTrue(MAPPER.readTree(lastBodies.get("/v0/configs/get")).get("showSecret").asBoolean());
    }

    @Test
    void listConfigsAndResources() {
        List<ConfigVar> configs = client.listConfigs("prod");
        assertEquals(2, configs.size());
        assertTrue(configs.get(1).secret());

        List<Resource> resources = client.listResources("prod");
        assertEquals(1, resources.size());
        assertEquals("db", resources.get(0).slug());
        assertEquals("localhost", resources.get(0).attributes().get("host"));
    }

    @Test
    void getEnvParsesPayload() {
        RemoteEnv env = client.getEnv("prod");
        assertEquals("env1", env.id());
        assertTrue(env.isDefault());
    }

    @Test
    void errorFieldBecomesMessage() {
        RemoteApiException e = assertThrows(RemoteApiException.class,
                () -> client.runTask("missing", Map.of(), "prod"));
        assertTrue(e.isNotFound());
        assertEquals("task not found", e.getMessage());
    }

    @Test
    void nonJsonErrorBody() {
        RemoteApiException e = assertThrows(RemoteApiException.class, () -> client.authInfo());
        assertEquals(500, e.status());
        assertEquals("boom", e.getMessage());
    }

    @Test
    void unconfiguredClientFailsFast() {
        HttpRemoteApiClient anonymous = new HttpRemoteApiClient(
                "http://127.0.0.1:" + server.getAddress().getPort(), "", "", Duration.ofSeconds(1));
        assertFalse(anonymous.isConfigured());
        RemoteApiException e = assertThrows(RemoteApiException.class, () -> anonymous.listConfigs("prod"));
        assertEquals(401, e.status());
        assertNull(lastQueries.get("/v0/configs/list"));
    }
}
