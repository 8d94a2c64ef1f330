package airdev.devserver.integration;

import airdev.devserver.config.Dependencies;
import airdev.devserver.config.DevServerConfig;
import airdev.devserver.env.LocalRunToken;
import airdev.devserver.remote.FakeRemoteApiClient;
import airdev.devserver.server.DevServer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Drives the dev server over HTTP, the way the SDK and the studio UI do.
 */
class DevServerIntegrationTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @TempDir
    Path dir;

    private Dependencies deps;
    private DevServer server;
    private HttpClient httpClient;
    private String baseUrl;

    @BeforeEach
    void setUp() throws Exception {
        Files.writeString(dir.resolve("hello.sh"), String.join("\n",
                "#!/bin/bash",
                "echo \"hello $1\"",
                "echo 'airplane_output_set {\"greeting\":\"hi\"}'",
                ""));
        Files.writeString(dir.resolve("hello.task.yaml"), String.join("\n",
                "slug: hello",
                "name: Hello",
                "parameters:",
                "  - slug: name",
                "    type: shorttext",
                "    default: World",
                "shell:",
                "  entrypoint: hello.sh",
                ""));
        Files.writeString(dir.resolve("home.view.yaml"), "slug: home\nname: Home\nentrypoint: Home.tsx\n");

        DevServerConfig config = DevServerConfig.defaults()
                .withServerPort(0)
                .withDirectory(dir)
                .withKillGrace(Duration.ofMillis(200));
        deps = Dependencies.create(config, new FakeRemoteApiClient());
        deps.discover();
        server = new DevServer(config, deps.routerHandler());
        baseUrl = "http://127.0.0.1:" + server.start();

        httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(5))
                .build();
    }

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop();
        }
        if (deps != null) {
            deps.close();
        }
    }

    private HttpResponse<String> get(String path) throws Exception {
        return httpClient.send(HttpRequest.newBuilder()
                        .uri(URI.create(baseUrl + path))
                        .GET()
                        .build(),
                HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> post(String path, String body, String... headers) throws Exception {
        HttpRequest.Builder request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body));
        if (headers.length > 0) {
            request.headers(headers);
        }
        return httpClient.send(request.build(), HttpResponse.BodyHandlers.ofString());
    }

    @Test
    void ping() throws Exception {
        HttpResponse<String> response = get("/dev/ping");
        assertEquals(200, response.statusCode());
        assertEquals("{}", response.body());
        assertTrue(server.isRunning());
        assertEquals("*", response.headers().firstValue("Access-Control-Allow-Origin").orElse(null));
    }

    @Test
    @DisplayName("Execute a local task, then read it back through the run endpoints")
    void executeAndReadBack() throws Exception {
        HttpResponse<String> execute = post("/v0/tasks/execute",
                "{\"slug\":\"hello\",\"paramValues\":{\"name\":\"there\"}}");
        assertEquals(200, execute.statusCode(), execute.body());
        JsonNode run = MAPPER.readTree(execute.body());
        String runId = run.get("id").asText();
        assertEquals("Succeeded", run.get("status").asText());
        assertEquals("hello", run.get("taskSlug").asText());

        JsonNode fetched = MAPPER.readTree(get("/v0/runs/get?id=" + runId).body());
        assertEquals("there", fetched.get("paramValues").get("name").asText());

        JsonNode outputs = MAPPER.readTree(get("/v0/runs/getOutputs?id=" + runId).body());
        assertEquals("hi", outputs.get("output").get("greeting").asText());

        JsonNode list = MAPPER.readTree(get("/v0/runs/list?taskSlug=hello").body());
        assertEquals(1, list.get("runs").size());

        JsonNode metadata = MAPPER.readTree(get("/v0/tasks/getMetadata?slug=hello").body());
        assertTrue(metadata.get("isLocal").asBoolean());
    }

    @Test
    @DisplayName("Log stream of a finished run replays history and ends")
    void logStreamOfFinishedRun() throws Exception {
        JsonNode run = MAPPER.readTree(post("/v0/tasks/execute", "{\"slug\":\"hello\"}").body());

        HttpResponse<String> stream = get("/dev/logs/" + run.get("id").asText());

        assertEquals(200, stream.statusCode());
        assertTrue(stream.headers().firstValue("Content-Type").orElse("").startsWith("text/event-stream"));
        assertEquals("*", stream.headers().firstValue("Access-Control-Allow-Origin").orElse(null));
        String firstEvent = stream.body().lines().filter(l -> l.startsWith("data: ")).findFirst().orElseThrow();
        JsonNode item = MAPPER.readTree(firstEvent.substring("data: ".length()));
        assertEquals("hello name=World", item.get("text").asText());
    }

    @Test
    void errorsMapToStatusCodes() throws Exception {
        HttpResponse<String> missingRun = get("/v0/runs/get?id=devrun_missing");
        assertEquals(404, missingRun.statusCode());
        assertTrue(MAPPER.readTree(missingRun.body()).has("error"));

        assertEquals(404, get("/dev/logs/devrun_missing").statusCode());
        assertEquals(404, post("/v0/tasks/execute", "{\"slug\":\"unknown\"}").statusCode());
        assertEquals(400, post("/v0/tasks/execute", "").statusCode());
        assertEquals(400, post("/v0/tasks/execute", "{\"paramValues\":{}}").statusCode());
        assertEquals(404, get("/no/such/route").statusCode());
    }

    @Test
    void envVarRoundTrip() throws Exception {
        assertEquals(200, post("/dev/envVars/upsert", "{\"name\":\"LOG_LEVEL\",\"value\":\"debug\"}").statusCode());

        JsonNode envVar = MAPPER.readTree(get("/dev/envVars/get?name=LOG_LEVEL").body());
        assertEquals("debug", envVar.get("envVar").get("value").asText());
        assertTrue(Files.readString(dir.resolve("airplane.dev.yaml")).contains("LOG_LEVEL"));

        assertEquals(400, post("/dev/envVars/upsert", "{\"name\":\"bad-name\",\"value\":\"x\"}").statusCode());
        assertEquals(200, post("/dev/envVars/delete", "{\"name\":\"LOG_LEVEL\"}").statusCode());
        assertEquals(0, MAPPER.readTree(get("/dev/envVars/list").body()).get("envVars").size());
        assertEquals(404, get("/dev/envVars/get?name=LOG_LEVEL").statusCode());
    }

    @Test
    @DisplayName("A run creates a prompt with its token and the studio submits it")
    void promptFlow() throws Exception {
        String runId = MAPPER.readTree(post("/dev/runs/create", "{}").body()).get("runID").asText();
        String token = LocalRunToken.encode(runId);

        assertEquals(400, post("/v0/prompts/create", "{\"schema\":{}}").statusCode());

        HttpResponse<String> created = post("/v0/prompts/create", "{\"schema\":{\"parameters\":[]}}",
                LocalRunToken.HEADER, token);
        assertEquals(200, created.statusCode(), created.body());
        String promptId = MAPPER.readTree(created.body()).get("id").asText();

        JsonNode prompts = MAPPER.readTree(get("/i/prompts/list?runID=" + runId).body());
        assertEquals(promptId, prompts.get("prompts").get(0).get("id").asText());
        assertTrue(MAPPER.readTree(get("/v0/runs/get?id=" + runId).body()).get("isWaitingForUser").asBoolean());

        HttpResponse<String> submitted = post("/i/prompts/submit",
                "{\"id\":\"" + promptId + "\",\"runID\":\"" + runId + "\",\"values\":{\"ok\":true}}");
        assertEquals(200, submitted.statusCode(), submitted.body());
        assertFalse(MAPPER.readTree(get("/v0/runs/get?id=" + runId).body()).get("isWaitingForUser").asBoolean());
    }

    @Test
    void cancelPreallocatedRun() throws Exception {
        String runId = MAPPER.readTree(post("/dev/runs/create", "{}").body()).get("runID").asText();

        HttpResponse<String> cancelled = post("/i/runs/cancel", "{\"runID\":\"" + runId + "\"}");

        assertEquals(200, cancelled.statusCode(), cancelled.body());
        assertEquals("Cancelled", MAPPER.readTree(cancelled.body()).get("status").asText());
    }

    @Test
    void viewWithEnv() throws Exception {
        JsonNode view = MAPPER.readTree(get("/i/views/get?slug=home").body());

        assertEquals("Home", view.get("name").asText());
        assertEquals("home", view.get("envVars").get("AIRPLANE_VIEW_SLUG").asText());
        assertEquals(400, get("/i/views/get?slug=missing").statusCode());
    }

    @Test
    void preflightIsAnswered() throws Exception {
        HttpResponse<String> response = httpClient.send(HttpRequest.newBuilder()
                        .uri(URI.create(baseUrl + "/v0/tasks/execute"))
                        .method("OPTIONS", HttpRequest.BodyPublishers.noBody())
                        .build(),
                HttpResponse.BodyHandlers.ofString());

        assertEquals(200, response.statusCode());
        assertTrue(response.headers().firstValue("Access-Control-Allow-Methods").orElse("").contains("POST"));
    }
}
