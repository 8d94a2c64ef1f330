package airdev.devserver.remote;

import airdev.devserver.model.ConfigVar;
import airdev.devserver.model.Resource;
import airdev.devserver.util.Json;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link RemoteApiClient} speaking JSON over {@link HttpClient}.
 *
 * Every request carries the API key and team id headers. Non-2xx responses become
 * {@link RemoteApiException} with the body's {@code error} field as message when present.
 */
public class HttpRemoteApiClient implements RemoteApiClient {

    private static final Logger log = LoggerFactory.getLogger(HttpRemoteApiClient.class);

    static final String API_KEY_HEADER = "X-Airplane-API-Key";
    static final String TEAM_ID_HEADER = "X-Team-ID";
    private static final String BASE_PATH = "/v0";

    private final URI baseUri;
    private final String apiKey;
    private final String teamId;
    private final Duration timeout;
    private final HttpClient httpClient;
    private final ObjectMapper mapper = Json.mapper();

    public HttpRemoteApiClient(String apiHost, String apiKey, String teamId, Duration timeout) {
        this.baseUri = URI.create(normalizeHost(apiHost));
        this.apiKey = apiKey == null ? "" : apiKey;
        this.teamId = teamId == null ? "" : teamId;
        this.timeout = timeout;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
    }

    @Override
    public boolean isConfigured() {
        return !apiKey.isEmpty();
    }

    @Override
    public JsonNode evaluateTemplate(EvaluateTemplateRequest request) {
        JsonNode body = post("/templates/evaluate", request);
        return body.path("value");
    }

    @Override
    public ConfigVar getConfig(String name, String envSlug, boolean showSecret) {
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("name", name);
        request.put("tag", "");
        request.put("showSecret", showSecret);
        request.put("envSlug", envSlug == null ? "" : envSlug);
        JsonNode config = post("/configs/get", request).path("config");
        return toConfigVar(config, envSlug);
    }

    @Override
    public List<ConfigVar> listConfigs(String envSlug) {
        JsonNode body = get("/configs/list", Map.of("envSlug", nullToEmpty(envSlug)));
        List<ConfigVar> configs = new ArrayList<>();
        for (JsonNode config : body.path("configs")) {
            configs.add(toConfigVar(config, envSlug));
        }
        return configs;
    }

    @Override
    public RemoteEnv getEnv(String envSlug) {
        JsonNode body = get("/envs/get", Map.of("slug", nullToEmpty(envSlug)));
        return convert(body, RemoteEnv.class);
    }

    @Override
    public List<Resource> listResources(String envSlug) {
        JsonNode body = get("/resources/list", Map.of("envSlug", nullToEmpty(envSlug)));
        List<Resource> resources = new ArrayList<>();
        for (JsonNode resource : body.path("resources")) {
            resources.add(convert(resource, Resource.class));
        }
        return resources;
    }

    @Override
    public String runTask(String slug, Map<String, Object> paramValues, String envSlug) {
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("slug", slug);
        request.put("paramValues", paramValues == null ? Map.of() : paramValues);
        request.put("envSlug", nullToEmpty(envSlug));
        return post("/tasks/execute", request).path("runID").asText("");
    }

    @Override
    public AuthInfo authInfo() {
        return convert(get("/auth/info", Map.of()), AuthInfo.class);
    }

    private JsonNode get(String path, Map<String, String> query) {
        HttpRequest request = newRequest(path, query).GET().build();
        return send(request, path);
    }

    private JsonNode post(String path, Object body) {
        HttpRequest request = newRequest(path, Map.of())
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(Json.write(body)))
                .build();
        return send(request, path);
    }

    private HttpRequest.Builder newRequest(String path, Map<String, String> query) {
        StringBuilder uri = new StringBuilder(baseUri.toString()).append(BASE_PATH).append(path);
        String sep = "?";
        for (Map.Entry<String, String> e : query.entrySet()) {
            uri.append(sep)
                    .append(URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8))
                    .append('=')
                    .append(URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8));
            sep = "&";
        }
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(uri.toString()))
                .timeout(timeout)
                .header("Accept", "application/json");
        if (!apiKey.isEmpty()) {
            builder.header(API_KEY_HEADER, apiKey);
        }
        if (!teamId.isEmpty()) {
            builder.header(TEAM_ID_HEADER, teamId);
        }
        return builder;
    }

    private JsonNode send(HttpRequest request, String path) {
        if (!isConfigured()) {
            throw new RemoteApiException(401, "not logged in: set AIRPLANE_API_KEY to call " + path);
        }
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new RemoteApiException("calling " + path + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RemoteApiException("interrupted calling " + path, e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            String message = errorMessage(response.body(), status);
            log.debug("Remote API {} returned {}: {}", path, status, message);
            throw new RemoteApiException(status, message);
        }
        String body = response.body();
        if (body == null || body.isBlank()) {
            return mapper.createObjectNode();
        }
        try {
            return mapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new RemoteApiException("invalid JSON from " + path + ": " + e.getOriginalMessage(), e);
        }
    }

    private String errorMessage(String body, int status) {
        if (body != null && !body.isBlank()) {
            try {
                JsonNode node = mapper.readTree(body);
                JsonNode error = node.path("error");
                if (error.isTextual() && !error.asText().isEmpty()) {
                    return error.asText();
                }
            } catch (JsonProcessingException e) {
                log.trace("Error body is not JSON", e);
            }
            return body.length() > 200 ? body.substring(0, 200) : body;
        }
        return "request failed with status " + status;
    }

    private <T> T convert(JsonNode node, Class<T> type) {
        try {
            return mapper.treeToValue(node, type);
        } catch (JsonProcessingException e) {
            throw new RemoteApiException("unexpected " + type.getSimpleName() + " payload: "
                    + e.getOriginalMessage(), e);
        }
    }

    private static ConfigVar toConfigVar(JsonNode config, String envSlug) {
        if (!(config instanceof ObjectNode)) {
            throw new RemoteApiException(404, "config not found");
        }
        return ConfigVar.remote(
                config.path("name").asText(),
                config.path("value").asText(""),
                config.path("isSecret").asBoolean(false),
                envSlug);
    }

    private static String normalizeHost(String host) {
        String h = host == null || host.isBlank() ? "https://api.airplane.dev" : host.strip();
        if (!h.startsWith("http://") && !h.startsWith("https://")) {
            h = "https://" + h;
        }
        while (h.endsWith("/")) {
            h = h.substring(0, h.length() - 1);
        }
        return h;
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
