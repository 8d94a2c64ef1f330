package airdev.devserver.remote;

import airdev.devserver.model.ConfigVar;
import airdev.devserver.model.Resource;
import airdev.devserver.util.Json;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * In-memory remote platform for tests. Unconfigured by default, so every call fails like a
 * client without an API key.
 */
public class FakeRemoteApiClient implements RemoteApiClient {

    public final Map<String, List<ConfigVar>> configsByEnv = new HashMap<>();
    public final Map<String, List<Resource>> resourcesByEnv = new HashMap<>();
    public final Map<String, String> secrets = new HashMap<>();
    public final List<EvaluateTemplateRequest> evaluations = new CopyOnWriteArrayList<>();
    public final List<String> startedTasks = new CopyOnWriteArrayList<>();
    public final Map<String, String> remoteTaskSlugs = new HashMap<>();

    public boolean configured;
    public AuthInfo auth = AuthInfo.anonymous();
    /** Template evaluation; identity unless replaced. */
    public Function<EvaluateTemplateRequest, JsonNode> evaluator = req -> Json.mapper().valueToTree(req.value());

    public FakeRemoteApiClient configured() {
        this.configured = true;
        return this;
    }

    private void requireConfigured() {
        if (!configured) {
            throw new RemoteApiException(401, "not logged in");
        }
    }

    @Override
    public JsonNode evaluateTemplate(EvaluateTemplateRequest request) {
        requireConfigured();
        evaluations.add(request);
        return evaluator.apply(request);
    }

    @Override
    public ConfigVar getConfig(String name, String envSlug, boolean showSecret) {
        requireConfigured();
        String value = secrets.get(name);
        if (value == null) {
            throw new RemoteApiException(404, "config " + name + " not found");
        }
        return ConfigVar.remote(name, value, true, envSlug);
    }

    @Override
    public List<ConfigVar> listConfigs(String envSlug) {
        requireConfigured();
        return new ArrayList<>(configsByEnv.getOrDefault(envSlug, List.of()));
    }

    @Override
    public RemoteEnv getEnv(String envSlug) {
        requireConfigured();
        return new RemoteEnv("env-" + envSlug, envSlug, envSlug, false);
    }

    @Override
    public List<Resource> listResources(String envSlug) {
        requireConfigured();
        return new ArrayList<>(resourcesByEnv.getOrDefault(envSlug, List.of()));
    }

    @Override
    public String runTask(String slug, Map<String, Object> paramValues, String envSlug) {
        requireConfigured();
        String runId = remoteTaskSlugs.get(slug);
        if (runId == null) {
            throw new RemoteApiException(404, "task " + slug + " not found");
        }
        startedTasks.add(slug);
        return runId;
    }

    @Override
    public AuthInfo authInfo() {
        requireConfigured();
        return auth;
    }

    @Override
    public boolean isConfigured() {
        return configured;
    }
}
