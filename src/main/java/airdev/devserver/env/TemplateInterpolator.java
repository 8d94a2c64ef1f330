package airdev.devserver.env;

import airdev.devserver.model.Resource;
import airdev.devserver.remote.EvaluateTemplateRequest;
import airdev.devserver.remote.RemoteApiClient;
import airdev.devserver.remote.RemoteApiException;
import airdev.devserver.remote.RemoteEnv;
import airdev.devserver.util.Json;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Expands {@code {{ }}} expressions of one run through the remote template endpoint.
 *
 * The base request (run, task, env, params, configs, resources) is built once per run and
 * reused for env vars, resources and kind options.
 */
public class TemplateInterpolator {

    private static final String TEMPLATE_MARKER = "{{";
    private static final Set<String> IDENTITY_FIELDS = Set.of("id", "slug", "name", "kind");

    private final RemoteApiClient remote;
    private final EvaluateTemplateRequest base;
    private final ObjectMapper mapper = Json.mapper();

    public TemplateInterpolator(RemoteApiClient remote, EvaluateTemplateRequest base) {
        this.remote = remote;
        this.base = base;
    }

    /**
     * Base request shared by every evaluation of a run.
     */
    public static EvaluateTemplateRequest baseRequest(String runId, String parentRunId, String taskSlug,
                                                      Map<String, Object> paramValues,
                                                      Map<String, String> configs,
                                                      Map<String, Resource> resources) {
        return new EvaluateTemplateRequest(null, runId, RemoteEnv.studio(), resources, configs, paramValues,
                runId, taskSlug, parentRunId == null ? "" : parentRunId, false);
    }

    public EvaluateTemplateRequest base() {
        return base;
    }

    /**
     * Evaluate one value.
     *
     * @param strict fail on references that cannot be resolved
     * @throws EnvResolutionException with the remote error message
     */
    public JsonNode interpolate(Object value, boolean strict) {
        try {
            return remote.evaluateTemplate(base.with(value, strict));
        } catch (RemoteApiException e) {
            throw new EvaluationException(e.getMessage(), e);
        }
    }

    /**
     * Interpolate env values in strict mode. Skipped when no value holds a template.
     */
    public Map<String, String> interpolateEnv(Map<String, String> env) {
        if (!containsTemplate(env.values())) {
            return env;
        }
        JsonNode result = interpolate(env, true);
        if (!result.isObject()) {
            throw new EnvResolutionException("expected interpolated env vars to be a map, got " + result.getNodeType());
        }
        Map<String, String> out = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = result.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode v = field.getValue();
            out.put(field.getKey(), v.isTextual() ? v.asText() : v.toString());
        }
        return out;
    }

    /**
     * Interpolate resource attributes with strict mode off. Each resource keeps its identity.
     * Skipped when no attribute holds a template.
     */
    public Map<String, Resource> interpolateResources(Map<String, Resource> resources) {
        if (resources.isEmpty() || !Json.write(resources).contains(TEMPLATE_MARKER)) {
            return resources;
        }
        JsonNode result = interpolate(resources, false);
        if (!result.isObject()) {
            throw new EnvResolutionException("expected interpolated resources to be a map");
        }
        Map<String, Resource> out = new LinkedHashMap<>();
        for (Map.Entry<String, Resource> e : resources.entrySet()) {
            JsonNode node = result.get(e.getKey());
            if (node == null || !node.isObject()) {
                throw new EnvResolutionException("expected resource " + e.getKey() + " to be a map");
            }
            Resource original = e.getValue();
            Map<String, Object> attributes = toMap(node);
            attributes.keySet().removeAll(IDENTITY_FIELDS);
            out.put(e.getKey(), original.withAttributes(attributes));
        }
        return out;
    }

    /**
     * Interpolate kind options with strict mode off. Skipped when no option holds a template.
     */
    public Map<String, Object> interpolateKindOptions(Map<String, Object> kindOptions) {
        if (kindOptions.isEmpty() || !Json.write(kindOptions).contains(TEMPLATE_MARKER)) {
            return kindOptions;
        }
        JsonNode result = interpolate(kindOptions, false);
        if (!result.isObject()) {
            throw new EnvResolutionException("expected interpolated kind options to be a map");
        }
        return toMap(result);
    }

    private Map<String, Object> toMap(JsonNode node) {
        try {
            return mapper.convertValue(node, new TypeReference<LinkedHashMap<String, Object>>() { });
        } catch (IllegalArgumentException e) {
            throw new EnvResolutionException("unexpected interpolation result: " + e.getMessage(), e);
        }
    }

    static boolean containsTemplate(Iterable<String> values) {
        for (String v : values) {
            if (v != null && v.contains(TEMPLATE_MARKER)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Remote evaluation failed; carries only the remote message.
     */
    public static class EvaluationException extends EnvResolutionException {
        public EvaluationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
