package airdev.devserver.remote;

import airdev.devserver.model.ConfigVar;
import airdev.devserver.model.Resource;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;

/**
 * Calls the dev server makes to the remote platform.
 * All methods throw {@link RemoteApiException} on failure.
 */
public interface RemoteApiClient {

    /**
     * Expand template expressions inside {@code request.value()}.
     *
     * @return the value with every template replaced
     */
    JsonNode evaluateTemplate(EvaluateTemplateRequest request);

    /**
     * Fetch one config variable.
     *
     * @param showSecret return the decrypted value of a secret
     */
    ConfigVar getConfig(String name, String envSlug, boolean showSecret);

    List<ConfigVar> listConfigs(String envSlug);

    RemoteEnv getEnv(String envSlug);

    List<Resource> listResources(String envSlug);

    /**
     * Start a task run on the remote platform.
     *
     * @return the remote run id
     */
    String runTask(String slug, Map<String, Object> paramValues, String envSlug);

    AuthInfo authInfo();

    /** Whether credentials are configured; calls fail fast otherwise. */
    boolean isConfigured();
}
