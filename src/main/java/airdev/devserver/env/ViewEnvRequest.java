package airdev.devserver.env;

import airdev.devserver.model.ConfigVar;
import airdev.devserver.model.EnvVarValue;
import airdev.devserver.remote.AuthInfo;

import java.util.Map;

/**
 * Inputs of the view variant of the env pipeline.
 *
 * @param apiHeaders headers the view's SDK should send, serialized into {@code AIRPLANE_API_HEADERS}
 */
public record ViewEnvRequest(
        String slug,
        String name,
        String viewUrl,
        Map<String, EnvVarValue> viewEnv,
        Map<String, String> devConfigEnv,
        Map<String, ConfigVar> configVars,
        String fallbackEnvSlug,
        AuthInfo authInfo,
        Map<String, String> apiHeaders) {

    public ViewEnvRequest {
        viewEnv = viewEnv == null ? Map.of() : viewEnv;
        devConfigEnv = devConfigEnv == null ? Map.of() : devConfigEnv;
        configVars = configVars == null ? Map.of() : configVars;
        fallbackEnvSlug = fallbackEnvSlug == null ? "" : fallbackEnvSlug;
        authInfo = authInfo == null ? AuthInfo.anonymous() : authInfo;
        apiHeaders = apiHeaders == null ? Map.of() : apiHeaders;
    }
}
