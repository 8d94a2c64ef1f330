package airdev.devserver.service;

import airdev.devserver.config.DevServerConfig;
import airdev.devserver.discovery.TaskCatalog;
import airdev.devserver.env.EnvVarResolver;
import airdev.devserver.env.ViewEnvRequest;
import airdev.devserver.model.ConfigVar;
import airdev.devserver.model.ViewConfig;
import airdev.devserver.remote.AuthInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Locally discovered views and the env their dev bundle is started with.
 */
public class ViewService {

    private static final Logger log = LoggerFactory.getLogger(ViewService.class);

    static final String FALLBACK_ENV_HEADER = "X-Airplane-Studio-Fallback-Env-Slug";

    private final TaskCatalog catalog;
    private final ConfigService configs;
    private final EnvVarResolver resolver;
    private final AuthInfo authInfo;
    private final DevServerConfig config;

    public ViewService(TaskCatalog catalog,
                       ConfigService configs,
                       EnvVarResolver resolver,
                       AuthInfo authInfo,
                       DevServerConfig config) {
        this.catalog = catalog;
        this.configs = configs;
        this.resolver = resolver;
        this.authInfo = authInfo;
        this.config = config;
    }

    /**
     * A view with its resolved env.
     *
     * @param envSlug requested fallback env, null for the server default
     * @throws IllegalArgumentException if the slug is missing or unknown
     */
    public ViewInfo getView(String slug, String envSlug) {
        if (slug == null || slug.isEmpty()) {
            throw new IllegalArgumentException("view slug was not supplied");
        }
        ViewConfig view = catalog.view(slug)
                .orElseThrow(() -> new IllegalArgumentException("view with slug \"" + slug + "\" not found"));
        String effectiveEnv = envSlug != null ? envSlug : config.envSlug();

        Map<String, String> devConfigEnv = configs.devConfig().envVars();
        Map<String, ConfigVar> configVars = devConfigEnv.isEmpty() && view.env().isEmpty()
                ? configs.devConfig().configVars()
                : configs.mergedConfigs(effectiveEnv);

        Map<String, String> headers = new LinkedHashMap<>();
        if (effectiveEnv != null) {
            headers.put(FALLBACK_ENV_HEADER, effectiveEnv);
        }

        Map<String, String> env = resolver.resolveView(new ViewEnvRequest(
                view.slug(),
                view.name(),
                config.studioUrl("/view/" + view.slug()),
                view.env(),
                devConfigEnv,
                configVars,
                effectiveEnv,
                authInfo,
                headers));
        log.debug("Resolved {} env vars for view {}", env.size(), slug);
        return new ViewInfo(view.slug(), view.name(),
                view.entrypoint() == null ? null : view.entrypoint().toString(),
                view.definitionFile() == null ? null : view.definitionFile().toString(),
                env);
    }

    /**
     * @param entrypoint absolute path of the view's entrypoint
     * @param file       absolute path of the definition file
     * @param envVars    env the view bundle is started with
     */
    public record ViewInfo(String slug, String name, String entrypoint, String file, Map<String, String> envVars) {
    }
}
