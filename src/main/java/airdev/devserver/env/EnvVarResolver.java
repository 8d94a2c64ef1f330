package airdev.devserver.env;

import airdev.devserver.model.ConfigVar;
import airdev.devserver.model.EnvVarValue;
import airdev.devserver.remote.RemoteApiClient;
import airdev.devserver.remote.RemoteApiException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Layered env resolution for task runs and views.
 *
 * Task layers, later wins: declared entries, dotenv files, dev config overrides; then config
 * references are materialized, templates interpolated and built-in variables appended.
 * Any failure aborts resolution, so a run never starts with a partial environment.
 */
public class EnvVarResolver {

    private static final Logger log = LoggerFactory.getLogger(EnvVarResolver.class);

    /** Server env vars passed through to tasks. */
    static final Set<String> ALLOWED_SYSTEM_VARS = Set.of("HOME", "PATH");

    private final RemoteApiClient remote;
    private final Map<String, String> systemEnv;

    public EnvVarResolver(RemoteApiClient remote) {
        this(remote, System.getenv());
    }

    public EnvVarResolver(RemoteApiClient remote, Map<String, String> systemEnv) {
        this.remote = remote;
        this.systemEnv = systemEnv;
    }

    /**
     * Final {@code KEY=VALUE} list of a task run.
     *
     * @param interpolator template evaluation bound to the run
     * @throws EnvResolutionException on a missing config, a failed secret fetch or failed interpolation
     */
    public List<String> resolveTask(TaskEnvRequest req, TemplateInterpolator interpolator) {
        Map<String, String> env = new LinkedHashMap<>(filteredSystemEnv());

        if (req.hasRuntime()) {
            Map<String, String> dotEnv = req.entrypoint() == null
                    ? Map.of()
                    : DotEnvFiles.read(req.root(), req.entrypoint());
            Map<String, EnvVarValue> layered = applyOverrides(req.taskEnv(), dotEnv, req.devConfigEnv());
            Map<String, String> materialized = materialize(layered, req.configVars(), req.fallbackEnvSlug());
            if (!materialized.isEmpty()) {
                env.putAll(interpolator.interpolateEnv(materialized));
            }
        }

        env.putAll(BuiltinEnvVars.forTask(req));
        log.debug("Resolved {} env vars for run {}", env.size(), req.runId());
        return toList(env);
    }

    /**
     * Env of a view. Views read no dotenv files and skip interpolation.
     */
    public Map<String, String> resolveView(ViewEnvRequest req) {
        Map<String, EnvVarValue> layered = applyOverrides(req.viewEnv(), Map.of(), req.devConfigEnv());
        Map<String, String> env = new LinkedHashMap<>(materialize(layered, req.configVars(), req.fallbackEnvSlug()));
        env.putAll(BuiltinEnvVars.forView(req));
        return env;
    }

    static Map<String, EnvVarValue> applyOverrides(Map<String, EnvVarValue> declared,
                                                   Map<String, String> dotEnv,
                                                   Map<String, String> devConfigEnv) {
        Map<String, EnvVarValue> out = new LinkedHashMap<>(declared);
        dotEnv.forEach((k, v) -> out.put(k, EnvVarValue.of(v)));
        devConfigEnv.forEach((k, v) -> out.put(k, EnvVarValue.of(v)));
        return out;
    }

    /**
     * Replace config references with values. Remote secrets are fetched decrypted.
     */
    Map<String, String> materialize(Map<String, EnvVarValue> vars,
                                    Map<String, ConfigVar> configVars,
                                    String fallbackEnvSlug) {
        Map<String, String> out = new LinkedHashMap<>();
        for (Map.Entry<String, EnvVarValue> e : vars.entrySet()) {
            String key = e.getKey();
            EnvVarValue v = e.getValue();
            if (!v.isConfigRef()) {
                if (v.value() != null) {
                    out.put(key, v.value());
                }
                continue;
            }
            ConfigVar config = configVars.get(v.config());
            if (config == null) {
                throw new EnvResolutionException(missingConfigMessage(key, v.config(), fallbackEnvSlug));
            }
            out.put(key, configValue(key, config));
        }
        return out;
    }

    private String configValue(String envKey, ConfigVar config) {
        if (!config.remote() || !config.secret()) {
            return config.value() == null ? "" : config.value();
        }
        try {
            ConfigVar decrypted = remote.getConfig(config.name(), config.envSlug(), true);
            return decrypted.value() == null ? "" : decrypted.value();
        } catch (RemoteApiException e) {
            throw new EnvResolutionException("getting config var " + config.name()
                    + " (referenced by env var " + envKey + "): " + e.getMessage(), e);
        }
    }

    static String missingConfigMessage(String envKey, String configName, String fallbackEnvSlug) {
        StringBuilder msg = new StringBuilder("Config var ").append(configName)
                .append(" not defined in airplane.dev.yaml");
        if (fallbackEnvSlug != null && !fallbackEnvSlug.isEmpty()) {
            msg.append(" or remotely in env ").append(fallbackEnvSlug);
        }
        msg.append(" (referenced by env var ").append(envKey)
                .append("). Please use the configs tab on the left to add it.");
        return msg.toString();
    }

    private Map<String, String> filteredSystemEnv() {
        Map<String, String> out = new LinkedHashMap<>();
        for (String key : ALLOWED_SYSTEM_VARS) {
            String value = systemEnv.get(key);
            if (value != null) {
                out.put(key, value);
            }
        }
        return out;
    }

    static List<String> toList(Map<String, String> env) {
        List<String> out = new ArrayList<>(env.size());
        env.forEach((k, v) -> out.add(k + "=" + v));
        return out;
    }
}
