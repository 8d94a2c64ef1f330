package airdev.devserver.service;

import airdev.devserver.config.DevConfig;
import airdev.devserver.model.ConfigVar;
import airdev.devserver.model.Resource;
import airdev.devserver.remote.RemoteApiClient;
import airdev.devserver.remote.RemoteApiException;
import airdev.devserver.remote.RemoteEnv;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Config variables and resources visible to local runs: the dev config file, plus the fallback
 * remote environment when one is selected. Local definitions win over remote ones.
 */
public class ConfigService {

    private static final Logger log = LoggerFactory.getLogger(ConfigService.class);

    private static final Pattern ENV_VAR_NAME = Pattern.compile("^[A-Za-z_]+[A-Za-z0-9_]*$");

    private final RemoteApiClient remote;
    private final DevConfig devConfig;
    private final ConcurrentHashMap<String, RemoteEnv> envCache = new ConcurrentHashMap<>();

    public ConfigService(RemoteApiClient remote, DevConfig devConfig) {
        this.remote = remote;
        this.devConfig = devConfig;
    }

    public DevConfig devConfig() {
        return devConfig;
    }

    /**
     * Config variables by name.
     *
     * @param envSlug fallback remote env, or null for local configs only
     */
    public Map<String, ConfigVar> mergedConfigs(String envSlug) {
        Map<String, ConfigVar> merged = new LinkedHashMap<>(devConfig.configVars());
        if (envSlug == null) {
            return merged;
        }
        try {
            for (ConfigVar cv : remote.listConfigs(envSlug)) {
                merged.putIfAbsent(cv.name(), cv);
            }
        } catch (RemoteApiException e) {
            throw new RemoteApiException(e.status(), "listing remote configs: " + e.getMessage());
        }
        return merged;
    }

    /**
     * Resources by slug.
     *
     * @param envSlug fallback remote env, or null for local resources only
     */
    public Map<String, Resource> mergedResources(String envSlug) {
        Map<String, Resource> merged = new LinkedHashMap<>(devConfig.resources());
        if (envSlug == null) {
            return merged;
        }
        try {
            for (Resource r : remote.listResources(envSlug)) {
                merged.putIfAbsent(r.slug(), r);
            }
        } catch (RemoteApiException e) {
            throw new RemoteApiException(e.status(), "merging local and remote resources: " + e.getMessage());
        }
        return merged;
    }

    /**
     * Resolve a task's attachments (alias to slug or name) to resources.
     *
     * @throws NotFoundException if an attachment names an unknown resource
     */
    public Map<String, Resource> aliasToResource(Map<String, String> attachments,
                                                 Map<String, Resource> slugToResource,
                                                 String envSlug) {
        Map<String, Resource> out = new LinkedHashMap<>();
        attachments.forEach((alias, ref) -> {
            Resource resource = lookup(slugToResource, ref).orElseThrow(() -> {
                String msg = "cannot find resource \"" + ref + "\". Is it defined in your dev config file";
                if (envSlug != null) {
                    msg += " or in your " + envSlug + " environment";
                }
                return new NotFoundException(msg + "?");
            });
            out.put(alias, resource);
        });
        return out;
    }

    /** Find a resource by slug, then by name. */
    public static Optional<Resource> lookup(Map<String, Resource> slugToResource, String ref) {
        Resource bySlug = slugToResource.get(ref);
        if (bySlug != null) {
            return Optional.of(bySlug);
        }
        return slugToResource.values().stream().filter(r -> ref.equals(r.name())).findFirst();
    }

    /** Alias to resource id, as stored on a run. */
    public static Map<String, String> aliasToId(Map<String, Resource> aliasToResource) {
        Map<String, String> out = new LinkedHashMap<>();
        aliasToResource.forEach((alias, r) -> out.put(alias, r.id()));
        return out;
    }

    /**
     * Remote environment by slug; fetched once per slug.
     */
    public RemoteEnv env(String envSlug) {
        return envCache.computeIfAbsent(envSlug, slug -> {
            log.debug("Fetching remote env {}", slug);
            return remote.getEnv(slug);
        });
    }

    /**
     * @throws NotFoundException if the dev config has no such env var
     */
    public String envVar(String name) {
        requireName(name);
        String value = devConfig.envVars().get(name);
        if (value == null) {
            throw new NotFoundException("env var with name " + name + " not found");
        }
        return value;
    }

    /** Dev config env vars sorted by name. */
    public Map<String, String> envVars() {
        return new TreeMap<>(devConfig.envVars());
    }

    public void upsertEnvVar(String name, String value) {
        requireName(name);
        if (!ENV_VAR_NAME.matcher(name).matches()) {
            throw new IllegalArgumentException("invalid env var name " + name
                    + ", must consist only of alphanumeric characters and underscores");
        }
        devConfig.setEnvVar(name, value == null ? "" : value);
    }

    public void deleteEnvVar(String name) {
        requireName(name);
        if (!devConfig.deleteEnvVar(name)) {
            throw new NotFoundException("Environment variable \"" + name + "\" not found in dev config file");
        }
    }

    private static void requireName(String name) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("name cannot be empty");
        }
    }
}
