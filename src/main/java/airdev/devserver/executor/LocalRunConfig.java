package airdev.devserver.executor;

import airdev.devserver.model.ConfigVar;
import airdev.devserver.model.EnvVarValue;
import airdev.devserver.model.Resource;
import airdev.devserver.model.StdApiRequest;
import airdev.devserver.model.TaskKind;
import airdev.devserver.remote.AuthInfo;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Everything needed to run one task locally.
 * A run is a builtin when {@link #stdApiRequest()} is set; it then has no entrypoint.
 */
public final class LocalRunConfig {
    private final String runId;
    private final String parentRunId;
    private final String slug;
    private final String name;
    private final TaskKind kind;
    private final Map<String, Object> kindOptions;
    private final Map<String, Object> paramValues;
    private final Path entrypoint;
    private final StdApiRequest stdApiRequest;
    private final Map<String, EnvVarValue> taskEnv;
    private final Map<String, String> devConfigEnv;
    private final Map<String, ConfigVar> configVars;
    private final String fallbackEnvSlug;
    private final Map<String, Resource> aliasToResource;
    private final AuthInfo authInfo;
    private final String apiHost;
    private final String taskUrl;
    private final String runUrl;
    private final String tunnelToken;

    private LocalRunConfig(Builder b) {
        this.runId = Objects.requireNonNull(b.runId, "runId is required");
        this.parentRunId = b.parentRunId;
        this.slug = Objects.requireNonNull(b.slug, "slug is required");
        this.name = b.name == null ? b.slug : b.name;
        this.kind = b.kind;
        this.kindOptions = b.kindOptions;
        this.paramValues = b.paramValues;
        this.entrypoint = b.entrypoint;
        this.stdApiRequest = b.stdApiRequest;
        this.taskEnv = b.taskEnv;
        this.devConfigEnv = b.devConfigEnv;
        this.configVars = b.configVars;
        this.fallbackEnvSlug = b.fallbackEnvSlug;
        this.aliasToResource = b.aliasToResource;
        this.authInfo = b.authInfo;
        this.apiHost = b.apiHost;
        this.taskUrl = b.taskUrl;
        this.runUrl = b.runUrl;
        this.tunnelToken = b.tunnelToken;
    }

    public String runId() {
        return runId;
    }

    public String parentRunId() {
        return parentRunId;
    }

    public String slug() {
        return slug;
    }

    public String name() {
        return name;
    }

    public TaskKind kind() {
        return kind;
    }

    public Map<String, Object> kindOptions() {
        return kindOptions;
    }

    public Map<String, Object> paramValues() {
        return paramValues;
    }

    public Path entrypoint() {
        return entrypoint;
    }

    public StdApiRequest stdApiRequest() {
        return stdApiRequest;
    }

    public boolean isBuiltin() {
        return stdApiRequest != null;
    }

    public Map<String, EnvVarValue> taskEnv() {
        return taskEnv;
    }

    public Map<String, String> devConfigEnv() {
        return devConfigEnv;
    }

    public Map<String, ConfigVar> configVars() {
        return configVars;
    }

    public String fallbackEnvSlug() {
        return fallbackEnvSlug;
    }

    public Map<String, Resource> aliasToResource() {
        return aliasToResource;
    }

    public AuthInfo authInfo() {
        return authInfo;
    }

    public String apiHost() {
        return apiHost;
    }

    public String taskUrl() {
        return taskUrl;
    }

    public String runUrl() {
        return runUrl;
    }

    public String tunnelToken() {
        return tunnelToken;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String runId;
        private String parentRunId;
        private String slug;
        private String name;
        private TaskKind kind;
        private Map<String, Object> kindOptions = Map.of();
        private Map<String, Object> paramValues = Map.of();
        private Path entrypoint;
        private StdApiRequest stdApiRequest;
        private Map<String, EnvVarValue> taskEnv = Map.of();
        private Map<String, String> devConfigEnv = Map.of();
        private Map<String, ConfigVar> configVars = Map.of();
        private String fallbackEnvSlug = "";
        private Map<String, Resource> aliasToResource = Map.of();
        private AuthInfo authInfo = AuthInfo.anonymous();
        private String apiHost = "";
        private String taskUrl = "";
        private String runUrl = "";
        private String tunnelToken;

        public Builder runId(String runId) {
            this.runId = runId;
            return this;
        }

        public Builder parentRunId(String parentRunId) {
            this.parentRunId = parentRunId;
            return this;
        }

        public Builder slug(String slug) {
            this.slug = slug;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder kind(TaskKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder kindOptions(Map<String, Object> kindOptions) {
            this.kindOptions = kindOptions == null ? Map.of() : kindOptions;
            return this;
        }

        public Builder paramValues(Map<String, Object> paramValues) {
            this.paramValues = paramValues == null ? Map.of() : paramValues;
            return this;
        }

        public Builder entrypoint(Path entrypoint) {
            this.entrypoint = entrypoint;
            return this;
        }

        public Builder stdApiRequest(StdApiRequest stdApiRequest) {
            this.stdApiRequest = stdApiRequest;
            return this;
        }

        public Builder taskEnv(Map<String, EnvVarValue> taskEnv) {
            this.taskEnv = taskEnv == null ? Map.of() : taskEnv;
            return this;
        }

        public Builder devConfigEnv(Map<String, String> devConfigEnv) {
            this.devConfigEnv = devConfigEnv == null ? Map.of() : devConfigEnv;
            return this;
        }

        public Builder configVars(Map<String, ConfigVar> configVars) {
            this.configVars = configVars == null ? Map.of() : configVars;
            return this;
        }

        public Builder fallbackEnvSlug(String fallbackEnvSlug) {
            this.fallbackEnvSlug = fallbackEnvSlug == null ? "" : fallbackEnvSlug;
            return this;
        }

        public Builder aliasToResource(Map<String, Resource> aliasToResource) {
            this.aliasToResource = aliasToResource == null ? Map.of() : aliasToResource;
            return this;
        }

        public Builder authInfo(AuthInfo authInfo) {
            this.authInfo = authInfo == null ? AuthInfo.anonymous() : authInfo;
            return this;
        }

        public Builder apiHost(String apiHost) {
            this.apiHost = apiHost;
            return this;
        }

        public Builder taskUrl(String taskUrl) {
            this.taskUrl = taskUrl;
            return this;
        }

        public Builder runUrl(String runUrl) {
            this.runUrl = runUrl;
            return this;
        }

        public Builder tunnelToken(String tunnelToken) {
            this.tunnelToken = tunnelToken;
            return this;
        }

        public LocalRunConfig build() {
            return new LocalRunConfig(this);
        }
    }
}
