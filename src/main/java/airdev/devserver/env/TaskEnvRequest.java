package airdev.devserver.env;

import airdev.devserver.model.ConfigVar;
import airdev.devserver.model.EnvVarValue;
import airdev.devserver.model.Resource;
import airdev.devserver.remote.AuthInfo;

import java.nio.file.Path;
import java.util.Map;

/**
 * Everything the env pipeline needs to know about one task run.
 * Builtin runs have no runtime root and skip the declared, dotenv and config layers.
 */
public final class TaskEnvRequest {
    private final String runId;
    private final String parentRunId;
    private final String taskSlug;
    private final String taskName;
    private final Map<String, EnvVarValue> taskEnv;
    private final Map<String, String> devConfigEnv;
    private final Map<String, ConfigVar> configVars;
    private final String fallbackEnvSlug;
    private final Path root;
    private final Path entrypoint;
    private final AuthInfo authInfo;
    private final String apiHost;
    private final String taskUrl;
    private final String runUrl;
    private final Map<String, Resource> aliasToResource;
    private final String tunnelToken;

    private TaskEnvRequest(Builder b) {
        this.runId = b.runId;
        this.parentRunId = b.parentRunId;
        this.taskSlug = b.taskSlug;
        this.taskName = b.taskName;
        this.taskEnv = b.taskEnv;
        this.devConfigEnv = b.devConfigEnv;
        this.configVars = b.configVars;
        this.fallbackEnvSlug = b.fallbackEnvSlug;
        this.root = b.root;
        this.entrypoint = b.entrypoint;
        this.authInfo = b.authInfo == null ? AuthInfo.anonymous() : b.authInfo;
        this.apiHost = b.apiHost;
        this.taskUrl = b.taskUrl;
        this.runUrl = b.runUrl;
        this.aliasToResource = b.aliasToResource;
        this.tunnelToken = b.tunnelToken;
    }

    public String runId() {
        return runId;
    }

    public String parentRunId() {
        return parentRunId;
    }

    public String taskSlug() {
        return taskSlug;
    }

    public String taskName() {
        return taskName;
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

    /** Runtime root, null for builtins. */
    public Path root() {
        return root;
    }

    public Path entrypoint() {
        return entrypoint;
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

    public Map<String, Resource> aliasToResource() {
        return aliasToResource;
    }

    public String tunnelToken() {
        return tunnelToken;
    }

    public boolean hasRuntime() {
        return root != null;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String runId;
        private String parentRunId;
        private String taskSlug = "";
        private String taskName = "";
        private Map<String, EnvVarValue> taskEnv = Map.of();
        private Map<String, String> devConfigEnv = Map.of();
        private Map<String, ConfigVar> configVars = Map.of();
        private String fallbackEnvSlug = "";
        private Path root;
        private Path entrypoint;
        private AuthInfo authInfo;
        private String apiHost = "";
        private String taskUrl = "";
        private String runUrl = "";
        private Map<String, Resource> aliasToResource = Map.of();
        private String tunnelToken;

        public Builder runId(String runId) {
            this.runId = runId;
            return this;
        }

        public Builder parentRunId(String parentRunId) {
            this.parentRunId = parentRunId;
            return this;
        }

        public Builder taskSlug(String taskSlug) {
            this.taskSlug = taskSlug;
            return this;
        }

        public Builder taskName(String taskName) {
            this.taskName = taskName;
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

        public Builder root(Path root) {
            this.root = root;
            return this;
        }

        public Builder entrypoint(Path entrypoint) {
            this.entrypoint = entrypoint;
            return this;
        }

        public Builder authInfo(AuthInfo authInfo) {
            this.authInfo = authInfo;
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

        public Builder aliasToResource(Map<String, Resource> aliasToResource) {
            this.aliasToResource = aliasToResource == null ? Map.of() : aliasToResource;
            return this;
        }

        public Builder tunnelToken(String tunnelToken) {
            this.tunnelToken = tunnelToken;
            return this;
        }

        public TaskEnvRequest build() {
            if (runId == null || runId.isEmpty()) {
                throw new IllegalArgumentException("runId is required");
            }
            return new TaskEnvRequest(this);
        }
    }
}
