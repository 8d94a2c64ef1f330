package airdev.devserver.config;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

/**
 * Configuration holder for the dev server.
 * All settings have sensible defaults.
 */
public final class DevServerConfig {

    // Server settings
    private int serverPort = 4000;
    private String serverHost = "127.0.0.1";

    // Local project
    private Path directory = Path.of(".");
    private Path devConfigPath = null; // defaults to <directory>/airplane.dev.yaml

    // Remote platform
    private String apiHost = "https://api.airplane.dev";
    private String apiKey = null;
    private String teamId = null;
    private String envSlug = null; // fallback env for configs and resources
    private String studioHost = "https://app.airplane.dev";
    private Duration remoteTimeout = Duration.ofSeconds(30);

    // Execution
    private Path builtinsBinary = null;
    private String tunnelToken = null;
    private int maxOutputLineBytes = 0; // disabled
    private Duration killGrace = Duration.ofSeconds(5);
    private int maxChildRuns = 1000;

    private DevServerConfig() {
    }

    public static DevServerConfig defaults() {
        return new DevServerConfig();
    }

    public static DevServerConfig fromEnv() {
        return fromEnv(System.getenv());
    }

    static DevServerConfig fromEnv(Map<String, String> env) {
        DevServerConfig config = new DevServerConfig();

        String port = env.get("AIRDEV_PORT");
        if (port != null && !port.isBlank()) {
            config.serverPort = Integer.parseInt(port.strip());
        }

        String host = env.get("AIRDEV_HOST");
        if (host != null && !host.isBlank()) {
            config.serverHost = host.strip();
        }

        String dir = env.get("AIRDEV_DIR");
        if (dir != null && !dir.isBlank()) {
            config.directory = Path.of(dir.strip());
        }

        String devConfig = env.get("AIRDEV_DEV_CONFIG");
        if (devConfig != null && !devConfig.isBlank()) {
            config.devConfigPath = Path.of(devConfig.strip());
        }

        String apiHost = env.get("AIRPLANE_API_HOST");
        if (apiHost != null && !apiHost.isBlank()) {
            config.apiHost = apiHost.strip();
        }

        String apiKey = env.get("AIRPLANE_API_KEY");
        if (apiKey != null && !apiKey.isBlank()) {
            config.apiKey = apiKey.strip();
        }

        String teamId = env.get("AIRPLANE_TEAM_ID");
        if (teamId != null && !teamId.isBlank()) {
            config.teamId = teamId.strip();
        }

        String envSlug = env.get("AIRDEV_ENV_SLUG");
        if (envSlug != null && !envSlug.isBlank()) {
            config.envSlug = envSlug.strip();
        }

        String studioHost = env.get("AIRDEV_STUDIO_HOST");
        if (studioHost != null && !studioHost.isBlank()) {
            config.studioHost = studioHost.strip();
        }

        String builtins = env.get("AIRDEV_BUILTINS_BIN");
        if (builtins != null && !builtins.isBlank()) {
            config.builtinsBinary = Path.of(builtins.strip());
        }

        String tunnelToken = env.get("AIRDEV_TUNNEL_TOKEN");
        if (tunnelToken != null && !tunnelToken.isBlank()) {
            config.tunnelToken = tunnelToken.strip();
        }

        String maxLine = env.get("AIRDEV_MAX_OUTPUT_LINE_BYTES");
        if (maxLine != null && !maxLine.isBlank()) {
            config.maxOutputLineBytes = Integer.parseInt(maxLine.strip());
        }

        return config;
    }

    // Getters
    public int serverPort() {
        return serverPort;
    }

    public String serverHost() {
        return serverHost;
    }

    public Path directory() {
        return directory;
    }

    public Path devConfigPath() {
        return devConfigPath != null ? devConfigPath : directory.resolve("airplane.dev.yaml");
    }

    public String apiHost() {
        return apiHost;
    }

    public String apiKey() {
        return apiKey;
    }

    public String teamId() {
        return teamId;
    }

    public String envSlug() {
        return envSlug;
    }

    public boolean hasEnvSlug() {
        return envSlug != null && !envSlug.isBlank();
    }

    public String studioHost() {
        return studioHost;
    }

    public Duration remoteTimeout() {
        return remoteTimeout;
    }

    public Path builtinsBinary() {
        return builtinsBinary;
    }

    public String tunnelToken() {
        return tunnelToken;
    }

    public int maxOutputLineBytes() {
        return maxOutputLineBytes;
    }

    public Duration killGrace() {
        return killGrace;
    }

    public int maxChildRuns() {
        return maxChildRuns;
    }

    /** Base URL task processes use to call back into this server. */
    public String localApiHost() {
        return "http://127.0.0.1:" + serverPort;
    }

    /** Studio page pointed at this server. */
    public String studioUrl(String path) {
        return studioHost + path + "?__airplane_host=" + URLEncoder.encode(localApiHost(), StandardCharsets.UTF_8);
    }

    // Fluent setters for testing/customization
    public DevServerConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    public DevServerConfig withServerHost(String host) {
        this.serverHost = host;
        return this;
    }

    public DevServerConfig withDirectory(Path directory) {
        this.directory = directory;
        return this;
    }

    public DevServerConfig withDevConfigPath(Path path) {
        this.devConfigPath = path;
        return this;
    }

    public DevServerConfig withApiHost(String host) {
        this.apiHost = host;
        return this;
    }

    public DevServerConfig withApiKey(String key) {
        this.apiKey = key;
        return this;
    }

    public DevServerConfig withTeamId(String teamId) {
        this.teamId = teamId;
        return this;
    }

    public DevServerConfig withEnvSlug(String envSlug) {
        this.envSlug = envSlug;
        return this;
    }

    public DevServerConfig withBuiltinsBinary(Path binary) {
        this.builtinsBinary = binary;
        return this;
    }

    public DevServerConfig withTunnelToken(String token) {
        this.tunnelToken = token;
        return this;
    }

    public DevServerConfig withMaxOutputLineBytes(int bytes) {
        this.maxOutputLineBytes = bytes;
        return this;
    }

    public DevServerConfig withKillGrace(Duration grace) {
        this.killGrace = grace;
        return this;
    }

    public DevServerConfig withMaxChildRuns(int max) {
        this.maxChildRuns = max;
        return this;
    }

    @Override
    public String toString() {
        return "DevServerConfig{" +
                "serverHost='" + serverHost + '\'' +
                ", serverPort=" + serverPort +
                ", directory=" + directory +
                ", apiHost='" + apiHost + '\'' +
                ", apiKeySet=" + (apiKey != null && !apiKey.isBlank()) +
                ", envSlug=" + envSlug +
                '}';
    }
}
