package airdev.devserver.config;

import airdev.devserver.api.dev.DevController;
import airdev.devserver.api.dev.LogStreamController;
import airdev.devserver.api.internal.RunInternalController;
import airdev.devserver.api.internal.ViewController;
import airdev.devserver.api.v0.DisplayController;
import airdev.devserver.api.v0.PromptController;
import airdev.devserver.api.v0.RunController;
import airdev.devserver.api.v0.TaskController;
import airdev.devserver.builtins.LocalBuiltinClient;
import airdev.devserver.discovery.Discoverer;
import airdev.devserver.discovery.TaskCatalog;
import airdev.devserver.discovery.YamlDefinitionDiscoverer;
import airdev.devserver.env.EnvVarResolver;
import airdev.devserver.executor.LocalExecutor;
import airdev.devserver.remote.AuthInfo;
import airdev.devserver.remote.HttpRemoteApiClient;
import airdev.devserver.remote.RemoteApiClient;
import airdev.devserver.remote.RemoteApiException;
import airdev.devserver.repository.RunRepository;
import airdev.devserver.runtime.RuntimeRegistry;
import airdev.devserver.server.RouterHandler;
import airdev.devserver.service.ConfigService;
import airdev.devserver.service.RunService;
import airdev.devserver.service.ViewService;
import airdev.devserver.store.InMemoryRunRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Manual dependency injection container.
 * Creates and wires all service dependencies.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(DevServerConfig.fromEnv());
 * deps.discover();
 * new DevServer(deps.config(), deps.routerHandler()).start();
 * // ... serve ...
 * deps.close();
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final DevServerConfig config;
    private final RemoteApiClient remote;
    private final DevConfig devConfig;
    private final RunRepository runRepository;
    private final TaskCatalog catalog;
    private final Discoverer discoverer;
    private final LocalExecutor executor;
    private final AuthInfo authInfo;
    private final ConfigService configService;
    private final RunService runService;
    private final ViewService viewService;

    // Controllers
    private final TaskController taskController;
    private final RunController runController;
    private final PromptController promptController;
    private final DisplayController displayController;
    private final RunInternalController runInternalController;
    private final ViewController viewController;
    private final DevController devController;
    private final LogStreamController logStreamController;

    // Router (lazy-initialized)
    private RouterHandler routerHandler;

    private Dependencies(DevServerConfig config, RemoteApiClient remote) {
        this.config = config;

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.remote = remote;
        this.devConfig = DevConfig.load(config.devConfigPath());
        this.runRepository = new InMemoryRunRepository();
        this.catalog = new TaskCatalog();
        this.discoverer = new YamlDefinitionDiscoverer();
        this.authInfo = resolveAuthInfo(remote);
        EnvVarResolver envVarResolver = new EnvVarResolver(remote);
        this.executor = new LocalExecutor(
                runRepository,
                RuntimeRegistry.defaults(),
                envVarResolver,
                remote,
                new LocalBuiltinClient(config.builtinsBinary()),
                config.maxOutputLineBytes(),
                config.killGrace());

        // Services
        this.configService = new ConfigService(remote, devConfig);
        this.runService = new RunService(runRepository, catalog, configService, executor, remote, authInfo, config);
        this.viewService = new ViewService(catalog, configService, envVarResolver, authInfo, config);

        // Controllers (/v0)
        this.taskController = new TaskController(runService);
        this.runController = new RunController(runService);
        this.promptController = new PromptController(runService);
        this.displayController = new DisplayController(runService);

        // Controllers (/i and /dev)
        this.runInternalController = new RunInternalController(runService, authInfo);
        this.viewController = new ViewController(viewService);
        this.devController = new DevController(runService, configService);
        this.logStreamController = new LogStreamController(runRepository);

        log.info("Dependencies initialized successfully");
    }

    /**
     * Create dependencies with the given config.
     */
    public static Dependencies create(DevServerConfig config) {
        return create(config, new HttpRemoteApiClient(
                config.apiHost(), config.apiKey(), config.teamId(), config.remoteTimeout()));
    }

    /**
     * Create dependencies talking to the given remote API.
     */
    public static Dependencies create(DevServerConfig config, RemoteApiClient remote) {
        return new Dependencies(config, remote);
    }

    /**
     * Create dependencies with environment-based config.
     */
    public static Dependencies create() {
        return create(DevServerConfig.fromEnv());
    }

    private static AuthInfo resolveAuthInfo(RemoteApiClient remote) {
        if (!remote.isConfigured()) {
            log.info("No API key configured; running without remote access");
            return AuthInfo.anonymous();
        }
        try {
            AuthInfo info = remote.authInfo();
            log.info("Authenticated as user {} in team {}", info.userEmail(), info.teamId());
            return info;
        } catch (RemoteApiException e) {
            log.warn("Could not fetch auth info, continuing anonymously: {}", e.getMessage());
            return AuthInfo.anonymous();
        }
    }

    /**
     * Walk the configured directory and replace the catalog's contents with what is found there.
     */
    public Discoverer.Result discover() throws IOException {
        Discoverer.Result result = discoverer.discover(config.directory());
        catalog.replaceAll(result);
        return result;
    }

    // Getters
    public DevServerConfig config() {
        return config;
    }

    public RemoteApiClient remote() {
        return remote;
    }

    public DevConfig devConfig() {
        return devConfig;
    }

    public RunRepository runRepository() {
        return runRepository;
    }

    public TaskCatalog catalog() {
        return catalog;
    }

    public AuthInfo authInfo() {
        return authInfo;
    }

    public ConfigService configService() {
        return configService;
    }

    public RunService runService() {
        return runService;
    }

    public ViewService viewService() {
        return viewService;
    }

    /**
     * Get a fully configured RouterHandler with all controllers registered.
     * This is the main entry point for serving HTTP requests.
     */
    public synchronized RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler()
                    .registerController(taskController)
                    .registerController(runController)
                    .registerController(promptController)
                    .registerController(displayController)
                    .registerController(runInternalController)
                    .registerController(viewController)
                    .registerController(devController)
                    .registerController(logStreamController);
            log.info("RouterHandler created with {} controllers", routerHandler.controllerCount());
        }
        return routerHandler;
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        try {
            logStreamController.close();
        } catch (Exception e) {
            log.warn("Error closing log streams: {}", e.getMessage());
        }

        try {
            executor.close();
        } catch (Exception e) {
            log.warn("Error closing executor: {}", e.getMessage());
        }

        log.info("Dependencies closed");
    }
}
