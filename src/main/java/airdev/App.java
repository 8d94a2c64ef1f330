package airdev;

import airdev.devserver.config.DevServerConfig;
import airdev.devserver.config.Dependencies;
import airdev.devserver.discovery.Discoverer;
import airdev.devserver.server.DevServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;

/**
 * Entry point: discover task and view definitions, then serve the dev API until interrupted.
 */
public class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) throws Exception {
        DevServerConfig config = DevServerConfig.fromEnv();
        if (args.length > 0) {
            config.withDirectory(Path.of(args[0]));
        }

        Dependencies deps = Dependencies.create(config);
        Discoverer.Result discovered = deps.discover();
        log.info("Discovered {} tasks and {} views in {} ({} errors)",
                discovered.tasks().size(), discovered.views().size(), config.directory(), discovered.errors().size());

        DevServer server = new DevServer(config, deps.routerHandler());
        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down, stopping server...");
            server.stop();
            deps.close();
            stopped.countDown();
        }, "airdev-shutdown"));

        try {
            server.start();
        } catch (Exception e) {
            log.error("Failed to start dev server", e);
            deps.close();
            System.exit(1);
        }
        log.info("Studio: {}?__airplane_host={}", config.studioHost(), config.localApiHost());
        stopped.await();
    }
}
