package maestro;

import maestro.coordinator.config.CoordinatorConfig;
import maestro.coordinator.config.Dependencies;
import maestro.coordinator.server.CoordinatorNettyServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Coordinator entry point: loads the store, starts the HTTP/WebSocket server
 * and blocks until shutdown.
 */
public class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        CoordinatorConfig config = CoordinatorConfig.fromEnv();
        Dependencies deps = Dependencies.create(config);
        CoordinatorNettyServer server = new CoordinatorNettyServer(deps);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown requested, stopping coordinator...");
            server.stop();
            deps.close();
        }, "maestro-shutdown"));

        try {
            server.start();
        } catch (RuntimeException e) {
            log.error("Coordinator failed to start", e);
            deps.close();
            System.exit(1);
        }
        server.awaitTermination();
    }
}
