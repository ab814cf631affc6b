package apprunner;

import apprunner.balancer.config.BalancerConfig;
import apprunner.balancer.config.BalancerDependencies;
import apprunner.common.server.HttpServer;
import apprunner.worker.config.WorkerConfig;
import apprunner.worker.config.WorkerDependencies;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Entry point. Usage: {@code java -jar apprunner.jar worker|balancer}.
 * Settings come from APPRUNNER_* environment variables.
 */
public final class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    private App() {
    }

    public static void main(String[] args) throws InterruptedException {
        String role = args.length > 0 ? args[0] : "";
        AutoCloseable dependencies;
        HttpServer server;
        boolean started;

        switch (role) {
            case "worker" -> {
                WorkerConfig config = WorkerConfig.fromEnv();
                WorkerDependencies deps = WorkerDependencies.create(config);
                server = new HttpServer("Worker", deps.routerHandler());
                started = server.start(config.serverHost(), config.serverPort());
                if (started) {
                    deps.startScheduler();
                }
                dependencies = deps;
            }
            case "balancer" -> {
                BalancerConfig config = BalancerConfig.fromEnv();
                BalancerDependencies deps = BalancerDependencies.create(config);
                server = new HttpServer("Balancer", deps.routerHandler());
                started = server.start(config.serverHost(), config.serverPort());
                if (started) {
                    deps.startScheduler();
                }
                dependencies = deps;
            }
            default -> {
                System.err.println("Usage: apprunner worker|balancer");
                System.exit(2);
                return;
            }
        }

        if (!started) {
            log.error("Failed to start {}, exiting", role);
            closeQuietly(dependencies);
            System.exit(1);
        }

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down {}...", role);
            server.stop();
            closeQuietly(dependencies);
            stopped.countDown();
        }, "apprunner-shutdown"));

        stopped.await();
    }

    private static void closeQuietly(AutoCloseable closeable) {
        try {
            closeable.close();
        } catch (Exception e) {
            log.warn("Error during shutdown: {}", e.getMessage());
        }
    }
}
