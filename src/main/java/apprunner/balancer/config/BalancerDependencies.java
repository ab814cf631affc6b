package apprunner.balancer.config;

import apprunner.balancer.api.BalancerHealthController;
import apprunner.balancer.api.BalancerProjectController;
import apprunner.balancer.api.BalancerTaskController;
import apprunner.balancer.client.HttpWorkerClient;
import apprunner.balancer.client.WorkerClient;
import apprunner.balancer.pool.RoundRobinSelector;
import apprunner.balancer.pool.WorkerPool;
import apprunner.balancer.repository.TaskRegistry;
import apprunner.balancer.scheduler.BalancerScheduler;
import apprunner.balancer.scheduler.RegistryReaper;
import apprunner.balancer.service.BalancerService;
import apprunner.balancer.store.Database;
import apprunner.balancer.store.JdbcTaskRegistry;
import apprunner.common.server.RouterHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Manual dependency injection container for the balancer.
 *
 * <pre>
 * BalancerDependencies deps = BalancerDependencies.create(BalancerConfig.fromEnv());
 * deps.startScheduler();
 * new HttpServer("balancer", deps.routerHandler()).start(host, port);
 * ...
 * deps.close();
 * </pre>
 */
public final class BalancerDependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BalancerDependencies.class);

    private final BalancerConfig config;
    private final Database database;
    private final TaskRegistry taskRegistry;
    private final WorkerPool workerPool;
    private final BalancerService balancerService;

    // Controllers
    private final BalancerHealthController healthController;
    private final BalancerProjectController projectController;
    private final BalancerTaskController taskController;

    // Router (lazy-initialized)
    private RouterHandler routerHandler;

    // Scheduler (lazy-initialized)
    private BalancerScheduler scheduler;

    private BalancerDependencies(BalancerConfig config, List<? extends WorkerClient> workers) {
        this.config = config;

        log.info("Initializing balancer with config: {}", config);

        // Infrastructure
        this.database = new Database(config);
        this.taskRegistry = new JdbcTaskRegistry(database);
        this.workerPool = new WorkerPool(workers);
        if (workerPool.isEmpty()) {
            log.warn("No workers configured; every run will be rejected");
        }

        // Services
        this.balancerService = new BalancerService(
                taskRegistry, workerPool, new RoundRobinSelector(), config.retryOnBusy());

        // Controllers
        this.healthController = new BalancerHealthController(balancerService);
        this.projectController = new BalancerProjectController(balancerService);
        this.taskController = new BalancerTaskController(balancerService);

        log.info("Balancer dependencies initialized with {} worker(s)", workerPool.size());
    }

    /**
     * Create dependencies with HTTP clients for the configured worker URLs.
     */
    public static BalancerDependencies create(BalancerConfig config) {
        List<WorkerClient> clients = config.workers().stream()
                .map(url -> (WorkerClient) new HttpWorkerClient(url, config.workerTimeout()))
                .toList();
        return create(config, clients);
    }

    /**
     * Create dependencies with explicit worker clients.
     */
    public static BalancerDependencies create(BalancerConfig config, List<? extends WorkerClient> workers) {
        return new BalancerDependencies(config, workers);
    }

    // Getters
    public BalancerConfig config() {
        return config;
    }

    public Database database() {
        return database;
    }

    public TaskRegistry taskRegistry() {
        return taskRegistry;
    }

    public WorkerPool workerPool() {
        return workerPool;
    }

    public BalancerService balancerService() {
        return balancerService;
    }

    /**
     * Get a fully configured RouterHandler with all controllers registered.
     */
    public RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler("balancer")
                    .registerController(healthController)
                    .registerController(projectController)
                    .registerController(taskController);
            log.info("RouterHandler created with {} controllers", routerHandler.controllerCount());
        }
        return routerHandler;
    }

    public BalancerScheduler scheduler() {
        if (scheduler == null) {
            scheduler = new BalancerScheduler(new RegistryReaper(taskRegistry, config), config);
        }
        return scheduler;
    }

    public void startScheduler() {
        scheduler().start();
    }

    @Override
    public void close() {
        log.info("Closing balancer dependencies...");

        if (scheduler != null) {
            try {
                scheduler.stop();
            } catch (Exception e) {
                log.warn("Error stopping scheduler: {}", e.getMessage());
            }
        }

        try {
            database.close();
        } catch (Exception e) {
            log.warn("Error closing database: {}", e.getMessage());
        }

        log.info("Balancer dependencies closed");
    }
}
