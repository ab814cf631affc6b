package apprunner.worker.config;

import apprunner.common.server.RouterHandler;
import apprunner.worker.api.HealthController;
import apprunner.worker.api.ProjectController;
import apprunner.worker.api.TaskController;
import apprunner.worker.execution.BuildRunner;
import apprunner.worker.execution.CommandBuildRunner;
import apprunner.worker.execution.TaskExecutor;
import apprunner.worker.execution.WorkspaceStager;
import apprunner.worker.lock.WorkerLock;
import apprunner.worker.project.ProjectCatalog;
import apprunner.worker.repository.ResultStore;
import apprunner.worker.scheduler.ResultReaper;
import apprunner.worker.scheduler.RunWatchdog;
import apprunner.worker.scheduler.WorkerScheduler;
import apprunner.worker.service.WorkerService;
import apprunner.worker.store.FileResultStore;
import apprunner.worker.store.InMemoryResultStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;

/**
 * Manual dependency injection container for a worker.
 *
 * <pre>
 * WorkerDependencies deps = WorkerDependencies.create(WorkerConfig.fromEnv());
 * deps.startScheduler();
 * new HttpServer("worker", deps.routerHandler()).start(host, port);
 * ...
 * deps.close();
 * </pre>
 */
public final class WorkerDependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WorkerDependencies.class);

    private final WorkerConfig config;
    private final ResultStore resultStore;
    private final WorkerLock workerLock;
    private final WorkspaceStager stager;
    private final ProjectCatalog catalog;
    private final TaskExecutor taskExecutor;
    private final WorkerService workerService;

    // Controllers
    private final TaskController taskController;
    private final ProjectController projectController;
    private final HealthController healthController;

    // Router (lazy-initialized)
    private RouterHandler routerHandler;

    // Scheduler (lazy-initialized)
    private WorkerScheduler scheduler;

    private WorkerDependencies(WorkerConfig config, ProjectCatalog catalog, BuildRunner buildRunner) {
        this.config = config;

        log.info("Initializing worker with config: {}", config);

        // Infrastructure
        this.resultStore = config.inMemoryResults()
                ? new InMemoryResultStore()
                : new FileResultStore(config.resultsDir());
        this.workerLock = new WorkerLock();
        this.stager = new WorkspaceStager(config.workDir());
        this.catalog = catalog;

        // Services
        this.taskExecutor = new TaskExecutor(workerLock, resultStore, stager, buildRunner);
        this.workerService = new WorkerService(config.workerId(), catalog, taskExecutor, resultStore);

        // Controllers
        this.taskController = new TaskController(workerService);
        this.projectController = new ProjectController(workerService);
        this.healthController = new HealthController(config.workerId(), workerLock);

        int recovered = taskExecutor.recoverInterrupted();
        if (recovered > 0) {
            log.warn("Marked {} run(s) interrupted by the previous process as failed", recovered);
        }

        log.info("Worker dependencies initialized successfully");
    }

    /**
     * Create dependencies with the given config, loading projects from its INI file.
     */
    public static WorkerDependencies create(WorkerConfig config) {
        return create(config, loadCatalog(config), new CommandBuildRunner());
    }

    /**
     * Create dependencies with an explicit catalog and build runner.
     */
    public static WorkerDependencies create(WorkerConfig config, ProjectCatalog catalog, BuildRunner buildRunner) {
        return new WorkerDependencies(config, catalog, buildRunner);
    }

    private static ProjectCatalog loadCatalog(WorkerConfig config) {
        if (!Files.isRegularFile(config.projectsIni())) {
            log.warn("Project catalog {} not found; worker has no projects", config.projectsIni());
            return ProjectCatalog.empty();
        }
        return ProjectCatalog.load(config.projectsIni());
    }

    // Getters
    public WorkerConfig config() {
        return config;
    }

    public ResultStore resultStore() {
        return resultStore;
    }

    public WorkerLock workerLock() {
        return workerLock;
    }

    public WorkspaceStager stager() {
        return stager;
    }

    public ProjectCatalog catalog() {
        return catalog;
    }

    public TaskExecutor taskExecutor() {
        return taskExecutor;
    }

    public WorkerService workerService() {
        return workerService;
    }

    /**
     * Get a fully configured RouterHandler with all controllers registered.
     */
    public RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler("worker")
                    .registerController(healthController)
                    .registerController(projectController)
                    .registerController(taskController);
            log.info("RouterHandler created with {} controllers", routerHandler.controllerCount());
        }
        return routerHandler;
    }

    public WorkerScheduler scheduler() {
        if (scheduler == null) {
            scheduler = new WorkerScheduler(
                    new ResultReaper(resultStore, taskExecutor, stager, config.resultTtl()),
                    new RunWatchdog(resultStore, taskExecutor, config.runDeadline()),
                    config);
        }
        return scheduler;
    }

    public void startScheduler() {
        scheduler().start();
    }

    @Override
    public void close() {
        log.info("Closing worker dependencies...");

        if (scheduler != null) {
            try {
                scheduler.stop();
            } catch (Exception e) {
                log.warn("Error stopping scheduler: {}", e.getMessage());
            }
        }

        try {
            taskExecutor.close();
        } catch (Exception e) {
            log.warn("Error stopping task executor: {}", e.getMessage());
        }

        log.info("Worker dependencies closed");
    }
}
