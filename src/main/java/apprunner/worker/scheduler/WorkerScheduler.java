package apprunner.worker.scheduler;

import apprunner.worker.config.WorkerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Runs worker housekeeping on a single daemon thread:
 * - ResultReaper: drops expired results and orphaned workspaces
 * - RunWatchdog: times out overdue runs (only when a deadline is configured)
 */
public class WorkerScheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WorkerScheduler.class);

    private final ScheduledExecutorService executor;
    private final ResultReaper resultReaper;
    private final RunWatchdog runWatchdog;
    private final WorkerConfig config;

    private volatile boolean running = false;

    public WorkerScheduler(ResultReaper resultReaper, RunWatchdog runWatchdog, WorkerConfig config) {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "apprunner-worker-scheduler");
            t.setDaemon(true);
            return t;
        });
        this.resultReaper = resultReaper;
        this.runWatchdog = runWatchdog;
        this.config = config;
    }

    public void start() {
        if (running) {
            log.warn("Scheduler already running");
            return;
        }
        running = true;

        long intervalMs = config.housekeepingInterval().toMillis();
        executor.scheduleAtFixedRate(resultReaper, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("Result reaper scheduled every {}ms (ttl {})", intervalMs, config.resultTtl());

        if (config.hasRunDeadline()) {
            long watchdogMs = Math.min(intervalMs, Math.max(1000, config.runDeadline().toMillis() / 4));
            executor.scheduleAtFixedRate(runWatchdog, watchdogMs, watchdogMs, TimeUnit.MILLISECONDS);
            log.info("Run watchdog scheduled every {}ms (deadline {})", watchdogMs, config.runDeadline());
        } else {
            log.info("Run watchdog disabled");
        }
    }

    public void stop() {
        if (!running) {
            return;
        }
        running = false;
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Scheduler forcefully stopped");
            } else {
                log.info("Scheduler stopped gracefully");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public boolean isRunning() {
        return running;
    }

    public ResultReaper resultReaper() {
        return resultReaper;
    }

    public RunWatchdog runWatchdog() {
        return runWatchdog;
    }

    @Override
    public void close() {
        stop();
    }
}
