package apprunner.balancer.scheduler;

import apprunner.balancer.config.BalancerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Runs balancer housekeeping (registry eviction) on a single daemon thread.
 */
public class BalancerScheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BalancerScheduler.class);

    private final ScheduledExecutorService executor;
    private final RegistryReaper registryReaper;
    private final BalancerConfig config;

    private volatile boolean running = false;

    public BalancerScheduler(RegistryReaper registryReaper, BalancerConfig config) {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "apprunner-balancer-scheduler");
            t.setDaemon(true);
            return t;
        });
        this.registryReaper = registryReaper;
        this.config = config;
    }

    public void start() {
        if (running) {
            log.warn("Scheduler already running");
            return;
        }
        running = true;

        long intervalMs = config.registryReaperInterval().toMillis();
        executor.scheduleAtFixedRate(registryReaper, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("Registry reaper scheduled every {}ms", intervalMs);
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

    public RegistryReaper registryReaper() {
        return registryReaper;
    }

    @Override
    public void close() {
        stop();
    }
}
