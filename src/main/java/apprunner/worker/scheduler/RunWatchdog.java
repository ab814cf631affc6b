package apprunner.worker.scheduler;

import apprunner.common.model.ResultRecord;
import apprunner.worker.execution.TaskExecutor;
import apprunner.worker.repository.ResultStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Marks runs that exceeded their deadline as TIMEOUT and aborts them.
 * The aborted unit still releases the worker lock through its own exit path.
 */
public class RunWatchdog implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(RunWatchdog.class);

    private final ResultStore store;
    private final TaskExecutor executor;
    private final Duration deadline;

    public RunWatchdog(ResultStore store, TaskExecutor executor, Duration deadline) {
        this.store = store;
        this.executor = executor;
        this.deadline = deadline;
    }

    @Override
    public void run() {
        try {
            timeOutOverdueRuns();
        } catch (Exception e) {
            log.error("Run watchdog error", e);
        }
    }

    /**
     * @return number of runs marked TIMEOUT
     */
    public int timeOutOverdueRuns() {
        Instant cutoff = Instant.now().minus(deadline);
        List<ResultRecord> overdue = store.findRunningOlderThan(cutoff);

        int timedOut = 0;
        for (ResultRecord record : overdue) {
            String message = "Run exceeded deadline of " + deadline.toSeconds() + "s";
            if (store.completeIfRunning(ResultRecord.timeout(record.ticket(), message))) {
                boolean aborted = executor.abort(record.ticket());
                log.warn("Ticket {} timed out after {} (aborted={})", record.ticket(), deadline, aborted);
                timedOut++;
            }
        }
        return timedOut;
    }
}
