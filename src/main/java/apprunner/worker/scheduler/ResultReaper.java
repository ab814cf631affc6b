package apprunner.worker.scheduler;

import apprunner.common.model.ResultRecord;
import apprunner.worker.execution.TaskExecutor;
import apprunner.worker.execution.WorkspaceStager;
import apprunner.worker.repository.ResultStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Background task that garbage-collects old results.
 *
 * The reaper:
 * 1. Deletes terminal records older than the TTL (RUNNING records are never touched)
 * 2. Removes staging directories whose ticket has no in-flight run
 */
public class ResultReaper implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(ResultReaper.class);

    private final ResultStore store;
    private final TaskExecutor executor;
    private final WorkspaceStager stager;
    private final Duration ttl;

    public ResultReaper(ResultStore store, TaskExecutor executor, WorkspaceStager stager, Duration ttl) {
        this.store = store;
        this.executor = executor;
        this.stager = stager;
        this.ttl = ttl;
    }

    @Override
    public void run() {
        try {
            reapExpiredResults();
            reapOrphanWorkspaces();
        } catch (Exception e) {
            log.error("Result reaper error", e);
        }
    }

    /**
     * @return number of records deleted
     */
    public int reapExpiredResults() {
        Instant cutoff = Instant.now().minus(ttl);
        List<ResultRecord> expired = store.findTerminalOlderThan(cutoff);
        if (expired.isEmpty()) {
            log.debug("No expired results");
            return 0;
        }

        int deleted = 0;
        for (ResultRecord record : expired) {
            try {
                if (store.delete(record.ticket())) {
                    deleted++;
                }
            } catch (Exception e) {
                log.error("Failed to delete result {}", record.ticket(), e);
            }
        }
        log.info("Result reaper: deleted {} of {} expired result(s)", deleted, expired.size());
        return deleted;
    }

    /**
     * @return number of staging directories removed
     */
    public int reapOrphanWorkspaces() {
        int removed = 0;
        for (String ticket : stager.stagedTickets()) {
            if (!executor.isInFlight(ticket)) {
                stager.cleanup(ticket);
                removed++;
            }
        }
        if (removed > 0) {
            log.info("Result reaper: removed {} orphaned workspace(s)", removed);
        }
        return removed;
    }
}
