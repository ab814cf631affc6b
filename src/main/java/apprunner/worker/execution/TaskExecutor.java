package apprunner.worker.execution;

import apprunner.common.error.DuplicateTicketException;
import apprunner.common.model.Patch;
import apprunner.common.model.ResultRecord;
import apprunner.worker.lock.WorkerLock;
import apprunner.worker.project.Project;
import apprunner.worker.repository.ResultStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.util.Base64;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Runs at most one build/run at a time, off the request thread.
 *
 * {@link #submit} takes the worker lock, writes the RUNNING record and returns;
 * the background unit stages the project, applies patches, builds, runs and
 * writes the terminal record. The unit releases the lock as its very last
 * action on every exit path.
 */
public class TaskExecutor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TaskExecutor.class);

    static final String EMPTY_PATCHES = "Must specify patches";
    static final String START_FAILED = "Unable to start worker process";
    static final String RESTARTED = "Worker restarted before the run finished";
    static final String ABORTED = "Run aborted";

    private final WorkerLock lock;
    private final ResultStore store;
    private final WorkspaceStager stager;
    private final BuildRunner runner;
    private final ExecutorService executor;
    private final ConcurrentMap<String, Unit> inFlight = new ConcurrentHashMap<>();

    public TaskExecutor(WorkerLock lock, ResultStore store, WorkspaceStager stager, BuildRunner runner) {
        this.lock = lock;
        this.store = store;
        this.stager = stager;
        this.runner = runner;
        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "apprunner-build");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Start a build/run for the ticket without waiting for it.
     *
     * @return WORKER_BUSY if another task holds the lock, ACCEPTED otherwise
     * @throws DuplicateTicketException if a record for the ticket already exists
     * @throws IllegalStateException    if the executor has been shut down
     */
    public SubmitResult submit(String ticket, Project project, List<Patch> patches) {
        Optional<WorkerLock.Lease> acquired = lock.tryAcquire(ticket);
        if (acquired.isEmpty()) {
            return SubmitResult.WORKER_BUSY;
        }
        WorkerLock.Lease lease = acquired.get();

        boolean created;
        try {
            created = store.create(ResultRecord.running(ticket));
        } catch (RuntimeException e) {
            lease.close();
            throw e;
        }
        if (!created) {
            lease.close();
            throw new DuplicateTicketException("Ticket already used: " + ticket);
        }

        Unit unit = new Unit(ticket, project, List.copyOf(patches), lease);
        inFlight.put(ticket, unit);
        try {
            executor.execute(unit);
        } catch (RejectedExecutionException e) {
            inFlight.remove(ticket);
            log.error("Executor refused ticket {}", ticket, e);
            try {
                store.completeIfRunning(ResultRecord.error(ticket, START_FAILED));
            } finally {
                lease.close();
            }
            throw new IllegalStateException(START_FAILED, e);
        }

        log.info("Accepted ticket {} for project {} ({} patch(es))", ticket, project.name(), patches.size());
        return SubmitResult.ACCEPTED;
    }

    /**
     * Interrupt the in-flight unit for a ticket. The unit still runs its own
     * cleanup and releases the lock itself.
     *
     * @return true if a unit for the ticket was in flight
     */
    public boolean abort(String ticket) {
        Unit unit = inFlight.get(ticket);
        if (unit == null) {
            return false;
        }
        unit.abort();
        return true;
    }

    public boolean isInFlight(String ticket) {
        return inFlight.containsKey(ticket);
    }

    public boolean isBusy() {
        return lock.isLocked();
    }

    /**
     * Turn RUNNING records with no in-flight unit (left by a previous process) into errors.
     *
     * @return number of records recovered
     */
    public int recoverInterrupted() {
        int recovered = 0;
        for (ResultRecord record : store.findAll()) {
            if (!record.isTerminal() && !inFlight.containsKey(record.ticket())
                    && store.completeIfRunning(ResultRecord.error(record.ticket(), RESTARTED))) {
                log.warn("Recovered interrupted ticket {}", record.ticket());
                recovered++;
            }
        }
        return recovered;
    }

    ResultRecord execute(String ticket, Project project, List<Patch> patches) throws Exception {
        if (patches.isEmpty()) {
            return ResultRecord.error(ticket, EMPTY_PATCHES);
        }

        StagedProject staged = stager.stage(ticket, project);
        stager.applyPatches(staged, patches);

        BuildOutcome outcome = runner.run(staged);
        if (!outcome.success()) {
            return ResultRecord.error(ticket, outcome.diagnostic());
        }

        byte[] artifact = Files.readAllBytes(outcome.artifact());
        return ResultRecord.complete(ticket, Base64.getEncoder().encodeToString(artifact));
    }

    @Override
    public void close() {
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Build thread did not stop in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * One accepted task. Owns the lease until its run() returns.
     */
    private final class Unit implements Runnable {

        private final String ticket;
        private final Project project;
        private final List<Patch> patches;
        private final WorkerLock.Lease lease;

        private volatile Thread thread;
        private volatile boolean aborted;

        Unit(String ticket, Project project, List<Patch> patches, WorkerLock.Lease lease) {
            this.ticket = ticket;
            this.project = project;
            this.patches = patches;
            this.lease = lease;
        }

        synchronized void abort() {
            aborted = true;
            if (thread != null) {
                thread.interrupt();
            }
        }

        @Override
        public void run() {
            synchronized (this) {
                thread = Thread.currentThread();
            }
            ResultRecord terminal;
            try {
                if (aborted) {
                    throw new InterruptedException("aborted before start");
                }
                terminal = execute(ticket, project, patches);
            } catch (InterruptedException e) {
                log.warn("Ticket {} aborted", ticket);
                terminal = ResultRecord.error(ticket, ABORTED);
            } catch (IllegalArgumentException e) {
                log.info("Ticket {} rejected: {}", ticket, e.getMessage());
                terminal = ResultRecord.error(ticket, e.getMessage());
            } catch (Throwable t) {
                log.error("Ticket {} failed unexpectedly", ticket, t);
                terminal = ResultRecord.error(ticket, "Worker failure: " + t);
            }

            // Stop accepting interrupts before touching the store; file channels close on interrupt
            synchronized (this) {
                thread = null;
            }
            Thread.interrupted();

            try {
                if (store.completeIfRunning(terminal)) {
                    log.info("Ticket {} finished: {}", ticket, terminal.status());
                } else {
                    log.info("Ticket {} already terminal, result {} discarded", ticket, terminal.status());
                }
            } catch (RuntimeException e) {
                log.error("Failed to record result for ticket {}", ticket, e);
            } finally {
                try {
                    stager.cleanup(ticket);
                } finally {
                    inFlight.remove(ticket);
                    lease.close();
                }
            }
        }
    }
}
