package apprunner.client;

import apprunner.common.api.dto.CreateTaskRequest;
import apprunner.common.api.dto.StatusResponse;
import apprunner.common.api.dto.TaskAccepted;
import apprunner.common.error.AppRunnerException;
import apprunner.common.error.TransportException;
import apprunner.common.error.WorkerBusyException;
import apprunner.common.model.Patch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Starts a run through the balancer and polls it until it finishes or the
 * local timeout expires.
 *
 * One run at a time per poller. All network calls happen on a single daemon
 * thread; callers only see the returned future.
 */
public class ClientPoller implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ClientPoller.class);

    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(3);
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(90);
    public static final Duration DEFAULT_MAX_BACKOFF = Duration.ofSeconds(30);
    public static final int DEFAULT_MAX_TRANSPORT_FAILURES = 3;

    private final BalancerClient client;
    private final Duration pollInterval;
    private final Duration timeout;
    private final Duration maxBackoff;
    private final int maxTransportFailures;
    private final PollListener listener;
    private final ScheduledExecutorService executor;

    private Run active;

    public ClientPoller(BalancerClient client) {
        this(client, DEFAULT_POLL_INTERVAL, DEFAULT_TIMEOUT, DEFAULT_MAX_BACKOFF,
                DEFAULT_MAX_TRANSPORT_FAILURES, PollListener.NONE);
    }

    public ClientPoller(BalancerClient client, Duration pollInterval, Duration timeout, Duration maxBackoff,
            int maxTransportFailures, PollListener listener) {
        if (maxTransportFailures < 1) {
            throw new IllegalArgumentException("maxTransportFailures must be at least 1");
        }
        this.client = client;
        this.pollInterval = pollInterval;
        this.timeout = timeout;
        this.maxBackoff = maxBackoff;
        this.maxTransportFailures = maxTransportFailures;
        this.listener = listener;
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "apprunner-poller");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Start a run and follow it to the end.
     *
     * @throws IllegalStateException if a run is already in progress
     */
    public synchronized CompletableFuture<RunOutcome> run(String project, List<Patch> patches, String userId) {
        Run run = begin(null);
        submit(run, () -> create(run, new CreateTaskRequest(project, patches, userId)), 0);
        return run.future;
    }

    /**
     * Follow a ticket that was created elsewhere.
     *
     * @throws IllegalStateException if a run is already in progress
     */
    public synchronized CompletableFuture<RunOutcome> follow(String ticket) {
        Run run = begin(ticket);
        submit(run, () -> poll(run), 0);
        return run.future;
    }

    /**
     * Stop polling the current run. Its future is cancelled.
     */
    public synchronized void cancel() {
        if (active != null && !active.future.isDone()) {
            log.info("Cancelling run {}", active.ticket);
            active.future.cancel(false);
        }
    }

    public synchronized boolean isRunning() {
        return active != null && !active.future.isDone();
    }

    private Run begin(String ticket) {
        if (isRunning()) {
            throw new IllegalStateException("A run is already in progress");
        }
        active = new Run(ticket);
        return active;
    }

    private void create(Run run, CreateTaskRequest request) {
        try {
            TaskAccepted accepted = client.createTask(request);
            run.ticket = accepted.ticket();
            log.info("Run started: ticket {} on {}", accepted.ticket(), accepted.workerId());
            poll(run);
        } catch (WorkerBusyException e) {
            finish(run, RunOutcome.Kind.WORKER_LOCKED, e.getMessage());
        } catch (TransportException e) {
            finish(run, RunOutcome.Kind.NETWORK_ERROR, e.getMessage());
        } catch (AppRunnerException | IllegalArgumentException e) {
            finish(run, RunOutcome.Kind.REJECTED, e.getMessage());
        }
    }

    private void poll(Run run) {
        if (run.future.isDone()) {
            return;
        }
        if (run.elapsed().compareTo(timeout) > 0) {
            finish(run, RunOutcome.Kind.TIMEOUT, "Timed out after " + timeout.toSeconds() + "s");
            return;
        }

        StatusResponse status;
        try {
            status = client.getStatus(run.ticket);
        } catch (TransportException e) {
            run.transportFailures++;
            if (run.transportFailures >= maxTransportFailures) {
                finish(run, RunOutcome.Kind.NETWORK_ERROR, e.getMessage());
            } else {
                Duration delay = backoff(run.transportFailures);
                log.warn("Poll of {} failed ({} of {}), retrying in {}ms: {}",
                        run.ticket, run.transportFailures, maxTransportFailures, delay.toMillis(), e.getMessage());
                schedule(run, delay);
            }
            return;
        } catch (AppRunnerException e) {
            finish(run, RunOutcome.Kind.ERROR, e.getMessage());
            return;
        }

        run.transportFailures = 0;
        try {
            listener.onStatus(run.ticket, status);
        } catch (RuntimeException e) {
            log.warn("Poll listener failed for {}", run.ticket, e);
        }

        switch (status.status()) {
            case COMPLETE -> finish(run, RunOutcome.Kind.COMPLETE, status.payload());
            case ERROR -> finish(run, RunOutcome.Kind.ERROR, status.payload());
            case TIMEOUT -> finish(run, RunOutcome.Kind.TIMEOUT, status.payload());
            default -> schedule(run, pollInterval);
        }
    }

    /**
     * Poll interval doubled per consecutive failure, capped at the max backoff.
     */
    Duration backoff(int failures) {
        long multiplier = 1L << Math.min(failures, 20);
        Duration delay = pollInterval.multipliedBy(multiplier);
        return delay.compareTo(maxBackoff) > 0 ? maxBackoff : delay;
    }

    private void schedule(Run run, Duration delay) {
        // Never sleep past the deadline
        Duration remaining = timeout.minus(run.elapsed()).plusMillis(1);
        Duration effective = remaining.isNegative() || delay.compareTo(remaining) < 0 ? delay : remaining;
        submit(run, () -> poll(run), effective.toMillis());
    }

    private void submit(Run run, Runnable step, long delayMs) {
        Runnable guarded = () -> {
            try {
                step.run();
            } catch (RuntimeException e) {
                log.error("Poller failed for {}", run.ticket, e);
                finish(run, RunOutcome.Kind.ERROR, "Client error: " + e.getMessage());
            }
        };
        try {
            executor.schedule(guarded, Math.max(0, delayMs), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            run.future.completeExceptionally(new IllegalStateException("Poller is closed", e));
        }
    }

    private void finish(Run run, RunOutcome.Kind kind, String payload) {
        RunOutcome outcome = new RunOutcome(kind, run.ticket, payload, run.elapsed());
        if (run.future.complete(outcome)) {
            log.info("Run {} finished: {} after {}ms", run.ticket, kind, outcome.elapsed().toMillis());
        }
    }

    @Override
    public void close() {
        cancel();
        executor.shutdownNow();
    }

    /**
     * Mutable state of one run; only touched from the poller thread after creation.
     */
    private static final class Run {
        private final long startNanos = System.nanoTime();
        private final CompletableFuture<RunOutcome> future = new CompletableFuture<>();
        private volatile String ticket;
        private int transportFailures;

        Run(String ticket) {
            this.ticket = ticket;
        }

        Duration elapsed() {
            return Duration.ofNanos(System.nanoTime() - startNanos);
        }
    }
}
