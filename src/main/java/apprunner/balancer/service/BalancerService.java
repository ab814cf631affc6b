package apprunner.balancer.service;

import apprunner.balancer.api.dto.BalancerHealth;
import apprunner.balancer.client.WorkerClient;
import apprunner.balancer.model.TaskRegistration;
import apprunner.balancer.pool.WorkerPool;
import apprunner.balancer.pool.WorkerSelector;
import apprunner.balancer.repository.TaskRegistry;
import apprunner.common.api.dto.CreateTaskRequest;
import apprunner.common.api.dto.ProjectResponse;
import apprunner.common.api.dto.StatusResponse;
import apprunner.common.api.dto.TaskAccepted;
import apprunner.common.api.dto.WorkerTaskRequest;
import apprunner.common.error.NoWorkerAvailableException;
import apprunner.common.error.TransportException;
import apprunner.common.error.UnknownTicketException;
import apprunner.common.error.WorkerBusyException;
import apprunner.common.model.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Client-facing orchestration: issue tickets, dispatch them to workers and
 * relay status polls to the worker that owns each ticket.
 *
 * Never queues: if no worker can take a run right now the caller gets an error.
 */
public class BalancerService {

    private static final Logger log = LoggerFactory.getLogger(BalancerService.class);

    private final TaskRegistry registry;
    private final WorkerPool pool;
    private final WorkerSelector selector;
    private final boolean retryOnBusy;

    public BalancerService(TaskRegistry registry, WorkerPool pool, WorkerSelector selector, boolean retryOnBusy) {
        this.registry = registry;
        this.pool = pool;
        this.selector = selector;
        this.retryOnBusy = retryOnBusy;
    }

    /**
     * Issue a ticket and hand the run to a worker.
     *
     * @throws WorkerBusyException         if every reachable worker is busy
     * @throws NoWorkerAvailableException  if no worker is configured or reachable
     */
    public TaskAccepted createTask(CreateTaskRequest request) {
        request.validate();

        List<WorkerClient> candidates = selector.candidates(pool);
        if (candidates.isEmpty()) {
            throw new NoWorkerAvailableException("No workers configured");
        }

        int busy = 0;
        TransportException lastTransportError = null;

        for (WorkerClient worker : candidates) {
            // Fresh ticket per attempt: a timed-out attempt may still have been accepted
            String ticket = UUID.randomUUID().toString();
            WorkerTaskRequest forward = new WorkerTaskRequest(
                    ticket, request.project(), request.patchesOrEmpty(), request.userId());
            try {
                worker.acceptTask(forward);
            } catch (WorkerBusyException e) {
                busy++;
                log.info("Worker {} busy for project {}", worker.workerId(), request.project());
                if (!retryOnBusy) {
                    throw e;
                }
                continue;
            } catch (TransportException e) {
                lastTransportError = e;
                log.warn("Worker {} unreachable: {}", worker.workerId(), e.getMessage());
                continue;
            }

            registry.save(TaskRegistration.builder()
                    .ticket(ticket)
                    .workerId(worker.workerId())
                    .project(request.project())
                    .userId(request.userId())
                    .status(TaskStatus.RUNNING)
                    .build());

            log.info("Ticket {} (project {}, user {}) assigned to {}",
                    ticket, request.project(), request.userId(), worker.workerId());
            return new TaskAccepted(ticket, worker.workerId());
        }

        if (busy > 0) {
            throw new WorkerBusyException();
        }
        throw new NoWorkerAvailableException("No worker reachable", lastTransportError);
    }

    /**
     * Relay the owning worker's record for a ticket.
     *
     * @throws UnknownTicketException      if the ticket is not (or no longer) registered
     * @throws NoWorkerAvailableException  if the owning worker left the pool
     */
    public StatusResponse getStatus(String ticket) {
        TaskRegistration registration = registry.findByTicket(ticket)
                .orElseThrow(() -> UnknownTicketException.forTicket(ticket));

        WorkerClient worker = pool.find(registration.workerId())
                .orElseThrow(() -> new NoWorkerAvailableException(
                        "Worker " + registration.workerId() + " is no longer in the pool"));

        StatusResponse status = worker.pollStatus(ticket);

        if (status.status() != registration.status()) {
            try {
                registry.updateStatus(ticket, status.status());
            } catch (RuntimeException e) {
                log.warn("Failed to record status {} for ticket {}: {}", status.status(), ticket, e.getMessage());
            }
        }
        return status;
    }

    /**
     * Editable source of a project, from the first reachable worker.
     */
    public ProjectResponse getProject(String project) {
        TransportException lastTransportError = null;
        for (WorkerClient worker : selector.candidates(pool)) {
            try {
                return worker.getProject(project);
            } catch (TransportException e) {
                lastTransportError = e;
                log.warn("Worker {} unreachable: {}", worker.workerId(), e.getMessage());
            }
        }
        throw new NoWorkerAvailableException("No worker reachable", lastTransportError);
    }

    public BalancerHealth health() {
        List<BalancerHealth.WorkerHealthView> workers = new ArrayList<>();
        for (WorkerClient worker : pool.all()) {
            workers.add(new BalancerHealth.WorkerHealthView(worker.workerId(), worker.probe()));
        }
        return BalancerHealth.of(registry.count(), workers);
    }
}
