package apprunner.worker.service;

import apprunner.common.api.dto.ProjectResponse;
import apprunner.common.api.dto.TaskAccepted;
import apprunner.common.api.dto.WorkerTaskRequest;
import apprunner.common.error.UnknownTicketException;
import apprunner.common.error.WorkerBusyException;
import apprunner.common.error.WrongWorkerException;
import apprunner.common.model.ResultRecord;
import apprunner.worker.execution.SubmitResult;
import apprunner.worker.execution.TaskExecutor;
import apprunner.worker.project.Project;
import apprunner.worker.project.ProjectCatalog;
import apprunner.worker.repository.ResultStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.regex.Pattern;

/**
 * Worker-facing operations: accept a task, report its status, serve project sources.
 *
 * Status polls are pure reads of the result store and never touch the worker lock.
 */
public class WorkerService {

    private static final Logger log = LoggerFactory.getLogger(WorkerService.class);

    private static final Pattern TICKET_PATTERN = Pattern.compile("[A-Za-z0-9_-]{1,128}");

    private final String workerId;
    private final ProjectCatalog catalog;
    private final TaskExecutor executor;
    private final ResultStore store;

    public WorkerService(String workerId, ProjectCatalog catalog, TaskExecutor executor, ResultStore store) {
        this.workerId = workerId;
        this.catalog = catalog;
        this.executor = executor;
        this.store = store;
    }

    public String workerId() {
        return workerId;
    }

    /**
     * Accept a build/run. Returns once the RUNNING record is written.
     *
     * @throws WorkerBusyException if another task holds the lock
     */
    public TaskAccepted acceptTask(WorkerTaskRequest request) {
        request.validate();
        if (!TICKET_PATTERN.matcher(request.ticket()).matches()) {
            throw new IllegalArgumentException("Invalid ticket: " + request.ticket());
        }

        Project project = catalog.get(request.project());

        SubmitResult result = executor.submit(request.ticket(), project, request.patchesOrEmpty());
        if (result == SubmitResult.WORKER_BUSY) {
            log.info("Rejected ticket {} from user {}: worker locked", request.ticket(), request.userId());
            throw new WorkerBusyException();
        }

        log.info("Ticket {} accepted for user {}", request.ticket(), request.userId());
        return new TaskAccepted(request.ticket(), workerId);
    }

    /**
     * Latest record for a ticket.
     *
     * @throws UnknownTicketException if the ticket was never accepted here or has been evicted
     */
    public ResultRecord pollStatus(String ticket) {
        if (ticket == null || !TICKET_PATTERN.matcher(ticket).matches()) {
            throw UnknownTicketException.forTicket(ticket);
        }
        return store.read(ticket).orElseThrow(() -> UnknownTicketException.forTicket(ticket));
    }

    /**
     * Like {@link #pollStatus(String)}, but rejects polls addressed to a different worker.
     */
    public ResultRecord pollStatus(String ticket, String expectedWorkerId) {
        if (expectedWorkerId != null && !expectedWorkerId.isBlank() && !expectedWorkerId.equals(workerId)) {
            throw new WrongWorkerException("Request sent to wrong worker; expected "
                    + expectedWorkerId + ", this is " + workerId);
        }
        return pollStatus(ticket);
    }

    public ProjectResponse getProject(String name) {
        return catalog.editorSource(name);
    }

    public boolean isBusy() {
        return executor.isBusy();
    }
}
