package apprunner.balancer.client;

import apprunner.common.api.dto.ProjectResponse;
import apprunner.common.api.dto.StatusResponse;
import apprunner.common.api.dto.TaskAccepted;
import apprunner.common.api.dto.WorkerTaskRequest;

/**
 * Balancer's view of one worker.
 *
 * Errors reported by the worker surface as the matching
 * {@link apprunner.common.error.AppRunnerException} subtype; network failures
 * as {@link apprunner.common.error.TransportException}.
 */
public interface WorkerClient {

    /** Stable id of the worker, recorded with every ticket it accepts */
    String workerId();

    /**
     * @throws apprunner.common.error.WorkerBusyException if the worker's lock is held
     */
    TaskAccepted acceptTask(WorkerTaskRequest request);

    /**
     * @throws apprunner.common.error.UnknownTicketException if the worker has no record
     */
    StatusResponse pollStatus(String ticket);

    ProjectResponse getProject(String project);

    /** Never throws */
    WorkerState probe();
}
