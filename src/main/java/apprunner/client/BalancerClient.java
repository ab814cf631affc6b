package apprunner.client;

import apprunner.common.api.dto.CreateTaskRequest;
import apprunner.common.api.dto.ProjectResponse;
import apprunner.common.api.dto.StatusResponse;
import apprunner.common.api.dto.TaskAccepted;

/**
 * Client-side view of the balancer's REST API.
 * Errors surface as {@link apprunner.common.error.AppRunnerException} subtypes.
 */
public interface BalancerClient {

    TaskAccepted createTask(CreateTaskRequest request);

    StatusResponse getStatus(String ticket);

    ProjectResponse getProject(String project);
}
