package apprunner.balancer.client;

import apprunner.common.api.dto.ProjectRequest;
import apprunner.common.api.dto.ProjectResponse;
import apprunner.common.api.dto.StatusRequest;
import apprunner.common.api.dto.StatusResponse;
import apprunner.common.api.dto.TaskAccepted;
import apprunner.common.api.dto.WorkerTaskRequest;
import apprunner.common.error.AppRunnerException;
import apprunner.common.http.JsonHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * WorkerClient speaking the worker's REST API over HTTP.
 * The worker's base URL doubles as its id.
 */
public class HttpWorkerClient implements WorkerClient {

    private static final Logger log = LoggerFactory.getLogger(HttpWorkerClient.class);

    private final JsonHttpClient http;

    public HttpWorkerClient(String baseUrl, Duration timeout) {
        this.http = new JsonHttpClient(baseUrl, timeout);
    }

    @Override
    public String workerId() {
        return http.baseUrl();
    }

    @Override
    public TaskAccepted acceptTask(WorkerTaskRequest request) {
        return http.post("/rest/v1", request, TaskAccepted.class);
    }

    @Override
    public StatusResponse pollStatus(String ticket) {
        return http.get("/rest/v1", new StatusRequest(ticket, workerId()), StatusResponse.class);
    }

    @Override
    public ProjectResponse getProject(String project) {
        return http.get("/rest/v1/project", new ProjectRequest(project), ProjectResponse.class);
    }

    @Override
    public WorkerState probe() {
        try {
            int status = http.status("/health");
            if (status == 200) {
                return WorkerState.IDLE;
            }
            return status == 500 ? WorkerState.BUSY : WorkerState.UNREACHABLE;
        } catch (AppRunnerException e) {
            log.debug("Health probe of {} failed: {}", workerId(), e.getMessage());
            return WorkerState.UNREACHABLE;
        }
    }

    @Override
    public String toString() {
        return "HttpWorkerClient{" + workerId() + '}';
    }
}
