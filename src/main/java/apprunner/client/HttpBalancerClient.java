package apprunner.client;

import apprunner.common.api.dto.CreateTaskRequest;
import apprunner.common.api.dto.ProjectRequest;
import apprunner.common.api.dto.ProjectResponse;
import apprunner.common.api.dto.StatusRequest;
import apprunner.common.api.dto.StatusResponse;
import apprunner.common.api.dto.TaskAccepted;
import apprunner.common.http.JsonHttpClient;

import java.time.Duration;

/**
 * BalancerClient over HTTP.
 */
public class HttpBalancerClient implements BalancerClient {

    private final JsonHttpClient http;

    public HttpBalancerClient(String baseUrl) {
        this(baseUrl, Duration.ofSeconds(30));
    }

    public HttpBalancerClient(String baseUrl, Duration timeout) {
        this.http = new JsonHttpClient(baseUrl, timeout);
    }

    @Override
    public TaskAccepted createTask(CreateTaskRequest request) {
        return http.post("/rest/balancer/v1", request, TaskAccepted.class);
    }

    @Override
    public StatusResponse getStatus(String ticket) {
        return http.get("/rest/balancer/v1", new StatusRequest(ticket, null), StatusResponse.class);
    }

    @Override
    public ProjectResponse getProject(String project) {
        return http.get("/rest/balancer/v1/project", new ProjectRequest(project), ProjectResponse.class);
    }
}
