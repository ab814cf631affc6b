package apprunner.worker.api;

import apprunner.common.api.Controller;
import apprunner.common.api.dto.StatusRequest;
import apprunner.common.api.dto.StatusResponse;
import apprunner.common.api.dto.TaskAccepted;
import apprunner.common.api.dto.WorkerTaskRequest;
import apprunner.common.error.AppRunnerException;
import apprunner.common.model.ResultRecord;
import apprunner.common.server.RequestArgs;
import apprunner.worker.service.WorkerService;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Controller for the balancer-facing task API.
 * POST /rest/v1 - Start a build/run
 * GET /rest/v1 - Poll the status of a ticket
 */
public class TaskController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(TaskController.class);

    static final String PATH = "/rest/v1";

    private final WorkerService workerService;

    public TaskController(WorkerService workerService) {
        this.workerService = workerService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return PATH.equals(path) && (HttpMethod.POST.equals(method) || HttpMethod.GET.equals(method));
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if (HttpMethod.POST.equals(req.method())) {
                return handleCreate(req);
            }
            return handleStatus(req);
        } catch (AppRunnerException e) {
            return ControllerResponse.failure(e);
        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        }
    }

    /**
     * POST /rest/v1 - Accept a task; returns once the RUNNING record is written
     */
    private ControllerResponse handleCreate(FullHttpRequest req) {
        WorkerTaskRequest request = RequestArgs.parse(req, WorkerTaskRequest.class);
        TaskAccepted accepted = workerService.acceptTask(request);
        return ControllerResponse.ok(accepted);
    }

    /**
     * GET /rest/v1?request={"ticket": "..."} - Read the latest record
     */
    private ControllerResponse handleStatus(FullHttpRequest req) {
        StatusRequest request = RequestArgs.parse(req, StatusRequest.class);
        request.validate();

        ResultRecord record = workerService.pollStatus(request.ticket(), request.workerId());
        log.debug("Status of {}: {}", request.ticket(), record.status());
        return ControllerResponse.ok(StatusResponse.from(record));
    }
}
