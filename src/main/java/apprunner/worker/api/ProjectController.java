package apprunner.worker.api;

import apprunner.common.api.Controller;
import apprunner.common.api.dto.ProjectRequest;
import apprunner.common.error.AppRunnerException;
import apprunner.common.server.RequestArgs;
import apprunner.worker.service.WorkerService;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;

/**
 * GET /rest/v1/project - Editable source of a golden project
 */
public class ProjectController implements Controller {

    private final WorkerService workerService;

    public ProjectController(WorkerService workerService) {
        this.workerService = workerService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return HttpMethod.GET.equals(method) && "/rest/v1/project".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            ProjectRequest request = RequestArgs.parse(req, ProjectRequest.class);
            request.validate();
            return ControllerResponse.ok(workerService.getProject(request.project()));
        } catch (AppRunnerException e) {
            return ControllerResponse.failure(e);
        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        }
    }
}
