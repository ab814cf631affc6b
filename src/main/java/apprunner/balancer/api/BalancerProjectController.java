package apprunner.balancer.api;

import apprunner.balancer.service.BalancerService;
import apprunner.common.api.Controller;
import apprunner.common.api.dto.ProjectRequest;
import apprunner.common.error.AppRunnerException;
import apprunner.common.server.RequestArgs;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;

/**
 * GET /rest/balancer/v1/project - Editable source of a project, fetched from a worker
 */
public class BalancerProjectController implements Controller {

    private final BalancerService balancerService;

    public BalancerProjectController(BalancerService balancerService) {
        this.balancerService = balancerService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return HttpMethod.GET.equals(method) && "/rest/balancer/v1/project".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            ProjectRequest request = RequestArgs.parse(req, ProjectRequest.class);
            request.validate();
            return ControllerResponse.ok(balancerService.getProject(request.project()));
        } catch (AppRunnerException e) {
            return ControllerResponse.failure(e);
        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        }
    }
}
