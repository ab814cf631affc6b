package apprunner.balancer.api;

import apprunner.balancer.service.BalancerService;
import apprunner.common.api.Controller;
import apprunner.common.api.dto.CreateTaskRequest;
import apprunner.common.api.dto.StatusRequest;
import apprunner.common.api.dto.TaskAccepted;
import apprunner.common.error.AppRunnerException;
import apprunner.common.server.RequestArgs;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;

/**
 * Controller for the client-facing task API.
 * POST /rest/balancer/v1 - Start a run, returns {ticket, workerId}
 * GET /rest/balancer/v1 - Poll a ticket, returns {status, payload}
 */
public class BalancerTaskController implements Controller {

    static final String PATH = "/rest/balancer/v1";

    private final BalancerService balancerService;

    public BalancerTaskController(BalancerService balancerService) {
        this.balancerService = balancerService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return PATH.equals(path) && (HttpMethod.POST.equals(method) || HttpMethod.GET.equals(method));
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if (HttpMethod.POST.equals(req.method())) {
                CreateTaskRequest request = RequestArgs.parse(req, CreateTaskRequest.class);
                TaskAccepted accepted = balancerService.createTask(request);
                return ControllerResponse.ok(accepted);
            }

            StatusRequest request = RequestArgs.parse(req, StatusRequest.class);
            request.validate();
            return ControllerResponse.ok(balancerService.getStatus(request.ticket()));
        } catch (AppRunnerException e) {
            return ControllerResponse.failure(e);
        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        }
    }
}
