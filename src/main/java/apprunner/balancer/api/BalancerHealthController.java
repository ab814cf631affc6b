package apprunner.balancer.api;

import apprunner.balancer.service.BalancerService;
import apprunner.common.api.Controller;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Health check controller.
 * GET /health - registry size and the state of every worker
 */
public class BalancerHealthController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(BalancerHealthController.class);

    private final BalancerService balancerService;

    public BalancerHealthController(BalancerService balancerService) {
        this.balancerService = balancerService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return HttpMethod.GET.equals(method) && "/health".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            return ControllerResponse.ok(balancerService.health());
        } catch (RuntimeException e) {
            log.error("Health check failed", e);
            return ControllerResponse.error("health check failed: " + e.getMessage());
        }
    }
}
