package apprunner.worker.api;

import apprunner.common.Json;
import apprunner.common.api.Controller;
import apprunner.common.api.dto.Envelope;
import apprunner.worker.api.dto.WorkerHealth;
import apprunner.worker.lock.WorkerLock;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;

import java.util.Optional;

/**
 * Health check controller.
 * GET /health - 200 when the worker can take a new run, 500 while its lock is held.
 * Load balancers use the status code alone.
 */
public class HealthController implements Controller {

    private final String workerId;
    private final WorkerLock lock;

    public HealthController(String workerId, WorkerLock lock) {
        this.workerId = workerId;
        this.lock = lock;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return HttpMethod.GET.equals(method) && "/health".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        Optional<String> holder = lock.holder();
        if (holder.isPresent()) {
            return ControllerResponse.json(HttpResponseStatus.INTERNAL_SERVER_ERROR,
                    Json.write(Envelope.ok(WorkerHealth.busy(workerId, holder.get()))));
        }
        return ControllerResponse.ok(WorkerHealth.idle(workerId));
    }
}
