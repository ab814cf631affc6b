package apprunner.common.server;

import apprunner.common.Json;
import apprunner.common.api.Controller;
import apprunner.common.api.Controller.ControllerResponse;
import apprunner.common.api.dto.Envelope;
import apprunner.common.error.AppRunnerException;
import apprunner.common.error.ErrorCode;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandler.Sharable;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static io.netty.handler.codec.http.HttpHeaderNames.CONTENT_TYPE;
import static io.netty.handler.codec.http.HttpResponseStatus.INTERNAL_SERVER_ERROR;
import static io.netty.handler.codec.http.HttpVersion.HTTP_1_1;

/**
 * Central router that dispatches HTTP requests to registered controllers.
 *
 * Unmatched paths return 404. Exceptions escaping a controller are mapped to
 * an error envelope: {@link IllegalArgumentException} to 400, {@link AppRunnerException}
 * to its code's status, anything else to 500.
 *
 * This handler is @Sharable because it has no per-channel state.
 */
@Sharable
public class RouterHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private static final Logger log = LoggerFactory.getLogger(RouterHandler.class);

    private final String name;
    private final List<Controller> controllers = new ArrayList<>();

    public RouterHandler(String name) {
        this.name = name;
    }

    /**
     * Register a controller to handle requests.
     * Controllers are checked in order of registration.
     */
    public RouterHandler registerController(Controller controller) {
        controllers.add(controller);
        log.debug("[{}] Registered controller: {}", name, controller.getClass().getName());
        return this;
    }

    public int controllerCount() {
        return controllers.size();
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest req) {
        String uri = req.uri();
        HttpMethod method = req.method();

        // Extract path without query string
        String path = uri.contains("?") ? uri.substring(0, uri.indexOf('?')) : uri;

        try {
            for (Controller controller : controllers) {
                if (controller.matches(method, path)) {
                    ControllerResponse response = controller.handle(ctx, req, path);
                    writeSafe(ctx, response.status(), response.contentType(), response.body());
                    return;
                }
            }

            log.debug("[{}] No handler for: {} {}", name, method, path);
            ControllerResponse notFound = ControllerResponse.notFound("not found");
            writeSafe(ctx, notFound.status(), notFound.contentType(), notFound.body());

        } catch (IllegalArgumentException e) {
            log.warn("[{}] Validation error: {}", name, e.getMessage());
            writeEnvelope(ctx, ErrorCode.BAD_REQUEST, e.getMessage());
        } catch (AppRunnerException e) {
            log.info("[{}] {} {} -> {}: {}", name, method, path, e.code().wire(), e.getMessage());
            writeEnvelope(ctx, e.code(), e.getMessage());
        } catch (Throwable t) {
            log.error("[{}] Handler error: {} {} - {}", name, method, path, t.toString(), t);
            writeEnvelope(ctx, ErrorCode.INTERNAL, errorChain(t));
        }
    }

    private void writeEnvelope(ChannelHandlerContext ctx, ErrorCode code, String message) {
        writeSafe(ctx, code.httpStatus(), "application/json", Json.write(Envelope.failure(code, message)));
    }

    /**
     * Safe write that catches any exceptions during response writing.
     * Ensures we never silently close the connection.
     */
    private void writeSafe(ChannelHandlerContext ctx, HttpResponseStatus status, String contentType, String body) {
        try {
            byte[] bytes = (body == null ? "" : body).getBytes(StandardCharsets.UTF_8);
            FullHttpResponse response = new DefaultFullHttpResponse(HTTP_1_1, status, Unpooled.wrappedBuffer(bytes));
            response.headers().set(CONTENT_TYPE, contentType + "; charset=utf-8");
            response.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, bytes.length);
            ctx.writeAndFlush(response);
        } catch (Throwable t) {
            log.error("[{}] Failed to write response: {}", name, t.getMessage(), t);
            try {
                byte[] errorBytes = "{\"payload\":\"failed to write response\",\"error\":\"internal_error\"}"
                        .getBytes(StandardCharsets.UTF_8);
                FullHttpResponse errorResponse = new DefaultFullHttpResponse(HTTP_1_1, INTERNAL_SERVER_ERROR,
                        Unpooled.wrappedBuffer(errorBytes));
                errorResponse.headers().set(CONTENT_TYPE, "application/json; charset=utf-8");
                errorResponse.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, errorBytes.length);
                ctx.writeAndFlush(errorResponse);
            } catch (Throwable t2) {
                log.error("[{}] Complete failure writing error response", name, t2);
                ctx.close();
            }
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("[{}] Unhandled exception in channel: {}", name, cause.getMessage(), cause);
        try {
            writeEnvelope(ctx, ErrorCode.INTERNAL, "channel error: " + cause.getMessage());
        } finally {
            ctx.close();
        }
    }

    private static String errorChain(Throwable t) {
        StringBuilder chain = new StringBuilder(t.toString());
        Throwable cause = t.getCause();
        while (cause != null) {
            chain.append(" <- ").append(cause);
            cause = cause.getCause();
        }
        return chain.toString();
    }
}
