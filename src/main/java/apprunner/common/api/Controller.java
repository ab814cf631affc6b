package apprunner.common.api;

import apprunner.common.Json;
import apprunner.common.api.dto.Envelope;
import apprunner.common.error.AppRunnerException;
import apprunner.common.error.ErrorCode;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;

/**
 * Base interface for HTTP controllers.
 * Controllers handle specific URL patterns and HTTP methods.
 */
public interface Controller {

    /**
     * Check if this controller can handle the given request.
     *
     * @param method HTTP method
     * @param path   Request path (without query string)
     * @return true if this controller handles this request
     */
    boolean matches(HttpMethod method, String path);

    /**
     * Handle the request.
     *
     * @param ctx  Netty channel context
     * @param req  Full HTTP request
     * @param path Request path (without query string)
     * @return Response to send back
     */
    ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path);

    /**
     * Response from a controller.
     */
    record ControllerResponse(
            HttpResponseStatus status,
            String contentType,
            String body) {

        public static ControllerResponse json(HttpResponseStatus status, String body) {
            return new ControllerResponse(status, "application/json", body);
        }

        /** 200 with {@code {"payload": ...}} */
        public static ControllerResponse ok(Object payload) {
            return json(HttpResponseStatus.OK, Json.write(Envelope.ok(payload)));
        }

        public static ControllerResponse failure(ErrorCode code, String message) {
            return json(code.httpStatus(), Json.write(Envelope.failure(code, message)));
        }

        public static ControllerResponse failure(AppRunnerException e) {
            return failure(e.code(), e.getMessage());
        }

        public static ControllerResponse badRequest(String message) {
            return failure(ErrorCode.BAD_REQUEST, message);
        }

        public static ControllerResponse error(String message) {
            return failure(ErrorCode.INTERNAL, message);
        }

        public static ControllerResponse notFound(String message) {
            return failure(ErrorCode.NOT_FOUND, message);
        }
    }
}
