package apprunner.common.server;

import apprunner.common.Json;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.QueryStringDecoder;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * Extracts the JSON arguments of a request.
 *
 * Accepted shapes:
 * <ul>
 * <li>GET {@code ?request=<url-encoded json>}</li>
 * <li>GET with plain query parameters, e.g. {@code ?ticket=abc}</li>
 * <li>POST with a JSON body</li>
 * <li>POST form body {@code request=<url-encoded json>}</li>
 * </ul>
 */
public final class RequestArgs {

    static final String REQUEST_PARAM = "request";

    private RequestArgs() {
    }

    /**
     * Parse request arguments into the given DTO type.
     *
     * @throws IllegalArgumentException if the arguments are missing or malformed
     */
    public static <T> T parse(FullHttpRequest req, Class<T> type) {
        String json = HttpMethod.GET.equals(req.method())
                ? fromQuery(req.uri())
                : fromBody(req);
        try {
            return Json.mapper().readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed request: " + e.getOriginalMessage(), e);
        }
    }

    static String fromQuery(String uri) {
        Map<String, List<String>> params = new QueryStringDecoder(uri, StandardCharsets.UTF_8).parameters();
        List<String> wrapped = params.get(REQUEST_PARAM);
        if (wrapped != null && !wrapped.isEmpty()) {
            return wrapped.get(0);
        }
        ObjectNode node = Json.mapper().createObjectNode();
        params.forEach((name, values) -> {
            if (!values.isEmpty()) {
                node.put(name, values.get(0));
            }
        });
        return node.toString();
    }

    static String fromBody(FullHttpRequest req) {
        String body = req.content().toString(StandardCharsets.UTF_8);
        String contentType = req.headers().get(HttpHeaderNames.CONTENT_TYPE, "");
        if (contentType.startsWith("application/x-www-form-urlencoded")) {
            List<String> wrapped = new QueryStringDecoder(body, StandardCharsets.UTF_8, false)
                    .parameters().get(REQUEST_PARAM);
            if (wrapped == null || wrapped.isEmpty()) {
                throw new IllegalArgumentException("Missing '" + REQUEST_PARAM + "' form field");
            }
            return wrapped.get(0);
        }
        if (body.isBlank()) {
            throw new IllegalArgumentException("Empty request body");
        }
        return body;
    }
}
