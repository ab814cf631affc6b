package apprunner.common.server;

import apprunner.common.api.dto.CreateTaskRequest;
import apprunner.common.api.dto.StatusRequest;
import io.netty.buffer.Unpooled;
import io.netty.handler.codec.http.DefaultFullHttpRequest;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpVersion;
import org.junit.jupiter.api.Test;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class RequestArgsTest {

    @Test
    void readsWrappedJsonFromQuery() {
        String json = URLEncoder.encode("{\"ticket\":\"abc\",\"workerId\":\"w1\"}", StandardCharsets.UTF_8);
        StatusRequest request = RequestArgs.parse(get("/rest/v1?request=" + json), StatusRequest.class);

        assertEquals("abc", request.ticket());
        assertEquals("w1", request.workerId());
    }

    @Test
    void readsPlainQueryParameters() {
        StatusRequest request = RequestArgs.parse(get("/rest/v1?ticket=abc"), StatusRequest.class);

        assertEquals("abc", request.ticket());
        assertNull(request.workerId());
    }

    @Test
    void readsJsonBody() {
        FullHttpRequest req = post("{\"project\":\"Example\",\"patches\":[],\"userId\":\"u1\"}", "application/json");
        CreateTaskRequest request = RequestArgs.parse(req, CreateTaskRequest.class);

        assertEquals("Example", request.project());
        assertEquals("u1", request.userId());
    }

    @Test
    void readsFormWrappedJson() {
        String form = "request=" + URLEncoder.encode("{\"project\":\"Example\"}", StandardCharsets.UTF_8);
        FullHttpRequest req = post(form, "application/x-www-form-urlencoded");

        assertEquals("Example", RequestArgs.parse(req, CreateTaskRequest.class).project());
    }

    @Test
    void rejectsMalformedInput() {
        assertThrows(IllegalArgumentException.class,
                () -> RequestArgs.parse(post("{not json", "application/json"), CreateTaskRequest.class));
        assertThrows(IllegalArgumentException.class,
                () -> RequestArgs.parse(post("", "application/json"), CreateTaskRequest.class));
        assertThrows(IllegalArgumentException.class,
                () -> RequestArgs.parse(post("other=1", "application/x-www-form-urlencoded"), CreateTaskRequest.class));
    }

    private static FullHttpRequest get(String uri) {
        return new DefaultFullHttpRequest(HttpVersion.HTTP_1_1, HttpMethod.GET, uri);
    }

    private static FullHttpRequest post(String body, String contentType) {
        FullHttpRequest req = new DefaultFullHttpRequest(HttpVersion.HTTP_1_1, HttpMethod.POST, "/rest/v1",
                Unpooled.copiedBuffer(body, StandardCharsets.UTF_8));
        req.headers().set(HttpHeaderNames.CONTENT_TYPE, contentType);
        return req;
    }
}
