package apprunner.common.http;

import apprunner.common.Json;
import apprunner.common.error.AppRunnerException;
import apprunner.common.error.ErrorCode;
import apprunner.common.error.TransportException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Envelope-aware JSON client on top of {@link HttpClient}.
 *
 * GET arguments travel as {@code ?request=<json>}, POST arguments as a JSON body.
 * Failure envelopes are rethrown as the matching {@link AppRunnerException}
 * subtype; network problems become {@link TransportException}.
 */
public final class JsonHttpClient {

    private final String baseUrl;
    private final Duration timeout;
    private final HttpClient http;

    public JsonHttpClient(String baseUrl, Duration timeout) {
        this(baseUrl, timeout, HttpClient.newBuilder().connectTimeout(timeout).build());
    }

    public JsonHttpClient(String baseUrl, Duration timeout, HttpClient http) {
        this.baseUrl = stripTrailingSlash(baseUrl);
        this.timeout = timeout;
        this.http = http;
    }

    public String baseUrl() {
        return baseUrl;
    }

    public <T> T get(String path, Object args, Class<T> type) {
        String query = args == null ? ""
                : "?request=" + URLEncoder.encode(Json.write(args), StandardCharsets.UTF_8);
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path + query))
                .timeout(timeout)
                .GET()
                .build();
        return unwrap(send(request), type);
    }

    public <T> T post(String path, Object body, Class<T> type) {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(Json.write(body)))
                .build();
        return unwrap(send(request), type);
    }

    /**
     * Status code of a bare GET, for health probes.
     */
    public int status(String path) {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .timeout(timeout)
                .GET()
                .build();
        return send(request).statusCode();
    }

    private HttpResponse<String> send(HttpRequest request) {
        try {
            return http.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new TransportException("Request to " + request.uri() + " failed: " + e, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("Interrupted calling " + request.uri(), e);
        }
    }

    static <T> T unwrap(HttpResponse<String> response, Class<T> type) {
        JsonNode envelope;
        try {
            envelope = Json.mapper().readTree(response.body());
        } catch (JsonProcessingException e) {
            throw new TransportException("Non-JSON response (HTTP " + response.statusCode() + ") from "
                    + response.uri(), e);
        }
        if (envelope == null || !envelope.isObject()) {
            throw new TransportException("Malformed response (HTTP " + response.statusCode() + ") from "
                    + response.uri());
        }

        JsonNode error = envelope.get("error");
        JsonNode payload = envelope.get("payload");
        if (error != null && !error.isNull()) {
            ErrorCode code = ErrorCode.fromWire(error.asText()).orElse(ErrorCode.INTERNAL);
            String message = payload == null || payload.isNull() ? code.wire() : payload.asText();
            throw AppRunnerException.fromWire(code, message);
        }
        if (response.statusCode() / 100 != 2) {
            throw new TransportException("Unexpected HTTP " + response.statusCode() + " from " + response.uri());
        }
        try {
            return Json.mapper().treeToValue(payload, type);
        } catch (JsonProcessingException e) {
            throw new TransportException("Unexpected payload from " + response.uri() + ": " + e.getOriginalMessage(), e);
        }
    }

    private static String stripTrailingSlash(String url) {
        String result = url;
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }
}
