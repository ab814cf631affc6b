package apprunner.common.api.dto;

import apprunner.common.error.ErrorCode;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wrapper around every response body.
 * Success: {@code {"payload": ...}}. Failure: {@code {"payload": "message", "error": "code"}}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Envelope(
        @JsonProperty("payload") Object payload,
        @JsonProperty("error") String error) {

    public static Envelope ok(Object payload) {
        return new Envelope(payload, null);
    }

    public static Envelope failure(ErrorCode code, String message) {
        return new Envelope(message, code.wire());
    }
}
