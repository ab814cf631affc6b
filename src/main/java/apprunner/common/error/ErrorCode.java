package apprunner.common.error;

import io.netty.handler.codec.http.HttpResponseStatus;

import java.util.Arrays;
import java.util.Optional;

/**
 * Error codes carried in the {@code error} field of failure envelopes.
 * Each code pins the HTTP status it travels with.
 */
public enum ErrorCode {
    /** Build/run requested while the worker already holds its lock */
    WORKER_LOCKED("worker_locked", HttpResponseStatus.INTERNAL_SERVER_ERROR),
    /** No record or registry entry for the ticket */
    UNKNOWN_TICKET("unknown_ticket", HttpResponseStatus.NOT_FOUND),
    /** Balancer could not find or reach any worker */
    NO_WORKER_AVAILABLE("no_worker_available", HttpResponseStatus.SERVICE_UNAVAILABLE),
    /** Network failure or timeout between two services */
    TRANSPORT_ERROR("transport_error", HttpResponseStatus.BAD_GATEWAY),
    PROJECT_NOT_FOUND("project_not_found", HttpResponseStatus.NOT_FOUND),
    DUPLICATE_TICKET("duplicate_ticket", HttpResponseStatus.CONFLICT),
    /** Status poll carried a workerId that is not this worker */
    WRONG_WORKER("wrong_worker", HttpResponseStatus.INTERNAL_SERVER_ERROR),
    BAD_REQUEST("bad_request", HttpResponseStatus.BAD_REQUEST),
    /** No route for the path */
    NOT_FOUND("not_found", HttpResponseStatus.NOT_FOUND),
    INTERNAL("internal_error", HttpResponseStatus.INTERNAL_SERVER_ERROR);

    private final String wire;
    private final HttpResponseStatus httpStatus;

    ErrorCode(String wire, HttpResponseStatus httpStatus) {
        this.wire = wire;
        this.httpStatus = httpStatus;
    }

    public String wire() {
        return wire;
    }

    public HttpResponseStatus httpStatus() {
        return httpStatus;
    }

    public static Optional<ErrorCode> fromWire(String wire) {
        return Arrays.stream(values())
                .filter(c -> c.wire.equals(wire))
                .findFirst();
    }
}
