package apprunner.worker.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Payload of the worker's GET /health.
 */
public record WorkerHealth(
        @JsonProperty("workerId") String workerId,
        @JsonProperty("state") String state,
        @JsonProperty("ticket") String ticket) {

    public static WorkerHealth idle(String workerId) {
        return new WorkerHealth(workerId, "idle", null);
    }

    public static WorkerHealth busy(String workerId, String ticket) {
        return new WorkerHealth(workerId, "busy", ticket);
    }
}
