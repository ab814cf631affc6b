package apprunner.balancer.api.dto;

import apprunner.balancer.client.WorkerState;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Payload of the balancer's GET /health.
 */
public record BalancerHealth(
        @JsonProperty("status") String status,
        @JsonProperty("registeredTasks") int registeredTasks,
        @JsonProperty("workers") List<WorkerHealthView> workers) {

    public record WorkerHealthView(
            @JsonProperty("workerId") String workerId,
            @JsonProperty("state") WorkerState state) {
    }

    /** "ok" while at least one worker can take a run */
    public static BalancerHealth of(int registeredTasks, List<WorkerHealthView> workers) {
        boolean anyIdle = workers.stream().anyMatch(w -> w.state() == WorkerState.IDLE);
        return new BalancerHealth(anyIdle ? "ok" : "degraded", registeredTasks, workers);
    }
}
