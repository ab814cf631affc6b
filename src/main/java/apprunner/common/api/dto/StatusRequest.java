package apprunner.common.api.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * GET /rest/balancer/v1, GET /rest/v1
 * {@code workerId} is optional and only checked by workers.
 */
public record StatusRequest(
        @JsonProperty("ticket") String ticket,
        @JsonProperty("workerId") @JsonAlias("worker_id") String workerId) {

    public void validate() {
        if (ticket == null || ticket.isBlank()) {
            throw new IllegalArgumentException("Must specify ticket");
        }
    }
}
