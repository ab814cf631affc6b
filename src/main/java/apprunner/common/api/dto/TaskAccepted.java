package apprunner.common.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Acknowledgement of an accepted run: the ticket to poll and the worker running it.
 */
public record TaskAccepted(
        @JsonProperty("ticket") String ticket,
        @JsonProperty("workerId") String workerId) {
}
