package apprunner.common.api.dto;

import apprunner.common.model.Patch;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Request DTO the balancer forwards to a worker.
 * POST /rest/v1
 */
public record WorkerTaskRequest(
        @JsonProperty("ticket") String ticket,
        @JsonProperty("project") String project,
        @JsonProperty("patches") List<Patch> patches,
        @JsonProperty("userId") String userId) {

    public List<Patch> patchesOrEmpty() {
        return patches != null ? patches : List.of();
    }

    public void validate() {
        if (ticket == null || ticket.isBlank()) {
            throw new IllegalArgumentException("Must specify ticket");
        }
        if (project == null || project.isBlank()) {
            throw new IllegalArgumentException("Must specify project");
        }
        Patch.validateAll(patchesOrEmpty());
    }
}
