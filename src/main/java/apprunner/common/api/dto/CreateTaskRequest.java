package apprunner.common.api.dto;

import apprunner.common.model.Patch;
import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Request DTO for starting a run.
 * POST /rest/balancer/v1
 */
public record CreateTaskRequest(
        @JsonProperty("project") String project,
        @JsonProperty("patches") List<Patch> patches,
        @JsonProperty("userId") @JsonAlias("user_id") String userId) {

    public List<Patch> patchesOrEmpty() {
        return patches != null ? patches : List.of();
    }

    public void validate() {
        if (project == null || project.isBlank()) {
            throw new IllegalArgumentException("Must specify project");
        }
        Patch.validateAll(patchesOrEmpty());
    }
}
