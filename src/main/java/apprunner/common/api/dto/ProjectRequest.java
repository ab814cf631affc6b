package apprunner.common.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * GET /rest/balancer/v1/project, GET /rest/v1/project
 */
public record ProjectRequest(@JsonProperty("project") String project) {

    public void validate() {
        if (project == null || project.isBlank()) {
            throw new IllegalArgumentException("Must specify project");
        }
    }
}
