package apprunner.common.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Editable source file of a project, as shown in the editor.
 */
public record ProjectResponse(
        @JsonProperty("filename") String filename,
        @JsonProperty("projectName") String projectName,
        @JsonProperty("contents") String contents) {
}
