package apprunner.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A file replacement applied to the project sources before building.
 * {@code filename} is relative to the project root.
 */
public record Patch(
        @JsonProperty("filename") String filename,
        @JsonProperty("contents") String contents) {

    public void validate() {
        if (filename == null || filename.isBlank()) {
            throw new IllegalArgumentException("patch filename is required");
        }
        if (contents == null) {
            throw new IllegalArgumentException("patch contents are required for " + filename);
        }
    }

    /**
     * Validate every patch of a request; a JSON {@code null} entry is rejected too.
     */
    public static void validateAll(List<Patch> patches) {
        for (int i = 0; i < patches.size(); i++) {
            Patch patch = patches.get(i);
            if (patch == null) {
                throw new IllegalArgumentException("patch " + i + " is null");
            }
            patch.validate();
        }
    }
}
