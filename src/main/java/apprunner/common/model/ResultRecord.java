package apprunner.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/**
 * Outcome of one task as stored by its worker.
 * Replaced as a whole on every update, never patched field by field.
 */
public record ResultRecord(
        @JsonProperty("ticket") String ticket,
        @JsonProperty("status") TaskStatus status,
        @JsonProperty("payload") String payload,
        @JsonProperty("writtenAt") Instant writtenAt) {

    public ResultRecord {
        Objects.requireNonNull(ticket, "ticket is required");
        Objects.requireNonNull(status, "status is required");
        Objects.requireNonNull(writtenAt, "writtenAt is required");
    }

    public static ResultRecord running(String ticket) {
        return new ResultRecord(ticket, TaskStatus.RUNNING, null, Instant.now());
    }

    public static ResultRecord complete(String ticket, String base64Artifact) {
        return new ResultRecord(ticket, TaskStatus.COMPLETE, base64Artifact, Instant.now());
    }

    public static ResultRecord error(String ticket, String diagnostic) {
        return new ResultRecord(ticket, TaskStatus.ERROR, diagnostic, Instant.now());
    }

    public static ResultRecord timeout(String ticket, String message) {
        return new ResultRecord(ticket, TaskStatus.TIMEOUT, message, Instant.now());
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }
}
