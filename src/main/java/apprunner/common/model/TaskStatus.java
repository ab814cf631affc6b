package apprunner.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Task execution status.
 * Serialized to lowercase wire names ({@code "running"}, {@code "complete"}, ...).
 */
public enum TaskStatus {
    /** Ticket issued, not yet accepted by a worker */
    CREATED,
    /** Accepted by a worker; build/run in flight */
    RUNNING,
    /** Build/run finished, payload is the base64 screenshot */
    COMPLETE,
    /** Build/run failed, payload is the diagnostic */
    ERROR,
    /** Run exceeded its deadline */
    TIMEOUT;

    @JsonValue
    public String wire() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static TaskStatus fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("status is required");
        }
        return TaskStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    /** Check if no further transition can follow */
    public boolean isTerminal() {
        return this == COMPLETE || this == ERROR || this == TIMEOUT;
    }
}
