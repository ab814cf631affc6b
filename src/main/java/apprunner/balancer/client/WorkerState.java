package apprunner.balancer.client;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Worker availability as seen by a health probe.
 */
public enum WorkerState {
    IDLE,
    BUSY,
    UNREACHABLE;

    @JsonValue
    public String wire() {
        return name().toLowerCase(Locale.ROOT);
    }
}
