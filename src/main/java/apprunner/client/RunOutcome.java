package apprunner.client;

import java.time.Duration;

/**
 * Final result of one client run, as shown to the user.
 *
 * @param kind    how the run ended
 * @param ticket  ticket of the run, null if it was never accepted
 * @param payload base64 screenshot on COMPLETE, diagnostic or message otherwise
 * @param elapsed time from the start of the run to this outcome
 */
public record RunOutcome(Kind kind, String ticket, String payload, Duration elapsed) {

    public enum Kind {
        /** Screenshot available */
        COMPLETE,
        /** Build or run failed on the worker */
        ERROR,
        /** Worker deadline or local poll timeout */
        TIMEOUT,
        /** Every worker was busy; retry later */
        WORKER_LOCKED,
        /** Balancer unreachable after repeated attempts */
        NETWORK_ERROR,
        /** Request refused (unknown project, bad input, no workers) */
        REJECTED
    }

    public boolean isSuccess() {
        return kind == Kind.COMPLETE;
    }
}
