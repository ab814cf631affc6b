package apprunner.client;

import apprunner.common.api.dto.StatusResponse;

/**
 * Receives every status observed while polling, including intermediate RUNNING ones.
 */
@FunctionalInterface
public interface PollListener {

    PollListener NONE = (ticket, status) -> {
    };

    void onStatus(String ticket, StatusResponse status);
}
