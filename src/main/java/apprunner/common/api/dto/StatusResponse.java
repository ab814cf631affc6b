package apprunner.common.api.dto;

import apprunner.common.model.ResultRecord;
import apprunner.common.model.TaskStatus;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire view of a result record: status plus status-dependent payload.
 */
public record StatusResponse(
        @JsonProperty("status") TaskStatus status,
        @JsonProperty("payload") String payload) {

    public static StatusResponse from(ResultRecord record) {
        return new StatusResponse(record.status(), record.payload());
    }
}
