package apprunner.common.model;

import apprunner.common.Json;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class TaskStatusTest {

    @Test
    void serializesToLowercaseWireNames() {
        assertEquals("\"running\"", Json.write(TaskStatus.RUNNING));
        assertEquals("\"complete\"", Json.write(TaskStatus.COMPLETE));
        assertEquals("\"timeout\"", Json.write(TaskStatus.TIMEOUT));
    }

    @Test
    void parsesWireNamesCaseInsensitively() {
        assertEquals(TaskStatus.ERROR, TaskStatus.fromWire("error"));
        assertEquals(TaskStatus.COMPLETE, TaskStatus.fromWire("COMPLETE"));
        assertThrows(IllegalArgumentException.class, () -> TaskStatus.fromWire(" "));
        assertThrows(IllegalArgumentException.class, () -> TaskStatus.fromWire("finished"));
    }

    @Test
    void terminalStates() {
        assertFalse(TaskStatus.CREATED.isTerminal());
        assertFalse(TaskStatus.RUNNING.isTerminal());
        assertTrue(TaskStatus.COMPLETE.isTerminal());
        assertTrue(TaskStatus.ERROR.isTerminal());
        assertTrue(TaskStatus.TIMEOUT.isTerminal());
    }

    @Test
    void resultRecordKeepsPayloadBitIdentical() throws Exception {
        ResultRecord record = new ResultRecord("t1", TaskStatus.COMPLETE, "abc==", Instant.parse("2024-05-01T10:15:30Z"));

        String json = Json.write(record);
        assertTrue(json.contains("\"status\":\"complete\""), json);
        assertTrue(json.contains("\"writtenAt\":\"2024-05-01T10:15:30Z\""), json);

        ResultRecord parsed = Json.mapper().readValue(json, ResultRecord.class);
        assertEquals(record, parsed);
    }

    @Test
    void resultRecordRequiresTicketAndStatus() {
        assertThrows(NullPointerException.class, () -> new ResultRecord(null, TaskStatus.RUNNING, null, Instant.now()));
        assertThrows(NullPointerException.class, () -> new ResultRecord("t", null, null, Instant.now()));
    }
}
