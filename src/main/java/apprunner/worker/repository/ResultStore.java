package apprunner.worker.repository;

import apprunner.common.model.ResultRecord;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Worker-local map from ticket to the latest result record.
 *
 * Reads always return a whole record (the previous one or the new one, never
 * a mix). Implementations must be safe for concurrent readers and writers.
 */
public interface ResultStore {

    /**
     * Create the initial record for a ticket.
     *
     * @return false if a record for the ticket already exists
     */
    boolean create(ResultRecord record);

    /**
     * Replace the record only if the stored one is still RUNNING.
     * Whichever terminal write comes first wins.
     *
     * @return true if the record was replaced
     */
    boolean completeIfRunning(ResultRecord terminal);

    Optional<ResultRecord> read(String ticket);

    boolean delete(String ticket);

    /** All records, in no particular order. Used by housekeeping. */
    List<ResultRecord> findAll();

    /**
     * Terminal records written before the cutoff. Never includes RUNNING records.
     */
    default List<ResultRecord> findTerminalOlderThan(Instant cutoff) {
        return findAll().stream()
                .filter(ResultRecord::isTerminal)
                .filter(r -> r.writtenAt().isBefore(cutoff))
                .toList();
    }

    /** RUNNING records written before the cutoff. */
    default List<ResultRecord> findRunningOlderThan(Instant cutoff) {
        return findAll().stream()
                .filter(r -> !r.isTerminal())
                .filter(r -> r.writtenAt().isBefore(cutoff))
                .toList();
    }
}
