package apprunner.balancer.repository;

import apprunner.balancer.model.TaskRegistration;
import apprunner.common.model.TaskStatus;

import java.time.Instant;
import java.util.Optional;

/**
 * Repository for the balancer's ticket-to-worker map.
 * Implementations must be safe for concurrent use.
 */
public interface TaskRegistry {

    /**
     * Save a new registration.
     *
     * @throws apprunner.common.error.DuplicateTicketException if the ticket is already registered
     */
    void save(TaskRegistration registration);

    /**
     * Find a registration by ticket.
     *
     * @param ticket the ticket
     * @return the registration if it has not been evicted
     */
    Optional<TaskRegistration> findByTicket(String ticket);

    /**
     * Record the last observed status.
     * Only moves forward: a terminal status is never overwritten.
     *
     * @return true if the row was updated
     */
    boolean updateStatus(String ticket, TaskStatus status);

    /**
     * Delete terminal registrations last updated before the cutoff.
     *
     * @return number of rows deleted
     */
    int deleteTerminalOlderThan(Instant cutoff);

    /**
     * Delete registrations created before the cutoff, whatever their status.
     *
     * @return number of rows deleted
     */
    int deleteOlderThan(Instant cutoff);

    int count();
}
