package apprunner.balancer.store;

import apprunner.balancer.model.TaskRegistration;
import apprunner.balancer.repository.TaskRegistry;
import apprunner.common.error.DuplicateTicketException;
import apprunner.common.model.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Optional;

/**
 * JDBC implementation of TaskRegistry.
 */
public class JdbcTaskRegistry implements TaskRegistry {

    private static final Logger log = LoggerFactory.getLogger(JdbcTaskRegistry.class);

    private static final String TERMINAL_STATUSES = "('" + TaskStatus.COMPLETE.name() + "', '"
            + TaskStatus.ERROR.name() + "', '" + TaskStatus.TIMEOUT.name() + "')";

    private final Database db;

    public JdbcTaskRegistry(Database db) {
        this.db = db;
    }

    @Override
    public void save(TaskRegistration registration) {
        String sql = """
                    INSERT INTO tasks (ticket, worker_id, project, user_id, status, created_at, updated_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, registration.ticket());
            ps.setString(2, registration.workerId());
            ps.setString(3, registration.project());
            ps.setString(4, registration.userId());
            ps.setString(5, registration.status().name());
            ps.setTimestamp(6, Timestamp.from(registration.createdAt()));
            ps.setTimestamp(7, Timestamp.from(registration.updatedAt()));

            ps.executeUpdate();
            conn.commit();
        } catch (SQLIntegrityConstraintViolationException e) {
            throw new DuplicateTicketException("Ticket already registered: " + registration.ticket());
        } catch (SQLException e) {
            throw new RuntimeException("Failed to save registration: " + registration.ticket(), e);
        }
    }

    @Override
    public Optional<TaskRegistration> findByTicket(String ticket) {
        String sql = "SELECT * FROM tasks WHERE ticket = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, ticket);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find registration: " + ticket, e);
        }
    }

    @Override
    public boolean updateStatus(String ticket, TaskStatus status) {
        String sql = "UPDATE tasks SET status = ?, updated_at = ? WHERE ticket = ? AND status NOT IN "
                + TERMINAL_STATUSES + " AND status <> ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, status.name());
            ps.setTimestamp(2, Timestamp.from(Instant.now()));
            ps.setString(3, ticket);
            ps.setString(4, status.name());

            int updated = ps.executeUpdate();
            conn.commit();

            if (updated > 0) {
                log.debug("Registration {} -> {}", ticket, status);
            }
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update registration: " + ticket, e);
        }
    }

    @Override
    public int deleteTerminalOlderThan(Instant cutoff) {
        String sql = "DELETE FROM tasks WHERE status IN " + TERMINAL_STATUSES + " AND updated_at < ?";
        return deleteBefore(sql, cutoff);
    }

    @Override
    public int deleteOlderThan(Instant cutoff) {
        return deleteBefore("DELETE FROM tasks WHERE created_at < ?", cutoff);
    }

    @Override
    public int count() {
        String sql = "SELECT COUNT(*) FROM tasks";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getInt(1) : 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count registrations", e);
        }
    }

    private int deleteBefore(String sql, Instant cutoff) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, Timestamp.from(cutoff));
            int deleted = ps.executeUpdate();
            conn.commit();
            return deleted;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to delete registrations before " + cutoff, e);
        }
    }

    private TaskRegistration mapRow(ResultSet rs) throws SQLException {
        return TaskRegistration.builder()
                .ticket(rs.getString("ticket"))
                .workerId(rs.getString("worker_id"))
                .project(rs.getString("project"))
                .userId(rs.getString("user_id"))
                .status(TaskStatus.valueOf(rs.getString("status")))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .updatedAt(toInstant(rs.getTimestamp("updated_at")))
                .build();
    }

    private static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }
}
