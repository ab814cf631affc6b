package apprunner.balancer.store;

import apprunner.balancer.model.TaskRegistration;
import apprunner.common.error.DuplicateTicketException;
import apprunner.common.model.TaskStatus;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class JdbcTaskRegistryTest {

    private static Database db;
    private static JdbcTaskRegistry registry;

    @BeforeAll
    static void setup() {
        db = new Database("jdbc:h2:mem:test-registry;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE", 4);
        registry = new JdbcTaskRegistry(db);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void cleanTasks() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM tasks");
            conn.commit();
        }
    }

    private static TaskRegistration registration(String ticket, String worker) {
        return TaskRegistration.builder()
                .ticket(ticket)
                .workerId(worker)
                .project("Example")
                .userId("u1")
                .status(TaskStatus.RUNNING)
                .build();
    }

    @Test
    void saveAndFind() {
        registry.save(registration("t1", "http://w1:8081"));

        TaskRegistration found = registry.findByTicket("t1").orElseThrow();
        assertEquals("http://w1:8081", found.workerId());
        assertEquals("Example", found.project());
        assertEquals("u1", found.userId());
        assertEquals(TaskStatus.RUNNING, found.status());
        assertNotNull(found.createdAt());

        assertTrue(registry.findByTicket("missing").isEmpty());
    }

    @Test
    void duplicateTicketIsRejected() {
        registry.save(registration("t1", "http://w1:8081"));

        assertThrows(DuplicateTicketException.class, () -> registry.save(registration("t1", "http://w2:8081")));
        assertEquals("http://w1:8081", registry.findByTicket("t1").orElseThrow().workerId());
    }

    @Test
    @DisplayName("Status only moves forward; terminal is final")
    void updateStatusIsForwardOnly() {
        registry.save(registration("t1", "http://w1:8081"));

        assertFalse(registry.updateStatus("t1", TaskStatus.RUNNING));
        assertTrue(registry.updateStatus("t1", TaskStatus.COMPLETE));
        assertFalse(registry.updateStatus("t1", TaskStatus.ERROR));
        assertFalse(registry.updateStatus("t1", TaskStatus.RUNNING));

        assertEquals(TaskStatus.COMPLETE, registry.findByTicket("t1").orElseThrow().status());
        assertFalse(registry.updateStatus("missing", TaskStatus.COMPLETE));
    }

    @Test
    void deleteTerminalOlderThanKeepsRunningRows() {
        Instant old = Instant.now().minus(Duration.ofHours(2));
        registry.save(registration("done", "w").toBuilder().status(TaskStatus.ERROR).createdAt(old).updatedAt(old).build());
        registry.save(registration("running", "w").toBuilder().createdAt(old).updatedAt(old).build());
        registry.save(registration("fresh", "w").toBuilder().status(TaskStatus.COMPLETE).build());

        assertEquals(1, registry.deleteTerminalOlderThan(Instant.now().minus(Duration.ofHours(1))));

        assertTrue(registry.findByTicket("done").isEmpty());
        assertTrue(registry.findByTicket("running").isPresent());
        assertTrue(registry.findByTicket("fresh").isPresent());
    }

    @Test
    void deleteOlderThanRemovesAnyStatus() {
        Instant old = Instant.now().minus(Duration.ofDays(2));
        registry.save(registration("stale", "w").toBuilder().createdAt(old).build());
        registry.save(registration("fresh", "w"));

        assertEquals(1, registry.deleteOlderThan(Instant.now().minus(Duration.ofDays(1))));
        assertEquals(1, registry.count());
    }

    @Test
    void countsAllRegistrations() {
        registry.save(registration("t1", "w1"));
        registry.save(registration("t2", "w1"));
        registry.save(registration("t3", "w2"));

        assertEquals(3, registry.count());
    }
}
