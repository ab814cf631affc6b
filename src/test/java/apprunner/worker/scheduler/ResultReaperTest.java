package apprunner.worker.scheduler;

import apprunner.common.model.ResultRecord;
import apprunner.common.model.TaskStatus;
import apprunner.worker.execution.StubBuildRunner;
import apprunner.worker.execution.TaskExecutor;
import apprunner.worker.execution.WorkspaceStager;
import apprunner.worker.lock.WorkerLock;
import apprunner.worker.project.TestProjects;
import apprunner.worker.store.InMemoryResultStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ResultReaper functionality.
 */
class ResultReaperTest {

    @TempDir
    Path dir;

    private InMemoryResultStore store;
    private WorkspaceStager stager;
    private TaskExecutor executor;
    private ResultReaper reaper;

    @BeforeEach
    void setUp() {
        store = new InMemoryResultStore();
        stager = new WorkspaceStager(dir.resolve("work"));
        executor = new TaskExecutor(new WorkerLock(), store, stager, StubBuildRunner.succeeding());
        reaper = new ResultReaper(store, executor, stager, Duration.ofMinutes(30));
    }

    @AfterEach
    void tearDown() {
        executor.close();
    }

    @Test
    void deletesExpiredTerminalResults() {
        Instant old = Instant.now().minus(Duration.ofHours(1));
        store.create(new ResultRecord("old-complete", TaskStatus.COMPLETE, "abc==", old));
        store.create(new ResultRecord("old-error", TaskStatus.ERROR, "boom", old));
        store.create(ResultRecord.complete("fresh", "abc=="));

        assertEquals(2, reaper.reapExpiredResults());

        assertTrue(store.read("old-complete").isEmpty());
        assertTrue(store.read("old-error").isEmpty());
        assertTrue(store.read("fresh").isPresent());
    }

    @Test
    @DisplayName("RUNNING records are never reaped, however old")
    void neverDeletesRunningRecords() {
        Instant ancient = Instant.now().minus(Duration.ofDays(7));
        store.create(new ResultRecord("stuck", TaskStatus.RUNNING, null, ancient));

        assertEquals(0, reaper.reapExpiredResults());
        assertTrue(store.read("stuck").isPresent());
    }

    @Test
    void removesWorkspacesWithNoRunInFlight() throws Exception {
        stager.stage("orphan", TestProjects.example(dir.resolve("golden")));

        assertEquals(1, reaper.reapOrphanWorkspaces());
        assertFalse(Files.exists(dir.resolve("work").resolve("orphan")));
        assertEquals(0, reaper.reapOrphanWorkspaces());
    }
}
