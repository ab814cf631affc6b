package apprunner.worker.scheduler;

import apprunner.common.model.Patch;
import apprunner.common.model.ResultRecord;
import apprunner.common.model.TaskStatus;
import apprunner.worker.execution.StubBuildRunner;
import apprunner.worker.execution.TaskExecutor;
import apprunner.worker.execution.WorkspaceStager;
import apprunner.worker.lock.WorkerLock;
import apprunner.worker.project.Project;
import apprunner.worker.project.TestProjects;
import apprunner.worker.store.InMemoryResultStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RunWatchdogTest {

    @TempDir
    Path dir;

    private WorkerLock lock;
    private InMemoryResultStore store;
    private StubBuildRunner runner;
    private TaskExecutor executor;
    private Project project;

    @BeforeEach
    void setUp() throws Exception {
        lock = new WorkerLock();
        store = new InMemoryResultStore();
        runner = StubBuildRunner.blockingThenSucceeding();
        executor = new TaskExecutor(lock, store, new WorkspaceStager(dir.resolve("work")), runner);
        project = TestProjects.example(dir.resolve("golden"));
    }

    @AfterEach
    void tearDown() {
        runner.release();
        executor.close();
    }

    @Test
    void overdueRunTimesOutAndReleasesLock() throws Exception {
        executor.submit("t1", project, List.of(new Patch(TestProjects.EDITOR_FILE, "<x/>")));
        assertTrue(runner.awaitStarted(2000));
        Thread.sleep(150);

        RunWatchdog watchdog = new RunWatchdog(store, executor, Duration.ofMillis(100));
        assertEquals(1, watchdog.timeOutOverdueRuns());

        long deadline = System.currentTimeMillis() + 5000;
        while (lock.isLocked() && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }
        assertFalse(lock.isLocked());

        ResultRecord record = store.read("t1").orElseThrow();
        assertEquals(TaskStatus.TIMEOUT, record.status());
        assertTrue(record.payload().startsWith("Run exceeded deadline"), record.payload());
        assertEquals(0, watchdog.timeOutOverdueRuns());
    }

    @Test
    void runWithinDeadlineIsLeftAlone() throws Exception {
        executor.submit("t1", project, List.of(new Patch(TestProjects.EDITOR_FILE, "<x/>")));
        assertTrue(runner.awaitStarted(2000));

        RunWatchdog watchdog = new RunWatchdog(store, executor, Duration.ofMinutes(10));
        assertEquals(0, watchdog.timeOutOverdueRuns());
        assertEquals(TaskStatus.RUNNING, store.read("t1").orElseThrow().status());
    }
}
