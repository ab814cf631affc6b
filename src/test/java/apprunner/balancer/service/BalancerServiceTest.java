package apprunner.balancer.service;

import apprunner.balancer.api.dto.BalancerHealth;
import apprunner.balancer.client.LocalWorkerClient;
import apprunner.balancer.client.WorkerState;
import apprunner.balancer.pool.RoundRobinSelector;
import apprunner.balancer.pool.WorkerPool;
import apprunner.balancer.store.Database;
import apprunner.balancer.store.JdbcTaskRegistry;
import apprunner.common.api.dto.CreateTaskRequest;
import apprunner.common.api.dto.ProjectResponse;
import apprunner.common.api.dto.StatusResponse;
import apprunner.common.api.dto.TaskAccepted;
import apprunner.common.error.NoWorkerAvailableException;
import apprunner.common.error.UnknownTicketException;
import apprunner.common.error.WorkerBusyException;
import apprunner.common.model.Patch;
import apprunner.common.model.TaskStatus;
import apprunner.worker.execution.StubBuildRunner;
import apprunner.worker.execution.TaskExecutor;
import apprunner.worker.execution.WorkspaceStager;
import apprunner.worker.lock.WorkerLock;
import apprunner.worker.project.TestProjects;
import apprunner.worker.service.WorkerService;
import apprunner.worker.store.InMemoryResultStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BalancerServiceTest {

    private static final List<Patch> PATCHES = List.of(new Patch(TestProjects.EDITOR_FILE, "<patched/>"));

    @TempDir
    Path dir;

    private Database db;
    private JdbcTaskRegistry registry;
    private final List<StubBuildRunner> runners = new ArrayList<>();
    private final List<TaskExecutor> executors = new ArrayList<>();

    @BeforeEach
    void setUp() {
        db = new Database("jdbc:h2:mem:test-balancer-" + System.nanoTime()
                + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE", 4);
        registry = new JdbcTaskRegistry(db);
    }

    @AfterEach
    void tearDown() {
        runners.forEach(StubBuildRunner::release);
        executors.forEach(TaskExecutor::close);
        db.close();
    }

    private LocalWorkerClient worker(String id) throws Exception {
        StubBuildRunner runner = StubBuildRunner.blockingThenSucceeding();
        InMemoryResultStore store = new InMemoryResultStore();
        TaskExecutor executor = new TaskExecutor(
                new WorkerLock(), store, new WorkspaceStager(dir.resolve(id).resolve("work")), runner);
        runners.add(runner);
        executors.add(executor);
        WorkerService service = new WorkerService(id, TestProjects.catalog(dir.resolve(id)), executor, store);
        return new LocalWorkerClient(service);
    }

    private BalancerService service(boolean retryOnBusy, LocalWorkerClient... workers) {
        return new BalancerService(registry, new WorkerPool(List.of(workers)), new RoundRobinSelector(), retryOnBusy);
    }

    private static CreateTaskRequest request() {
        return new CreateTaskRequest("Example", PATCHES, "u1");
    }

    @Test
    void createTaskRegistersTicketWithItsWorker() throws Exception {
        LocalWorkerClient w1 = worker("w1");
        BalancerService balancer = service(true, w1);

        TaskAccepted accepted = balancer.createTask(request());

        assertEquals("w1", accepted.workerId());
        assertEquals("w1", registry.findByTicket(accepted.ticket()).orElseThrow().workerId());
        assertEquals(TaskStatus.RUNNING, balancer.getStatus(accepted.ticket()).status());
    }

    @Test
    @DisplayName("A busy worker is skipped when retry-on-busy is enabled")
    void retriesNextWorkerWhenBusy() throws Exception {
        BalancerService balancer = service(true, worker("w1"), worker("w2"));

        TaskAccepted first = balancer.createTask(request());
        TaskAccepted second = balancer.createTask(request());

        assertNotEquals(first.workerId(), second.workerId());
        assertNotEquals(first.ticket(), second.ticket());
    }

    @Test
    void allWorkersBusy() throws Exception {
        BalancerService balancer = service(true, worker("w1"), worker("w2"));
        balancer.createTask(request());
        balancer.createTask(request());

        assertThrows(WorkerBusyException.class, () -> balancer.createTask(request()));
        assertEquals(2, registry.count());
    }

    @Test
    void busyIsRelayedWhenRetryIsDisabled() throws Exception {
        LocalWorkerClient w1 = worker("w1");
        BalancerService balancer = service(false, w1, worker("w2"));
        balancer.createTask(request());
        // Rotation makes w2 first for the second call, w1 first for the third
        balancer.createTask(request());

        assertThrows(WorkerBusyException.class, () -> balancer.createTask(request()));
    }

    @Test
    void unreachableWorkerIsSkipped() throws Exception {
        LocalWorkerClient down = worker("w1");
        down.setOffline(true);
        BalancerService balancer = service(true, down, worker("w2"));

        TaskAccepted accepted = balancer.createTask(request());
        assertEquals("w2", accepted.workerId());
    }

    @Test
    void noReachableWorker() throws Exception {
        LocalWorkerClient down = worker("w1");
        down.setOffline(true);
        BalancerService balancer = service(true, down);

        assertThrows(NoWorkerAvailableException.class, () -> balancer.createTask(request()));
        assertEquals(0, registry.count());
    }

    @Test
    void emptyPool() {
        BalancerService balancer = service(true);

        NoWorkerAvailableException e = assertThrows(NoWorkerAvailableException.class,
                () -> balancer.createTask(request()));
        assertEquals("No workers configured", e.getMessage());
    }

    @Test
    void unknownTicket() throws Exception {
        BalancerService balancer = service(true, worker("w1"));

        assertThrows(UnknownTicketException.class, () -> balancer.getStatus("zzz"));
    }

    @Test
    @DisplayName("Polling relays the worker's record and records terminal status")
    void statusRelayUpdatesRegistry() throws Exception {
        LocalWorkerClient w1 = worker("w1");
        BalancerService balancer = service(true, w1);
        TaskAccepted accepted = balancer.createTask(request());

        runners.get(0).release();
        StatusResponse status = balancer.getStatus(accepted.ticket());
        long deadline = System.currentTimeMillis() + 5000;
        while (status.status() == TaskStatus.RUNNING && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
            status = balancer.getStatus(accepted.ticket());
        }

        assertEquals(TaskStatus.COMPLETE, status.status());
        assertNotNull(status.payload());
        assertEquals(TaskStatus.COMPLETE, registry.findByTicket(accepted.ticket()).orElseThrow().status());
    }

    @Test
    void getProjectFromFirstReachableWorker() throws Exception {
        LocalWorkerClient down = worker("w1");
        down.setOffline(true);
        BalancerService balancer = service(true, down, worker("w2"));

        ProjectResponse project = balancer.getProject("Example");
        assertEquals(TestProjects.EDITOR_FILE, project.filename());
        assertEquals(TestProjects.ORIGINAL_CONTENTS, project.contents());
    }

    @Test
    void healthReportsWorkerStates() throws Exception {
        LocalWorkerClient w1 = worker("w1");
        LocalWorkerClient w2 = worker("w2");
        w2.setOffline(true);
        BalancerService balancer = service(true, w1, w2);

        BalancerHealth idle = balancer.health();
        assertEquals("ok", idle.status());
        assertEquals(WorkerState.IDLE, idle.workers().get(0).state());
        assertEquals(WorkerState.UNREACHABLE, idle.workers().get(1).state());

        balancer.createTask(request());
        BalancerHealth busy = balancer.health();
        assertEquals("degraded", busy.status());
        assertEquals(1, busy.registeredTasks());
    }
}
