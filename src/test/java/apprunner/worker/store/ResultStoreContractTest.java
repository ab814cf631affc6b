package apprunner.worker.store;

import apprunner.common.model.ResultRecord;
import apprunner.common.model.TaskStatus;
import apprunner.worker.repository.ResultStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Behaviour every ResultStore implementation must share.
 */
abstract class ResultStoreContractTest {

    protected ResultStore store;

    protected abstract ResultStore newStore() throws Exception;

    @BeforeEach
    void createStore() throws Exception {
        store = newStore();
    }

    @Test
    void readMissingTicket() {
        assertTrue(store.read("nope").isEmpty());
    }

    @Test
    void createThenRead() {
        assertTrue(store.create(ResultRecord.running("t1")));

        ResultRecord read = store.read("t1").orElseThrow();
        assertEquals(TaskStatus.RUNNING, read.status());
        assertNull(read.payload());
    }

    @Test
    void createRefusesExistingTicket() {
        assertTrue(store.create(ResultRecord.running("t1")));
        assertFalse(store.create(ResultRecord.running("t1")));
    }

    @Test
    @DisplayName("Complete payload reads back bit-identical")
    void payloadRoundTrip() {
        store.create(ResultRecord.running("t1"));
        assertTrue(store.completeIfRunning(ResultRecord.complete("t1", "abc==")));

        ResultRecord read = store.read("t1").orElseThrow();
        assertEquals(TaskStatus.COMPLETE, read.status());
        assertEquals("abc==", read.payload());
    }

    @Test
    @DisplayName("First terminal write wins")
    void completeIfRunningOnlyOnce() {
        store.create(ResultRecord.running("t1"));

        assertTrue(store.completeIfRunning(ResultRecord.timeout("t1", "deadline")));
        assertFalse(store.completeIfRunning(ResultRecord.complete("t1", "late")));

        ResultRecord read = store.read("t1").orElseThrow();
        assertEquals(TaskStatus.TIMEOUT, read.status());
        assertEquals("deadline", read.payload());
    }

    @Test
    void completeIfRunningIgnoresMissingTicket() {
        assertFalse(store.completeIfRunning(ResultRecord.error("ghost", "x")));
        assertTrue(store.read("ghost").isEmpty());
    }

    @Test
    void deleteRemovesRecord() {
        store.create(ResultRecord.running("t1"));

        assertTrue(store.delete("t1"));
        assertFalse(store.delete("t1"));
        assertTrue(store.read("t1").isEmpty());
    }

    @Test
    void findAllAndAgeQueries() {
        Instant old = Instant.now().minusSeconds(3600);
        store.create(new ResultRecord("old-done", TaskStatus.COMPLETE, "x", old));
        store.create(new ResultRecord("old-running", TaskStatus.RUNNING, null, old));
        store.create(ResultRecord.error("new-done", "boom"));

        assertEquals(3, store.findAll().size());

        Instant cutoff = Instant.now().minusSeconds(60);
        List<ResultRecord> terminal = store.findTerminalOlderThan(cutoff);
        assertEquals(1, terminal.size());
        assertEquals("old-done", terminal.get(0).ticket());

        List<ResultRecord> running = store.findRunningOlderThan(cutoff);
        assertEquals(1, running.size());
        assertEquals("old-running", running.get(0).ticket());
    }

    @Test
    @DisplayName("Readers racing a writer always see a whole record")
    void concurrentReadsSeeWholeRecords() throws Exception {
        int tickets = 50;
        String payload = "A".repeat(64 * 1024);
        AtomicInteger torn = new AtomicInteger();
        CountDownLatch done = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(4);

        for (int i = 0; i < 3; i++) {
            pool.submit(() -> {
                while (done.getCount() > 0) {
                    for (int t = 0; t < tickets; t++) {
                        store.read("t" + t).ifPresent(r -> {
                            boolean ok = r.status() == TaskStatus.RUNNING
                                    ? r.payload() == null
                                    : payload.equals(r.payload());
                            if (!ok) {
                                torn.incrementAndGet();
                            }
                        });
                    }
                }
                return null;
            });
        }
        for (int t = 0; t < tickets; t++) {
            store.create(ResultRecord.running("t" + t));
            store.completeIfRunning(ResultRecord.complete("t" + t, payload));
        }
        done.countDown();
        pool.shutdown();
        assertTrue(pool.awaitTermination(5, TimeUnit.SECONDS));

        assertEquals(0, torn.get());
    }
}
