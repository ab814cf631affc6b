package apprunner.worker.config;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class WorkerConfigTest {

    @Test
    void workerIdDefaultsToOwnUrl() {
        assertEquals("http://localhost:8081", WorkerConfig.defaults().workerId());
        assertEquals("http://10.0.0.5:9000",
                WorkerConfig.defaults().withServerHost("10.0.0.5").withServerPort(9000).workerId());
        assertEquals("http://w1.internal:8081",
                WorkerConfig.defaults().withWorkerId("http://w1.internal:8081").workerId());
    }

    @Test
    void zeroDeadlineDisablesWatchdog() {
        assertTrue(WorkerConfig.defaults().hasRunDeadline());
        assertFalse(WorkerConfig.defaults().withRunDeadline(Duration.ZERO).hasRunDeadline());
    }

    @Test
    void defaultsPointAtLocalDirectories() {
        WorkerConfig config = WorkerConfig.defaults();

        assertEquals(Path.of("projects", "projects.ini"), config.projectsIni());
        assertEquals(Path.of("results"), config.resultsDir());
        assertFalse(config.inMemoryResults());
        assertEquals(Duration.ofMinutes(30), config.resultTtl());
    }
}
