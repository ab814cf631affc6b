package apprunner.balancer.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BalancerConfigTest {

    @Test
    void defaults() {
        BalancerConfig config = BalancerConfig.defaults();

        assertEquals(8080, config.serverPort());
        assertTrue(config.workers().isEmpty());
        assertTrue(config.retryOnBusy());
        assertEquals(Duration.ofMinutes(30), config.registryTtl());
        assertTrue(config.databaseUrl().startsWith("jdbc:h2:mem:"));
    }

    @Test
    void parsesWorkerList() {
        assertEquals(List.of("http://w1:8081", "http://w2:8081"),
                BalancerConfig.parseWorkers(" http://w1:8081/ ,, http://w2:8081"));
        assertTrue(BalancerConfig.parseWorkers(" , ").isEmpty());
    }

    @Test
    void fluentOverrides() {
        BalancerConfig config = BalancerConfig.defaults()
                .withServerPort(9090)
                .withWorkers(List.of("http://w1:8081"))
                .withRetryOnBusy(false)
                .withWorkerTimeout(Duration.ofSeconds(2));

        assertEquals(9090, config.serverPort());
        assertEquals(List.of("http://w1:8081"), config.workers());
        assertFalse(config.retryOnBusy());
        assertEquals(Duration.ofSeconds(2), config.workerTimeout());
    }
}
