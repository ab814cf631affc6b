package apprunner.balancer.scheduler;

import apprunner.balancer.config.BalancerConfig;
import apprunner.balancer.repository.TaskRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;

/**
 * Background task that evicts old registry rows.
 *
 * Terminal rows go after the registry TTL; any row goes after the max age,
 * which covers tickets whose terminal status was never polled.
 * Workers collect their own results independently.
 */
public class RegistryReaper implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(RegistryReaper.class);

    private final TaskRegistry registry;
    private final BalancerConfig config;

    public RegistryReaper(TaskRegistry registry, BalancerConfig config) {
        this.registry = registry;
        this.config = config;
    }

    @Override
    public void run() {
        try {
            reapExpired();
        } catch (Exception e) {
            log.error("Registry reaper error", e);
        }
    }

    /**
     * @return number of rows evicted
     */
    public int reapExpired() {
        Instant now = Instant.now();
        int terminal = registry.deleteTerminalOlderThan(now.minus(config.registryTtl()));
        int stale = registry.deleteOlderThan(now.minus(config.registryMaxAge()));

        if (terminal + stale > 0) {
            log.info("Registry reaper: evicted {} finished and {} stale ticket(s)", terminal, stale);
        } else {
            log.debug("Registry reaper: nothing to evict");
        }
        return terminal + stale;
    }
}
