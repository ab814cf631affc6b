package apprunner.balancer.pool;

import apprunner.balancer.client.WorkerClient;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Rotates the starting worker on every call; the rest follow in pool order.
 */
public class RoundRobinSelector implements WorkerSelector {

    private final AtomicInteger next = new AtomicInteger();

    @Override
    public List<WorkerClient> candidates(WorkerPool pool) {
        List<WorkerClient> all = pool.all();
        if (all.isEmpty()) {
            return all;
        }
        int start = Math.floorMod(next.getAndIncrement(), all.size());
        List<WorkerClient> rotated = new ArrayList<>(all.size());
        for (int i = 0; i < all.size(); i++) {
            rotated.add(all.get((start + i) % all.size()));
        }
        return rotated;
    }
}
