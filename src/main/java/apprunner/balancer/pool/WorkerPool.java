package apprunner.balancer.pool;

import apprunner.balancer.client.WorkerClient;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Fixed set of workers known to the balancer, in configuration order.
 */
public final class WorkerPool {

    private final Map<String, WorkerClient> workers;

    public WorkerPool(List<? extends WorkerClient> clients) {
        Map<String, WorkerClient> byId = new LinkedHashMap<>();
        for (WorkerClient client : clients) {
            if (byId.putIfAbsent(client.workerId(), client) != null) {
                throw new IllegalArgumentException("Duplicate worker: " + client.workerId());
            }
        }
        this.workers = Collections.unmodifiableMap(byId);
    }

    public Optional<WorkerClient> find(String workerId) {
        return Optional.ofNullable(workers.get(workerId));
    }

    public List<WorkerClient> all() {
        return new ArrayList<>(workers.values());
    }

    public int size() {
        return workers.size();
    }

    public boolean isEmpty() {
        return workers.isEmpty();
    }
}
