package apprunner.balancer.pool;

import apprunner.balancer.client.WorkerClient;

import java.util.List;

/**
 * Worker-selection policy. Returns candidates in the order they should be tried.
 */
public interface WorkerSelector {

    List<WorkerClient> candidates(WorkerPool pool);
}
