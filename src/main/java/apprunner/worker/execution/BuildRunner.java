package apprunner.worker.execution;

/**
 * Builds and runs a staged project. Build or run failures are reported in the
 * outcome; exceptions are reserved for infrastructure problems.
 */
@FunctionalInterface
public interface BuildRunner {

    /**
     * @throws Exception           on infrastructure failure (I/O, process start)
     * @throws InterruptedException if the run was aborted
     */
    BuildOutcome run(StagedProject staged) throws Exception;
}
