package apprunner.worker.execution;

/**
 * Result of submitting a task to the executor.
 */
public enum SubmitResult {
    /** Lock taken, Running record written, background unit scheduled */
    ACCEPTED,
    /** Another task holds the lock; nothing was written */
    WORKER_BUSY
}
