package apprunner.common.error;

/**
 * Thrown when a build/run is requested while the worker lock is held.
 * Expected under load.
 */
public class WorkerBusyException extends AppRunnerException {

    public static final String MESSAGE = "Worker locked";

    public WorkerBusyException() {
        this(MESSAGE);
    }

    public WorkerBusyException(String message) {
        super(ErrorCode.WORKER_LOCKED, message);
    }
}
