package apprunner.common.error;

public class NoWorkerAvailableException extends AppRunnerException {

    public NoWorkerAvailableException(String message) {
        super(ErrorCode.NO_WORKER_AVAILABLE, message);
    }

    public NoWorkerAvailableException(String message, Throwable cause) {
        super(ErrorCode.NO_WORKER_AVAILABLE, message, cause);
    }
}
