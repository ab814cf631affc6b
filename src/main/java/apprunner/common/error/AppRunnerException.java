package apprunner.common.error;

/**
 * Base class for protocol errors that must reach the caller as a
 * distinguishable error code rather than a generic failure.
 */
public class AppRunnerException extends RuntimeException {

    private final ErrorCode code;

    public AppRunnerException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public AppRunnerException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCode code() {
        return code;
    }

    /**
     * Rebuild the typed exception for an error code received over the wire.
     */
    public static AppRunnerException fromWire(ErrorCode code, String message) {
        return switch (code) {
            case WORKER_LOCKED -> new WorkerBusyException(message);
            case UNKNOWN_TICKET -> new UnknownTicketException(message);
            case NO_WORKER_AVAILABLE -> new NoWorkerAvailableException(message);
            case TRANSPORT_ERROR -> new TransportException(message);
            case PROJECT_NOT_FOUND -> new ProjectNotFoundException(message);
            case DUPLICATE_TICKET -> new DuplicateTicketException(message);
            case WRONG_WORKER -> new WrongWorkerException(message);
            default -> new AppRunnerException(code, message);
        };
    }
}
