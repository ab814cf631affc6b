package apprunner.common.error;

/**
 * Network failure or timeout talking to another service.
 */
public class TransportException extends AppRunnerException {

    public TransportException(String message) {
        super(ErrorCode.TRANSPORT_ERROR, message);
    }

    public TransportException(String message, Throwable cause) {
        super(ErrorCode.TRANSPORT_ERROR, message, cause);
    }
}
