package apprunner.common.error;

public class WrongWorkerException extends AppRunnerException {

    public WrongWorkerException(String message) {
        super(ErrorCode.WRONG_WORKER, message);
    }
}
