package apprunner.common.error;

public class DuplicateTicketException extends AppRunnerException {

    public DuplicateTicketException(String message) {
        super(ErrorCode.DUPLICATE_TICKET, message);
    }
}
