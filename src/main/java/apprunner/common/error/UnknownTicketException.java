package apprunner.common.error;

/**
 * Thrown when a ticket is not present in the store being asked,
 * typically after garbage collection or a restart.
 */
public class UnknownTicketException extends AppRunnerException {

    public UnknownTicketException(String message) {
        super(ErrorCode.UNKNOWN_TICKET, message);
    }

    public static UnknownTicketException forTicket(String ticket) {
        return new UnknownTicketException("Unknown ticket: " + ticket);
    }
}
