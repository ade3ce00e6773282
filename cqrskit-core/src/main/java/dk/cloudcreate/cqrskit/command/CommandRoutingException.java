package dk.cloudcreate.cqrskit.command;

/**
 * Base exception for failures detected by the {@link CommandRouter} itself (as opposed to exceptions thrown by command handlers,
 * which are propagated unchanged)
 */
public class CommandRoutingException extends RuntimeException {
    public CommandRoutingException(String message) {
        super(message);
    }

    public CommandRoutingException(String message, Throwable cause) {
        super(message, cause);
    }
}
