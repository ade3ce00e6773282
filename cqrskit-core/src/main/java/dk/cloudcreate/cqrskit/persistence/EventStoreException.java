package dk.cloudcreate.cqrskit.persistence;

/**
 * Base exception for errors related to the event store and to the conversion of stored events
 */
public class EventStoreException extends RuntimeException {
    public EventStoreException(String message) {
        super(message);
    }

    public EventStoreException(String message, Throwable cause) {
        super(message, cause);
    }

    public EventStoreException(Throwable cause) {
        super(cause);
    }
}
