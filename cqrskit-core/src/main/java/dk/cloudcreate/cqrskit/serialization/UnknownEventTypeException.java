package dk.cloudcreate.cqrskit.serialization;

import dk.cloudcreate.cqrskit.persistence.EventStoreException;

/**
 * Thrown when an {@link EventTypeResolver} doesn't know an event type or an event class
 */
public class UnknownEventTypeException extends EventStoreException {
    /**
     * The event type or event class name that couldn't be resolved
     */
    public final String unresolved;

    public UnknownEventTypeException(String message, String unresolved) {
        super(message);
        this.unresolved = unresolved;
    }
}
