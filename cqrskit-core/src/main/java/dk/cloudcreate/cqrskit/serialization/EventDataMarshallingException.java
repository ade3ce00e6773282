package dk.cloudcreate.cqrskit.serialization;

import dk.cloudcreate.cqrskit.persistence.EventStoreException;

/**
 * Thrown when an {@link EventDataMarshaller} fails to serialize or deserialize event data
 */
public class EventDataMarshallingException extends EventStoreException {
    public EventDataMarshallingException(String message, Throwable cause) {
        super(message, cause);
    }

    public EventDataMarshallingException(String message) {
        super(message);
    }
}
