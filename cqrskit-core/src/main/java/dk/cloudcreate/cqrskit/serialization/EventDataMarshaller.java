package dk.cloudcreate.cqrskit.serialization;

import java.util.Map;

/**
 * Converts between {@link EventData} and the generic data map stored in a {@link dk.cloudcreate.cqrskit.types.RawEvent}
 */
public interface EventDataMarshaller {
    /**
     * @throws EventDataMarshallingException if the event data couldn't be serialized, or the metadata uses a key the marshaller
     *                                       reserves for the payload
     */
    Map<String, Object> serialize(EventData<?> eventData);

    /**
     * @param data         the stored data
     * @param payloadClass the class to deserialize the payload into
     * @throws EventDataMarshallingException if the data doesn't contain a payload or the payload couldn't be converted to <code>payloadClass</code>
     */
    <T> EventData<T> deserialize(Map<String, Object> data, Class<T> payloadClass);
}
