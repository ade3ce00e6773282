package dk.cloudcreate.cqrskit.serialization;

/**
 * Maps between the event type stored with a {@link dk.cloudcreate.cqrskit.types.RawEvent} and the Java class used
 * to represent the event payload
 */
public interface EventTypeResolver {
    /**
     * @param eventClass the event payload class
     * @return the event type persisted for events of this class
     * @throws UnknownEventTypeException if the class isn't known by the resolver
     */
    String resolveEventType(Class<?> eventClass);

    /**
     * @param eventType the persisted event type
     * @return the class that event payloads of this type are deserialized into
     * @throws UnknownEventTypeException if the event type isn't known by the resolver
     */
    Class<?> resolveEventClass(String eventType);
}
