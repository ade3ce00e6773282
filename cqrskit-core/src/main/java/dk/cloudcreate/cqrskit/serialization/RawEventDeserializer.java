package dk.cloudcreate.cqrskit.serialization;

import dk.cloudcreate.cqrskit.types.RawEvent;
import org.slf4j.*;

import java.util.Optional;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Resolves the class of a {@link RawEvent} and deserializes its data.<br>
 * Events that can't be converted are skipped rather than failing the caller:
 * <ul>
 *     <li>an event type unknown to the {@link EventTypeResolver} is skipped silently, since such events typically belong to
 *     another application sharing the subject</li>
 *     <li>an event of a known type whose data can't be deserialized is skipped with a warning</li>
 * </ul>
 */
public class RawEventDeserializer {
    private static final Logger log = LoggerFactory.getLogger(RawEventDeserializer.class);

    private final EventTypeResolver   eventTypeResolver;
    private final EventDataMarshaller eventDataMarshaller;

    public RawEventDeserializer(EventTypeResolver eventTypeResolver, EventDataMarshaller eventDataMarshaller) {
        this.eventTypeResolver = requireNonNull(eventTypeResolver, "You must supply an eventTypeResolver");
        this.eventDataMarshaller = requireNonNull(eventDataMarshaller, "You must supply an eventDataMarshaller");
    }

    /**
     * @return the deserialized payload and metadata, or empty if the event was skipped
     */
    public Optional<EventData<?>> deserialize(RawEvent event) {
        requireNonNull(event, "No event provided");
        Class<?> eventClass;
        try {
            eventClass = eventTypeResolver.resolveEventClass(event.type);
        } catch (UnknownEventTypeException e) {
            log.trace("Skipping event '{}' with unknown type '{}'", event.id, event.type);
            return Optional.empty();
        }
        try {
            return Optional.of(eventDataMarshaller.deserialize(event.data, eventClass));
        } catch (EventDataMarshallingException e) {
            log.warn(msg("Skipping event '{}' of type '{}' for subject '{}' since its data couldn't be deserialized into '{}'",
                         event.id,
                         event.type,
                         event.subject,
                         eventClass.getName()),
                     e);
            return Optional.empty();
        }
    }

    public EventTypeResolver getEventTypeResolver() {
        return eventTypeResolver;
    }

    public EventDataMarshaller getEventDataMarshaller() {
        return eventDataMarshaller;
    }
}
