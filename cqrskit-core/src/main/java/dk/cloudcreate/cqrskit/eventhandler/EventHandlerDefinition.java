package dk.cloudcreate.cqrskit.eventhandler;

import dk.cloudcreate.cqrskit.types.RawEvent;

import java.util.Map;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Registration of an event handler for a given event class within a processing group.<br>
 * Every {@link EventHandlingProcessor} only invokes the handlers registered for its own group.
 *
 * @param <EVENT> the event type
 */
public final class EventHandlerDefinition<EVENT> {
    public enum Kind {
        FOR_OBJECT,
        FOR_OBJECT_AND_METADATA,
        FOR_OBJECT_AND_METADATA_AND_RAW_EVENT
    }

    public final  String       group;
    public final  Class<EVENT> eventClass;
    public final  Kind         kind;
    private final EventHandler handler;

    private EventHandlerDefinition(String group, Class<EVENT> eventClass, Kind kind, EventHandler handler) {
        this.group = requireNonNull(group, "No group provided");
        this.eventClass = requireNonNull(eventClass, "No eventClass provided");
        this.kind = requireNonNull(kind, "No kind provided");
        this.handler = requireNonNull(handler, "No handler provided");
    }

    public static <EVENT> EventHandlerDefinition<EVENT> forObject(String group,
                                                                  Class<EVENT> eventClass,
                                                                  EventHandler.ForObject<EVENT> handler) {
        return new EventHandlerDefinition<>(group, eventClass, Kind.FOR_OBJECT, handler);
    }

    public static <EVENT> EventHandlerDefinition<EVENT> forObjectAndMetadata(String group,
                                                                             Class<EVENT> eventClass,
                                                                             EventHandler.ForObjectAndMetadata<EVENT> handler) {
        return new EventHandlerDefinition<>(group, eventClass, Kind.FOR_OBJECT_AND_METADATA, handler);
    }

    public static <EVENT> EventHandlerDefinition<EVENT> forObjectAndMetadataAndRawEvent(String group,
                                                                                        Class<EVENT> eventClass,
                                                                                        EventHandler.ForObjectAndMetadataAndRawEvent<EVENT> handler) {
        return new EventHandlerDefinition<>(group, eventClass, Kind.FOR_OBJECT_AND_METADATA_AND_RAW_EVENT, handler);
    }

    /**
     * Invoke the event handler with the arguments its {@link Kind} requires
     */
    @SuppressWarnings("unchecked")
    public void handle(Object event, Map<String, Object> metadata, RawEvent rawEvent) {
        var typedEvent = eventClass.cast(event);
        switch (kind) {
            case FOR_OBJECT:
                ((EventHandler.ForObject<EVENT>) handler).handle(typedEvent);
                break;
            case FOR_OBJECT_AND_METADATA:
                ((EventHandler.ForObjectAndMetadata<EVENT>) handler).handle(typedEvent, metadata);
                break;
            case FOR_OBJECT_AND_METADATA_AND_RAW_EVENT:
                ((EventHandler.ForObjectAndMetadataAndRawEvent<EVENT>) handler).handle(typedEvent, metadata, rawEvent);
                break;
            default:
                throw new IllegalStateException("Unsupported event handler kind " + kind);
        }
    }

    @Override
    public String toString() {
        return "EventHandlerDefinition{" +
                "group='" + group + '\'' +
                ", eventClass=" + eventClass.getName() +
                ", kind=" + kind +
                '}';
    }
}
