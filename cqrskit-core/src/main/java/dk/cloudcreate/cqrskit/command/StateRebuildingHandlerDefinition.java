package dk.cloudcreate.cqrskit.command;

import dk.cloudcreate.cqrskit.types.*;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Registration of a state rebuilding handler for a given (instance class, event class) pair.<br>
 * The factory method used decides the {@link Kind}, which controls the arguments the handler is called with.
 * Multiple handlers for the same pair are applied in registration order.
 *
 * @param <INSTANCE> the type of instance being rebuilt
 * @param <EVENT>    the event type
 */
@SuppressWarnings("OptionalUsedAsFieldOrParameterType")
public final class StateRebuildingHandlerDefinition<INSTANCE, EVENT> {
    public enum Kind {
        FROM_OBJECT,
        FROM_OBJECT_AND_RAW_EVENT,
        FROM_OBJECT_AND_METADATA,
        FROM_OBJECT_AND_METADATA_AND_SUBJECT,
        FROM_OBJECT_AND_METADATA_AND_SUBJECT_AND_RAW_EVENT
    }

    public final  Class<INSTANCE>        instanceClass;
    public final  Class<EVENT>           eventClass;
    public final  Kind                   kind;
    private final StateRebuildingHandler handler;

    private StateRebuildingHandlerDefinition(Class<INSTANCE> instanceClass,
                                             Class<EVENT> eventClass,
                                             Kind kind,
                                             StateRebuildingHandler handler) {
        this.instanceClass = requireNonNull(instanceClass, "No instanceClass provided");
        this.eventClass = requireNonNull(eventClass, "No eventClass provided");
        this.kind = requireNonNull(kind, "No kind provided");
        this.handler = requireNonNull(handler, "No handler provided");
    }

    public static <INSTANCE, EVENT> StateRebuildingHandlerDefinition<INSTANCE, EVENT> fromObject(Class<INSTANCE> instanceClass,
                                                                                                 Class<EVENT> eventClass,
                                                                                                 StateRebuildingHandler.FromObject<INSTANCE, EVENT> handler) {
        return new StateRebuildingHandlerDefinition<>(instanceClass, eventClass, Kind.FROM_OBJECT, handler);
    }

    public static <INSTANCE, EVENT> StateRebuildingHandlerDefinition<INSTANCE, EVENT> fromObjectAndRawEvent(Class<INSTANCE> instanceClass,
                                                                                                            Class<EVENT> eventClass,
                                                                                                            StateRebuildingHandler.FromObjectAndRawEvent<INSTANCE, EVENT> handler) {
        return new StateRebuildingHandlerDefinition<>(instanceClass, eventClass, Kind.FROM_OBJECT_AND_RAW_EVENT, handler);
    }

    public static <INSTANCE, EVENT> StateRebuildingHandlerDefinition<INSTANCE, EVENT> fromObjectAndMetadata(Class<INSTANCE> instanceClass,
                                                                                                            Class<EVENT> eventClass,
                                                                                                            StateRebuildingHandler.FromObjectAndMetadata<INSTANCE, EVENT> handler) {
        return new StateRebuildingHandlerDefinition<>(instanceClass, eventClass, Kind.FROM_OBJECT_AND_METADATA, handler);
    }

    public static <INSTANCE, EVENT> StateRebuildingHandlerDefinition<INSTANCE, EVENT> fromObjectAndMetadataAndSubject(Class<INSTANCE> instanceClass,
                                                                                                                      Class<EVENT> eventClass,
                                                                                                                      StateRebuildingHandler.FromObjectAndMetadataAndSubject<INSTANCE, EVENT> handler) {
        return new StateRebuildingHandlerDefinition<>(instanceClass, eventClass, Kind.FROM_OBJECT_AND_METADATA_AND_SUBJECT, handler);
    }

    public static <INSTANCE, EVENT> StateRebuildingHandlerDefinition<INSTANCE, EVENT> fromObjectAndMetadataAndSubjectAndRawEvent(Class<INSTANCE> instanceClass,
                                                                                                                                 Class<EVENT> eventClass,
                                                                                                                                 StateRebuildingHandler.FromObjectAndMetadataAndSubjectAndRawEvent<INSTANCE, EVENT> handler) {
        return new StateRebuildingHandlerDefinition<>(instanceClass, eventClass, Kind.FROM_OBJECT_AND_METADATA_AND_SUBJECT_AND_RAW_EVENT, handler);
    }

    /**
     * Fold the event into the instance using the arguments the handler's {@link Kind} requires
     *
     * @param instance the current instance (<code>null</code> before the first event)
     * @param event    the deserialized event (must be an instance of {@link #eventClass})
     * @param metadata the event metadata
     * @param subject  the subject of the event
     * @param rawEvent the raw event, empty when applying an event that hasn't been persisted yet
     * @return the new instance
     */
    @SuppressWarnings("unchecked")
    public INSTANCE apply(INSTANCE instance, Object event, Map<String, Object> metadata, Subject subject, Optional<RawEvent> rawEvent) {
        var typedEvent = eventClass.cast(event);
        switch (kind) {
            case FROM_OBJECT:
                return ((StateRebuildingHandler.FromObject<INSTANCE, EVENT>) handler).apply(instance, typedEvent);
            case FROM_OBJECT_AND_RAW_EVENT:
                return ((StateRebuildingHandler.FromObjectAndRawEvent<INSTANCE, EVENT>) handler).apply(instance, typedEvent, rawEvent);
            case FROM_OBJECT_AND_METADATA:
                return ((StateRebuildingHandler.FromObjectAndMetadata<INSTANCE, EVENT>) handler).apply(instance, typedEvent, metadata);
            case FROM_OBJECT_AND_METADATA_AND_SUBJECT:
                return ((StateRebuildingHandler.FromObjectAndMetadataAndSubject<INSTANCE, EVENT>) handler).apply(instance, typedEvent, metadata, subject);
            case FROM_OBJECT_AND_METADATA_AND_SUBJECT_AND_RAW_EVENT:
                return ((StateRebuildingHandler.FromObjectAndMetadataAndSubjectAndRawEvent<INSTANCE, EVENT>) handler).apply(instance, typedEvent, metadata, subject, rawEvent);
            default:
                throw new IllegalStateException("Unsupported state rebuilding handler kind " + kind);
        }
    }

    @Override
    public String toString() {
        return "StateRebuildingHandlerDefinition{" +
                "instanceClass=" + instanceClass.getName() +
                ", eventClass=" + eventClass.getName() +
                ", kind=" + kind +
                '}';
    }
}
