package dk.cloudcreate.cqrskit.command;

import dk.cloudcreate.cqrskit.types.*;

import java.util.*;

/**
 * The supported state rebuilding handler shapes. A state rebuilding handler folds one event into an instance and returns the
 * new instance (the instance is <code>null</code> for the first event of a subject).<br>
 * The raw event is only present when the event is replayed from the event store. Events that a command handler has just published
 * are applied before they have been persisted and don't have a raw event.
 */
@SuppressWarnings("OptionalUsedAsFieldOrParameterType")
public interface StateRebuildingHandler {
    @FunctionalInterface
    interface FromObject<INSTANCE, EVENT> extends StateRebuildingHandler {
        INSTANCE apply(INSTANCE instance, EVENT event);
    }

    @FunctionalInterface
    interface FromObjectAndRawEvent<INSTANCE, EVENT> extends StateRebuildingHandler {
        INSTANCE apply(INSTANCE instance, EVENT event, Optional<RawEvent> rawEvent);
    }

    @FunctionalInterface
    interface FromObjectAndMetadata<INSTANCE, EVENT> extends StateRebuildingHandler {
        INSTANCE apply(INSTANCE instance, EVENT event, Map<String, Object> metadata);
    }

    @FunctionalInterface
    interface FromObjectAndMetadataAndSubject<INSTANCE, EVENT> extends StateRebuildingHandler {
        INSTANCE apply(INSTANCE instance, EVENT event, Map<String, Object> metadata, Subject subject);
    }

    @FunctionalInterface
    interface FromObjectAndMetadataAndSubjectAndRawEvent<INSTANCE, EVENT> extends StateRebuildingHandler {
        INSTANCE apply(INSTANCE instance, EVENT event, Map<String, Object> metadata, Subject subject, Optional<RawEvent> rawEvent);
    }
}
