package dk.cloudcreate.cqrskit.types;

import dk.cloudcreate.essentials.types.CharSequenceType;

/**
 * Opaque, store assigned, identifier of a persisted event.<br>
 * The event store guarantees that events are delivered in the order their {@link EventId}'s were assigned,
 * but the textual value itself carries no ordering semantics
 */
public class EventId extends CharSequenceType<EventId> {
    public EventId(CharSequence value) {
        super(value);
    }

    public static EventId of(CharSequence value) {
        return new EventId(value);
    }
}
