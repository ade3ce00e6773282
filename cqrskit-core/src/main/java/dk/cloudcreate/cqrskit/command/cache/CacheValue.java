package dk.cloudcreate.cqrskit.command.cache;

import dk.cloudcreate.cqrskit.types.*;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * A rebuilt instance together with the position in the event store it reflects.<br>
 * Every event up to and including {@link #eventId} has been applied to {@link #instance} and no later event has.
 */
@SuppressWarnings("OptionalUsedAsFieldOrParameterType")
public final class CacheValue {
    /**
     * The id of the last applied event, empty if no events have been applied
     */
    public final Optional<EventId>     eventId;
    /**
     * The rebuilt instance, <code>null</code> if no state rebuilding handler has produced an instance yet
     */
    public final Object                instance;
    /**
     * Per subject (relevant for {@link dk.cloudcreate.cqrskit.command.SourcingMode#RECURSIVE}) the id of the last applied event
     */
    public final Map<Subject, EventId> sourcedSubjectIds;

    public CacheValue(Optional<EventId> eventId, Object instance, Map<Subject, EventId> sourcedSubjectIds) {
        this.eventId = requireNonNull(eventId, "No eventId option provided");
        this.instance = instance;
        this.sourcedSubjectIds = Collections.unmodifiableMap(new LinkedHashMap<>(requireNonNull(sourcedSubjectIds, "No sourcedSubjectIds provided")));
    }

    public static CacheValue empty() {
        return new CacheValue(Optional.empty(), null, Map.of());
    }

    @Override
    public String toString() {
        return "CacheValue{" +
                "eventId=" + eventId +
                ", instance=" + instance +
                ", sourcedSubjectIds=" + sourcedSubjectIds +
                '}';
    }
}
