package dk.cloudcreate.cqrskit.persistence;

import dk.cloudcreate.cqrskit.types.EventId;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Options that narrow down the events returned by {@link EventStoreAdapter#streamEvents(dk.cloudcreate.cqrskit.types.Subject, StreamOptions, boolean)}
 * and {@link EventStoreAdapter#observeEvents(dk.cloudcreate.cqrskit.types.Subject, StreamOptions, boolean)}.<br>
 * Instances are immutable, use the <code>with</code> methods to derive new options.
 */
@SuppressWarnings("OptionalUsedAsFieldOrParameterType")
public final class StreamOptions {
    private static final StreamOptions NONE = new StreamOptions(Optional.empty(), false, Optional.empty(), false, Optional.empty());

    public final Optional<EventId> lowerBound;
    public final boolean           includeLowerBound;
    public final Optional<EventId> upperBound;
    public final boolean           includeUpperBound;
    /**
     * If present, only the latest event of this type is returned per subject
     */
    public final Optional<String>  latestByEventType;

    private StreamOptions(Optional<EventId> lowerBound,
                          boolean includeLowerBound,
                          Optional<EventId> upperBound,
                          boolean includeUpperBound,
                          Optional<String> latestByEventType) {
        this.lowerBound = requireNonNull(lowerBound, "No lowerBound option provided");
        this.includeLowerBound = includeLowerBound;
        this.upperBound = requireNonNull(upperBound, "No upperBound option provided");
        this.includeUpperBound = includeUpperBound;
        this.latestByEventType = requireNonNull(latestByEventType, "No latestByEventType option provided");
    }

    /**
     * No bounds, all events
     */
    public static StreamOptions none() {
        return NONE;
    }

    /**
     * All events after (exclusive) the given event id or all events if the event id is empty
     */
    public static StreamOptions after(Optional<EventId> eventId) {
        return NONE.withLowerBound(eventId, false);
    }

    public StreamOptions withLowerBound(Optional<EventId> lowerBound, boolean includeLowerBound) {
        return new StreamOptions(lowerBound, includeLowerBound, upperBound, includeUpperBound, latestByEventType);
    }

    public StreamOptions withUpperBound(Optional<EventId> upperBound, boolean includeUpperBound) {
        return new StreamOptions(lowerBound, includeLowerBound, upperBound, includeUpperBound, latestByEventType);
    }

    public StreamOptions withLatestByEventType(String eventType) {
        return new StreamOptions(lowerBound, includeLowerBound, upperBound, includeUpperBound, Optional.of(eventType));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StreamOptions)) return false;
        var that = (StreamOptions) o;
        return includeLowerBound == that.includeLowerBound && includeUpperBound == that.includeUpperBound &&
                lowerBound.equals(that.lowerBound) && upperBound.equals(that.upperBound) &&
                latestByEventType.equals(that.latestByEventType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(lowerBound, includeLowerBound, upperBound, includeUpperBound, latestByEventType);
    }

    @Override
    public String toString() {
        return "StreamOptions{" +
                "lowerBound=" + lowerBound +
                ", includeLowerBound=" + includeLowerBound +
                ", upperBound=" + upperBound +
                ", includeUpperBound=" + includeUpperBound +
                ", latestByEventType=" + latestByEventType +
                '}';
    }
}
