package dk.cloudcreate.cqrskit.eventhandler.progress;

import dk.cloudcreate.cqrskit.types.EventId;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * The processing position of a (group, partition)
 */
@SuppressWarnings("OptionalUsedAsFieldOrParameterType")
public final class Progress {
    private static final Progress BEGINNING = new Progress(Optional.empty());

    /**
     * The id of the last event that has been processed, empty if nothing has been processed yet
     */
    public final Optional<EventId> lastProcessedEventId;

    public Progress(Optional<EventId> lastProcessedEventId) {
        this.lastProcessedEventId = requireNonNull(lastProcessedEventId, "No lastProcessedEventId option provided");
    }

    public static Progress beginning() {
        return BEGINNING;
    }

    public static Progress at(EventId lastProcessedEventId) {
        return new Progress(Optional.of(requireNonNull(lastProcessedEventId, "No lastProcessedEventId provided")));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Progress)) return false;
        return lastProcessedEventId.equals(((Progress) o).lastProcessedEventId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(lastProcessedEventId);
    }

    @Override
    public String toString() {
        return "Progress{" +
                "lastProcessedEventId=" + lastProcessedEventId.map(EventId::toString).orElse("<beginning>") +
                '}';
    }
}
