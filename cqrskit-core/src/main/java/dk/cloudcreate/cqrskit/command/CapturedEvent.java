package dk.cloudcreate.cqrskit.command;

import dk.cloudcreate.cqrskit.types.Precondition;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * An event published by a command handler through the {@link CommandEventPublisher}, but not yet published to the event store
 */
public final class CapturedEvent {
    public final Object              event;
    public final Map<String, Object> metadata;
    public final List<Precondition>  preconditions;

    public CapturedEvent(Object event, Map<String, Object> metadata, List<Precondition> preconditions) {
        this.event = requireNonNull(event, "No event provided");
        this.metadata = metadata != null ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata)) : Map.of();
        this.preconditions = preconditions != null ? List.copyOf(preconditions) : List.of();
    }

    @Override
    public String toString() {
        return "CapturedEvent{" +
                "event=" + event +
                ", metadata=" + metadata +
                ", preconditions=" + preconditions +
                '}';
    }
}
