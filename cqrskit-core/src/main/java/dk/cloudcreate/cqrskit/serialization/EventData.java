package dk.cloudcreate.cqrskit.serialization;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * An event payload together with the metadata that is stored inside the event data
 *
 * @param <T> the payload type
 */
public final class EventData<T> {
    public final T                   payload;
    public final Map<String, Object> metadata;

    public EventData(T payload, Map<String, Object> metadata) {
        this.payload = requireNonNull(payload, "No payload provided");
        this.metadata = metadata != null ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata)) : Map.of();
    }

    public static <T> EventData<T> of(T payload) {
        return new EventData<>(payload, Map.of());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EventData)) return false;
        var eventData = (EventData<?>) o;
        return payload.equals(eventData.payload) && metadata.equals(eventData.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(payload, metadata);
    }

    @Override
    public String toString() {
        return "EventData{" +
                "payload=" + payload +
                ", metadata=" + metadata +
                '}';
    }
}
