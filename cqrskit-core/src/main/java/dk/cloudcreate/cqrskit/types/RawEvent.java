package dk.cloudcreate.cqrskit.types;

import java.time.OffsetDateTime;
import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * An event as it is persisted in, and returned from, the event store, i.e. before it has been upcasted and deserialized.
 */
public final class RawEvent {
    public final EventId             id;
    public final String              type;
    public final String              source;
    public final Subject             subject;
    public final OffsetDateTime      time;
    public final Map<String, Object> data;
    public final Map<String, Object> metadata;

    public RawEvent(EventId id,
                    String type,
                    String source,
                    Subject subject,
                    OffsetDateTime time,
                    Map<String, Object> data,
                    Map<String, Object> metadata) {
        this.id = requireNonNull(id, "No id provided");
        this.type = requireNonNull(type, "No type provided");
        this.source = requireNonNull(source, "No source provided");
        this.subject = requireNonNull(subject, "No subject provided");
        this.time = requireNonNull(time, "No time provided");
        this.data = Collections.unmodifiableMap(new LinkedHashMap<>(requireNonNull(data, "No data provided")));
        this.metadata = metadata != null ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata)) : Map.of();
    }

    /**
     * Create a copy of this event with a new type and data, while the id, subject, source, time and metadata are inherited
     */
    public RawEvent withTypeAndData(String type, Map<String, Object> data) {
        return new RawEvent(id, type, source, subject, time, data, metadata);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RawEvent)) return false;
        var rawEvent = (RawEvent) o;
        return id.equals(rawEvent.id) && type.equals(rawEvent.type) && source.equals(rawEvent.source) &&
                subject.equals(rawEvent.subject) && time.equals(rawEvent.time) && data.equals(rawEvent.data) &&
                metadata.equals(rawEvent.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, type, subject);
    }

    @Override
    public String toString() {
        return "RawEvent{" +
                "id=" + id +
                ", type='" + type + '\'' +
                ", source='" + source + '\'' +
                ", subject=" + subject +
                ", time=" + time +
                '}';
    }
}
