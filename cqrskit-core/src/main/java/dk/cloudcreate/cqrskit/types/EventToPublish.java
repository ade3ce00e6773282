package dk.cloudcreate.cqrskit.types;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * A serialized event ready to be appended to the event store
 */
public final class EventToPublish {
    public final String              source;
    public final Subject             subject;
    public final String              type;
    public final Map<String, Object> data;
    public final Map<String, Object> metadata;
    public final List<Precondition>  preconditions;

    public EventToPublish(String source,
                          Subject subject,
                          String type,
                          Map<String, Object> data,
                          Map<String, Object> metadata,
                          List<Precondition> preconditions) {
        this.source = requireNonNull(source, "No source provided");
        this.subject = requireNonNull(subject, "No subject provided");
        this.type = requireNonNull(type, "No type provided");
        this.data = Collections.unmodifiableMap(new LinkedHashMap<>(requireNonNull(data, "No data provided")));
        this.metadata = metadata != null ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata)) : Map.of();
        this.preconditions = preconditions != null ? List.copyOf(preconditions) : List.of();
    }

    public EventToPublish(String source, Subject subject, String type, Map<String, Object> data) {
        this(source, subject, type, data, Map.of(), List.of());
    }

    @Override
    public String toString() {
        return "EventToPublish{" +
                "source='" + source + '\'' +
                ", subject=" + subject +
                ", type='" + type + '\'' +
                ", preconditions=" + preconditions +
                '}';
    }
}
