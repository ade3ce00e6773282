package dk.cloudcreate.cqrskit.types;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * A condition the event store must verify, atomically with the append, before publishing a batch of events.<br>
 * A single failing precondition aborts the entire batch.<br>
 * The two built in precondition types are supported by all shipped adapters, other types are passed verbatim
 * to the adapter.
 */
public final class Precondition {
    public static final String SUBJECT_IS_NEW_TYPE    = "isSubjectNew";
    public static final String LAST_EVENT_ID_TYPE     = "lastEventId";
    public static final String SUBJECT_KEY            = "subject";
    public static final String EXPECTED_EVENT_ID_KEY  = "expectedLastEventId";

    public final String              type;
    public final Map<String, Object> payload;

    public Precondition(String type, Map<String, Object> payload) {
        this.type = requireNonNull(type, "No type provided");
        this.payload = Collections.unmodifiableMap(new LinkedHashMap<>(requireNonNull(payload, "No payload provided")));
    }

    /**
     * The subject must not have any events
     */
    public static Precondition isSubjectNew(Subject subject) {
        requireNonNull(subject, "No subject provided");
        return new Precondition(SUBJECT_IS_NEW_TYPE, Map.of(SUBJECT_KEY, subject.toString()));
    }

    /**
     * The last event published for the subject must have the given id
     */
    public static Precondition lastEventId(Subject subject, EventId expectedLastEventId) {
        requireNonNull(subject, "No subject provided");
        requireNonNull(expectedLastEventId, "No expectedLastEventId provided");
        return new Precondition(LAST_EVENT_ID_TYPE, Map.of(SUBJECT_KEY, subject.toString(),
                                                           EXPECTED_EVENT_ID_KEY, expectedLastEventId.toString()));
    }

    public Subject subject() {
        var subject = payload.get(SUBJECT_KEY);
        return subject != null ? Subject.of(subject.toString()) : null;
    }

    public EventId expectedLastEventId() {
        var eventId = payload.get(EXPECTED_EVENT_ID_KEY);
        return eventId != null ? EventId.of(eventId.toString()) : null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Precondition)) return false;
        var that = (Precondition) o;
        return type.equals(that.type) && payload.equals(that.payload);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, payload);
    }

    @Override
    public String toString() {
        return "Precondition{" +
                "type='" + type + '\'' +
                ", payload=" + payload +
                '}';
    }
}
