package dk.cloudcreate.cqrskit.upcaster;

import dk.cloudcreate.cqrskit.types.RawEvent;
import org.slf4j.*;

import java.util.*;
import java.util.concurrent.CopyOnWriteArrayList;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Ordered chain of {@link EventUpcaster}'s.<br>
 * Every upcaster gets one pass over the events produced by the previous upcasters (in the order the upcasters were added),
 * which allows chaining e.g. a v1 to v2 upcaster with a v2 to v3 upcaster.<br>
 * Events that an upcaster doesn't claim pass through unchanged. The events produced keep the id, subject, source, time and metadata
 * of the original raw event.
 */
public class EventUpcasters {
    private static final Logger log = LoggerFactory.getLogger(EventUpcasters.class);

    private final List<EventUpcaster> upcasters = new CopyOnWriteArrayList<>();

    public EventUpcasters(EventUpcaster... upcasters) {
        this(List.of(upcasters));
    }

    public EventUpcasters(List<EventUpcaster> upcasters) {
        requireNonNull(upcasters, "No upcasters provided").forEach(this::add);
    }

    public EventUpcasters add(EventUpcaster upcaster) {
        upcasters.add(requireNonNull(upcaster, "No upcaster provided"));
        return this;
    }

    public boolean isEmpty() {
        return upcasters.isEmpty();
    }

    /**
     * Run the raw event through all upcasters
     *
     * @param event the raw event as read from the event store
     * @return the resulting events (possibly empty)
     */
    public List<RawEvent> upcast(RawEvent event) {
        requireNonNull(event, "No event provided");
        List<RawEvent> events = List.of(event);
        for (var upcaster : upcasters) {
            var nextEvents = new ArrayList<RawEvent>(events.size());
            for (var current : events) {
                if (upcaster.canUpcast(current)) {
                    var results = upcaster.upcast(current);
                    log.trace("Upcaster '{}' transformed event '{}' of type '{}' into {} event(s)",
                              upcaster.getClass().getSimpleName(),
                              current.id,
                              current.type,
                              results.size());
                    results.forEach(result -> nextEvents.add(current.withTypeAndData(result.type, result.data)));
                } else {
                    nextEvents.add(current);
                }
            }
            events = nextEvents;
        }
        return events;
    }
}
