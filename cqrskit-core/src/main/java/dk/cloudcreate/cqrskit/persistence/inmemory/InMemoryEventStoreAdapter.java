package dk.cloudcreate.cqrskit.persistence.inmemory;

import dk.cloudcreate.cqrskit.persistence.*;
import dk.cloudcreate.cqrskit.types.*;
import org.slf4j.*;
import reactor.core.publisher.Flux;

import java.time.*;
import java.util.*;
import java.util.concurrent.atomic.*;
import java.util.stream.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * {@link EventStoreAdapter} that keeps all events in memory.<br>
 * Event ids are assigned sequentially (<code>1</code>, <code>2</code>, ...). Bounds in {@link StreamOptions} are resolved
 * by the position of the referenced event, and a bound referencing an unknown event id is ignored.<br>
 * {@link #observeEvents(Subject, StreamOptions, boolean)} is implemented by polling.<br>
 * Supports the {@link Precondition#isSubjectNew(Subject)} and {@link Precondition#lastEventId(Subject, EventId)} preconditions.
 */
public class InMemoryEventStoreAdapter implements EventStoreAdapter {
    private static final Logger   log                     = LoggerFactory.getLogger(InMemoryEventStoreAdapter.class);
    public static final  Duration DEFAULT_POLLING_INTERVAL = Duration.ofMillis(100);

    private final Object         lock   = new Object();
    private final List<RawEvent> events = new ArrayList<>();
    private final AtomicLong     idCounter = new AtomicLong();
    private final Duration       pollingInterval;
    private final Clock          clock;

    public InMemoryEventStoreAdapter() {
        this(DEFAULT_POLLING_INTERVAL);
    }

    public InMemoryEventStoreAdapter(Duration pollingInterval) {
        this(pollingInterval, Clock.systemUTC());
    }

    public InMemoryEventStoreAdapter(Duration pollingInterval, Clock clock) {
        this.pollingInterval = requireNonNull(pollingInterval, "No pollingInterval provided");
        this.clock = requireNonNull(clock, "No clock provided");
    }

    @Override
    public Stream<RawEvent> streamEvents(Subject subject, StreamOptions options, boolean recursive) {
        requireNonNull(subject, "No subject provided");
        requireNonNull(options, "No options provided");
        List<RawEvent> snapshot;
        synchronized (lock) {
            snapshot = new ArrayList<>(events);
        }

        var fromIndex = options.lowerBound.map(lowerBound -> indexOf(snapshot, lowerBound))
                                          .filter(index -> index >= 0)
                                          .map(index -> options.includeLowerBound ? index : index + 1)
                                          .orElse(0);
        var toIndex = options.upperBound.map(upperBound -> indexOf(snapshot, upperBound))
                                        .filter(index -> index >= 0)
                                        .map(index -> options.includeUpperBound ? index + 1 : index)
                                        .orElse(snapshot.size());
        if (fromIndex >= toIndex) {
            return Stream.empty();
        }

        var matching = snapshot.subList(fromIndex, toIndex)
                               .stream()
                               .filter(event -> recursive ? subject.contains(event.subject) : subject.equals(event.subject))
                               .collect(Collectors.toList());

        if (options.latestByEventType.isPresent()) {
            var eventType = options.latestByEventType.get();
            var latestPerSubject = new HashMap<Subject, RawEvent>();
            matching.stream()
                    .filter(event -> event.type.equals(eventType))
                    .forEach(event -> latestPerSubject.put(event.subject, event));
            matching = matching.stream()
                               .filter(event -> latestPerSubject.get(event.subject) == event)
                               .collect(Collectors.toList());
        }
        return matching.stream();
    }

    @Override
    public Flux<RawEvent> observeEvents(Subject subject, StreamOptions options, boolean recursive) {
        requireNonNull(subject, "No subject provided");
        requireNonNull(options, "No options provided");
        var nextOptions = new AtomicReference<>(StreamOptions.none().withLowerBound(options.lowerBound, options.includeLowerBound));
        return Flux.defer(() -> {
                       List<RawEvent> polledEvents;
                       try (var stream = streamEvents(subject, nextOptions.get(), recursive)) {
                           polledEvents = stream.collect(Collectors.toList());
                       }
                       if (!polledEvents.isEmpty()) {
                           log.trace("Polling '{}' with {} returned {} event(s)", subject, nextOptions.get(), polledEvents.size());
                       }
                       return Flux.fromIterable(polledEvents);
                   })
                   .doOnNext(event -> nextOptions.set(StreamOptions.after(Optional.of(event.id))))
                   .repeatWhen(completed -> completed.delayElements(pollingInterval));
    }

    @Override
    public List<RawEvent> publishEvents(List<EventToPublish> eventsToPublish, List<Precondition> preconditions) {
        requireNonNull(eventsToPublish, "No eventsToPublish provided");
        synchronized (lock) {
            if (preconditions != null) {
                preconditions.forEach(this::checkPrecondition);
            }
            var now = OffsetDateTime.now(clock);
            var publishedEvents = eventsToPublish.stream()
                                                 .map(event -> new RawEvent(EventId.of(String.valueOf(idCounter.incrementAndGet())),
                                                                            event.type,
                                                                            event.source,
                                                                            event.subject,
                                                                            now,
                                                                            event.data,
                                                                            event.metadata))
                                                 .collect(Collectors.toList());
            events.addAll(publishedEvents);
            log.debug("Published {} event(s)", publishedEvents.size());
            return publishedEvents;
        }
    }

    /**
     * Get a copy of all events published in publishing order
     */
    public List<RawEvent> getAllEvents() {
        synchronized (lock) {
            return new ArrayList<>(events);
        }
    }

    /**
     * Remove all events and reset the id sequence
     */
    public void clear() {
        synchronized (lock) {
            events.clear();
            idCounter.set(0);
        }
    }

    private void checkPrecondition(Precondition precondition) {
        switch (precondition.type) {
            case Precondition.SUBJECT_IS_NEW_TYPE: {
                var subject = precondition.subject();
                if (events.stream().anyMatch(event -> event.subject.equals(subject))) {
                    throw new PreconditionFailedException(msg("Precondition failed: subject '{}' already exists", subject), precondition);
                }
                break;
            }
            case Precondition.LAST_EVENT_ID_TYPE: {
                var subject = precondition.subject();
                var lastEventId = lastEventIdOf(subject);
                var expected    = precondition.expectedLastEventId();
                if (!lastEventId.equals(Optional.of(expected))) {
                    throw new PreconditionFailedException(msg("Precondition failed: expected last event id of subject '{}' to be '{}' but was '{}'",
                                                              subject,
                                                              expected,
                                                              lastEventId.map(EventId::toString).orElse("<none>")),
                                                          precondition);
                }
                break;
            }
            default:
                throw new PreconditionFailedException(msg("Unsupported precondition type '{}'", precondition.type), precondition);
        }
    }

    private Optional<EventId> lastEventIdOf(Subject subject) {
        for (var i = events.size() - 1; i >= 0; i--) {
            if (events.get(i).subject.equals(subject)) {
                return Optional.of(events.get(i).id);
            }
        }
        return Optional.empty();
    }

    private static int indexOf(List<RawEvent> events, EventId eventId) {
        for (var i = 0; i < events.size(); i++) {
            if (events.get(i).id.equals(eventId)) {
                return i;
            }
        }
        return -1;
    }
}
