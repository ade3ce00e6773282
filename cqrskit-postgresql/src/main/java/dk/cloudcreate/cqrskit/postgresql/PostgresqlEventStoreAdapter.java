package dk.cloudcreate.cqrskit.postgresql;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dk.cloudcreate.cqrskit.persistence.*;
import dk.cloudcreate.cqrskit.serialization.JacksonEventDataMarshaller;
import dk.cloudcreate.cqrskit.types.*;
import org.jdbi.v3.core.*;
import org.jdbi.v3.core.statement.Query;
import org.slf4j.*;
import reactor.core.publisher.Flux;

import java.time.*;
import java.util.*;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Postgresql version of the {@link EventStoreAdapter}, using Jdbi.<br>
 * All events are stored in a single table (default {@value #DEFAULT_EVENTS_TABLE_NAME}), where the <code>global_order</code>
 * column defines the publishing order and the <code>id</code> column holds the {@link EventId} (a random UUID).
 * The event <code>data</code> and <code>metadata</code> are stored as JSONB.<br>
 * Publishing takes an exclusive lock on the events table for the duration of the transaction, which guarantees that the
 * {@link Precondition}'s are checked against the same state the events are appended to.<br>
 * {@link #observeEvents(Subject, StreamOptions, boolean)} is implemented by polling.
 */
public class PostgresqlEventStoreAdapter implements EventStoreAdapter {
    private static final Logger   log                       = LoggerFactory.getLogger(PostgresqlEventStoreAdapter.class);
    public static final  String   DEFAULT_EVENTS_TABLE_NAME = "events";
    public static final  Duration DEFAULT_POLLING_INTERVAL  = Duration.ofMillis(500);

    private final Jdbi              jdbi;
    private final String            eventsTableName;
    private final Duration          pollingInterval;
    private final ObjectMapper      objectMapper;
    private final RawEventRowMapper rawEventRowMapper;

    /**
     * Create an adapter using the default table name and polling interval
     */
    public PostgresqlEventStoreAdapter(Jdbi jdbi) {
        this(jdbi, Optional.empty(), Optional.empty());
    }

    /**
     * @param jdbi            the jdbi instance
     * @param eventsTableName the name of the events table (default {@value #DEFAULT_EVENTS_TABLE_NAME})
     * @param pollingInterval how often {@link #observeEvents(Subject, StreamOptions, boolean)} polls for new events (default 500 ms)
     */
    @SuppressWarnings("OptionalUsedAsFieldOrParameterType")
    public PostgresqlEventStoreAdapter(Jdbi jdbi,
                                       Optional<String> eventsTableName,
                                       Optional<Duration> pollingInterval) {
        this.jdbi = requireNonNull(jdbi, "You must supply a jdbi instance");
        this.eventsTableName = requireNonNull(eventsTableName, "No eventsTableName option provided").orElse(DEFAULT_EVENTS_TABLE_NAME);
        this.pollingInterval = requireNonNull(pollingInterval, "No pollingInterval option provided").orElse(DEFAULT_POLLING_INTERVAL);
        this.objectMapper = JacksonEventDataMarshaller.createDefaultObjectMapper();
        this.rawEventRowMapper = new RawEventRowMapper(objectMapper);
        createEventsTable();
    }

    private void createEventsTable() {
        jdbi.useTransaction(handle -> {
            handle.execute("CREATE TABLE IF NOT EXISTS " + eventsTableName + " (\n" +
                                   "  global_order BIGSERIAL PRIMARY KEY,\n" +
                                   "  id TEXT NOT NULL UNIQUE,\n" +
                                   "  type TEXT NOT NULL,\n" +
                                   "  source TEXT NOT NULL,\n" +
                                   "  subject TEXT NOT NULL,\n" +
                                   "  time TIMESTAMP WITH TIME ZONE NOT NULL,\n" +
                                   "  data JSONB NOT NULL,\n" +
                                   "  metadata JSONB NOT NULL\n" +
                                   ")");
            handle.execute("CREATE INDEX IF NOT EXISTS idx_" + eventsTableName + "_subject ON " + eventsTableName + " (subject, global_order)");
            log.info("Ensured events table '{}' exists", eventsTableName);
        });
    }

    @Override
    public Stream<RawEvent> streamEvents(Subject subject, StreamOptions options, boolean recursive) {
        requireNonNull(subject, "No subject provided");
        requireNonNull(options, "No options provided");
        return jdbi.withHandle(handle -> loadEvents(handle, subject, options, recursive)).stream();
    }

    private List<RawEvent> loadEvents(Handle handle, Subject subject, StreamOptions options, boolean recursive) {
        var where = new StringBuilder(recursive ?
                                      "(subject = :subject OR subject LIKE :subjectPrefix)" :
                                      "subject = :subject");
        options.lowerBound.ifPresent(lowerBound -> where.append(" AND global_order ")
                                                        .append(options.includeLowerBound ? ">=" : ">")
                                                        .append(" COALESCE((SELECT global_order FROM ").append(eventsTableName)
                                                        .append(" WHERE id = :lowerBound), 0)"));
        options.upperBound.ifPresent(upperBound -> where.append(" AND global_order ")
                                                        .append(options.includeUpperBound ? "<=" : "<")
                                                        .append(" COALESCE((SELECT global_order FROM ").append(eventsTableName)
                                                        .append(" WHERE id = :upperBound), 9223372036854775807)"));
        String sql;
        if (options.latestByEventType.isPresent()) {
            sql = "SELECT * FROM (SELECT DISTINCT ON (subject) * FROM " + eventsTableName +
                    " WHERE " + where + " AND type = :latestByEventType ORDER BY subject, global_order DESC) latest ORDER BY global_order";
        } else {
            sql = "SELECT * FROM " + eventsTableName + " WHERE " + where + " ORDER BY global_order";
        }

        Query query = handle.createQuery(sql)
                            .bind("subject", subject.toString());
        if (recursive) {
            query.bind("subjectPrefix", subjectPrefix(subject));
        }
        options.lowerBound.ifPresent(lowerBound -> query.bind("lowerBound", lowerBound.toString()));
        options.upperBound.ifPresent(upperBound -> query.bind("upperBound", upperBound.toString()));
        options.latestByEventType.ifPresent(eventType -> query.bind("latestByEventType", eventType));
        return query.map(rawEventRowMapper)
                    .list();
    }

    /**
     * LIKE pattern matching all descendants of the subject
     */
    private static String subjectPrefix(Subject subject) {
        var value = subject.toString()
                           .replace("\\", "\\\\")
                           .replace("%", "\\%")
                           .replace("_", "\\_");
        return (value.endsWith(Subject.SEPARATOR) ? value : value + Subject.SEPARATOR) + "%";
    }

    @Override
    public Flux<RawEvent> observeEvents(Subject subject, StreamOptions options, boolean recursive) {
        requireNonNull(subject, "No subject provided");
        requireNonNull(options, "No options provided");
        var eventStreamLogName = "EventStream:" + subject;
        var nextOptions        = new AtomicReference<>(StreamOptions.none().withLowerBound(options.lowerBound, options.includeLowerBound));
        log.debug("[{}] Creating polling event stream with {} and polling interval {}", eventStreamLogName, nextOptions.get(), pollingInterval);

        return Flux.defer(() -> {
                       try {
                           var events = jdbi.withHandle(handle -> loadEvents(handle, subject, nextOptions.get(), recursive));
                           if (!events.isEmpty()) {
                               log.debug("[{}] Polling with {} returned {} event(s)", eventStreamLogName, nextOptions.get(), events.size());
                           } else {
                               log.trace("[{}] Polling with {} returned no events", eventStreamLogName, nextOptions.get());
                           }
                           return Flux.fromIterable(events);
                       } catch (ConnectionException e) {
                           log.debug(msg("[{}] Experienced a Postgresql connection issue, will retry at the next poll", eventStreamLogName), e);
                           return Flux.empty();
                       }
                   })
                   .doOnNext(event -> nextOptions.set(StreamOptions.after(Optional.of(event.id))))
                   .doOnError(throwable -> log.error(msg("[{}] Polling failed with {}", eventStreamLogName, nextOptions.get()), throwable))
                   .repeatWhen(completed -> completed.delayElements(pollingInterval));
    }

    @Override
    public List<RawEvent> publishEvents(List<EventToPublish> events, List<Precondition> preconditions) {
        requireNonNull(events, "No events provided");
        if (events.isEmpty()) {
            return List.of();
        }
        return jdbi.inTransaction(handle -> {
            handle.execute("LOCK TABLE " + eventsTableName + " IN EXCLUSIVE MODE");
            if (preconditions != null) {
                preconditions.forEach(precondition -> checkPrecondition(handle, precondition));
            }
            var now = OffsetDateTime.now(Clock.systemUTC());
            var publishedEvents = events.stream()
                                        .map(event -> insertEvent(handle, event, now))
                                        .collect(Collectors.toList());
            log.debug("Published {} event(s)", publishedEvents.size());
            return publishedEvents;
        });
    }

    private RawEvent insertEvent(Handle handle, EventToPublish event, OffsetDateTime now) {
        var eventId = EventId.of(UUID.randomUUID().toString());
        handle.createUpdate("INSERT INTO " + eventsTableName + " (id, type, source, subject, time, data, metadata) " +
                                    "VALUES (:id, :type, :source, :subject, :time, CAST(:data AS JSONB), CAST(:metadata AS JSONB))")
              .bind("id", eventId.toString())
              .bind("type", event.type)
              .bind("source", event.source)
              .bind("subject", event.subject.toString())
              .bind("time", now)
              .bind("data", toJson(event.data))
              .bind("metadata", toJson(event.metadata))
              .execute();
        return new RawEvent(eventId, event.type, event.source, event.subject, now, event.data, event.metadata);
    }

    private void checkPrecondition(Handle handle, Precondition precondition) {
        switch (precondition.type) {
            case Precondition.SUBJECT_IS_NEW_TYPE: {
                var subject = precondition.subject();
                var exists = handle.createQuery("SELECT EXISTS (SELECT 1 FROM " + eventsTableName + " WHERE subject = :subject)")
                                   .bind("subject", subject.toString())
                                   .mapTo(Boolean.class)
                                   .one();
                if (exists) {
                    throw new PreconditionFailedException(msg("Precondition failed: subject '{}' already exists", subject), precondition);
                }
                break;
            }
            case Precondition.LAST_EVENT_ID_TYPE: {
                var subject  = precondition.subject();
                var expected = precondition.expectedLastEventId();
                var lastEventId = handle.createQuery("SELECT id FROM " + eventsTableName + " WHERE subject = :subject ORDER BY global_order DESC LIMIT 1")
                                        .bind("subject", subject.toString())
                                        .mapTo(String.class)
                                        .findOne();
                if (!lastEventId.equals(Optional.of(expected.toString()))) {
                    throw new PreconditionFailedException(msg("Precondition failed: expected last event id of subject '{}' to be '{}' but was '{}'",
                                                              subject,
                                                              expected,
                                                              lastEventId.orElse("<none>")),
                                                          precondition);
                }
                break;
            }
            default:
                throw new PreconditionFailedException(msg("Unsupported precondition type '{}'", precondition.type), precondition);
        }
    }

    @Override
    public void ping() {
        jdbi.useHandle(handle -> handle.createQuery("SELECT 1").mapTo(Integer.class).one());
    }

    public String getEventsTableName() {
        return eventsTableName;
    }

    private String toJson(Map<String, Object> value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new EventStoreException(msg("Failed to serialize '{}' to JSON", value), e);
        }
    }

}
