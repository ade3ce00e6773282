package dk.cloudcreate.cqrskit.persistence;

import dk.cloudcreate.cqrskit.types.*;
import reactor.core.publisher.Flux;

import java.util.List;
import java.util.stream.Stream;

/**
 * The contract between the command router/event handling processors and a concrete event store.<br>
 * <br>
 * An event store is an append only log of {@link RawEvent}'s, where every event belongs to a {@link Subject}.
 * Events are always returned in the order they were published.
 */
public interface EventStoreAdapter {
    /**
     * Stream the historical events for a subject. The returned stream is finite and must be closed by the caller
     * (e.g. using try-with-resources)
     *
     * @param subject   the subject
     * @param options   bounds and filters
     * @param recursive if true then events for all descendants of <code>subject</code> are included, otherwise only the events
     *                  for the exact subject
     * @return the matching events in publishing order
     */
    Stream<RawEvent> streamEvents(Subject subject, StreamOptions options, boolean recursive);

    /**
     * Observe the events for a subject. The returned {@link Flux} first emits all historical events matching
     * <code>options</code> and afterwards continues to emit newly published events until the subscription is cancelled.<br>
     * Only the lower bound of the <code>options</code> is used.
     *
     * @param subject   the subject
     * @param options   the lower bound to start after (or at if {@link StreamOptions#includeLowerBound})
     * @param recursive if true then events for all descendants of <code>subject</code> are included
     * @return an infinite stream of events
     */
    Flux<RawEvent> observeEvents(Subject subject, StreamOptions options, boolean recursive);

    /**
     * Atomically publish a batch of events: either all events are published or none are.
     *
     * @param events        the events to publish
     * @param preconditions the preconditions that must hold (checked atomically with the append)
     * @return the published events with their store assigned ids and timestamps
     * @throws PreconditionFailedException in case a precondition wasn't fulfilled
     */
    List<RawEvent> publishEvents(List<EventToPublish> events, List<Precondition> preconditions);

    /**
     * Verify that the event store can be reached
     */
    default void ping() {
    }
}
