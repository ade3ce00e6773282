package dk.cloudcreate.cqrskit.command;

import dk.cloudcreate.cqrskit.types.Precondition;

import java.util.*;

/**
 * Given to command handlers to publish events.<br>
 * Publishing only buffers the event: the events are published to the event store, as one atomic batch,
 * after the command handler has returned successfully. If the command handler throws, nothing is published.
 *
 * @param <INSTANCE> the type of instance the command handler works on
 */
public interface CommandEventPublisher<INSTANCE> {
    /**
     * @param event         the event payload
     * @param metadata      metadata stored with the event
     * @param preconditions preconditions that must hold when the batch is published
     */
    void publish(Object event, Map<String, Object> metadata, List<Precondition> preconditions);

    default void publish(Object event, Map<String, Object> metadata) {
        publish(event, metadata, List.of());
    }

    default void publish(Object event) {
        publish(event, Map.of(), List.of());
    }
}
