package dk.cloudcreate.cqrskit.eventhandler;

import dk.cloudcreate.cqrskit.types.RawEvent;

import java.util.Map;

/**
 * The supported event handler shapes. Which shape a handler has is decided by the {@link EventHandlerDefinition} factory method
 * used to register it.<br>
 * An event handler signals a failure by throwing an exception, after which the event is retried according to the
 * {@link EventHandlingRetryPolicy}.
 */
public interface EventHandler {
    @FunctionalInterface
    interface ForObject<EVENT> extends EventHandler {
        void handle(EVENT event);
    }

    @FunctionalInterface
    interface ForObjectAndMetadata<EVENT> extends EventHandler {
        void handle(EVENT event, Map<String, Object> metadata);
    }

    @FunctionalInterface
    interface ForObjectAndMetadataAndRawEvent<EVENT> extends EventHandler {
        void handle(EVENT event, Map<String, Object> metadata, RawEvent rawEvent);
    }
}
