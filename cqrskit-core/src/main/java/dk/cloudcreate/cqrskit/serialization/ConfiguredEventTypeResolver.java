package dk.cloudcreate.cqrskit.serialization;

import java.util.concurrent.*;

import static dk.cloudcreate.essentials.shared.FailFast.*;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * {@link EventTypeResolver} where every event type is explicitly registered:
 * <pre>{@code
 * var resolver = new ConfiguredEventTypeResolver()
 *         .register("com.example.task-created.v1", TaskCreated.class)
 *         .register("com.example.task-assigned.v1", TaskAssigned.class);
 * }</pre>
 * A type and a class can only be registered once.
 */
public class ConfiguredEventTypeResolver implements EventTypeResolver {
    private final ConcurrentMap<String, Class<?>> classByEventType = new ConcurrentHashMap<>();
    private final ConcurrentMap<Class<?>, String> eventTypeByClass = new ConcurrentHashMap<>();

    public ConfiguredEventTypeResolver register(String eventType, Class<?> eventClass) {
        requireNonNull(eventType, "No eventType provided");
        requireNonNull(eventClass, "No eventClass provided");
        var existingClass = classByEventType.putIfAbsent(eventType, eventClass);
        if (existingClass != null && !existingClass.equals(eventClass)) {
            throw new IllegalArgumentException(msg("Event type '{}' is already registered for class '{}'", eventType, existingClass.getName()));
        }
        var existingType = eventTypeByClass.putIfAbsent(eventClass, eventType);
        if (existingType != null && !existingType.equals(eventType)) {
            throw new IllegalArgumentException(msg("Class '{}' is already registered with event type '{}'", eventClass.getName(), existingType));
        }
        return this;
    }

    @Override
    public String resolveEventType(Class<?> eventClass) {
        requireNonNull(eventClass, "No eventClass provided");
        var eventType = eventTypeByClass.get(eventClass);
        if (eventType == null) {
            throw new UnknownEventTypeException(msg("No event type registered for class '{}'", eventClass.getName()), eventClass.getName());
        }
        return eventType;
    }

    @Override
    public Class<?> resolveEventClass(String eventType) {
        requireNonNull(eventType, "No eventType provided");
        var eventClass = classByEventType.get(eventType);
        if (eventClass == null) {
            throw new UnknownEventTypeException(msg("Unknown event type '{}'", eventType), eventType);
        }
        return eventClass;
    }
}
