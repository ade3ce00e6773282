package dk.cloudcreate.cqrskit.command;

import dk.cloudcreate.cqrskit.command.cache.*;
import dk.cloudcreate.cqrskit.persistence.*;
import dk.cloudcreate.cqrskit.serialization.*;
import dk.cloudcreate.cqrskit.types.*;
import dk.cloudcreate.cqrskit.upcaster.EventUpcasters;
import org.slf4j.*;

import java.util.*;
import java.util.stream.Collectors;

import static dk.cloudcreate.essentials.shared.FailFast.*;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Routes a {@link Command} to its registered {@link CommandHandlerDefinition}.<br>
 * For every {@link #send(Command, Map)} the router:
 * <ol>
 *     <li>resolves the command handler using the runtime class of the command</li>
 *     <li>rebuilds the instance the command handler works on (unless the {@link SourcingMode} is {@link SourcingMode#NONE}),
 *     by replaying the events of the command's subject that haven't already been applied to the instance cached in the
 *     {@link StateRebuildingCache}</li>
 *     <li>verifies the {@link Command#getSubjectCondition()}</li>
 *     <li>invokes the command handler</li>
 *     <li>applies the events the command handler published to the instance</li>
 *     <li>publishes all events the command handler published as one atomic batch</li>
 * </ol>
 * Exceptions thrown by the command handler are propagated unchanged and no events are published.<br>
 * Instances returned by state rebuilding handlers are shared through the cache and must not be mutated by command handlers.
 * <br>
 * Use {@link #builder()} to create a router:
 * <pre>{@code
 * var router = CommandRouter.builder()
 *                           .setEventStore(eventStore)
 *                           .setEventTypeResolver(eventTypeResolver)
 *                           .setEventSource("tasks-service")
 *                           .addCommandHandlers(TaskHandlers.commandHandlers())
 *                           .addStateRebuildingHandlers(TaskHandlers.stateRebuildingHandlers())
 *                           .setCache(new InMemoryStateRebuildingCache())
 *                           .build();
 * }</pre>
 */
public class CommandRouter {
    private static final Logger log = LoggerFactory.getLogger(CommandRouter.class);

    private final EventStoreAdapter                                           eventStore;
    private final EventTypeResolver                                           eventTypeResolver;
    private final EventDataMarshaller                                         eventDataMarshaller;
    private final RawEventDeserializer                                        rawEventDeserializer;
    private final EventUpcasters                                              upcasters;
    private final StateRebuildingCache                                        cache;
    private final String                                                      eventSource;
    private final MetadataPropagation                                         metadataPropagation;
    private final Map<Class<?>, CommandHandlerDefinition<?, ?, ?>>            commandHandlers;
    private final Map<Class<?>, List<StateRebuildingHandlerDefinition<?, ?>>> stateRebuildingHandlers;

    private CommandRouter(Builder builder) {
        this.eventStore = requireNonNull(builder.eventStore, "You must supply an eventStore");
        this.eventTypeResolver = requireNonNull(builder.eventTypeResolver, "You must supply an eventTypeResolver");
        this.eventDataMarshaller = requireNonNull(builder.eventDataMarshaller, "You must supply an eventDataMarshaller");
        this.upcasters = requireNonNull(builder.upcasters, "You must supply upcasters");
        this.cache = requireNonNull(builder.cache, "You must supply a cache");
        this.eventSource = requireNonNull(builder.eventSource, "You must supply an eventSource");
        this.metadataPropagation = requireNonNull(builder.metadataPropagation, "You must supply a metadataPropagation");
        this.rawEventDeserializer = new RawEventDeserializer(eventTypeResolver, eventDataMarshaller);

        var handlers = new HashMap<Class<?>, CommandHandlerDefinition<?, ?, ?>>();
        for (var definition : builder.commandHandlers) {
            var existing = handlers.putIfAbsent(definition.commandClass, definition);
            if (existing != null) {
                throw new IllegalArgumentException(msg("A command handler is already registered for command '{}'", definition.commandClass.getName()));
            }
        }
        this.commandHandlers = Map.copyOf(handlers);
        this.stateRebuildingHandlers = builder.stateRebuildingHandlers.stream()
                                                                      .collect(Collectors.groupingBy(definition -> definition.instanceClass,
                                                                                                     LinkedHashMap::new,
                                                                                                     Collectors.toList()));
        log.debug("Created CommandRouter for event source '{}' with {} command handler(s), {} state rebuilding handler(s) and cache '{}'",
                  eventSource,
                  commandHandlers.size(),
                  builder.stateRebuildingHandlers.size(),
                  cache.getClass().getSimpleName());
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Send a command without metadata
     *
     * @see #send(Command, Map)
     */
    public <RESULT> RESULT send(Command command) {
        return send(command, Map.of());
    }

    /**
     * Send a command to its command handler
     *
     * @param command  the command
     * @param metadata metadata that is available to the command handler and is propagated to the published events according to the
     *                 configured {@link MetadataPropagation}
     * @param <RESULT> the result type of the command handler
     * @return the result returned by the command handler
     * @throws NoCommandHandlerException           if no command handler is registered for the command
     * @throws SubjectConditionViolationException  if the command's {@link SubjectCondition} isn't fulfilled
     * @throws PreconditionFailedException         if the event store rejected the published events
     */
    @SuppressWarnings("unchecked")
    public <RESULT> RESULT send(Command command, Map<String, Object> metadata) {
        requireNonNull(command, "You must supply a command");
        requireNonNull(metadata, "You must supply metadata");
        var definition = (CommandHandlerDefinition<Object, Command, Object>) commandHandlers.get(command.getClass());
        if (definition == null) {
            throw new NoCommandHandlerException(command.getClass());
        }
        var subject = requireNonNull(command.getSubject(), msg("Command '{}' returned a null subject", command.getClass().getName()));
        log.debug("Sending command '{}' for subject '{}'", command.getClass().getSimpleName(), subject);

        var rebuilt = definition.sourcingMode == SourcingMode.NONE ?
                      CacheValue.empty() :
                      rebuildState(subject, definition.instanceClass, definition.sourcingMode);

        verifySubjectCondition(subject, command.getSubjectCondition(), rebuilt.eventId);

        var eventPublisher = new CapturingCommandEventPublisher<>();
        var result         = definition.handle(rebuilt.instance, command, metadata, eventPublisher);
        var capturedEvents = eventPublisher.getCapturedEvents();

        if (!capturedEvents.isEmpty()) {
            var updatedInstance = rebuilt.instance;
            for (var capturedEvent : capturedEvents) {
                updatedInstance = applyStateRebuildingHandlers(definition.instanceClass,
                                                               updatedInstance,
                                                               capturedEvent.event,
                                                               capturedEvent.metadata,
                                                               subject,
                                                               Optional.empty());
            }
            log.trace("Instance of subject '{}' after applying {} new event(s): {}", subject, capturedEvents.size(), updatedInstance);
            publish(subject, metadata, capturedEvents);
        }
        return (RESULT) result;
    }

    private void publish(Subject subject, Map<String, Object> commandMetadata, List<CapturedEvent> capturedEvents) {
        var eventsToPublish = capturedEvents.stream()
                                            .map(capturedEvent -> new EventToPublish(eventSource,
                                                                                     subject,
                                                                                     eventTypeResolver.resolveEventType(capturedEvent.event.getClass()),
                                                                                     eventDataMarshaller.serialize(new EventData<>(capturedEvent.event,
                                                                                                                                   metadataPropagation.propagate(commandMetadata, capturedEvent.metadata))),
                                                                                     capturedEvent.metadata,
                                                                                     capturedEvent.preconditions))
                                            .collect(Collectors.toList());
        var preconditions = capturedEvents.stream()
                                          .flatMap(capturedEvent -> capturedEvent.preconditions.stream())
                                          .collect(Collectors.toList());
        var publishedEvents = eventStore.publishEvents(eventsToPublish, preconditions);
        log.debug("Published {} event(s) for subject '{}'", publishedEvents.size(), subject);
    }

    private CacheValue rebuildState(Subject subject, Class<?> instanceClass, SourcingMode sourcingMode) {
        return cache.fetchAndMerge(new CacheKey(subject, instanceClass, sourcingMode), cached -> {
            var eventId           = cached.flatMap(value -> value.eventId);
            var instance          = cached.map(value -> value.instance).orElse(null);
            var sourcedSubjectIds = new LinkedHashMap<>(cached.map(value -> value.sourcedSubjectIds).orElse(Map.of()));
            var appliedEvents     = 0;

            try (var rawEvents = eventStore.streamEvents(subject,
                                                         StreamOptions.after(eventId),
                                                         sourcingMode == SourcingMode.RECURSIVE)) {
                var iterator = rawEvents.iterator();
                while (iterator.hasNext()) {
                    var rawEvent = iterator.next();
                    for (var upcastedEvent : upcasters.upcast(rawEvent)) {
                        var eventData = rawEventDeserializer.deserialize(upcastedEvent);
                        if (eventData.isEmpty()) {
                            continue;
                        }
                        instance = applyStateRebuildingHandlers(instanceClass,
                                                                instance,
                                                                eventData.get().payload,
                                                                eventData.get().metadata,
                                                                upcastedEvent.subject,
                                                                Optional.of(upcastedEvent));
                        eventId = Optional.of(upcastedEvent.id);
                        sourcedSubjectIds.put(upcastedEvent.subject, upcastedEvent.id);
                        appliedEvents++;
                    }
                }
            }
            log.trace("Rebuilt '{}' for subject '{}' by applying {} event(s) on top of {}",
                      instanceClass.getSimpleName(),
                      subject,
                      appliedEvents,
                      cached.isPresent() ? "the cached instance" : "an empty instance");
            return new CacheValue(eventId, instance, sourcedSubjectIds);
        });
    }

    @SuppressWarnings({"unchecked", "OptionalUsedAsFieldOrParameterType"})
    private Object applyStateRebuildingHandlers(Class<?> instanceClass,
                                                Object instance,
                                                Object event,
                                                Map<String, Object> metadata,
                                                Subject subject,
                                                Optional<RawEvent> rawEvent) {
        var result = instance;
        for (var definition : stateRebuildingHandlers.getOrDefault(instanceClass, List.of())) {
            if (definition.eventClass.equals(event.getClass())) {
                result = ((StateRebuildingHandlerDefinition<Object, ?>) definition).apply(result, event, metadata, subject, rawEvent);
            }
        }
        return result;
    }

    @SuppressWarnings("OptionalUsedAsFieldOrParameterType")
    private static void verifySubjectCondition(Subject subject, SubjectCondition condition, Optional<EventId> lastEventId) {
        if (condition == null || condition == SubjectCondition.NONE) {
            return;
        }
        if (condition == SubjectCondition.NEW && lastEventId.isPresent()) {
            throw new SubjectConditionViolationException(subject, condition);
        }
        if (condition == SubjectCondition.EXISTS && lastEventId.isEmpty()) {
            throw new SubjectConditionViolationException(subject, condition);
        }
    }

    public static class Builder {
        private final List<CommandHandlerDefinition<?, ?, ?>>      commandHandlers         = new ArrayList<>();
        private final List<StateRebuildingHandlerDefinition<?, ?>> stateRebuildingHandlers = new ArrayList<>();
        private       EventStoreAdapter                            eventStore;
        private       EventTypeResolver                            eventTypeResolver;
        private       EventDataMarshaller                          eventDataMarshaller     = new JacksonEventDataMarshaller();
        private       EventUpcasters                               upcasters               = new EventUpcasters();
        private       StateRebuildingCache                         cache                   = new NoStateRebuildingCache();
        private       String                                       eventSource;
        private       MetadataPropagation                          metadataPropagation     = MetadataPropagation.none();

        public Builder setEventStore(EventStoreAdapter eventStore) {
            this.eventStore = eventStore;
            return this;
        }

        public Builder setEventTypeResolver(EventTypeResolver eventTypeResolver) {
            this.eventTypeResolver = eventTypeResolver;
            return this;
        }

        /**
         * Default: {@link JacksonEventDataMarshaller}
         */
        public Builder setEventDataMarshaller(EventDataMarshaller eventDataMarshaller) {
            this.eventDataMarshaller = eventDataMarshaller;
            return this;
        }

        /**
         * Default: no upcasters
         */
        public Builder setUpcasters(EventUpcasters upcasters) {
            this.upcasters = upcasters;
            return this;
        }

        /**
         * Default: {@link NoStateRebuildingCache}
         */
        public Builder setCache(StateRebuildingCache cache) {
            this.cache = cache;
            return this;
        }

        /**
         * The source stored with every published event, e.g. the name of the service
         */
        public Builder setEventSource(String eventSource) {
            this.eventSource = eventSource;
            return this;
        }

        /**
         * Default: {@link MetadataPropagation#none()}
         */
        public Builder setMetadataPropagation(MetadataPropagation metadataPropagation) {
            this.metadataPropagation = metadataPropagation;
            return this;
        }

        public Builder addCommandHandler(CommandHandlerDefinition<?, ?, ?> commandHandler) {
            this.commandHandlers.add(requireNonNull(commandHandler, "No commandHandler provided"));
            return this;
        }

        public Builder addCommandHandlers(List<? extends CommandHandlerDefinition<?, ?, ?>> commandHandlers) {
            requireNonNull(commandHandlers, "No commandHandlers provided").forEach(this::addCommandHandler);
            return this;
        }

        public Builder addStateRebuildingHandler(StateRebuildingHandlerDefinition<?, ?> stateRebuildingHandler) {
            this.stateRebuildingHandlers.add(requireNonNull(stateRebuildingHandler, "No stateRebuildingHandler provided"));
            return this;
        }

        public Builder addStateRebuildingHandlers(List<? extends StateRebuildingHandlerDefinition<?, ?>> stateRebuildingHandlers) {
            requireNonNull(stateRebuildingHandlers, "No stateRebuildingHandlers provided").forEach(this::addStateRebuildingHandler);
            return this;
        }

        public CommandRouter build() {
            return new CommandRouter(this);
        }
    }
}
