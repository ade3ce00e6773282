package dk.cloudcreate.cqrskit.eventhandler;

import dk.cloudcreate.cqrskit.common.Lifecycle;
import dk.cloudcreate.cqrskit.eventhandler.partitioning.*;
import dk.cloudcreate.cqrskit.eventhandler.progress.*;
import dk.cloudcreate.cqrskit.persistence.*;
import dk.cloudcreate.cqrskit.serialization.*;
import dk.cloudcreate.cqrskit.types.*;
import dk.cloudcreate.cqrskit.upcaster.EventUpcasters;
import dk.cloudcreate.essentials.shared.concurrent.ThreadFactoryBuilder;
import org.slf4j.*;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

import static dk.cloudcreate.essentials.shared.FailFast.*;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Continuously observes the event store and invokes the {@link EventHandlerDefinition}'s registered for one processing group,
 * for the events that belong to one partition of that group.<br>
 * <br>
 * Every event observed is assigned a partition by resolving its sequence id using the {@link EventSequenceResolver}
 * and mapping the sequence id to a partition using the {@link PartitionKeyResolver}. Events belonging to other partitions are
 * skipped (they're handled by the processors owning those partitions), but the progress still moves past them.<br>
 * <br>
 * Events are handled one at a time, in the order they were published, on a dedicated thread. If an event handler fails, the
 * event is retried according to the {@link EventHandlingRetryPolicy}. After the last failed attempt the event is skipped, so a
 * single poison event can't block the partition. The {@link Progress} is stored in the {@link ProgressTracker} exactly once per
 * event, after the event has been handled (or skipped).<br>
 * <br>
 * Failures outside event handlers (e.g. the event store or progress tracker being unavailable) are logged and the processing is
 * restarted, from the last stored progress, after {@link Builder#setLoopRestartDelay(Duration)}.<br>
 * <br>
 * A processor can be started again after {@link #stop()}. {@link #start()} then waits for the processing thread of the previous
 * run to finish, so a partition is never handled by two threads at the same time.<br>
 * <br>
 * Use {@link #builder()} to create a processor:
 * <pre>{@code
 * var processor = EventHandlingProcessor.builder()
 *                                       .setGroup("task-list")
 *                                       .setPartition(0)
 *                                       .setEventStore(eventStore)
 *                                       .setEventTypeResolver(eventTypeResolver)
 *                                       .setProgressTracker(progressTracker)
 *                                       .addEventHandlers(taskListProjector.eventHandlers())
 *                                       .build();
 * processor.start();
 * }</pre>
 */
public class EventHandlingProcessor implements Lifecycle {
    private static final Logger   log                      = LoggerFactory.getLogger(EventHandlingProcessor.class);
    private static final Duration STOP_CHECK_INTERVAL      = Duration.ofMillis(50);
    private static final Duration TERMINATION_LOG_INTERVAL = Duration.ofSeconds(5);

    private final String                                       group;
    private final int                                          partition;
    private final String                                       logPrefix;
    private final EventStoreAdapter                            eventStore;
    private final Subject                                      subject;
    private final boolean                                      recursive;
    private final RawEventDeserializer                         rawEventDeserializer;
    private final EventUpcasters                               upcasters;
    private final ProgressTracker                              progressTracker;
    private final PartitionKeyResolver                         partitionKeyResolver;
    private final EventSequenceResolver                        eventSequenceResolver;
    private final EventHandlingRetryPolicy                     retryPolicy;
    private final Duration                                     loopRestartDelay;
    private final Map<Class<?>, List<EventHandlerDefinition<?>>> eventHandlers;

    private volatile boolean         started;
    /**
     * Cleared when the current run is stopped. Every run gets its own token, so a stopped run never resumes
     */
    private          AtomicBoolean   running;
    private          ExecutorService executor;
    private          Disposable      subscription;

    private EventHandlingProcessor(Builder builder) {
        this.group = requireNonNull(builder.group, "You must supply a group");
        requireTrue(builder.partition >= 0, "partition must be 0 or larger");
        this.partition = builder.partition;
        this.logPrefix = group + ":" + partition;
        this.eventStore = requireNonNull(builder.eventStore, "You must supply an eventStore");
        this.subject = requireNonNull(builder.subject, "You must supply a subject");
        this.recursive = builder.recursive;
        this.rawEventDeserializer = new RawEventDeserializer(requireNonNull(builder.eventTypeResolver, "You must supply an eventTypeResolver"),
                                                             requireNonNull(builder.eventDataMarshaller, "You must supply an eventDataMarshaller"));
        this.upcasters = requireNonNull(builder.upcasters, "You must supply upcasters");
        this.progressTracker = requireNonNull(builder.progressTracker, "You must supply a progressTracker");
        this.partitionKeyResolver = requireNonNull(builder.partitionKeyResolver, "You must supply a partitionKeyResolver");
        this.eventSequenceResolver = requireNonNull(builder.eventSequenceResolver, "You must supply an eventSequenceResolver");
        this.retryPolicy = requireNonNull(builder.retryPolicy, "You must supply a retryPolicy");
        this.loopRestartDelay = builder.loopRestartDelay != null ? builder.loopRestartDelay : retryPolicy.initialRetryDelay;
        if (partitionKeyResolver instanceof DefaultPartitionKeyResolver) {
            var partitionCount = ((DefaultPartitionKeyResolver) partitionKeyResolver).getPartitionCount();
            requireTrue(partition < partitionCount, msg("partition {} is outside the {} partitions of the partitionKeyResolver", partition, partitionCount));
        }
        this.eventHandlers = builder.eventHandlers.stream()
                                                  .filter(definition -> definition.group.equals(group))
                                                  .collect(Collectors.groupingBy(definition -> definition.eventClass,
                                                                                 LinkedHashMap::new,
                                                                                 Collectors.toList()));
        if (eventHandlers.isEmpty()) {
            log.warn("[{}] No event handlers registered for group '{}'", logPrefix, group);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public synchronized void start() {
        if (!started) {
            awaitPreviousRunTermination();
            log.info("[{}] Starting EventHandlingProcessor observing '{}' (recursive: {}) with {}",
                     logPrefix,
                     subject,
                     recursive,
                     retryPolicy);
            var run = new AtomicBoolean(true);
            running = run;
            executor = Executors.newSingleThreadExecutor(ThreadFactoryBuilder.builder()
                                                                             .nameFormat("EventHandlingProcessor-" + group + "-" + partition + "-%d")
                                                                             .daemon(true)
                                                                             .build());
            var scheduler = Schedulers.fromExecutorService(executor, "EventHandlingProcessor-" + logPrefix);
            subscription = Flux.defer(() -> {
                                   var progress = progressTracker.current(group, partition);
                                   log.debug("[{}] Observing events after {}", logPrefix, progress);
                                   return eventStore.observeEvents(subject, StreamOptions.after(progress.lastProcessedEventId), recursive);
                               })
                               .subscribeOn(scheduler)
                               .publishOn(scheduler)
                               .doOnNext(rawEvent -> handleRawEvent(rawEvent, run))
                               .doOnError(e -> {
                                   if (run.get()) {
                                       log.error(msg("[{}] Event processing failed, restarting in {}", logPrefix, loopRestartDelay), e);
                                   }
                               })
                               .retryWhen(Retry.fixedDelay(Long.MAX_VALUE, loopRestartDelay)
                                               .filter(e -> run.get()))
                               .repeatWhen(completed -> completed.delayElements(loopRestartDelay)
                                                                 .takeWhile(ignore -> run.get()))
                               .subscribe(rawEvent -> {
                                          },
                                          e -> {
                                              if (run.get()) {
                                                  log.error(msg("[{}] Event processing terminated", logPrefix), e);
                                              }
                                          });
            started = true;
        }
    }

    /**
     * Request the processing to stop. An event handler currently being invoked is allowed to finish and afterwards no further
     * events are handled. This method doesn't wait for the processing thread to terminate.
     */
    @Override
    public synchronized void stop() {
        if (started) {
            log.info("[{}] Stopping EventHandlingProcessor", logPrefix);
            running.set(false);
            var currentSubscription = subscription;
            // Disposed on the processing thread, after an in-flight event handler has returned
            executor.execute(currentSubscription::dispose);
            executor.shutdown();
            started = false;
            log.info("[{}] EventHandlingProcessor stopped", logPrefix);
        }
    }

    private void awaitPreviousRunTermination() {
        var previousExecutor = executor;
        if (previousExecutor == null || previousExecutor.isTerminated()) {
            return;
        }
        log.info("[{}] Waiting for the processing thread of the previous run to finish", logPrefix);
        try {
            while (!previousExecutor.awaitTermination(TERMINATION_LOG_INTERVAL.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("[{}] Still waiting for the processing thread of the previous run to finish", logPrefix);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(msg("[{}] Interrupted while waiting for the processing thread of the previous run to finish", logPrefix), e);
        }
    }

    @Override
    public boolean isStarted() {
        return started;
    }

    public String getGroup() {
        return group;
    }

    public int getPartition() {
        return partition;
    }

    private void handleRawEvent(RawEvent rawEvent, AtomicBoolean run) {
        if (!run.get()) {
            log.trace("[{}] Stop requested, ignoring event '{}'", logPrefix, rawEvent.id);
            return;
        }
        var sequenceId     = eventSequenceResolver.resolve(Optional.empty(), rawEvent.metadata, rawEvent);
        var eventPartition = partitionKeyResolver.resolve(sequenceId);
        if (eventPartition != partition) {
            log.trace("[{}] Event '{}' with sequence id '{}' belongs to partition {}", logPrefix, rawEvent.id, sequenceId, eventPartition);
            storeProgress(rawEvent);
            return;
        }

        var attempt = 0;
        while (true) {
            attempt++;
            if (processEvent(rawEvent, attempt)) {
                break;
            }
            if (attempt >= retryPolicy.maximumNumberOfAttempts) {
                log.error("[{}] Giving up on event '{}' of type '{}' for subject '{}' after {} failed attempt(s)",
                          logPrefix,
                          rawEvent.id,
                          rawEvent.type,
                          rawEvent.subject,
                          attempt);
                break;
            }
            var retryDelay = retryPolicy.calculateRetryDelay(attempt);
            log.debug("[{}] Retrying event '{}' in {} (failed attempt {} of {})",
                      logPrefix,
                      rawEvent.id,
                      retryDelay,
                      attempt,
                      retryPolicy.maximumNumberOfAttempts);
            if (!awaitRetry(rawEvent, retryDelay, run)) {
                return;
            }
        }
        storeProgress(rawEvent);
    }

    /**
     * One attempt at handling all events the raw event is upcasted into
     *
     * @return true if every invoked event handler succeeded
     */
    private boolean processEvent(RawEvent rawEvent, int attempt) {
        var succeeded = true;
        List<RawEvent> upcastedEvents;
        try {
            upcastedEvents = upcasters.upcast(rawEvent);
        } catch (RuntimeException e) {
            log.error(msg("[{}] Failed to upcast event '{}' of type '{}' (attempt {})", logPrefix, rawEvent.id, rawEvent.type, attempt), e);
            return false;
        }

        for (var upcastedEvent : upcastedEvents) {
            var eventData = rawEventDeserializer.deserialize(upcastedEvent);
            if (eventData.isEmpty()) {
                continue;
            }
            var event    = eventData.get().payload;
            var metadata = eventData.get().metadata;

            var sequenceId     = eventSequenceResolver.resolve(Optional.of(event), metadata, upcastedEvent);
            var eventPartition = partitionKeyResolver.resolve(sequenceId);
            if (eventPartition != partition) {
                log.debug("[{}] Converted event '{}' of type '{}' with sequence id '{}' belongs to partition {}",
                          logPrefix,
                          upcastedEvent.id,
                          upcastedEvent.type,
                          sequenceId,
                          eventPartition);
                continue;
            }

            for (var eventHandler : eventHandlers.getOrDefault(event.getClass(), List.of())) {
                try {
                    eventHandler.handle(event, metadata, upcastedEvent);
                } catch (Exception e) {
                    log.error(msg("[{}] Skipping event '{}' of type '{}' for subject '{}' since an event handler failed (attempt {})",
                                  logPrefix,
                                  upcastedEvent.id,
                                  upcastedEvent.type,
                                  upcastedEvent.subject,
                                  attempt),
                              e);
                    succeeded = false;
                }
            }
        }
        return succeeded;
    }

    private void storeProgress(RawEvent rawEvent) {
        progressTracker.proceed(group, partition, current -> Progress.at(rawEvent.id));
        log.trace("[{}] Progress moved to event '{}'", logPrefix, rawEvent.id);
    }

    /**
     * @return false if a stop was requested while waiting
     * @throws EventProcessingInterruptedException if the processing thread was interrupted while waiting
     */
    private boolean awaitRetry(RawEvent rawEvent, Duration retryDelay, AtomicBoolean run) {
        var deadline = System.nanoTime() + retryDelay.toNanos();
        try {
            while (run.get()) {
                var remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    return true;
                }
                TimeUnit.NANOSECONDS.sleep(Math.min(remaining, STOP_CHECK_INTERVAL.toNanos()));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[{}] Interrupted while waiting to retry event '{}'. Processing restarts from the last stored progress", logPrefix, rawEvent.id);
            throw new EventProcessingInterruptedException(msg("[{}] Interrupted while waiting to retry event '{}'", logPrefix, rawEvent.id), e);
        }
        log.info("[{}] Stop requested while waiting to retry event '{}'. It will be handled again after the next start", logPrefix, rawEvent.id);
        return false;
    }

    public static class Builder {
        private final List<EventHandlerDefinition<?>> eventHandlers         = new ArrayList<>();
        private       String                          group;
        private       int                             partition;
        private       EventStoreAdapter               eventStore;
        private       Subject                         subject               = Subject.ROOT;
        private       boolean                         recursive             = true;
        private       EventTypeResolver               eventTypeResolver;
        private       EventDataMarshaller             eventDataMarshaller   = new JacksonEventDataMarshaller();
        private       EventUpcasters                  upcasters             = new EventUpcasters();
        private       ProgressTracker                 progressTracker       = new InMemoryProgressTracker();
        private       PartitionKeyResolver            partitionKeyResolver  = new DefaultPartitionKeyResolver();
        private       EventSequenceResolver           eventSequenceResolver = EventSequenceResolver.perSubject();
        private       EventHandlingRetryPolicy        retryPolicy           = EventHandlingRetryPolicy.defaultPolicy();
        private       Duration                        loopRestartDelay;

        /**
         * The processing group. Only the event handlers registered for this group are invoked
         */
        public Builder setGroup(String group) {
            this.group = group;
            return this;
        }

        /**
         * The partition this processor owns. Default: 0
         */
        public Builder setPartition(int partition) {
            this.partition = partition;
            return this;
        }

        public Builder setEventStore(EventStoreAdapter eventStore) {
            this.eventStore = eventStore;
            return this;
        }

        /**
         * The subject to observe. Default: {@link Subject#ROOT}
         */
        public Builder setSubject(Subject subject) {
            this.subject = subject;
            return this;
        }

        /**
         * Observe the descendants of the subject as well. Default: true
         */
        public Builder setRecursive(boolean recursive) {
            this.recursive = recursive;
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

        public Builder setUpcasters(EventUpcasters upcasters) {
            this.upcasters = upcasters;
            return this;
        }

        /**
         * Default: {@link InMemoryProgressTracker}
         */
        public Builder setProgressTracker(ProgressTracker progressTracker) {
            this.progressTracker = progressTracker;
            return this;
        }

        /**
         * Default: {@link DefaultPartitionKeyResolver} with {@value DefaultPartitionKeyResolver#DEFAULT_PARTITION_COUNT} partitions
         */
        public Builder setPartitionKeyResolver(PartitionKeyResolver partitionKeyResolver) {
            this.partitionKeyResolver = partitionKeyResolver;
            return this;
        }

        /**
         * Default: {@link EventSequenceResolver#perSubject()}
         */
        public Builder setEventSequenceResolver(EventSequenceResolver eventSequenceResolver) {
            this.eventSequenceResolver = eventSequenceResolver;
            return this;
        }

        /**
         * Default: {@link EventHandlingRetryPolicy#defaultPolicy()}
         */
        public Builder setRetryPolicy(EventHandlingRetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        /**
         * The delay before the processing is restarted after a failure outside the event handlers.
         * Default: the {@link EventHandlingRetryPolicy#initialRetryDelay}
         */
        public Builder setLoopRestartDelay(Duration loopRestartDelay) {
            this.loopRestartDelay = loopRestartDelay;
            return this;
        }

        public Builder addEventHandler(EventHandlerDefinition<?> eventHandler) {
            this.eventHandlers.add(requireNonNull(eventHandler, "No eventHandler provided"));
            return this;
        }

        public Builder addEventHandlers(List<? extends EventHandlerDefinition<?>> eventHandlers) {
            requireNonNull(eventHandlers, "No eventHandlers provided").forEach(this::addEventHandler);
            return this;
        }

        public EventHandlingProcessor build() {
            return new EventHandlingProcessor(this);
        }
    }
}
