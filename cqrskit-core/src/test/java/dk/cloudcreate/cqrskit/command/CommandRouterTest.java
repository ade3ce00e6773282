package dk.cloudcreate.cqrskit.command;

import dk.cloudcreate.cqrskit.command.cache.*;
import dk.cloudcreate.cqrskit.persistence.*;
import dk.cloudcreate.cqrskit.persistence.inmemory.InMemoryEventStoreAdapter;
import dk.cloudcreate.cqrskit.serialization.*;
import dk.cloudcreate.cqrskit.test_data.*;
import dk.cloudcreate.cqrskit.test_data.TaskCommands.*;
import dk.cloudcreate.cqrskit.test_data.TaskEvents.*;
import dk.cloudcreate.cqrskit.types.*;
import dk.cloudcreate.cqrskit.upcaster.*;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.*;

import java.time.*;
import java.util.*;
import java.util.concurrent.*;
import java.util.stream.Collectors;

import static dk.cloudcreate.cqrskit.test_data.TaskCommands.taskSubject;
import static org.assertj.core.api.Assertions.*;

class CommandRouterTest {
    private InMemoryEventStoreAdapter eventStore;
    private CountingEventStoreAdapter countingEventStore;

    @BeforeEach
    void setup() {
        eventStore = new InMemoryEventStoreAdapter();
        countingEventStore = new CountingEventStoreAdapter(eventStore);
    }

    @Test
    void a_command_handler_publishes_events_for_the_command_subject() {
        // Given
        var router = router(new InMemoryStateRebuildingCache());

        // When
        String taskId = router.send(new CreateTask("task-1", "Write docs", "The user guide"));
        router.send(new AssignTask("task-1", "Alice"));

        // Then
        assertThat(taskId).isEqualTo("task-1");
        var events = eventStore.getAllEvents();
        assertThat(events).extracting(rawEvent -> rawEvent.type).containsExactly(TaskEvents.TASK_CREATED, TaskEvents.TASK_ASSIGNED);
        assertThat(events).allSatisfy(rawEvent -> {
            assertThat((CharSequence) rawEvent.subject).isEqualTo(taskSubject("task-1"));
            assertThat(rawEvent.source).isEqualTo("tasks-service");
        });
        assertThat(events.get(1).data.get(JacksonEventDataMarshaller.PAYLOAD_KEY)).asInstanceOf(InstanceOfAssertFactories.MAP)
                                                                                .containsEntry("taskId", "task-1")
                                                                                .containsEntry("assignee", "Alice")
                                                                                .containsKey("assignedAt");
        Task task = router.send(new GetTask("task-1"));
        assertThat(task).isEqualTo(new Task("task-1", "Write docs", "The user guide", "Alice", TaskStatus.TODO));
    }

    @Test
    void a_new_subject_condition_is_violated_when_the_subject_has_events() {
        // Given
        var router = router(new InMemoryStateRebuildingCache());
        router.send(new CreateTask("task-1", "Write docs", ""));

        // When
        assertThatThrownBy(() -> router.send(new CreateTask("task-1", "Write docs again", "")))
                .isInstanceOf(SubjectConditionViolationException.class)
                .hasMessageContaining("already exists");

        // Then
        assertThat(eventStore.getAllEvents()).hasSize(1);
    }

    @Test
    void an_exists_subject_condition_is_violated_when_the_subject_has_no_events() {
        // Given
        var router = router(new InMemoryStateRebuildingCache());

        // When
        assertThatThrownBy(() -> router.send(new AssignTask("task-1", "Alice")))
                .isInstanceOf(SubjectConditionViolationException.class)
                .hasMessageContaining("does not exist");

        // Then
        assertThat(eventStore.getAllEvents()).isEmpty();
    }

    @Test
    void command_handler_exceptions_are_propagated_unchanged_and_nothing_is_published() {
        // Given
        var router = router(new InMemoryStateRebuildingCache());
        router.send(new CreateTask("task-1", "Write docs", ""));

        // When
        assertThatThrownBy(() -> router.send(new StartTask("task-1")))
                .isExactlyInstanceOf(IllegalStateException.class)
                .hasMessage("Task task-1 must be assigned before it can be started");

        // Then
        assertThat(eventStore.getAllEvents()).hasSize(1);
    }

    @Test
    void sending_a_command_without_a_command_handler_fails() {
        var router = router(new NoStateRebuildingCache());

        assertThatThrownBy(() -> router.send(new UnhandledCommand()))
                .isInstanceOf(NoCommandHandlerException.class)
                .hasMessageContaining(UnhandledCommand.class.getName());
    }

    @Test
    void registering_two_command_handlers_for_the_same_command_fails() {
        assertThatThrownBy(() -> CommandRouter.builder()
                                              .setEventStore(eventStore)
                                              .setEventTypeResolver(TaskEvents.eventTypeResolver())
                                              .setEventSource("tasks-service")
                                              .addCommandHandler(TaskHandlers.createTask(Clock.systemUTC()))
                                              .addCommandHandler(TaskHandlers.createTask(Clock.systemUTC()))
                                              .build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void a_created_and_assigned_task_can_be_started_but_not_completed() {
        // Given
        var marshaller = new JacksonEventDataMarshaller();
        eventStore.publishEvents(List.of(new EventToPublish("tasks-service",
                                                            taskSubject("t1"),
                                                            TaskEvents.TASK_CREATED,
                                                            marshaller.serialize(EventData.of(new TaskCreated("t1",
                                                                                                              "Login",
                                                                                                              "desc",
                                                                                                              OffsetDateTime.parse("2024-01-01T00:00:00Z"))))),
                                         new EventToPublish("tasks-service",
                                                            taskSubject("t1"),
                                                            TaskEvents.TASK_ASSIGNED,
                                                            marshaller.serialize(EventData.of(new TaskAssigned("t1",
                                                                                                               "Alice",
                                                                                                               OffsetDateTime.parse("2024-01-01T01:00:00Z")))))),
                                 List.of());
        var router = router(new InMemoryStateRebuildingCache());

        // When
        Task task = router.send(new GetTask("t1"));

        // Then
        assertThat(task.status).isEqualTo(TaskStatus.TODO);
        assertThat(task.assignee).isEqualTo("Alice");
        assertThat(task.title).isEqualTo("Login");

        // When
        assertThatThrownBy(() -> router.send(new CompleteTask("t1")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("must be started");

        // Then
        assertThat(eventStore.getAllEvents()).hasSize(2);

        // When
        router.send(new StartTask("t1"));

        // Then
        var events = eventStore.getAllEvents();
        assertThat(events).hasSize(3);
        var started = events.get(2);
        assertThat(started.type).isEqualTo(TaskEvents.TASK_STARTED);
        assertThat((CharSequence) started.subject).isEqualTo(taskSubject("t1"));
        var startedEvent = marshaller.deserialize(started.data, TaskStarted.class).payload;
        assertThat(startedEvent.taskId).isEqualTo("t1");
        assertThat(startedEvent.startedAt).isNotNull();
        assertThat(((Task) router.send(new GetTask("t1"))).status).isEqualTo(TaskStatus.IN_PROGRESS);
    }

    @Test
    void the_cache_only_replays_events_published_after_the_cached_position() {
        // Given
        var router = router(new InMemoryStateRebuildingCache());
        router.send(new CreateTask("task-1", "Write docs", ""));
        router.send(new AssignTask("task-1", "Alice"));
        countingEventStore.streamOptions.clear();

        // When
        router.send(new StartTask("task-1"));

        // Then
        var lastEventBeforeStart = eventStore.getAllEvents().get(1).id;
        assertThat(countingEventStore.streamOptions).hasSize(1);
        assertThat(countingEventStore.streamOptions.get(0).lowerBound).contains(lastEventBeforeStart);
        assertThat(countingEventStore.streamOptions.get(0).includeLowerBound).isFalse();
    }

    @Test
    void cached_and_uncached_rebuilds_produce_the_same_instance() {
        // Given
        var cachedRouter   = router(new InMemoryStateRebuildingCache());
        var uncachedRouter = router(new NoStateRebuildingCache());
        cachedRouter.send(new CreateTask("task-1", "Write docs", ""));
        Task initial = cachedRouter.send(new GetTask("task-1"));
        cachedRouter.send(new AssignTask("task-1", "Alice"));
        uncachedRouter.send(new StartTask("task-1"));
        cachedRouter.send(new CompleteTask("task-1"));

        // When
        Task cached   = cachedRouter.send(new GetTask("task-1"));
        Task uncached = uncachedRouter.send(new GetTask("task-1"));

        // Then
        assertThat(initial.status).isEqualTo(TaskStatus.TODO);
        assertThat(cached).isEqualTo(uncached);
        assertThat(cached.status).isEqualTo(TaskStatus.COMPLETED);
        assertThat(cached.assignee).isEqualTo("Alice");
    }

    @Test
    void concurrent_commands_for_the_same_subject_rebuild_one_at_a_time() throws Exception {
        // Given
        var router = router(new InMemoryStateRebuildingCache());
        router.send(new CreateTask("task-1", "Write docs", ""));
        var executor = Executors.newFixedThreadPool(8);

        // When
        var futures = new ArrayList<Future<Object>>();
        for (var i = 0; i < 40; i++) {
            var assignee = "user-" + i;
            futures.add(executor.submit(() -> router.send(new AssignTask("task-1", assignee))));
        }
        for (var future : futures) {
            future.get(30, TimeUnit.SECONDS);
        }
        executor.shutdown();

        // Then
        assertThat(countingEventStore.maxConcurrentOpenStreams.get()).isEqualTo(1);
        assertThat(eventStore.getAllEvents()).hasSize(41);
        var lastPayload = (Map<?, ?>) eventStore.getAllEvents().get(40).data.get(JacksonEventDataMarshaller.PAYLOAD_KEY);
        Task task = router.send(new GetTask("task-1"));
        assertThat(task.assignee).isEqualTo(lastPayload.get("assignee"));
    }

    @Test
    void all_events_published_by_a_command_handler_are_published_together_and_applied_in_order() {
        // Given
        var router = CommandRouter.builder()
                                  .setEventStore(eventStore)
                                  .setEventTypeResolver(TaskEvents.eventTypeResolver())
                                  .setEventSource("tasks-service")
                                  .addCommandHandler(CommandHandlerDefinition.forCommand(Task.class,
                                                                                         CreateAndAssignTask.class,
                                                                                         (command, eventPublisher) -> {
                                                                                             eventPublisher.publish(new TaskCreated(command.taskId, "Write docs", "", OffsetDateTime.now()),
                                                                                                                    Map.of(),
                                                                                                                    List.of(Precondition.isSubjectNew(command.getSubject())));
                                                                                             eventPublisher.publish(new TaskAssigned(command.taskId, command.assignee, OffsetDateTime.now()));
                                                                                             return null;
                                                                                         }))
                                  .addCommandHandler(getTaskHandler(SourcingMode.LOCAL))
                                  .addStateRebuildingHandlers(TaskHandlers.stateRebuildingHandlers())
                                  .build();

        // When
        router.send(new CreateAndAssignTask("task-1", "Alice"));

        // Then
        assertThat(eventStore.getAllEvents()).extracting(rawEvent -> rawEvent.type).containsExactly(TaskEvents.TASK_CREATED, TaskEvents.TASK_ASSIGNED);
        Task task = router.send(new GetTask("task-1"));
        assertThat(task.assignee).isEqualTo("Alice");
        assertThatThrownBy(() -> router.send(new CreateAndAssignTask("task-1", "Bob")))
                .isInstanceOf(PreconditionFailedException.class);
        assertThat(eventStore.getAllEvents()).hasSize(2);
    }

    @Test
    void metadata_is_propagated_according_to_the_configured_mode() {
        // Given
        var shallowRouter = router(new NoStateRebuildingCache(), MetadataPropagation.shallow("correlationId"));
        var deepRouter    = router(new NoStateRebuildingCache(), MetadataPropagation.deep());
        var noneRouter    = router(new NoStateRebuildingCache(), MetadataPropagation.none());
        var metadata      = Map.<String, Object>of("correlationId", "c-1", "userId", "u-1");

        // When
        shallowRouter.send(new CreateTask("task-1", "Write docs", ""), metadata);
        deepRouter.send(new CreateTask("task-2", "Write docs", ""), metadata);
        noneRouter.send(new CreateTask("task-3", "Write docs", ""), metadata);

        // Then
        var events = eventStore.getAllEvents();
        assertThat(events.get(0).data).containsEntry("correlationId", "c-1").doesNotContainKey("userId");
        assertThat(events.get(1).data).containsEntry("correlationId", "c-1").containsEntry("userId", "u-1");
        assertThat(events.get(2).data).containsOnlyKeys(JacksonEventDataMarshaller.PAYLOAD_KEY);
    }

    @Test
    void metadata_published_with_an_event_is_stored_with_the_event() {
        // Given
        var router = router(new NoStateRebuildingCache(), MetadataPropagation.deep());
        router.send(new CreateTask("task-1", "Write docs", ""));
        router.send(new AssignTask("task-1", "Alice"));

        // When
        router.send(new StartTask("task-1"), Map.of("userId", "u-1"));

        // Then
        var started = eventStore.getAllEvents().get(2);
        assertThat(started.type).isEqualTo(TaskEvents.TASK_STARTED);
        assertThat(started.data).containsEntry("userId", "u-1");
        assertThat(started.metadata).containsEntry("userId", "u-1");
    }

    @Test
    void upcasters_are_applied_while_rebuilding_state() {
        // Given
        eventStore.publishEvents(List.of(new EventToPublish("legacy-service",
                                                            taskSubject("task-1"),
                                                            "com.example.task-created.v0",
                                                            Map.of(JacksonEventDataMarshaller.PAYLOAD_KEY, Map.of("taskId", "task-1", "name", "Legacy title")))),
                                 List.of());
        var upcaster = new EventUpcaster() {
            @Override
            public boolean canUpcast(RawEvent event) {
                return event.type.equals("com.example.task-created.v0");
            }

            @Override
            @SuppressWarnings("unchecked")
            public List<UpcasterResult> upcast(RawEvent event) {
                var payload = (Map<String, Object>) event.data.get(JacksonEventDataMarshaller.PAYLOAD_KEY);
                return List.of(UpcasterResult.of(TaskEvents.TASK_CREATED,
                                                 Map.of(JacksonEventDataMarshaller.PAYLOAD_KEY,
                                                        Map.of("taskId", payload.get("taskId"), "title", payload.get("name"), "description", ""))));
            }
        };
        var router = CommandRouter.builder()
                                  .setEventStore(eventStore)
                                  .setEventTypeResolver(TaskEvents.eventTypeResolver())
                                  .setEventSource("tasks-service")
                                  .setUpcasters(new EventUpcasters(upcaster))
                                  .addCommandHandlers(TaskHandlers.commandHandlers())
                                  .addCommandHandler(getTaskHandler(SourcingMode.LOCAL))
                                  .addStateRebuildingHandlers(TaskHandlers.stateRebuildingHandlers())
                                  .build();

        // When
        router.send(new AssignTask("task-1", "Alice"));

        // Then
        Task task = router.send(new GetTask("task-1"));
        assertThat(task.title).isEqualTo("Legacy title");
        assertThat(task.assignee).isEqualTo("Alice");
    }

    @Test
    void events_of_unknown_types_are_skipped_while_rebuilding_state() {
        // Given
        var router = router(new InMemoryStateRebuildingCache());
        router.send(new CreateTask("task-1", "Write docs", ""));
        eventStore.publishEvents(List.of(new EventToPublish("other-service",
                                                            taskSubject("task-1"),
                                                            "com.example.task-labelled.v1",
                                                            Map.of(JacksonEventDataMarshaller.PAYLOAD_KEY, Map.of("label", "docs")))),
                                 List.of());

        // When
        router.send(new AssignTask("task-1", "Alice"));

        // Then
        Task task = router.send(new GetTask("task-1"));
        assertThat(task.assignee).isEqualTo("Alice");
        assertThat(eventStore.getAllEvents()).hasSize(3);
    }

    @Test
    void recursive_sourcing_includes_the_events_of_descendant_subjects() {
        // Given
        var router = CommandRouter.builder()
                                  .setEventStore(eventStore)
                                  .setEventTypeResolver(TaskEvents.eventTypeResolver())
                                  .setEventSource("tasks-service")
                                  .setCache(new InMemoryStateRebuildingCache())
                                  .addCommandHandlers(TaskHandlers.commandHandlers())
                                  .addCommandHandler(countTasksHandler(CountTasks.class, SourcingMode.RECURSIVE))
                                  .addCommandHandler(countTasksHandler(CountTasksLocally.class, SourcingMode.LOCAL))
                                  .addStateRebuildingHandler(StateRebuildingHandlerDefinition.fromObjectAndMetadataAndSubject(TaskCount.class,
                                                                                                                              TaskCreated.class,
                                                                                                                              (count, event, metadata, subject) -> count == null ?
                                                                                                                                                                   new TaskCount(1) :
                                                                                                                                                                   new TaskCount(count.count + 1)))
                                  .build();
        router.send(new CreateTask("task-1", "Write docs", ""));
        router.send(new CreateTask("task-2", "Review docs", ""));

        // When
        Integer recursiveCount = router.send(new CountTasks());
        Integer localCount     = router.send(new CountTasksLocally());
        router.send(new CreateTask("task-3", "Publish docs", ""));
        Integer updatedCount = router.send(new CountTasks());

        // Then
        assertThat(recursiveCount).isEqualTo(2);
        assertThat(localCount).isEqualTo(0);
        assertThat(updatedCount).isEqualTo(3);
    }

    @Test
    void without_sourcing_the_command_handler_receives_no_instance() {
        // Given
        var router = CommandRouter.builder()
                                  .setEventStore(countingEventStore)
                                  .setEventTypeResolver(TaskEvents.eventTypeResolver())
                                  .setEventSource("tasks-service")
                                  .addCommandHandlers(TaskHandlers.commandHandlers())
                                  .addCommandHandler(getTaskHandler(SourcingMode.NONE))
                                  .addStateRebuildingHandlers(TaskHandlers.stateRebuildingHandlers())
                                  .build();
        router.send(new CreateTask("task-1", "Write docs", ""));
        countingEventStore.streamOptions.clear();

        // When
        Task task = router.send(new GetTask("task-1"));

        // Then
        assertThat(task).isNull();
        assertThat(countingEventStore.streamOptions).isEmpty();
    }

    private CommandRouter router(StateRebuildingCache cache) {
        return router(cache, MetadataPropagation.none());
    }

    private CommandRouter router(StateRebuildingCache cache, MetadataPropagation metadataPropagation) {
        return CommandRouter.builder()
                            .setEventStore(countingEventStore)
                            .setEventTypeResolver(TaskEvents.eventTypeResolver())
                            .setEventSource("tasks-service")
                            .setCache(cache)
                            .setMetadataPropagation(metadataPropagation)
                            .addCommandHandlers(TaskHandlers.commandHandlers())
                            .addCommandHandler(getTaskHandler(SourcingMode.LOCAL))
                            .addStateRebuildingHandlers(TaskHandlers.stateRebuildingHandlers())
                            .build();
    }

    private static CommandHandlerDefinition<Task, GetTask, Task> getTaskHandler(SourcingMode sourcingMode) {
        return CommandHandlerDefinition.forInstanceAndCommand(Task.class,
                                                              GetTask.class,
                                                              sourcingMode,
                                                              (task, command, eventPublisher) -> task);
    }

    private static <COMMAND extends Command> CommandHandlerDefinition<TaskCount, COMMAND, Integer> countTasksHandler(Class<COMMAND> commandClass, SourcingMode sourcingMode) {
        return CommandHandlerDefinition.forInstanceAndCommand(TaskCount.class,
                                                              commandClass,
                                                              sourcingMode,
                                                              (count, command, eventPublisher) -> count == null ? 0 : count.count);
    }

    private static class GetTask implements Command {
        private final String taskId;

        private GetTask(String taskId) {
            this.taskId = taskId;
        }

        @Override
        public Subject getSubject() {
            return taskSubject(taskId);
        }
    }

    private static class CreateAndAssignTask implements Command {
        private final String taskId;
        private final String assignee;

        private CreateAndAssignTask(String taskId, String assignee) {
            this.taskId = taskId;
            this.assignee = assignee;
        }

        @Override
        public Subject getSubject() {
            return taskSubject(taskId);
        }
    }

    private static class CountTasks implements Command {
        @Override
        public Subject getSubject() {
            return Subject.of("/task");
        }
    }

    private static class CountTasksLocally implements Command {
        @Override
        public Subject getSubject() {
            return Subject.of("/task");
        }
    }

    private static class UnhandledCommand implements Command {
        @Override
        public Subject getSubject() {
            return Subject.of("/unhandled");
        }
    }

    private static class TaskCount {
        private final int count;

        private TaskCount(int count) {
            this.count = count;
        }
    }
}
