package dk.cloudcreate.cqrskit.test_data;

import dk.cloudcreate.cqrskit.eventhandler.EventHandlerDefinition;
import dk.cloudcreate.cqrskit.test_data.TaskEvents.*;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Read model with one entry per task, maintained by the event handlers of the {@value #GROUP} group
 */
public class TaskListProjector {
    public static final String GROUP = "task-list";

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();

    public List<EventHandlerDefinition<?>> eventHandlers() {
        return List.of(EventHandlerDefinition.forObject(GROUP,
                                                        TaskCreated.class,
                                                        event -> entries.put(event.taskId, new Entry(event.taskId, event.title, null, "TODO", null))),
                       EventHandlerDefinition.forObjectAndMetadata(GROUP,
                                                                   TaskAssigned.class,
                                                                   (event, metadata) -> entries.computeIfPresent(event.taskId,
                                                                                                                 (taskId, entry) -> new Entry(taskId, entry.title, event.assignee, entry.status, entry.lastEventId))),
                       EventHandlerDefinition.forObjectAndMetadataAndRawEvent(GROUP,
                                                                              TaskStarted.class,
                                                                              (event, metadata, rawEvent) -> entries.computeIfPresent(event.taskId,
                                                                                                                                      (taskId, entry) -> new Entry(taskId, entry.title, entry.assignee, "IN_PROGRESS", rawEvent.id.toString()))),
                       EventHandlerDefinition.forObjectAndMetadataAndRawEvent(GROUP,
                                                                              TaskCompleted.class,
                                                                              (event, metadata, rawEvent) -> entries.computeIfPresent(event.taskId,
                                                                                                                                      (taskId, entry) -> new Entry(taskId, entry.title, entry.assignee, "COMPLETED", rawEvent.id.toString()))));
    }

    public Optional<Entry> get(String taskId) {
        return Optional.ofNullable(entries.get(taskId));
    }

    public int size() {
        return entries.size();
    }

    public static class Entry {
        public final String taskId;
        public final String title;
        public final String assignee;
        public final String status;
        public final String lastEventId;

        public Entry(String taskId, String title, String assignee, String status, String lastEventId) {
            this.taskId = taskId;
            this.title = title;
            this.assignee = assignee;
            this.status = status;
            this.lastEventId = lastEventId;
        }

        @Override
        public String toString() {
            return "Entry{" +
                    "taskId='" + taskId + '\'' +
                    ", assignee='" + assignee + '\'' +
                    ", status='" + status + '\'' +
                    '}';
        }
    }
}
