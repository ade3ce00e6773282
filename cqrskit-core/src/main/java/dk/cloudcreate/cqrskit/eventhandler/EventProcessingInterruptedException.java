package dk.cloudcreate.cqrskit.eventhandler;

/**
 * Thrown on the processing thread of an {@link EventHandlingProcessor} when it's interrupted while handling an event.
 * The processor restarts from the last stored progress, so the event is handled again
 */
public class EventProcessingInterruptedException extends RuntimeException {
    public EventProcessingInterruptedException(String message, InterruptedException cause) {
        super(message, cause);
    }
}
