package dk.cloudcreate.cqrskit.command;

import java.util.Map;

/**
 * The supported command handler shapes. Which shape a handler has is decided by the
 * {@link CommandHandlerDefinition} factory method used to register it.<br>
 * A command handler signals a violated business rule by throwing an exception, which is propagated unchanged to the
 * caller of {@link CommandRouter#send(Command)}.
 */
public interface CommandHandler {
    /**
     * Handler that only needs the command, e.g. for commands that create a new instance
     */
    @FunctionalInterface
    interface ForCommand<INSTANCE, COMMAND extends Command, RESULT> extends CommandHandler {
        RESULT handle(COMMAND command, CommandEventPublisher<INSTANCE> eventPublisher);
    }

    /**
     * Handler that needs the rebuilt instance (which is <code>null</code> if no events have been rebuilt)
     */
    @FunctionalInterface
    interface ForInstanceAndCommand<INSTANCE, COMMAND extends Command, RESULT> extends CommandHandler {
        RESULT handle(INSTANCE instance, COMMAND command, CommandEventPublisher<INSTANCE> eventPublisher);
    }

    /**
     * Handler that needs the rebuilt instance and the metadata the command was sent with
     */
    @FunctionalInterface
    interface ForInstanceAndCommandAndMetadata<INSTANCE, COMMAND extends Command, RESULT> extends CommandHandler {
        RESULT handle(INSTANCE instance, COMMAND command, Map<String, Object> metadata, CommandEventPublisher<INSTANCE> eventPublisher);
    }
}
