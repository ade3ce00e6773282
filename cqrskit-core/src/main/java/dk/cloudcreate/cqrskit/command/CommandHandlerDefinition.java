package dk.cloudcreate.cqrskit.command;

import java.util.Map;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Registration of a command handler for a given command class.<br>
 * The factory method used decides the {@link Kind} of handler, which controls the arguments the handler is called with:
 * <pre>{@code
 * CommandHandlerDefinition.forInstanceAndCommand(Task.class,
 *                                                AssignTask.class,
 *                                                (task, command, publisher) -> {
 *                                                    publisher.publish(new TaskAssigned(command.taskId, command.assignee, OffsetDateTime.now(clock)));
 *                                                    return null;
 *                                                });
 * }</pre>
 *
 * @param <INSTANCE> the type of instance rebuilt for the command handler
 * @param <COMMAND>  the command type
 * @param <RESULT>   the result type returned by the command handler
 */
public final class CommandHandlerDefinition<INSTANCE, COMMAND extends Command, RESULT> {
    public enum Kind {
        FOR_COMMAND,
        FOR_INSTANCE_AND_COMMAND,
        FOR_INSTANCE_AND_COMMAND_AND_METADATA
    }

    public final Class<INSTANCE> instanceClass;
    public final Class<COMMAND>  commandClass;
    public final SourcingMode    sourcingMode;
    public final Kind            kind;
    private final CommandHandler handler;

    private CommandHandlerDefinition(Class<INSTANCE> instanceClass,
                                     Class<COMMAND> commandClass,
                                     SourcingMode sourcingMode,
                                     Kind kind,
                                     CommandHandler handler) {
        this.instanceClass = requireNonNull(instanceClass, "No instanceClass provided");
        this.commandClass = requireNonNull(commandClass, "No commandClass provided");
        this.sourcingMode = requireNonNull(sourcingMode, "No sourcingMode provided");
        this.kind = requireNonNull(kind, "No kind provided");
        this.handler = requireNonNull(handler, "No handler provided");
    }

    public static <INSTANCE, COMMAND extends Command, RESULT> CommandHandlerDefinition<INSTANCE, COMMAND, RESULT> forCommand(Class<INSTANCE> instanceClass,
                                                                                                                            Class<COMMAND> commandClass,
                                                                                                                            CommandHandler.ForCommand<INSTANCE, COMMAND, RESULT> handler) {
        return forCommand(instanceClass, commandClass, SourcingMode.LOCAL, handler);
    }

    public static <INSTANCE, COMMAND extends Command, RESULT> CommandHandlerDefinition<INSTANCE, COMMAND, RESULT> forCommand(Class<INSTANCE> instanceClass,
                                                                                                                            Class<COMMAND> commandClass,
                                                                                                                            SourcingMode sourcingMode,
                                                                                                                            CommandHandler.ForCommand<INSTANCE, COMMAND, RESULT> handler) {
        return new CommandHandlerDefinition<>(instanceClass, commandClass, sourcingMode, Kind.FOR_COMMAND, handler);
    }

    public static <INSTANCE, COMMAND extends Command, RESULT> CommandHandlerDefinition<INSTANCE, COMMAND, RESULT> forInstanceAndCommand(Class<INSTANCE> instanceClass,
                                                                                                                                       Class<COMMAND> commandClass,
                                                                                                                                       CommandHandler.ForInstanceAndCommand<INSTANCE, COMMAND, RESULT> handler) {
        return forInstanceAndCommand(instanceClass, commandClass, SourcingMode.LOCAL, handler);
    }

    public static <INSTANCE, COMMAND extends Command, RESULT> CommandHandlerDefinition<INSTANCE, COMMAND, RESULT> forInstanceAndCommand(Class<INSTANCE> instanceClass,
                                                                                                                                       Class<COMMAND> commandClass,
                                                                                                                                       SourcingMode sourcingMode,
                                                                                                                                       CommandHandler.ForInstanceAndCommand<INSTANCE, COMMAND, RESULT> handler) {
        return new CommandHandlerDefinition<>(instanceClass, commandClass, sourcingMode, Kind.FOR_INSTANCE_AND_COMMAND, handler);
    }

    public static <INSTANCE, COMMAND extends Command, RESULT> CommandHandlerDefinition<INSTANCE, COMMAND, RESULT> forInstanceAndCommandAndMetadata(Class<INSTANCE> instanceClass,
                                                                                                                                                  Class<COMMAND> commandClass,
                                                                                                                                                  CommandHandler.ForInstanceAndCommandAndMetadata<INSTANCE, COMMAND, RESULT> handler) {
        return forInstanceAndCommandAndMetadata(instanceClass, commandClass, SourcingMode.LOCAL, handler);
    }

    public static <INSTANCE, COMMAND extends Command, RESULT> CommandHandlerDefinition<INSTANCE, COMMAND, RESULT> forInstanceAndCommandAndMetadata(Class<INSTANCE> instanceClass,
                                                                                                                                                  Class<COMMAND> commandClass,
                                                                                                                                                  SourcingMode sourcingMode,
                                                                                                                                                  CommandHandler.ForInstanceAndCommandAndMetadata<INSTANCE, COMMAND, RESULT> handler) {
        return new CommandHandlerDefinition<>(instanceClass, commandClass, sourcingMode, Kind.FOR_INSTANCE_AND_COMMAND_AND_METADATA, handler);
    }

    /**
     * Invoke the command handler with the arguments its {@link Kind} requires
     */
    @SuppressWarnings("unchecked")
    public RESULT handle(INSTANCE instance, COMMAND command, Map<String, Object> metadata, CommandEventPublisher<INSTANCE> eventPublisher) {
        switch (kind) {
            case FOR_COMMAND:
                return ((CommandHandler.ForCommand<INSTANCE, COMMAND, RESULT>) handler).handle(command, eventPublisher);
            case FOR_INSTANCE_AND_COMMAND:
                return ((CommandHandler.ForInstanceAndCommand<INSTANCE, COMMAND, RESULT>) handler).handle(instance, command, eventPublisher);
            case FOR_INSTANCE_AND_COMMAND_AND_METADATA:
                return ((CommandHandler.ForInstanceAndCommandAndMetadata<INSTANCE, COMMAND, RESULT>) handler).handle(instance, command, metadata, eventPublisher);
            default:
                throw new IllegalStateException("Unsupported command handler kind " + kind);
        }
    }

    @Override
    public String toString() {
        return "CommandHandlerDefinition{" +
                "instanceClass=" + instanceClass.getName() +
                ", commandClass=" + commandClass.getName() +
                ", sourcingMode=" + sourcingMode +
                ", kind=" + kind +
                '}';
    }
}
