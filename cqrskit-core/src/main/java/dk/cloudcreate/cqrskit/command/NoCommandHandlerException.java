package dk.cloudcreate.cqrskit.command;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

public class NoCommandHandlerException extends CommandRoutingException {
    public final Class<?> commandClass;

    public NoCommandHandlerException(Class<?> commandClass) {
        super(msg("No command handler registered for command '{}'", commandClass.getName()));
        this.commandClass = commandClass;
    }
}
