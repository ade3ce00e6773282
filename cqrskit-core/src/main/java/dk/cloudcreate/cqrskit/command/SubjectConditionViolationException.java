package dk.cloudcreate.cqrskit.command;

import dk.cloudcreate.cqrskit.types.Subject;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Thrown when the {@link Command#getSubjectCondition()} isn't fulfilled. The command handler hasn't been invoked.
 */
public class SubjectConditionViolationException extends CommandRoutingException {
    public final Subject          subject;
    public final SubjectCondition condition;

    public SubjectConditionViolationException(Subject subject, SubjectCondition condition) {
        super(condition == SubjectCondition.NEW ?
              msg("Subject '{}' already exists", subject) :
              msg("Subject '{}' does not exist", subject));
        this.subject = subject;
        this.condition = condition;
    }
}
