package dk.cloudcreate.cqrskit.command;

import dk.cloudcreate.cqrskit.types.Subject;

/**
 * A request to change the state of the entity identified by {@link #getSubject()}.<br>
 * Commands are routed by their runtime class, see {@link CommandRouter}.
 */
public interface Command {
    /**
     * @return the subject the command targets, e.g. <code>/task/42</code>
     */
    Subject getSubject();

    /**
     * @return the condition the subject must fulfill before the command handler is invoked
     */
    default SubjectCondition getSubjectCondition() {
        return SubjectCondition.NONE;
    }
}
