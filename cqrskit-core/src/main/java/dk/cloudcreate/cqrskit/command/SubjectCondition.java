package dk.cloudcreate.cqrskit.command;

public enum SubjectCondition {
    /**
     * No check
     */
    NONE,
    /**
     * The subject must not have any (rebuilt) events
     */
    NEW,
    /**
     * The subject must have at least one (rebuilt) event
     */
    EXISTS
}
