package dk.cloudcreate.cqrskit.command;

/**
 * Controls which events are replayed to rebuild the instance a command handler works on
 */
public enum SourcingMode {
    /**
     * Nothing is replayed, the command handler receives a <code>null</code> instance
     */
    NONE,
    /**
     * Only the events of the command's exact subject are replayed
     */
    LOCAL,
    /**
     * The events of the command's subject and all its descendant subjects are replayed
     */
    RECURSIVE
}
