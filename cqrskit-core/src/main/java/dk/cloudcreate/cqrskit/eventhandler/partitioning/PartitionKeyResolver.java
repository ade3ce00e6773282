package dk.cloudcreate.cqrskit.eventhandler.partitioning;

/**
 * Maps a sequence id (see {@link EventSequenceResolver}) to a partition. Must be deterministic across processes and restarts.
 */
public interface PartitionKeyResolver {
    int resolve(String sequenceId);
}
