package dk.cloudcreate.cqrskit.eventhandler.partitioning;

import static dk.cloudcreate.essentials.shared.FailFast.*;

/**
 * Hash based {@link PartitionKeyResolver}: <code>|hash(sequenceId)| mod partitionCount</code>, where the hash is the 32 bit
 * rolling hash <code>h = 31 * h + c</code> over the UTF-16 code units of the sequence id ({@link String#hashCode()}).
 * The absolute value is computed in 64 bit, so {@link Integer#MIN_VALUE} doesn't overflow.
 */
public class DefaultPartitionKeyResolver implements PartitionKeyResolver {
    public static final int DEFAULT_PARTITION_COUNT = 10;

    private final int partitionCount;

    public DefaultPartitionKeyResolver() {
        this(DEFAULT_PARTITION_COUNT);
    }

    public DefaultPartitionKeyResolver(int partitionCount) {
        requireTrue(partitionCount > 0, "partitionCount must be larger than 0");
        this.partitionCount = partitionCount;
    }

    @Override
    public int resolve(String sequenceId) {
        requireNonNull(sequenceId, "No sequenceId provided");
        return (int) (Math.abs((long) sequenceId.hashCode()) % partitionCount);
    }

    public int getPartitionCount() {
        return partitionCount;
    }
}
