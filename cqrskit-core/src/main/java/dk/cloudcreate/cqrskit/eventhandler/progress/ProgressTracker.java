package dk.cloudcreate.cqrskit.eventhandler.progress;

import java.util.function.Function;

/**
 * Stores the processing {@link Progress} per (group, partition)
 */
public interface ProgressTracker {
    /**
     * @return the current progress or {@link Progress#beginning()} if nothing has been processed
     */
    Progress current(String group, int partition);

    /**
     * Atomically replace the progress. The new progress must be stored durably before this method returns.
     *
     * @param computeNext receives the current progress and returns the new progress
     */
    void proceed(String group, int partition, Function<Progress, Progress> computeNext);
}
