package dk.cloudcreate.cqrskit.eventhandler.progress;

import java.util.concurrent.*;
import java.util.function.Function;

import static dk.cloudcreate.essentials.shared.FailFast.*;

/**
 * Non durable {@link ProgressTracker} for tests and single process deployments that can replay from the beginning after a restart
 */
public class InMemoryProgressTracker implements ProgressTracker {
    private final ConcurrentMap<String, Progress> progress = new ConcurrentHashMap<>();

    @Override
    public Progress current(String group, int partition) {
        return progress.getOrDefault(key(group, partition), Progress.beginning());
    }

    @Override
    public void proceed(String group, int partition, Function<Progress, Progress> computeNext) {
        requireNonNull(computeNext, "No computeNext function provided");
        progress.compute(key(group, partition),
                         (key, current) -> requireNonNull(computeNext.apply(current != null ? current : Progress.beginning()),
                                                          "computeNext returned null"));
    }

    private static String key(String group, int partition) {
        requireNonNull(group, "No group provided");
        return group + ":" + partition;
    }
}
