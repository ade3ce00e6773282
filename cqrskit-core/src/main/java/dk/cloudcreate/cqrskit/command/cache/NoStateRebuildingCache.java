package dk.cloudcreate.cqrskit.command.cache;

import java.util.Optional;
import java.util.function.Function;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * {@link StateRebuildingCache} that doesn't cache anything, i.e. every instance is rebuilt from the first event
 */
public class NoStateRebuildingCache implements StateRebuildingCache {
    @Override
    public CacheValue fetchAndMerge(CacheKey key, Function<Optional<CacheValue>, CacheValue> merge) {
        requireNonNull(key, "No key provided");
        return requireNonNull(merge, "No merge function provided").apply(Optional.empty());
    }
}
