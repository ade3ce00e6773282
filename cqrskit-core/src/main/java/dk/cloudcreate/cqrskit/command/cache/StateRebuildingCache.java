package dk.cloudcreate.cqrskit.command.cache;

import java.util.Optional;
import java.util.function.Function;

/**
 * Cache of rebuilt instances used by the {@link dk.cloudcreate.cqrskit.command.CommandRouter}
 */
public interface StateRebuildingCache {
    /**
     * Fetch the cached value for the key (if any), let <code>merge</code> bring it up to date and store the result.<br>
     * Implementations must guarantee that, for the same key, at most one <code>merge</code> runs at a time.
     *
     * @param key   the cache key
     * @param merge receives the currently cached value (empty if not cached) and returns the updated value
     * @return the value returned by <code>merge</code>
     */
    CacheValue fetchAndMerge(CacheKey key, Function<Optional<CacheValue>, CacheValue> merge);
}
