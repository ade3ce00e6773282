package dk.cloudcreate.cqrskit.command.cache;

import org.slf4j.*;

import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

import static dk.cloudcreate.essentials.shared.FailFast.*;

/**
 * Bounded, least recently used, in memory {@link StateRebuildingCache}.<br>
 * Merges for the same {@link CacheKey} are serialized using a per key lock, while merges for different keys run in parallel.
 * The lock for a key only exists while threads are merging or waiting to merge that key.
 */
public class InMemoryStateRebuildingCache implements StateRebuildingCache {
    private static final Logger log              = LoggerFactory.getLogger(InMemoryStateRebuildingCache.class);
    public static final  int    DEFAULT_CAPACITY = 1000;

    private final int                                       capacity;
    private final Map<CacheKey, CacheValue>                 values;
    private final ConcurrentMap<CacheKey, ReentrantLock>    locks = new ConcurrentHashMap<>();

    public InMemoryStateRebuildingCache() {
        this(DEFAULT_CAPACITY);
    }

    public InMemoryStateRebuildingCache(int capacity) {
        requireTrue(capacity > 0, "capacity must be larger than 0");
        this.capacity = capacity;
        this.values = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<CacheKey, CacheValue> eldest) {
                var evict = size() > InMemoryStateRebuildingCache.this.capacity;
                if (evict) {
                    log.trace("Evicting '{}'", eldest.getKey());
                }
                return evict;
            }
        };
    }

    @Override
    public CacheValue fetchAndMerge(CacheKey key, Function<Optional<CacheValue>, CacheValue> merge) {
        requireNonNull(key, "No key provided");
        requireNonNull(merge, "No merge function provided");
        var lock = acquireLock(key);
        try {
            Optional<CacheValue> cached;
            synchronized (values) {
                cached = Optional.ofNullable(values.get(key));
            }
            log.trace("Merging '{}' - cached: {}", key, cached.isPresent());
            var merged = requireNonNull(merge.apply(cached), "The merge function returned null");
            synchronized (values) {
                values.put(key, merged);
            }
            return merged;
        } finally {
            releaseLock(key, lock);
        }
    }

    public int size() {
        synchronized (values) {
            return values.size();
        }
    }

    public Optional<CacheValue> get(CacheKey key) {
        synchronized (values) {
            return Optional.ofNullable(values.get(key));
        }
    }

    public void clear() {
        synchronized (values) {
            values.clear();
        }
    }

    private ReentrantLock acquireLock(CacheKey key) {
        while (true) {
            var lock = locks.computeIfAbsent(key, k -> new ReentrantLock());
            lock.lock();
            if (locks.get(key) == lock) {
                return lock;
            }
            // The previous holder released and removed the lock before we got it
            lock.unlock();
        }
    }

    private void releaseLock(CacheKey key, ReentrantLock lock) {
        if (!lock.hasQueuedThreads() && lock.getHoldCount() == 1) {
            locks.remove(key, lock);
        }
        lock.unlock();
    }
}
