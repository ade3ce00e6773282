package dk.cloudcreate.cqrskit.command.cache;

import dk.cloudcreate.cqrskit.command.SourcingMode;
import dk.cloudcreate.cqrskit.types.*;
import org.junit.jupiter.api.Test;

import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class InMemoryStateRebuildingCacheTest {
    @Test
    void the_merge_function_receives_the_previously_cached_value() {
        // Given
        var cache = new InMemoryStateRebuildingCache();
        var key   = key("/task/1");
        cache.fetchAndMerge(key, cached -> value("1", "first"));

        // When
        var merged = cache.fetchAndMerge(key, cached -> {
            assertThat(cached).isPresent();
            assertThat(cached.get().instance).isEqualTo("first");
            return value("2", cached.get().instance + "+second");
        });

        // Then
        assertThat(merged.instance).isEqualTo("first+second");
        assertThat(cache.get(key)).hasValueSatisfying(value -> assertThat(value.eventId).contains(EventId.of("2")));
    }

    @Test
    void keys_differ_by_instance_class_and_sourcing_mode() {
        // Given
        var cache = new InMemoryStateRebuildingCache();

        // When
        cache.fetchAndMerge(new CacheKey(Subject.of("/task/1"), String.class, SourcingMode.LOCAL), cached -> value("1", "local"));
        cache.fetchAndMerge(new CacheKey(Subject.of("/task/1"), String.class, SourcingMode.RECURSIVE), cached -> value("1", "recursive"));
        cache.fetchAndMerge(new CacheKey(Subject.of("/task/1"), Integer.class, SourcingMode.LOCAL), cached -> value("1", 1));

        // Then
        assertThat(cache.size()).isEqualTo(3);
    }

    @Test
    void the_least_recently_used_entry_is_evicted_when_the_capacity_is_exceeded() {
        // Given
        var cache = new InMemoryStateRebuildingCache(2);
        cache.fetchAndMerge(key("/task/1"), cached -> value("1", "one"));
        cache.fetchAndMerge(key("/task/2"), cached -> value("2", "two"));
        cache.get(key("/task/1"));

        // When
        cache.fetchAndMerge(key("/task/3"), cached -> value("3", "three"));

        // Then
        assertThat(cache.size()).isEqualTo(2);
        assertThat(cache.get(key("/task/1"))).isPresent();
        assertThat(cache.get(key("/task/2"))).isEmpty();
        assertThat(cache.get(key("/task/3"))).isPresent();
    }

    @Test
    void merges_for_the_same_key_are_serialized() throws Exception {
        // Given
        var cache               = new InMemoryStateRebuildingCache();
        var key                 = key("/task/1");
        var concurrentMerges    = new AtomicInteger();
        var maxConcurrentMerges = new AtomicInteger();
        var executor            = Executors.newFixedThreadPool(8);

        // When
        var futures = new ArrayList<Future<CacheValue>>();
        for (var i = 0; i < 50; i++) {
            futures.add(executor.submit(() -> cache.fetchAndMerge(key, cached -> {
                var current = concurrentMerges.incrementAndGet();
                maxConcurrentMerges.accumulateAndGet(current, Math::max);
                try {
                    Thread.sleep(2);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                concurrentMerges.decrementAndGet();
                var count = cached.map(value -> (Integer) value.instance).orElse(0);
                return new CacheValue(Optional.of(EventId.of(String.valueOf(count + 1))), count + 1, Map.of());
            })));
        }
        for (var future : futures) {
            future.get(10, TimeUnit.SECONDS);
        }
        executor.shutdown();

        // Then
        assertThat(maxConcurrentMerges.get()).isEqualTo(1);
        assertThat(cache.get(key)).hasValueSatisfying(value -> assertThat(value.instance).isEqualTo(50));
    }

    @Test
    void no_state_rebuilding_cache_always_merges_from_an_empty_value() {
        var cache = new NoStateRebuildingCache();
        var key   = key("/task/1");
        cache.fetchAndMerge(key, cached -> value("1", "first"));

        cache.fetchAndMerge(key, cached -> {
            assertThat(cached).isEmpty();
            return value("2", "second");
        });
    }

    private static CacheKey key(String subject) {
        return new CacheKey(Subject.of(subject), String.class, SourcingMode.LOCAL);
    }

    private static CacheValue value(String eventId, Object instance) {
        return new CacheValue(Optional.of(EventId.of(eventId)), instance, Map.of(Subject.of("/task/1"), EventId.of(eventId)));
    }
}
