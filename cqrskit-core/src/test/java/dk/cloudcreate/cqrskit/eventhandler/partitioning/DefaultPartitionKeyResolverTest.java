package dk.cloudcreate.cqrskit.eventhandler.partitioning;

import org.junit.jupiter.api.Test;

import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.*;

class DefaultPartitionKeyResolverTest {
    @Test
    void the_partition_is_the_absolute_hash_modulo_the_partition_count() {
        var resolver = new DefaultPartitionKeyResolver(10);

        assertThat(resolver.resolve("")).isEqualTo(0);
        assertThat(resolver.resolve("a")).isEqualTo(97 % 10);
        assertThat(resolver.resolve("/task/1")).isEqualTo((int) (Math.abs((long) "/task/1".hashCode()) % 10));
    }

    @Test
    void the_same_sequence_id_always_maps_to_the_same_partition() {
        var resolver = new DefaultPartitionKeyResolver();

        assertThat(resolver.resolve("/task/42")).isEqualTo(resolver.resolve("/task/42"));
        assertThat(resolver.getPartitionCount()).isEqualTo(DefaultPartitionKeyResolver.DEFAULT_PARTITION_COUNT);
    }

    @Test
    void negative_hashes_map_to_a_valid_partition() {
        // "polygenelubricants".hashCode() == Integer.MIN_VALUE
        assertThat("polygenelubricants".hashCode()).isEqualTo(Integer.MIN_VALUE);
        var resolver = new DefaultPartitionKeyResolver(7);

        assertThat(resolver.resolve("polygenelubricants")).isEqualTo((int) (2147483648L % 7));
        IntStream.range(0, 1000)
                 .mapToObj(i -> "/subject/" + i)
                 .forEach(sequenceId -> assertThat(resolver.resolve(sequenceId)).isBetween(0, 6));
    }

    @Test
    void the_partition_count_must_be_positive() {
        assertThatThrownBy(() -> new DefaultPartitionKeyResolver(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
