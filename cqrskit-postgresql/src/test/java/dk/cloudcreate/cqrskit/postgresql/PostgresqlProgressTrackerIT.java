package dk.cloudcreate.cqrskit.postgresql;

import dk.cloudcreate.cqrskit.eventhandler.progress.Progress;
import dk.cloudcreate.cqrskit.types.EventId;
import org.jdbi.v3.core.Jdbi;
import org.junit.jupiter.api.*;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.*;

import java.util.*;
import java.util.concurrent.*;

import static org.assertj.core.api.Assertions.*;

@Testcontainers
class PostgresqlProgressTrackerIT {
    @Container
    private final PostgreSQLContainer<?> postgreSQLContainer = new PostgreSQLContainer<>("postgres:latest")
            .withDatabaseName("event-store")
            .withUsername("test-user")
            .withPassword("secret-password");

    private Jdbi                      jdbi;
    private PostgresqlProgressTracker progressTracker;

    @BeforeEach
    void setup() {
        jdbi = Jdbi.create(postgreSQLContainer.getJdbcUrl(),
                           postgreSQLContainer.getUsername(),
                           postgreSQLContainer.getPassword());
        progressTracker = new PostgresqlProgressTracker(jdbi);
    }

    @Test
    void unknown_group_and_partition_starts_at_the_beginning() {
        assertThat(progressTracker.current("task-list", 0)).isEqualTo(Progress.beginning());
    }

    @Test
    void progress_is_stored_per_group_and_partition() {
        // When
        progressTracker.proceed("task-list", 0, current -> Progress.at(EventId.of("a")));
        progressTracker.proceed("task-list", 1, current -> Progress.at(EventId.of("b")));
        progressTracker.proceed("task-list", 0, current -> {
            assertThat(current).isEqualTo(Progress.at(EventId.of("a")));
            return Progress.at(EventId.of("c"));
        });

        // Then
        assertThat(progressTracker.current("task-list", 0)).isEqualTo(Progress.at(EventId.of("c")));
        assertThat(progressTracker.current("task-list", 1)).isEqualTo(Progress.at(EventId.of("b")));
        assertThat(progressTracker.current("notifications", 0)).isEqualTo(Progress.beginning());
    }

    @Test
    void progress_survives_a_new_tracker_instance() {
        // Given
        progressTracker.proceed("task-list", 3, current -> Progress.at(EventId.of("42")));

        // When
        var newTracker = new PostgresqlProgressTracker(jdbi, Optional.of(PostgresqlProgressTracker.DEFAULT_PROGRESS_TABLE_NAME));

        // Then
        assertThat(newTracker.current("task-list", 3)).isEqualTo(Progress.at(EventId.of("42")));
    }

    @Test
    void concurrent_updates_of_the_same_partition_are_serialized() throws Exception {
        // Given
        progressTracker.proceed("counter", 0, current -> Progress.at(EventId.of("0")));
        var executor = Executors.newFixedThreadPool(4);

        // When
        var futures = new ArrayList<Future<?>>();
        for (var i = 0; i < 20; i++) {
            futures.add(executor.submit(() -> progressTracker.proceed("counter", 0, current -> {
                var value = Integer.parseInt(current.lastProcessedEventId.orElseThrow().toString());
                return Progress.at(EventId.of(String.valueOf(value + 1)));
            })));
        }
        for (var future : futures) {
            future.get(30, TimeUnit.SECONDS);
        }
        executor.shutdown();

        // Then
        assertThat(progressTracker.current("counter", 0)).isEqualTo(Progress.at(EventId.of("20")));
    }
}
