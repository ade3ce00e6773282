package dk.cloudcreate.cqrskit.postgresql;

import dk.cloudcreate.cqrskit.eventhandler.progress.*;
import dk.cloudcreate.cqrskit.types.EventId;
import org.jdbi.v3.core.*;
import org.slf4j.*;

import java.time.*;
import java.util.*;
import java.util.function.Function;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Durable, Postgresql based, {@link ProgressTracker} using Jdbi.<br>
 * The progress of every (group, partition) is stored as a row in the progress table (default {@value #DEFAULT_PROGRESS_TABLE_NAME}).
 * {@link #proceed(String, int, Function)} locks the row (<code>SELECT ... FOR UPDATE</code>) and upserts the new progress within the
 * same transaction.
 */
public class PostgresqlProgressTracker implements ProgressTracker {
    private static final Logger log                         = LoggerFactory.getLogger(PostgresqlProgressTracker.class);
    public static final  String DEFAULT_PROGRESS_TABLE_NAME = "event_processing_progress";

    private final Jdbi   jdbi;
    private final String progressTableName;

    public PostgresqlProgressTracker(Jdbi jdbi) {
        this(jdbi, Optional.empty());
    }

    @SuppressWarnings("OptionalUsedAsFieldOrParameterType")
    public PostgresqlProgressTracker(Jdbi jdbi, Optional<String> progressTableName) {
        this.jdbi = requireNonNull(jdbi, "You must supply a jdbi instance");
        this.progressTableName = requireNonNull(progressTableName, "No progressTableName option provided").orElse(DEFAULT_PROGRESS_TABLE_NAME);
        createProgressTable();
    }

    private void createProgressTable() {
        jdbi.useTransaction(handle -> {
            handle.execute("CREATE TABLE IF NOT EXISTS " + progressTableName + " (\n" +
                                   "  group_name TEXT NOT NULL,\n" +
                                   "  partition_key INTEGER NOT NULL,\n" +
                                   "  last_event_id TEXT,\n" +
                                   "  last_updated_ts TIMESTAMP WITH TIME ZONE NOT NULL,\n" +
                                   "  PRIMARY KEY (group_name, partition_key)\n" +
                                   ")");
            log.info("Ensured progress table '{}' exists", progressTableName);
        });
    }

    @Override
    public Progress current(String group, int partition) {
        requireNonNull(group, "No group provided");
        return jdbi.withHandle(handle -> lookupProgress(handle, group, partition, false));
    }

    @Override
    public void proceed(String group, int partition, Function<Progress, Progress> computeNext) {
        requireNonNull(group, "No group provided");
        requireNonNull(computeNext, "No computeNext function provided");
        jdbi.useTransaction(handle -> {
            var current = lookupProgress(handle, group, partition, true);
            var next    = requireNonNull(computeNext.apply(current), msg("[{}:{}] computeNext returned null", group, partition));
            handle.createUpdate("INSERT INTO " + progressTableName + " (group_name, partition_key, last_event_id, last_updated_ts) " +
                                        "VALUES (:group_name, :partition_key, :last_event_id, :last_updated_ts) " +
                                        "ON CONFLICT (group_name, partition_key) DO UPDATE SET " +
                                        "last_event_id = EXCLUDED.last_event_id, last_updated_ts = EXCLUDED.last_updated_ts")
                  .bind("group_name", group)
                  .bind("partition_key", partition)
                  .bind("last_event_id", next.lastProcessedEventId.map(EventId::toString).orElse(null))
                  .bind("last_updated_ts", OffsetDateTime.now(Clock.systemUTC()))
                  .execute();
            log.trace("[{}:{}] Progress updated from {} to {}", group, partition, current, next);
        });
    }

    private Progress lookupProgress(Handle handle, String group, int partition, boolean forUpdate) {
        return handle.createQuery("SELECT last_event_id FROM " + progressTableName +
                                          " WHERE group_name = :group_name AND partition_key = :partition_key" +
                                          (forUpdate ? " FOR UPDATE" : ""))
                     .bind("group_name", group)
                     .bind("partition_key", partition)
                     .map((rs, ctx) -> new Progress(Optional.ofNullable(rs.getString("last_event_id")).map(EventId::of)))
                     .findOne()
                     .orElse(Progress.beginning());
    }
}
