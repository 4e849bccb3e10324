package com.wirecrest.scraper.schedule.persistence;

import com.wirecrest.scraper.schedule.model.JobKind;
import com.wirecrest.scraper.schedule.model.ScheduleEntry;
import com.wirecrest.scraper.schedule.model.SubscriberMapping;
import com.wirecrest.scraper.schedule.model.TargetType;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Schedule entries and the subscriber mappings that hang off them. Subscriber counts are never adjusted
 * incrementally; {@link #recountSubscribers(long)} recomputes them from the mapping rows.
 */
@Repository
public class ScheduleJdbcRepository {
    private static final String ENTRY_COLUMNS = """
        id, target_type, job_kind, interval_hours, batch_index, external_job_id, cron_expression,
        subscriber_count, active, paused, input_stale, last_synced_at, last_sync_error,
        last_run_at, next_run_at, created_at, updated_at
        """;
    private static final String MAPPING_COLUMNS = """
        id, target_id, tenant_id, target_type, job_kind, schedule_entry_id, external_identifier,
        interval_hours, active, created_at
        """;

    private static final RowMapper<ScheduleEntry> ENTRY_MAPPER = ScheduleJdbcRepository::mapEntry;
    private static final RowMapper<SubscriberMapping> MAPPING_MAPPER = ScheduleJdbcRepository::mapMapping;

    private final NamedParameterJdbcTemplate jdbc;
    private final Clock clock;

    public ScheduleJdbcRepository(NamedParameterJdbcTemplate jdbc, Clock clock) {
        this.jdbc = jdbc;
        this.clock = clock;
    }

    public Optional<ScheduleEntry> findEntry(long entryId) {
        List<ScheduleEntry> rows = jdbc.query(
            "SELECT " + ENTRY_COLUMNS + " FROM schedule_entries WHERE id = :id",
            new MapSqlParameterSource("id", entryId),
            ENTRY_MAPPER
        );
        return rows.stream().findFirst();
    }

    /**
     * Row-locks the entry for the rest of the surrounding transaction.
     */
    public Optional<ScheduleEntry> lockEntry(long entryId) {
        List<ScheduleEntry> rows = jdbc.query(
            "SELECT " + ENTRY_COLUMNS + " FROM schedule_entries WHERE id = :id FOR UPDATE",
            new MapSqlParameterSource("id", entryId),
            ENTRY_MAPPER
        );
        return rows.stream().findFirst();
    }

    public Optional<ScheduleEntry> findEntryWithCapacity(TargetType targetType, JobKind jobKind, int intervalHours, int maxBatchSize) {
        MapSqlParameterSource params = groupParams(targetType, jobKind, intervalHours)
            .addValue("maxBatchSize", maxBatchSize);
        List<ScheduleEntry> rows = jdbc.query(
            "SELECT " + ENTRY_COLUMNS + """
                FROM schedule_entries
                WHERE target_type = :targetType
                  AND job_kind = :jobKind
                  AND interval_hours = :intervalHours
                  AND paused = FALSE
                  AND subscriber_count < :maxBatchSize
                ORDER BY batch_index ASC
                LIMIT 1
                """,
            params,
            ENTRY_MAPPER
        );
        return rows.stream().findFirst();
    }

    public List<ScheduleEntry> findEntriesForGroup(TargetType targetType, JobKind jobKind, int intervalHours) {
        return jdbc.query(
            "SELECT " + ENTRY_COLUMNS + """
                FROM schedule_entries
                WHERE target_type = :targetType
                  AND job_kind = :jobKind
                  AND interval_hours = :intervalHours
                ORDER BY batch_index ASC
                """,
            groupParams(targetType, jobKind, intervalHours),
            ENTRY_MAPPER
        );
    }

    public List<ScheduleEntry> findAllEntries() {
        return jdbc.query(
            "SELECT " + ENTRY_COLUMNS + """
                FROM schedule_entries
                ORDER BY target_type, job_kind, interval_hours, batch_index
                """,
            new MapSqlParameterSource(),
            ENTRY_MAPPER
        );
    }

    public List<ScheduleEntry> findEntriesForTenant(String tenantId) {
        return jdbc.query(
            "SELECT " + ENTRY_COLUMNS + """
                FROM schedule_entries
                WHERE id IN (
                    SELECT schedule_entry_id FROM subscriber_mappings WHERE tenant_id = :tenantId AND active = TRUE
                )
                ORDER BY target_type, job_kind, interval_hours, batch_index
                """,
            new MapSqlParameterSource("tenantId", tenantId),
            ENTRY_MAPPER
        );
    }

    public Integer findMaxBatchIndex(TargetType targetType, JobKind jobKind, int intervalHours) {
        return jdbc.queryForObject(
            """
                SELECT MAX(batch_index)
                FROM schedule_entries
                WHERE target_type = :targetType
                  AND job_kind = :jobKind
                  AND interval_hours = :intervalHours
                """,
            groupParams(targetType, jobKind, intervalHours),
            Integer.class
        );
    }

    /**
     * Inserts a new entry. Throws {@link org.springframework.dao.DuplicateKeyException} when another
     * caller already holds the slot.
     */
    public long insertEntry(TargetType targetType, JobKind jobKind, int intervalHours, int batchIndex, String cronExpression) {
        Instant now = clock.instant();
        MapSqlParameterSource params = groupParams(targetType, jobKind, intervalHours)
            .addValue("batchIndex", batchIndex)
            .addValue("cronExpression", cronExpression)
            .addValue("now", Timestamp.from(now));
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO schedule_entries (
                    target_type, job_kind, interval_hours, batch_index, cron_expression,
                    subscriber_count, active, paused, input_stale, created_at, updated_at
                )
                VALUES (
                    :targetType, :jobKind, :intervalHours, :batchIndex, :cronExpression,
                    0, FALSE, FALSE, TRUE, :now, :now
                )
                """,
            params,
            keyHolder,
            new String[] {"id"}
        );
        Number key = keyHolder.getKey();
        if (key == null) {
            throw new IllegalStateException("No id returned for new schedule entry");
        }
        return key.longValue();
    }

    /**
     * Records the external job id unless another caller already attached one. Returns false in that case.
     */
    public boolean assignExternalJob(long entryId, String externalJobId) {
        return jdbc.update(
            """
                UPDATE schedule_entries
                SET external_job_id = :externalJobId,
                    updated_at = :now
                WHERE id = :id
                  AND external_job_id IS NULL
                """,
            new MapSqlParameterSource()
                .addValue("id", entryId)
                .addValue("externalJobId", externalJobId)
                .addValue("now", Timestamp.from(clock.instant()))
        ) > 0;
    }

    /**
     * Detaches an external job id that the platform no longer knows, so the next rebuild creates a new job.
     */
    public boolean clearExternalJob(long entryId, String externalJobId) {
        return jdbc.update(
            """
                UPDATE schedule_entries
                SET external_job_id = NULL,
                    input_stale = TRUE,
                    updated_at = :now
                WHERE id = :id
                  AND external_job_id = :externalJobId
                """,
            new MapSqlParameterSource()
                .addValue("id", entryId)
                .addValue("externalJobId", externalJobId)
                .addValue("now", Timestamp.from(clock.instant()))
        ) > 0;
    }

    /**
     * Recomputes subscriber count and active flag from the mapping rows and returns the new count.
     */
    public int recountSubscribers(long entryId) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", entryId)
            .addValue("now", Timestamp.from(clock.instant()));
        jdbc.update(
            """
                UPDATE schedule_entries
                SET subscriber_count = (
                        SELECT COUNT(*) FROM subscriber_mappings
                        WHERE schedule_entry_id = :id AND active = TRUE
                    ),
                    active = (
                        SELECT COUNT(*) FROM subscriber_mappings
                        WHERE schedule_entry_id = :id AND active = TRUE
                    ) > 0,
                    input_stale = TRUE,
                    updated_at = :now
                WHERE id = :id
                """,
            params
        );
        return countActiveMappings(entryId);
    }

    public int countActiveMappings(long entryId) {
        Integer count = jdbc.queryForObject(
            """
                SELECT COUNT(*) FROM subscriber_mappings
                WHERE schedule_entry_id = :id AND active = TRUE
                """,
            new MapSqlParameterSource("id", entryId),
            Integer.class
        );
        return count == null ? 0 : count;
    }

    public void markSynced(long entryId, Instant syncedAt) {
        jdbc.update(
            """
                UPDATE schedule_entries
                SET input_stale = FALSE,
                    last_synced_at = :syncedAt,
                    last_sync_error = NULL,
                    updated_at = :syncedAt
                WHERE id = :id
                """,
            new MapSqlParameterSource()
                .addValue("id", entryId)
                .addValue("syncedAt", Timestamp.from(syncedAt))
        );
    }

    public void markSyncFailed(long entryId, String error) {
        jdbc.update(
            """
                UPDATE schedule_entries
                SET input_stale = TRUE,
                    last_sync_error = :error,
                    updated_at = :now
                WHERE id = :id
                """,
            new MapSqlParameterSource()
                .addValue("id", entryId)
                .addValue("error", truncate(error, 1000))
                .addValue("now", Timestamp.from(clock.instant()))
        );
    }

    public void setPaused(long entryId, boolean paused) {
        jdbc.update(
            """
                UPDATE schedule_entries
                SET paused = :paused,
                    input_stale = TRUE,
                    updated_at = :now
                WHERE id = :id
                """,
            new MapSqlParameterSource()
                .addValue("id", entryId)
                .addValue("paused", paused)
                .addValue("now", Timestamp.from(clock.instant()))
        );
    }

    public void recordRun(long entryId, Instant lastRunAt, Instant nextRunAt) {
        jdbc.update(
            """
                UPDATE schedule_entries
                SET last_run_at = :lastRunAt,
                    next_run_at = :nextRunAt,
                    updated_at = :lastRunAt
                WHERE id = :id
                """,
            new MapSqlParameterSource()
                .addValue("id", entryId)
                .addValue("lastRunAt", Timestamp.from(lastRunAt))
                .addValue("nextRunAt", nextRunAt == null ? null : Timestamp.from(nextRunAt))
        );
    }

    /**
     * Deletes an entry only if no mapping references it. Returns the number of rows removed.
     */
    public int deleteEmptyEntry(long entryId) {
        return jdbc.update(
            """
                DELETE FROM schedule_entries
                WHERE id = :id
                  AND NOT EXISTS (SELECT 1 FROM subscriber_mappings WHERE schedule_entry_id = :id)
                """,
            new MapSqlParameterSource("id", entryId)
        );
    }

    public Optional<SubscriberMapping> findMapping(String targetId, JobKind jobKind) {
        List<SubscriberMapping> rows = jdbc.query(
            "SELECT " + MAPPING_COLUMNS + " FROM subscriber_mappings WHERE target_id = :targetId AND job_kind = :jobKind",
            new MapSqlParameterSource()
                .addValue("targetId", targetId)
                .addValue("jobKind", jobKind.name()),
            MAPPING_MAPPER
        );
        return rows.stream().findFirst();
    }

    public List<SubscriberMapping> findMappingsForTarget(String targetId) {
        return jdbc.query(
            "SELECT " + MAPPING_COLUMNS + " FROM subscriber_mappings WHERE target_id = :targetId ORDER BY job_kind",
            new MapSqlParameterSource("targetId", targetId),
            MAPPING_MAPPER
        );
    }

    public List<SubscriberMapping> findMappingsForEntry(long entryId) {
        return jdbc.query(
            "SELECT " + MAPPING_COLUMNS + """
                FROM subscriber_mappings
                WHERE schedule_entry_id = :entryId
                  AND active = TRUE
                ORDER BY created_at ASC, id ASC
                """,
            new MapSqlParameterSource("entryId", entryId),
            MAPPING_MAPPER
        );
    }

    public List<SubscriberMapping> findMappingsForTenant(String tenantId) {
        return jdbc.query(
            "SELECT " + MAPPING_COLUMNS + """
                FROM subscriber_mappings
                WHERE tenant_id = :tenantId
                ORDER BY target_type, target_id, job_kind
                """,
            new MapSqlParameterSource("tenantId", tenantId),
            MAPPING_MAPPER
        );
    }

    public List<SubscriberMapping> findMappingsByIdentifiers(TargetType targetType, Collection<String> identifiers) {
        if (identifiers == null || identifiers.isEmpty()) {
            return List.of();
        }
        return jdbc.query(
            "SELECT " + MAPPING_COLUMNS + """
                FROM subscriber_mappings
                WHERE target_type = :targetType
                  AND external_identifier IN (:identifiers)
                  AND active = TRUE
                ORDER BY id
                """,
            new MapSqlParameterSource()
                .addValue("targetType", targetType.name())
                .addValue("identifiers", identifiers),
            MAPPING_MAPPER
        );
    }

    /**
     * Throws {@link org.springframework.dao.DuplicateKeyException} if the target already has a mapping
     * for this job kind.
     */
    public long insertMapping(
        String targetId,
        String tenantId,
        TargetType targetType,
        JobKind jobKind,
        long scheduleEntryId,
        String externalIdentifier,
        int intervalHours
    ) {
        Instant now = clock.instant();
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("targetId", targetId)
            .addValue("tenantId", tenantId)
            .addValue("targetType", targetType.name())
            .addValue("jobKind", jobKind.name())
            .addValue("entryId", scheduleEntryId)
            .addValue("identifier", externalIdentifier)
            .addValue("intervalHours", intervalHours)
            .addValue("now", Timestamp.from(now));
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO subscriber_mappings (
                    target_id, tenant_id, target_type, job_kind, schedule_entry_id,
                    external_identifier, interval_hours, active, created_at, updated_at
                )
                VALUES (
                    :targetId, :tenantId, :targetType, :jobKind, :entryId,
                    :identifier, :intervalHours, TRUE, :now, :now
                )
                """,
            params,
            keyHolder,
            new String[] {"id"}
        );
        Number key = keyHolder.getKey();
        if (key == null) {
            throw new IllegalStateException("No id returned for new subscriber mapping");
        }
        return key.longValue();
    }

    public void reassignMappings(Collection<Long> mappingIds, long scheduleEntryId, int intervalHours) {
        if (mappingIds == null || mappingIds.isEmpty()) {
            return;
        }
        jdbc.update(
            """
                UPDATE subscriber_mappings
                SET schedule_entry_id = :entryId,
                    interval_hours = :intervalHours,
                    updated_at = :now
                WHERE id IN (:ids)
                """,
            new MapSqlParameterSource()
                .addValue("ids", mappingIds)
                .addValue("entryId", scheduleEntryId)
                .addValue("intervalHours", intervalHours)
                .addValue("now", Timestamp.from(clock.instant()))
        );
    }

    public int deleteMapping(long mappingId) {
        return jdbc.update(
            "DELETE FROM subscriber_mappings WHERE id = :id",
            new MapSqlParameterSource("id", mappingId)
        );
    }

    private static MapSqlParameterSource groupParams(TargetType targetType, JobKind jobKind, int intervalHours) {
        return new MapSqlParameterSource()
            .addValue("targetType", targetType.name())
            .addValue("jobKind", jobKind.name())
            .addValue("intervalHours", intervalHours);
    }

    private static ScheduleEntry mapEntry(ResultSet rs, int rowNum) throws SQLException {
        return new ScheduleEntry(
            rs.getLong("id"),
            TargetType.valueOf(rs.getString("target_type")),
            JobKind.valueOf(rs.getString("job_kind")),
            rs.getInt("interval_hours"),
            rs.getInt("batch_index"),
            rs.getString("external_job_id"),
            rs.getString("cron_expression"),
            rs.getInt("subscriber_count"),
            rs.getBoolean("active"),
            rs.getBoolean("paused"),
            rs.getBoolean("input_stale"),
            toInstant(rs.getTimestamp("last_synced_at")),
            rs.getString("last_sync_error"),
            toInstant(rs.getTimestamp("last_run_at")),
            toInstant(rs.getTimestamp("next_run_at")),
            toInstant(rs.getTimestamp("created_at")),
            toInstant(rs.getTimestamp("updated_at"))
        );
    }

    private static SubscriberMapping mapMapping(ResultSet rs, int rowNum) throws SQLException {
        return new SubscriberMapping(
            rs.getLong("id"),
            rs.getString("target_id"),
            rs.getString("tenant_id"),
            TargetType.valueOf(rs.getString("target_type")),
            JobKind.valueOf(rs.getString("job_kind")),
            rs.getLong("schedule_entry_id"),
            rs.getString("external_identifier"),
            rs.getInt("interval_hours"),
            rs.getBoolean("active"),
            toInstant(rs.getTimestamp("created_at"))
        );
    }

    static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }

    static String truncate(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength);
    }
}
