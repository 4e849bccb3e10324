package com.wirecrest.scraper.schedule.persistence;

import com.wirecrest.scraper.schedule.model.DatasetProcessingResult;
import com.wirecrest.scraper.schedule.model.JobRunKind;
import com.wirecrest.scraper.schedule.model.JobRunRecord;
import com.wirecrest.scraper.schedule.model.JobRunStatus;
import com.wirecrest.scraper.schedule.model.TargetType;
import org.springframework.dao.DuplicateKeyException;
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
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.wirecrest.scraper.schedule.persistence.ScheduleJdbcRepository.toInstant;
import static com.wirecrest.scraper.schedule.persistence.ScheduleJdbcRepository.truncate;

/**
 * Run bookkeeping: job run records, the webhook idempotency log, staged review items and operator alerts.
 */
@Repository
public class JobRunJdbcRepository {
    public static final String EVENT_PROCESSING = "PROCESSING";
    public static final String EVENT_PROCESSED = "PROCESSED";
    public static final String EVENT_FAILED = "FAILED";

    private static final String RUN_COLUMNS = """
        id, tenant_id, target_type, run_kind, schedule_entry_id, external_run_id, external_dataset_id,
        status, items_processed, items_new, items_duplicate, targets_updated, error_message,
        started_at, completed_at
        """;

    private final NamedParameterJdbcTemplate jdbc;
    private final Clock clock;

    public JobRunJdbcRepository(NamedParameterJdbcTemplate jdbc, Clock clock) {
        this.jdbc = jdbc;
        this.clock = clock;
    }

    public long insertRun(
        String tenantId,
        TargetType targetType,
        JobRunKind runKind,
        Long scheduleEntryId,
        String externalRunId,
        String externalDatasetId,
        JobRunStatus status,
        Instant startedAt
    ) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("tenantId", tenantId)
            .addValue("targetType", targetType.name())
            .addValue("runKind", runKind.name())
            .addValue("entryId", scheduleEntryId)
            .addValue("runId", externalRunId)
            .addValue("datasetId", externalDatasetId)
            .addValue("status", status.name())
            .addValue("startedAt", Timestamp.from(startedAt));
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO job_runs (
                    tenant_id, target_type, run_kind, schedule_entry_id, external_run_id,
                    external_dataset_id, status, started_at
                )
                VALUES (:tenantId, :targetType, :runKind, :entryId, :runId, :datasetId, :status, :startedAt)
                """,
            params,
            keyHolder,
            new String[] {"id"}
        );
        Number key = keyHolder.getKey();
        if (key == null) {
            throw new IllegalStateException("No id returned for job run");
        }
        return key.longValue();
    }

    public void completeRun(
        long runRecordId,
        JobRunStatus status,
        String datasetId,
        DatasetProcessingResult result,
        String errorMessage,
        Instant completedAt
    ) {
        DatasetProcessingResult safe = result == null ? DatasetProcessingResult.empty() : result;
        String datasetClause = datasetId == null ? "" : "external_dataset_id = :datasetId,";
        jdbc.update(
            """
                UPDATE job_runs
                SET status = :status,
                    %s
                    items_processed = :processed,
                    items_new = :itemsNew,
                    items_duplicate = :duplicate,
                    targets_updated = :targetsUpdated,
                    error_message = :error,
                    completed_at = :completedAt
                WHERE id = :id
                """.formatted(datasetClause),
            new MapSqlParameterSource()
                .addValue("id", runRecordId)
                .addValue("status", status.name())
                .addValue("datasetId", datasetId)
                .addValue("processed", safe.itemsProcessed())
                .addValue("itemsNew", safe.itemsNew())
                .addValue("duplicate", safe.itemsDuplicate())
                .addValue("targetsUpdated", safe.targetsUpdated())
                .addValue("error", truncate(errorMessage, 2000))
                .addValue("completedAt", Timestamp.from(completedAt))
        );
    }

    public List<JobRunRecord> findRunsByExternalRunId(String externalRunId) {
        return jdbc.query(
            "SELECT " + RUN_COLUMNS + " FROM job_runs WHERE external_run_id = :runId ORDER BY id",
            new MapSqlParameterSource("runId", externalRunId),
            JobRunJdbcRepository::mapRun
        );
    }

    /**
     * Deletes the per-tenant records written while splitting a shared batch run, leaving launch-time
     * records alone.
     */
    public int deleteTenantSlices(String externalRunId) {
        return jdbc.update(
            """
                DELETE FROM job_runs
                WHERE external_run_id = :runId
                  AND tenant_id IS NOT NULL
                  AND run_kind <> :initial
                """,
            new MapSqlParameterSource()
                .addValue("runId", externalRunId)
                .addValue("initial", JobRunKind.INITIAL.name())
        );
    }

    public List<JobRunRecord> findRecentRuns(String tenantId, int limit) {
        return jdbc.query(
            "SELECT " + RUN_COLUMNS + """
                FROM job_runs
                WHERE tenant_id = :tenantId
                ORDER BY started_at DESC, id DESC
                LIMIT :limit
                """,
            new MapSqlParameterSource()
                .addValue("tenantId", tenantId)
                .addValue("limit", Math.max(1, limit)),
            JobRunJdbcRepository::mapRun
        );
    }

    /**
     * Claims a completion event for processing. A run id already processed, or being processed by someone
     * else within the staleness window, is not claimable.
     */
    public boolean claimWebhookEvent(String externalRunId, String eventType, Instant now, Instant staleBefore) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("runId", externalRunId)
            .addValue("eventType", eventType)
            .addValue("processing", EVENT_PROCESSING)
            .addValue("failed", EVENT_FAILED)
            .addValue("now", Timestamp.from(now))
            .addValue("staleBefore", Timestamp.from(staleBefore));
        try {
            jdbc.update(
                """
                    INSERT INTO job_webhook_events (external_run_id, event_type, status, attempts, received_at, updated_at)
                    VALUES (:runId, :eventType, :processing, 1, :now, :now)
                    """,
                params
            );
            return true;
        } catch (DuplicateKeyException e) {
            int taken = jdbc.update(
                """
                    UPDATE job_webhook_events
                    SET status = :processing,
                        event_type = :eventType,
                        attempts = attempts + 1,
                        error_message = NULL,
                        updated_at = :now
                    WHERE external_run_id = :runId
                      AND (status = :failed OR (status = :processing AND updated_at < :staleBefore))
                    """,
                params
            );
            return taken > 0;
        }
    }

    public void finishWebhookEvent(String externalRunId, String status, String errorMessage) {
        jdbc.update(
            """
                UPDATE job_webhook_events
                SET status = :status,
                    error_message = :error,
                    updated_at = :now
                WHERE external_run_id = :runId
                """,
            new MapSqlParameterSource()
                .addValue("runId", externalRunId)
                .addValue("status", status)
                .addValue("error", truncate(errorMessage, 2000))
                .addValue("now", Timestamp.from(clock.instant()))
        );
    }

    public Optional<String> findWebhookEventStatus(String externalRunId) {
        List<String> rows = jdbc.query(
            "SELECT status FROM job_webhook_events WHERE external_run_id = :runId",
            new MapSqlParameterSource("runId", externalRunId),
            (rs, rowNum) -> rs.getString("status")
        );
        return rows.stream().findFirst();
    }

    /**
     * Stages a scraped item. Returns false when the same item was already stored for this tenant.
     */
    public boolean insertReviewItem(
        String tenantId,
        TargetType targetType,
        String externalIdentifier,
        String itemKey,
        String payload,
        Instant fetchedAt
    ) {
        try {
            jdbc.update(
                """
                    INSERT INTO review_items (tenant_id, target_type, external_identifier, item_key, payload, fetched_at)
                    VALUES (:tenantId, :targetType, :identifier, :itemKey, :payload, :fetchedAt)
                    """,
                new MapSqlParameterSource()
                    .addValue("tenantId", tenantId)
                    .addValue("targetType", targetType.name())
                    .addValue("identifier", externalIdentifier)
                    .addValue("itemKey", itemKey)
                    .addValue("payload", payload)
                    .addValue("fetchedAt", Timestamp.from(fetchedAt))
            );
            return true;
        } catch (DuplicateKeyException e) {
            return false;
        }
    }

    public int countReviewItems(String tenantId, TargetType targetType) {
        Integer count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM review_items WHERE tenant_id = :tenantId AND target_type = :targetType",
            new MapSqlParameterSource()
                .addValue("tenantId", tenantId)
                .addValue("targetType", targetType.name()),
            Integer.class
        );
        return count == null ? 0 : count;
    }

    public void insertAlert(String alertKey, String title, String details, Instant createdAt) {
        jdbc.update(
            """
                INSERT INTO operator_alerts (alert_key, title, details, created_at)
                VALUES (:alertKey, :title, :details, :createdAt)
                """,
            new MapSqlParameterSource()
                .addValue("alertKey", truncate(alertKey, 256))
                .addValue("title", truncate(title, 512))
                .addValue("details", details)
                .addValue("createdAt", Timestamp.from(createdAt))
        );
    }

    public List<Map<String, Object>> findRecentAlerts(int limit) {
        return jdbc.queryForList(
            """
                SELECT alert_key, title, details, created_at
                FROM operator_alerts
                ORDER BY created_at DESC, id DESC
                LIMIT :limit
                """,
            new MapSqlParameterSource("limit", Math.max(1, limit))
        );
    }

    private static JobRunRecord mapRun(ResultSet rs, int rowNum) throws SQLException {
        long entryId = rs.getLong("schedule_entry_id");
        Long scheduleEntryId = rs.wasNull() ? null : entryId;
        return new JobRunRecord(
            rs.getLong("id"),
            rs.getString("tenant_id"),
            TargetType.valueOf(rs.getString("target_type")),
            JobRunKind.valueOf(rs.getString("run_kind")),
            scheduleEntryId,
            rs.getString("external_run_id"),
            rs.getString("external_dataset_id"),
            JobRunStatus.valueOf(rs.getString("status")),
            rs.getInt("items_processed"),
            rs.getInt("items_new"),
            rs.getInt("items_duplicate"),
            rs.getInt("targets_updated"),
            rs.getString("error_message"),
            toInstant(rs.getTimestamp("started_at")),
            toInstant(rs.getTimestamp("completed_at"))
        );
    }
}
