package com.wirecrest.scraper.schedule.persistence;

import com.wirecrest.scraper.schedule.model.CustomIntervalOverride;
import com.wirecrest.scraper.schedule.model.InvalidTargetTypeException;
import com.wirecrest.scraper.schedule.model.SubscriptionTier;
import com.wirecrest.scraper.schedule.model.TargetType;
import com.wirecrest.scraper.schedule.model.TeamPlan;
import com.wirecrest.scraper.schedule.model.TrackedTarget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

import static com.wirecrest.scraper.schedule.persistence.ScheduleJdbcRepository.toInstant;

/**
 * Tenant-side state: billing plans, operator interval overrides and the directory of tracked targets.
 */
@Repository
public class TenantJdbcRepository {
    private static final Logger log = LoggerFactory.getLogger(TenantJdbcRepository.class);

    private final NamedParameterJdbcTemplate jdbc;
    private final Clock clock;

    public TenantJdbcRepository(NamedParameterJdbcTemplate jdbc, Clock clock) {
        this.jdbc = jdbc;
        this.clock = clock;
    }

    public Optional<TeamPlan> findPlan(String teamId) {
        List<TeamPlan> rows = jdbc.query(
            """
                SELECT team_id, tier, status, enabled_platforms, reviews_interval_hours,
                       overview_interval_hours, max_reviews_per_run
                FROM team_plans
                WHERE team_id = :teamId
                """,
            new MapSqlParameterSource("teamId", teamId),
            (rs, rowNum) -> new TeamPlan(
                rs.getString("team_id"),
                SubscriptionTier.fromValue(rs.getString("tier")),
                rs.getString("status"),
                parsePlatforms(rs.getString("enabled_platforms")),
                nullableInt(rs, "reviews_interval_hours"),
                nullableInt(rs, "overview_interval_hours"),
                nullableInt(rs, "max_reviews_per_run")
            )
        );
        return rows.stream().findFirst();
    }

    public void upsertPlan(TeamPlan plan) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("teamId", plan.teamId())
            .addValue("tier", plan.tier().name())
            .addValue("status", plan.status())
            .addValue("platforms", plan.enabledPlatforms() == null ? "" : plan.enabledPlatforms().stream()
                .map(TargetType::key)
                .collect(Collectors.joining(",")))
            .addValue("reviewsInterval", plan.reviewsIntervalHours())
            .addValue("overviewInterval", plan.overviewIntervalHours())
            .addValue("maxReviews", plan.maxReviewsPerRun())
            .addValue("now", Timestamp.from(clock.instant()));
        int updated = jdbc.update(
            """
                UPDATE team_plans
                SET tier = :tier,
                    status = :status,
                    enabled_platforms = :platforms,
                    reviews_interval_hours = :reviewsInterval,
                    overview_interval_hours = :overviewInterval,
                    max_reviews_per_run = :maxReviews,
                    updated_at = :now
                WHERE team_id = :teamId
                """,
            params
        );
        if (updated > 0) {
            return;
        }
        jdbc.update(
            """
                INSERT INTO team_plans (
                    team_id, tier, status, enabled_platforms, reviews_interval_hours,
                    overview_interval_hours, max_reviews_per_run, updated_at
                )
                VALUES (:teamId, :tier, :status, :platforms, :reviewsInterval, :overviewInterval, :maxReviews, :now)
                """,
            params
        );
    }

    public Optional<CustomIntervalOverride> findOverride(String teamId, TargetType targetType) {
        List<CustomIntervalOverride> rows = jdbc.query(
            """
                SELECT id, team_id, target_type, interval_hours, reason, set_by, expires_at, created_at
                FROM custom_interval_overrides
                WHERE team_id = :teamId AND target_type = :targetType
                """,
            new MapSqlParameterSource()
                .addValue("teamId", teamId)
                .addValue("targetType", targetType.name()),
            TenantJdbcRepository::mapOverride
        );
        return rows.stream().findFirst();
    }

    public List<CustomIntervalOverride> findOverrides() {
        return jdbc.query(
            """
                SELECT id, team_id, target_type, interval_hours, reason, set_by, expires_at, created_at
                FROM custom_interval_overrides
                ORDER BY team_id, target_type
                """,
            new MapSqlParameterSource(),
            TenantJdbcRepository::mapOverride
        );
    }

    public void upsertOverride(
        String teamId,
        TargetType targetType,
        int intervalHours,
        String reason,
        String setBy,
        Instant expiresAt
    ) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("teamId", teamId)
            .addValue("targetType", targetType.name())
            .addValue("intervalHours", intervalHours)
            .addValue("reason", reason)
            .addValue("setBy", setBy)
            .addValue("expiresAt", expiresAt == null ? null : Timestamp.from(expiresAt))
            .addValue("now", Timestamp.from(clock.instant()));
        String updateSql = """
            UPDATE custom_interval_overrides
            SET interval_hours = :intervalHours,
                reason = :reason,
                set_by = :setBy,
                expires_at = :expiresAt,
                updated_at = :now
            WHERE team_id = :teamId AND target_type = :targetType
            """;
        if (jdbc.update(updateSql, params) > 0) {
            return;
        }
        try {
            jdbc.update(
                """
                    INSERT INTO custom_interval_overrides (
                        team_id, target_type, interval_hours, reason, set_by, expires_at, created_at, updated_at
                    )
                    VALUES (:teamId, :targetType, :intervalHours, :reason, :setBy, :expiresAt, :now, :now)
                    """,
                params
            );
        } catch (DataIntegrityViolationException e) {
            log.debug("Concurrent override insert for team {} {}, updating instead", teamId, targetType);
            jdbc.update(updateSql, params);
        }
    }

    public int deleteOverride(String teamId, TargetType targetType) {
        return jdbc.update(
            "DELETE FROM custom_interval_overrides WHERE team_id = :teamId AND target_type = :targetType",
            new MapSqlParameterSource()
                .addValue("teamId", teamId)
                .addValue("targetType", targetType.name())
        );
    }

    public List<TrackedTarget> findTargets(String teamId, TargetType targetType) {
        return jdbc.query(
            """
                SELECT id, team_id, target_type, external_identifier, display_name, created_at
                FROM tracked_targets
                WHERE team_id = :teamId AND target_type = :targetType
                ORDER BY created_at, id
                """,
            new MapSqlParameterSource()
                .addValue("teamId", teamId)
                .addValue("targetType", targetType.name()),
            TenantJdbcRepository::mapTarget
        );
    }

    public Optional<TrackedTarget> findTarget(String teamId, TargetType targetType, String identifier) {
        List<TrackedTarget> rows = jdbc.query(
            """
                SELECT id, team_id, target_type, external_identifier, display_name, created_at
                FROM tracked_targets
                WHERE team_id = :teamId AND target_type = :targetType AND external_identifier = :identifier
                """,
            new MapSqlParameterSource()
                .addValue("teamId", teamId)
                .addValue("targetType", targetType.name())
                .addValue("identifier", identifier),
            TenantJdbcRepository::mapTarget
        );
        return rows.stream().findFirst();
    }

    /**
     * Inserts the target and returns its id. Throws
     * {@link org.springframework.dao.DuplicateKeyException} if it is already tracked.
     */
    public String insertTarget(String teamId, TargetType targetType, String identifier, String displayName) {
        String id = UUID.randomUUID().toString();
        jdbc.update(
            """
                INSERT INTO tracked_targets (id, team_id, target_type, external_identifier, display_name, created_at)
                VALUES (:id, :teamId, :targetType, :identifier, :displayName, :now)
                """,
            new MapSqlParameterSource()
                .addValue("id", id)
                .addValue("teamId", teamId)
                .addValue("targetType", targetType.name())
                .addValue("identifier", identifier)
                .addValue("displayName", displayName)
                .addValue("now", Timestamp.from(clock.instant()))
        );
        return id;
    }

    public int deleteTarget(String targetId) {
        return jdbc.update(
            "DELETE FROM tracked_targets WHERE id = :id",
            new MapSqlParameterSource("id", targetId)
        );
    }

    /**
     * Identifiers the team configured for the platform, oldest first.
     */
    public List<String> findConfiguredIdentifiers(String teamId, TargetType targetType) {
        return jdbc.queryForList(
            """
                SELECT external_identifier
                FROM configured_targets
                WHERE team_id = :teamId AND target_type = :targetType
                ORDER BY created_at, external_identifier
                """,
            new MapSqlParameterSource()
                .addValue("teamId", teamId)
                .addValue("targetType", targetType.name()),
            String.class
        );
    }

    /**
     * Records a configured identifier. Returns false if it was already recorded.
     */
    public boolean insertConfiguredIdentifier(String teamId, TargetType targetType, String identifier) {
        try {
            jdbc.update(
                """
                    INSERT INTO configured_targets (team_id, target_type, external_identifier, created_at)
                    VALUES (:teamId, :targetType, :identifier, :now)
                    """,
                new MapSqlParameterSource()
                    .addValue("teamId", teamId)
                    .addValue("targetType", targetType.name())
                    .addValue("identifier", identifier)
                    .addValue("now", Timestamp.from(clock.instant()))
            );
            return true;
        } catch (DuplicateKeyException e) {
            return false;
        }
    }

    public int deleteConfiguredIdentifier(String teamId, TargetType targetType, String identifier) {
        return jdbc.update(
            """
                DELETE FROM configured_targets
                WHERE team_id = :teamId AND target_type = :targetType AND external_identifier = :identifier
                """,
            new MapSqlParameterSource()
                .addValue("teamId", teamId)
                .addValue("targetType", targetType.name())
                .addValue("identifier", identifier)
        );
    }

    /**
     * Reads the stored platform list. An unknown key means the plan was written by something other than
     * {@link #upsertPlan} and is rejected rather than silently narrowed.
     */
    static List<TargetType> parsePlatforms(String raw) {
        List<TargetType> platforms = new ArrayList<>();
        if (raw == null || raw.isBlank()) {
            return platforms;
        }
        for (String part : raw.split(",")) {
            if (part.isBlank()) {
                continue;
            }
            TargetType type;
            try {
                type = TargetType.fromKey(part);
            } catch (InvalidTargetTypeException e) {
                throw new IllegalStateException("Team plan lists unknown platform '" + part.trim() + "'", e);
            }
            if (!platforms.contains(type)) {
                platforms.add(type);
            }
        }
        return platforms;
    }

    private static Integer nullableInt(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }

    private static CustomIntervalOverride mapOverride(ResultSet rs, int rowNum) throws SQLException {
        return new CustomIntervalOverride(
            rs.getLong("id"),
            rs.getString("team_id"),
            TargetType.valueOf(rs.getString("target_type")),
            rs.getInt("interval_hours"),
            rs.getString("reason"),
            rs.getString("set_by"),
            toInstant(rs.getTimestamp("expires_at")),
            toInstant(rs.getTimestamp("created_at"))
        );
    }

    private static TrackedTarget mapTarget(ResultSet rs, int rowNum) throws SQLException {
        return new TrackedTarget(
            rs.getString("id"),
            rs.getString("team_id"),
            TargetType.valueOf(rs.getString("target_type")),
            rs.getString("external_identifier"),
            rs.getString("display_name"),
            toInstant(rs.getTimestamp("created_at"))
        );
    }
}
