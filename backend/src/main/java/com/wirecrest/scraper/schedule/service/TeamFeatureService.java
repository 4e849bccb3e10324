package com.wirecrest.scraper.schedule.service;

import com.wirecrest.scraper.config.SchedulerProperties;
import com.wirecrest.scraper.schedule.model.CustomIntervalOverride;
import com.wirecrest.scraper.schedule.model.JobKind;
import com.wirecrest.scraper.schedule.model.SubscriptionTier;
import com.wirecrest.scraper.schedule.model.TargetType;
import com.wirecrest.scraper.schedule.model.TeamPlan;
import com.wirecrest.scraper.schedule.persistence.TenantJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Resolves what a team's subscription entitles it to: enabled platforms and the scrape interval per
 * platform. An unexpired operator override wins over the tier default.
 */
@Service
public class TeamFeatureService {
    private static final Logger log = LoggerFactory.getLogger(TeamFeatureService.class);

    private final TenantJdbcRepository repository;
    private final SchedulerProperties properties;
    private final Clock clock;

    public TeamFeatureService(TenantJdbcRepository repository, SchedulerProperties properties, Clock clock) {
        this.repository = repository;
        this.properties = properties;
        this.clock = clock;
    }

    public Optional<TeamPlan> findPlan(String teamId) {
        return repository.findPlan(teamId);
    }

    public boolean hasActiveSubscription(String teamId) {
        return repository.findPlan(teamId).map(TeamPlan::isActive).orElse(false);
    }

    public List<TargetType> enabledPlatforms(String teamId) {
        return repository.findPlan(teamId)
            .filter(TeamPlan::isActive)
            .map(TeamPlan::enabledPlatforms)
            .orElse(List.of());
    }

    /**
     * Interval applied to every job kind of the team's targets on this platform.
     */
    public int resolveIntervalHours(String teamId, TargetType targetType) {
        Optional<CustomIntervalOverride> override = repository.findOverride(teamId, targetType);
        Instant now = clock.instant();
        if (override.isPresent()) {
            if (override.get().isEffectiveAt(now)) {
                return override.get().intervalHours();
            }
            log.debug("Ignoring expired interval override for team {} {}", teamId, targetType);
        }
        return repository.findPlan(teamId)
            .map(plan -> plan.intervalHoursFor(JobKind.REVIEWS))
            .orElse(SubscriptionTier.STARTER.reviewsIntervalHours());
    }

    public int maxReviewsPerRun(String teamId) {
        return repository.findPlan(teamId)
            .map(TeamPlan::effectiveMaxReviewsPerRun)
            .orElse(SubscriptionTier.STARTER.maxReviewsPerRun());
    }

    public CustomIntervalOverride setCustomInterval(
        String teamId,
        TargetType targetType,
        int intervalHours,
        String reason,
        String setBy,
        Instant expiresAt
    ) {
        int min = properties.getIntervals().getMinHours();
        int max = properties.getIntervals().getMaxHours();
        if (intervalHours < min || intervalHours > max) {
            throw new IllegalArgumentException("Interval must be between " + min + " and " + max + " hours");
        }
        if (expiresAt != null && !expiresAt.isAfter(clock.instant())) {
            throw new IllegalArgumentException("expiresAt must be in the future");
        }
        repository.upsertOverride(teamId, targetType, intervalHours, reason, setBy, expiresAt);
        log.info("Set custom interval {}h for team {} {} (by {}, expires {})", intervalHours, teamId, targetType, setBy, expiresAt);
        return repository.findOverride(teamId, targetType)
            .orElseThrow(() -> new IllegalStateException("Override for team " + teamId + " was not stored"));
    }

    public boolean removeCustomInterval(String teamId, TargetType targetType) {
        boolean removed = repository.deleteOverride(teamId, targetType) > 0;
        if (removed) {
            log.info("Removed custom interval for team {} {}", teamId, targetType);
        }
        return removed;
    }

    public List<CustomIntervalOverride> listCustomIntervals() {
        return repository.findOverrides();
    }
}
