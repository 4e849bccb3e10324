package com.wirecrest.scraper.schedule.model;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Billing-side view of a team's subscription. Written by the billing integration, read here.
 */
public record TeamPlan(
    String teamId,
    SubscriptionTier tier,
    String status,
    List<TargetType> enabledPlatforms,
    Integer reviewsIntervalHours,
    Integer overviewIntervalHours,
    Integer maxReviewsPerRun
) {
    private static final Set<String> ACTIVE_STATUSES = Set.of("active", "trialing");

    public boolean isActive() {
        return status != null && ACTIVE_STATUSES.contains(status.toLowerCase(Locale.ROOT));
    }

    public boolean hasPlatform(TargetType targetType) {
        return enabledPlatforms != null && enabledPlatforms.contains(targetType);
    }

    public int intervalHoursFor(JobKind jobKind) {
        if (jobKind == JobKind.OVERVIEW) {
            return overviewIntervalHours != null ? overviewIntervalHours : tier.overviewIntervalHours();
        }
        return reviewsIntervalHours != null ? reviewsIntervalHours : tier.reviewsIntervalHours();
    }

    public int effectiveMaxReviewsPerRun() {
        return maxReviewsPerRun != null ? maxReviewsPerRun : tier.maxReviewsPerRun();
    }
}
