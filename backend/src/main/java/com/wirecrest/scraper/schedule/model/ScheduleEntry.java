package com.wirecrest.scraper.schedule.model;

import java.time.Instant;
import java.util.Locale;

public record ScheduleEntry(
    long id,
    TargetType targetType,
    JobKind jobKind,
    int intervalHours,
    int batchIndex,
    String externalJobId,
    String cronExpression,
    int subscriberCount,
    boolean active,
    boolean paused,
    boolean inputStale,
    Instant lastSyncedAt,
    String lastSyncError,
    Instant lastRunAt,
    Instant nextRunAt,
    Instant createdAt,
    Instant updatedAt
) {
    public String name() {
        String base = targetType.key() + "_" + jobKind.name().toLowerCase(Locale.ROOT) + "_" + intervalHours + "h";
        return batchIndex == 0 ? base : base + "_batch_" + batchIndex;
    }

    public boolean hasExternalJob() {
        return externalJobId != null && !externalJobId.isBlank();
    }

    /**
     * The external job only fires while it has someone to scrape for and an operator has not paused it.
     */
    public boolean shouldBeEnabled() {
        return subscriberCount > 0 && !paused;
    }
}
