package com.wirecrest.scraper.schedule.model;

import java.time.Instant;

public record CustomIntervalOverride(
    long id,
    String teamId,
    TargetType targetType,
    int intervalHours,
    String reason,
    String setBy,
    Instant expiresAt,
    Instant createdAt
) {
    public boolean isEffectiveAt(Instant now) {
        return expiresAt == null || expiresAt.isAfter(now);
    }
}
