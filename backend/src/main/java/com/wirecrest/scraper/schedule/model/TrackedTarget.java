package com.wirecrest.scraper.schedule.model;

import java.time.Instant;

public record TrackedTarget(
    String id,
    String teamId,
    TargetType targetType,
    String externalIdentifier,
    String displayName,
    Instant createdAt
) {
}
