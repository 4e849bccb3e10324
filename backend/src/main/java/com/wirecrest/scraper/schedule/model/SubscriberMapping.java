package com.wirecrest.scraper.schedule.model;

import java.time.Instant;

public record SubscriberMapping(
    long id,
    String targetId,
    String tenantId,
    TargetType targetType,
    JobKind jobKind,
    long scheduleEntryId,
    String externalIdentifier,
    int intervalHours,
    boolean active,
    Instant createdAt
) {
}
