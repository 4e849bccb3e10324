package com.wirecrest.scraper.schedule.model;

import java.time.Instant;

public record JobRunRecord(
    long id,
    String tenantId,
    TargetType targetType,
    JobRunKind runKind,
    Long scheduleEntryId,
    String externalRunId,
    String externalDatasetId,
    JobRunStatus status,
    int itemsProcessed,
    int itemsNew,
    int itemsDuplicate,
    int targetsUpdated,
    String errorMessage,
    Instant startedAt,
    Instant completedAt
) {
}
