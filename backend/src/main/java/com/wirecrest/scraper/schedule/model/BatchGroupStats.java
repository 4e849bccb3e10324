package com.wirecrest.scraper.schedule.model;

import java.util.List;

public record BatchGroupStats(
    TargetType targetType,
    JobKind jobKind,
    int intervalHours,
    int maxBatchSize,
    int batches,
    int totalSubscribers,
    double averageBatchSize,
    int minBatchSize,
    int maxObservedBatchSize,
    boolean needsRebalancing,
    List<Integer> batchSizes
) {
}
