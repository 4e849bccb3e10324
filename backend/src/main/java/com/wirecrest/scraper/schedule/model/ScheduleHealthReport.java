package com.wirecrest.scraper.schedule.model;

import java.util.List;

public record ScheduleHealthReport(
    int healthy,
    int warning,
    int critical,
    List<Detail> details
) {
    public record Detail(
        long entryId,
        String name,
        int subscriberCount,
        int maxBatchSize,
        double loadPercent,
        HealthLevel level
    ) {
    }
}
