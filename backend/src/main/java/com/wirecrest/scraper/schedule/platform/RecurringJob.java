package com.wirecrest.scraper.schedule.platform;

import java.time.Instant;

public record RecurringJob(
    String id,
    String name,
    String cronExpression,
    boolean enabled,
    Instant nextRunAt
) {
}
