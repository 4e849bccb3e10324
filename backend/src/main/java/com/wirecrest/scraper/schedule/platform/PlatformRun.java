package com.wirecrest.scraper.schedule.platform;

import java.time.Instant;

public record PlatformRun(
    String id,
    String datasetId,
    String status,
    Instant startedAt
) {
}
