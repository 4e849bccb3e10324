package com.wirecrest.scraper.schedule.api;

import java.time.Instant;

public record CustomIntervalRequest(
    String platform,
    Integer intervalHours,
    String reason,
    String setBy,
    Instant expiresAt
) {
}
