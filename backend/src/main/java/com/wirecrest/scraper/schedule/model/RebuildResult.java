package com.wirecrest.scraper.schedule.model;

public record RebuildResult(
    long entryId,
    int subscriberCount,
    boolean enabled,
    boolean synced,
    String error
) {
}
