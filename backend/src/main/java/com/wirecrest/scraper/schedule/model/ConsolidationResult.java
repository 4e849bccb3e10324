package com.wirecrest.scraper.schedule.model;

import java.util.List;

public record ConsolidationResult(
    boolean success,
    int batchesRemoved,
    int movedSubscribers,
    String message,
    List<String> syncErrors
) {
}
