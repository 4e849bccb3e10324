package com.wirecrest.scraper.schedule.model;

import java.util.List;

public record SplitResult(
    boolean split,
    long sourceEntryId,
    Long newEntryId,
    int movedSubscribers,
    String message,
    List<String> syncErrors
) {
    public static SplitResult skipped(long sourceEntryId, String message) {
        return new SplitResult(false, sourceEntryId, null, 0, message, List.of());
    }
}
