package com.wirecrest.scraper.schedule.model;

import java.util.List;

public record RebalanceResult(
    boolean success,
    int movedSubscribers,
    int batches,
    String message,
    List<String> syncErrors
) {
    public static RebalanceResult refused(String message) {
        return new RebalanceResult(false, 0, 0, message, List.of());
    }
}
