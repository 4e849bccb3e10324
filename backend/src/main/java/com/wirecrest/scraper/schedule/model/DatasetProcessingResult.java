package com.wirecrest.scraper.schedule.model;

public record DatasetProcessingResult(
    int itemsProcessed,
    int itemsNew,
    int itemsDuplicate,
    int targetsUpdated
) {
    public static DatasetProcessingResult empty() {
        return new DatasetProcessingResult(0, 0, 0, 0);
    }
}
