package com.wirecrest.scraper.schedule.model;

import java.util.List;

public record LifecycleReport(
    LifecycleEventType event,
    String teamId,
    boolean success,
    boolean deferred,
    String message,
    int succeeded,
    int failed,
    int initialRunsStarted,
    int profilesCreated,
    int targetsAdded,
    int targetsMoved,
    int targetsRemoved,
    List<String> failures
) {
    public LifecycleReport {
        failures = failures == null ? List.of() : List.copyOf(failures);
    }
}
