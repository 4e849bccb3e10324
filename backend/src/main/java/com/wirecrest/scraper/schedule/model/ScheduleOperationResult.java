package com.wirecrest.scraper.schedule.model;

import java.util.List;

/**
 * Outcome of a mapping mutation. {@code syncErrors} lists entries whose external job could not be
 * brought in line with the committed mappings; they stay flagged stale until reconciled.
 */
public record ScheduleOperationResult(
    OperationOutcome outcome,
    String message,
    List<Long> touchedEntryIds,
    List<String> failures,
    List<String> syncErrors
) {
    public ScheduleOperationResult {
        touchedEntryIds = touchedEntryIds == null ? List.of() : List.copyOf(touchedEntryIds);
        failures = failures == null ? List.of() : List.copyOf(failures);
        syncErrors = syncErrors == null ? List.of() : List.copyOf(syncErrors);
    }

    public boolean isSuccess() {
        return outcome.isSuccess();
    }

    public static ScheduleOperationResult noOp(String message) {
        return new ScheduleOperationResult(OperationOutcome.NO_OP, message, List.of(), List.of(), List.of());
    }

    public static ScheduleOperationResult rejected(String message) {
        return new ScheduleOperationResult(OperationOutcome.REJECTED, message, List.of(), List.of(message), List.of());
    }
}
