package com.wirecrest.scraper.schedule.model;

import java.util.List;

public record ReconciliationSummary(
    int entriesChecked,
    int countsRepaired,
    int inputsRebuilt,
    List<String> failures
) {
}
