package com.wirecrest.scraper.schedule.platform;

import com.fasterxml.jackson.databind.node.ObjectNode;

public record RecurringJobDefinition(
    String name,
    String cronExpression,
    String actorId,
    boolean enabled,
    ObjectNode input
) {
}
