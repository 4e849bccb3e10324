package com.wirecrest.scraper.schedule.model;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record WebhookAck(
    boolean received,
    boolean processed,
    String reason,
    Integer tenantsProcessed
) {
    public static WebhookAck processed(int tenantsProcessed) {
        return new WebhookAck(true, true, null, tenantsProcessed);
    }

    public static WebhookAck skipped(String reason) {
        return new WebhookAck(true, false, reason, null);
    }
}
