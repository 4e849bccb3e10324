package com.wirecrest.scraper.schedule.platform;

import java.util.List;

public record WebhookSpec(
    List<String> eventTypes,
    String requestUrl,
    String payloadTemplate
) {
}
