package com.wirecrest.scraper.schedule.api;

public record LifecycleRequest(String teamId, String platform, String identifier) {
}
