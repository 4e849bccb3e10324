package com.wirecrest.scraper.schedule.service;

public class WebhookProcessingException extends RuntimeException {
    private final String runId;

    public WebhookProcessingException(String runId, Throwable cause) {
        super("Failed to process completion of run " + runId + ": " + cause.getMessage(), cause);
        this.runId = runId;
    }

    public String getRunId() {
        return runId;
    }
}
