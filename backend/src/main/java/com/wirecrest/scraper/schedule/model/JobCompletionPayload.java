package com.wirecrest.scraper.schedule.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Body the job platform posts when a run finishes. The trailing fields are filled by our own payload
 * template so scheduled runs can be traced back to their entry.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record JobCompletionPayload(
    String eventType,
    EventData eventData,
    Resource resource,
    String targetType,
    Long scheduleEntryId
) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record EventData(String actorId, String actorRunId) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Resource(String id, String status, String statusMessage, String defaultDatasetId) {
    }

    public String runId() {
        if (eventData != null && eventData.actorRunId() != null && !eventData.actorRunId().isBlank()) {
            return eventData.actorRunId();
        }
        return resource == null ? null : resource.id();
    }

    public String datasetId() {
        return resource == null ? null : resource.defaultDatasetId();
    }
}
