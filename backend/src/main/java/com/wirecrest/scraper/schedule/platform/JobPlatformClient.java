package com.wirecrest.scraper.schedule.platform;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;
import java.util.Optional;

/**
 * Recurring-job API of the scraping platform. Every method throws {@link JobPlatformException} when the
 * platform cannot be reached or rejects the call.
 */
public interface JobPlatformClient {

    /**
     * Creates a recurring job and returns its platform id.
     */
    String createRecurringJob(RecurringJobDefinition definition);

    Optional<RecurringJob> getRecurringJob(String jobId);

    /**
     * Replaces the run input of every action on the job, leaving the rest of its configuration intact.
     */
    void updateRecurringJob(String jobId, ObjectNode input, boolean enabled);

    void setRecurringJobEnabled(String jobId, boolean enabled);

    /**
     * Deletes the job. A job that no longer exists is treated as already deleted.
     */
    void deleteRecurringJob(String jobId);

    PlatformRun startRun(String actorId, ObjectNode input, List<WebhookSpec> webhooks);

    List<JsonNode> fetchDatasetItems(String datasetId);

    /**
     * Runs the actor to completion and returns its dataset items. Meant for small lookups only.
     */
    List<JsonNode> runSyncForItems(String actorId, ObjectNode input);
}
