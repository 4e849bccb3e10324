package com.wirecrest.scraper.schedule.platform;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory job platform. Keeps every recurring job it was asked to create and records started runs so
 * tests can assert on what would have been sent to the real platform.
 */
public class FakeJobPlatformClient implements JobPlatformClient {
    private final Map<String, Job> jobs = new ConcurrentHashMap<>();
    private final Map<String, List<JsonNode>> datasets = new ConcurrentHashMap<>();
    private final List<StartedRun> runs = new CopyOnWriteArrayList<>();
    private final List<String> deletedJobs = new CopyOnWriteArrayList<>();
    private final List<String> profileLookups = new CopyOnWriteArrayList<>();
    private final Set<String> missingProfiles = ConcurrentHashMap.newKeySet();
    private final AtomicInteger sequence = new AtomicInteger();
    private final AtomicBoolean failing = new AtomicBoolean(false);

    public void reset() {
        jobs.clear();
        datasets.clear();
        runs.clear();
        deletedJobs.clear();
        profileLookups.clear();
        missingProfiles.clear();
        failing.set(false);
    }

    public void setFailing(boolean failing) {
        this.failing.set(failing);
    }

    public void putDataset(String datasetId, List<JsonNode> items) {
        datasets.put(datasetId, List.copyOf(items));
    }

    /**
     * Makes profile lookups for the identifier come back empty, as they do for a deleted listing.
     */
    public void markProfileMissing(String identifier) {
        missingProfiles.add(identifier);
    }

    /**
     * Drops a recurring job behind the scheduler's back, as an operator deleting it in the platform UI would.
     */
    public void forgetJob(String jobId) {
        jobs.remove(jobId);
    }

    public List<String> profileLookups() {
        return List.copyOf(profileLookups);
    }

    public Optional<Job> job(String jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }

    public int jobCount() {
        return jobs.size();
    }

    public List<StartedRun> runs() {
        return List.copyOf(runs);
    }

    public List<String> deletedJobs() {
        return List.copyOf(deletedJobs);
    }

    @Override
    public String createRecurringJob(RecurringJobDefinition definition) {
        failIfRequested();
        String id = "job-" + sequence.incrementAndGet();
        jobs.put(id, new Job(id, definition.name(), definition.cronExpression(), definition.enabled(), definition.input()));
        return id;
    }

    @Override
    public Optional<RecurringJob> getRecurringJob(String jobId) {
        failIfRequested();
        Job job = jobs.get(jobId);
        if (job == null) {
            return Optional.empty();
        }
        return Optional.of(new RecurringJob(job.id(), job.name(), job.cronExpression(), job.enabled(), null));
    }

    @Override
    public void updateRecurringJob(String jobId, ObjectNode input, boolean enabled) {
        failIfRequested();
        Job job = jobs.get(jobId);
        if (job == null) {
            throw new JobPlatformException("http_error", 404, false, "Schedule " + jobId + " not found");
        }
        jobs.put(jobId, new Job(jobId, job.name(), job.cronExpression(), enabled, input.deepCopy()));
    }

    @Override
    public void setRecurringJobEnabled(String jobId, boolean enabled) {
        failIfRequested();
        Job job = jobs.get(jobId);
        if (job != null) {
            jobs.put(jobId, new Job(jobId, job.name(), job.cronExpression(), enabled, job.input()));
        }
    }

    @Override
    public void deleteRecurringJob(String jobId) {
        failIfRequested();
        jobs.remove(jobId);
        deletedJobs.add(jobId);
    }

    @Override
    public PlatformRun startRun(String actorId, ObjectNode input, List<WebhookSpec> webhooks) {
        failIfRequested();
        int n = sequence.incrementAndGet();
        PlatformRun run = new PlatformRun("run-" + n, "dataset-" + n, "RUNNING", Instant.now());
        runs.add(new StartedRun(run, actorId, input, new ArrayList<>(webhooks)));
        return run;
    }

    @Override
    public List<JsonNode> fetchDatasetItems(String datasetId) {
        failIfRequested();
        return datasets.getOrDefault(datasetId, List.of());
    }

    @Override
    public List<JsonNode> runSyncForItems(String actorId, ObjectNode input) {
        failIfRequested();
        String identifier = input.has("placeIds")
            ? input.path("placeIds").path(0).asText()
            : input.path("startUrls").path(0).path("url").asText();
        profileLookups.add(identifier);
        if (missingProfiles.contains(identifier)) {
            return List.of();
        }
        ObjectNode item = JsonNodeFactory.instance.objectNode();
        item.put("title", "Profile " + identifier);
        return List.of(item);
    }

    private void failIfRequested() {
        if (failing.get()) {
            throw new JobPlatformException("http_error", 503, true, "platform unavailable");
        }
    }

    public record Job(String id, String name, String cronExpression, boolean enabled, ObjectNode input) {
    }

    public record StartedRun(PlatformRun run, String actorId, ObjectNode input, List<WebhookSpec> webhooks) {
    }
}
