package com.wirecrest.scraper.schedule.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.wirecrest.scraper.schedule.model.CompletionEventType;
import com.wirecrest.scraper.schedule.model.DatasetProcessingResult;
import com.wirecrest.scraper.schedule.model.JobCompletionPayload;
import com.wirecrest.scraper.schedule.model.JobRunKind;
import com.wirecrest.scraper.schedule.model.JobRunRecord;
import com.wirecrest.scraper.schedule.model.JobRunStatus;
import com.wirecrest.scraper.schedule.model.ScheduleEntry;
import com.wirecrest.scraper.schedule.model.SubscriberMapping;
import com.wirecrest.scraper.schedule.model.TargetType;
import com.wirecrest.scraper.schedule.model.WebhookAck;
import com.wirecrest.scraper.schedule.persistence.JobRunJdbcRepository;
import com.wirecrest.scraper.schedule.persistence.ScheduleJdbcRepository;
import com.wirecrest.scraper.schedule.platform.JobPlatformClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Handles the platform's run-completion callbacks. Each run id is processed to completion at most once:
 * the event is claimed in the idempotency log before any side effect and released as failed when
 * processing throws, so the platform's redelivery can retry it.
 */
@Service
public class JobCompletionService {
    private static final Logger log = LoggerFactory.getLogger(JobCompletionService.class);
    private static final Duration STALE_PROCESSING = Duration.ofMinutes(10);

    private final JobRunJdbcRepository jobRunRepository;
    private final ScheduleJdbcRepository scheduleRepository;
    private final IntervalScheduleRegistry registry;
    private final JobPlatformClient platformClient;
    private final DatasetProcessorRouter processorRouter;
    private final OperatorAlertService alertService;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public JobCompletionService(
        JobRunJdbcRepository jobRunRepository,
        ScheduleJdbcRepository scheduleRepository,
        IntervalScheduleRegistry registry,
        JobPlatformClient platformClient,
        DatasetProcessorRouter processorRouter,
        OperatorAlertService alertService,
        TransactionTemplate transactionTemplate,
        Clock clock
    ) {
        this.jobRunRepository = jobRunRepository;
        this.scheduleRepository = scheduleRepository;
        this.registry = registry;
        this.platformClient = platformClient;
        this.processorRouter = processorRouter;
        this.alertService = alertService;
        this.transactionTemplate = transactionTemplate;
        this.clock = clock;
    }

    public WebhookAck handle(JobCompletionPayload payload) {
        if (payload == null) {
            throw new IllegalArgumentException("Webhook payload is required");
        }
        CompletionEventType eventType = CompletionEventType.parse(payload.eventType());
        if (eventType == CompletionEventType.TEST) {
            log.info("Received test webhook");
            return WebhookAck.skipped("test_event");
        }
        String runId = payload.runId();
        if (runId == null || runId.isBlank()) {
            throw new IllegalArgumentException("Webhook payload has no run id");
        }
        if (eventType == CompletionEventType.UNKNOWN) {
            log.warn("Ignoring webhook for run {} with unsupported event type {}", runId, payload.eventType());
            return WebhookAck.skipped("unsupported_event_type");
        }
        List<JobRunRecord> records = jobRunRepository.findRunsByExternalRunId(runId);
        Optional<ScheduleEntry> entry = resolveEntry(payload, records);
        TargetType targetType = resolveTargetType(payload, records, entry);

        Instant now = clock.instant();
        if (!jobRunRepository.claimWebhookEvent(runId, eventType.name(), now, now.minus(STALE_PROCESSING))) {
            log.info("Run {} already processed, skipping duplicate {} webhook", runId, eventType);
            return WebhookAck.skipped("already_processed");
        }
        try {
            int tenants = eventType == CompletionEventType.SUCCEEDED
                ? handleSucceeded(payload, runId, targetType, records, entry, now)
                : handleFailed(eventType, payload, runId, targetType, records, entry, now);
            jobRunRepository.finishWebhookEvent(runId, JobRunJdbcRepository.EVENT_PROCESSED, null);
            return WebhookAck.processed(tenants);
        } catch (RuntimeException e) {
            log.error("Processing completion of run {} failed", runId, e);
            jobRunRepository.finishWebhookEvent(runId, JobRunJdbcRepository.EVENT_FAILED, e.getMessage());
            alertService.raise(
                "webhook_processing:" + targetType.key(),
                "Failed to process " + targetType.key() + " run results",
                Map.of("runId", runId, "error", String.valueOf(e.getMessage()))
            );
            throw new WebhookProcessingException(runId, e);
        }
    }

    private int handleSucceeded(
        JobCompletionPayload payload,
        String runId,
        TargetType targetType,
        List<JobRunRecord> records,
        Optional<ScheduleEntry> entry,
        Instant now
    ) {
        String datasetId = payload.datasetId();
        if (datasetId == null || datasetId.isBlank()) {
            datasetId = records.stream()
                .map(JobRunRecord::externalDatasetId)
                .filter(id -> id != null && !id.isBlank())
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("Run " + runId + " reported no dataset"));
        }
        List<JsonNode> items = platformClient.fetchDatasetItems(datasetId);

        // Only launch-time records of single-tenant runs carry their tenant. Records written while
        // splitting a shared batch are per-tenant slices and never stand for the whole dataset.
        Optional<JobRunRecord> attributed = records.stream()
            .filter(r -> r.runKind() == JobRunKind.INITIAL && r.tenantId() != null)
            .findFirst();
        String resolvedDatasetId = datasetId;
        int tenants;
        if (attributed.isPresent()) {
            JobRunRecord record = attributed.get();
            DatasetProcessingResult result = processorRouter.process(record.tenantId(), targetType, items, true);
            jobRunRepository.completeRun(record.id(), JobRunStatus.SUCCEEDED, datasetId, result, null, now);
            tenants = 1;
        } else {
            Integer distributed = transactionTemplate.execute(status -> {
                int removed = jobRunRepository.deleteTenantSlices(runId);
                if (removed > 0) {
                    log.info("Discarded {} tenant records of an earlier attempt at run {}", removed, runId);
                }
                int count = distributeToTenants(runId, resolvedDatasetId, targetType, entry, items, now);
                for (JobRunRecord record : records) {
                    if (record.tenantId() == null) {
                        jobRunRepository.completeRun(record.id(), JobRunStatus.SUCCEEDED, resolvedDatasetId,
                            new DatasetProcessingResult(items.size(), 0, 0, 0), null, now);
                    }
                }
                return count;
            });
            tenants = distributed == null ? 0 : distributed;
        }
        entry.ifPresent(e -> registry.recordCompletedRun(e.id(), now));
        log.info("Run {} ({}) succeeded: {} items for {} tenants", runId, targetType, items.size(), tenants);
        return tenants;
    }

    /**
     * Splits the items of a shared batch run by tenant, using the identifier each item was scraped for,
     * and writes one run record per tenant.
     */
    private int distributeToTenants(
        String runId,
        String datasetId,
        TargetType targetType,
        Optional<ScheduleEntry> entry,
        List<JsonNode> items,
        Instant now
    ) {
        Map<String, List<JsonNode>> byIdentifier = new LinkedHashMap<>();
        int unidentified = 0;
        for (JsonNode item : items) {
            String identifier = targetType.extractIdentifier(item);
            if (identifier == null) {
                unidentified++;
                continue;
            }
            byIdentifier.computeIfAbsent(identifier, ignored -> new ArrayList<>()).add(item);
        }
        List<SubscriberMapping> mappings = scheduleRepository.findMappingsByIdentifiers(targetType, byIdentifier.keySet());
        Map<String, Set<String>> tenantsByIdentifier = new LinkedHashMap<>();
        for (SubscriberMapping mapping : mappings) {
            if (entry.isPresent() && mapping.jobKind() != entry.get().jobKind()) {
                continue;
            }
            tenantsByIdentifier.computeIfAbsent(mapping.externalIdentifier(), ignored -> new LinkedHashSet<>())
                .add(mapping.tenantId());
        }
        Map<String, List<JsonNode>> byTenant = new LinkedHashMap<>();
        for (Map.Entry<String, List<JsonNode>> group : byIdentifier.entrySet()) {
            Set<String> tenants = tenantsByIdentifier.get(group.getKey());
            if (tenants == null) {
                unidentified += group.getValue().size();
                continue;
            }
            for (String tenant : tenants) {
                byTenant.computeIfAbsent(tenant, ignored -> new ArrayList<>()).addAll(group.getValue());
            }
        }
        if (unidentified > 0) {
            log.warn("Run {} returned {} items that match no current subscriber", runId, unidentified);
        }
        JobRunKind runKind = entry.map(e -> JobRunKind.recurring(e.jobKind())).orElse(JobRunKind.RECURRING_REVIEWS);
        Long entryId = entry.map(ScheduleEntry::id).orElse(null);
        for (Map.Entry<String, List<JsonNode>> tenantItems : byTenant.entrySet()) {
            DatasetProcessingResult result = processorRouter.process(tenantItems.getKey(), targetType, tenantItems.getValue(), false);
            long recordId = jobRunRepository.insertRun(
                tenantItems.getKey(), targetType, runKind, entryId, runId, datasetId, JobRunStatus.RUNNING, now);
            jobRunRepository.completeRun(recordId, JobRunStatus.SUCCEEDED, datasetId, result, null, now);
        }
        return byTenant.size();
    }

    private int handleFailed(
        CompletionEventType eventType,
        JobCompletionPayload payload,
        String runId,
        TargetType targetType,
        List<JobRunRecord> records,
        Optional<ScheduleEntry> entry,
        Instant now
    ) {
        String reason = payload.resource() != null && payload.resource().statusMessage() != null
            ? payload.resource().statusMessage()
            : "Run " + eventType.name().toLowerCase(Locale.ROOT);
        if (records.isEmpty()) {
            JobRunKind runKind = entry.map(e -> JobRunKind.recurring(e.jobKind())).orElse(JobRunKind.RECURRING_REVIEWS);
            long recordId = jobRunRepository.insertRun(
                null, targetType, runKind, entry.map(ScheduleEntry::id).orElse(null),
                runId, payload.datasetId(), JobRunStatus.RUNNING, now);
            jobRunRepository.completeRun(recordId, JobRunStatus.FAILED, null, null, reason, now);
        } else {
            for (JobRunRecord record : records) {
                jobRunRepository.completeRun(record.id(), JobRunStatus.FAILED, null, null, reason, now);
            }
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("runId", runId);
        details.put("eventType", eventType.name());
        details.put("reason", reason);
        entry.ifPresent(e -> details.put("schedule", e.name()));
        records.stream().map(JobRunRecord::tenantId).filter(Objects::nonNull).findFirst()
            .ifPresent(tenant -> details.put("tenantId", tenant));
        String alertKey = "run_failed:" + targetType.key() + ":" + entry.map(e -> Long.toString(e.id())).orElse(runId);
        alertService.raise(alertKey, "Scrape run " + eventType.name().toLowerCase(Locale.ROOT) + " for " + targetType.key(), details);
        log.warn("Run {} ({}) {}: {}", runId, targetType, eventType, reason);
        return 0;
    }

    private Optional<ScheduleEntry> resolveEntry(JobCompletionPayload payload, List<JobRunRecord> records) {
        Long entryId = payload.scheduleEntryId();
        if (entryId == null) {
            entryId = records.stream()
                .map(JobRunRecord::scheduleEntryId)
                .filter(Objects::nonNull)
                .findFirst()
                .orElse(null);
        }
        return entryId == null ? Optional.empty() : scheduleRepository.findEntry(entryId);
    }

    private static TargetType resolveTargetType(JobCompletionPayload payload, List<JobRunRecord> records, Optional<ScheduleEntry> entry) {
        if (payload.targetType() != null && !payload.targetType().isBlank()) {
            return TargetType.fromKey(payload.targetType());
        }
        if (entry.isPresent()) {
            return entry.get().targetType();
        }
        return records.stream()
            .map(JobRunRecord::targetType)
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Cannot determine target type of run " + payload.runId()));
    }
}
