package com.wirecrest.scraper.schedule.service;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.wirecrest.scraper.config.SchedulerProperties;
import com.wirecrest.scraper.schedule.model.JobKind;
import com.wirecrest.scraper.schedule.model.JobRunKind;
import com.wirecrest.scraper.schedule.model.JobRunStatus;
import com.wirecrest.scraper.schedule.model.RebuildResult;
import com.wirecrest.scraper.schedule.model.ScheduleEntry;
import com.wirecrest.scraper.schedule.model.SubscriberMapping;
import com.wirecrest.scraper.schedule.model.TargetType;
import com.wirecrest.scraper.schedule.persistence.JobRunJdbcRepository;
import com.wirecrest.scraper.schedule.persistence.ScheduleJdbcRepository;
import com.wirecrest.scraper.schedule.platform.ActorInputFactory;
import com.wirecrest.scraper.schedule.platform.CronExpressions;
import com.wirecrest.scraper.schedule.platform.JobPlatformClient;
import com.wirecrest.scraper.schedule.platform.JobPlatformException;
import com.wirecrest.scraper.schedule.platform.PlatformRun;
import com.wirecrest.scraper.schedule.platform.RecurringJobDefinition;
import com.wirecrest.scraper.schedule.platform.WebhookSecurity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Owns the set of shared recurring jobs, one per (target type, job kind, interval, batch index), and keeps
 * each job's input in line with the subscriber mappings committed against it.
 */
@Service
public class IntervalScheduleRegistry {
    private static final Logger log = LoggerFactory.getLogger(IntervalScheduleRegistry.class);

    private final ScheduleJdbcRepository repository;
    private final JobRunJdbcRepository jobRunRepository;
    private final JobPlatformClient platformClient;
    private final ActorInputFactory inputFactory;
    private final WebhookSecurity webhookSecurity;
    private final SchedulerProperties properties;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public IntervalScheduleRegistry(
        ScheduleJdbcRepository repository,
        JobRunJdbcRepository jobRunRepository,
        JobPlatformClient platformClient,
        ActorInputFactory inputFactory,
        WebhookSecurity webhookSecurity,
        SchedulerProperties properties,
        TransactionTemplate transactionTemplate,
        Clock clock
    ) {
        this.repository = repository;
        this.jobRunRepository = jobRunRepository;
        this.platformClient = platformClient;
        this.inputFactory = inputFactory;
        this.webhookSecurity = webhookSecurity;
        this.properties = properties;
        this.transactionTemplate = transactionTemplate;
        this.clock = clock;
    }

    public int maxBatchSize(TargetType targetType) {
        return properties.getBatch().maxSizeFor(targetType.key(), targetType.defaultMaxBatchSize());
    }

    /**
     * Returns the lowest-indexed unpaused entry of the group with spare capacity, creating the next batch
     * when every existing one is full. Inactive entries are reused before new ones are created.
     */
    public ScheduleEntry getOrCreate(TargetType targetType, JobKind jobKind, int intervalHours) {
        requirePositiveInterval(intervalHours);
        int maxBatchSize = maxBatchSize(targetType);
        int attempts = properties.getBatch().getMaxPlacementAttempts();
        for (int attempt = 1; attempt <= attempts; attempt++) {
            Optional<ScheduleEntry> available = repository.findEntryWithCapacity(targetType, jobKind, intervalHours, maxBatchSize);
            if (available.isPresent()) {
                return available.get();
            }
            Optional<ScheduleEntry> created = tryCreateNextBatch(targetType, jobKind, intervalHours);
            if (created.isPresent()) {
                return created.get();
            }
        }
        throw new IllegalStateException(
            "Could not place a " + targetType.key() + "/" + jobKind + "/" + intervalHours + "h entry after " + attempts + " attempts"
        );
    }

    /**
     * Allocates a fresh batch at the next free index of the group, regardless of spare capacity elsewhere.
     */
    public ScheduleEntry createBatch(TargetType targetType, JobKind jobKind, int intervalHours) {
        requirePositiveInterval(intervalHours);
        int attempts = properties.getBatch().getMaxPlacementAttempts();
        for (int attempt = 1; attempt <= attempts; attempt++) {
            Optional<ScheduleEntry> created = tryCreateNextBatch(targetType, jobKind, intervalHours);
            if (created.isPresent()) {
                return created.get();
            }
        }
        throw new IllegalStateException("Could not allocate a new batch for " + targetType.key() + "/" + jobKind + "/" + intervalHours + "h");
    }

    private Optional<ScheduleEntry> tryCreateNextBatch(TargetType targetType, JobKind jobKind, int intervalHours) {
        Integer maxIndex = repository.findMaxBatchIndex(targetType, jobKind, intervalHours);
        int batchIndex = maxIndex == null ? 0 : maxIndex + 1;
        long entryId;
        try {
            entryId = repository.insertEntry(
                targetType,
                jobKind,
                intervalHours,
                batchIndex,
                CronExpressions.forInterval(intervalHours, batchIndex)
            );
        } catch (DuplicateKeyException e) {
            log.debug("Batch {} of {}/{}/{}h taken concurrently", batchIndex, targetType, jobKind, intervalHours);
            return Optional.empty();
        }
        ScheduleEntry entry = requireEntry(entryId);
        log.info("Created schedule entry {} ({}) cron={}", entryId, entry.name(), entry.cronExpression());
        try {
            createExternalJob(entry);
        } catch (JobPlatformException e) {
            log.warn("External job for entry {} not created yet ({}); it will be retried on the next rebuild", entryId, e.getMessage());
            repository.markSyncFailed(entryId, e.getMessage());
        }
        return Optional.of(requireEntry(entryId));
    }

    /**
     * Creates the disabled external recurring job for an entry and records its id. If another caller
     * attached a job first, the one created here is deleted and the existing id returned.
     */
    public String createExternalJob(ScheduleEntry entry) {
        RecurringJobDefinition definition = new RecurringJobDefinition(
            entry.name(),
            entry.cronExpression(),
            entry.targetType().actorId(),
            false,
            buildInput(entry, List.of())
        );
        String jobId = platformClient.createRecurringJob(definition);
        if (repository.assignExternalJob(entry.id(), jobId)) {
            return jobId;
        }
        log.info("Entry {} already has an external job, discarding duplicate {}", entry.id(), jobId);
        try {
            platformClient.deleteRecurringJob(jobId);
        } catch (JobPlatformException e) {
            log.warn("Failed to delete duplicate external job {}", jobId, e);
        }
        return requireEntry(entry.id()).externalJobId();
    }

    /**
     * Recomputes the entry's subscriber count from its mappings and pushes the matching identifier list
     * to the external job. The external job is enabled exactly when the entry has subscribers and is not
     * paused. Platform failures leave the entry flagged stale for reconciliation and are reported in the
     * result rather than thrown.
     */
    public RebuildResult rebuildInput(long entryId) {
        // recount under the entry lock so a concurrent attach cannot be overwritten by a stale count
        Integer count = transactionTemplate.execute(status -> {
            repository.lockEntry(entryId).orElseThrow(() -> new ScheduleNotFoundException(entryId));
            return repository.recountSubscribers(entryId);
        });
        ScheduleEntry entry = requireEntry(entryId);
        List<String> identifiers = repository.findMappingsForEntry(entryId).stream()
            .map(SubscriberMapping::externalIdentifier)
            .distinct()
            .toList();
        boolean enabled = entry.shouldBeEnabled();
        if (!entry.hasExternalJob() && count == 0) {
            repository.markSynced(entryId, clock.instant());
            return new RebuildResult(entryId, count, false, true, null);
        }
        try {
            String jobId = entry.hasExternalJob() ? entry.externalJobId() : createExternalJob(entry);
            ObjectNode input = buildInput(entry, identifiers);
            try {
                platformClient.updateRecurringJob(jobId, input, enabled);
            } catch (JobPlatformException e) {
                if (e.getStatusCode() != 404) {
                    throw e;
                }
                log.warn("External job {} of entry {} no longer exists, creating a replacement", jobId, entryId);
                repository.clearExternalJob(entryId, jobId);
                jobId = createExternalJob(requireEntry(entryId));
                platformClient.updateRecurringJob(jobId, input, enabled);
            }
            repository.markSynced(entryId, clock.instant());
            log.debug("Rebuilt entry {} with {} identifiers (enabled={})", entryId, identifiers.size(), enabled);
            return new RebuildResult(entryId, count, enabled, true, null);
        } catch (JobPlatformException e) {
            log.warn("Failed to sync entry {} ({}): {}", entryId, entry.name(), e.getMessage());
            repository.markSyncFailed(entryId, e.getMessage());
            return new RebuildResult(entryId, count, enabled, false, e.getMessage());
        }
    }

    /**
     * Same as {@link #rebuildInput(long)}, but an entry that no longer exists is reported as a failed sync
     * instead of thrown.
     */
    public RebuildResult resyncIfPresent(long entryId) {
        try {
            return rebuildInput(entryId);
        } catch (ScheduleNotFoundException e) {
            log.warn("Skipping sync of schedule entry {}: it no longer exists", entryId);
            return new RebuildResult(entryId, 0, false, false, e.getMessage());
        }
    }

    public RebuildResult setPaused(long entryId, boolean paused) {
        ScheduleEntry entry = requireEntry(entryId);
        repository.setPaused(entryId, paused);
        log.info("{} schedule entry {} ({})", paused ? "Paused" : "Resumed", entryId, entry.name());
        return rebuildInput(entryId);
    }

    /**
     * Removes an empty entry together with its external job. The row is deleted under its lock before the
     * external job is touched, so a subscriber attached concurrently keeps both. Returns false when the
     * entry is gone or still has mappings.
     */
    public boolean deleteEntry(long entryId) {
        Optional<ScheduleEntry> deleted = transactionTemplate.execute(status -> {
            Optional<ScheduleEntry> locked = repository.lockEntry(entryId);
            if (locked.isEmpty() || repository.deleteEmptyEntry(entryId) == 0) {
                return Optional.<ScheduleEntry>empty();
            }
            return locked;
        });
        if (deleted == null || deleted.isEmpty()) {
            log.info("Schedule entry {} kept: it is gone or still has subscribers", entryId);
            return false;
        }
        ScheduleEntry entry = deleted.get();
        log.info("Deleted schedule entry {} ({})", entryId, entry.name());
        if (entry.hasExternalJob()) {
            try {
                platformClient.deleteRecurringJob(entry.externalJobId());
            } catch (JobPlatformException e) {
                log.error("Schedule entry {} deleted but its external job {} could not be removed: {}",
                    entryId, entry.externalJobId(), e.getMessage());
            }
        }
        return true;
    }

    /**
     * Starts an immediate run of the entry's current batch outside its cron schedule.
     */
    public PlatformRun triggerRun(long entryId) {
        ScheduleEntry entry = requireEntry(entryId);
        List<String> identifiers = repository.findMappingsForEntry(entryId).stream()
            .map(SubscriberMapping::externalIdentifier)
            .distinct()
            .toList();
        if (identifiers.isEmpty()) {
            throw new IllegalStateException("Schedule entry " + entryId + " has no subscribers to run");
        }
        PlatformRun run = platformClient.startRun(
            entry.targetType().actorId(),
            inputFactory.build(entry.targetType(), identifiers, maxItemsFor(entry.jobKind())),
            webhookSecurity.webhooksFor(entry.targetType(), entryId)
        );
        jobRunRepository.insertRun(
            null,
            entry.targetType(),
            JobRunKind.recurring(entry.jobKind()),
            entryId,
            run.id(),
            run.datasetId(),
            JobRunStatus.RUNNING,
            run.startedAt() == null ? clock.instant() : run.startedAt()
        );
        log.info("Triggered manual run {} for entry {} ({} identifiers)", run.id(), entryId, identifiers.size());
        return run;
    }

    public void recordCompletedRun(long entryId, Instant completedAt) {
        Optional<ScheduleEntry> entry = repository.findEntry(entryId);
        if (entry.isEmpty()) {
            log.warn("Completed run references unknown schedule entry {}", entryId);
            return;
        }
        Instant nextRunAt = completedAt.plus(Duration.ofHours(entry.get().intervalHours()));
        repository.recordRun(entryId, completedAt, nextRunAt);
    }

    public ScheduleEntry requireEntry(long entryId) {
        return repository.findEntry(entryId).orElseThrow(() -> new ScheduleNotFoundException(entryId));
    }

    public List<ScheduleEntry> listEntries() {
        return repository.findAllEntries();
    }

    public List<ScheduleEntry> listEntries(TargetType targetType, JobKind jobKind, int intervalHours) {
        return repository.findEntriesForGroup(targetType, jobKind, intervalHours);
    }

    public List<ScheduleEntry> entriesForTenant(String tenantId) {
        return repository.findEntriesForTenant(tenantId);
    }

    public List<SubscriberMapping> subscribers(long entryId) {
        requireEntry(entryId);
        return repository.findMappingsForEntry(entryId);
    }

    private ObjectNode buildInput(ScheduleEntry entry, List<String> identifiers) {
        ObjectNode input = inputFactory.build(entry.targetType(), identifiers, maxItemsFor(entry.jobKind()));
        return inputFactory.withWebhooks(input, webhookSecurity.webhooksFor(entry.targetType(), entry.id()));
    }

    private int maxItemsFor(JobKind jobKind) {
        return jobKind == JobKind.OVERVIEW
            ? properties.getBatch().getOverviewMaxItemsPerRun()
            : properties.getBatch().getReviewsMaxItemsPerRun();
    }

    private static void requirePositiveInterval(int intervalHours) {
        if (intervalHours <= 0) {
            throw new IllegalArgumentException("intervalHours must be positive: " + intervalHours);
        }
    }
}
