package com.wirecrest.scraper.schedule.service;

import com.wirecrest.scraper.config.SchedulerProperties;
import com.wirecrest.scraper.schedule.model.JobKind;
import com.wirecrest.scraper.schedule.model.OperationOutcome;
import com.wirecrest.scraper.schedule.model.RebuildResult;
import com.wirecrest.scraper.schedule.model.ScheduleEntry;
import com.wirecrest.scraper.schedule.model.ScheduleOperationResult;
import com.wirecrest.scraper.schedule.model.SplitResult;
import com.wirecrest.scraper.schedule.model.SubscriberMapping;
import com.wirecrest.scraper.schedule.model.TargetType;
import com.wirecrest.scraper.schedule.persistence.ScheduleJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Single writer of subscriber mappings. Every mutation commits the mapping change and the recomputed
 * subscriber counts in one transaction, then re-syncs the affected external jobs.
 */
@Service
public class ScheduleOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(ScheduleOrchestrator.class);

    private final ScheduleJdbcRepository repository;
    private final IntervalScheduleRegistry registry;
    private final BatchCapacityManager capacityManager;
    private final TransactionTemplate transactionTemplate;
    private final SchedulerProperties properties;

    public ScheduleOrchestrator(
        ScheduleJdbcRepository repository,
        IntervalScheduleRegistry registry,
        BatchCapacityManager capacityManager,
        TransactionTemplate transactionTemplate,
        SchedulerProperties properties
    ) {
        this.repository = repository;
        this.registry = registry;
        this.capacityManager = capacityManager;
        this.transactionTemplate = transactionTemplate;
        this.properties = properties;
    }

    /**
     * Places the target in the shared batch of every job kind of its type at the given interval.
     * Repeating an identical call is a no-op; a target owned by another tenant, or already scheduled at
     * a different interval, is rejected without changes.
     */
    public ScheduleOperationResult addSubscriber(
        String targetId,
        String tenantId,
        TargetType targetType,
        String externalIdentifier,
        int intervalHours
    ) {
        if (isBlank(targetId) || isBlank(tenantId) || isBlank(externalIdentifier)) {
            return ScheduleOperationResult.rejected("targetId, tenantId and identifier are required");
        }
        if (intervalHours <= 0) {
            return ScheduleOperationResult.rejected("intervalHours must be positive");
        }
        String identifier = targetType.normalizeIdentifier(externalIdentifier);
        Map<JobKind, SubscriberMapping> existing = repository.findMappingsForTarget(targetId).stream()
            .collect(Collectors.toMap(SubscriberMapping::jobKind, Function.identity()));
        for (SubscriberMapping mapping : existing.values()) {
            if (!mapping.tenantId().equals(tenantId)) {
                return ScheduleOperationResult.rejected(
                    "Target " + targetId + " is already scheduled for another tenant");
            }
            if (mapping.targetType() != targetType) {
                return ScheduleOperationResult.rejected(
                    "Target " + targetId + " is already scheduled as " + mapping.targetType().key());
            }
            if (mapping.intervalHours() != intervalHours) {
                return ScheduleOperationResult.rejected(
                    "Target " + targetId + " is already scheduled every " + mapping.intervalHours()
                        + "h; move it instead");
            }
        }

        List<JobKind> missing = targetType.jobKinds().stream()
            .filter(kind -> !existing.containsKey(kind))
            .toList();
        if (missing.isEmpty()) {
            return ScheduleOperationResult.noOp("Target " + targetId + " is already scheduled every " + intervalHours + "h");
        }

        Set<Long> touched = new LinkedHashSet<>();
        List<String> failures = new ArrayList<>();
        List<String> syncErrors = new ArrayList<>();
        int attached = 0;
        for (JobKind jobKind : missing) {
            try {
                Optional<ScheduleEntry> entry = attach(targetId, tenantId, targetType, jobKind, identifier, intervalHours);
                if (entry.isEmpty()) {
                    // lost a race with an identical add
                    attached++;
                    continue;
                }
                attached++;
                touched.add(entry.get().id());
                touched.addAll(syncAfterGrowth(entry.get(), syncErrors));
            } catch (RuntimeException e) {
                log.warn("Failed to attach target {} ({}) for {}: {}", targetId, targetType, jobKind, e.getMessage());
                failures.add(jobKind + ": " + e.getMessage());
            }
        }
        OperationOutcome outcome;
        if (failures.isEmpty()) {
            outcome = OperationOutcome.APPLIED;
        } else if (attached > 0 || missing.size() < targetType.jobKinds().size()) {
            outcome = OperationOutcome.PARTIAL;
        } else {
            outcome = OperationOutcome.FAILED;
        }
        log.info("Added target {} for tenant {} ({} every {}h): {}", targetId, tenantId, targetType, intervalHours, outcome);
        return new ScheduleOperationResult(outcome, "Scheduled " + attached + " of " + missing.size() + " job kinds",
            new ArrayList<>(touched), failures, syncErrors);
    }

    /**
     * Moves every job-kind mapping of the target from its current interval to {@code toIntervalHours}.
     */
    public ScheduleOperationResult moveSubscriber(String targetId, TargetType targetType, int fromIntervalHours, int toIntervalHours) {
        if (toIntervalHours <= 0) {
            return ScheduleOperationResult.rejected("intervalHours must be positive");
        }
        List<SubscriberMapping> mappings = repository.findMappingsForTarget(targetId).stream()
            .filter(mapping -> mapping.targetType() == targetType)
            .toList();
        if (mappings.isEmpty()) {
            return ScheduleOperationResult.rejected("Target " + targetId + " is not scheduled");
        }
        Set<Long> touched = new LinkedHashSet<>();
        List<String> failures = new ArrayList<>();
        List<String> syncErrors = new ArrayList<>();
        int moved = 0;
        for (SubscriberMapping mapping : mappings) {
            if (mapping.intervalHours() == toIntervalHours) {
                continue;
            }
            if (mapping.intervalHours() != fromIntervalHours) {
                log.warn("Target {} {} mapping is at {}h, expected {}h; moving anyway",
                    targetId, mapping.jobKind(), mapping.intervalHours(), fromIntervalHours);
            }
            try {
                ScheduleEntry destination = relocate(mapping, toIntervalHours);
                moved++;
                touched.add(mapping.scheduleEntryId());
                touched.add(destination.id());
                collectSyncError(registry.resyncIfPresent(mapping.scheduleEntryId()), syncErrors);
                touched.addAll(syncAfterGrowth(destination, syncErrors));
            } catch (RuntimeException e) {
                log.warn("Failed to move target {} {} to {}h: {}", targetId, mapping.jobKind(), toIntervalHours, e.getMessage());
                failures.add(mapping.jobKind() + ": " + e.getMessage());
            }
        }
        if (moved == 0 && failures.isEmpty()) {
            return ScheduleOperationResult.noOp("Target " + targetId + " is already scheduled every " + toIntervalHours + "h");
        }
        OperationOutcome outcome = failures.isEmpty()
            ? OperationOutcome.APPLIED
            : moved > 0 ? OperationOutcome.PARTIAL : OperationOutcome.FAILED;
        log.info("Moved target {} ({}) from {}h to {}h: {}", targetId, targetType, fromIntervalHours, toIntervalHours, outcome);
        return new ScheduleOperationResult(outcome, "Moved " + moved + " job kinds to " + toIntervalHours + "h",
            new ArrayList<>(touched), failures, syncErrors);
    }

    /**
     * Deletes every mapping of the target. A target with no mappings is a successful no-op.
     */
    public ScheduleOperationResult removeSubscriber(String targetId, TargetType targetType) {
        List<SubscriberMapping> mappings = repository.findMappingsForTarget(targetId).stream()
            .filter(mapping -> targetType == null || mapping.targetType() == targetType)
            .toList();
        if (mappings.isEmpty()) {
            return ScheduleOperationResult.noOp("Target " + targetId + " is not scheduled");
        }
        Set<Long> touched = new LinkedHashSet<>();
        List<String> failures = new ArrayList<>();
        List<String> syncErrors = new ArrayList<>();
        for (SubscriberMapping mapping : mappings) {
            try {
                transactionTemplate.executeWithoutResult(status -> {
                    repository.lockEntry(mapping.scheduleEntryId());
                    repository.deleteMapping(mapping.id());
                    repository.recountSubscribers(mapping.scheduleEntryId());
                });
                touched.add(mapping.scheduleEntryId());
            } catch (RuntimeException e) {
                log.warn("Failed to remove target {} {}: {}", targetId, mapping.jobKind(), e.getMessage());
                failures.add(mapping.jobKind() + ": " + e.getMessage());
            }
        }
        for (Long entryId : touched) {
            collectSyncError(registry.resyncIfPresent(entryId), syncErrors);
        }
        OperationOutcome outcome = failures.isEmpty()
            ? OperationOutcome.APPLIED
            : touched.isEmpty() ? OperationOutcome.FAILED : OperationOutcome.PARTIAL;
        log.info("Removed target {} ({}) from {} entries: {}", targetId, targetType, touched.size(), outcome);
        return new ScheduleOperationResult(outcome, "Removed " + touched.size() + " mappings",
            new ArrayList<>(touched), failures, syncErrors);
    }

    public RebuildResult updateScheduleInput(long entryId) {
        return registry.rebuildInput(entryId);
    }

    public List<SubscriberMapping> mappingsForTenant(String tenantId) {
        return repository.findMappingsForTenant(tenantId);
    }

    /**
     * Inserts the mapping into an entry with spare capacity, re-checking capacity under the entry's row
     * lock. Returns empty if an identical mapping was inserted concurrently.
     */
    private Optional<ScheduleEntry> attach(
        String targetId,
        String tenantId,
        TargetType targetType,
        JobKind jobKind,
        String identifier,
        int intervalHours
    ) {
        int maxBatchSize = registry.maxBatchSize(targetType);
        int attempts = properties.getBatch().getMaxPlacementAttempts();
        for (int attempt = 1; attempt <= attempts; attempt++) {
            ScheduleEntry candidate = registry.getOrCreate(targetType, jobKind, intervalHours);
            AttachOutcome outcome;
            try {
                outcome = transactionTemplate.execute(status -> {
                    ScheduleEntry locked = repository.lockEntry(candidate.id()).orElse(null);
                    if (locked == null || locked.paused() || repository.countActiveMappings(candidate.id()) >= maxBatchSize) {
                        return AttachOutcome.FULL;
                    }
                    repository.insertMapping(targetId, tenantId, targetType, jobKind, candidate.id(), identifier, intervalHours);
                    repository.recountSubscribers(candidate.id());
                    return AttachOutcome.ATTACHED;
                });
            } catch (DuplicateKeyException e) {
                return Optional.empty();
            }
            if (outcome == AttachOutcome.ATTACHED) {
                return Optional.of(candidate);
            }
            log.debug("Entry {} filled up before target {} could be placed, retrying", candidate.id(), targetId);
        }
        throw new IllegalStateException("No capacity found for target " + targetId + " after " + attempts + " attempts");
    }

    private ScheduleEntry relocate(SubscriberMapping mapping, int toIntervalHours) {
        int maxBatchSize = registry.maxBatchSize(mapping.targetType());
        int attempts = properties.getBatch().getMaxPlacementAttempts();
        for (int attempt = 1; attempt <= attempts; attempt++) {
            ScheduleEntry candidate = registry.getOrCreate(mapping.targetType(), mapping.jobKind(), toIntervalHours);
            Boolean moved = transactionTemplate.execute(status -> {
                repository.lockEntry(Math.min(mapping.scheduleEntryId(), candidate.id()));
                repository.lockEntry(Math.max(mapping.scheduleEntryId(), candidate.id()));
                ScheduleEntry locked = repository.findEntry(candidate.id()).orElse(null);
                if (locked == null || locked.paused() || repository.countActiveMappings(candidate.id()) >= maxBatchSize) {
                    return false;
                }
                repository.reassignMappings(List.of(mapping.id()), candidate.id(), toIntervalHours);
                repository.recountSubscribers(mapping.scheduleEntryId());
                repository.recountSubscribers(candidate.id());
                return true;
            });
            if (Boolean.TRUE.equals(moved)) {
                return candidate;
            }
        }
        throw new IllegalStateException("No capacity found at " + toIntervalHours + "h after " + attempts + " attempts");
    }

    /**
     * Splits the entry if it reached capacity, otherwise re-syncs it. Returns the ids of entries touched.
     */
    private List<Long> syncAfterGrowth(ScheduleEntry entry, List<String> syncErrors) {
        if (capacityManager.shouldSplit(entry.id())) {
            SplitResult split = capacityManager.split(entry.id());
            syncErrors.addAll(split.syncErrors());
            return split.newEntryId() == null ? List.of(entry.id()) : List.of(entry.id(), split.newEntryId());
        }
        collectSyncError(registry.resyncIfPresent(entry.id()), syncErrors);
        return List.of(entry.id());
    }

    private static void collectSyncError(RebuildResult result, List<String> syncErrors) {
        if (!result.synced()) {
            syncErrors.add("entry " + result.entryId() + ": " + result.error());
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private enum AttachOutcome {
        ATTACHED,
        FULL
    }
}
