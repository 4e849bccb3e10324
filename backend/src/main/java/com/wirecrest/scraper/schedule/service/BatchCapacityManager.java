package com.wirecrest.scraper.schedule.service;

import com.wirecrest.scraper.config.SchedulerProperties;
import com.wirecrest.scraper.schedule.model.BatchGroupStats;
import com.wirecrest.scraper.schedule.model.ConsolidationResult;
import com.wirecrest.scraper.schedule.model.HealthLevel;
import com.wirecrest.scraper.schedule.model.JobKind;
import com.wirecrest.scraper.schedule.model.RebalanceResult;
import com.wirecrest.scraper.schedule.model.RebuildResult;
import com.wirecrest.scraper.schedule.model.ScheduleEntry;
import com.wirecrest.scraper.schedule.model.ScheduleHealthReport;
import com.wirecrest.scraper.schedule.model.SplitResult;
import com.wirecrest.scraper.schedule.model.SubscriberMapping;
import com.wirecrest.scraper.schedule.model.TargetType;
import com.wirecrest.scraper.schedule.persistence.ScheduleJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.LongStream;

/**
 * Keeps batches of a (target type, job kind, interval) group within capacity: splits full batches,
 * spreads subscribers evenly and folds under-filled batches together. Mapping moves are committed in one
 * transaction per step and the affected external jobs are re-synced afterwards.
 */
@Service
public class BatchCapacityManager {
    private static final Logger log = LoggerFactory.getLogger(BatchCapacityManager.class);
    private static final double REBALANCE_SPREAD_RATIO = 0.2;

    private final ScheduleJdbcRepository repository;
    private final IntervalScheduleRegistry registry;
    private final TransactionTemplate transactionTemplate;
    private final SchedulerProperties properties;

    public BatchCapacityManager(
        ScheduleJdbcRepository repository,
        IntervalScheduleRegistry registry,
        TransactionTemplate transactionTemplate,
        SchedulerProperties properties
    ) {
        this.repository = repository;
        this.registry = registry;
        this.transactionTemplate = transactionTemplate;
        this.properties = properties;
    }

    public boolean shouldSplit(long entryId) {
        ScheduleEntry entry = registry.requireEntry(entryId);
        return repository.countActiveMappings(entryId) >= registry.maxBatchSize(entry.targetType());
    }

    /**
     * Moves the newer half of an entry's subscribers, by mapping creation order, into a new batch of the
     * same group. An entry with one subscriber or fewer is left alone.
     */
    public SplitResult split(long entryId) {
        ScheduleEntry source = registry.requireEntry(entryId);
        if (repository.countActiveMappings(entryId) <= 1) {
            return SplitResult.skipped(entryId, "Entry has too few subscribers to split");
        }
        ScheduleEntry target = registry.createBatch(source.targetType(), source.jobKind(), source.intervalHours());
        Integer moved = transactionTemplate.execute(status -> {
            lockInOrder(entryId, target.id());
            List<SubscriberMapping> mappings = repository.findMappingsForEntry(entryId);
            if (mappings.size() <= 1) {
                return 0;
            }
            List<Long> toMove = mappings.subList(mappings.size() / 2, mappings.size()).stream()
                .map(SubscriberMapping::id)
                .toList();
            repository.reassignMappings(toMove, target.id(), source.intervalHours());
            repository.recountSubscribers(entryId);
            repository.recountSubscribers(target.id());
            return toMove.size();
        });
        int movedCount = moved == null ? 0 : moved;
        List<String> syncErrors = new ArrayList<>();
        collectSyncError(registry.resyncIfPresent(entryId), syncErrors);
        collectSyncError(registry.resyncIfPresent(target.id()), syncErrors);
        log.info("Split entry {} ({}): moved {} subscribers to entry {} ({})",
            entryId, source.name(), movedCount, target.id(), target.name());
        return new SplitResult(movedCount > 0, entryId, target.id(), movedCount,
            "Moved " + movedCount + " subscribers to batch " + target.batchIndex(), syncErrors);
    }

    /**
     * Redistributes the subscribers of the group's unpaused batches so that batch i holds subscribers
     * [i*t, (i+1)*t) with t = ceil(total / batches). Refuses without changes if t exceeds capacity.
     */
    public RebalanceResult rebalance(TargetType targetType, JobKind jobKind, int intervalHours) {
        List<ScheduleEntry> entries = unpausedEntries(targetType, jobKind, intervalHours);
        if (entries.size() <= 1) {
            return new RebalanceResult(true, 0, entries.size(), "Nothing to rebalance", List.of());
        }
        int maxBatchSize = registry.maxBatchSize(targetType);
        RebalancePlan plan = transactionTemplate.execute(status -> {
            lockInOrder(entries.stream().mapToLong(ScheduleEntry::id).toArray());
            List<SubscriberMapping> all = new ArrayList<>();
            for (ScheduleEntry entry : entries) {
                all.addAll(repository.findMappingsForEntry(entry.id()));
            }
            int total = all.size();
            int perBatch = (int) Math.ceil((double) total / entries.size());
            if (perBatch > maxBatchSize) {
                return new RebalancePlan(false, 0,
                    "Cannot rebalance: " + perBatch + " per batch exceeds capacity " + maxBatchSize);
            }
            if (total == 0) {
                return new RebalancePlan(true, 0, "Group has no subscribers");
            }
            Map<Long, List<Long>> moves = new LinkedHashMap<>();
            for (int i = 0; i < all.size(); i++) {
                SubscriberMapping mapping = all.get(i);
                long destination = entries.get(i / perBatch).id();
                if (mapping.scheduleEntryId() != destination) {
                    moves.computeIfAbsent(destination, ignored -> new ArrayList<>()).add(mapping.id());
                }
            }
            int movedCount = 0;
            for (Map.Entry<Long, List<Long>> move : moves.entrySet()) {
                repository.reassignMappings(move.getValue(), move.getKey(), intervalHours);
                movedCount += move.getValue().size();
            }
            for (ScheduleEntry entry : entries) {
                repository.recountSubscribers(entry.id());
            }
            return new RebalancePlan(true, movedCount, "Rebalanced " + total + " subscribers at " + perBatch + " per batch");
        });
        if (plan == null || !plan.applied()) {
            String message = plan == null ? "Rebalance aborted" : plan.message();
            log.warn("Rebalance of {}/{}/{}h refused: {}", targetType, jobKind, intervalHours, message);
            return RebalanceResult.refused(message);
        }
        List<String> syncErrors = new ArrayList<>();
        if (plan.moved() > 0) {
            for (ScheduleEntry entry : entries) {
                collectSyncError(registry.resyncIfPresent(entry.id()), syncErrors);
            }
        }
        log.info("Rebalanced {}/{}/{}h: moved {} subscribers across {} batches",
            targetType, jobKind, intervalHours, plan.moved(), entries.size());
        return new RebalanceResult(true, plan.moved(), entries.size(), plan.message(), syncErrors);
    }

    public ConsolidationResult consolidate(TargetType targetType, JobKind jobKind, int intervalHours) {
        return consolidate(targetType, jobKind, intervalHours, properties.getBatch().getConsolidationThreshold());
    }

    /**
     * Merges each batch below {@code threshold * capacity} into another batch of the group that can take
     * all of its subscribers, then deletes the emptied batch and its external job.
     */
    public ConsolidationResult consolidate(TargetType targetType, JobKind jobKind, int intervalHours, double threshold) {
        List<ScheduleEntry> entries = unpausedEntries(targetType, jobKind, intervalHours);
        if (entries.size() <= 1) {
            return new ConsolidationResult(true, 0, 0, "Nothing to consolidate", List.of());
        }
        int maxBatchSize = registry.maxBatchSize(targetType);
        int minSize = (int) Math.floor(maxBatchSize * threshold);
        Map<Long, Integer> counts = new HashMap<>();
        for (ScheduleEntry entry : entries) {
            counts.put(entry.id(), repository.countActiveMappings(entry.id()));
        }
        List<ScheduleEntry> ordered = new ArrayList<>(entries);
        ordered.sort(Comparator.<ScheduleEntry>comparingInt(e -> counts.get(e.id())).thenComparingInt(ScheduleEntry::batchIndex));

        Set<Long> retired = new HashSet<>();
        List<String> syncErrors = new ArrayList<>();
        int removed = 0;
        int movedTotal = 0;
        for (ScheduleEntry small : ordered) {
            if (retired.contains(small.id())) {
                continue;
            }
            int smallCount = counts.get(small.id());
            if (smallCount >= minSize) {
                continue;
            }
            Optional<ScheduleEntry> destination = ordered.stream()
                .filter(e -> e.id() != small.id() && !retired.contains(e.id()))
                .filter(e -> counts.get(e.id()) + smallCount <= maxBatchSize)
                .findFirst();
            if (destination.isEmpty()) {
                continue;
            }
            ScheduleEntry target = destination.get();
            Integer moved = transactionTemplate.execute(status -> {
                lockInOrder(small.id(), target.id());
                List<Long> ids = repository.findMappingsForEntry(small.id()).stream()
                    .map(SubscriberMapping::id)
                    .toList();
                repository.reassignMappings(ids, target.id(), intervalHours);
                repository.recountSubscribers(small.id());
                repository.recountSubscribers(target.id());
                return ids.size();
            });
            int movedCount = moved == null ? 0 : moved;
            movedTotal += movedCount;
            counts.put(target.id(), counts.get(target.id()) + movedCount);
            counts.put(small.id(), 0);
            retired.add(small.id());
            collectSyncError(registry.resyncIfPresent(target.id()), syncErrors);
            if (registry.deleteEntry(small.id())) {
                removed++;
            } else {
                // picked up a subscriber after the merge
                collectSyncError(registry.resyncIfPresent(small.id()), syncErrors);
            }
        }
        log.info("Consolidated {}/{}/{}h: removed {} batches, moved {} subscribers",
            targetType, jobKind, intervalHours, removed, movedTotal);
        return new ConsolidationResult(true, removed, movedTotal,
            "Removed " + removed + " under-filled batches", syncErrors);
    }

    public ScheduleHealthReport healthStatus() {
        int healthy = 0;
        int warning = 0;
        int critical = 0;
        List<ScheduleHealthReport.Detail> details = new ArrayList<>();
        for (ScheduleEntry entry : registry.listEntries()) {
            int maxBatchSize = registry.maxBatchSize(entry.targetType());
            double loadPercent = entry.subscriberCount() * 100.0 / maxBatchSize;
            HealthLevel level = HealthLevel.forLoadPercent(loadPercent);
            switch (level) {
                case CRITICAL -> critical++;
                case WARNING -> warning++;
                default -> healthy++;
            }
            if (level != HealthLevel.HEALTHY) {
                details.add(new ScheduleHealthReport.Detail(
                    entry.id(), entry.name(), entry.subscriberCount(), maxBatchSize, loadPercent, level
                ));
            }
        }
        return new ScheduleHealthReport(healthy, warning, critical, details);
    }

    public BatchGroupStats groupStats(TargetType targetType, JobKind jobKind, int intervalHours) {
        List<ScheduleEntry> entries = registry.listEntries(targetType, jobKind, intervalHours);
        List<Integer> sizes = entries.stream().map(ScheduleEntry::subscriberCount).toList();
        int total = sizes.stream().mapToInt(Integer::intValue).sum();
        int min = sizes.stream().mapToInt(Integer::intValue).min().orElse(0);
        int max = sizes.stream().mapToInt(Integer::intValue).max().orElse(0);
        double average = sizes.isEmpty() ? 0.0 : (double) total / sizes.size();
        boolean needsRebalancing = sizes.size() > 1 && (max - min) > average * REBALANCE_SPREAD_RATIO;
        return new BatchGroupStats(
            targetType,
            jobKind,
            intervalHours,
            registry.maxBatchSize(targetType),
            sizes.size(),
            total,
            average,
            min,
            max,
            needsRebalancing,
            sizes
        );
    }

    private List<ScheduleEntry> unpausedEntries(TargetType targetType, JobKind jobKind, int intervalHours) {
        return registry.listEntries(targetType, jobKind, intervalHours).stream()
            .filter(entry -> !entry.paused())
            .toList();
    }

    private void lockInOrder(long... entryIds) {
        LongStream.of(entryIds).sorted().distinct().forEach(repository::lockEntry);
    }

    private static void collectSyncError(RebuildResult result, List<String> syncErrors) {
        if (!result.synced()) {
            syncErrors.add("entry " + result.entryId() + ": " + result.error());
        }
    }

    private record RebalancePlan(boolean applied, int moved, String message) {
    }
}
