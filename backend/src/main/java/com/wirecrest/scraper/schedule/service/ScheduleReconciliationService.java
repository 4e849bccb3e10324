package com.wirecrest.scraper.schedule.service;

import com.wirecrest.scraper.config.SchedulerProperties;
import com.wirecrest.scraper.schedule.model.RebuildResult;
import com.wirecrest.scraper.schedule.model.ReconciliationSummary;
import com.wirecrest.scraper.schedule.model.ScheduleEntry;
import com.wirecrest.scraper.schedule.persistence.ScheduleJdbcRepository;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Repairs drift between the registry and the job platform: cached subscriber counts that disagree with
 * the mapping rows, and entries whose last input push failed.
 */
@Service
public class ScheduleReconciliationService {
    private static final Logger log = LoggerFactory.getLogger(ScheduleReconciliationService.class);

    private final ScheduleJdbcRepository repository;
    private final IntervalScheduleRegistry registry;
    private final OperatorAlertService alertService;
    private final SchedulerProperties properties;
    private final ScheduledExecutorService maintenanceExecutor;
    private final AtomicBoolean reconciling = new AtomicBoolean(false);
    private final Object lifecycleLock = new Object();

    private ScheduledFuture<?> periodicRun;

    public ScheduleReconciliationService(
        ScheduleJdbcRepository repository,
        IntervalScheduleRegistry registry,
        OperatorAlertService alertService,
        SchedulerProperties properties,
        @Qualifier("maintenanceExecutor") ScheduledExecutorService maintenanceExecutor
    ) {
        this.repository = repository;
        this.registry = registry;
        this.alertService = alertService;
        this.properties = properties;
        this.maintenanceExecutor = maintenanceExecutor;
    }

    @PostConstruct
    public void startIfEnabled() {
        if (properties.getReconciliation().isEnabled()) {
            start();
        }
    }

    @PreDestroy
    public void stopOnShutdown() {
        stop();
    }

    public void start() {
        synchronized (lifecycleLock) {
            if (periodicRun != null) {
                return;
            }
            long minutes = properties.getReconciliation().getIntervalMinutes();
            periodicRun = maintenanceExecutor.scheduleWithFixedDelay(this::reconcileSafely, minutes, minutes, TimeUnit.MINUTES);
            log.info("Schedule reconciliation every {} minutes", minutes);
        }
    }

    public void stop() {
        synchronized (lifecycleLock) {
            if (periodicRun != null) {
                periodicRun.cancel(false);
                periodicRun = null;
            }
        }
    }

    public ReconciliationSummary reconcile() {
        if (!reconciling.compareAndSet(false, true)) {
            return new ReconciliationSummary(0, 0, 0, List.of("Reconciliation already in progress"));
        }
        try {
            int checked = 0;
            int repaired = 0;
            int rebuilt = 0;
            List<String> failures = new ArrayList<>();
            for (ScheduleEntry entry : repository.findAllEntries()) {
                checked++;
                int actual = repository.countActiveMappings(entry.id());
                boolean drifted = actual != entry.subscriberCount() || entry.active() != (actual > 0);
                boolean missingJob = !entry.hasExternalJob() && actual > 0;
                if (!drifted && !entry.inputStale() && !missingJob) {
                    continue;
                }
                if (drifted) {
                    log.warn("Entry {} ({}) count drifted: cached {} actual {}", entry.id(), entry.name(), entry.subscriberCount(), actual);
                    repaired++;
                }
                RebuildResult result = registry.resyncIfPresent(entry.id());
                if (result.synced()) {
                    rebuilt++;
                } else {
                    failures.add("entry " + entry.id() + ": " + result.error());
                }
            }
            if (!failures.isEmpty()) {
                alertService.raise("reconciliation", "Schedule reconciliation left " + failures.size() + " entries unsynced",
                    Map.of("failures", failures));
            }
            log.info("Reconciled {} entries: {} counts repaired, {} inputs rebuilt, {} failures", checked, repaired, rebuilt, failures.size());
            return new ReconciliationSummary(checked, repaired, rebuilt, failures);
        } finally {
            reconciling.set(false);
        }
    }

    private void reconcileSafely() {
        try {
            reconcile();
        } catch (RuntimeException e) {
            log.warn("Periodic schedule reconciliation failed", e);
        }
    }
}
