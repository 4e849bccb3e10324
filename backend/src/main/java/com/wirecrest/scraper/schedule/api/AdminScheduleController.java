package com.wirecrest.scraper.schedule.api;

import com.wirecrest.scraper.schedule.model.BatchGroupStats;
import com.wirecrest.scraper.schedule.model.ConsolidationResult;
import com.wirecrest.scraper.schedule.model.CustomIntervalOverride;
import com.wirecrest.scraper.schedule.model.JobKind;
import com.wirecrest.scraper.schedule.model.JobRunRecord;
import com.wirecrest.scraper.schedule.model.LifecycleReport;
import com.wirecrest.scraper.schedule.model.RebalanceResult;
import com.wirecrest.scraper.schedule.model.RebuildResult;
import com.wirecrest.scraper.schedule.model.ReconciliationSummary;
import com.wirecrest.scraper.schedule.model.ScheduleEntry;
import com.wirecrest.scraper.schedule.model.ScheduleHealthReport;
import com.wirecrest.scraper.schedule.model.SplitResult;
import com.wirecrest.scraper.schedule.model.SubscriberMapping;
import com.wirecrest.scraper.schedule.model.TargetType;
import com.wirecrest.scraper.schedule.persistence.JobRunJdbcRepository;
import com.wirecrest.scraper.schedule.platform.PlatformRun;
import com.wirecrest.scraper.schedule.service.BatchCapacityManager;
import com.wirecrest.scraper.schedule.service.IntervalScheduleRegistry;
import com.wirecrest.scraper.schedule.service.OperatorAlertService;
import com.wirecrest.scraper.schedule.service.ScheduleReconciliationService;
import com.wirecrest.scraper.schedule.service.SubscriptionLifecycleService;
import com.wirecrest.scraper.schedule.service.TeamFeatureService;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Locale;
import java.util.Map;

@RestController
@RequestMapping("/admin")
public class AdminScheduleController {
    private final IntervalScheduleRegistry registry;
    private final BatchCapacityManager capacityManager;
    private final SubscriptionLifecycleService lifecycleService;
    private final TeamFeatureService featureService;
    private final ScheduleReconciliationService reconciliationService;
    private final OperatorAlertService alertService;
    private final JobRunJdbcRepository jobRunRepository;

    public AdminScheduleController(
        IntervalScheduleRegistry registry,
        BatchCapacityManager capacityManager,
        SubscriptionLifecycleService lifecycleService,
        TeamFeatureService featureService,
        ScheduleReconciliationService reconciliationService,
        OperatorAlertService alertService,
        JobRunJdbcRepository jobRunRepository
    ) {
        this.registry = registry;
        this.capacityManager = capacityManager;
        this.lifecycleService = lifecycleService;
        this.featureService = featureService;
        this.reconciliationService = reconciliationService;
        this.alertService = alertService;
        this.jobRunRepository = jobRunRepository;
    }

    @GetMapping("/schedules")
    public List<ScheduleEntry> schedules() {
        return registry.listEntries();
    }

    @GetMapping("/schedules/{entryId}")
    public ScheduleEntry schedule(@PathVariable long entryId) {
        return registry.requireEntry(entryId);
    }

    @GetMapping("/schedules/{entryId}/subscribers")
    public List<SubscriberMapping> subscribers(@PathVariable long entryId) {
        return registry.subscribers(entryId);
    }

    @PostMapping("/schedules/{entryId}/trigger")
    public PlatformRun trigger(@PathVariable long entryId) {
        return registry.triggerRun(entryId);
    }

    @PostMapping("/schedules/{entryId}/pause")
    public RebuildResult pause(@PathVariable long entryId) {
        return registry.setPaused(entryId, true);
    }

    @PostMapping("/schedules/{entryId}/resume")
    public RebuildResult resume(@PathVariable long entryId) {
        return registry.setPaused(entryId, false);
    }

    @PostMapping("/schedules/{entryId}/rebuild")
    public RebuildResult rebuild(@PathVariable long entryId) {
        return registry.rebuildInput(entryId);
    }

    @PostMapping("/schedules/{entryId}/split")
    public SplitResult split(@PathVariable long entryId) {
        return capacityManager.split(entryId);
    }

    @GetMapping("/teams/{teamId}/schedules")
    public List<ScheduleEntry> teamSchedules(@PathVariable String teamId) {
        return registry.entriesForTenant(teamId);
    }

    @GetMapping("/teams/{teamId}/runs")
    public List<JobRunRecord> teamRuns(
        @PathVariable String teamId,
        @RequestParam(name = "limit", defaultValue = "50") int limit
    ) {
        return jobRunRepository.findRecentRuns(teamId, Math.min(limit, 500));
    }

    @PostMapping("/teams/{teamId}/custom-interval")
    public LifecycleReport setCustomInterval(@PathVariable String teamId, @RequestBody CustomIntervalRequest request) {
        if (request == null || request.intervalHours() == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "intervalHours is required");
        }
        return lifecycleService.applyCustomInterval(
            teamId,
            TargetType.fromKey(request.platform()),
            request.intervalHours(),
            request.reason(),
            request.setBy(),
            request.expiresAt()
        );
    }

    @DeleteMapping("/teams/{teamId}/custom-interval")
    public LifecycleReport clearCustomInterval(@PathVariable String teamId, @RequestParam("platform") String platform) {
        return lifecycleService.clearCustomInterval(teamId, TargetType.fromKey(platform));
    }

    @GetMapping("/custom-intervals")
    public List<CustomIntervalOverride> customIntervals() {
        return featureService.listCustomIntervals();
    }

    @PostMapping("/groups/rebalance")
    public RebalanceResult rebalance(
        @RequestParam("platform") String platform,
        @RequestParam(name = "jobKind", defaultValue = "reviews") String jobKind,
        @RequestParam("intervalHours") int intervalHours
    ) {
        return capacityManager.rebalance(TargetType.fromKey(platform), parseJobKind(jobKind), intervalHours);
    }

    @PostMapping("/groups/consolidate")
    public ConsolidationResult consolidate(
        @RequestParam("platform") String platform,
        @RequestParam(name = "jobKind", defaultValue = "reviews") String jobKind,
        @RequestParam("intervalHours") int intervalHours,
        @RequestParam(name = "threshold", required = false) Double threshold
    ) {
        TargetType targetType = TargetType.fromKey(platform);
        if (threshold == null) {
            return capacityManager.consolidate(targetType, parseJobKind(jobKind), intervalHours);
        }
        if (threshold < 0.0 || threshold > 1.0) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "threshold must be between 0 and 1");
        }
        return capacityManager.consolidate(targetType, parseJobKind(jobKind), intervalHours, threshold);
    }

    @GetMapping("/groups/stats")
    public BatchGroupStats groupStats(
        @RequestParam("platform") String platform,
        @RequestParam(name = "jobKind", defaultValue = "reviews") String jobKind,
        @RequestParam("intervalHours") int intervalHours
    ) {
        return capacityManager.groupStats(TargetType.fromKey(platform), parseJobKind(jobKind), intervalHours);
    }

    @GetMapping("/health")
    public ScheduleHealthReport health() {
        return capacityManager.healthStatus();
    }

    @PostMapping("/reconcile")
    public ReconciliationSummary reconcile() {
        return reconciliationService.reconcile();
    }

    @GetMapping("/alerts")
    public List<Map<String, Object>> alerts(@RequestParam(name = "limit", defaultValue = "50") int limit) {
        return alertService.recentAlerts(Math.min(limit, 500));
    }

    private static JobKind parseJobKind(String raw) {
        try {
            return JobKind.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Unknown jobKind: " + raw);
        }
    }
}
