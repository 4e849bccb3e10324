package com.wirecrest.scraper.schedule.service;

import com.wirecrest.scraper.schedule.model.CustomIntervalOverride;
import com.wirecrest.scraper.schedule.model.LifecycleEvent;
import com.wirecrest.scraper.schedule.model.LifecycleEventType;
import com.wirecrest.scraper.schedule.model.LifecycleReport;
import com.wirecrest.scraper.schedule.model.OperationOutcome;
import com.wirecrest.scraper.schedule.model.ScheduleOperationResult;
import com.wirecrest.scraper.schedule.model.SubscriberMapping;
import com.wirecrest.scraper.schedule.model.TargetType;
import com.wirecrest.scraper.schedule.model.TeamPlan;
import com.wirecrest.scraper.schedule.model.TrackedTarget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Translates billing and dashboard events into schedule changes. Each event type maps to one handler;
 * platforms and targets are processed independently so one failure does not abort the rest, and every
 * failure is listed in the returned report.
 */
@Service
public class SubscriptionLifecycleService {
    private static final Logger log = LoggerFactory.getLogger(SubscriptionLifecycleService.class);

    private final ScheduleOrchestrator orchestrator;
    private final TeamFeatureService featureService;
    private final TrackedTargetService targetService;
    private final InitialRunService initialRunService;
    private final Map<LifecycleEventType, Function<LifecycleEvent, LifecycleReport>> handlers;

    public SubscriptionLifecycleService(
        ScheduleOrchestrator orchestrator,
        TeamFeatureService featureService,
        TrackedTargetService targetService,
        InitialRunService initialRunService
    ) {
        this.orchestrator = orchestrator;
        this.featureService = featureService;
        this.targetService = targetService;
        this.initialRunService = initialRunService;
        Map<LifecycleEventType, Function<LifecycleEvent, LifecycleReport>> table = new EnumMap<>(LifecycleEventType.class);
        table.put(LifecycleEventType.SUBSCRIPTION_CREATED, this::onSubscriptionCreated);
        table.put(LifecycleEventType.SUBSCRIPTION_UPDATED, this::onSubscriptionUpdated);
        table.put(LifecycleEventType.SUBSCRIPTION_CANCELLED, this::onSubscriptionCancelled);
        table.put(LifecycleEventType.TARGET_ADDED, this::onTargetAdded);
        table.put(LifecycleEventType.TARGET_REMOVED, this::onTargetRemoved);
        this.handlers = table;
    }

    public LifecycleReport handle(LifecycleEvent event) {
        Function<LifecycleEvent, LifecycleReport> handler = handlers.get(event.type());
        if (handler == null) {
            throw new IllegalArgumentException("Unsupported lifecycle event " + event.type());
        }
        log.info("Handling {} for team {}", event.type(), event.teamId());
        LifecycleReport report;
        try {
            report = handler.apply(event);
        } catch (IllegalStateException e) {
            // unreadable plan or tenant state; nothing was changed for this team
            log.error("{} for team {} aborted", event.type(), event.teamId(), e);
            report = new Report(event.type(), event.teamId()).fail(e.getMessage());
        }
        if (report.success()) {
            log.info("{} for team {}: {}", event.type(), event.teamId(), report.message());
        } else {
            log.warn("{} for team {} finished with failures: {} {}", event.type(), event.teamId(), report.message(), report.failures());
        }
        return report;
    }

    public LifecycleReport handleNewSubscription(String teamId) {
        return handle(LifecycleEvent.subscriptionCreated(teamId));
    }

    public LifecycleReport handleSubscriptionUpdate(String teamId) {
        return handle(LifecycleEvent.subscriptionUpdated(teamId));
    }

    public LifecycleReport handleCancellation(String teamId) {
        return handle(LifecycleEvent.subscriptionCancelled(teamId));
    }

    public LifecycleReport handleTargetAdded(String teamId, TargetType targetType, String identifier) {
        return handle(LifecycleEvent.targetAdded(teamId, targetType, identifier));
    }

    public LifecycleReport handleTargetRemoved(String teamId, TargetType targetType, String identifier) {
        return handle(LifecycleEvent.targetRemoved(teamId, targetType, identifier));
    }

    /**
     * Stores an operator interval override and moves the team's existing targets on that platform to it.
     */
    public LifecycleReport applyCustomInterval(
        String teamId,
        TargetType targetType,
        int intervalHours,
        String reason,
        String setBy,
        Instant expiresAt
    ) {
        CustomIntervalOverride override = featureService.setCustomInterval(teamId, targetType, intervalHours, reason, setBy, expiresAt);
        Report report = new Report(LifecycleEventType.SUBSCRIPTION_UPDATED, teamId);
        moveToResolvedInterval(teamId, targetType, report);
        return report.build("Custom interval " + override.intervalHours() + "h applied to " + targetType.key());
    }

    public LifecycleReport clearCustomInterval(String teamId, TargetType targetType) {
        Report report = new Report(LifecycleEventType.SUBSCRIPTION_UPDATED, teamId);
        if (!featureService.removeCustomInterval(teamId, targetType)) {
            return report.build("No custom interval set for " + targetType.key());
        }
        moveToResolvedInterval(teamId, targetType, report);
        return report.build("Custom interval removed for " + targetType.key());
    }

    private LifecycleReport onSubscriptionCreated(LifecycleEvent event) {
        String teamId = event.teamId();
        Report report = new Report(event.type(), teamId);
        Optional<TeamPlan> plan = featureService.findPlan(teamId);
        if (plan.isEmpty() || !plan.get().isActive()) {
            return report.fail("Team has no active subscription");
        }
        List<TargetType> platforms = plan.get().enabledPlatforms();
        if (platforms.isEmpty()) {
            return report.fail("No platforms enabled for team");
        }
        for (TargetType platform : platforms) {
            try {
                scheduleExistingTargets(teamId, platform, report);
            } catch (RuntimeException e) {
                log.warn("Scheduling {} targets for team {} failed", platform, teamId, e);
                report.failure(platform.key() + ": " + e.getMessage());
            }
        }
        return report.build("Scheduled " + report.targetsAdded + " targets across " + platforms.size() + " platforms");
    }

    private void scheduleExistingTargets(String teamId, TargetType platform, Report report) {
        List<String> configured = targetService.configuredIdentifiers(teamId, platform);
        if (configured.isEmpty()) {
            log.debug("Team {} has no {} targets configured", teamId, platform);
            return;
        }
        List<String> identifiers = new ArrayList<>();
        List<TrackedTarget> ensured = new ArrayList<>();
        for (String identifier : configured) {
            try {
                TrackedTargetService.EnsuredTarget result = targetService.ensureTarget(teamId, platform, identifier);
                if (result.created()) {
                    report.profilesCreated++;
                }
                ensured.add(result.target());
                identifiers.add(result.target().externalIdentifier());
            } catch (RuntimeException e) {
                log.warn("Could not resolve {} target {} for team {}: {}", platform, identifier, teamId, e.getMessage());
                report.failure(platform.key() + " " + identifier + ": " + e.getMessage());
            }
        }
        if (ensured.isEmpty()) {
            return;
        }
        launchInitialRun(teamId, platform, identifiers, report);
        int intervalHours = featureService.resolveIntervalHours(teamId, platform);
        for (TrackedTarget target : ensured) {
            addSubscriber(teamId, platform, target, intervalHours, report);
        }
    }

    private ScheduleOperationResult addSubscriber(
        String teamId,
        TargetType platform,
        TrackedTarget target,
        int intervalHours,
        Report report
    ) {
        ScheduleOperationResult result;
        try {
            result = orchestrator.addSubscriber(target.id(), teamId, platform, target.externalIdentifier(), intervalHours);
        } catch (RuntimeException e) {
            log.warn("Scheduling {} target {} for team {} failed", platform, target.externalIdentifier(), teamId, e);
            report.failure(platform.key() + " " + target.externalIdentifier() + ": " + e.getMessage());
            return null;
        }
        report.record(platform, target.externalIdentifier(), result);
        if (result.outcome() == OperationOutcome.APPLIED || result.outcome() == OperationOutcome.PARTIAL) {
            report.targetsAdded++;
        }
        return result;
    }

    private LifecycleReport onSubscriptionUpdated(LifecycleEvent event) {
        String teamId = event.teamId();
        Report report = new Report(event.type(), teamId);
        Optional<TeamPlan> plan = featureService.findPlan(teamId);
        if (plan.isEmpty() || !plan.get().isActive()) {
            return report.fail("Team has no active subscription");
        }
        for (TargetType platform : plan.get().enabledPlatforms()) {
            try {
                moveToResolvedInterval(teamId, platform, report);
            } catch (RuntimeException e) {
                log.warn("Updating {} intervals for team {} failed", platform, teamId, e);
                report.failure(platform.key() + ": " + e.getMessage());
            }
        }
        return report.build("Moved " + report.targetsMoved + " targets to their new intervals");
    }

    private void moveToResolvedInterval(String teamId, TargetType platform, Report report) {
        int intervalHours = featureService.resolveIntervalHours(teamId, platform);
        Map<String, Integer> currentIntervals = new LinkedHashMap<>();
        for (SubscriberMapping mapping : orchestrator.mappingsForTenant(teamId)) {
            if (mapping.targetType() == platform) {
                currentIntervals.putIfAbsent(mapping.targetId(), mapping.intervalHours());
            }
        }
        for (Map.Entry<String, Integer> target : currentIntervals.entrySet()) {
            if (target.getValue() == intervalHours) {
                continue;
            }
            ScheduleOperationResult result;
            try {
                result = orchestrator.moveSubscriber(target.getKey(), platform, target.getValue(), intervalHours);
            } catch (RuntimeException e) {
                log.warn("Moving {} target {} for team {} failed", platform, target.getKey(), teamId, e);
                report.failure(platform.key() + " " + target.getKey() + ": " + e.getMessage());
                continue;
            }
            report.record(platform, target.getKey(), result);
            if (result.outcome() == OperationOutcome.APPLIED || result.outcome() == OperationOutcome.PARTIAL) {
                report.targetsMoved++;
            }
        }
    }

    private LifecycleReport onSubscriptionCancelled(LifecycleEvent event) {
        String teamId = event.teamId();
        Report report = new Report(event.type(), teamId);
        Map<String, TargetType> targets = new LinkedHashMap<>();
        for (SubscriberMapping mapping : orchestrator.mappingsForTenant(teamId)) {
            targets.putIfAbsent(mapping.targetId(), mapping.targetType());
        }
        for (Map.Entry<String, TargetType> target : targets.entrySet()) {
            ScheduleOperationResult result;
            try {
                result = orchestrator.removeSubscriber(target.getKey(), target.getValue());
            } catch (RuntimeException e) {
                log.warn("Removing {} target {} for team {} failed", target.getValue(), target.getKey(), teamId, e);
                report.failure(target.getValue().key() + " " + target.getKey() + ": " + e.getMessage());
                continue;
            }
            report.record(target.getValue(), target.getKey(), result);
            if (result.isSuccess()) {
                report.targetsRemoved++;
            }
        }
        return report.build("Removed " + report.targetsRemoved + " targets from shared schedules");
    }

    private LifecycleReport onTargetAdded(LifecycleEvent event) {
        String teamId = event.teamId();
        TargetType platform = event.targetType();
        Report report = new Report(event.type(), teamId);
        try {
            targetService.recordConfigured(teamId, platform, event.externalIdentifier());
        } catch (IllegalArgumentException e) {
            return report.fail(e.getMessage());
        }
        Optional<TeamPlan> plan = featureService.findPlan(teamId);
        if (plan.isEmpty() || !plan.get().isActive()) {
            return report.defer("No active subscription; target will be scheduled once the team subscribes");
        }
        if (!plan.get().hasPlatform(platform)) {
            return report.defer(platform.key() + " is not enabled for this team; target will be scheduled once it is");
        }
        TrackedTargetService.EnsuredTarget ensured;
        try {
            ensured = targetService.ensureTarget(teamId, platform, event.externalIdentifier());
        } catch (RuntimeException e) {
            log.warn("Could not resolve {} target {} for team {}: {}", platform, event.externalIdentifier(), teamId, e.getMessage());
            return report.fail(e.getMessage());
        }
        if (ensured.created()) {
            report.profilesCreated++;
        }
        TrackedTarget target = ensured.target();
        int intervalHours = featureService.resolveIntervalHours(teamId, platform);
        ScheduleOperationResult result = addSubscriber(teamId, platform, target, intervalHours, report);
        if (result == null) {
            return report.build("Scheduling failed for " + target.externalIdentifier());
        }
        if (result.outcome() == OperationOutcome.APPLIED || result.outcome() == OperationOutcome.PARTIAL) {
            launchInitialRun(teamId, platform, List.of(target.externalIdentifier()), report);
        }
        return report.build(result.message());
    }

    private LifecycleReport onTargetRemoved(LifecycleEvent event) {
        String teamId = event.teamId();
        TargetType platform = event.targetType();
        Report report = new Report(event.type(), teamId);
        targetService.forgetConfigured(teamId, platform, event.externalIdentifier());
        Optional<TrackedTarget> target = targetService.findTarget(teamId, platform, event.externalIdentifier());
        if (target.isEmpty()) {
            return report.build("Target is not tracked; nothing to remove");
        }
        ScheduleOperationResult result;
        try {
            result = orchestrator.removeSubscriber(target.get().id(), platform);
        } catch (RuntimeException e) {
            log.warn("Removing {} target {} for team {} failed", platform, target.get().externalIdentifier(), teamId, e);
            return report.fail(e.getMessage());
        }
        report.record(platform, target.get().externalIdentifier(), result);
        if (result.isSuccess()) {
            targetService.removeTarget(target.get().id());
            report.targetsRemoved++;
        }
        return report.build(result.message());
    }

    private void launchInitialRun(String teamId, TargetType platform, List<String> identifiers, Report report) {
        try {
            initialRunService.launch(teamId, platform, identifiers);
            report.initialRunsStarted++;
        } catch (RuntimeException e) {
            log.warn("Initial {} run for team {} could not be started: {}", platform, teamId, e.getMessage());
            report.failure(platform.key() + " initial run: " + e.getMessage());
        }
    }

    private static final class Report {
        private final LifecycleEventType event;
        private final String teamId;
        private final List<String> failures = new ArrayList<>();
        private int succeeded;
        private int failed;
        private int initialRunsStarted;
        private int profilesCreated;
        private int targetsAdded;
        private int targetsMoved;
        private int targetsRemoved;

        private Report(LifecycleEventType event, String teamId) {
            this.event = event;
            this.teamId = teamId;
        }

        private void record(TargetType platform, String target, ScheduleOperationResult result) {
            if (result.isSuccess()) {
                succeeded++;
                return;
            }
            failed++;
            failures.add(platform.key() + " " + target + ": " + result.message()
                + (result.failures().isEmpty() ? "" : " " + result.failures()));
        }

        private void failure(String message) {
            failed++;
            failures.add(message);
        }

        private LifecycleReport build(String message) {
            return new LifecycleReport(event, teamId, failed == 0, false, message, succeeded, failed,
                initialRunsStarted, profilesCreated, targetsAdded, targetsMoved, targetsRemoved, failures);
        }

        private LifecycleReport fail(String message) {
            failures.add(message);
            return new LifecycleReport(event, teamId, false, false, message, succeeded, failed + 1,
                initialRunsStarted, profilesCreated, targetsAdded, targetsMoved, targetsRemoved, failures);
        }

        private LifecycleReport defer(String message) {
            return new LifecycleReport(event, teamId, true, true, message, 0, 0, 0, 0, 0, 0, 0, List.of());
        }
    }
}
