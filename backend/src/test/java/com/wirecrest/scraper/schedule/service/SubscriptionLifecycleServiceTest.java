package com.wirecrest.scraper.schedule.service;

import com.wirecrest.scraper.schedule.model.JobKind;
import com.wirecrest.scraper.schedule.model.LifecycleReport;
import com.wirecrest.scraper.schedule.model.OperationOutcome;
import com.wirecrest.scraper.schedule.model.ScheduleOperationResult;
import com.wirecrest.scraper.schedule.model.SubscriberMapping;
import com.wirecrest.scraper.schedule.model.SubscriptionTier;
import com.wirecrest.scraper.schedule.model.TargetType;
import com.wirecrest.scraper.schedule.model.TeamPlan;
import com.wirecrest.scraper.schedule.model.TrackedTarget;
import com.wirecrest.scraper.schedule.platform.JobPlatformException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.verifyNoMoreInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SubscriptionLifecycleServiceTest {
    private static final String TEAM = "team-1";

    @Mock
    private ScheduleOrchestrator orchestrator;

    @Mock
    private TeamFeatureService featureService;

    @Mock
    private TrackedTargetService targetService;

    @Mock
    private InitialRunService initialRunService;

    private SubscriptionLifecycleService service;

    @BeforeEach
    void setUp() {
        service = new SubscriptionLifecycleService(orchestrator, featureService, targetService, initialRunService);
    }

    @Test
    void newSubscriptionIsolatesFailingPlatform() {
        when(featureService.findPlan(TEAM)).thenReturn(Optional.of(plan(List.of(TargetType.GOOGLE, TargetType.FACEBOOK))));
        when(targetService.configuredIdentifiers(TEAM, TargetType.GOOGLE))
            .thenThrow(new DataAccessResourceFailureException("connection reset"));
        TrackedTarget page = target("t-fb", TargetType.FACEBOOK, "https://facebook.com/acme");
        when(targetService.configuredIdentifiers(TEAM, TargetType.FACEBOOK)).thenReturn(List.of(page.externalIdentifier()));
        when(targetService.ensureTarget(TEAM, TargetType.FACEBOOK, page.externalIdentifier()))
            .thenReturn(new TrackedTargetService.EnsuredTarget(page, false));
        when(featureService.resolveIntervalHours(TEAM, TargetType.FACEBOOK)).thenReturn(24);
        when(orchestrator.addSubscriber("t-fb", TEAM, TargetType.FACEBOOK, page.externalIdentifier(), 24))
            .thenReturn(applied());

        LifecycleReport report = service.handleNewSubscription(TEAM);

        assertThat(report.success()).isFalse();
        assertThat(report.targetsAdded()).isEqualTo(1);
        assertThat(report.initialRunsStarted()).isEqualTo(1);
        assertThat(report.failures()).singleElement().asString().startsWith("google");
        verify(initialRunService).launch(TEAM, TargetType.FACEBOOK, List.of(page.externalIdentifier()));
    }

    @Test
    void newSubscriptionWithoutActivePlanFails() {
        when(featureService.findPlan(TEAM)).thenReturn(Optional.empty());

        LifecycleReport report = service.handleNewSubscription(TEAM);

        assertThat(report.success()).isFalse();
        verifyNoInteractions(orchestrator, initialRunService);
    }

    @Test
    void initialRunFailureDoesNotBlockScheduling() {
        when(featureService.findPlan(TEAM)).thenReturn(Optional.of(plan(List.of(TargetType.GOOGLE))));
        TrackedTarget place = target("t-1", TargetType.GOOGLE, "place-1");
        when(targetService.configuredIdentifiers(TEAM, TargetType.GOOGLE)).thenReturn(List.of("place-1"));
        when(targetService.ensureTarget(TEAM, TargetType.GOOGLE, "place-1"))
            .thenReturn(new TrackedTargetService.EnsuredTarget(place, true));
        when(initialRunService.launch(eq(TEAM), eq(TargetType.GOOGLE), anyList()))
            .thenThrow(new JobPlatformException("http_error", 503, true, "unavailable"));
        when(featureService.resolveIntervalHours(TEAM, TargetType.GOOGLE)).thenReturn(12);
        when(orchestrator.addSubscriber("t-1", TEAM, TargetType.GOOGLE, "place-1", 12)).thenReturn(applied());

        LifecycleReport report = service.handleNewSubscription(TEAM);

        assertThat(report.targetsAdded()).isEqualTo(1);
        assertThat(report.profilesCreated()).isEqualTo(1);
        assertThat(report.initialRunsStarted()).isZero();
        assertThat(report.failures()).hasSize(1);
    }

    @Test
    void newSubscriptionSkipsUnresolvableProfileAndSchedulesTheRest() {
        when(featureService.findPlan(TEAM)).thenReturn(Optional.of(plan(List.of(TargetType.GOOGLE))));
        when(targetService.configuredIdentifiers(TEAM, TargetType.GOOGLE)).thenReturn(List.of("place-gone", "place-1"));
        when(targetService.ensureTarget(TEAM, TargetType.GOOGLE, "place-gone"))
            .thenThrow(new JobPlatformException("profile_not_found", 404, false, "No google profile found for place-gone"));
        TrackedTarget place = target("t-1", TargetType.GOOGLE, "place-1");
        when(targetService.ensureTarget(TEAM, TargetType.GOOGLE, "place-1"))
            .thenReturn(new TrackedTargetService.EnsuredTarget(place, true));
        when(featureService.resolveIntervalHours(TEAM, TargetType.GOOGLE)).thenReturn(24);
        when(orchestrator.addSubscriber("t-1", TEAM, TargetType.GOOGLE, "place-1", 24)).thenReturn(applied());

        LifecycleReport report = service.handleNewSubscription(TEAM);

        assertThat(report.success()).isFalse();
        assertThat(report.profilesCreated()).isEqualTo(1);
        assertThat(report.targetsAdded()).isEqualTo(1);
        assertThat(report.failures()).singleElement().asString().contains("place-gone");
        verify(initialRunService).launch(TEAM, TargetType.GOOGLE, List.of("place-1"));
    }

    @Test
    void newSubscriptionReportsSchedulingErrorPerTarget() {
        when(featureService.findPlan(TEAM)).thenReturn(Optional.of(plan(List.of(TargetType.GOOGLE))));
        when(targetService.configuredIdentifiers(TEAM, TargetType.GOOGLE)).thenReturn(List.of("place-1", "place-2"));
        TrackedTarget first = target("t-1", TargetType.GOOGLE, "place-1");
        TrackedTarget second = target("t-2", TargetType.GOOGLE, "place-2");
        when(targetService.ensureTarget(TEAM, TargetType.GOOGLE, "place-1"))
            .thenReturn(new TrackedTargetService.EnsuredTarget(first, false));
        when(targetService.ensureTarget(TEAM, TargetType.GOOGLE, "place-2"))
            .thenReturn(new TrackedTargetService.EnsuredTarget(second, false));
        when(featureService.resolveIntervalHours(TEAM, TargetType.GOOGLE)).thenReturn(24);
        when(orchestrator.addSubscriber("t-1", TEAM, TargetType.GOOGLE, "place-1", 24))
            .thenThrow(new ScheduleNotFoundException(10L));
        when(orchestrator.addSubscriber("t-2", TEAM, TargetType.GOOGLE, "place-2", 24)).thenReturn(applied());

        LifecycleReport report = service.handleNewSubscription(TEAM);

        assertThat(report.targetsAdded()).isEqualTo(1);
        assertThat(report.failures()).singleElement().asString().contains("place-1");
    }

    @Test
    void unreadablePlanIsReportedAsFailure() {
        when(featureService.findPlan(TEAM)).thenThrow(new IllegalStateException("Team plan lists unknown platform 'yelp'"));

        LifecycleReport report = service.handleNewSubscription(TEAM);

        assertThat(report.success()).isFalse();
        assertThat(report.failures()).singleElement().asString().contains("yelp");
        verifyNoInteractions(orchestrator, initialRunService);
    }

    @Test
    void cancellationContinuesPastFailingTarget() {
        when(orchestrator.mappingsForTenant(TEAM)).thenReturn(List.of(
            mapping("t-1", JobKind.REVIEWS), mapping("t-2", JobKind.REVIEWS), mapping("t-3", JobKind.REVIEWS)));
        when(orchestrator.removeSubscriber(anyString(), eq(TargetType.GOOGLE))).thenReturn(applied());
        when(orchestrator.removeSubscriber("t-2", TargetType.GOOGLE)).thenThrow(new ScheduleNotFoundException(10L));

        LifecycleReport report = service.handleCancellation(TEAM);

        assertThat(report.success()).isFalse();
        assertThat(report.targetsRemoved()).isEqualTo(2);
        assertThat(report.failures()).singleElement().asString().contains("t-2");
        verify(orchestrator).removeSubscriber("t-3", TargetType.GOOGLE);
    }

    @Test
    void cancellationRemovesEveryDistinctTarget() {
        List<SubscriberMapping> mappings = new ArrayList<>();
        for (int i = 1; i <= 3; i++) {
            mappings.add(mapping("t-" + i, JobKind.REVIEWS));
            mappings.add(mapping("t-" + i, JobKind.OVERVIEW));
        }
        when(orchestrator.mappingsForTenant(TEAM)).thenReturn(mappings);
        when(orchestrator.removeSubscriber(anyString(), eq(TargetType.GOOGLE))).thenReturn(applied());

        LifecycleReport report = service.handleCancellation(TEAM);

        assertThat(report.success()).isTrue();
        assertThat(report.targetsRemoved()).isEqualTo(3);
        verify(orchestrator, times(3)).removeSubscriber(anyString(), eq(TargetType.GOOGLE));
    }

    @Test
    void targetAddedWithoutSubscriptionIsDeferred() {
        when(featureService.findPlan(TEAM)).thenReturn(Optional.empty());

        LifecycleReport report = service.handleTargetAdded(TEAM, TargetType.GOOGLE, "place-1");

        assertThat(report.success()).isTrue();
        assertThat(report.deferred()).isTrue();
        verify(targetService).recordConfigured(TEAM, TargetType.GOOGLE, "place-1");
        verifyNoMoreInteractions(targetService);
        verifyNoInteractions(orchestrator, initialRunService);
    }

    @Test
    void targetAddedForDisabledPlatformIsDeferred() {
        when(featureService.findPlan(TEAM)).thenReturn(Optional.of(plan(List.of(TargetType.GOOGLE))));

        LifecycleReport report = service.handleTargetAdded(TEAM, TargetType.BOOKING, "https://booking.com/hotel/x");

        assertThat(report.deferred()).isTrue();
        verifyNoInteractions(orchestrator);
    }

    @Test
    void repeatedTargetAddDoesNotLaunchAnotherInitialRun() {
        when(featureService.findPlan(TEAM)).thenReturn(Optional.of(plan(List.of(TargetType.GOOGLE))));
        TrackedTarget place = target("t-1", TargetType.GOOGLE, "place-1");
        when(targetService.ensureTarget(TEAM, TargetType.GOOGLE, "place-1"))
            .thenReturn(new TrackedTargetService.EnsuredTarget(place, false));
        when(featureService.resolveIntervalHours(TEAM, TargetType.GOOGLE)).thenReturn(24);
        when(orchestrator.addSubscriber("t-1", TEAM, TargetType.GOOGLE, "place-1", 24))
            .thenReturn(ScheduleOperationResult.noOp("already scheduled"));

        LifecycleReport report = service.handleTargetAdded(TEAM, TargetType.GOOGLE, "place-1");

        assertThat(report.success()).isTrue();
        assertThat(report.targetsAdded()).isZero();
        verify(initialRunService, never()).launch(anyString(), any(), anyList());
    }

    @Test
    void subscriptionUpdateMovesTargetsToNewTierInterval() {
        when(featureService.findPlan(TEAM)).thenReturn(Optional.of(plan(List.of(TargetType.GOOGLE))));
        when(featureService.resolveIntervalHours(TEAM, TargetType.GOOGLE)).thenReturn(12);
        when(orchestrator.mappingsForTenant(TEAM))
            .thenReturn(List.of(mapping("t-1", JobKind.REVIEWS), mapping("t-1", JobKind.OVERVIEW)));
        when(orchestrator.moveSubscriber("t-1", TargetType.GOOGLE, 24, 12)).thenReturn(applied());

        LifecycleReport report = service.handleSubscriptionUpdate(TEAM);

        assertThat(report.targetsMoved()).isEqualTo(1);
        verify(orchestrator, times(1)).moveSubscriber(anyString(), any(), anyInt(), anyInt());
    }

    private static TeamPlan plan(List<TargetType> platforms) {
        return new TeamPlan(TEAM, SubscriptionTier.STARTER, "active", platforms, null, null, null);
    }

    private static TrackedTarget target(String id, TargetType type, String identifier) {
        return new TrackedTarget(id, TEAM, type, identifier, null, Instant.now());
    }

    private static SubscriberMapping mapping(String targetId, JobKind jobKind) {
        return new SubscriberMapping(1L, targetId, TEAM, TargetType.GOOGLE, jobKind, 10L, targetId + "-place", 24, true, Instant.now());
    }

    private static ScheduleOperationResult applied() {
        return new ScheduleOperationResult(OperationOutcome.APPLIED, "ok", List.of(10L), List.of(), List.of());
    }
}
