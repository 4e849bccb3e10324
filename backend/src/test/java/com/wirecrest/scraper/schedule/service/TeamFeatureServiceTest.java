package com.wirecrest.scraper.schedule.service;

import com.wirecrest.scraper.config.SchedulerProperties;
import com.wirecrest.scraper.schedule.model.CustomIntervalOverride;
import com.wirecrest.scraper.schedule.model.SubscriptionTier;
import com.wirecrest.scraper.schedule.model.TargetType;
import com.wirecrest.scraper.schedule.model.TeamPlan;
import com.wirecrest.scraper.schedule.persistence.TenantJdbcRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TeamFeatureServiceTest {
    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @Mock
    private TenantJdbcRepository repository;

    private TeamFeatureService service;

    @BeforeEach
    void setUp() {
        service = new TeamFeatureService(repository, new SchedulerProperties(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void tierDefaultAppliesWithoutOverride() {
        when(repository.findOverride("team-1", TargetType.GOOGLE)).thenReturn(Optional.empty());
        when(repository.findPlan("team-1")).thenReturn(Optional.of(plan(SubscriptionTier.PROFESSIONAL)));

        assertThat(service.resolveIntervalHours("team-1", TargetType.GOOGLE)).isEqualTo(12);
    }

    @Test
    void unexpiredOverrideWinsOverTier() {
        when(repository.findOverride("team-1", TargetType.GOOGLE))
            .thenReturn(Optional.of(override(6, NOW.plus(Duration.ofDays(1)))));

        assertThat(service.resolveIntervalHours("team-1", TargetType.GOOGLE)).isEqualTo(6);
    }

    @Test
    void expiredOverrideFallsBackToTier() {
        when(repository.findOverride("team-1", TargetType.GOOGLE)).thenReturn(Optional.of(override(3, NOW)));
        when(repository.findPlan("team-1")).thenReturn(Optional.of(plan(SubscriptionTier.ENTERPRISE)));

        assertThat(service.resolveIntervalHours("team-1", TargetType.GOOGLE)).isEqualTo(6);

        when(repository.findPlan("team-1")).thenReturn(Optional.of(plan(SubscriptionTier.STARTER)));
        assertThat(service.resolveIntervalHours("team-1", TargetType.GOOGLE)).isEqualTo(24);
    }

    @Test
    void teamWithoutPlanGetsStarterInterval() {
        when(repository.findOverride("team-x", TargetType.BOOKING)).thenReturn(Optional.empty());
        when(repository.findPlan("team-x")).thenReturn(Optional.empty());

        assertThat(service.resolveIntervalHours("team-x", TargetType.BOOKING)).isEqualTo(24);
        assertThat(service.enabledPlatforms("team-x")).isEmpty();
    }

    @Test
    void rejectsIntervalsOutsideConfiguredRange() {
        assertThatThrownBy(() -> service.setCustomInterval("team-1", TargetType.GOOGLE, 0, "r", "ops", null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.setCustomInterval("team-1", TargetType.GOOGLE, 169, "r", "ops", null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.setCustomInterval("team-1", TargetType.GOOGLE, 12, "r", "ops", NOW.minusSeconds(1)))
            .isInstanceOf(IllegalArgumentException.class);
        verify(repository, never()).upsertOverride(anyString(), any(), anyInt(), any(), any(), any());
    }

    @Test
    void storesValidOverride() {
        Instant expiresAt = NOW.plus(Duration.ofDays(7));
        when(repository.findOverride("team-1", TargetType.GOOGLE)).thenReturn(Optional.of(override(8, expiresAt)));

        CustomIntervalOverride stored = service.setCustomInterval("team-1", TargetType.GOOGLE, 8, "vip", "ops", expiresAt);

        assertThat(stored.intervalHours()).isEqualTo(8);
        verify(repository).upsertOverride("team-1", TargetType.GOOGLE, 8, "vip", "ops", expiresAt);
    }

    private static TeamPlan plan(SubscriptionTier tier) {
        return new TeamPlan("team-1", tier, "active", List.of(TargetType.GOOGLE), null, null, null);
    }

    private static CustomIntervalOverride override(int hours, Instant expiresAt) {
        return new CustomIntervalOverride(1L, "team-1", TargetType.GOOGLE, hours, "test", "ops", expiresAt, NOW.minusSeconds(60));
    }
}
