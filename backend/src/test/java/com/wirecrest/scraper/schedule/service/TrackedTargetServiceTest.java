package com.wirecrest.scraper.schedule.service;

import com.wirecrest.scraper.schedule.model.TargetType;
import com.wirecrest.scraper.schedule.model.TrackedTarget;
import com.wirecrest.scraper.schedule.persistence.TenantJdbcRepository;
import com.wirecrest.scraper.schedule.platform.JobPlatformException;
import com.wirecrest.scraper.schedule.platform.ProfileLookupClient;
import com.wirecrest.scraper.schedule.platform.TargetProfile;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TrackedTargetServiceTest {
    private static final String TEAM = "team-1";

    @Mock
    private TenantJdbcRepository repository;

    @Mock
    private ProfileLookupClient profileLookup;

    @InjectMocks
    private TrackedTargetService service;

    @Test
    void newTargetIsLookedUpBeforeItIsTracked() {
        TrackedTarget stored = new TrackedTarget("t-1", TEAM, TargetType.GOOGLE, "place-1", "Acme", Instant.now());
        when(repository.findTarget(TEAM, TargetType.GOOGLE, "place-1")).thenReturn(Optional.empty(), Optional.of(stored));
        when(profileLookup.fetchProfile(TargetType.GOOGLE, "place-1"))
            .thenReturn(new TargetProfile(TargetType.GOOGLE, "place-1", "Acme"));

        TrackedTargetService.EnsuredTarget ensured = service.ensureTarget(TEAM, TargetType.GOOGLE, " place-1 ");

        assertThat(ensured.created()).isTrue();
        assertThat(ensured.target().displayName()).isEqualTo("Acme");
        verify(repository).insertTarget(TEAM, TargetType.GOOGLE, "place-1", "Acme");
    }

    @Test
    void existingTargetSkipsTheLookup() {
        TrackedTarget stored = new TrackedTarget("t-1", TEAM, TargetType.GOOGLE, "place-1", "Acme", Instant.now());
        when(repository.findTarget(TEAM, TargetType.GOOGLE, "place-1")).thenReturn(Optional.of(stored));

        assertThat(service.ensureTarget(TEAM, TargetType.GOOGLE, "place-1").created()).isFalse();

        verify(profileLookup, never()).fetchProfile(any(), anyString());
    }

    @Test
    void profileThatCannotBeFoundIsNeverTracked() {
        when(repository.findTarget(TEAM, TargetType.GOOGLE, "place-gone")).thenReturn(Optional.empty());
        when(profileLookup.fetchProfile(TargetType.GOOGLE, "place-gone"))
            .thenThrow(new JobPlatformException("profile_not_found", 404, false, "No google profile found for place-gone"));

        assertThatThrownBy(() -> service.ensureTarget(TEAM, TargetType.GOOGLE, "place-gone"))
            .isInstanceOf(JobPlatformException.class);

        verify(repository, never()).insertTarget(anyString(), any(), anyString(), any());
    }

    @Test
    void configuredIdentifiersIncludeAlreadyTrackedProfilesOnce() {
        when(repository.findConfiguredIdentifiers(TEAM, TargetType.GOOGLE)).thenReturn(List.of("place-2", "place-1"));
        when(repository.findTargets(TEAM, TargetType.GOOGLE)).thenReturn(List.of(
            new TrackedTarget("t-1", TEAM, TargetType.GOOGLE, "place-1", null, Instant.now()),
            new TrackedTarget("t-3", TEAM, TargetType.GOOGLE, "place-3", null, Instant.now())));

        assertThat(service.configuredIdentifiers(TEAM, TargetType.GOOGLE)).containsExactly("place-2", "place-1", "place-3");
    }

    @Test
    void urlBasedIdentifiersMustBeHttpUrls() {
        assertThat(TrackedTargetService.validateIdentifier(TargetType.FACEBOOK, " https://www.facebook.com/acme/ "))
            .isEqualTo("https://www.facebook.com/acme");
        assertThatThrownBy(() -> TrackedTargetService.validateIdentifier(TargetType.TRIPADVISOR, "not a url"))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> TrackedTargetService.validateIdentifier(TargetType.BOOKING, "ftp://booking.com/hotel"))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void placeIdsAreOnlyTrimmed() {
        assertThat(TrackedTargetService.validateIdentifier(TargetType.GOOGLE, " ChIJ123/ ")).isEqualTo("ChIJ123/");
        assertThatThrownBy(() -> TrackedTargetService.validateIdentifier(TargetType.GOOGLE, "  "))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
