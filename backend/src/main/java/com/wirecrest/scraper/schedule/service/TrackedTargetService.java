package com.wirecrest.scraper.schedule.service;

import com.wirecrest.scraper.schedule.model.TargetType;
import com.wirecrest.scraper.schedule.model.TrackedTarget;
import com.wirecrest.scraper.schedule.persistence.TenantJdbcRepository;
import com.wirecrest.scraper.schedule.platform.ProfileLookupClient;
import com.wirecrest.scraper.schedule.platform.TargetProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

/**
 * Directory of the external profiles each tenant tracks, and of the identifiers the tenant configured
 * before a profile exists for them. Identifiers are stored normalized so that the value pushed into a
 * batch input matches what comes back in dataset items.
 */
@Service
public class TrackedTargetService {
    private static final Logger log = LoggerFactory.getLogger(TrackedTargetService.class);

    private final TenantJdbcRepository repository;
    private final ProfileLookupClient profileLookup;

    public TrackedTargetService(TenantJdbcRepository repository, ProfileLookupClient profileLookup) {
        this.repository = repository;
        this.profileLookup = profileLookup;
    }

    /**
     * Every identifier the team configured for the platform plus any profile it already tracks, in
     * configuration order.
     */
    public List<String> configuredIdentifiers(String teamId, TargetType targetType) {
        LinkedHashSet<String> identifiers = new LinkedHashSet<>(repository.findConfiguredIdentifiers(teamId, targetType));
        for (TrackedTarget target : repository.findTargets(teamId, targetType)) {
            identifiers.add(target.externalIdentifier());
        }
        return List.copyOf(identifiers);
    }

    /**
     * Remembers an identifier the team configured, whether or not it can be scheduled yet.
     */
    public String recordConfigured(String teamId, TargetType targetType, String identifier) {
        String normalized = validateIdentifier(targetType, identifier);
        if (repository.insertConfiguredIdentifier(teamId, targetType, normalized)) {
            log.debug("Team {} configured {} target {}", teamId, targetType, normalized);
        }
        return normalized;
    }

    public boolean forgetConfigured(String teamId, TargetType targetType, String identifier) {
        return repository.deleteConfiguredIdentifier(teamId, targetType, targetType.normalizeIdentifier(identifier)) > 0;
    }

    public Optional<TrackedTarget> findTarget(String teamId, TargetType targetType, String identifier) {
        return repository.findTarget(teamId, targetType, targetType.normalizeIdentifier(identifier));
    }

    /**
     * Returns the tracked target. When the tenant has not tracked it before the profile is looked up on
     * the platform first, so an identifier that resolves to nothing is never tracked. Lookup failures
     * propagate as {@link com.wirecrest.scraper.schedule.platform.JobPlatformException}.
     */
    public EnsuredTarget ensureTarget(String teamId, TargetType targetType, String identifier) {
        String normalized = validateIdentifier(targetType, identifier);
        Optional<TrackedTarget> existing = repository.findTarget(teamId, targetType, normalized);
        if (existing.isPresent()) {
            return new EnsuredTarget(existing.get(), false);
        }
        TargetProfile profile = profileLookup.fetchProfile(targetType, normalized);
        try {
            repository.insertTarget(teamId, targetType, normalized, profile.displayName());
            log.info("Tracking new {} target {} for team {}", targetType, normalized, teamId);
            return new EnsuredTarget(requireTarget(teamId, targetType, normalized), true);
        } catch (DuplicateKeyException e) {
            return new EnsuredTarget(requireTarget(teamId, targetType, normalized), false);
        }
    }

    public boolean removeTarget(String targetId) {
        return repository.deleteTarget(targetId) > 0;
    }

    static String validateIdentifier(TargetType targetType, String identifier) {
        String normalized = targetType.normalizeIdentifier(identifier);
        if (normalized == null || normalized.isBlank()) {
            throw new IllegalArgumentException("identifier is required");
        }
        if (targetType.urlBased()) {
            URI uri;
            try {
                uri = URI.create(normalized);
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Invalid " + targetType.key() + " URL: " + identifier, e);
            }
            String scheme = uri.getScheme();
            boolean http = "http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme);
            if (!http || uri.getHost() == null) {
                throw new IllegalArgumentException("Invalid " + targetType.key() + " URL: " + identifier);
            }
        }
        return normalized;
    }

    private TrackedTarget requireTarget(String teamId, TargetType targetType, String identifier) {
        return repository.findTarget(teamId, targetType, identifier)
            .orElseThrow(() -> new IllegalStateException("Tracked target vanished: " + identifier));
    }

    public record EnsuredTarget(TrackedTarget target, boolean created) {
    }
}
