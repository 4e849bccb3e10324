package com.wirecrest.scraper.schedule.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Locale;

/**
 * External review platforms that schedules are grouped by. Each type knows the actor that scrapes it,
 * its default batch capacity and which dataset fields carry the identifier a run was fed.
 */
public enum TargetType {
    GOOGLE("google", "Xb8osYTtOjlsgI6k9", 50, false, List.of("placeId", "place_id"), List.of("google_reviews", "google_maps")),
    FACEBOOK("facebook", "dX3d80hsNMilEwjXG", 30, true, List.of("inputUrl", "facebookUrl", "pageUrl", "url"), List.of("facebook_reviews")),
    TRIPADVISOR("tripadvisor", "Hvp4YfFGyLM635Q2F", 30, true, List.of("inputUrl", "startUrl", "url"), List.of("tripadvisor_reviews")),
    BOOKING("booking", "PbMHke3jW25J6hSOA", 30, true, List.of("inputUrl", "startUrl", "hotelUrl", "url"), List.of("booking_reviews"));

    private final String key;
    private final String actorId;
    private final int defaultMaxBatchSize;
    private final boolean urlBased;
    private final List<String> identifierFields;
    private final List<String> aliases;

    TargetType(
        String key,
        String actorId,
        int defaultMaxBatchSize,
        boolean urlBased,
        List<String> identifierFields,
        List<String> aliases
    ) {
        this.key = key;
        this.actorId = actorId;
        this.defaultMaxBatchSize = defaultMaxBatchSize;
        this.urlBased = urlBased;
        this.identifierFields = identifierFields;
        this.aliases = aliases;
    }

    public String key() {
        return key;
    }

    public String actorId() {
        return actorId;
    }

    public int defaultMaxBatchSize() {
        return defaultMaxBatchSize;
    }

    public boolean urlBased() {
        return urlBased;
    }

    public List<JobKind> jobKinds() {
        return List.of(JobKind.REVIEWS, JobKind.OVERVIEW);
    }

    /**
     * Returns the identifier a dataset item was scraped for, normalized the same way mapping identifiers are.
     */
    public String extractIdentifier(JsonNode item) {
        if (item == null || !item.isObject()) {
            return null;
        }
        for (String field : identifierFields) {
            JsonNode value = item.get(field);
            if (value != null && value.isTextual() && !value.asText().isBlank()) {
                return normalizeIdentifier(value.asText());
            }
        }
        return null;
    }

    public String normalizeIdentifier(String identifier) {
        if (identifier == null) {
            return null;
        }
        String trimmed = identifier.trim();
        if (!urlBased) {
            return trimmed;
        }
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    public static TargetType fromKey(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new InvalidTargetTypeException("Target type is required");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (TargetType type : values()) {
            if (type.key.equals(normalized) || type.name().toLowerCase(Locale.ROOT).equals(normalized)
                || type.aliases.contains(normalized)) {
                return type;
            }
        }
        throw new InvalidTargetTypeException("Unknown target type: " + raw);
    }
}
