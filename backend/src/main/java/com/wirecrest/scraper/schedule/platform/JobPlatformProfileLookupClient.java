package com.wirecrest.scraper.schedule.platform;

import com.fasterxml.jackson.databind.JsonNode;
import com.wirecrest.scraper.schedule.model.TargetType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Looks profiles up by running the platform's review actor for a single item and reading the profile
 * name off the first result.
 */
@Component
public class JobPlatformProfileLookupClient implements ProfileLookupClient {
    private static final Logger log = LoggerFactory.getLogger(JobPlatformProfileLookupClient.class);
    private static final List<String> NAME_FIELDS = List.of("title", "placeName", "pageName", "hotelName", "name");

    private final JobPlatformClient platformClient;
    private final ActorInputFactory inputFactory;

    public JobPlatformProfileLookupClient(JobPlatformClient platformClient, ActorInputFactory inputFactory) {
        this.platformClient = platformClient;
        this.inputFactory = inputFactory;
    }

    @Override
    public TargetProfile fetchProfile(TargetType targetType, String identifier) {
        List<JsonNode> items = platformClient.runSyncForItems(
            targetType.actorId(), inputFactory.build(targetType, List.of(identifier), 1));
        if (items.isEmpty()) {
            throw new JobPlatformException("profile_not_found", 404, false,
                "No " + targetType.key() + " profile found for " + identifier);
        }
        String displayName = displayName(items.get(0));
        log.debug("Resolved {} profile {} as '{}'", targetType, identifier, displayName);
        return new TargetProfile(targetType, identifier, displayName);
    }

    private static String displayName(JsonNode item) {
        for (String field : NAME_FIELDS) {
            JsonNode value = item.get(field);
            if (value != null && value.isTextual() && !value.asText().isBlank()) {
                return value.asText().trim();
            }
        }
        return null;
    }
}
