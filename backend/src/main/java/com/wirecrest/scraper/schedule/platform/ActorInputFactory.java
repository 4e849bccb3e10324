package com.wirecrest.scraper.schedule.platform;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.wirecrest.scraper.schedule.model.TargetType;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Builds the actor input for a batch of identifiers. Google takes place ids, the URL-based actors take
 * start URLs and treat a limit at or above {@link #UNLIMITED_ITEMS} as "no limit".
 */
@Component
public class ActorInputFactory {
    public static final int UNLIMITED_ITEMS = 99999;

    private final ObjectMapper objectMapper;

    public ActorInputFactory(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ObjectNode build(TargetType targetType, List<String> identifiers, int maxItems) {
        ObjectNode input = objectMapper.createObjectNode();
        List<String> safeIdentifiers = identifiers == null ? List.of() : identifiers;
        switch (targetType) {
            case GOOGLE -> {
                ArrayNode placeIds = input.putArray("placeIds");
                safeIdentifiers.forEach(placeIds::add);
                input.put("maxReviews", maxItems);
                input.put("reviewsSort", "newest");
                input.put("language", "en");
                input.put("reviewsOrigin", "google");
                input.put("personalData", false);
            }
            case FACEBOOK -> {
                putStartUrls(input, safeIdentifiers);
                input.putObject("proxy").putArray("apifyProxyGroups").add("RESIDENTIAL");
                input.put("maxRequestRetries", 10);
                if (maxItems < UNLIMITED_ITEMS) {
                    input.put("resultsLimit", maxItems);
                }
            }
            case TRIPADVISOR -> {
                putStartUrls(input, safeIdentifiers);
                input.put("scrapeReviewerInfo", true);
                input.putArray("reviewRatings").add("ALL_REVIEW_RATINGS");
                input.putArray("reviewsLanguages").add("ALL_REVIEW_LANGUAGES");
                if (maxItems < UNLIMITED_ITEMS) {
                    input.put("maxItemsPerQuery", maxItems);
                }
            }
            case BOOKING -> {
                putStartUrls(input, safeIdentifiers);
                input.put("sortReviewsBy", "f_recent_desc");
                input.putArray("reviewScores").add("ALL");
                input.putObject("proxyConfiguration").put("useApifyProxy", true);
                if (maxItems < UNLIMITED_ITEMS) {
                    input.put("maxReviewsPerHotel", maxItems);
                }
            }
            default -> throw new IllegalArgumentException("Unsupported target type: " + targetType);
        }
        return input;
    }

    /**
     * Copies the webhook registrations into the input so every run the recurring job starts reports back.
     */
    public ObjectNode withWebhooks(ObjectNode input, List<WebhookSpec> webhooks) {
        ObjectNode copy = input.deepCopy();
        copy.set("webhooks", objectMapper.valueToTree(webhooks == null ? List.of() : webhooks));
        return copy;
    }

    private void putStartUrls(ObjectNode input, List<String> identifiers) {
        ArrayNode startUrls = input.putArray("startUrls");
        for (String identifier : identifiers) {
            startUrls.addObject().put("url", identifier);
        }
    }
}
