package com.wirecrest.scraper.schedule.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.wirecrest.scraper.schedule.model.TargetType;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;

/**
 * Stable dedup keys for scraped items. Uses the platform's own review id when the item has one, and the
 * full item content otherwise.
 */
public final class ItemKeys {
    private static final List<String> REVIEW_ID_FIELDS = List.of("reviewId", "review_id", "id");

    private ItemKeys() {
    }

    public static String itemKey(TargetType targetType, String identifier, JsonNode item) {
        for (String field : REVIEW_ID_FIELDS) {
            JsonNode value = item.get(field);
            if (value != null && !value.isNull() && !value.asText().isBlank()) {
                return sha256Hex(targetType.name() + "|" + identifier + "|id|" + value.asText());
            }
        }
        return sha256Hex(targetType.name() + "|" + identifier + "|body|" + item);
    }

    public static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }
}
