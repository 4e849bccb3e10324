package com.wirecrest.scraper.schedule.platform;

import com.wirecrest.scraper.config.SchedulerProperties;
import com.wirecrest.scraper.schedule.model.TargetType;
import org.springframework.stereotype.Component;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;

/**
 * Owns the shared secret the job platform echoes back on completion callbacks. The service refuses to
 * start without one.
 */
@Component
public class WebhookSecurity {
    public static final List<String> COMPLETION_EVENT_TYPES = List.of(
        "ACTOR.RUN.SUCCEEDED",
        "ACTOR.RUN.FAILED",
        "ACTOR.RUN.ABORTED",
        "ACTOR.RUN.TIMED_OUT"
    );

    private final String secret;
    private final String baseUrl;

    public WebhookSecurity(SchedulerProperties properties) {
        String configured = properties.getWebhook().getSecret();
        if (configured == null || configured.isBlank()) {
            throw new IllegalStateException("scheduler.webhook.secret must be configured");
        }
        this.secret = configured.trim();
        String url = properties.getWebhook().getBaseUrl();
        this.baseUrl = url == null ? "" : url.replaceAll("/+$", "");
    }

    public boolean isValidToken(String token) {
        if (token == null || token.isBlank()) {
            return false;
        }
        return MessageDigest.isEqual(
            secret.getBytes(StandardCharsets.UTF_8),
            token.trim().getBytes(StandardCharsets.UTF_8)
        );
    }

    /**
     * Webhook registration for a run. {@code scheduleEntryId} is null for one-off runs.
     */
    public List<WebhookSpec> webhooksFor(TargetType targetType, Long scheduleEntryId) {
        String requestUrl = baseUrl + "/webhooks/apify?token=" + URLEncoder.encode(secret, StandardCharsets.UTF_8);
        String entryValue = scheduleEntryId == null ? "null" : Long.toString(scheduleEntryId);
        String payloadTemplate = "{\"eventType\":\"{{eventType}}\","
            + "\"eventData\":{{eventData}},"
            + "\"resource\":{{resource}},"
            + "\"targetType\":\"" + targetType.key() + "\","
            + "\"scheduleEntryId\":" + entryValue + "}";
        return List.of(new WebhookSpec(COMPLETION_EVENT_TYPES, requestUrl, payloadTemplate));
    }
}
