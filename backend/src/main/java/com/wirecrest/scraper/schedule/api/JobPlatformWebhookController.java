package com.wirecrest.scraper.schedule.api;

import com.wirecrest.scraper.schedule.model.JobCompletionPayload;
import com.wirecrest.scraper.schedule.model.WebhookAck;
import com.wirecrest.scraper.schedule.platform.WebhookSecurity;
import com.wirecrest.scraper.schedule.service.JobCompletionService;
import com.wirecrest.scraper.schedule.service.WebhookAuthenticationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/webhooks")
public class JobPlatformWebhookController {
    private static final Logger log = LoggerFactory.getLogger(JobPlatformWebhookController.class);

    private final WebhookSecurity webhookSecurity;
    private final JobCompletionService completionService;

    public JobPlatformWebhookController(WebhookSecurity webhookSecurity, JobCompletionService completionService) {
        this.webhookSecurity = webhookSecurity;
        this.completionService = completionService;
    }

    @PostMapping("/apify")
    public WebhookAck runCompleted(
        @RequestParam(name = "token", required = false) String token,
        @RequestBody JobCompletionPayload payload
    ) {
        if (!webhookSecurity.isValidToken(token)) {
            log.warn("Rejected completion webhook with invalid token");
            throw new WebhookAuthenticationException("Invalid webhook token");
        }
        return completionService.handle(payload);
    }
}
