package com.wirecrest.scraper.schedule.api;

import com.wirecrest.scraper.schedule.model.LifecycleReport;
import com.wirecrest.scraper.schedule.model.TargetType;
import com.wirecrest.scraper.schedule.service.SubscriptionLifecycleService;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

/**
 * Entry points for billing and dashboard events. Each call returns the lifecycle report, including
 * per-target failures, with status 200 once the event has been handled.
 */
@RestController
@RequestMapping("/api")
public class LifecycleWebhookController {
    private final SubscriptionLifecycleService lifecycleService;

    public LifecycleWebhookController(SubscriptionLifecycleService lifecycleService) {
        this.lifecycleService = lifecycleService;
    }

    @PostMapping("/subscription/created")
    public LifecycleReport subscriptionCreated(@RequestBody LifecycleRequest request) {
        return lifecycleService.handleNewSubscription(requireTeam(request));
    }

    @PostMapping("/subscription/updated")
    public LifecycleReport subscriptionUpdated(@RequestBody LifecycleRequest request) {
        return lifecycleService.handleSubscriptionUpdate(requireTeam(request));
    }

    @PostMapping("/subscription/cancelled")
    public LifecycleReport subscriptionCancelled(@RequestBody LifecycleRequest request) {
        return lifecycleService.handleCancellation(requireTeam(request));
    }

    @PostMapping("/targets/added")
    public LifecycleReport targetAdded(@RequestBody LifecycleRequest request) {
        return lifecycleService.handleTargetAdded(
            requireTeam(request),
            TargetType.fromKey(request.platform()),
            requireIdentifier(request)
        );
    }

    @PostMapping("/targets/removed")
    public LifecycleReport targetRemoved(@RequestBody LifecycleRequest request) {
        return lifecycleService.handleTargetRemoved(
            requireTeam(request),
            TargetType.fromKey(request.platform()),
            requireIdentifier(request)
        );
    }

    private static String requireTeam(LifecycleRequest request) {
        if (request == null || request.teamId() == null || request.teamId().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "teamId is required");
        }
        return request.teamId().trim();
    }

    private static String requireIdentifier(LifecycleRequest request) {
        if (request.identifier() == null || request.identifier().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "identifier is required");
        }
        return request.identifier().trim();
    }
}
