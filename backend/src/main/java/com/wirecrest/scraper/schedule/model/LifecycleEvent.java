package com.wirecrest.scraper.schedule.model;

/**
 * A billing or dashboard event that changes what a tenant has scheduled. Target-scoped events carry the
 * platform and identifier of the single target they concern.
 */
public record LifecycleEvent(
    LifecycleEventType type,
    String teamId,
    TargetType targetType,
    String externalIdentifier
) {
    public LifecycleEvent {
        if (type == null) {
            throw new IllegalArgumentException("Lifecycle event type is required");
        }
        if (teamId == null || teamId.isBlank()) {
            throw new IllegalArgumentException("teamId is required");
        }
        if (type.targetScoped()) {
            if (targetType == null) {
                throw new IllegalArgumentException("platform is required for " + type);
            }
            if (externalIdentifier == null || externalIdentifier.isBlank()) {
                throw new IllegalArgumentException("identifier is required for " + type);
            }
        }
        teamId = teamId.trim();
    }

    public static LifecycleEvent subscriptionCreated(String teamId) {
        return new LifecycleEvent(LifecycleEventType.SUBSCRIPTION_CREATED, teamId, null, null);
    }

    public static LifecycleEvent subscriptionUpdated(String teamId) {
        return new LifecycleEvent(LifecycleEventType.SUBSCRIPTION_UPDATED, teamId, null, null);
    }

    public static LifecycleEvent subscriptionCancelled(String teamId) {
        return new LifecycleEvent(LifecycleEventType.SUBSCRIPTION_CANCELLED, teamId, null, null);
    }

    public static LifecycleEvent targetAdded(String teamId, TargetType targetType, String identifier) {
        return new LifecycleEvent(LifecycleEventType.TARGET_ADDED, teamId, targetType, identifier);
    }

    public static LifecycleEvent targetRemoved(String teamId, TargetType targetType, String identifier) {
        return new LifecycleEvent(LifecycleEventType.TARGET_REMOVED, teamId, targetType, identifier);
    }
}
