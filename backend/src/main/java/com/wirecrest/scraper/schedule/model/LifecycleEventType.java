package com.wirecrest.scraper.schedule.model;

public enum LifecycleEventType {
    SUBSCRIPTION_CREATED(false),
    SUBSCRIPTION_UPDATED(false),
    SUBSCRIPTION_CANCELLED(false),
    TARGET_ADDED(true),
    TARGET_REMOVED(true);

    private final boolean targetScoped;

    LifecycleEventType(boolean targetScoped) {
        this.targetScoped = targetScoped;
    }

    public boolean targetScoped() {
        return targetScoped;
    }
}
