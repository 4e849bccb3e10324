package com.wirecrest.scraper.schedule.model;

import java.util.Locale;

public enum SubscriptionTier {
    STARTER(24, 48, 500),
    PROFESSIONAL(12, 24, 2000),
    ENTERPRISE(6, 12, 10000);

    private final int reviewsIntervalHours;
    private final int overviewIntervalHours;
    private final int maxReviewsPerRun;

    SubscriptionTier(int reviewsIntervalHours, int overviewIntervalHours, int maxReviewsPerRun) {
        this.reviewsIntervalHours = reviewsIntervalHours;
        this.overviewIntervalHours = overviewIntervalHours;
        this.maxReviewsPerRun = maxReviewsPerRun;
    }

    public int reviewsIntervalHours() {
        return reviewsIntervalHours;
    }

    public int overviewIntervalHours() {
        return overviewIntervalHours;
    }

    public int maxReviewsPerRun() {
        return maxReviewsPerRun;
    }

    public static SubscriptionTier fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return STARTER;
        }
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return STARTER;
        }
    }
}
