package com.wirecrest.scraper.schedule.model;

public enum JobRunKind {
    INITIAL,
    RECURRING_REVIEWS,
    RECURRING_OVERVIEW;

    public static JobRunKind recurring(JobKind jobKind) {
        return jobKind == JobKind.OVERVIEW ? RECURRING_OVERVIEW : RECURRING_REVIEWS;
    }
}
