package com.wirecrest.scraper.schedule.model;

public enum JobKind {
    REVIEWS,
    OVERVIEW
}
