package com.wirecrest.scraper.schedule.model;

public enum JobRunStatus {
    RUNNING,
    SUCCEEDED,
    FAILED
}
