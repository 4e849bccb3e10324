package com.wirecrest.scraper.schedule.model;

public enum OperationOutcome {
    APPLIED,
    NO_OP,
    PARTIAL,
    REJECTED,
    FAILED;

    public boolean isSuccess() {
        return this == APPLIED || this == NO_OP;
    }
}
