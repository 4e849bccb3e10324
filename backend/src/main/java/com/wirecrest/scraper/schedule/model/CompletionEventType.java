package com.wirecrest.scraper.schedule.model;

import java.util.Locale;

public enum CompletionEventType {
    SUCCEEDED,
    FAILED,
    ABORTED,
    TIMED_OUT,
    TEST,
    UNKNOWN;

    /**
     * Accepts both bare names and the platform's dotted form, e.g. {@code ACTOR.RUN.SUCCEEDED}.
     */
    public static CompletionEventType parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return UNKNOWN;
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT);
        int lastDot = normalized.lastIndexOf('.');
        if (lastDot >= 0) {
            normalized = normalized.substring(lastDot + 1);
        }
        normalized = normalized.replace('-', '_');
        if ("ABORT".equals(normalized)) {
            return ABORTED;
        }
        for (CompletionEventType type : values()) {
            if (type.name().equals(normalized)) {
                return type;
            }
        }
        return UNKNOWN;
    }

    public boolean isFailure() {
        return this == FAILED || this == ABORTED || this == TIMED_OUT;
    }
}
