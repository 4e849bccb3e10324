package com.wirecrest.scraper.schedule.model;

public enum HealthLevel {
    HEALTHY,
    WARNING,
    CRITICAL;

    public static HealthLevel forLoadPercent(double loadPercent) {
        if (loadPercent >= 95.0) {
            return CRITICAL;
        }
        if (loadPercent >= 80.0) {
            return WARNING;
        }
        return HEALTHY;
    }
}
