package com.wirecrest.scraper.schedule.platform;

/**
 * Maps an interval to a five-field cron expression. Batches of the same group are offset by 15 minutes
 * so they do not all fire at once.
 */
public final class CronExpressions {
    private static final int BATCH_OFFSET_MINUTES = 15;

    private CronExpressions() {
    }

    public static String forInterval(int intervalHours, int batchIndex) {
        if (intervalHours <= 0) {
            throw new IllegalArgumentException("intervalHours must be positive: " + intervalHours);
        }
        int minute = Math.floorMod(Math.max(0, batchIndex) * BATCH_OFFSET_MINUTES, 60);
        if (intervalHours == 24) {
            return minute + " 9 * * *";
        }
        if (intervalHours == 72) {
            return minute + " 10 */3 * *";
        }
        if (intervalHours > 24 && intervalHours % 24 == 0) {
            return minute + " 9 */" + (intervalHours / 24) + " * *";
        }
        if (intervalHours > 24) {
            // cron cannot express non-day multiples above a day; fall back to daily
            return minute + " 9 * * *";
        }
        return minute + " */" + intervalHours + " * * *";
    }
}
