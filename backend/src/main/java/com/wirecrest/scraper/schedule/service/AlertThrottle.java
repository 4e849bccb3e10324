package com.wirecrest.scraper.schedule.service;

import com.wirecrest.scraper.config.SchedulerProperties;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Lets at most one alert per key through within the throttle window. Expired keys are swept
 * periodically so the map does not grow with every distinct key ever seen.
 */
@Component
public class AlertThrottle {
    private static final Logger log = LoggerFactory.getLogger(AlertThrottle.class);

    private final Map<String, Instant> lastSent = new ConcurrentHashMap<>();
    private final Duration window;
    private final Duration sweepInterval;
    private final Clock clock;
    private final ScheduledExecutorService maintenanceExecutor;

    public AlertThrottle(
        SchedulerProperties properties,
        Clock clock,
        @Qualifier("maintenanceExecutor") ScheduledExecutorService maintenanceExecutor
    ) {
        this.window = Duration.ofMinutes(properties.getAlerts().getThrottleWindowMinutes());
        this.sweepInterval = Duration.ofSeconds(properties.getAlerts().getSweepIntervalSeconds());
        this.clock = clock;
        this.maintenanceExecutor = maintenanceExecutor;
    }

    @PostConstruct
    public void scheduleSweep() {
        if (maintenanceExecutor == null) {
            return;
        }
        long periodMs = sweepInterval.toMillis();
        maintenanceExecutor.scheduleAtFixedRate(this::sweepSafely, periodMs, periodMs, TimeUnit.MILLISECONDS);
    }

    public boolean tryAcquire(String key) {
        Instant now = clock.instant();
        boolean[] acquired = {false};
        lastSent.compute(key, (ignored, previous) -> {
            if (previous == null || !previous.plus(window).isAfter(now)) {
                acquired[0] = true;
                return now;
            }
            return previous;
        });
        return acquired[0];
    }

    /**
     * Drops keys whose window has passed. Returns the number removed.
     */
    public int sweep() {
        Instant cutoff = clock.instant().minus(window);
        int before = lastSent.size();
        lastSent.entrySet().removeIf(entry -> !entry.getValue().isAfter(cutoff));
        return before - lastSent.size();
    }

    int trackedKeys() {
        return lastSent.size();
    }

    private void sweepSafely() {
        try {
            int removed = sweep();
            if (removed > 0) {
                log.debug("Swept {} expired alert throttle keys", removed);
            }
        } catch (RuntimeException e) {
            log.warn("Alert throttle sweep failed", e);
        }
    }
}
