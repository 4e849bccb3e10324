package com.wirecrest.scraper.schedule.service;

import com.wirecrest.scraper.config.SchedulerProperties;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class AlertThrottleTest {

    @Test
    void letsOneAlertPerKeyThroughPerWindow() {
        MutableClock clock = new MutableClock(Instant.parse("2026-03-01T12:00:00Z"));
        AlertThrottle throttle = new AlertThrottle(new SchedulerProperties(), clock, null);

        assertThat(throttle.tryAcquire("run_failed:google:1")).isTrue();
        assertThat(throttle.tryAcquire("run_failed:google:1")).isFalse();
        assertThat(throttle.tryAcquire("run_failed:google:2")).isTrue();

        clock.advance(Duration.ofMinutes(30));
        assertThat(throttle.tryAcquire("run_failed:google:1")).isTrue();
    }

    @Test
    void sweepDropsExpiredKeys() {
        MutableClock clock = new MutableClock(Instant.parse("2026-03-01T12:00:00Z"));
        AlertThrottle throttle = new AlertThrottle(new SchedulerProperties(), clock, null);
        throttle.tryAcquire("a");
        clock.advance(Duration.ofMinutes(20));
        throttle.tryAcquire("b");

        clock.advance(Duration.ofMinutes(15));

        assertThat(throttle.sweep()).isEqualTo(1);
        assertThat(throttle.trackedKeys()).isEqualTo(1);
    }

    private static final class MutableClock extends Clock {
        private Instant now;

        private MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
