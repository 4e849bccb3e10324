package com.wirecrest.scraper.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

@ConfigurationProperties(prefix = "scheduler")
public class SchedulerProperties {
    private Platform platform = new Platform();
    private Webhook webhook = new Webhook();
    private Batch batch = new Batch();
    private Intervals intervals = new Intervals();
    private Alerts alerts = new Alerts();
    private Reconciliation reconciliation = new Reconciliation();
    private InitialRun initialRun = new InitialRun();

    public Platform getPlatform() {
        return platform;
    }

    public void setPlatform(Platform platform) {
        this.platform = platform;
    }

    public Webhook getWebhook() {
        return webhook;
    }

    public void setWebhook(Webhook webhook) {
        this.webhook = webhook;
    }

    public Batch getBatch() {
        return batch;
    }

    public void setBatch(Batch batch) {
        this.batch = batch;
    }

    public Intervals getIntervals() {
        return intervals;
    }

    public void setIntervals(Intervals intervals) {
        this.intervals = intervals;
    }

    public Alerts getAlerts() {
        return alerts;
    }

    public void setAlerts(Alerts alerts) {
        this.alerts = alerts;
    }

    public Reconciliation getReconciliation() {
        return reconciliation;
    }

    public void setReconciliation(Reconciliation reconciliation) {
        this.reconciliation = reconciliation;
    }

    public InitialRun getInitialRun() {
        return initialRun;
    }

    public void setInitialRun(InitialRun initialRun) {
        this.initialRun = initialRun;
    }

    public static class Platform {
        private String baseUrl = "https://api.apify.com/v2";
        private String token;
        private int requestTimeoutSeconds = 30;
        private int maxRetries = 2;
        private int retryBaseDelayMs = 500;
        private int retryMaxDelayMs = 5000;
        private int runMemoryMbytes = 4096;
        private int runTimeoutSecs = 3600;
        private String build = "latest";
        private int profileLookupTimeoutSecs = 120;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getToken() {
            return token;
        }

        public void setToken(String token) {
            this.token = token;
        }

        public int getRequestTimeoutSeconds() {
            return Math.max(1, requestTimeoutSeconds);
        }

        public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
            this.requestTimeoutSeconds = requestTimeoutSeconds;
        }

        public int getMaxRetries() {
            return Math.max(0, maxRetries);
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public int getRetryBaseDelayMs() {
            return Math.max(0, retryBaseDelayMs);
        }

        public void setRetryBaseDelayMs(int retryBaseDelayMs) {
            this.retryBaseDelayMs = retryBaseDelayMs;
        }

        public int getRetryMaxDelayMs() {
            return Math.max(0, retryMaxDelayMs);
        }

        public void setRetryMaxDelayMs(int retryMaxDelayMs) {
            this.retryMaxDelayMs = retryMaxDelayMs;
        }

        public int getRunMemoryMbytes() {
            return Math.max(128, runMemoryMbytes);
        }

        public void setRunMemoryMbytes(int runMemoryMbytes) {
            this.runMemoryMbytes = runMemoryMbytes;
        }

        public int getRunTimeoutSecs() {
            return Math.max(60, runTimeoutSecs);
        }

        public void setRunTimeoutSecs(int runTimeoutSecs) {
            this.runTimeoutSecs = runTimeoutSecs;
        }

        public String getBuild() {
            return build == null || build.isBlank() ? "latest" : build.trim();
        }

        public void setBuild(String build) {
            this.build = build;
        }

        /**
         * Upper bound for a synchronous profile lookup run. The platform caps synchronous runs at 300 seconds.
         */
        public int getProfileLookupTimeoutSecs() {
            return Math.min(300, Math.max(1, profileLookupTimeoutSecs));
        }

        public void setProfileLookupTimeoutSecs(int profileLookupTimeoutSecs) {
            this.profileLookupTimeoutSecs = profileLookupTimeoutSecs;
        }
    }

    public static class Webhook {
        private String baseUrl = "http://localhost:8080";
        private String secret;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getSecret() {
            return secret;
        }

        public void setSecret(String secret) {
            this.secret = secret;
        }
    }

    public static class Batch {
        private Map<String, Integer> maxSize = new LinkedHashMap<>();
        private double consolidationThreshold = 0.3;
        private int reviewsMaxItemsPerRun = 200;
        private int overviewMaxItemsPerRun = 1;
        private int maxPlacementAttempts = 5;

        /**
         * Configured capacity for a target-type key, falling back to the supplied default.
         */
        public int maxSizeFor(String targetTypeKey, int defaultSize) {
            if (targetTypeKey == null) {
                return Math.max(1, defaultSize);
            }
            Integer configured = maxSize.get(targetTypeKey.toLowerCase(Locale.ROOT));
            if (configured == null) {
                return Math.max(1, defaultSize);
            }
            return Math.max(1, configured);
        }

        public Map<String, Integer> getMaxSize() {
            return maxSize;
        }

        public void setMaxSize(Map<String, Integer> maxSize) {
            this.maxSize = maxSize == null ? new LinkedHashMap<>() : maxSize;
        }

        public double getConsolidationThreshold() {
            return Math.min(1.0, Math.max(0.0, consolidationThreshold));
        }

        public void setConsolidationThreshold(double consolidationThreshold) {
            this.consolidationThreshold = consolidationThreshold;
        }

        public int getReviewsMaxItemsPerRun() {
            return Math.max(1, reviewsMaxItemsPerRun);
        }

        public void setReviewsMaxItemsPerRun(int reviewsMaxItemsPerRun) {
            this.reviewsMaxItemsPerRun = reviewsMaxItemsPerRun;
        }

        public int getOverviewMaxItemsPerRun() {
            return Math.max(1, overviewMaxItemsPerRun);
        }

        public void setOverviewMaxItemsPerRun(int overviewMaxItemsPerRun) {
            this.overviewMaxItemsPerRun = overviewMaxItemsPerRun;
        }

        public int getMaxPlacementAttempts() {
            return Math.max(1, maxPlacementAttempts);
        }

        public void setMaxPlacementAttempts(int maxPlacementAttempts) {
            this.maxPlacementAttempts = maxPlacementAttempts;
        }
    }

    public static class Intervals {
        private int minHours = 1;
        private int maxHours = 168;

        public int getMinHours() {
            return Math.max(1, minHours);
        }

        public void setMinHours(int minHours) {
            this.minHours = minHours;
        }

        public int getMaxHours() {
            return Math.max(getMinHours(), maxHours);
        }

        public void setMaxHours(int maxHours) {
            this.maxHours = maxHours;
        }
    }

    public static class Alerts {
        private int throttleWindowMinutes = 30;
        private int sweepIntervalSeconds = 300;

        public int getThrottleWindowMinutes() {
            return Math.max(1, throttleWindowMinutes);
        }

        public void setThrottleWindowMinutes(int throttleWindowMinutes) {
            this.throttleWindowMinutes = throttleWindowMinutes;
        }

        public int getSweepIntervalSeconds() {
            return Math.max(1, sweepIntervalSeconds);
        }

        public void setSweepIntervalSeconds(int sweepIntervalSeconds) {
            this.sweepIntervalSeconds = sweepIntervalSeconds;
        }
    }

    public static class Reconciliation {
        private boolean enabled = false;
        private int intervalMinutes = 15;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getIntervalMinutes() {
            return Math.max(1, intervalMinutes);
        }

        public void setIntervalMinutes(int intervalMinutes) {
            this.intervalMinutes = intervalMinutes;
        }
    }

    public static class InitialRun {
        private int maxItems = 99999;

        public int getMaxItems() {
            return Math.max(1, maxItems);
        }

        public void setMaxItems(int maxItems) {
            this.maxItems = maxItems;
        }
    }
}
