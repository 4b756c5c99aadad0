package io.livefeed.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the live-feed subscription coordinator.
 *
 * @see LiveFeedAutoConfiguration
 */
@ConfigurationProperties(prefix = "livefeed")
public class LiveFeedProperties {

    private final Coordinator coordinator = new Coordinator();
    private final Retry retry = new Retry();
    private final StaleMonitor staleMonitor = new StaleMonitor();
    private final Metrics metrics = new Metrics();

    public Coordinator getCoordinator() {
        return coordinator;
    }

    public Retry getRetry() {
        return retry;
    }

    public StaleMonitor getStaleMonitor() {
        return staleMonitor;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Coordinator {
        /**
         * Retries of a failed admission before the request is dropped.
         */
        private int maxRetries = 3;

        /**
         * How long one admission may wait for the channel to become active.
         */
        private long admissionTimeoutMs = 30000;

        /**
         * Pause between two consecutive admissions.
         */
        private long interAdmissionDelayMs = 100;

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public long getAdmissionTimeoutMs() {
            return admissionTimeoutMs;
        }

        public void setAdmissionTimeoutMs(long admissionTimeoutMs) {
            this.admissionTimeoutMs = admissionTimeoutMs;
        }

        public long getInterAdmissionDelayMs() {
            return interAdmissionDelayMs;
        }

        public void setInterAdmissionDelayMs(long interAdmissionDelayMs) {
            this.interAdmissionDelayMs = interAdmissionDelayMs;
        }
    }

    public static class Retry {
        private long baseDelayMs = 1000;
        private long maxDelayMs = Long.MAX_VALUE;

        public long getBaseDelayMs() {
            return baseDelayMs;
        }

        public void setBaseDelayMs(long baseDelayMs) {
            this.baseDelayMs = baseDelayMs;
        }

        public long getMaxDelayMs() {
            return maxDelayMs;
        }

        public void setMaxDelayMs(long maxDelayMs) {
            this.maxDelayMs = maxDelayMs;
        }
    }

    public static class StaleMonitor {
        private boolean enabled = false;
        private Duration idleThreshold = Duration.ofSeconds(60);
        private Duration interval = Duration.ofSeconds(30);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getIdleThreshold() {
            return idleThreshold;
        }

        public void setIdleThreshold(Duration idleThreshold) {
            this.idleThreshold = idleThreshold;
        }

        public Duration getInterval() {
            return interval;
        }

        public void setInterval(Duration interval) {
            this.interval = interval;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "livefeed";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
