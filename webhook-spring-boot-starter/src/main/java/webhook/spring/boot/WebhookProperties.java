package webhook.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;
import webhook.DispatchMode;

/**
 * Configuration properties for the webhook queue.
 *
 * <p>Environment variables bind through relaxed binding, e.g.
 * {@code WEBHOOK_DISPATCH_CONCURRENCY=20} or {@code WEBHOOK_RETRY_DELAY_MS=500}.
 *
 * @see WebhookAutoConfiguration
 */
@ConfigurationProperties(prefix = "webhook")
public class WebhookProperties {

    private final Dispatch dispatch = new Dispatch();
    private final Retry retry = new Retry();
    private final Processing processing = new Processing();
    private final Consumer consumer = new Consumer();
    private final Metrics metrics = new Metrics();

    public Dispatch getDispatch() {
        return dispatch;
    }

    public Retry getRetry() {
        return retry;
    }

    public Processing getProcessing() {
        return processing;
    }

    public Consumer getConsumer() {
        return consumer;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Dispatch {
        /**
         * Who moves items from pending to in flight: the queue itself or a polling consumer.
         */
        private DispatchMode mode = DispatchMode.INTERNAL_PUSH;

        /**
         * Maximum number of webhooks processed at once.
         */
        private int concurrency = 10;

        /**
         * Resident item count (pending plus in flight) at which new webhooks are rejected.
         */
        private int overloadThreshold = 100;

        private long drainTimeoutMs = 5000;

        public DispatchMode getMode() {
            return mode;
        }

        public void setMode(DispatchMode mode) {
            this.mode = mode;
        }

        public int getConcurrency() {
            return concurrency;
        }

        public void setConcurrency(int concurrency) {
            this.concurrency = concurrency;
        }

        public int getOverloadThreshold() {
            return overloadThreshold;
        }

        public void setOverloadThreshold(int overloadThreshold) {
            this.overloadThreshold = overloadThreshold;
        }

        public long getDrainTimeoutMs() {
            return drainTimeoutMs;
        }

        public void setDrainTimeoutMs(long drainTimeoutMs) {
            this.drainTimeoutMs = drainTimeoutMs;
        }
    }

    public static class Retry {
        /**
         * Pause between the first failed attempt and the retry.
         */
        private long delayMs = 2000;

        public long getDelayMs() {
            return delayMs;
        }

        public void setDelayMs(long delayMs) {
            this.delayMs = delayMs;
        }
    }

    public static class Processing {
        private long minDelayMs = 100;
        private long maxDelayMs = 300;
        private double failureRate = 0.1;

        public long getMinDelayMs() {
            return minDelayMs;
        }

        public void setMinDelayMs(long minDelayMs) {
            this.minDelayMs = minDelayMs;
        }

        public long getMaxDelayMs() {
            return maxDelayMs;
        }

        public void setMaxDelayMs(long maxDelayMs) {
            this.maxDelayMs = maxDelayMs;
        }

        public double getFailureRate() {
            return failureRate;
        }

        public void setFailureRate(double failureRate) {
            this.failureRate = failureRate;
        }
    }

    public static class Consumer {
        private long pollIntervalMs = 100;

        /**
         * Number of polling loops; 0 means one per concurrency slot.
         */
        private int workerCount = 0;

        public long getPollIntervalMs() {
            return pollIntervalMs;
        }

        public void setPollIntervalMs(long pollIntervalMs) {
            this.pollIntervalMs = pollIntervalMs;
        }

        public int getWorkerCount() {
            return workerCount;
        }

        public void setWorkerCount(int workerCount) {
            this.workerCount = workerCount;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "webhook";

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
