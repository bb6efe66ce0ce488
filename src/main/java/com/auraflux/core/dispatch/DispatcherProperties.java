package com.auraflux.core.dispatch;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "auraflux.dispatcher")
public class DispatcherProperties {

    private LaneSettings defaultLane = new LaneSettings(4, 100);
    private LaneSettings streamLane = new LaneSettings(2, 50);
    private Retry retry = new Retry();

    /** How long the acceptance of a reconciled key is replayed to resubmissions. */
    private long completedKeyTtlSeconds = 600;

    /** How long late results of a cancelled key are silently discarded. */
    private long cancelledKeyTtlSeconds = 600;

    public LaneSettings getDefaultLane() {
        return defaultLane;
    }

    public void setDefaultLane(LaneSettings defaultLane) {
        this.defaultLane = defaultLane;
    }

    public LaneSettings getStreamLane() {
        return streamLane;
    }

    public void setStreamLane(LaneSettings streamLane) {
        this.streamLane = streamLane;
    }

    public LaneSettings lane(Lane lane) {
        return lane == Lane.STREAM ? streamLane : defaultLane;
    }

    public Retry getRetry() {
        return retry;
    }

    public void setRetry(Retry retry) {
        this.retry = retry;
    }

    public long getCompletedKeyTtlSeconds() {
        return completedKeyTtlSeconds;
    }

    public void setCompletedKeyTtlSeconds(long completedKeyTtlSeconds) {
        this.completedKeyTtlSeconds = completedKeyTtlSeconds;
    }

    public long getCancelledKeyTtlSeconds() {
        return cancelledKeyTtlSeconds;
    }

    public void setCancelledKeyTtlSeconds(long cancelledKeyTtlSeconds) {
        this.cancelledKeyTtlSeconds = cancelledKeyTtlSeconds;
    }

    public static class LaneSettings {

        private int poolSize;
        private int queueCapacity;

        public LaneSettings() {
            this(1, 10);
        }

        public LaneSettings(int poolSize, int queueCapacity) {
            this.poolSize = poolSize;
            this.queueCapacity = queueCapacity;
        }

        public int getPoolSize() {
            return poolSize;
        }

        public void setPoolSize(int poolSize) {
            this.poolSize = poolSize;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }
    }

    /**
     * Default retry policy for task types that do not override it.
     */
    public static class Retry {

        private int maxAttempts = 3;
        private long initialBackoffMs = 500;
        private double multiplier = 2.0;
        private long maxBackoffMs = 10_000;

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public long getInitialBackoffMs() {
            return initialBackoffMs;
        }

        public void setInitialBackoffMs(long initialBackoffMs) {
            this.initialBackoffMs = initialBackoffMs;
        }

        public double getMultiplier() {
            return multiplier;
        }

        public void setMultiplier(double multiplier) {
            this.multiplier = multiplier;
        }

        public long getMaxBackoffMs() {
            return maxBackoffMs;
        }

        public void setMaxBackoffMs(long maxBackoffMs) {
            this.maxBackoffMs = maxBackoffMs;
        }

        public RetryPolicy toPolicy() {
            return new RetryPolicy(maxAttempts, initialBackoffMs, multiplier, maxBackoffMs);
        }
    }
}
