package com.existence.arbitration.api;

import java.time.Duration;

/**
 * Options for an existence engine: confidence thresholds, notification retry,
 * locking, and scheduling.
 */
public class ArbitrationOptions {

    private static final double DEFAULT_AUTO_FIX_THRESHOLD = 0.90;
    private static final double DEFAULT_PENDING_PROVENANCE_THRESHOLD = 0.80;
    private static final int DEFAULT_CACHE_MAX_SIZE = 50_000;
    private static final int DEFAULT_NOTIFICATION_MAX_ATTEMPTS = 3;
    private static final Duration DEFAULT_NOTIFICATION_BASE_DELAY = Duration.ofMillis(500);
    private static final Duration DEFAULT_LOCK_TIMEOUT = Duration.ofSeconds(5);
    private static final Duration DEFAULT_RECONCILE_INTERVAL = Duration.ofMinutes(5);
    private static final long DEFAULT_ASYNC_TIMEOUT_MS = 30_000;

    private final double autoFixThreshold;
    private final double pendingProvenanceThreshold;
    private final int cacheMaxSize;
    private final int notificationMaxAttempts;
    private final Duration notificationBaseDelay;
    private final Duration lockTimeout;
    private final boolean strictTransitions;
    private final Duration reconcileInterval;
    private final boolean scheduledAutoFix;
    private final long asyncTimeoutMs;

    private ArbitrationOptions(Builder builder) {
        this.autoFixThreshold = builder.autoFixThreshold;
        this.pendingProvenanceThreshold = builder.pendingProvenanceThreshold;
        this.cacheMaxSize = builder.cacheMaxSize;
        this.notificationMaxAttempts = builder.notificationMaxAttempts;
        this.notificationBaseDelay = builder.notificationBaseDelay;
        this.lockTimeout = builder.lockTimeout;
        this.strictTransitions = builder.strictTransitions;
        this.reconcileInterval = builder.reconcileInterval;
        this.scheduledAutoFix = builder.scheduledAutoFix;
        this.asyncTimeoutMs = builder.asyncTimeoutMs;
    }

    /**
     * Minimum confidence at which reconciliation repairs a finding without a human.
     */
    public double getAutoFixThreshold() {
        return autoFixThreshold;
    }

    /**
     * Bindings created by AI or the system below this confidence start out pending.
     */
    public double getPendingProvenanceThreshold() {
        return pendingProvenanceThreshold;
    }

    public int getCacheMaxSize() {
        return cacheMaxSize;
    }

    public int getNotificationMaxAttempts() {
        return notificationMaxAttempts;
    }

    public Duration getNotificationBaseDelay() {
        return notificationBaseDelay;
    }

    public Duration getLockTimeout() {
        return lockTimeout;
    }

    public boolean isStrictTransitions() {
        return strictTransitions;
    }

    public Duration getReconcileInterval() {
        return reconcileInterval;
    }

    public boolean isScheduledAutoFix() {
        return scheduledAutoFix;
    }

    public long getAsyncTimeoutMs() {
        return asyncTimeoutMs;
    }

    public static ArbitrationOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private double autoFixThreshold = DEFAULT_AUTO_FIX_THRESHOLD;
        private double pendingProvenanceThreshold = DEFAULT_PENDING_PROVENANCE_THRESHOLD;
        private int cacheMaxSize = DEFAULT_CACHE_MAX_SIZE;
        private int notificationMaxAttempts = DEFAULT_NOTIFICATION_MAX_ATTEMPTS;
        private Duration notificationBaseDelay = DEFAULT_NOTIFICATION_BASE_DELAY;
        private Duration lockTimeout = DEFAULT_LOCK_TIMEOUT;
        private boolean strictTransitions = false;
        private Duration reconcileInterval = DEFAULT_RECONCILE_INTERVAL;
        private boolean scheduledAutoFix = true;
        private long asyncTimeoutMs = DEFAULT_ASYNC_TIMEOUT_MS;

        public Builder autoFixThreshold(double threshold) {
            if (threshold < 0.0 || threshold > 1.0) {
                throw new IllegalArgumentException("autoFixThreshold must be in [0, 1]");
            }
            this.autoFixThreshold = threshold;
            return this;
        }

        public Builder pendingProvenanceThreshold(double threshold) {
            if (threshold < 0.0 || threshold > 1.0) {
                throw new IllegalArgumentException("pendingProvenanceThreshold must be in [0, 1]");
            }
            this.pendingProvenanceThreshold = threshold;
            return this;
        }

        public Builder cacheMaxSize(int cacheMaxSize) {
            if (cacheMaxSize <= 0) {
                throw new IllegalArgumentException("cacheMaxSize must be > 0");
            }
            this.cacheMaxSize = cacheMaxSize;
            return this;
        }

        public Builder notificationMaxAttempts(int attempts) {
            if (attempts <= 0) {
                throw new IllegalArgumentException("notificationMaxAttempts must be > 0");
            }
            this.notificationMaxAttempts = attempts;
            return this;
        }

        public Builder notificationBaseDelay(Duration delay) {
            this.notificationBaseDelay = delay;
            return this;
        }

        public Builder lockTimeout(Duration timeout) {
            this.lockTimeout = timeout;
            return this;
        }

        public Builder strictTransitions(boolean strict) {
            this.strictTransitions = strict;
            return this;
        }

        public Builder reconcileInterval(Duration interval) {
            this.reconcileInterval = interval;
            return this;
        }

        public Builder scheduledAutoFix(boolean autoFix) {
            this.scheduledAutoFix = autoFix;
            return this;
        }

        public Builder asyncTimeoutMs(long timeoutMs) {
            if (timeoutMs <= 0) {
                throw new IllegalArgumentException("asyncTimeoutMs must be > 0");
            }
            this.asyncTimeoutMs = timeoutMs;
            return this;
        }

        public ArbitrationOptions build() {
            return new ArbitrationOptions(this);
        }
    }
}
