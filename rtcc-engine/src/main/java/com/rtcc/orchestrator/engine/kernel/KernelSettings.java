package com.rtcc.orchestrator.engine.kernel;

import com.rtcc.orchestrator.core.model.RetryPolicy;

import java.time.Duration;

/**
 * Tuning for the orchestration kernel.
 *
 * @param queueCapacity Queued actions beyond this shed the lowest-priority entry
 * @param handlerThreads Maximum concurrent handler invocations
 * @param defaultActionTimeout Used when an action carries no timeout
 * @param allocationRetry Backoff and attempt limit when a resource cannot be allocated
 * @param shutdownTimeout How long stop() waits for in-flight handlers
 * @param historyLimit Retained audit trail entries
 */
public record KernelSettings(
    int queueCapacity,
    int handlerThreads,
    Duration defaultActionTimeout,
    RetryPolicy allocationRetry,
    Duration shutdownTimeout,
    int historyLimit
) {
    public KernelSettings {
        if (queueCapacity < 1) {
            throw new IllegalArgumentException("queueCapacity must be at least 1");
        }
        if (handlerThreads < 1) {
            throw new IllegalArgumentException("handlerThreads must be at least 1");
        }
        if (defaultActionTimeout == null || defaultActionTimeout.isNegative() || defaultActionTimeout.isZero()) {
            throw new IllegalArgumentException("defaultActionTimeout must be positive");
        }
        if (allocationRetry == null) {
            allocationRetry = RetryPolicy.defaultPolicy();
        }
        if (shutdownTimeout == null || shutdownTimeout.isNegative()) {
            shutdownTimeout = Duration.ofSeconds(30);
        }
        if (historyLimit < 1) {
            throw new IllegalArgumentException("historyLimit must be at least 1");
        }
    }

    public static KernelSettings defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int queueCapacity = 10_000;
        private int handlerThreads = 16;
        private Duration defaultActionTimeout = Duration.ofSeconds(30);
        private RetryPolicy allocationRetry = RetryPolicy.defaultPolicy();
        private Duration shutdownTimeout = Duration.ofSeconds(30);
        private int historyLimit = 10_000;

        public Builder queueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
            return this;
        }

        public Builder handlerThreads(int handlerThreads) {
            this.handlerThreads = handlerThreads;
            return this;
        }

        public Builder defaultActionTimeout(Duration defaultActionTimeout) {
            this.defaultActionTimeout = defaultActionTimeout;
            return this;
        }

        public Builder allocationRetry(RetryPolicy allocationRetry) {
            this.allocationRetry = allocationRetry;
            return this;
        }

        public Builder shutdownTimeout(Duration shutdownTimeout) {
            this.shutdownTimeout = shutdownTimeout;
            return this;
        }

        public Builder historyLimit(int historyLimit) {
            this.historyLimit = historyLimit;
            return this;
        }

        public KernelSettings build() {
            return new KernelSettings(queueCapacity, handlerThreads, defaultActionTimeout,
                allocationRetry, shutdownTimeout, historyLimit);
        }
    }
}
