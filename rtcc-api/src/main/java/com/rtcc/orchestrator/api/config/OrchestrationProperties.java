package com.rtcc.orchestrator.api.config;

import com.rtcc.orchestrator.core.model.RetryPolicy;
import com.rtcc.orchestrator.engine.kernel.KernelSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Orchestration settings bound from {@code rtcc.orchestration.*}.
 */
@ConfigurationProperties(prefix = "rtcc.orchestration")
public class OrchestrationProperties {

    private int queueCapacity = 10_000;
    private int handlerThreads = 16;
    private Duration defaultActionTimeout = Duration.ofSeconds(30);
    private Duration shutdownTimeout = Duration.ofSeconds(30);
    private int historyLimit = 10_000;
    private boolean autoStart = true;
    private boolean loadStandardCatalog = true;
    private final AllocationRetry allocationRetry = new AllocationRetry();

    public KernelSettings toKernelSettings() {
        return KernelSettings.builder()
            .queueCapacity(queueCapacity)
            .handlerThreads(handlerThreads)
            .defaultActionTimeout(defaultActionTimeout)
            .allocationRetry(allocationRetry.toRetryPolicy())
            .shutdownTimeout(shutdownTimeout)
            .historyLimit(historyLimit)
            .build();
    }

    public int getQueueCapacity() {
        return queueCapacity;
    }

    public void setQueueCapacity(int queueCapacity) {
        this.queueCapacity = queueCapacity;
    }

    public int getHandlerThreads() {
        return handlerThreads;
    }

    public void setHandlerThreads(int handlerThreads) {
        this.handlerThreads = handlerThreads;
    }

    public Duration getDefaultActionTimeout() {
        return defaultActionTimeout;
    }

    public void setDefaultActionTimeout(Duration defaultActionTimeout) {
        this.defaultActionTimeout = defaultActionTimeout;
    }

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    public void setShutdownTimeout(Duration shutdownTimeout) {
        this.shutdownTimeout = shutdownTimeout;
    }

    public int getHistoryLimit() {
        return historyLimit;
    }

    public void setHistoryLimit(int historyLimit) {
        this.historyLimit = historyLimit;
    }

    public boolean isAutoStart() {
        return autoStart;
    }

    public void setAutoStart(boolean autoStart) {
        this.autoStart = autoStart;
    }

    public boolean isLoadStandardCatalog() {
        return loadStandardCatalog;
    }

    public void setLoadStandardCatalog(boolean loadStandardCatalog) {
        this.loadStandardCatalog = loadStandardCatalog;
    }

    public AllocationRetry getAllocationRetry() {
        return allocationRetry;
    }

    /**
     * Backoff applied when an action's resource cannot be allocated.
     */
    public static class AllocationRetry {

        private int maxAttempts = 5;
        private Duration initialBackoff = Duration.ofMillis(200);
        private Duration maxBackoff = Duration.ofSeconds(5);
        private double multiplier = 2.0;
        private double jitterFactor = 0.1;

        public RetryPolicy toRetryPolicy() {
            return new RetryPolicy(maxAttempts, initialBackoff, maxBackoff, multiplier, jitterFactor);
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getInitialBackoff() {
            return initialBackoff;
        }

        public void setInitialBackoff(Duration initialBackoff) {
            this.initialBackoff = initialBackoff;
        }

        public Duration getMaxBackoff() {
            return maxBackoff;
        }

        public void setMaxBackoff(Duration maxBackoff) {
            this.maxBackoff = maxBackoff;
        }

        public double getMultiplier() {
            return multiplier;
        }

        public void setMultiplier(double multiplier) {
            this.multiplier = multiplier;
        }

        public double getJitterFactor() {
            return jitterFactor;
        }

        public void setJitterFactor(double jitterFactor) {
            this.jitterFactor = jitterFactor;
        }
    }
}
