package com.rtcc.orchestrator.api.config;

import com.rtcc.orchestrator.engine.kernel.KernelSettings;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class OrchestrationPropertiesTest {

    private static OrchestrationProperties bind(Map<String, String> values) {
        Binder binder = new Binder(new MapConfigurationPropertySource(values));
        return binder.bindOrCreate("rtcc.orchestration", OrchestrationProperties.class);
    }

    @Test
    @DisplayName("Defaults produce the default kernel settings")
    void defaults() {
        KernelSettings settings = bind(Map.of()).toKernelSettings();

        assertThat(settings.queueCapacity()).isEqualTo(10_000);
        assertThat(settings.handlerThreads()).isEqualTo(16);
        assertThat(settings.defaultActionTimeout()).isEqualTo(Duration.ofSeconds(30));
        assertThat(settings.allocationRetry().maxAttempts()).isEqualTo(5);
        assertThat(settings.allocationRetry().initialBackoff()).isEqualTo(Duration.ofMillis(200));
    }

    @Test
    @DisplayName("Relaxed property names bind into the kernel settings")
    void boundValues() {
        OrchestrationProperties properties = bind(Map.of(
            "rtcc.orchestration.queue-capacity", "250",
            "rtcc.orchestration.handler-threads", "4",
            "rtcc.orchestration.default-action-timeout", "10s",
            "rtcc.orchestration.shutdown-timeout", "5s",
            "rtcc.orchestration.auto-start", "false",
            "rtcc.orchestration.allocation-retry.max-attempts", "3",
            "rtcc.orchestration.allocation-retry.initial-backoff", "50ms",
            "rtcc.orchestration.allocation-retry.multiplier", "3.0"));

        KernelSettings settings = properties.toKernelSettings();

        assertThat(properties.isAutoStart()).isFalse();
        assertThat(properties.isLoadStandardCatalog()).isTrue();
        assertThat(settings.queueCapacity()).isEqualTo(250);
        assertThat(settings.handlerThreads()).isEqualTo(4);
        assertThat(settings.defaultActionTimeout()).isEqualTo(Duration.ofSeconds(10));
        assertThat(settings.shutdownTimeout()).isEqualTo(Duration.ofSeconds(5));
        assertThat(settings.allocationRetry().maxAttempts()).isEqualTo(3);
        assertThat(settings.allocationRetry().initialBackoff()).isEqualTo(Duration.ofMillis(50));
        assertThat(settings.allocationRetry().backoffMultiplier()).isEqualTo(3.0);
    }
}
