package com.rtcc.orchestrator.engine.metrics;

import com.rtcc.orchestrator.core.model.ActionType;
import com.rtcc.orchestrator.core.model.FailureKind;
import com.rtcc.orchestrator.core.model.GuardrailCheck;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Micrometer metrics for the orchestration core.
 *
 * Metrics exposed:
 * - Event ingestion and routing counts
 * - Action dispatch outcomes and handler latency
 * - Execution outcomes
 * - Guardrail check outcomes by severity
 * - Resource allocations and queue depth
 */
public class OrchestrationMetrics {

    // Metric names
    public static final String EVENTS_RECEIVED = "rtcc.events.received";
    public static final String EVENTS_ROUTED = "rtcc.events.routed";
    public static final String EVENTS_DROPPED = "rtcc.events.dropped";

    public static final String ACTIONS_DISPATCHED = "rtcc.actions.dispatched";
    public static final String ACTIONS_VETOED = "rtcc.actions.vetoed";
    public static final String ACTIONS_FAILED = "rtcc.actions.failed";
    public static final String ACTIONS_SHED = "rtcc.actions.shed";
    public static final String ACTION_DURATION = "rtcc.action.duration";

    public static final String EXECUTIONS_STARTED = "rtcc.executions.started";
    public static final String EXECUTIONS_COMPLETED = "rtcc.executions.completed";
    public static final String EXECUTIONS_FAILED = "rtcc.executions.failed";
    public static final String EXECUTIONS_TIMED_OUT = "rtcc.executions.timed_out";

    public static final String POLICY_CHECKS = "rtcc.policy.checks";
    public static final String RESOURCE_ALLOCATIONS = "rtcc.resources.allocations";
    public static final String QUEUE_SIZE = "rtcc.queue.size";

    private final MeterRegistry registry;

    public OrchestrationMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Metrics backed by a private in-memory registry, for components built outside Spring.
     */
    public static OrchestrationMetrics standalone() {
        return new OrchestrationMetrics(new SimpleMeterRegistry());
    }

    public MeterRegistry registry() {
        return registry;
    }

    // ========== Event Metrics ==========

    public void eventReceived(String channel) {
        counter(EVENTS_RECEIVED, "Raw events received", "channel", channel).increment();
    }

    public void eventRouted(String channel, int pipelines) {
        counter(EVENTS_ROUTED, "Events delivered to at least one pipeline", "channel", channel).increment();
        counter("rtcc.events.deliveries", "Pipeline deliveries", "channel", channel).increment(pipelines);
    }

    public void eventDropped(String channel, String reason) {
        Counter.builder(EVENTS_DROPPED)
            .tag("channel", safe(channel))
            .tag("reason", reason)
            .description("Events dropped before reaching a pipeline")
            .register(registry)
            .increment();
    }

    // ========== Action Metrics ==========

    public void actionDispatched(ActionType type, String subsystem) {
        Counter.builder(ACTIONS_DISPATCHED)
            .tag("action_type", type.code())
            .tag("subsystem", safe(subsystem))
            .description("Actions handed to a subsystem handler")
            .register(registry)
            .increment();
    }

    public void actionVetoed(ActionType type) {
        counter(ACTIONS_VETOED, "Actions vetoed by a blocking guardrail", "action_type", type.code()).increment();
    }

    public void actionFailed(ActionType type, FailureKind kind) {
        Counter.builder(ACTIONS_FAILED)
            .tag("action_type", type.code())
            .tag("failure", kind.name())
            .description("Actions that did not succeed")
            .register(registry)
            .increment();
    }

    public void actionShed(ActionType type) {
        counter(ACTIONS_SHED, "Actions shed on queue overload", "action_type", type.code()).increment();
    }

    public void recordActionDuration(String subsystem, boolean success, Duration duration) {
        Timer.builder(ACTION_DURATION)
            .tag("subsystem", safe(subsystem))
            .tag("outcome", success ? "success" : "failure")
            .description("Subsystem handler latency")
            .register(registry)
            .record(duration);
    }

    // ========== Execution Metrics ==========

    public void executionStarted(String workflowId) {
        counter(EXECUTIONS_STARTED, "Workflow executions created", "workflow", workflowId).increment();
    }

    public void executionCompleted(String workflowId, Duration duration) {
        counter(EXECUTIONS_COMPLETED, "Workflow executions completed", "workflow", workflowId).increment();
        Timer.builder("rtcc.execution.duration")
            .tag("workflow", safe(workflowId))
            .description("Workflow execution duration")
            .register(registry)
            .record(duration);
    }

    public void executionFailed(String workflowId) {
        counter(EXECUTIONS_FAILED, "Workflow executions failed or aborted", "workflow", workflowId).increment();
    }

    public void executionTimedOut(String workflowId) {
        counter(EXECUTIONS_TIMED_OUT, "Workflow executions that hit their timeout", "workflow", workflowId).increment();
    }

    // ========== Policy / Resource Metrics ==========

    public void policyChecked(GuardrailCheck check) {
        Counter.builder(POLICY_CHECKS)
            .tag("severity", check.severity().code())
            .tag("outcome", check.passed() ? "pass" : "fail")
            .description("Guardrail checks evaluated")
            .register(registry)
            .increment();
    }

    public void resourceAllocated(String resourceType, boolean success) {
        Counter.builder(RESOURCE_ALLOCATIONS)
            .tag("type", resourceType)
            .tag("outcome", success ? "allocated" : "unavailable")
            .description("Resource allocation attempts")
            .register(registry)
            .increment();
    }

    public void bindQueueSize(Supplier<Number> queueSize) {
        Gauge.builder(QUEUE_SIZE, queueSize, s -> s.get().doubleValue())
            .description("Actions waiting in the kernel queue")
            .register(registry);
    }

    private Counter counter(String name, String description, String tagKey, String tagValue) {
        return Counter.builder(name)
            .tag(tagKey, safe(tagValue))
            .description(description)
            .register(registry);
    }

    private static String safe(String tagValue) {
        return tagValue == null ? "unknown" : tagValue;
    }
}
