package com.rtcc.orchestrator.engine.logging;

import com.rtcc.orchestrator.core.model.OrchestrationAction;
import org.slf4j.MDC;

import java.util.UUID;

/**
 * MDC (Mapped Diagnostic Context) helper for structured logging.
 * Ensures dispatch, handler and routing logs carry their correlation keys.
 *
 * Usage:
 * <pre>
 * try (var ctx = LoggingContext.forAction(action)) {
 *     log.info("Dispatching"); // includes executionId, actionId, actionType, subsystem
 * }
 * </pre>
 */
public final class LoggingContext implements AutoCloseable {

    public static final String EXECUTION_ID = "executionId";
    public static final String WORKFLOW = "workflow";
    public static final String ACTION_ID = "actionId";
    public static final String ACTION_TYPE = "actionType";
    public static final String SUBSYSTEM = "subsystem";
    public static final String CHANNEL = "channel";
    public static final String TRACE_ID = "traceId";

    private LoggingContext() {
        // Private constructor - use static factory methods
    }

    /**
     * Create a logging context for execution-level operations.
     */
    public static LoggingContext forExecution(String executionId, String workflowId) {
        LoggingContext ctx = new LoggingContext();
        putIfPresent(EXECUTION_ID, executionId);
        putIfPresent(WORKFLOW, workflowId);
        ensureTraceId();
        return ctx;
    }

    /**
     * Create a logging context around dispatch or invocation of one action.
     */
    public static LoggingContext forAction(OrchestrationAction action) {
        LoggingContext ctx = new LoggingContext();
        putIfPresent(EXECUTION_ID, action.executionId());
        putIfPresent(WORKFLOW, action.workflowId());
        putIfPresent(ACTION_ID, action.actionId());
        putIfPresent(ACTION_TYPE, action.actionType().code());
        putIfPresent(SUBSYSTEM, action.targetSubsystem());
        ensureTraceId();
        return ctx;
    }

    /**
     * Create a logging context for ingestion on a channel.
     */
    public static LoggingContext forChannel(String channel) {
        LoggingContext ctx = new LoggingContext();
        putIfPresent(CHANNEL, channel);
        ensureTraceId();
        return ctx;
    }

    /**
     * Get current trace ID from context.
     */
    public static String getTraceId() {
        return MDC.get(TRACE_ID);
    }

    private static void putIfPresent(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        }
    }

    private static void ensureTraceId() {
        if (MDC.get(TRACE_ID) == null) {
            MDC.put(TRACE_ID, UUID.randomUUID().toString().substring(0, 8));
        }
    }

    @Override
    public void close() {
        MDC.remove(EXECUTION_ID);
        MDC.remove(WORKFLOW);
        MDC.remove(ACTION_ID);
        MDC.remove(ACTION_TYPE);
        MDC.remove(SUBSYSTEM);
        MDC.remove(CHANNEL);
        // Keep TRACE_ID for request-scoped tracing
    }

    /**
     * Clear all MDC context. Call at the end of a request or worker loop.
     */
    public static void clearAll() {
        MDC.clear();
    }
}
