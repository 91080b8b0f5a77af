package com.rtcc.orchestrator.engine.kernel;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rtcc.orchestrator.core.exception.KernelStateException;
import com.rtcc.orchestrator.core.exception.NotFoundException;
import com.rtcc.orchestrator.core.model.ActionStatus;
import com.rtcc.orchestrator.core.model.ActionType;
import com.rtcc.orchestrator.core.model.FailureKind;
import com.rtcc.orchestrator.core.model.GuardrailCheck;
import com.rtcc.orchestrator.core.model.KernelStatus;
import com.rtcc.orchestrator.core.model.NormalizedEvent;
import com.rtcc.orchestrator.core.model.OrchestrationAction;
import com.rtcc.orchestrator.core.model.OrchestrationResult;
import com.rtcc.orchestrator.core.model.Resource;
import com.rtcc.orchestrator.core.model.ResourceAllocation;
import com.rtcc.orchestrator.core.model.RoutingRule;
import com.rtcc.orchestrator.core.repository.AuditTrailRepository;
import com.rtcc.orchestrator.engine.logging.LoggingContext;
import com.rtcc.orchestrator.engine.metrics.OrchestrationMetrics;
import com.rtcc.orchestrator.engine.policy.PolicyBindingEngine;
import com.rtcc.orchestrator.engine.policy.PolicyVerdict;
import com.rtcc.orchestrator.engine.resource.ResourceManager;
import com.rtcc.orchestrator.engine.routing.EventRouter;
import com.rtcc.orchestrator.engine.subsystem.HandlerContext;
import com.rtcc.orchestrator.engine.subsystem.HandlerException;
import com.rtcc.orchestrator.engine.subsystem.SubsystemHandler;
import com.rtcc.orchestrator.engine.workflow.ActionPublisher;
import com.rtcc.orchestrator.engine.workflow.ActionResultListener;
import com.rtcc.orchestrator.engine.workflow.WorkflowEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Predicate;

/**
 * Top-level coordinator: owns the action queue, the subsystem handler registry
 * and the audit trail.
 *
 * A single dispatcher thread takes the highest-priority action, checks it against
 * the policy engine, allocates a resource when the action needs one, and hands it to
 * the target subsystem handler on a bounded pool. The dispatcher only takes an action
 * when a handler slot is free, so a newly queued urgent action is never stuck behind
 * work the dispatcher already took. A handler that overruns its timeout gets a
 * {@code HANDLER_TIMEOUT} result at once, but its slot and any allocated resource stay
 * held until its thread returns.
 *
 * Every action ends in exactly one {@link OrchestrationResult}, appended to the audit
 * trail and passed to result listeners. Nothing thrown by a handler or a listener
 * escapes the dispatch loop.
 */
public class OrchestrationKernel implements ActionPublisher {

    private static final Logger log = LoggerFactory.getLogger(OrchestrationKernel.class);

    public static final String WORKFLOW_TRIGGERS_PIPELINE = "workflow_triggers";
    static final String WORKFLOW_TRIGGERS_RULE = "workflow-triggers";
    private static final long POLL_INTERVAL_MS = 100;

    private final EventRouter router;
    private final PolicyBindingEngine policyEngine;
    private final ResourceManager resourceManager;
    private final AuditTrailRepository auditTrail;
    private final OrchestrationMetrics metrics;
    private final ObjectMapper objectMapper;
    private final KernelSettings settings;

    private final ActionQueue queue;
    private final Map<String, SubsystemHandler> subsystems = new ConcurrentHashMap<>();
    private final Map<String, OrchestrationAction> awaitingConfirmation = new LinkedHashMap<>();
    private final Map<String, PendingRetry> pendingRetries = new ConcurrentHashMap<>();
    private final List<ActionResultListener> listeners = new CopyOnWriteArrayList<>();

    private final AtomicReference<KernelStatus> status = new AtomicReference<>(KernelStatus.STOPPED);
    private final Semaphore handlerSlots;
    private final AtomicInteger inFlight = new AtomicInteger();
    private final Object lifecycleLock = new Object();

    private volatile Thread dispatcher;
    private volatile ExecutorService handlerPool;
    private volatile ScheduledExecutorService retryScheduler;

    // Statistics
    private final AtomicLong queued = new AtomicLong();
    private final AtomicLong dispatched = new AtomicLong();
    private final AtomicLong succeeded = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong vetoed = new AtomicLong();
    private final AtomicLong shed = new AtomicLong();
    private final AtomicLong requeued = new AtomicLong();
    private final AtomicLong cancelled = new AtomicLong();
    private final Map<String, AtomicLong> bySubsystem = new ConcurrentHashMap<>();

    private record PendingRetry(OrchestrationAction action, ScheduledFuture<?> future) {}

    public OrchestrationKernel(
            EventRouter router,
            PolicyBindingEngine policyEngine,
            ResourceManager resourceManager,
            AuditTrailRepository auditTrail,
            OrchestrationMetrics metrics,
            ObjectMapper objectMapper,
            KernelSettings settings) {
        this.router = router;
        this.policyEngine = policyEngine;
        this.resourceManager = resourceManager;
        this.auditTrail = auditTrail;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
        this.settings = settings;
        this.queue = new ActionQueue(settings.queueCapacity());
        this.handlerSlots = new Semaphore(settings.handlerThreads());
        metrics.bindQueueSize(queue::size);
    }

    // ========== Wiring ==========

    /**
     * Connect a workflow engine: it receives every action result, and routed events
     * reach its trigger matching through the {@value #WORKFLOW_TRIGGERS_PIPELINE} pipeline.
     */
    public void bindWorkflowEngine(WorkflowEngine workflowEngine) {
        addResultListener(workflowEngine);
        router.registerPipeline(WORKFLOW_TRIGGERS_PIPELINE, workflowEngine::handleEvent);
        router.addRule(RoutingRule.builder("Workflow Triggers")
            .ruleId(WORKFLOW_TRIGGERS_RULE)
            .targetPipelines(WORKFLOW_TRIGGERS_PIPELINE)
            .build());
        log.info("Workflow engine bound to kernel");
    }

    public void addResultListener(ActionResultListener listener) {
        listeners.add(listener);
    }

    /**
     * Make a subsystem available to future actions. Replaces any handler with the same name.
     */
    public void registerSubsystem(String name, SubsystemHandler handler) {
        subsystems.put(name, handler);
        log.info("Registered subsystem handler: {}", name);
    }

    public boolean unregisterSubsystem(String name) {
        boolean removed = subsystems.remove(name) != null;
        if (removed) {
            log.info("Unregistered subsystem handler: {}", name);
        }
        return removed;
    }

    public Set<String> listSubsystems() {
        return new TreeSet<>(subsystems.keySet());
    }

    /**
     * Single ingestion entry point: normalize and route a raw channel event.
     *
     * @throws com.rtcc.orchestrator.core.exception.SchemaValidationException if the event is malformed
     */
    public NormalizedEvent ingest(String channel, Map<String, Object> rawEvent) {
        return router.route(channel, rawEvent);
    }

    // ========== Lifecycle ==========

    public KernelStatus getStatus() {
        return status.get();
    }

    /**
     * Start dispatching. Queued actions are kept across stop and start.
     */
    public void start() {
        synchronized (lifecycleLock) {
            KernelStatus current = status.get();
            if (current == KernelStatus.RUNNING) {
                return;
            }
            if (current != KernelStatus.STOPPED) {
                throw new KernelStateException("start", current);
            }
            handlerPool = Executors.newFixedThreadPool(settings.handlerThreads(), namedThreads("rtcc-handler"));
            retryScheduler = Executors.newSingleThreadScheduledExecutor(namedThreads("rtcc-retry"));
            status.set(KernelStatus.RUNNING);
            Thread thread = new Thread(this::dispatchLoop, "rtcc-dispatcher");
            thread.setDaemon(true);
            dispatcher = thread;
            thread.start();
        }
        log.info("Orchestration kernel started ({} handler threads, queue capacity {}, {} queued)",
            settings.handlerThreads(), settings.queueCapacity(), queue.size());
    }

    /**
     * Stop taking new actions; in-flight handlers keep running.
     */
    public void pause() {
        synchronized (lifecycleLock) {
            KernelStatus current = status.get();
            if (current == KernelStatus.PAUSED) {
                return;
            }
            if (current != KernelStatus.RUNNING) {
                throw new KernelStateException("pause", current);
            }
            status.set(KernelStatus.PAUSED);
        }
        log.info("Orchestration kernel paused ({} queued, {} in flight)", queue.size(), inFlight.get());
    }

    public void resume() {
        synchronized (lifecycleLock) {
            KernelStatus current = status.get();
            if (current == KernelStatus.RUNNING) {
                return;
            }
            if (current != KernelStatus.PAUSED) {
                throw new KernelStateException("resume", current);
            }
            status.set(KernelStatus.RUNNING);
        }
        log.info("Orchestration kernel resumed ({} queued)", queue.size());
    }

    /**
     * Stop dispatching and wait up to the shutdown timeout for in-flight handlers.
     * Actions waiting for an allocation retry go back to the queue.
     */
    public void stop() {
        Thread dispatcherThread;
        synchronized (lifecycleLock) {
            KernelStatus current = status.get();
            if (current == KernelStatus.STOPPED || current == KernelStatus.STOPPING) {
                return;
            }
            status.set(KernelStatus.STOPPING);
            dispatcherThread = dispatcher;
        }
        log.info("Stopping orchestration kernel ({} in flight)", inFlight.get());

        if (dispatcherThread != null) {
            try {
                dispatcherThread.join(settings.shutdownTimeout().toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        retryScheduler.shutdownNow();
        for (PendingRetry retry : drainPendingRetries(a -> true)) {
            retry.future().cancel(false);
            enqueue(retry.action());
        }

        handlerPool.shutdown();
        try {
            if (!handlerPool.awaitTermination(settings.shutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Shutdown timeout reached with {} handlers still in flight; interrupting", inFlight.get());
                handlerPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            handlerPool.shutdownNow();
            Thread.currentThread().interrupt();
        }

        synchronized (lifecycleLock) {
            dispatcher = null;
            status.set(KernelStatus.STOPPED);
        }
        log.info("Orchestration kernel stopped ({} actions remain queued)", queue.size());
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    // ========== Queue ==========

    /**
     * Insert an action into the priority queue. While paused or stopped, actions
     * accumulate without being dispatched.
     */
    @Override
    public void queueAction(OrchestrationAction action) {
        queued.incrementAndGet();
        log.debug("Queued action {} ({}) for {} at priority {}",
            action.actionId(), action.actionType(), action.targetSubsystem(), action.priority());
        enqueue(action);
    }

    private void enqueue(OrchestrationAction action) {
        queue.offer(action).ifPresent(this::recordShed);
    }

    private void recordShed(OrchestrationAction action) {
        shed.incrementAndGet();
        metrics.actionShed(action.actionType());
        log.warn("Queue at capacity {}; shed action {} ({}) at priority {}",
            queue.capacity(), action.actionId(), action.actionType(), action.priority());
        Instant now = Instant.now();
        record(OrchestrationResult.failed(action, ActionStatus.SHED, FailureKind.QUEUE_OVERLOAD,
            List.of("Shed: queue at capacity " + queue.capacity()),
            List.of(), null,
            List.of("Queued at priority " + action.priority(),
                "Shed as lowest-priority entry while queue was at capacity " + queue.capacity()),
            now));
    }

    @Override
    public List<OrchestrationAction> withdrawActions(String executionId) {
        List<OrchestrationAction> withdrawn = new ArrayList<>(
            queue.removeIf(a -> executionId.equals(a.executionId())));
        synchronized (awaitingConfirmation) {
            Iterator<OrchestrationAction> it = awaitingConfirmation.values().iterator();
            while (it.hasNext()) {
                OrchestrationAction action = it.next();
                if (executionId.equals(action.executionId())) {
                    withdrawn.add(action);
                    it.remove();
                }
            }
        }
        for (PendingRetry retry : drainPendingRetries(a -> executionId.equals(a.executionId()))) {
            retry.future().cancel(false);
            withdrawn.add(retry.action());
        }

        for (OrchestrationAction action : withdrawn) {
            cancelled.incrementAndGet();
            record(OrchestrationResult.failed(action, ActionStatus.CANCELLED, FailureKind.CANCELLED,
                List.of("Withdrawn before dispatch"), List.of(), null,
                List.of("Withdrawn before dispatch: execution " + executionId + " ended"),
                Instant.now()));
        }
        if (!withdrawn.isEmpty()) {
            log.info("Withdrew {} pending action(s) of execution {}", withdrawn.size(), executionId);
        }
        return withdrawn;
    }

    @Override
    public boolean isDispatching() {
        return status.get() == KernelStatus.RUNNING;
    }

    private List<PendingRetry> drainPendingRetries(Predicate<OrchestrationAction> filter) {
        List<PendingRetry> drained = new ArrayList<>();
        for (String actionId : List.copyOf(pendingRetries.keySet())) {
            PendingRetry retry = pendingRetries.get(actionId);
            if (retry != null && filter.test(retry.action()) && pendingRetries.remove(actionId, retry)) {
                drained.add(retry);
            }
        }
        return drained;
    }

    /**
     * Queued actions in dispatch order.
     */
    public List<OrchestrationAction> getQueueSnapshot() {
        return queue.snapshot();
    }

    // ========== Confirmation ==========

    public List<OrchestrationAction> getAwaitingConfirmation() {
        synchronized (awaitingConfirmation) {
            return List.copyOf(awaitingConfirmation.values());
        }
    }

    /**
     * Confirm a parked action; it re-enters the queue at its priority.
     */
    public OrchestrationAction confirmAction(String actionId) {
        OrchestrationAction action = takeAwaitingConfirmation(actionId).confirm();
        log.info("Action {} ({}) confirmed by operator", actionId, action.actionType());
        enqueue(action);
        return action;
    }

    /**
     * Reject a parked action; it fails without reaching its subsystem.
     */
    public OrchestrationResult rejectAction(String actionId, String reason) {
        OrchestrationAction action = takeAwaitingConfirmation(actionId);
        String why = reason == null || reason.isBlank() ? "no reason given" : reason;
        log.warn("Action {} ({}) rejected by operator: {}", actionId, action.actionType(), why);
        OrchestrationResult result = OrchestrationResult.failed(action, ActionStatus.FAILED,
            FailureKind.CONFIRMATION_REJECTED,
            List.of("Rejected by operator: " + why), List.of(), null,
            List.of("Held for operator confirmation", "Rejected by operator: " + why),
            Instant.now());
        failed.incrementAndGet();
        metrics.actionFailed(action.actionType(), FailureKind.CONFIRMATION_REJECTED);
        record(result);
        return result;
    }

    private OrchestrationAction takeAwaitingConfirmation(String actionId) {
        synchronized (awaitingConfirmation) {
            OrchestrationAction action = awaitingConfirmation.remove(actionId);
            if (action == null) {
                throw new NotFoundException("AwaitingConfirmation", actionId);
            }
            return action;
        }
    }

    // ========== Dispatch ==========

    private void dispatchLoop() {
        log.debug("Dispatcher started");
        while (true) {
            KernelStatus current = status.get();
            if (current == KernelStatus.STOPPING || current == KernelStatus.STOPPED) {
                break;
            }
            boolean holdingSlot = false;
            try {
                if (!current.acceptsDispatch()) {
                    Thread.sleep(POLL_INTERVAL_MS);
                    continue;
                }
                holdingSlot = handlerSlots.tryAcquire(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
                if (!holdingSlot) {
                    continue;
                }
                ActionQueue.Entry entry = queue.poll(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
                if (entry == null) {
                    continue;
                }
                if (!status.get().acceptsDispatch()) {
                    queue.restore(entry);
                    continue;
                }
                if (dispatch(entry.action())) {
                    // the handler thread releases the slot when it returns
                    holdingSlot = false;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Dispatcher interrupted while {}", status.get());
                break;
            } catch (RuntimeException e) {
                log.error("Unexpected error in dispatch loop: {}", e.getMessage(), e);
            } finally {
                if (holdingSlot) {
                    handlerSlots.release();
                }
            }
        }
        log.debug("Dispatcher exited");
    }

    /**
     * Run one action through confirmation, policy, allocation and handler invocation.
     *
     * @return true if a handler was started and now owns the handler slot
     */
    private boolean dispatch(OrchestrationAction action) {
        try (LoggingContext ignored = LoggingContext.forAction(action)) {
            if (action.isAwaitingConfirmation()) {
                synchronized (awaitingConfirmation) {
                    awaitingConfirmation.put(action.actionId(), action);
                }
                log.info("Action {} ({}) held for operator confirmation", action.actionId(), action.actionType());
                return false;
            }

            Instant startedAt = Instant.now();
            List<String> trail = new ArrayList<>();
            trail.add("Dequeued at priority " + action.priority() + " (attempt " + action.attempt() + ")");

            PolicyVerdict verdict = policyEngine.checkAction(action);
            for (GuardrailCheck check : verdict.checks()) {
                trail.add(describe(check));
            }
            if (!verdict.allowed()) {
                List<String> errors = new ArrayList<>();
                for (GuardrailCheck check : verdict.blockingFailures()) {
                    errors.add("Blocked by policy binding " + check.bindingName() + ": "
                        + (check.violations().isEmpty() ? check.message() : String.join("; ", check.violations())));
                }
                trail.add("Vetoed by " + verdict.vetoedBy() + "; handler not invoked");
                vetoed.incrementAndGet();
                metrics.actionVetoed(action.actionType());
                record(OrchestrationResult.failed(action, ActionStatus.VETOED, FailureKind.POLICY_VIOLATION,
                    errors, verdict.checks(), null, trail, startedAt));
                return false;
            }

            SubsystemHandler handler = subsystems.get(action.targetSubsystem());
            if (handler == null) {
                trail.add("No handler registered for subsystem " + action.targetSubsystem());
                fail(action, FailureKind.UNKNOWN_SUBSYSTEM,
                    "Unknown subsystem: " + action.targetSubsystem(), verdict.checks(), null, trail, startedAt);
                return false;
            }

            Resource resource = null;
            ResourceAllocation allocation = null;
            if (action.needsResource()) {
                Optional<ResourceAllocation> allocated = resourceManager.allocateFor(
                    action.resource(), action.location(), action.workflowId(),
                    "kernel:" + action.actionId(), action.priority(), action.actionType().code());
                if (allocated.isEmpty()) {
                    return handleAllocationFailure(action, verdict, trail, startedAt);
                }
                allocation = allocated.get();
                resource = resourceManager.getResource(allocation.resourceId()).orElse(null);
                trail.add("Allocated resource " + allocation.resourceId() + " (allocation " + allocation.allocationId() + ")");
            }

            invoke(action, handler, verdict.checks(), resource, allocation, trail, startedAt);
            return true;
        }
    }

    private boolean handleAllocationFailure(
            OrchestrationAction action, PolicyVerdict verdict, List<String> trail, Instant startedAt) {
        if (settings.allocationRetry().hasMoreAttempts(action.attempt())) {
            Duration backoff = settings.allocationRetry().computeBackoff(action.attempt());
            OrchestrationAction next = action.withAttempt(action.attempt() + 1);
            requeued.incrementAndGet();
            log.info("No resource for action {} ({}); retrying in {} ms (attempt {})",
                action.actionId(), action.actionType(), backoff.toMillis(), next.attempt());
            // registered under the map's monitor so a short backoff cannot fire before the entry exists
            synchronized (pendingRetries) {
                ScheduledFuture<?> future = retryScheduler.schedule(() -> {
                    boolean due;
                    synchronized (pendingRetries) {
                        due = pendingRetries.remove(next.actionId()) != null;
                    }
                    if (due) {
                        enqueue(next);
                    }
                }, backoff.toMillis(), TimeUnit.MILLISECONDS);
                pendingRetries.put(next.actionId(), new PendingRetry(next, future));
            }
            return false;
        }
        trail.add("No resource available after " + action.attempt() + " attempt(s)");
        fail(action, FailureKind.RESOURCE_UNAVAILABLE,
            "Resource unavailable: " + describe(action), verdict.checks(), null, trail, startedAt);
        return false;
    }

    private void invoke(
            OrchestrationAction action,
            SubsystemHandler handler,
            List<GuardrailCheck> checks,
            Resource resource,
            ResourceAllocation allocation,
            List<String> trail,
            Instant startedAt) {
        String resourceId = allocation == null ? null : allocation.resourceId();
        HandlerContext context = new HandlerContext(action, resource, allocation, objectMapper);
        Duration timeout = action.timeout() != null ? action.timeout() : settings.defaultActionTimeout();

        inFlight.incrementAndGet();
        dispatched.incrementAndGet();
        bySubsystem.computeIfAbsent(action.targetSubsystem(), k -> new AtomicLong()).incrementAndGet();
        metrics.actionDispatched(action.actionType(), action.targetSubsystem());
        trail.add("Dispatched to " + action.targetSubsystem() + " with timeout " + timeout.toMillis() + " ms");

        CompletableFuture<JsonNode> outcome = new CompletableFuture<>();
        Future<?> task = handlerPool.submit(() -> {
            boolean abandoned = false;
            try (LoggingContext ignored = LoggingContext.forAction(action)) {
                if (resourceId != null) {
                    resourceManager.markInUse(resourceId);
                }
                // the clock starts when the handler does, not when the task was submitted
                outcome.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
                abandoned = !outcome.complete(handler.handle(context));
            } catch (Throwable t) {
                abandoned = !outcome.completeExceptionally(t);
            } finally {
                if (abandoned) {
                    releaseAbandoned(action, resourceId, context);
                }
                inFlight.decrementAndGet();
                handlerSlots.release();
            }
        });
        outcome.whenComplete((output, error) -> {
            Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
            if (cause instanceof TimeoutException) {
                task.cancel(true);
            }
            try (LoggingContext ignored = LoggingContext.forAction(action)) {
                complete(action, output, cause, timeout, checks, resourceId, context, trail, startedAt);
            } catch (RuntimeException e) {
                log.error("Failed to record result of action {}: {}", action.actionId(), e.getMessage(), e);
            }
        });
    }

    /**
     * A timed-out handler keeps its slot and its resource until its thread actually returns.
     */
    private void releaseAbandoned(OrchestrationAction action, String resourceId, HandlerContext context) {
        log.warn("Timed-out handler for action {} ({}) on {} returned; freeing its slot",
            action.actionId(), action.actionType(), action.targetSubsystem());
        if (resourceId != null && !context.isResourceRetained() && resourceManager.release(resourceId)) {
            log.info("Released resource {} held by timed-out action {}", resourceId, action.actionId());
        }
    }

    private void complete(
            OrchestrationAction action,
            JsonNode output,
            Throwable error,
            Duration timeout,
            List<GuardrailCheck> checks,
            String resourceId,
            HandlerContext context,
            List<String> trail,
            Instant startedAt) {
        if (resourceId != null) {
            if (error instanceof TimeoutException) {
                trail.add("Resource " + resourceId + " held until the timed-out handler returns");
            } else if (context.isResourceRetained()) {
                trail.add("Resource " + resourceId + " retained by handler");
            } else if (resourceManager.release(resourceId)) {
                trail.add("Released resource " + resourceId);
            }
        }

        if (error == null) {
            trail.add("Handler succeeded");
            OrchestrationResult result = OrchestrationResult.succeeded(action,
                output != null ? output : objectMapper.createObjectNode(), checks, resourceId, trail, startedAt);
            succeeded.incrementAndGet();
            metrics.recordActionDuration(action.targetSubsystem(), true, result.duration());
            log.info("Action {} ({}) succeeded on {} in {} ms",
                action.actionId(), action.actionType(), action.targetSubsystem(), result.duration().toMillis());
            record(result);
            return;
        }

        FailureKind kind;
        String message;
        if (error instanceof TimeoutException) {
            kind = FailureKind.HANDLER_TIMEOUT;
            message = "Handler timed out after " + timeout.toMillis() + " ms";
            log.warn("Action {} ({}) timed out on {}", action.actionId(), action.actionType(), action.targetSubsystem());
        } else if (error instanceof HandlerException he) {
            kind = FailureKind.HANDLER_FAILURE;
            message = "Handler failed [" + he.getErrorCode() + "]: " + he.getMessage();
            if (he.isPermanent()) {
                trail.add("Failure reported as permanent by " + action.targetSubsystem());
            }
            log.warn("Action {} ({}) failed on {}: {}", action.actionId(), action.actionType(),
                action.targetSubsystem(), message);
        } else {
            kind = FailureKind.HANDLER_FAILURE;
            message = "Handler error: " + error.getClass().getSimpleName() + ": " + error.getMessage();
            log.error("Action {} ({}) raised an unexpected error on {}", action.actionId(), action.actionType(),
                action.targetSubsystem(), error);
        }
        trail.add(message);
        OrchestrationResult result = OrchestrationResult.failed(action, ActionStatus.FAILED, kind,
            List.of(message), checks, resourceId, trail, startedAt);
        failed.incrementAndGet();
        metrics.actionFailed(action.actionType(), kind);
        metrics.recordActionDuration(action.targetSubsystem(), false, result.duration());
        record(result);
    }

    private void fail(
            OrchestrationAction action,
            FailureKind kind,
            String message,
            List<GuardrailCheck> checks,
            String resourceId,
            List<String> trail,
            Instant startedAt) {
        log.warn("Action {} ({}) failed: {}", action.actionId(), action.actionType(), message);
        failed.incrementAndGet();
        metrics.actionFailed(action.actionType(), kind);
        record(OrchestrationResult.failed(action, ActionStatus.FAILED, kind, List.of(message),
            checks, resourceId, trail, startedAt));
    }

    private void record(OrchestrationResult result) {
        auditTrail.append(result);
        for (ActionResultListener listener : listeners) {
            try {
                listener.onActionResult(result);
            } catch (RuntimeException e) {
                log.error("Result listener failed for action {}: {}", result.actionId(), e.getMessage(), e);
            }
        }
    }

    private static String describe(GuardrailCheck check) {
        StringBuilder line = new StringBuilder("Guardrail ")
            .append(check.bindingName())
            .append(check.passed() ? ": PASSED" : ": FAILED")
            .append(" (").append(check.severity()).append(", score ")
            .append(String.format("%.0f", check.score())).append(")");
        if (!check.violations().isEmpty()) {
            line.append(" violations=").append(check.violations());
        }
        if (!check.recommendations().isEmpty()) {
            line.append(" recommendations=").append(check.recommendations());
        }
        return line.toString();
    }

    private static String describe(OrchestrationAction action) {
        return action.resource().isSpecific()
            ? action.resource().resourceId()
            : action.resource().type().code();
    }

    // ========== Reporting ==========

    /**
     * Most recent results first.
     *
     * @param executionId Filter by execution, or null
     * @param actionType Filter by action type, or null
     */
    public List<OrchestrationResult> getAuditTrail(String executionId, ActionType actionType, int limit) {
        return auditTrail.findRecent(executionId, actionType, limit);
    }

    public int getInFlightCount() {
        return inFlight.get();
    }

    public int getQueueDepth() {
        return queue.size();
    }

    public KernelStatistics getStatistics() {
        Map<String, Long> subsystemCounts = new TreeMap<>();
        bySubsystem.forEach((name, count) -> subsystemCounts.put(name, count.get()));
        int confirmations;
        synchronized (awaitingConfirmation) {
            confirmations = awaitingConfirmation.size();
        }
        return new KernelStatistics(
            status.get(),
            queue.size(),
            confirmations,
            pendingRetries.size(),
            inFlight.get(),
            queued.get(),
            dispatched.get(),
            succeeded.get(),
            failed.get(),
            vetoed.get(),
            shed.get(),
            requeued.get(),
            cancelled.get(),
            subsystemCounts,
            listSubsystems()
        );
    }
}
