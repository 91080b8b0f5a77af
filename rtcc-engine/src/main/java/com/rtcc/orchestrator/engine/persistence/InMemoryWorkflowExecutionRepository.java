package com.rtcc.orchestrator.engine.persistence;

import com.rtcc.orchestrator.core.model.ExecutionStatus;
import com.rtcc.orchestrator.core.model.WorkflowExecution;
import com.rtcc.orchestrator.core.repository.ExecutionEventRepository;
import com.rtcc.orchestrator.core.repository.WorkflowExecutionRepository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * In-memory implementation of WorkflowExecutionRepository.
 * Terminal executions beyond the retention limit are evicted oldest first, and the
 * eviction listener is told each evicted id so dependent stores can drop it too.
 */
public class InMemoryWorkflowExecutionRepository implements WorkflowExecutionRepository {

    private final Map<String, WorkflowExecution> executions = new ConcurrentHashMap<>();
    private final int retentionLimit;
    private final Consumer<String> evictionListener;

    public InMemoryWorkflowExecutionRepository() {
        this(10_000);
    }

    public InMemoryWorkflowExecutionRepository(int retentionLimit) {
        this(retentionLimit, executionId -> { });
    }

    public InMemoryWorkflowExecutionRepository(int retentionLimit, Consumer<String> evictionListener) {
        this.retentionLimit = retentionLimit;
        this.evictionListener = evictionListener;
    }

    /**
     * Execution store whose evictions also drop the execution's event log.
     */
    public static InMemoryWorkflowExecutionRepository withEventLog(
            int retentionLimit, ExecutionEventRepository eventRepository) {
        return new InMemoryWorkflowExecutionRepository(retentionLimit, eventRepository::deleteByExecutionId);
    }

    @Override
    public void save(WorkflowExecution execution) {
        executions.put(execution.executionId(), execution);
        if (execution.isTerminal() && executions.size() > retentionLimit) {
            evictOldestTerminal(execution.executionId());
        }
    }

    @Override
    public Optional<WorkflowExecution> findById(String executionId) {
        return Optional.ofNullable(executions.get(executionId));
    }

    @Override
    public List<WorkflowExecution> findActive() {
        return executions.values().stream()
            .filter(e -> !e.isTerminal())
            .sorted(Comparator.comparing(WorkflowExecution::createdAt))
            .collect(Collectors.toList());
    }

    @Override
    public List<WorkflowExecution> findRecent(ExecutionStatus status, int limit) {
        return executions.values().stream()
            .filter(e -> status == null || e.status() == status)
            .sorted(Comparator.comparing(WorkflowExecution::createdAt).reversed())
            .limit(limit)
            .collect(Collectors.toList());
    }

    @Override
    public long count() {
        return executions.size();
    }

    // the execution just saved stays, so its closing events land in a live log
    private void evictOldestTerminal(String justSaved) {
        executions.values().stream()
            .filter(e -> e.isTerminal() && !e.executionId().equals(justSaved))
            .min(Comparator.comparing(WorkflowExecution::createdAt))
            .ifPresent(oldest -> {
                if (executions.remove(oldest.executionId()) != null) {
                    evictionListener.accept(oldest.executionId());
                }
            });
    }
}
