package com.rtcc.orchestrator.engine.persistence;

import com.rtcc.orchestrator.core.model.Workflow;
import com.rtcc.orchestrator.core.repository.WorkflowRepository;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory implementation of WorkflowRepository.
 * Keeps registration order; replacing a definition keeps its original position.
 */
public class InMemoryWorkflowRepository implements WorkflowRepository {

    private final Map<String, Workflow> workflows = new LinkedHashMap<>();

    @Override
    public synchronized Optional<Workflow> save(Workflow workflow) {
        return Optional.ofNullable(workflows.put(workflow.id(), workflow));
    }

    @Override
    public synchronized Optional<Workflow> findById(String workflowId) {
        return Optional.ofNullable(workflows.get(workflowId));
    }

    @Override
    public synchronized List<Workflow> findAll() {
        return List.copyOf(new ArrayList<>(workflows.values()));
    }

    @Override
    public synchronized boolean delete(String workflowId) {
        return workflows.remove(workflowId) != null;
    }
}
