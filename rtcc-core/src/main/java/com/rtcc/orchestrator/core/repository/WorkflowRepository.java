package com.rtcc.orchestrator.core.repository;

import com.rtcc.orchestrator.core.model.Workflow;

import java.util.List;
import java.util.Optional;

/**
 * Registry of workflow definitions, keyed by workflow id.
 */
public interface WorkflowRepository {

    /**
     * Save a definition. An existing definition with the same id is replaced.
     *
     * @return the definition that was replaced, if any
     */
    Optional<Workflow> save(Workflow workflow);

    Optional<Workflow> findById(String workflowId);

    /**
     * All definitions in registration order.
     */
    List<Workflow> findAll();

    boolean delete(String workflowId);
}
