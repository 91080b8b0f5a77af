package com.rtcc.orchestrator.core.model;

/**
 * What a workflow execution does when a required step fails.
 */
public enum FailureStrategy {
    /**
     * Stop immediately, withdraw pending actions and mark the execution FAILED.
     */
    ABORT,

    /**
     * Record the failure and keep advancing through the remaining steps.
     */
    CONTINUE,

    /**
     * Stop, dispatch the workflow's compensation steps, then mark the execution FAILED.
     */
    COMPENSATE
}
