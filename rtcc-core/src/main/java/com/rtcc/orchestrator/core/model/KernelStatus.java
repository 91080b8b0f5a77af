package com.rtcc.orchestrator.core.model;

/**
 * Lifecycle of the orchestration kernel's dispatch loop.
 */
public enum KernelStatus {
    STOPPED,
    RUNNING,
    PAUSED,
    STOPPING;

    public boolean acceptsDispatch() {
        return this == RUNNING;
    }
}
