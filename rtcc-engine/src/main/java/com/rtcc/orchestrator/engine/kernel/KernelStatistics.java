package com.rtcc.orchestrator.engine.kernel;

import com.rtcc.orchestrator.core.model.KernelStatus;

import java.util.Map;
import java.util.Set;

/**
 * Point-in-time kernel counters.
 */
public record KernelStatistics(
    KernelStatus status,
    int queueDepth,
    int awaitingConfirmation,
    int pendingRetries,
    int inFlight,
    long actionsQueued,
    long actionsDispatched,
    long actionsSucceeded,
    long actionsFailed,
    long actionsVetoed,
    long actionsShed,
    long actionsRequeued,
    long actionsCancelled,
    Map<String, Long> dispatchedBySubsystem,
    Set<String> subsystems
) {}
