package com.rtcc.orchestrator.core.exception;

import com.rtcc.orchestrator.core.model.KernelStatus;

/**
 * Thrown when a lifecycle operation is not valid in the kernel's current status.
 */
public class KernelStateException extends OrchestratorException {

    public static final String ERROR_CODE = "KERNEL_STATE_CONFLICT";

    public KernelStateException(String operation, KernelStatus current) {
        super(ERROR_CODE, String.format("Cannot %s kernel while %s", operation, current));
    }
}
