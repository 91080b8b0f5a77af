package com.rtcc.orchestrator.engine.subsystem;

/**
 * Thrown by subsystem handlers when an action could not be carried out.
 */
public class HandlerException extends Exception {

    private final String errorCode;
    private final boolean permanent;

    public HandlerException(String errorCode, String message) {
        this(errorCode, message, null, false);
    }

    public HandlerException(String errorCode, String message, Throwable cause) {
        this(errorCode, message, cause, false);
    }

    public HandlerException(String errorCode, String message, Throwable cause, boolean permanent) {
        super(message, cause);
        this.errorCode = errorCode;
        this.permanent = permanent;
    }

    public String getErrorCode() {
        return errorCode;
    }

    /**
     * A permanent failure means repeating the action cannot succeed.
     */
    public boolean isPermanent() {
        return permanent;
    }

    public static HandlerException permanent(String errorCode, String message) {
        return new HandlerException(errorCode, message, null, true);
    }

    public static HandlerException transientFailure(String errorCode, String message) {
        return new HandlerException(errorCode, message, null, false);
    }
}
