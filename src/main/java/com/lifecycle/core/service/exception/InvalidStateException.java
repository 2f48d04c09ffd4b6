package com.lifecycle.core.service.exception;

/**
 * Thrown when an operation is requested against a job or policy in the wrong lifecycle state.
 */
public class InvalidStateException extends LifecycleException {

    public InvalidStateException(String message, String entityId) {
        super(message, entityId, "INVALID_STATE");
    }

    protected InvalidStateException(String message, String entityId, String errorCode) {
        super(message, entityId, errorCode);
    }
}
