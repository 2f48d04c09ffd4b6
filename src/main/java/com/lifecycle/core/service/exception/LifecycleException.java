package com.lifecycle.core.service.exception;

/**
 * Base exception for data lifecycle operations.
 *
 * Carries a stable error code so callers (CLIs, REST wrappers) can map failures
 * without parsing messages.
 */
public class LifecycleException extends RuntimeException {

    private final String entityId;
    private final String errorCode;

    public LifecycleException(String message) {
        this(message, null, "LIFECYCLE_ERROR");
    }

    public LifecycleException(String message, Throwable cause) {
        this(message, null, "LIFECYCLE_ERROR", cause);
    }

    public LifecycleException(String message, String entityId, String errorCode) {
        super(message);
        this.entityId = entityId;
        this.errorCode = errorCode;
    }

    public LifecycleException(String message, String entityId, String errorCode, Throwable cause) {
        super(message, cause);
        this.entityId = entityId;
        this.errorCode = errorCode;
    }

    public String getEntityId() {
        return entityId;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
