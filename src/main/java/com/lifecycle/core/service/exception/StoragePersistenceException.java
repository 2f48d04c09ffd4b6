package com.lifecycle.core.service.exception;

/**
 * Thrown when the job or policy store cannot be read or written.
 */
public class StoragePersistenceException extends LifecycleException {

    public StoragePersistenceException(String message, Throwable cause) {
        super(message, null, "PERSISTENCE_ERROR", cause);
    }
}
