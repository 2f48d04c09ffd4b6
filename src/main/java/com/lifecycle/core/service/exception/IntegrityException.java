package com.lifecycle.core.service.exception;

/**
 * Thrown when an archive bundle fails verification. Source files must not be removed after this.
 */
public class IntegrityException extends LifecycleException {

    public IntegrityException(String archivePath, String message) {
        super(message, archivePath, "INTEGRITY_ERROR");
    }

    public IntegrityException(String archivePath, String message, Throwable cause) {
        super(message, archivePath, "INTEGRITY_ERROR", cause);
    }
}
