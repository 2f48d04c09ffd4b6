package com.lifecycle.core.service.exception;

/**
 * Thrown when a job or policy id does not resolve to a stored record.
 */
public class NotFoundException extends LifecycleException {

    public NotFoundException(String kind, String id) {
        super(kind + " not found: " + id, id, "NOT_FOUND");
    }
}
