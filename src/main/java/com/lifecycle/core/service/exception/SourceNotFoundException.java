package com.lifecycle.core.service.exception;

/**
 * Thrown when a job references a source path that does not exist.
 */
public class SourceNotFoundException extends LifecycleException {

    public SourceNotFoundException(String sourcePath) {
        super("Source path does not exist: " + sourcePath, sourcePath, "SOURCE_NOT_FOUND");
    }
}
