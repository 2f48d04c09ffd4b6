package com.lifecycle.core.service.exception;

/**
 * Thrown when a compression format other than gzip is requested.
 */
public class UnsupportedFormatException extends LifecycleException {

    public UnsupportedFormatException(String format) {
        super("Unsupported compression format: " + format + " (only gzip is supported)",
                format, "UNSUPPORTED_FORMAT");
    }
}
