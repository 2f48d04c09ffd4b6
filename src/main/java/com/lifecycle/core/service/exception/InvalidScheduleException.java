package com.lifecycle.core.service.exception;

/**
 * Thrown when a cron expression cannot be parsed. The affected policy stays unscheduled.
 */
public class InvalidScheduleException extends LifecycleException {

    public InvalidScheduleException(String policyId, String expression, Throwable cause) {
        super("Invalid cron expression '" + expression + "'", policyId, "INVALID_SCHEDULE", cause);
    }
}
