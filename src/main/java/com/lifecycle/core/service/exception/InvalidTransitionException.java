package com.lifecycle.core.service.exception;

import com.lifecycle.core.service.job.JobStatus;

/**
 * Thrown by the job tracker when a status change is not an allowed edge of the job state machine.
 */
public class InvalidTransitionException extends InvalidStateException {

    private final JobStatus from;
    private final JobStatus to;

    public InvalidTransitionException(String jobId, JobStatus from, JobStatus to) {
        super("Invalid job transition " + from + " -> " + to, jobId, "INVALID_TRANSITION");
        this.from = from;
        this.to = to;
    }

    public JobStatus getFrom() {
        return from;
    }

    public JobStatus getTo() {
        return to;
    }
}
