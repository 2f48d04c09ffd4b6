package com.lifecycle.core.service.job;

/**
 * Lifecycle states of archive and cleanup jobs.
 *
 * Allowed edges: PENDING -> RUNNING, RUNNING -> {COMPLETED, FAILED, CANCELLED}.
 * Terminal states never change again.
 */
public enum JobStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    public boolean canTransitionTo(JobStatus target) {
        return switch (this) {
            case PENDING -> target == RUNNING;
            case RUNNING -> target.isTerminal();
            default -> false;
        };
    }
}
