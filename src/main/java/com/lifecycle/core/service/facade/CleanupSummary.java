package com.lifecycle.core.service.facade;

import com.lifecycle.core.service.job.JobStatus;

import java.util.List;

/**
 * Outcome of a facade cleanup call.
 */
public record CleanupSummary(
        String jobId,
        JobStatus status,
        int processed,
        long freed,
        List<String> errors
) {
}
