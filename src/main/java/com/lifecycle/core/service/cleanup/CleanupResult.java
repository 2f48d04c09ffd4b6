package com.lifecycle.core.service.cleanup;

import com.lifecycle.core.service.job.Job;
import com.lifecycle.core.service.job.JobStatus;

import java.time.Duration;
import java.util.List;

/**
 * Outcome of one cleanup job run.
 */
public record CleanupResult(
        String jobId,
        String policyId,
        JobStatus status,
        int itemsTotal,
        int itemsProcessed,
        long sizeFreed,
        List<String> errors,
        boolean dryRun,
        Duration duration
) {

    public static CleanupResult from(Job job) {
        return new CleanupResult(
                job.getId(),
                job.getPolicyId(),
                job.getStatus(),
                job.getItemsTotal(),
                job.getItemsProcessed(),
                job.getSizeFreed(),
                List.copyOf(job.getErrors()),
                job.getOptions().isDryRun(),
                job.getDuration().orElse(Duration.ZERO));
    }

    public boolean success() {
        return status == JobStatus.COMPLETED;
    }
}
