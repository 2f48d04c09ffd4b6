package com.lifecycle.core.service.facade;

import com.lifecycle.core.service.job.Job;

/**
 * An archive job and its state when the call returned.
 */
public record ArchiveSubmission(String jobId, Job job) {
}
