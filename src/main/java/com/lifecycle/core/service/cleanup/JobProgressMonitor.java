package com.lifecycle.core.service.cleanup;

import com.lifecycle.core.service.job.JobTracker;
import com.lifecycle.core.service.scan.StorageItem;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Feeds batch progress into the job record and exposes the job's cancellation flag.
 *
 * Progress is written every {@code batchSize} items and on the last item. A failed write
 * means the job is no longer RUNNING, which is treated as cancellation.
 */
public class JobProgressMonitor implements ExecutionMonitor {

    private final JobTracker jobs;
    private final String jobId;
    private final AtomicBoolean cancelled;
    private final int total;
    private final int batchSize;
    private final AtomicInteger done = new AtomicInteger();
    private final AtomicInteger failed = new AtomicInteger();

    public JobProgressMonitor(JobTracker jobs, String jobId, AtomicBoolean cancelled, int total, int batchSize) {
        this.jobs = jobs;
        this.jobId = jobId;
        this.cancelled = cancelled;
        this.total = total;
        this.batchSize = Math.max(1, batchSize);
    }

    @Override
    public boolean isCancelled() {
        return cancelled.get();
    }

    @Override
    public void itemCompleted(StorageItem item, boolean success) {
        int count = done.incrementAndGet();
        if (!success) {
            failed.incrementAndGet();
        }
        if (count % batchSize == 0 || count == total) {
            int processed = count - failed.get();
            boolean running = jobs.updateProgress(jobId, job -> {
                job.setItemsProcessed(processed);
                job.setProgress(total == 0 ? 0 : (int) ((long) count * 100 / total));
            });
            if (!running) {
                cancelled.set(true);
            }
        }
    }

    public int getDone() {
        return done.get();
    }
}
