package com.lifecycle.core.service.job;

import com.lifecycle.core.service.exception.InvalidStateException;
import com.lifecycle.core.service.exception.InvalidTransitionException;
import com.lifecycle.core.service.exception.NotFoundException;
import com.lifecycle.core.service.persistence.RecordStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Owns the lifecycle of job records and enforces the job state machine.
 *
 * Writes to one job are serialized on a per-id lock; reads return copies so callers
 * can never mutate persisted state directly.
 */
@Slf4j
public class JobTracker {

    private final String idPrefix;
    private final RecordStore<Job> store;
    private final Clock clock;
    private final Map<String, Object> locks = new ConcurrentHashMap<>();

    public JobTracker(String idPrefix, RecordStore<Job> store, Clock clock) {
        this.idPrefix = idPrefix;
        this.store = store;
        this.clock = clock;
    }

    // ==================== CRUD ====================

    /**
     * Persists a new job in PENDING state.
     *
     * @param job the job to record; id, status, progress and createdAt are assigned here
     * @return the generated job id
     */
    public String create(Job job) {
        if (job.getStatus() != null && job.getStatus() != JobStatus.PENDING) {
            throw new InvalidStateException("Jobs must be created in PENDING state", job.getId());
        }
        var record = job.copy();
        record.setId(JobIds.next(idPrefix, clock));
        record.setStatus(JobStatus.PENDING);
        record.setProgress(0);
        record.setCreatedAt(clock.instant());
        record.setStartedAt(null);
        record.setCompletedAt(null);

        store.insert(record);
        log.info("Job created: {} ({})", record.getId(), record.getName());
        return record.getId();
    }

    public Optional<Job> get(String jobId) {
        return store.findById(jobId).map(Job::copy);
    }

    /**
     * Lists all jobs, newest first.
     */
    public List<Job> list() {
        return store.findAll().stream()
                .map(Job::copy)
                .sorted(Comparator.comparing(Job::getCreatedAt,
                        Comparator.nullsLast(Comparator.reverseOrder())))
                .toList();
    }

    public List<Job> listByStatus(JobStatus status) {
        return list().stream()
                .filter(job -> job.getStatus() == status)
                .toList();
    }

    public boolean delete(String jobId) {
        synchronized (lockFor(jobId)) {
            boolean deleted = store.delete(jobId);
            if (deleted) {
                log.info("Job deleted: {}", jobId);
            }
            locks.remove(jobId);
            return deleted;
        }
    }

    // ==================== State Machine ====================

    /**
     * Moves a job to a new status, applying extra field changes in the same write.
     *
     * @param jobId the job to update
     * @param target the requested status
     * @param fields extra changes (metrics, error text); may be null
     * @return a copy of the updated job
     * @throws InvalidTransitionException if the edge is not allowed
     */
    public Job updateStatus(String jobId, JobStatus target, Consumer<Job> fields) {
        synchronized (lockFor(jobId)) {
            var job = require(jobId);
            var from = job.getStatus();
            if (!from.canTransitionTo(target)) {
                throw new InvalidTransitionException(jobId, from, target);
            }

            if (fields != null) {
                fields.accept(job);
            }
            job.setId(jobId);
            job.setStatus(target);
            stampTimestamps(job, target);
            job.setProgress(clampProgress(job.getProgress()));

            store.upsert(job);
            log.info("Job {} {} -> {}", jobId, from, target);
            return job.copy();
        }
    }

    /**
     * Applies progress changes to a RUNNING job.
     *
     * @return false if the job is no longer running (for example it was cancelled)
     */
    public boolean updateProgress(String jobId, Consumer<Job> fields) {
        synchronized (lockFor(jobId)) {
            var job = require(jobId);
            if (job.getStatus() != JobStatus.RUNNING) {
                return false;
            }
            fields.accept(job);
            job.setId(jobId);
            job.setStatus(JobStatus.RUNNING);
            job.setProgress(clampProgress(job.getProgress()));
            store.upsert(job);
            return true;
        }
    }

    /**
     * Marks RUNNING jobs whose start lies further back than the grace period as FAILED.
     * Used on startup to recover from jobs interrupted by a crash.
     *
     * @return number of reconciled jobs
     */
    public int reconcileStuckJobs(Duration grace) {
        Instant cutoff = clock.instant().minus(grace);
        int reconciled = 0;

        for (Job job : listByStatus(JobStatus.RUNNING)) {
            Instant started = job.getStartedAt() != null ? job.getStartedAt() : job.getCreatedAt();
            if (started != null && started.isBefore(cutoff)) {
                updateStatus(job.getId(), JobStatus.FAILED,
                        j -> j.setError("Job was still running at startup; marked failed after "
                                + grace.toMinutes() + " minute grace period"));
                reconciled++;
            }
        }

        if (reconciled > 0) {
            log.warn("Reconciled {} stuck running jobs", reconciled);
        }
        return reconciled;
    }

    public int count() {
        return store.count();
    }

    // ==================== Helpers ====================

    private Job require(String jobId) {
        return store.findById(jobId)
                .map(Job::copy)
                .orElseThrow(() -> new NotFoundException("Job", jobId));
    }

    private void stampTimestamps(Job job, JobStatus target) {
        Instant now = clock.instant();
        if (target == JobStatus.RUNNING) {
            job.setStartedAt(now);
            job.setCompletedAt(null);
        } else if (target.isTerminal()) {
            if (job.getStartedAt() == null) {
                job.setStartedAt(now);
            }
            job.setCompletedAt(now);
            if (target == JobStatus.COMPLETED) {
                job.setProgress(100);
            }
        }
    }

    private int clampProgress(int progress) {
        return Math.max(0, Math.min(100, progress));
    }

    private Object lockFor(String jobId) {
        return locks.computeIfAbsent(jobId, id -> new Object());
    }
}
