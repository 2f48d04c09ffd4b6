package com.lifecycle.core.service.job;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Auditable record of one archive or cleanup run.
 *
 * Only {@link JobTracker} mutates persisted jobs; everything else works on copies.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Job {

    private String id;
    private JobType type;
    private String name;
    private String description;

    /**
     * Source directory for archive jobs, optional override for cleanup jobs.
     */
    private String sourcePath;

    /**
     * Policy this job applies, if any.
     */
    private String policyId;

    @Builder.Default
    private JobStatus status = JobStatus.PENDING;

    private int progress;

    private Instant createdAt;
    private Instant startedAt;
    private Instant completedAt;

    private long originalSize;
    private long compressedSize;
    private double compressionRatio;
    private long sizeFreed;

    private int itemsTotal;
    private int itemsProcessed;

    /**
     * Per-item failures; a completed job may carry errors (partial success).
     */
    @Builder.Default
    private List<String> errors = new ArrayList<>();

    /**
     * Orchestration failure that moved the job to FAILED.
     */
    private String error;

    @Builder.Default
    private JobOptions options = new JobOptions();

    @Builder.Default
    private Map<String, Object> metadata = new HashMap<>();

    /**
     * Elapsed time between start and completion, derived from the timestamps.
     */
    @JsonIgnore
    public Optional<Duration> getDuration() {
        if (startedAt == null || completedAt == null) {
            return Optional.empty();
        }
        return Optional.of(Duration.between(startedAt, completedAt));
    }

    @JsonIgnore
    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }

    public Job copy() {
        return toBuilder()
                .errors(new ArrayList<>(errors))
                .options(options != null ? options.copy() : new JobOptions())
                .metadata(new HashMap<>(metadata))
                .build();
    }
}
