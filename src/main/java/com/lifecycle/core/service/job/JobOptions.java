package com.lifecycle.core.service.job;

import com.lifecycle.core.service.policy.LifecycleAction;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Execution parameters captured when a job is created.
 *
 * Stored with the job so that a re-read job record fully describes what was run.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class JobOptions {

    /**
     * Action applied to selected items (null = manager default).
     */
    private LifecycleAction action;

    /**
     * Age threshold in days (null = manager or policy default, 0 = everything).
     */
    private Integer retentionDays;

    /**
     * Evaluate and report without touching the filesystem.
     */
    private boolean dryRun;

    /**
     * Remove source files after a verified archive.
     */
    private boolean deleteSource;

    /**
     * Explicit relative file list; empty means "scan the source".
     */
    @Builder.Default
    private List<String> files = new ArrayList<>();

    /**
     * Data types to scan, overriding the policy's own list.
     */
    @Builder.Default
    private List<String> dataTypes = new ArrayList<>();

    /**
     * Multiplier applied to age and count thresholds (emergency passes use 0.5).
     */
    @Builder.Default
    private double thresholdFactor = 1.0;

    /**
     * Destination directory for archive bundles or moved files.
     */
    private String targetPath;

    public JobOptions copy() {
        return toBuilder()
                .files(new ArrayList<>(files))
                .dataTypes(new ArrayList<>(dataTypes))
                .build();
    }
}
