package com.lifecycle.core.service.policy;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Age-threshold rule of an archive policy.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ArchiveRule {

    private String id;
    private String name;

    /**
     * Human readable condition, e.g. "age > 30 days".
     */
    private String condition;

    /**
     * One of ARCHIVE, DELETE or COMPRESS.
     */
    private LifecycleAction action;

    private int priority;

    @Builder.Default
    private boolean enabled = true;

    private int retentionDays;

    /**
     * Directory to scan (null = storage base dir).
     */
    private String sourcePath;

    /**
     * Bundle destination for ARCHIVE (null = configured archive path).
     */
    private String archivePath;
}
