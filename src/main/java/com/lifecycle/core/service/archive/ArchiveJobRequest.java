package com.lifecycle.core.service.archive;

import com.lifecycle.core.service.policy.LifecycleAction;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Parameters for a new archive job.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ArchiveJobRequest {

    private String name;
    private String description;

    /**
     * Directory to archive; relative paths resolve against the storage base dir.
     */
    private String sourcePath;

    private String policyId;

    /**
     * Explicit files relative to the source; empty means every file older than the threshold.
     */
    @Builder.Default
    private List<String> files = new ArrayList<>();

    /**
     * Age threshold in days (null = configured default, 0 = everything).
     */
    private Integer retentionDays;

    /**
     * ARCHIVE (default), DELETE or COMPRESS.
     */
    @Builder.Default
    private LifecycleAction action = LifecycleAction.ARCHIVE;

    /**
     * Remove sources after a verified bundle (null = configured default).
     */
    private Boolean deleteSource;

    /**
     * Bundle destination (null = configured archive path).
     */
    private String targetPath;

    /**
     * Requested bundle format (null = configured format).
     */
    private String compressionFormat;

    private boolean dryRun;

    @Builder.Default
    private Map<String, Object> metadata = new HashMap<>();
}
