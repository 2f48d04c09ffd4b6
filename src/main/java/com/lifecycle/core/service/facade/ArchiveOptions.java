package com.lifecycle.core.service.facade;

import com.lifecycle.core.service.policy.LifecycleAction;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * How to archive. Unset fields fall back to configuration.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ArchiveOptions {

    private String name;
    private String description;
    private LifecycleAction action;
    private Boolean deleteSource;
    private String targetPath;
    private String compressionFormat;
    private boolean dryRun;

    public static ArchiveOptions defaults() {
        return new ArchiveOptions();
    }
}
