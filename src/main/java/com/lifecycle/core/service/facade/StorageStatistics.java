package com.lifecycle.core.service.facade;

import com.lifecycle.core.service.archive.ArchiveStatistics;
import com.lifecycle.core.service.cleanup.CleanupStatistics;
import com.lifecycle.core.service.cleanup.StorageUsage;
import lombok.Builder;
import lombok.Value;

/**
 * Combined archive, cleanup and usage figures.
 */
@Value
@Builder
public class StorageStatistics {

    ArchiveStatistics archive;
    CleanupStatistics cleanup;
    StorageUsage usage;

    long totalJobs;

    /**
     * Bytes released by archive and cleanup jobs together.
     */
    long totalSizeFreed;
}
