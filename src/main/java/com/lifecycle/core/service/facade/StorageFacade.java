package com.lifecycle.core.service.facade;

import com.lifecycle.core.service.archive.ArchiveJobRequest;
import com.lifecycle.core.service.archive.ArchiveManager;
import com.lifecycle.core.service.archive.ArchiveStatistics;
import com.lifecycle.core.service.cleanup.CleanupJobRequest;
import com.lifecycle.core.service.cleanup.CleanupManager;
import com.lifecycle.core.service.cleanup.CleanupResult;
import com.lifecycle.core.service.cleanup.CleanupStatistics;
import com.lifecycle.core.service.config.ArchiveConfig;
import com.lifecycle.core.service.job.Job;
import com.lifecycle.core.service.job.JobStatus;
import com.lifecycle.core.service.scan.StorageLayout;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Single entry point for archive and cleanup operations, statistics and health.
 */
@Slf4j
@RequiredArgsConstructor
public class StorageFacade {

    private final ArchiveManager archiveManager;
    private final CleanupManager cleanupManager;
    private final StorageLayout layout;
    private final ArchiveConfig archiveConfig;
    private final Executor executor;

    /**
     * Creates and runs an archive job on the calling thread.
     */
    public ArchiveSubmission archive(ArchiveCriteria criteria, ArchiveOptions options) {
        String jobId = archiveManager.createJob(toRequest(criteria, options));
        Job job = archiveManager.executeJob(jobId);
        return new ArchiveSubmission(jobId, job);
    }

    /**
     * Creates the job immediately, so invalid requests fail on the calling thread, and runs
     * it on the lifecycle executor.
     */
    public CompletableFuture<ArchiveSubmission> archiveAsync(ArchiveCriteria criteria, ArchiveOptions options) {
        String jobId = archiveManager.createJob(toRequest(criteria, options));
        log.info("Archive job {} submitted for async execution", jobId);
        return CompletableFuture.supplyAsync(() -> new ArchiveSubmission(jobId, archiveManager.executeJob(jobId)),
                executor);
    }

    public CleanupSummary cleanup(CleanupCriteria criteria) {
        return cleanup(criteria, CleanupOptions.defaults());
    }

    /**
     * Creates and runs a cleanup job on the calling thread.
     */
    public CleanupSummary cleanup(CleanupCriteria criteria, CleanupOptions options) {
        var request = CleanupJobRequest.builder()
                .name(options.getName())
                .policyId(criteria.getPolicyId())
                .sourcePath(criteria.getSourcePath())
                .dataTypes(criteria.getDataTypes())
                .retentionDays(criteria.getOlderThanDays())
                .action(options.getAction())
                .dryRun(options.getDryRun())
                .build();
        String jobId = cleanupManager.createJob(request);
        CleanupResult result = cleanupManager.executeJob(jobId);
        return new CleanupSummary(jobId, result.status(), result.itemsProcessed(), result.sizeFreed(),
                result.errors());
    }

    public StorageStatistics getStatistics() {
        ArchiveStatistics archive = archiveManager.getStatistics();
        CleanupStatistics cleanup = cleanupManager.getStatistics();
        long archiveFreed = archiveManager.listJobs().stream()
                .filter(job -> job.getStatus() == JobStatus.COMPLETED)
                .mapToLong(Job::getSizeFreed)
                .sum();

        return StorageStatistics.builder()
                .archive(archive)
                .cleanup(cleanup)
                .usage(cleanupManager.getStorageUsage())
                .totalJobs(archive.getTotalJobs() + cleanup.getTotalJobs())
                .totalSizeFreed(archiveFreed + cleanup.getTotalSizeFreed())
                .build();
    }

    /**
     * Checks storage reachability and that the archive and cleanup roots accept writes.
     * Missing roots are created.
     */
    public HealthReport healthCheck() {
        Path base = layout.baseDir();
        boolean storageReachable = ensureDirectory(base) && Files.isReadable(base);
        boolean archiveWritable = isWritable(Paths.get(archiveConfig.getArchivePath()));
        boolean cleanupWritable = storageReachable && isWritable(base);

        HealthReport report = HealthReport.of(storageReachable, archiveWritable, cleanupWritable);
        if (!report.overall()) {
            log.warn("Storage health degraded: {}", report);
        }
        return report;
    }

    private ArchiveJobRequest toRequest(ArchiveCriteria criteria, ArchiveOptions options) {
        var request = ArchiveJobRequest.builder()
                .name(options.getName())
                .description(options.getDescription())
                .sourcePath(criteria.getSourcePath())
                .policyId(criteria.getPolicyId())
                .files(criteria.getFiles())
                .retentionDays(criteria.getOlderThanDays())
                .deleteSource(options.getDeleteSource())
                .targetPath(options.getTargetPath())
                .compressionFormat(options.getCompressionFormat())
                .dryRun(options.isDryRun());
        if (options.getAction() != null) {
            request.action(options.getAction());
        }
        return request.build();
    }

    private boolean isWritable(Path dir) {
        return ensureDirectory(dir) && Files.isWritable(dir);
    }

    private boolean ensureDirectory(Path dir) {
        try {
            Files.createDirectories(dir);
            return Files.isDirectory(dir);
        } catch (IOException e) {
            log.warn("Directory {} unavailable: {}", dir, e.getMessage());
            return false;
        }
    }
}
