package com.lifecycle.core.service.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for archival.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "lifecycle.archive")
public class ArchiveConfig {

    /**
     * Directory receiving archive bundles.
     */
    @NotBlank
    private String archivePath = "./archives";

    /**
     * Scratch directory for restores.
     */
    @NotBlank
    private String tempPath = "./temp/archives";

    /**
     * Gzip compression level (1 = fastest, 9 = smallest).
     */
    @Min(1)
    @Max(9)
    private int compressionLevel = 9;

    /**
     * Bundle compression format: gzip, bzip2 or xz. Only gzip is implemented.
     */
    @NotBlank
    private String compressionFormat = "gzip";

    /**
     * Files per progress update.
     */
    @Min(1)
    private int batchSize = 1000;

    /**
     * Upper bound on the input size of a single bundle in bytes.
     */
    @Min(1)
    private long maxArchiveSize = 1024L * 1024 * 1024;

    /**
     * Register cron triggers for enabled archive policies.
     */
    private boolean scheduleEnabled = true;

    /**
     * Default age threshold for jobs that do not set one.
     */
    @Min(0)
    private int retentionDays = 30;

    /**
     * Remove source files after a verified archive when the job does not say otherwise.
     */
    private boolean deleteSourceAfterArchive = false;
}
