package com.lifecycle.core.service.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for retention-driven cleanup.
 *
 * Controls the cleanup schedule, storage ceiling and emergency passes.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "lifecycle.retention")
public class RetentionConfig {

    /**
     * Cron for the scheduled cleanup pass (default: daily at 02:00).
     */
    @NotBlank
    private String schedule = "0 2 * * *";

    /**
     * Evaluate policies without touching the filesystem.
     */
    private boolean dryRun = false;

    /**
     * Items per progress update.
     */
    @Min(1)
    private int batchSize = 1000;

    /**
     * Gzip level used by compress actions.
     */
    @Min(1)
    @Max(9)
    private int compressionLevel = 6;

    /**
     * Storage ceiling in bytes (default: 10 GiB).
     */
    @Min(1)
    private long maxStorageSize = 10L * 1024 * 1024 * 1024;

    /**
     * Fraction of the ceiling kept free.
     */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double safetyMargin = 0.1;

    /**
     * RUNNING jobs older than this are marked FAILED on startup.
     */
    @NotNull
    private Duration stuckJobGrace = Duration.ofHours(1);

    /**
     * Emergency cleanup settings.
     */
    @Valid
    private Emergency emergency = new Emergency();

    @Getter
    @Setter
    public static class Emergency {

        private boolean enabled = true;

        /**
         * Usage percentage of maxStorageSize that triggers an emergency pass.
         */
        @Min(1)
        @Max(100)
        private int usageThresholdPercent = 90;

        /**
         * Cron for the usage check (default: hourly).
         */
        @NotBlank
        private String checkSchedule = "0 * * * *";

        /**
         * Multiplier applied to age and count thresholds during an emergency pass.
         */
        @DecimalMin(value = "0.0", inclusive = false)
        @DecimalMax("1.0")
        private double thresholdFactor = 0.5;
    }
}
