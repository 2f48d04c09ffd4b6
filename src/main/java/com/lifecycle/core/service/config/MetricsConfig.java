package com.lifecycle.core.service.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Getter;
import org.springframework.context.annotation.Configuration;

import java.util.function.Supplier;

/**
 * Metrics configuration for the data lifecycle service.
 *
 * Provides custom metrics for archive and cleanup runs.
 */
@Configuration
@Getter
public class MetricsConfig {

    private final MeterRegistry registry;

    // Counters
    private final Counter archivesCompleted;
    private final Counter archivesFailed;
    private final Counter cleanupsCompleted;
    private final Counter cleanupsFailed;
    private final Counter itemsProcessed;
    private final Counter bytesFreed;
    private final Counter runsSkipped;

    // Timers
    private final Timer archiveTimer;
    private final Timer cleanupTimer;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;

        this.archivesCompleted = Counter.builder("lifecycle.archive.completed")
                .description("Number of archive jobs completed")
                .register(registry);

        this.archivesFailed = Counter.builder("lifecycle.archive.failed")
                .description("Number of archive jobs failed")
                .register(registry);

        this.cleanupsCompleted = Counter.builder("lifecycle.cleanup.completed")
                .description("Number of cleanup jobs completed")
                .register(registry);

        this.cleanupsFailed = Counter.builder("lifecycle.cleanup.failed")
                .description("Number of cleanup jobs failed")
                .register(registry);

        this.itemsProcessed = Counter.builder("lifecycle.cleanup.items.processed")
                .description("Number of items a cleanup action was applied to")
                .register(registry);

        this.bytesFreed = Counter.builder("lifecycle.cleanup.bytes.freed")
                .description("Bytes released by cleanup actions")
                .baseUnit("bytes")
                .register(registry);

        this.runsSkipped = Counter.builder("lifecycle.runs.skipped")
                .description("Scheduled runs skipped because a previous run was still in progress")
                .register(registry);

        this.archiveTimer = Timer.builder("lifecycle.archive.duration")
                .description("Time taken for archive jobs")
                .register(registry);

        this.cleanupTimer = Timer.builder("lifecycle.cleanup.duration")
                .description("Time taken for cleanup jobs")
                .register(registry);
    }

    /**
     * Registers a gauge for the number of running jobs of one manager.
     *
     * @param name the metric name
     * @param description the metric description
     * @param countSupplier supplier for the current count
     */
    public void registerJobGauge(String name, String description, Supplier<Number> countSupplier) {
        Gauge.builder(name, countSupplier)
                .description(description)
                .register(registry);
    }
}
