package com.lifecycle.core.service.config;

import com.lifecycle.core.service.archive.ArchiveBuilder;
import com.lifecycle.core.service.archive.ArchiveManager;
import com.lifecycle.core.service.archive.CompressionFormat;
import com.lifecycle.core.service.cleanup.ActionExecutor;
import com.lifecycle.core.service.cleanup.CleanupManager;
import com.lifecycle.core.service.facade.StorageFacade;
import com.lifecycle.core.service.job.Job;
import com.lifecycle.core.service.job.JobTracker;
import com.lifecycle.core.service.persistence.RecordStoreFactory;
import com.lifecycle.core.service.policy.ArchivePolicy;
import com.lifecycle.core.service.policy.DefaultPolicies;
import com.lifecycle.core.service.policy.PolicyStore;
import com.lifecycle.core.service.policy.RetentionPolicy;
import com.lifecycle.core.service.policy.RuleEvaluator;
import com.lifecycle.core.service.scan.FileScanner;
import com.lifecycle.core.service.scan.StorageLayout;
import com.lifecycle.core.service.schedule.PolicyScheduler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.nio.file.Paths;
import java.time.Clock;

/**
 * Wires the lifecycle components.
 *
 * Each manager owns its job tracker, policy store and scheduler so archive and cleanup state
 * never mix.
 */
@Slf4j
@Configuration
public class LifecycleManagerConfig {

    @Bean
    public StorageLayout storageLayout(LifecycleConfig lifecycleConfig) {
        var storage = lifecycleConfig.getStorage();
        log.info("Storage base dir: {}", storage.getBaseDir());
        return new StorageLayout(Paths.get(storage.getBaseDir()), storage.getDataTypes());
    }

    @Bean
    public FileScanner fileScanner() {
        return new FileScanner();
    }

    @Bean
    public RuleEvaluator ruleEvaluator() {
        return new RuleEvaluator();
    }

    /**
     * Tar.gz codec; fails at startup if a format other than gzip is configured.
     */
    @Bean
    public ArchiveBuilder archiveBuilder(ArchiveConfig archiveConfig, Clock clock) {
        var format = CompressionFormat.parse(archiveConfig.getCompressionFormat());
        format.requireSupported();
        log.info("Initializing ArchiveBuilder (format={}, level={})", format, archiveConfig.getCompressionLevel());
        return new ArchiveBuilder(archiveConfig.getCompressionLevel(), format, clock);
    }

    @Bean
    public ActionExecutor actionExecutor(ArchiveBuilder archiveBuilder, ArchiveConfig archiveConfig,
                                         RetentionConfig retentionConfig) {
        return new ActionExecutor(archiveBuilder, Paths.get(archiveConfig.getArchivePath()),
                retentionConfig.getCompressionLevel());
    }

    @Bean
    public ArchiveManager archiveManager(RecordStoreFactory stores,
                                         FileScanner fileScanner,
                                         ArchiveBuilder archiveBuilder,
                                         ActionExecutor actionExecutor,
                                         StorageLayout storageLayout,
                                         LifecycleConfig lifecycleConfig,
                                         ArchiveConfig archiveConfig,
                                         RetentionConfig retentionConfig,
                                         MetricsConfig metricsConfig,
                                         @Qualifier("lifecycleTaskScheduler") TaskScheduler taskScheduler,
                                         Clock clock) {
        log.info("Initializing ArchiveManager");
        var jobs = new JobTracker("job", stores.create("archive-jobs", Job.class, Job::getId), clock);
        var policies = new PolicyStore<>("Archive",
                stores.create("archive-policies", ArchivePolicy.class, ArchivePolicy::getId),
                DefaultPolicies::archivePolicies, ArchiveManager::validatePolicy, clock);
        return new ArchiveManager(jobs, policies, fileScanner, archiveBuilder, actionExecutor,
                new PolicyScheduler("Archive", taskScheduler, clock.getZone()), storageLayout,
                lifecycleConfig, archiveConfig, retentionConfig, metricsConfig, clock);
    }

    @Bean
    public CleanupManager cleanupManager(RecordStoreFactory stores,
                                         FileScanner fileScanner,
                                         RuleEvaluator ruleEvaluator,
                                         ActionExecutor actionExecutor,
                                         StorageLayout storageLayout,
                                         LifecycleConfig lifecycleConfig,
                                         RetentionConfig retentionConfig,
                                         MetricsConfig metricsConfig,
                                         @Qualifier("lifecycleTaskScheduler") TaskScheduler taskScheduler,
                                         Clock clock) {
        log.info("Initializing CleanupManager");
        var jobs = new JobTracker("cleanup_job", stores.create("cleanup-jobs", Job.class, Job::getId), clock);
        var policies = new PolicyStore<>("Retention",
                stores.create("retention-policies", RetentionPolicy.class, RetentionPolicy::getId),
                DefaultPolicies::retentionPolicies, CleanupManager::validatePolicy, clock);
        return new CleanupManager(jobs, policies, fileScanner, ruleEvaluator, actionExecutor,
                new PolicyScheduler("Cleanup", taskScheduler, clock.getZone()), storageLayout,
                lifecycleConfig, retentionConfig, metricsConfig, clock);
    }

    @Bean
    public StorageFacade storageFacade(ArchiveManager archiveManager,
                                       CleanupManager cleanupManager,
                                       StorageLayout storageLayout,
                                       ArchiveConfig archiveConfig,
                                       @Qualifier("lifecycleExecutor") ThreadPoolTaskExecutor executor) {
        return new StorageFacade(archiveManager, cleanupManager, storageLayout, archiveConfig, executor);
    }
}
