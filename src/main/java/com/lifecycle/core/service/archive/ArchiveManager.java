package com.lifecycle.core.service.archive;

import com.lifecycle.core.service.cleanup.ActionExecutor;
import com.lifecycle.core.service.cleanup.ActionOutcome;
import com.lifecycle.core.service.cleanup.JobProgressMonitor;
import com.lifecycle.core.service.config.ArchiveConfig;
import com.lifecycle.core.service.config.LifecycleConfig;
import com.lifecycle.core.service.config.MetricsConfig;
import com.lifecycle.core.service.config.RetentionConfig;
import com.lifecycle.core.service.exception.IntegrityException;
import com.lifecycle.core.service.exception.InvalidScheduleException;
import com.lifecycle.core.service.exception.InvalidStateException;
import com.lifecycle.core.service.exception.InvalidTransitionException;
import com.lifecycle.core.service.exception.LifecycleException;
import com.lifecycle.core.service.exception.NotFoundException;
import com.lifecycle.core.service.exception.SourceNotFoundException;
import com.lifecycle.core.service.job.Job;
import com.lifecycle.core.service.job.JobFolds;
import com.lifecycle.core.service.job.JobOptions;
import com.lifecycle.core.service.job.JobStatus;
import com.lifecycle.core.service.job.JobTracker;
import com.lifecycle.core.service.job.JobType;
import com.lifecycle.core.service.policy.ArchivePolicy;
import com.lifecycle.core.service.policy.ArchiveRule;
import com.lifecycle.core.service.policy.LifecycleAction;
import com.lifecycle.core.service.policy.PolicyStore;
import com.lifecycle.core.service.scan.FileScanner;
import com.lifecycle.core.service.scan.StorageItem;
import com.lifecycle.core.service.scan.StorageLayout;
import com.lifecycle.core.service.schedule.CronSchedules;
import com.lifecycle.core.service.schedule.PolicyScheduler;
import com.lifecycle.core.service.schedule.SingleFlightGuard;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * Orchestrates archival: scan the source, bundle stale files, verify the bundle and only
 * then remove the originals. Every run is an auditable job in the {@link JobTracker}.
 */
@Slf4j
@RequiredArgsConstructor
public class ArchiveManager {

    public static final String META_ARCHIVE_PATH = "archivePath";
    public static final String META_CHECKSUM = "checksum";
    public static final String META_FILE_COUNT = "fileCount";

    private static final Set<LifecycleAction> JOB_ACTIONS =
            EnumSet.of(LifecycleAction.ARCHIVE, LifecycleAction.DELETE, LifecycleAction.COMPRESS);

    private final JobTracker jobs;
    private final PolicyStore<ArchivePolicy> policies;
    private final FileScanner scanner;
    private final ArchiveBuilder builder;
    private final ActionExecutor executor;
    private final PolicyScheduler scheduler;
    private final StorageLayout layout;
    private final LifecycleConfig lifecycleConfig;
    private final ArchiveConfig config;
    private final RetentionConfig retentionConfig;
    private final MetricsConfig metrics;
    private final Clock clock;

    private final SingleFlightGuard guard = new SingleFlightGuard("Archive");
    private final Map<String, AtomicBoolean> cancellations = new ConcurrentHashMap<>();

    // ==================== Lifecycle ====================

    @PostConstruct
    public void start() {
        jobs.reconcileStuckJobs(retentionConfig.getStuckJobGrace());
        policies.seedDefaults();
        if (lifecycleConfig.getFeatures().isMetricsEnabled()) {
            metrics.registerJobGauge("lifecycle.archive.jobs.running", "Archive jobs currently running",
                    () -> jobs.listByStatus(JobStatus.RUNNING).size());
        }

        if (!lifecycleConfig.isEnabled() || !lifecycleConfig.getFeatures().isSchedulingEnabled()
                || !config.isScheduleEnabled()) {
            log.info("Archive scheduling disabled");
            return;
        }
        for (ArchivePolicy policy : policies.list()) {
            if (policy.isEnabled()) {
                try {
                    schedulePolicy(policy);
                } catch (InvalidScheduleException e) {
                    log.error("Archive policy {} left unscheduled: {}", policy.getId(), e.getMessage());
                }
            }
        }
    }

    @PreDestroy
    public void stop() {
        cancellations.values().forEach(flag -> flag.set(true));
        scheduler.shutdown();
    }

    // ==================== Jobs ====================

    /**
     * Records a new PENDING archive job.
     *
     * @throws SourceNotFoundException if the source directory does not exist
     * @throws com.lifecycle.core.service.exception.UnsupportedFormatException for a non-gzip format
     */
    public String createJob(ArchiveJobRequest request) {
        String format = request.getCompressionFormat() != null
                ? request.getCompressionFormat()
                : config.getCompressionFormat();
        CompressionFormat.parse(format).requireSupported();

        LifecycleAction action = request.getAction() != null ? request.getAction() : LifecycleAction.ARCHIVE;
        if (!JOB_ACTIONS.contains(action)) {
            throw new IllegalArgumentException("Archive jobs support ARCHIVE, DELETE or COMPRESS, not " + action);
        }

        Path source = layout.resolve(request.getSourcePath());
        if (!Files.exists(source)) {
            throw new SourceNotFoundException(source.toString());
        }

        var options = JobOptions.builder()
                .action(action)
                .retentionDays(request.getRetentionDays() != null
                        ? request.getRetentionDays()
                        : config.getRetentionDays())
                .dryRun(request.isDryRun())
                .deleteSource(request.getDeleteSource() != null
                        ? request.getDeleteSource()
                        : config.isDeleteSourceAfterArchive())
                .files(new ArrayList<>(request.getFiles()))
                .targetPath(request.getTargetPath())
                .build();

        var job = Job.builder()
                .type(JobType.ARCHIVE)
                .name(request.getName() != null ? request.getName() : "archive")
                .description(request.getDescription())
                .sourcePath(source.toString())
                .policyId(request.getPolicyId())
                .options(options)
                .metadata(new HashMap<>(request.getMetadata()))
                .build();
        return jobs.create(job);
    }

    /**
     * Runs a PENDING job to a terminal state.
     *
     * @return the job as recorded after the run
     * @throws InvalidStateException if the job is not PENDING
     * @throws LifecycleException if the run itself fails; the job is then FAILED
     */
    public Job executeJob(String jobId) {
        Job job = jobs.get(jobId).orElseThrow(() -> new NotFoundException("Archive job", jobId));
        if (job.getStatus() != JobStatus.PENDING) {
            throw new InvalidStateException("Archive job is " + job.getStatus() + ", expected PENDING", jobId);
        }

        jobs.updateStatus(jobId, JobStatus.RUNNING, null);
        AtomicBoolean cancelled = new AtomicBoolean(false);
        cancellations.put(jobId, cancelled);
        if (jobs.get(jobId).map(j -> j.getStatus() != JobStatus.RUNNING).orElse(true)) {
            cancelled.set(true);
        }
        log.info("Archive job started: {} ({})", jobId, job.getName());

        Timer.Sample sample = Timer.start(metrics.getRegistry());
        JobStatus terminal = JobStatus.FAILED;
        Consumer<Job> results = j -> { };
        String failure = "Archive job aborted";
        try {
            results = run(job, cancelled);
            terminal = cancelled.get() ? JobStatus.CANCELLED : JobStatus.COMPLETED;
            failure = null;
        } catch (IOException e) {
            failure = e.getMessage();
            throw new LifecycleException("Archive job failed: " + e.getMessage(), jobId, "ARCHIVE_IO_ERROR", e);
        } catch (RuntimeException e) {
            failure = e.getMessage();
            throw e;
        } finally {
            finish(jobId, terminal, results, failure);
            cancellations.remove(jobId, cancelled);
            sample.stop(metrics.getArchiveTimer());
        }
        return jobs.get(jobId).orElseThrow(() -> new NotFoundException("Archive job", jobId));
    }

    /**
     * Requests cooperative cancellation of a RUNNING job.
     *
     * @return false if the job is missing or not RUNNING
     */
    public boolean cancelJob(String jobId) {
        Optional<Job> job = jobs.get(jobId);
        if (job.isEmpty() || job.get().getStatus() != JobStatus.RUNNING) {
            return false;
        }
        AtomicBoolean flag = cancellations.get(jobId);
        if (flag != null) {
            flag.set(true);
        }
        try {
            jobs.updateStatus(jobId, JobStatus.CANCELLED, j -> j.setError("Cancelled by request"));
        } catch (InvalidTransitionException e) {
            log.debug("Archive job {} finished before cancellation: {}", jobId, e.getMessage());
            return false;
        }
        log.info("Archive job cancelled: {}", jobId);
        return true;
    }

    public Optional<Job> getJob(String jobId) {
        return jobs.get(jobId);
    }

    public List<Job> listJobs() {
        return jobs.list();
    }

    /**
     * Deletes a job record together with its bundle.
     *
     * @throws InvalidStateException if the job is RUNNING
     */
    public boolean deleteJob(String jobId) {
        Optional<Job> job = jobs.get(jobId);
        if (job.isEmpty()) {
            return false;
        }
        if (job.get().getStatus() == JobStatus.RUNNING) {
            throw new InvalidStateException("Cannot delete a running job; cancel it first", jobId);
        }
        bundleOf(job.get()).ifPresent(bundle -> {
            try {
                Files.deleteIfExists(bundle);
                log.info("Archive bundle removed: {}", bundle);
            } catch (IOException e) {
                throw new LifecycleException("Could not remove bundle " + bundle, jobId, "ARCHIVE_IO_ERROR", e);
            }
        });
        return jobs.delete(jobId);
    }

    /**
     * Extracts the bundle of a completed job, or of a job cancelled after its bundle was verified.
     *
     * @param destination target directory; null extracts below the configured temp path
     * @return the restored files
     */
    public List<Path> restoreArchive(String jobId, String destination) {
        Job job = jobs.get(jobId).orElseThrow(() -> new NotFoundException("Archive job", jobId));
        if (job.getStatus() != JobStatus.COMPLETED && job.getStatus() != JobStatus.CANCELLED) {
            throw new InvalidStateException("Only completed or cancelled archive jobs can be restored", jobId);
        }
        Path bundle = bundleOf(job)
                .orElseThrow(() -> new InvalidStateException("Archive job has no bundle", jobId));
        if (!Files.isRegularFile(bundle)) {
            throw new SourceNotFoundException(bundle.toString());
        }
        Path target = destination != null
                ? Paths.get(destination)
                : Paths.get(config.getTempPath()).resolve(jobId);
        try {
            List<Path> restored = builder.extract(bundle, target);
            log.info("Archive job {} restored to {} ({} files)", jobId, target, restored.size());
            return restored;
        } catch (IOException e) {
            throw new LifecycleException("Restore failed: " + e.getMessage(), jobId, "ARCHIVE_IO_ERROR", e);
        }
    }

    public ArchiveStatistics getStatistics() {
        List<Job> all = jobs.list();
        List<Job> completed = all.stream().filter(j -> j.getStatus() == JobStatus.COMPLETED).toList();
        List<Job> archives = completed.stream().filter(j -> bundleOf(j).isPresent()).toList();
        Map<JobStatus, Long> byStatus = JobFolds.countByStatus(all);

        return ArchiveStatistics.builder()
                .totalJobs(all.size())
                .totalArchives(archives.size())
                .totalArchivedBytes(archives.stream().mapToLong(Job::getOriginalSize).sum())
                .totalCompressedBytes(archives.stream().mapToLong(Job::getCompressedSize).sum())
                .averageCompressionRatio(archives.stream()
                        .filter(j -> j.getOriginalSize() > 0)
                        .mapToDouble(Job::getCompressionRatio)
                        .average()
                        .orElse(0.0))
                .activeJobs(byStatus.get(JobStatus.PENDING) + byStatus.get(JobStatus.RUNNING))
                .completedJobs(byStatus.get(JobStatus.COMPLETED))
                .failedJobs(byStatus.get(JobStatus.FAILED))
                .cancelledJobs(byStatus.get(JobStatus.CANCELLED))
                .byStatus(byStatus)
                .byName(JobFolds.countBy(all, Job::getName))
                .dailyTrends(JobFolds.dailyTrends(all, Job::getOriginalSize, clock.getZone()))
                .build();
    }

    // ==================== Policies ====================

    public String createPolicy(ArchivePolicy policy) {
        String id = policies.create(policy);
        policies.get(id).ifPresent(this::syncSchedule);
        return id;
    }

    public Optional<ArchivePolicy> getPolicy(String policyId) {
        return policies.get(policyId);
    }

    public List<ArchivePolicy> listPolicies() {
        return policies.list();
    }

    /**
     * Patches a policy. An enabled policy with an invalid schedule is rejected and not stored.
     */
    public ArchivePolicy updatePolicy(String policyId, UnaryOperator<ArchivePolicy> patch) {
        ArchivePolicy updated = policies.update(policyId, patch);
        syncSchedule(updated);
        return updated;
    }

    public boolean deletePolicy(String policyId) {
        scheduler.unschedule(policyId);
        return policies.delete(policyId);
    }

    /**
     * Runs every enabled rule of a policy, one job per rule. Skipped if another archive
     * policy run is still in progress.
     *
     * @return ids of the jobs created; empty when the run was skipped
     */
    public List<String> runPolicy(String policyId) {
        ArchivePolicy policy = policies.get(policyId)
                .orElseThrow(() -> new NotFoundException("Archive policy", policyId));

        List<String> jobIds = new ArrayList<>();
        boolean ran = guard.runExclusive(() -> jobIds.addAll(executeRules(policy)));
        if (!ran) {
            metrics.getRunsSkipped().increment();
        }
        return jobIds;
    }

    public boolean isRunning() {
        return guard.isRunning();
    }

    /**
     * Validates enabled policies before they are stored.
     */
    public static void validatePolicy(ArchivePolicy policy) {
        if (policy.getName() == null || policy.getName().isBlank()) {
            throw new IllegalArgumentException("Archive policy name is required");
        }
        if (policy.isEnabled()) {
            CronSchedules.validate(policy.getId(), policy.getSchedule());
        }
    }

    // ==================== Execution ====================

    private List<String> executeRules(ArchivePolicy policy) {
        List<String> jobIds = new ArrayList<>();
        for (ArchiveRule rule : policy.orderedRules()) {
            try {
                String jobId = createJob(ArchiveJobRequest.builder()
                        .name(policy.getName() + " - " + rule.getName())
                        .description(rule.getCondition())
                        .sourcePath(rule.getSourcePath())
                        .policyId(policy.getId())
                        .retentionDays(rule.getRetentionDays())
                        .action(rule.getAction())
                        .deleteSource(true)
                        .targetPath(rule.getArchivePath())
                        .metadata(Map.of("ruleId", String.valueOf(rule.getId())))
                        .build());
                jobIds.add(jobId);
                executeJob(jobId);
            } catch (LifecycleException | IllegalArgumentException e) {
                log.error("Archive rule {} of policy {} failed: {}", rule.getId(), policy.getId(), e.getMessage());
            }
        }
        log.info("Archive policy {} ran {} rules", policy.getId(), jobIds.size());
        return jobIds;
    }

    private Consumer<Job> run(Job job, AtomicBoolean cancelled) throws IOException {
        JobOptions options = job.getOptions();
        Path source = Paths.get(job.getSourcePath());
        List<StorageItem> items = select(source, options);
        long originalSize = scanner.totalSize(items);

        jobs.updateProgress(job.getId(), j -> {
            j.setItemsTotal(items.size());
            j.setOriginalSize(originalSize);
        });

        if (items.isEmpty()) {
            log.info("Archive job {} found nothing to process under {}", job.getId(), source);
            return j -> j.setItemsProcessed(0);
        }

        var monitor = new JobProgressMonitor(jobs, job.getId(), cancelled, items.size(), config.getBatchSize());
        if (options.getAction() != LifecycleAction.ARCHIVE) {
            ActionOutcome outcome = executor.apply(options.getAction(), items, Map.of(), options.isDryRun(), monitor);
            return j -> {
                j.setItemsProcessed(outcome.processed());
                j.setSizeFreed(outcome.sizeFreed());
                j.getErrors().addAll(outcome.errors());
            };
        }

        if (options.isDryRun()) {
            log.info("[dry-run] archive job {} would bundle {} files ({} bytes)", job.getId(), items.size(), originalSize);
            long wouldFree = options.isDeleteSource() ? originalSize : 0;
            return j -> {
                j.setItemsProcessed(items.size());
                j.setSizeFreed(wouldFree);
                j.getMetadata().put("dryRun", true);
            };
        }
        if (originalSize > config.getMaxArchiveSize()) {
            throw new LifecycleException("Archive input of " + originalSize + " bytes exceeds the limit of "
                    + config.getMaxArchiveSize(), job.getId(), "ARCHIVE_TOO_LARGE");
        }
        if (cancelled.get()) {
            return j -> { };
        }

        Path destination = options.getTargetPath() != null
                ? Paths.get(options.getTargetPath())
                : Paths.get(config.getArchivePath());
        List<Path> files = items.stream().map(StorageItem::path).toList();
        Path root = Files.isDirectory(source) ? source : source.getParent();

        ArchiveResult result = builder.build(root, files, destination, job.getName());
        try {
            builder.verify(result);
        } catch (IntegrityException e) {
            Files.deleteIfExists(result.path());
            log.error("Archive job {} failed verification, originals kept: {}", job.getId(), e.getMessage());
            throw e;
        }

        List<String> errors = new ArrayList<>();
        items.stream()
                .filter(item -> !result.includes(item.path()))
                .forEach(item -> errors.add(item.path() + ": unreadable, not archived"));
        if (result.fileCount() == 0) {
            Files.deleteIfExists(result.path());
            log.warn("Archive job {}: none of {} files could be read", job.getId(), items.size());
            return j -> j.getErrors().addAll(errors);
        }

        // the bundle is recorded before any original is removed
        boolean recorded = jobs.updateProgress(job.getId(), j -> {
            j.setItemsProcessed(result.fileCount());
            j.setOriginalSize(result.originalSize());
            j.setCompressedSize(result.compressedSize());
            j.setCompressionRatio(result.compressionRatio());
            j.getMetadata().put(META_ARCHIVE_PATH, result.path().toString());
            j.getMetadata().put(META_CHECKSUM, result.checksum());
            j.getMetadata().put(META_FILE_COUNT, result.fileCount());
        });
        if (!recorded) {
            Files.deleteIfExists(result.path());
            log.info("Archive job {} stopped before its bundle was recorded; bundle removed", job.getId());
            return j -> { };
        }

        ActionOutcome removal = ActionOutcome.empty();
        if (options.isDeleteSource()) {
            List<StorageItem> archived = items.stream().filter(item -> result.includes(item.path())).toList();
            removal = executor.apply(LifecycleAction.DELETE, archived, Map.of(), false, monitor);
            errors.addAll(removal.errors());
        }

        long sizeFreed = removal.sizeFreed();
        return j -> {
            j.setItemsProcessed(result.fileCount());
            j.setSizeFreed(sizeFreed);
            j.getErrors().addAll(errors);
        };
    }

    private List<StorageItem> select(Path source, JobOptions options) {
        Path root = Files.isDirectory(source) ? source : source.getParent();
        if (!options.getFiles().isEmpty()) {
            List<StorageItem> items = new ArrayList<>();
            for (String file : options.getFiles()) {
                Path path = root.resolve(file).normalize();
                if (!path.startsWith(root)) {
                    throw new IllegalArgumentException("File is outside the source directory: " + file);
                }
                items.add(scanner.stat(path, FileScanner.UNTYPED)
                        .orElseThrow(() -> new SourceNotFoundException(path.toString())));
            }
            return items;
        }
        List<StorageItem> scanned = Files.isDirectory(source)
                ? scanner.scan(source)
                : scanner.stat(source, FileScanner.UNTYPED).map(List::of).orElse(List.of());
        int threshold = options.getRetentionDays() != null ? options.getRetentionDays() : 0;
        return scanner.filterByAge(scanned, threshold, clock.instant());
    }

    private void finish(String jobId, JobStatus terminal, Consumer<Job> results, String failure) {
        try {
            Job done = jobs.updateStatus(jobId, terminal, j -> {
                results.accept(j);
                if (failure != null) {
                    j.setError(failure);
                }
            });
            if (terminal == JobStatus.COMPLETED) {
                metrics.getArchivesCompleted().increment();
            } else if (terminal == JobStatus.FAILED) {
                metrics.getArchivesFailed().increment();
            }
            log.info("Archive job finished: {} {} ({} items, {} errors)",
                    jobId, terminal, done.getItemsProcessed(), done.getErrors().size());
        } catch (InvalidTransitionException e) {
            log.info("Archive job {} already {}, run results discarded", jobId, e.getFrom());
        }
    }

    private void syncSchedule(ArchivePolicy policy) {
        if (!policy.isEnabled()) {
            scheduler.unschedule(policy.getId());
            return;
        }
        if (lifecycleConfig.getFeatures().isSchedulingEnabled() && config.isScheduleEnabled()) {
            schedulePolicy(policy);
        }
    }

    private void schedulePolicy(ArchivePolicy policy) {
        String policyId = policy.getId();
        scheduler.schedule(policyId, policy.getSchedule(), () -> runPolicy(policyId));
    }

    private static Optional<Path> bundleOf(Job job) {
        Object path = job.getMetadata().get(META_ARCHIVE_PATH);
        return path != null ? Optional.of(Paths.get(path.toString())) : Optional.empty();
    }
}
