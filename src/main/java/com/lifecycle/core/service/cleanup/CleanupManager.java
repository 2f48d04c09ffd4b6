package com.lifecycle.core.service.cleanup;

import com.lifecycle.core.service.config.LifecycleConfig;
import com.lifecycle.core.service.config.MetricsConfig;
import com.lifecycle.core.service.config.RetentionConfig;
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
import com.lifecycle.core.service.policy.CleanupRule;
import com.lifecycle.core.service.policy.LifecycleAction;
import com.lifecycle.core.service.policy.PolicyStore;
import com.lifecycle.core.service.policy.RetentionPolicy;
import com.lifecycle.core.service.policy.RuleEvaluator;
import com.lifecycle.core.service.scan.FileScanner;
import com.lifecycle.core.service.scan.StorageItem;
import com.lifecycle.core.service.scan.StorageLayout;
import com.lifecycle.core.service.schedule.PolicyScheduler;
import com.lifecycle.core.service.schedule.SingleFlightGuard;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Orchestrates retention-driven cleanup: scan the data-type roots, select candidates by age
 * and count, route each candidate to the first matching rule and apply the rule's action.
 *
 * Scheduled, emergency and deep passes share one single-flight guard per manager.
 */
@Slf4j
@RequiredArgsConstructor
public class CleanupManager {

    public static final String SCHEDULED_CLEANUP = "scheduled-cleanup";
    public static final String EMERGENCY_CHECK = "emergency-check";

    public static final String META_CANDIDATES_BY_TYPE = "candidatesByType";
    public static final String META_UNMATCHED = "unmatched";
    public static final String META_EFFECTIVE_RETENTION_DAYS = "effectiveRetentionDays";

    private final JobTracker jobs;
    private final PolicyStore<RetentionPolicy> policies;
    private final FileScanner scanner;
    private final RuleEvaluator evaluator;
    private final ActionExecutor executor;
    private final PolicyScheduler scheduler;
    private final StorageLayout layout;
    private final LifecycleConfig lifecycleConfig;
    private final RetentionConfig config;
    private final MetricsConfig metrics;
    private final Clock clock;

    private final SingleFlightGuard guard = new SingleFlightGuard("Cleanup");
    private final Map<String, AtomicBoolean> cancellations = new ConcurrentHashMap<>();

    // ==================== Lifecycle ====================

    @PostConstruct
    public void start() {
        jobs.reconcileStuckJobs(config.getStuckJobGrace());
        policies.seedDefaults();
        if (lifecycleConfig.getFeatures().isMetricsEnabled()) {
            metrics.registerJobGauge("lifecycle.cleanup.jobs.running", "Cleanup jobs currently running",
                    () -> jobs.listByStatus(JobStatus.RUNNING).size());
        }

        if (!lifecycleConfig.isEnabled() || !lifecycleConfig.getFeatures().isSchedulingEnabled()) {
            log.info("Cleanup scheduling disabled");
            return;
        }
        try {
            scheduler.schedule(SCHEDULED_CLEANUP, config.getSchedule(), this::runScheduledCleanup);
            if (config.getEmergency().isEnabled()) {
                scheduler.schedule(EMERGENCY_CHECK, config.getEmergency().getCheckSchedule(),
                        this::checkStorageAndCleanup);
            }
        } catch (InvalidScheduleException e) {
            log.error("Cleanup schedule rejected, automatic cleanup disabled: {}", e.getMessage());
        }
    }

    @PreDestroy
    public void stop() {
        cancellations.values().forEach(flag -> flag.set(true));
        scheduler.shutdown();
    }

    // ==================== Jobs ====================

    /**
     * Records a new PENDING cleanup job.
     *
     * @throws NotFoundException if the policy does not exist
     * @throws SourceNotFoundException if an explicit source path does not exist
     */
    public String createJob(CleanupJobRequest request) {
        RetentionPolicy policy = null;
        if (request.getPolicyId() != null) {
            policy = policies.get(request.getPolicyId())
                    .orElseThrow(() -> new NotFoundException("Retention policy", request.getPolicyId()));
        } else if (request.getRetentionDays() == null) {
            throw new IllegalArgumentException("A cleanup job needs a policy or an explicit retention period");
        }

        String sourcePath = null;
        if (request.getSourcePath() != null) {
            Path source = layout.resolve(request.getSourcePath());
            if (!Files.exists(source)) {
                throw new SourceNotFoundException(source.toString());
            }
            sourcePath = source.toString();
        }

        var options = JobOptions.builder()
                .action(request.getAction())
                .retentionDays(request.getRetentionDays())
                .dryRun(request.getDryRun() != null ? request.getDryRun() : config.isDryRun())
                .dataTypes(new ArrayList<>(request.getDataTypes()))
                .thresholdFactor(request.getThresholdFactor())
                .build();

        String name = request.getName() != null ? request.getName()
                : policy != null ? policy.getName() : "cleanup";
        var job = Job.builder()
                .type(JobType.CLEANUP)
                .name(name)
                .description(request.getDescription())
                .sourcePath(sourcePath)
                .policyId(request.getPolicyId())
                .options(options)
                .build();
        return jobs.create(job);
    }

    /**
     * Runs a PENDING job to a terminal state. Per-item failures leave the job COMPLETED with
     * errors; only an orchestration failure marks it FAILED.
     *
     * @throws InvalidStateException if the job is not PENDING
     */
    public CleanupResult executeJob(String jobId) {
        Job job = jobs.get(jobId).orElseThrow(() -> new NotFoundException("Cleanup job", jobId));
        if (job.getStatus() != JobStatus.PENDING) {
            throw new InvalidStateException("Cleanup job is " + job.getStatus() + ", expected PENDING", jobId);
        }

        jobs.updateStatus(jobId, JobStatus.RUNNING, null);
        AtomicBoolean cancelled = new AtomicBoolean(false);
        cancellations.put(jobId, cancelled);
        if (jobs.get(jobId).map(j -> j.getStatus() != JobStatus.RUNNING).orElse(true)) {
            cancelled.set(true);
        }
        log.info("Cleanup job started: {} ({})", jobId, job.getName());

        Timer.Sample sample = Timer.start(metrics.getRegistry());
        JobStatus terminal = JobStatus.FAILED;
        Consumer<Job> results = j -> { };
        String failure = "Cleanup job aborted";
        try {
            results = run(job, cancelled);
            terminal = cancelled.get() ? JobStatus.CANCELLED : JobStatus.COMPLETED;
            failure = null;
        } catch (RuntimeException e) {
            failure = e.getMessage();
            log.error("Cleanup job {} failed", jobId, e);
            throw e;
        } finally {
            finish(jobId, terminal, results, failure);
            cancellations.remove(jobId, cancelled);
            sample.stop(metrics.getCleanupTimer());
        }
        return CleanupResult.from(jobs.get(jobId).orElseThrow(() -> new NotFoundException("Cleanup job", jobId)));
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
            log.debug("Cleanup job {} finished before cancellation: {}", jobId, e.getMessage());
            return false;
        }
        log.info("Cleanup job cancelled: {}", jobId);
        return true;
    }

    public Optional<Job> getJob(String jobId) {
        return jobs.get(jobId);
    }

    public List<Job> listJobs() {
        return jobs.list();
    }

    /**
     * @throws InvalidStateException if the job is RUNNING
     */
    public boolean deleteJob(String jobId) {
        Optional<Job> job = jobs.get(jobId);
        if (job.isPresent() && job.get().getStatus() == JobStatus.RUNNING) {
            throw new InvalidStateException("Cannot delete a running job; cancel it first", jobId);
        }
        return jobs.delete(jobId);
    }

    public CleanupStatistics getStatistics() {
        List<Job> all = jobs.list();
        List<Job> completed = all.stream().filter(j -> j.getStatus() == JobStatus.COMPLETED).toList();
        long finished = all.stream().filter(Job::isTerminal).count();
        Map<JobStatus, Long> byStatus = JobFolds.countByStatus(all);

        Map<String, Long> byDataType = new TreeMap<>();
        for (Job job : all) {
            if (job.getMetadata().get(META_CANDIDATES_BY_TYPE) instanceof Map<?, ?> counts) {
                counts.forEach((type, count) -> {
                    if (count instanceof Number number) {
                        byDataType.merge(String.valueOf(type), number.longValue(), Long::sum);
                    }
                });
            }
        }

        return CleanupStatistics.builder()
                .totalJobs(all.size())
                .totalCleanups(completed.size())
                .totalItemsProcessed(all.stream().mapToLong(Job::getItemsProcessed).sum())
                .totalSizeFreed(all.stream().mapToLong(Job::getSizeFreed).sum())
                .averageDurationMillis(JobFolds.averageDurationMillis(completed))
                .successRate(finished == 0 ? 0.0 : completed.size() * 100.0 / finished)
                .activeJobs(byStatus.get(JobStatus.PENDING) + byStatus.get(JobStatus.RUNNING))
                .byStatus(byStatus)
                .byPolicy(JobFolds.countBy(all, Job::getPolicyId))
                .byDataType(byDataType)
                .dailyTrends(JobFolds.dailyTrends(all, Job::getSizeFreed, clock.getZone()))
                .build();
    }

    // ==================== Policies ====================

    public String createPolicy(RetentionPolicy policy) {
        return policies.create(policy);
    }

    public Optional<RetentionPolicy> getPolicy(String policyId) {
        return policies.get(policyId);
    }

    public List<RetentionPolicy> listPolicies() {
        return policies.list();
    }

    public RetentionPolicy updatePolicy(String policyId, UnaryOperator<RetentionPolicy> patch) {
        return policies.update(policyId, patch);
    }

    public boolean deletePolicy(String policyId) {
        return policies.delete(policyId);
    }

    /**
     * Rejects policies that could never select anything sensibly.
     */
    public static void validatePolicy(RetentionPolicy policy) {
        if (policy.getName() == null || policy.getName().isBlank()) {
            throw new IllegalArgumentException("Retention policy name is required");
        }
        if (policy.getRetentionDays() < 0) {
            throw new IllegalArgumentException("Retention days must not be negative");
        }
        if (policy.getMaxCount() != null && policy.getMaxCount() < 0) {
            throw new IllegalArgumentException("Max count must not be negative");
        }
        for (CleanupRule rule : policy.getRules()) {
            if (rule.getAction() == null) {
                throw new IllegalArgumentException("Rule " + rule.getId() + " has no action");
            }
            if (rule.getAction() == LifecycleAction.MOVE
                    && !rule.getParameters().containsKey(ActionExecutor.PARAM_TARGET)) {
                throw new IllegalArgumentException("Move rule " + rule.getId() + " needs a target parameter");
            }
        }
    }

    // ==================== Passes ====================

    /**
     * Runs every enabled policy once, unless a cleanup pass is already in progress.
     *
     * @return ids of the jobs run; empty when skipped
     */
    public List<String> runScheduledCleanup() {
        return runAllPolicies(1.0, "Scheduled cleanup");
    }

    /**
     * Runs every enabled policy with age and count thresholds scaled by the emergency factor.
     * Policies are never modified; the stricter thresholds exist only in the emergency jobs.
     */
    public List<String> runEmergencyCleanup() {
        log.warn("Emergency cleanup requested");
        return runAllPolicies(config.getEmergency().getThresholdFactor(), "Emergency cleanup");
    }

    /**
     * Runs an emergency pass if usage is at or above the configured threshold.
     *
     * @return true if an emergency pass ran; false when usage is below the threshold or
     *         another cleanup pass was already in progress
     */
    public boolean checkStorageAndCleanup() {
        StorageUsage usage = getStorageUsage();
        int threshold = config.getEmergency().getUsageThresholdPercent();
        if (usage.getUsagePercent() < threshold) {
            log.debug("Storage usage {}% below emergency threshold {}%",
                    String.format("%.1f", usage.getUsagePercent()), threshold);
            return false;
        }
        log.warn("Storage usage {}% reached emergency threshold {}%",
                String.format("%.1f", usage.getUsagePercent()), threshold);
        log.warn("Emergency cleanup requested");
        boolean ran = guard.runExclusive(() ->
                executeEnabledPolicies(config.getEmergency().getThresholdFactor(), "Emergency cleanup"));
        if (!ran) {
            metrics.getRunsSkipped().increment();
        }
        return ran;
    }

    /**
     * Runs every enabled policy immediately, then prunes empty directories under the data-type roots.
     */
    public DeepCleanupResult runDeepCleanup() {
        List<String> jobIds = new ArrayList<>();
        int[] removed = new int[1];
        boolean ran = guard.runExclusive(() -> {
            jobIds.addAll(executeEnabledPolicies(1.0, "Deep cleanup"));
            for (Path root : layout.roots().values()) {
                removed[0] += pruneEmptyDirectories(root, root);
            }
        });
        if (!ran) {
            metrics.getRunsSkipped().increment();
        }
        log.info("Deep cleanup ran {} jobs and removed {} empty directories", jobIds.size(), removed[0]);
        return new DeepCleanupResult(jobIds, removed[0], !ran);
    }

    public boolean isRunning() {
        return guard.isRunning();
    }

    /**
     * Measures the data-type roots against the configured storage ceiling.
     */
    public StorageUsage getStorageUsage() {
        Instant now = clock.instant();
        Map<String, Long> byType = new LinkedHashMap<>();
        Map<String, Long> byAge = new LinkedHashMap<>();
        byAge.put(StorageUsage.AGE_UNDER_7_DAYS, 0L);
        byAge.put(StorageUsage.AGE_7_TO_30_DAYS, 0L);
        byAge.put(StorageUsage.AGE_30_TO_90_DAYS, 0L);
        byAge.put(StorageUsage.AGE_OVER_90_DAYS, 0L);

        long used = 0;
        long files = 0;
        for (Map.Entry<String, Path> entry : layout.roots().entrySet()) {
            List<StorageItem> items = scanner.scan(entry.getValue(), entry.getKey());
            long size = scanner.totalSize(items);
            byType.put(entry.getKey(), size);
            used += size;
            files += items.size();
            for (StorageItem item : items) {
                byAge.merge(ageBucket(item.ageDays(now)), item.sizeBytes(), Long::sum);
            }
        }

        long total = config.getMaxStorageSize();
        long reserved = (long) (total * config.getSafetyMargin());
        return StorageUsage.builder()
                .totalBytes(total)
                .usedBytes(used)
                .freeBytes(Math.max(0, total - used))
                .usagePercent(total > 0 ? used * 100.0 / total : 0.0)
                .fileCount(files)
                .byDataType(byType)
                .byAge(byAge)
                .availableBytes(Math.max(0, total - reserved - used))
                .build();
    }

    // ==================== Execution ====================

    private List<String> runAllPolicies(double thresholdFactor, String label) {
        List<String> jobIds = new ArrayList<>();
        boolean ran = guard.runExclusive(() -> jobIds.addAll(executeEnabledPolicies(thresholdFactor, label)));
        if (!ran) {
            metrics.getRunsSkipped().increment();
        }
        return jobIds;
    }

    private List<String> executeEnabledPolicies(double thresholdFactor, String label) {
        List<String> jobIds = new ArrayList<>();
        List<RetentionPolicy> enabled = policies.list().stream()
                .filter(RetentionPolicy::isEnabled)
                .sorted(Comparator.comparingInt(RetentionPolicy::getPriority))
                .toList();

        for (RetentionPolicy policy : enabled) {
            try {
                String jobId = createJob(CleanupJobRequest.builder()
                        .name(label + " - " + policy.getName())
                        .policyId(policy.getId())
                        .thresholdFactor(thresholdFactor)
                        .build());
                jobIds.add(jobId);
                executeJob(jobId);
            } catch (LifecycleException | IllegalArgumentException e) {
                log.error("{} of policy {} failed: {}", label, policy.getId(), e.getMessage());
            }
        }
        log.info("{} finished: {} policies run", label, jobIds.size());
        return jobIds;
    }

    private Consumer<Job> run(Job job, AtomicBoolean cancelled) {
        JobOptions options = job.getOptions();
        RetentionPolicy policy = effectivePolicy(job);
        Instant now = clock.instant();

        int retentionDays = scale(policy.getRetentionDays(), options.getThresholdFactor());
        Integer maxCount = policy.getMaxCount() == null || policy.getMaxCount() <= 0
                ? null
                : scale(policy.getMaxCount(), options.getThresholdFactor());

        List<StorageItem> candidates = selectCandidates(job, policy, retentionDays, maxCount, now);

        List<CleanupRule> rules = policy.orderedRules();
        Map<CleanupRule, List<StorageItem>> routed = new IdentityHashMap<>();
        int unmatched = 0;
        for (StorageItem item : candidates) {
            Optional<CleanupRule> match = evaluator.firstMatch(rules, item, now);
            if (match.isPresent()) {
                routed.computeIfAbsent(match.get(), rule -> new ArrayList<>()).add(item);
            } else {
                unmatched++;
            }
        }
        int total = candidates.size() - unmatched;
        Map<String, Long> byType = candidates.stream()
                .collect(Collectors.groupingBy(StorageItem::dataType, TreeMap::new, Collectors.counting()));

        jobs.updateProgress(job.getId(), j -> j.setItemsTotal(total));
        log.info("Cleanup job {}: {} candidates, {} routed to rules, retention {} days",
                job.getId(), candidates.size(), total, retentionDays);

        var monitor = new JobProgressMonitor(jobs, job.getId(), cancelled, total, config.getBatchSize());
        ActionOutcome outcome = ActionOutcome.empty();
        for (CleanupRule rule : rules) {
            List<StorageItem> batch = routed.getOrDefault(rule, List.of());
            if (batch.isEmpty()) {
                continue;
            }
            if (cancelled.get()) {
                break;
            }
            Map<String, Object> params = new HashMap<>(rule.getParameters());
            params.putIfAbsent(ActionExecutor.PARAM_ARCHIVE_NAME, job.getName());
            outcome = outcome.plus(executor.apply(rule.getAction(), batch, params, options.isDryRun(), monitor));
        }

        ActionOutcome result = outcome;
        int unmatchedCount = unmatched;
        metrics.getItemsProcessed().increment(result.processed());
        if (!options.isDryRun()) {
            metrics.getBytesFreed().increment(result.sizeFreed());
        }
        return j -> {
            j.setItemsProcessed(result.processed());
            j.setSizeFreed(result.sizeFreed());
            j.getErrors().addAll(result.errors());
            j.getMetadata().put(META_CANDIDATES_BY_TYPE, byType);
            j.getMetadata().put(META_UNMATCHED, unmatchedCount);
            j.getMetadata().put(META_EFFECTIVE_RETENTION_DAYS, retentionDays);
            j.getMetadata().put("dryRun", options.isDryRun());
            if (!result.bundles().isEmpty()) {
                j.getMetadata().put("bundles", result.bundles().stream().map(Path::toString).toList());
            }
        };
    }

    /**
     * The stored policy with the job's overrides applied, or an ad-hoc policy for jobs without one.
     */
    private RetentionPolicy effectivePolicy(Job job) {
        JobOptions options = job.getOptions();
        RetentionPolicy policy = job.getPolicyId() != null
                ? policies.get(job.getPolicyId())
                        .orElseThrow(() -> new NotFoundException("Retention policy", job.getPolicyId()))
                : RetentionPolicy.builder().id(null).name(job.getName()).build();

        if (options.getRetentionDays() != null) {
            policy.setRetentionDays(options.getRetentionDays());
        }
        if (!options.getDataTypes().isEmpty()) {
            policy.setDataTypes(new ArrayList<>(options.getDataTypes()));
        }
        if (options.getAction() != null || policy.getRules().isEmpty()) {
            LifecycleAction action = options.getAction() != null ? options.getAction() : LifecycleAction.DELETE;
            policy.setRules(new ArrayList<>(List.of(CleanupRule.builder()
                    .id("override")
                    .name(action.name().toLowerCase(Locale.ROOT))
                    .action(action)
                    .parameters(overrideParameters(policy, action))
                    .build())));
        }
        return policy;
    }

    private Map<String, Object> overrideParameters(RetentionPolicy policy, LifecycleAction action) {
        return policy.getRules().stream()
                .filter(rule -> rule.getAction() == action)
                .findFirst()
                .<Map<String, Object>>map(rule -> new HashMap<>(rule.getParameters()))
                .orElseGet(HashMap::new);
    }

    private List<StorageItem> selectCandidates(Job job, RetentionPolicy policy, int retentionDays,
                                               Integer maxCount, Instant now) {
        List<StorageItem> items = new ArrayList<>();
        if (job.getSourcePath() != null) {
            String type = policy.getDataTypes().isEmpty() ? FileScanner.UNTYPED : policy.getDataTypes().get(0);
            items.addAll(scanner.scan(Paths.get(job.getSourcePath()), type));
        } else {
            Set<String> types = policy.getDataTypes().isEmpty()
                    ? layout.roots().keySet()
                    : new LinkedHashSet<>(policy.getDataTypes());
            for (String type : types) {
                items.addAll(scanner.scan(layout.root(type), type));
            }
        }

        // count-only policy: zero days must not select everything
        Set<StorageItem> candidates = maxCount != null && retentionDays <= 0
                ? new LinkedHashSet<>()
                : new LinkedHashSet<>(scanner.filterByAge(items, retentionDays, now));
        if (maxCount != null) {
            items.stream()
                    .collect(Collectors.groupingBy(StorageItem::dataType, LinkedHashMap::new, Collectors.toList()))
                    .values()
                    .forEach(group -> group.stream()
                            .sorted(Comparator.comparing(StorageItem::lastModified).reversed())
                            .skip(maxCount)
                            .forEach(candidates::add));
        }
        return new ArrayList<>(candidates);
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
                metrics.getCleanupsCompleted().increment();
            } else if (terminal == JobStatus.FAILED) {
                metrics.getCleanupsFailed().increment();
            }
            log.info("Cleanup job finished: {} {} ({} items, {} bytes, {} errors)", jobId, terminal,
                    done.getItemsProcessed(), done.getSizeFreed(), done.getErrors().size());
        } catch (InvalidTransitionException e) {
            log.info("Cleanup job {} already {}, run results discarded", jobId, e.getFrom());
        }
    }

    // ==================== Helpers ====================

    /**
     * Scales a threshold, never below one so that a stricter pass cannot turn into "everything".
     */
    static int scale(int value, double factor) {
        if (factor >= 1.0 || value <= 0) {
            return value;
        }
        return Math.max(1, (int) Math.floor(value * factor));
    }

    private static String ageBucket(double ageDays) {
        if (ageDays < 7) {
            return StorageUsage.AGE_UNDER_7_DAYS;
        }
        if (ageDays < 30) {
            return StorageUsage.AGE_7_TO_30_DAYS;
        }
        if (ageDays < 90) {
            return StorageUsage.AGE_30_TO_90_DAYS;
        }
        return StorageUsage.AGE_OVER_90_DAYS;
    }

    private int pruneEmptyDirectories(Path dir, Path root) {
        if (!Files.isDirectory(dir)) {
            return 0;
        }
        int removed = 0;
        try (DirectoryStream<Path> children = Files.newDirectoryStream(dir)) {
            for (Path child : children) {
                if (Files.isDirectory(child)) {
                    removed += pruneEmptyDirectories(child, root);
                }
            }
        } catch (IOException e) {
            log.warn("Cannot list {}: {}", dir, e.getMessage());
            return removed;
        }
        if (!dir.equals(root) && isEmpty(dir)) {
            try {
                Files.delete(dir);
                removed++;
            } catch (IOException e) {
                log.warn("Cannot remove empty directory {}: {}", dir, e.getMessage());
            }
        }
        return removed;
    }

    private static boolean isEmpty(Path dir) {
        try (DirectoryStream<Path> children = Files.newDirectoryStream(dir)) {
            return !children.iterator().hasNext();
        } catch (IOException e) {
            return false;
        }
    }
}
