package com.lifecycle.core.service.cleanup;

import com.lifecycle.core.service.exception.InvalidStateException;
import com.lifecycle.core.service.exception.NotFoundException;
import com.lifecycle.core.service.exception.SourceNotFoundException;
import com.lifecycle.core.service.job.Job;
import com.lifecycle.core.service.job.JobStatus;
import com.lifecycle.core.service.policy.CleanupRule;
import com.lifecycle.core.service.policy.ConditionOperator;
import com.lifecycle.core.service.policy.LifecycleAction;
import com.lifecycle.core.service.policy.RetentionPolicy;
import com.lifecycle.core.service.policy.RuleCondition;
import com.lifecycle.core.service.scan.StorageItem;
import com.lifecycle.core.service.testutil.MutableClock;
import com.lifecycle.core.service.testutil.TestLifecycle;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class CleanupManagerTest {

    @TempDir
    Path tempDir;

    private TestLifecycle lifecycle;
    private CleanupManager manager;
    private Path logs;

    @BeforeEach
    void setUp() throws IOException {
        lifecycle = new TestLifecycle(tempDir, new MutableClock(Instant.parse("2024-06-15T12:00:00Z"), ZoneOffset.UTC));
        manager = lifecycle.cleanupManager();
        logs = Files.createDirectories(lifecycle.root("logs"));
    }

    @AfterEach
    void tearDown() {
        lifecycle.close();
    }

    // ==================== Jobs ====================

    @Test
    void deletesOnlyFilesOlderThanRetention() throws IOException {
        lifecycle.file(logs, "recent.log", 100, 10);
        lifecycle.file(logs, "old.log", 200, 40);
        lifecycle.file(logs, "ancient.log", 300, 95);
        String policyId = manager.createPolicy(logsPolicy(30, LifecycleAction.DELETE));

        CleanupResult result = manager.executeJob(manager.createJob(
                CleanupJobRequest.builder().policyId(policyId).build()));

        assertThat(result.status()).isEqualTo(JobStatus.COMPLETED);
        assertThat(result.itemsProcessed()).isEqualTo(2);
        assertThat(result.sizeFreed()).isEqualTo(500);
        assertThat(result.errors()).isEmpty();
        assertThat(logs.resolve("recent.log")).exists();
        assertThat(logs.resolve("old.log")).doesNotExist();
        assertThat(logs.resolve("ancient.log")).doesNotExist();

        Job job = manager.getJob(result.jobId()).orElseThrow();
        assertThat(job.getProgress()).isEqualTo(100);
        assertThat(job.getCompletedAt()).isNotNull();
        assertThat(lifecycle.metrics().getCleanupsCompleted().count()).isEqualTo(1.0);
        assertThat(lifecycle.metrics().getBytesFreed().count()).isEqualTo(500.0);
    }

    @Test
    void dryRunReportsButKeepsFiles() throws IOException {
        lifecycle.file(logs, "old.log", 200, 40);
        lifecycle.file(logs, "older.log", 300, 50);
        String policyId = manager.createPolicy(logsPolicy(30, LifecycleAction.DELETE));

        CleanupResult result = manager.executeJob(manager.createJob(
                CleanupJobRequest.builder().policyId(policyId).dryRun(true).build()));

        assertThat(result.success()).isTrue();
        assertThat(result.dryRun()).isTrue();
        assertThat(result.itemsProcessed()).isEqualTo(2);
        assertThat(result.sizeFreed()).isEqualTo(500);
        assertThat(logs.resolve("old.log")).exists();
        assertThat(logs.resolve("older.log")).exists();
        assertThat(lifecycle.metrics().getBytesFreed().count()).isZero();
    }

    @Test
    void cancelStopsBetweenItemsAndKeepsCancelledState() throws Exception {
        var realClock = new TestLifecycle(tempDir.resolve("real"), Clock.systemUTC());
        try {
            var entered = new CountDownLatch(1);
            var release = new CountDownLatch(1);
            var executor = new BlockingExecutor(realClock, 2, entered, release);
            CleanupManager cleanup = realClock.cleanupManager(executor);
            Path dir = Files.createDirectories(realClock.root("logs"));
            for (String name : List.of("a.log", "b.log", "c.log")) {
                realClock.file(dir, name, 10, 40);
            }
            String jobId = cleanup.createJob(CleanupJobRequest.builder()
                    .retentionDays(30).dataTypes(List.of("logs")).action(LifecycleAction.DELETE).build());

            CompletableFuture<CleanupResult> running = CompletableFuture.supplyAsync(() -> cleanup.executeJob(jobId));
            assertThat(entered.await(10, TimeUnit.SECONDS)).isTrue();

            assertThat(cleanup.cancelJob(jobId)).isTrue();
            Job cancelled = cleanup.getJob(jobId).orElseThrow();
            assertThat(cancelled.getStatus()).isEqualTo(JobStatus.CANCELLED);
            assertThat(cancelled.getCompletedAt()).isNotNull();

            release.countDown();
            CleanupResult result = running.get(10, TimeUnit.SECONDS);

            assertThat(result.status()).isEqualTo(JobStatus.CANCELLED);
            Job after = cleanup.getJob(jobId).orElseThrow();
            assertThat(after.getCompletedAt()).isEqualTo(cancelled.getCompletedAt());
            assertThat(after.getDuration()).isEqualTo(cancelled.getDuration());
            try (Stream<Path> remaining = Files.list(dir)) {
                assertThat(remaining).hasSize(1);
            }
            assertThat(cleanup.cancelJob(jobId)).isFalse();
        } finally {
            realClock.close();
        }
    }

    @Test
    void overlappingScheduledRunIsSkipped() throws Exception {
        var entered = new CountDownLatch(1);
        var release = new CountDownLatch(1);
        CleanupManager cleanup = lifecycle.cleanupManager(new BlockingExecutor(lifecycle, 1, entered, release));
        lifecycle.retentionConfig().setMaxStorageSize(10);
        lifecycle.file(logs, "old.log", 10, 40);
        cleanup.createPolicy(logsPolicy(30, LifecycleAction.DELETE));

        CompletableFuture<List<String>> first = CompletableFuture.supplyAsync(cleanup::runScheduledCleanup);
        assertThat(entered.await(10, TimeUnit.SECONDS)).isTrue();
        assertThat(cleanup.isRunning()).isTrue();

        assertThat(cleanup.runScheduledCleanup()).isEmpty();
        assertThat(cleanup.runEmergencyCleanup()).isEmpty();
        assertThat(cleanup.checkStorageAndCleanup()).isFalse();
        assertThat(lifecycle.metrics().getRunsSkipped().count()).isEqualTo(3.0);

        release.countDown();
        assertThat(first.get(10, TimeUnit.SECONDS)).hasSize(1);
        await().atMost(5, TimeUnit.SECONDS).until(() -> !cleanup.isRunning());
        assertThat(cleanup.listJobs()).hasSize(1);
    }

    @Test
    void maxCountRemovesOldestBeyondLimit() throws IOException {
        for (int age = 1; age <= 4; age++) {
            lifecycle.file(logs, "day" + age + ".log", 10, age);
        }
        RetentionPolicy policy = logsPolicy(365, LifecycleAction.DELETE);
        policy.setMaxCount(2);
        String policyId = manager.createPolicy(policy);

        CleanupResult result = manager.executeJob(manager.createJob(
                CleanupJobRequest.builder().policyId(policyId).build()));

        assertThat(result.itemsProcessed()).isEqualTo(2);
        assertThat(logs.resolve("day1.log")).exists();
        assertThat(logs.resolve("day2.log")).exists();
        assertThat(logs.resolve("day3.log")).doesNotExist();
        assertThat(logs.resolve("day4.log")).doesNotExist();
    }

    @Test
    void countOnlyPolicyKeepsTheNewestItems() throws IOException {
        for (int age = 1; age <= 4; age++) {
            lifecycle.file(logs, "day" + age + ".log", 10, age);
        }
        RetentionPolicy policy = logsPolicy(0, LifecycleAction.DELETE);
        policy.setMaxCount(2);
        String policyId = manager.createPolicy(policy);

        CleanupResult result = manager.executeJob(manager.createJob(
                CleanupJobRequest.builder().policyId(policyId).build()));

        assertThat(result.itemsProcessed()).isEqualTo(2);
        assertThat(logs.resolve("day1.log")).exists();
        assertThat(logs.resolve("day2.log")).exists();
        assertThat(logs.resolve("day3.log")).doesNotExist();
        assertThat(logs.resolve("day4.log")).doesNotExist();
    }

    @Test
    void candidatesAreRoutedToFirstMatchingRule() throws IOException {
        lifecycle.file(logs, "scratch.tmp", 10, 40);
        lifecycle.file(logs, "app.log", 20, 40);
        lifecycle.file(logs, "fresh.tmp", 30, 1);
        Path cold = tempDir.resolve("cold");
        var policy = logsPolicy(30, LifecycleAction.DELETE);
        policy.setRules(new ArrayList<>(List.of(
                CleanupRule.builder().id("move-rest").priority(2).action(LifecycleAction.MOVE)
                        .parameters(new HashMap<>(Map.of(ActionExecutor.PARAM_TARGET, cold.toString()))).build(),
                CleanupRule.builder().id("delete-tmp").priority(1).action(LifecycleAction.DELETE)
                        .condition(new RuleCondition("extension", ConditionOperator.EQUALS, "tmp")).build())));
        String policyId = manager.createPolicy(policy);

        CleanupResult result = manager.executeJob(manager.createJob(
                CleanupJobRequest.builder().policyId(policyId).build()));

        assertThat(result.itemsProcessed()).isEqualTo(2);
        assertThat(logs.resolve("scratch.tmp")).doesNotExist();
        assertThat(cold.resolve("scratch.tmp")).doesNotExist();
        assertThat(cold.resolve("app.log")).exists();
        assertThat(logs.resolve("fresh.tmp")).exists();
    }

    @Test
    void unmatchedCandidatesAreCountedButUntouched() throws IOException {
        lifecycle.file(logs, "app.log", 20, 40);
        var policy = logsPolicy(30, LifecycleAction.DELETE);
        policy.getRules().get(0).setCondition(new RuleCondition("extension", ConditionOperator.EQUALS, "tmp"));
        String policyId = manager.createPolicy(policy);

        CleanupResult result = manager.executeJob(manager.createJob(
                CleanupJobRequest.builder().policyId(policyId).build()));

        assertThat(result.itemsProcessed()).isZero();
        assertThat(result.itemsTotal()).isZero();
        assertThat(manager.getJob(result.jobId()).orElseThrow().getMetadata())
                .containsEntry(CleanupManager.META_UNMATCHED, 1);
        assertThat(logs.resolve("app.log")).exists();
    }

    @Test
    void adHocJobAppliesRequestedActionToSourcePath() throws IOException {
        Path exports = Files.createDirectories(lifecycle.baseDir().resolve("exports"));
        lifecycle.file(exports, "report.csv", 4000, 20);

        CleanupResult result = manager.executeJob(manager.createJob(CleanupJobRequest.builder()
                .sourcePath("exports").retentionDays(14).action(LifecycleAction.COMPRESS).build()));

        assertThat(result.itemsProcessed()).isEqualTo(1);
        assertThat(result.policyId()).isNull();
        assertThat(exports.resolve("report.csv.gz")).exists();
        assertThat(exports.resolve("report.csv")).doesNotExist();
    }

    @Test
    void createJobValidatesInput() {
        assertThatThrownBy(() -> manager.createJob(CleanupJobRequest.builder().build()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> manager.createJob(CleanupJobRequest.builder().policyId("missing").build()))
                .isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> manager.createJob(
                CleanupJobRequest.builder().retentionDays(1).sourcePath("does/not/exist").build()))
                .isInstanceOf(SourceNotFoundException.class);
        assertThat(manager.listJobs()).isEmpty();
    }

    @Test
    void finishedJobCannotRunAgainAndRunningJobCannotBeDeleted() throws IOException {
        String jobId = manager.createJob(CleanupJobRequest.builder().retentionDays(30).build());
        manager.executeJob(jobId);

        assertThatThrownBy(() -> manager.executeJob(jobId)).isInstanceOf(InvalidStateException.class);
        assertThat(manager.cancelJob(jobId)).isFalse();
        assertThat(manager.deleteJob(jobId)).isTrue();
        assertThat(manager.getJob(jobId)).isEmpty();
    }

    // ==================== Passes ====================

    @Test
    void emergencyPassHalvesThresholdsWithoutTouchingPolicies() throws IOException {
        lifecycle.file(logs, "ten.log", 10, 10);
        lifecycle.file(logs, "twenty.log", 10, 20);
        lifecycle.file(logs, "forty.log", 10, 40);
        String policyId = manager.createPolicy(logsPolicy(30, LifecycleAction.DELETE));

        List<String> jobIds = manager.runEmergencyCleanup();

        assertThat(jobIds).hasSize(1);
        Job job = manager.getJob(jobIds.get(0)).orElseThrow();
        assertThat(job.getItemsProcessed()).isEqualTo(2);
        assertThat(job.getMetadata()).containsEntry(CleanupManager.META_EFFECTIVE_RETENTION_DAYS, 15);
        assertThat(logs.resolve("ten.log")).exists();
        assertThat(logs.resolve("twenty.log")).doesNotExist();
        assertThat(manager.getPolicy(policyId).orElseThrow().getRetentionDays()).isEqualTo(30);
    }

    @Test
    void scaledThresholdNeverDropsBelowOneDay() {
        assertThat(CleanupManager.scale(1, 0.5)).isEqualTo(1);
        assertThat(CleanupManager.scale(7, 0.5)).isEqualTo(3);
        assertThat(CleanupManager.scale(30, 1.0)).isEqualTo(30);
        assertThat(CleanupManager.scale(0, 0.5)).isZero();
    }

    @Test
    void usageCheckTriggersEmergencyPassAboveThreshold() throws IOException {
        lifecycle.retentionConfig().setMaxStorageSize(1000);
        lifecycle.retentionConfig().getEmergency().setUsageThresholdPercent(50);
        lifecycle.file(logs, "big.log", 400, 20);
        manager.createPolicy(logsPolicy(30, LifecycleAction.DELETE));

        assertThat(manager.checkStorageAndCleanup()).isFalse();

        lifecycle.file(logs, "bigger.log", 300, 2);
        assertThat(manager.checkStorageAndCleanup()).isTrue();
        assertThat(logs.resolve("big.log")).doesNotExist();
        assertThat(logs.resolve("bigger.log")).exists();
    }

    @Test
    void storageUsageGroupsByTypeAndAge() throws IOException {
        lifecycle.retentionConfig().setMaxStorageSize(1000);
        Path temp = Files.createDirectories(lifecycle.root("temp"));
        lifecycle.file(logs, "new.log", 100, 3);
        lifecycle.file(temp, "mid.tmp", 200, 40);
        lifecycle.file(logs, "old.log", 300, 100);

        StorageUsage usage = manager.getStorageUsage();

        assertThat(usage.getUsedBytes()).isEqualTo(600);
        assertThat(usage.getUsagePercent()).isEqualTo(60.0);
        assertThat(usage.getFreeBytes()).isEqualTo(400);
        assertThat(usage.getAvailableBytes()).isEqualTo(300);
        assertThat(usage.getFileCount()).isEqualTo(3);
        assertThat(usage.getByDataType()).containsEntry("logs", 400L).containsEntry("temp", 200L);
        assertThat(usage.getByAge())
                .containsEntry(StorageUsage.AGE_UNDER_7_DAYS, 100L)
                .containsEntry(StorageUsage.AGE_7_TO_30_DAYS, 0L)
                .containsEntry(StorageUsage.AGE_30_TO_90_DAYS, 200L)
                .containsEntry(StorageUsage.AGE_OVER_90_DAYS, 300L);
    }

    @Test
    void deepCleanupPrunesEmptyDirectoriesButKeepsRoots() throws IOException {
        Files.createDirectories(logs.resolve("2023/01/02"));
        Files.createDirectories(logs.resolve("2024/05"));
        lifecycle.file(logs.resolve("2024/05"), "keep.log", 10, 1);

        DeepCleanupResult result = manager.runDeepCleanup();

        assertThat(result.skipped()).isFalse();
        assertThat(result.directoriesRemoved()).isEqualTo(3);
        assertThat(logs).isDirectory();
        assertThat(logs.resolve("2023")).doesNotExist();
        assertThat(logs.resolve("2024/05/keep.log")).exists();
    }

    @Test
    void startSeedsDefaultsOnlyOnce() {
        manager.start();
        manager.start();

        assertThat(manager.listPolicies()).extracting(RetentionPolicy::getId)
                .containsExactlyInAnyOrder("test_results_policy", "logs_policy", "temp_files_policy");
    }

    @Test
    void statisticsFoldJobHistory() throws IOException {
        lifecycle.file(logs, "old.log", 200, 40);
        String policyId = manager.createPolicy(logsPolicy(30, LifecycleAction.DELETE));
        manager.executeJob(manager.createJob(CleanupJobRequest.builder().policyId(policyId).build()));
        manager.createJob(CleanupJobRequest.builder().policyId(policyId).build());

        CleanupStatistics stats = manager.getStatistics();

        assertThat(stats.getTotalJobs()).isEqualTo(2);
        assertThat(stats.getTotalCleanups()).isEqualTo(1);
        assertThat(stats.getTotalItemsProcessed()).isEqualTo(1);
        assertThat(stats.getTotalSizeFreed()).isEqualTo(200);
        assertThat(stats.getSuccessRate()).isEqualTo(100.0);
        assertThat(stats.getActiveJobs()).isEqualTo(1);
        assertThat(stats.getByPolicy()).containsEntry(policyId, 2L);
        assertThat(stats.getByDataType()).containsEntry("logs", 1L);
        assertThat(stats.getDailyTrends()).hasSize(1);
    }

    private static RetentionPolicy logsPolicy(int retentionDays, LifecycleAction action) {
        return RetentionPolicy.builder()
                .name("logs-" + retentionDays)
                .dataTypes(new ArrayList<>(List.of("logs")))
                .retentionDays(retentionDays)
                .rules(new ArrayList<>(List.of(CleanupRule.builder().id("rule").action(action).build())))
                .build();
    }

    /**
     * Blocks inside the n-th item until released.
     */
    private static class BlockingExecutor extends ActionExecutor {

        private final int blockOn;
        private final CountDownLatch entered;
        private final CountDownLatch release;
        private final AtomicInteger calls = new AtomicInteger();

        BlockingExecutor(TestLifecycle lifecycle, int blockOn, CountDownLatch entered, CountDownLatch release) {
            super(lifecycle.archiveBuilder(), lifecycle.archiveDir(), 6);
            this.blockOn = blockOn;
            this.entered = entered;
            this.release = release;
        }

        @Override
        protected long applyToItem(LifecycleAction action, StorageItem item, Map<String, Object> params)
                throws IOException {
            if (calls.incrementAndGet() == blockOn) {
                entered.countDown();
                try {
                    release.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            return super.applyToItem(action, item, params);
        }
    }
}
