package com.lifecycle.core.service.policy;

import java.util.List;
import java.util.Map;

/**
 * Policies seeded into an empty store on first start.
 */
public final class DefaultPolicies {

    private DefaultPolicies() {
    }

    public static List<ArchivePolicy> archivePolicies() {
        return List.of(
                ArchivePolicy.builder()
                        .name("Daily data archive")
                        .description("Archives test data every day")
                        .rules(List.of(ArchiveRule.builder()
                                .id("rule1")
                                .name("Archive data older than 30 days")
                                .condition("age > 30 days")
                                .action(LifecycleAction.ARCHIVE)
                                .priority(1)
                                .retentionDays(30)
                                .build()))
                        .schedule("0 2 * * *")
                        .enabled(false)
                        .build(),
                ArchivePolicy.builder()
                        .name("Weekly data cleanup")
                        .description("Removes expired data every week")
                        .rules(List.of(ArchiveRule.builder()
                                .id("rule2")
                                .name("Delete data older than 90 days")
                                .condition("age > 90 days")
                                .action(LifecycleAction.DELETE)
                                .priority(1)
                                .retentionDays(90)
                                .build()))
                        .schedule("0 3 * * 0")
                        .enabled(false)
                        .build()
        );
    }

    public static List<RetentionPolicy> retentionPolicies() {
        return List.of(
                RetentionPolicy.builder()
                        .id("test_results_policy")
                        .name("Test result retention")
                        .description("Archives test results and performance data older than 30 days")
                        .dataTypes(List.of("test_results", "performance_data"))
                        .retentionDays(30)
                        .rules(List.of(CleanupRule.builder()
                                .id("archive_test_results")
                                .name("Archive stale results")
                                .action(LifecycleAction.ARCHIVE)
                                .parameters(Map.of("archivePath", "./archives/test_results", "compressionLevel", 6))
                                .priority(1)
                                .build()))
                        .priority(1)
                        .build(),
                RetentionPolicy.builder()
                        .id("logs_policy")
                        .name("Log file retention")
                        .description("Deletes log files older than 7 days")
                        .dataTypes(List.of("logs"))
                        .retentionDays(7)
                        .rules(List.of(CleanupRule.builder()
                                .id("delete_logs")
                                .name("Delete stale logs")
                                .action(LifecycleAction.DELETE)
                                .priority(1)
                                .build()))
                        .priority(2)
                        .build(),
                RetentionPolicy.builder()
                        .id("temp_files_policy")
                        .name("Temporary file retention")
                        .description("Deletes temporary files older than 1 day")
                        .dataTypes(List.of("temp"))
                        .retentionDays(1)
                        .rules(List.of(CleanupRule.builder()
                                .id("delete_temp")
                                .name("Delete stale temp files")
                                .action(LifecycleAction.DELETE)
                                .priority(1)
                                .build()))
                        .priority(3)
                        .build()
        );
    }
}
