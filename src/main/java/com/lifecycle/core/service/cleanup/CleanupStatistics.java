package com.lifecycle.core.service.cleanup;

import com.lifecycle.core.service.job.DailyTrend;
import com.lifecycle.core.service.job.JobStatus;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Cleanup totals folded from the job list.
 */
@Value
@Builder
public class CleanupStatistics {

    long totalJobs;
    long totalCleanups;
    long totalItemsProcessed;
    long totalSizeFreed;
    double averageDurationMillis;

    /**
     * Completed jobs as a percentage of finished jobs.
     */
    double successRate;

    long activeJobs;
    Map<JobStatus, Long> byStatus;
    Map<String, Long> byPolicy;
    Map<String, Long> byDataType;
    List<DailyTrend> dailyTrends;
}
