package com.lifecycle.core.service.archive;

import com.lifecycle.core.service.job.DailyTrend;
import com.lifecycle.core.service.job.JobStatus;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Archive totals folded from the job list.
 */
@Value
@Builder
public class ArchiveStatistics {

    long totalJobs;
    long totalArchives;
    long totalArchivedBytes;
    long totalCompressedBytes;
    double averageCompressionRatio;
    long activeJobs;
    long completedJobs;
    long failedJobs;
    long cancelledJobs;
    Map<JobStatus, Long> byStatus;
    Map<String, Long> byName;
    List<DailyTrend> dailyTrends;
}
