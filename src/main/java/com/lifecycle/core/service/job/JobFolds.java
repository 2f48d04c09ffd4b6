package com.lifecycle.core.service.job;

import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.function.ToLongFunction;
import java.util.stream.Collectors;

/**
 * Aggregations over job lists. Statistics are always recomputed from jobs, never stored.
 */
public final class JobFolds {

    private JobFolds() {
    }

    public static Map<JobStatus, Long> countByStatus(List<Job> jobs) {
        Map<JobStatus, Long> counts = new EnumMap<>(JobStatus.class);
        for (JobStatus status : JobStatus.values()) {
            counts.put(status, 0L);
        }
        jobs.forEach(job -> counts.merge(job.getStatus(), 1L, Long::sum));
        return counts;
    }

    public static Map<String, Long> countBy(List<Job> jobs, Function<Job, String> key) {
        return jobs.stream()
                .filter(job -> key.apply(job) != null)
                .collect(Collectors.groupingBy(key, TreeMap::new, Collectors.counting()));
    }

    /**
     * Groups jobs by creation day, oldest day first.
     */
    public static List<DailyTrend> dailyTrends(List<Job> jobs, ToLongFunction<Job> bytes, ZoneId zone) {
        Map<LocalDate, long[]> days = new TreeMap<>();
        for (Job job : jobs) {
            if (job.getCreatedAt() == null) {
                continue;
            }
            long[] totals = days.computeIfAbsent(job.getCreatedAt().atZone(zone).toLocalDate(), d -> new long[2]);
            totals[0]++;
            totals[1] += bytes.applyAsLong(job);
        }
        return days.entrySet().stream()
                .map(e -> new DailyTrend(e.getKey(), e.getValue()[0], e.getValue()[1]))
                .toList();
    }

    public static double averageDurationMillis(List<Job> jobs) {
        return jobs.stream()
                .map(Job::getDuration)
                .flatMap(Optional::stream)
                .mapToLong(Duration::toMillis)
                .average()
                .orElse(0.0);
    }
}
