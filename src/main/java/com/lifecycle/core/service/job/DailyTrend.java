package com.lifecycle.core.service.job;

import java.time.LocalDate;

/**
 * Jobs created on one day and the bytes they handled.
 */
public record DailyTrend(LocalDate date, long jobs, long bytes) {
}
