package com.lifecycle.core.service.cleanup;

import java.util.List;

/**
 * @param jobIds jobs run for the enabled policies
 * @param directoriesRemoved empty directories pruned afterwards
 * @param skipped true when another cleanup run held the single-flight guard
 */
public record DeepCleanupResult(List<String> jobIds, int directoriesRemoved, boolean skipped) {
}
