package com.lifecycle.core.service.cleanup;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Snapshot of managed storage against the configured ceiling.
 */
@Value
@Builder
public class StorageUsage {

    public static final String AGE_UNDER_7_DAYS = "lessThan7Days";
    public static final String AGE_7_TO_30_DAYS = "7to30Days";
    public static final String AGE_30_TO_90_DAYS = "30to90Days";
    public static final String AGE_OVER_90_DAYS = "moreThan90Days";

    long totalBytes;
    long usedBytes;
    long freeBytes;
    double usagePercent;
    long fileCount;
    Map<String, Long> byDataType;
    Map<String, Long> byAge;

    /**
     * Bytes still usable once the safety margin is reserved.
     */
    long availableBytes;
}
