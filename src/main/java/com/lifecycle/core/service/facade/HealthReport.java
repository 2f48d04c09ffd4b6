package com.lifecycle.core.service.facade;

/**
 * Component-level health flags. Each flag is independently actionable; {@code overall} is
 * their conjunction.
 */
public record HealthReport(
        boolean storageReachable,
        boolean archiveRootWritable,
        boolean cleanupRootWritable,
        boolean overall
) {

    public static HealthReport of(boolean storageReachable, boolean archiveRootWritable, boolean cleanupRootWritable) {
        return new HealthReport(storageReachable, archiveRootWritable, cleanupRootWritable,
                storageReachable && archiveRootWritable && cleanupRootWritable);
    }
}
