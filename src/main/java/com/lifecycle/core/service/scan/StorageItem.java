package com.lifecycle.core.service.scan;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

/**
 * A scanned file. Derived on every scan, never persisted.
 */
public record StorageItem(
        Path path,
        String dataType,
        long sizeBytes,
        Instant lastModified
) {

    public Duration age(Instant now) {
        return Duration.between(lastModified, now);
    }

    public double ageDays(Instant now) {
        return age(now).toMillis() / (double) Duration.ofDays(1).toMillis();
    }
}
