package com.lifecycle.core.service.health;

import com.lifecycle.core.service.facade.HealthReport;
import com.lifecycle.core.service.facade.StorageFacade;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for lifecycle storage.
 *
 * Reports each storage flag; DOWN only when the combined check fails.
 */
@Component
@RequiredArgsConstructor
public class LifecycleHealthIndicator implements HealthIndicator {

    private final StorageFacade storageFacade;

    @Override
    public Health health() {
        HealthReport report = storageFacade.healthCheck();

        Health.Builder builder = report.overall()
                ? Health.up()
                : Health.down();

        return builder
                .withDetail("storageReachable", report.storageReachable())
                .withDetail("archiveRootWritable", report.archiveRootWritable())
                .withDetail("cleanupRootWritable", report.cleanupRootWritable())
                .build();
    }
}
