package com.lifecycle.core.service.cleanup;

import com.lifecycle.core.service.policy.LifecycleAction;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Parameters for a new cleanup job. Either a policy id or an explicit retention period is required.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CleanupJobRequest {

    private String name;
    private String description;

    /**
     * Retention policy to apply.
     */
    private String policyId;

    /**
     * Directory to clean instead of the policy's data-type roots.
     */
    private String sourcePath;

    /**
     * Overrides the policy's data types.
     */
    @Builder.Default
    private List<String> dataTypes = new ArrayList<>();

    /**
     * Overrides the policy's retention period.
     */
    private Integer retentionDays;

    /**
     * Applies this action to every candidate instead of routing through the policy rules.
     */
    private LifecycleAction action;

    /**
     * Dry run (null = configured default).
     */
    private Boolean dryRun;

    /**
     * Multiplier for age and count thresholds.
     */
    @Builder.Default
    private double thresholdFactor = 1.0;
}
