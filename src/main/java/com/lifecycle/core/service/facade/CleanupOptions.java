package com.lifecycle.core.service.facade;

import com.lifecycle.core.service.policy.LifecycleAction;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * How to clean. Unset fields fall back to the policy or configuration.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CleanupOptions {

    private String name;
    private LifecycleAction action;
    private Boolean dryRun;

    public static CleanupOptions defaults() {
        return new CleanupOptions();
    }
}
