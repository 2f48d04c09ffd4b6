package com.lifecycle.core.service.policy;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/**
 * Rule of a retention policy: when the condition matches, apply the action.
 * A rule without a condition matches every candidate.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CleanupRule {

    private String id;
    private String name;
    private RuleCondition condition;
    private LifecycleAction action;

    /**
     * Action parameters, e.g. {@code target} for move or {@code archivePath} for archive.
     */
    @Builder.Default
    private Map<String, Object> parameters = new HashMap<>();

    private int priority;

    @Builder.Default
    private boolean enabled = true;

    public CleanupRule copy() {
        return toBuilder()
                .condition(condition == null ? null
                        : new RuleCondition(condition.getField(), condition.getOperator(), condition.getValue()))
                .parameters(new HashMap<>(parameters))
                .build();
    }
}
