package com.lifecycle.core.service.policy;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A single field/operator/value test against a scanned item.
 *
 * Supported fields: ageDays, size, name, path, dataType, extension.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RuleCondition {

    private String field;
    private ConditionOperator operator;
    private Object value;

    public static RuleCondition olderThanDays(int days) {
        return new RuleCondition(RuleEvaluator.FIELD_AGE_DAYS, ConditionOperator.GREATER_THAN, days);
    }
}
