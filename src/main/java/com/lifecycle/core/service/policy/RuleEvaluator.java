package com.lifecycle.core.service.policy;

import com.lifecycle.core.service.scan.StorageItem;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Matches scanned items against retention rule conditions.
 */
@Slf4j
public class RuleEvaluator {

    public static final String FIELD_AGE_DAYS = "ageDays";
    public static final String FIELD_SIZE = "size";
    public static final String FIELD_NAME = "name";
    public static final String FIELD_PATH = "path";
    public static final String FIELD_DATA_TYPE = "dataType";
    public static final String FIELD_EXTENSION = "extension";

    /**
     * Returns the first enabled rule, in ascending priority, whose condition matches the item.
     */
    public Optional<CleanupRule> firstMatch(List<CleanupRule> rules, StorageItem item, Instant now) {
        return rules.stream()
                .filter(CleanupRule::isEnabled)
                .sorted((a, b) -> Integer.compare(a.getPriority(), b.getPriority()))
                .filter(rule -> matches(rule.getCondition(), item, now))
                .findFirst();
    }

    /**
     * Evaluates one condition. A missing condition matches everything; an unknown
     * field or a type mismatch never matches.
     */
    public boolean matches(RuleCondition condition, StorageItem item, Instant now) {
        if (condition == null || condition.getField() == null || condition.getOperator() == null) {
            return true;
        }
        Object actual = resolve(condition.getField(), item, now);
        if (actual == null) {
            log.debug("Unknown condition field '{}'", condition.getField());
            return false;
        }
        return apply(condition.getOperator(), actual, condition.getValue());
    }

    private Object resolve(String field, StorageItem item, Instant now) {
        String fileName = item.path().getFileName() != null ? item.path().getFileName().toString() : "";
        return switch (field) {
            case FIELD_AGE_DAYS -> item.ageDays(now);
            case FIELD_SIZE -> item.sizeBytes();
            case FIELD_NAME -> fileName;
            case FIELD_PATH -> item.path().toString();
            case FIELD_DATA_TYPE -> item.dataType();
            case FIELD_EXTENSION -> {
                int dot = fileName.lastIndexOf('.');
                yield dot >= 0 ? fileName.substring(dot + 1).toLowerCase(Locale.ROOT) : "";
            }
            default -> null;
        };
    }

    private boolean apply(ConditionOperator operator, Object actual, Object expected) {
        switch (operator) {
            case EQUALS:
                return equalValues(actual, expected);
            case NOT_EQUALS:
                return !equalValues(actual, expected);
            case GREATER_THAN:
            case LESS_THAN:
                Double left = toNumber(actual);
                Double right = toNumber(expected);
                if (left == null || right == null) {
                    return false;
                }
                return operator == ConditionOperator.GREATER_THAN ? left > right : left < right;
            case CONTAINS:
                return expected != null && String.valueOf(actual).contains(String.valueOf(expected));
            case NOT_CONTAINS:
                return expected == null || !String.valueOf(actual).contains(String.valueOf(expected));
            default:
                return false;
        }
    }

    private boolean equalValues(Object actual, Object expected) {
        Double left = toNumber(actual);
        Double right = toNumber(expected);
        if (left != null && right != null) {
            return left.doubleValue() == right.doubleValue();
        }
        return Objects.equals(String.valueOf(actual), String.valueOf(expected));
    }

    private Double toNumber(Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String text) {
            try {
                return Double.parseDouble(text.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
