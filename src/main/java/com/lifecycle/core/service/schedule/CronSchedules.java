package com.lifecycle.core.service.schedule;

import com.lifecycle.core.service.exception.InvalidScheduleException;
import org.springframework.scheduling.support.CronExpression;

/**
 * Cron parsing helpers. Accepts 5-field (minute first) and 6-field (seconds first) expressions.
 */
public final class CronSchedules {

    private CronSchedules() {
    }

    /**
     * Converts a 5-field expression to Spring's 6-field form by prefixing a zero seconds field.
     */
    public static String normalize(String expression) {
        if (expression == null) {
            return null;
        }
        String trimmed = expression.trim().replaceAll("\\s+", " ");
        return trimmed.split(" ").length == 5 ? "0 " + trimmed : trimmed;
    }

    /**
     * @return the parsed expression
     * @throws InvalidScheduleException if the expression is blank or malformed
     */
    public static CronExpression validate(String ownerId, String expression) {
        if (expression == null || expression.isBlank()) {
            throw new InvalidScheduleException(ownerId, expression, null);
        }
        try {
            return CronExpression.parse(normalize(expression));
        } catch (IllegalArgumentException e) {
            throw new InvalidScheduleException(ownerId, expression, e);
        }
    }

    public static boolean isValid(String expression) {
        if (expression == null || expression.isBlank()) {
            return false;
        }
        return CronExpression.isValidExpression(normalize(expression));
    }
}
