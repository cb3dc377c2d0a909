package com.herzen.wizard.engine;

import com.herzen.wizard.domain.QuestionModels.Condition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Objects;

public final class ConditionEvaluator {
    private static final Logger log = LoggerFactory.getLogger(ConditionEvaluator.class);

    private ConditionEvaluator() {}

    public static boolean evaluate(Condition condition, Object answer) {
        if (condition == null || condition.operator() == null) {
            log.debug("Condition without a supported operator hides its question");
            return false;
        }
        Object operand = condition.value();
        return switch (condition.operator()) {
            case EQUALS -> sameValue(answer, operand);
            case CONTAINS -> answer instanceof Collection<?> items
                    ? items.stream().anyMatch(item -> sameValue(item, operand))
                    : sameValue(answer, operand);
            case GREATER_THAN -> toNumber(answer) > toNumber(operand);
            case LESS_THAN -> toNumber(answer) < toNumber(operand);
            case BETWEEN -> between(answer, operand);
        };
    }

    private static boolean between(Object answer, Object operand) {
        if (!(operand instanceof List<?> bounds) || bounds.size() != 2) return false;
        double value = toNumber(answer);
        return value >= toNumber(bounds.get(0)) && value <= toNumber(bounds.get(1));
    }

    // 5 and 5.0 are the same answer; everything else compares with equals()
    private static boolean sameValue(Object left, Object right) {
        if (left instanceof Number a && right instanceof Number b) {
            return Double.compare(a.doubleValue(), b.doubleValue()) == 0;
        }
        return Objects.equals(left, right);
    }

    /** NaN for anything without a numeric reading, so every comparison with it is false. */
    static double toNumber(Object value) {
        if (value instanceof Number n) return n.doubleValue();
        if (value instanceof Boolean b) return b ? 1 : 0;
        if (value instanceof String s && !s.isBlank()) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                return Double.NaN;
            }
        }
        return Double.NaN;
    }
}
