package com.herzen.wizard.validation;

import com.herzen.wizard.domain.QuestionModels.DateRange;
import com.herzen.wizard.domain.QuestionModels.NumberRange;
import com.herzen.wizard.domain.QuestionModels.QuestionType;

import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

public final class AnswerTypeGuards {

    public record TypeCheckResult(boolean valid, String errorMessage) {}

    private AnswerTypeGuards() {}

    public static boolean isTextAnswer(Object value) {
        return value instanceof String;
    }

    public static boolean isBooleanAnswer(Object value) {
        return value instanceof Boolean;
    }

    public static boolean isNumberAnswer(Object value) {
        return value instanceof Number n && Double.isFinite(n.doubleValue());
    }

    public static boolean isMultipleChoiceAnswer(Object value) {
        if (value instanceof String) return true;
        return value instanceof List<?> list && list.stream().allMatch(v -> v instanceof String);
    }

    public static boolean isNumberRangeAnswer(Object value) {
        NumberRange range = asNumberRange(value);
        return range != null && isFinite(range.min()) && isFinite(range.max());
    }

    public static boolean isDateAnswer(Object value) {
        return value instanceof String s && DateValues.isValid(s);
    }

    public static boolean isDateRangeAnswer(Object value) {
        DateRange range = asDateRange(value);
        return range != null && DateValues.isValid(range.start()) && DateValues.isValid(range.end());
    }

    public static Predicate<Object> guardFor(QuestionType type) {
        return switch (type) {
            case TEXT -> AnswerTypeGuards::isTextAnswer;
            case BOOLEAN -> AnswerTypeGuards::isBooleanAnswer;
            case NUMBER -> AnswerTypeGuards::isNumberAnswer;
            case MULTIPLE_CHOICE -> AnswerTypeGuards::isMultipleChoiceAnswer;
            case NUMBER_RANGE -> AnswerTypeGuards::isNumberRangeAnswer;
            case DATE -> AnswerTypeGuards::isDateAnswer;
            case DATE_RANGE -> AnswerTypeGuards::isDateRangeAnswer;
        };
    }

    public static TypeCheckResult validateAnswerType(QuestionType type, Object value) {
        if (guardFor(type).test(value)) {
            return new TypeCheckResult(true, null);
        }
        return new TypeCheckResult(false, mismatchMessage(type, value));
    }

    public static String describe(QuestionType type) {
        return switch (type) {
            case TEXT -> "a string";
            case BOOLEAN -> "a boolean";
            case NUMBER -> "a number";
            case MULTIPLE_CHOICE -> "a string or array of strings";
            case NUMBER_RANGE -> "an object with min and max numbers";
            case DATE -> "a valid ISO date string";
            case DATE_RANGE -> "an object with start and end date strings";
        };
    }

    public static String mismatchMessage(QuestionType type, Object value) {
        return "Expected " + describe(type) + ", but received " + runtimeTypeName(value);
    }

    public static String runtimeTypeName(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }

    /** Missing or non-numeric endpoints of a map come back as null. */
    public static NumberRange asNumberRange(Object value) {
        if (value instanceof NumberRange range) return range;
        if (value instanceof Map<?, ?> map) {
            return new NumberRange(toDouble(map.get("min")), toDouble(map.get("max")));
        }
        return null;
    }

    public static DateRange asDateRange(Object value) {
        if (value instanceof DateRange range) return range;
        if (value instanceof Map<?, ?> map) {
            Object start = map.get("start");
            Object end = map.get("end");
            if ((start == null || start instanceof String) && (end == null || end instanceof String)) {
                return new DateRange((String) start, (String) end);
            }
        }
        return null;
    }

    private static Double toDouble(Object value) {
        return value instanceof Number n ? n.doubleValue() : null;
    }

    private static boolean isFinite(Double value) {
        return value != null && Double.isFinite(value);
    }
}
