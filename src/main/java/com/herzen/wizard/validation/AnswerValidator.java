package com.herzen.wizard.validation;

import com.herzen.wizard.domain.QuestionModels.DateRange;
import com.herzen.wizard.domain.QuestionModels.NumberRange;
import com.herzen.wizard.domain.QuestionModels.Question;
import com.herzen.wizard.domain.QuestionModels.QuestionType;
import com.herzen.wizard.domain.QuestionModels.Validation;
import com.herzen.wizard.domain.QuestionModels.ValidationResult;
import com.herzen.wizard.validation.DateValues.ParsedDate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

@Component
public class AnswerValidator {
    private static final Logger log = LoggerFactory.getLogger(AnswerValidator.class);

    public static final String REQUIRED_MESSAGE = "This question is required";
    public static final String TODAY = "today";

    private final Clock clock;
    private final Map<String, Pattern> patterns = new ConcurrentHashMap<>();

    public AnswerValidator(Clock clock) {
        this.clock = clock;
    }

    public ValidationResult validate(Question question, Object answer) {
        if (isEmpty(answer)) {
            return question.required() ? ValidationResult.invalid(REQUIRED_MESSAGE) : ValidationResult.ok();
        }
        if (!hasExpectedShape(question.type(), answer)) {
            return ValidationResult.invalid(AnswerTypeGuards.mismatchMessage(question.type(), answer));
        }

        Validation rules = question.rules();
        return switch (question.type()) {
            case TEXT -> validateText((String) answer, rules);
            case NUMBER -> validateNumber(((Number) answer).doubleValue(), rules);
            case NUMBER_RANGE -> validateNumberRange(AnswerTypeGuards.asNumberRange(answer), rules);
            case DATE -> validateDate((String) answer, rules);
            case DATE_RANGE -> validateDateRange(AnswerTypeGuards.asDateRange(answer), rules);
            case BOOLEAN, MULTIPLE_CHOICE -> ValidationResult.ok();
        };
    }

    private boolean isEmpty(Object answer) {
        return answer == null || "".equals(answer);
    }

    // Looser than the type guards: range endpoints and date contents are checked by the rules
    // below so that their messages stay specific.
    private boolean hasExpectedShape(QuestionType type, Object answer) {
        return switch (type) {
            case TEXT, DATE -> answer instanceof String;
            case NUMBER -> AnswerTypeGuards.isNumberAnswer(answer);
            case BOOLEAN -> AnswerTypeGuards.isBooleanAnswer(answer);
            case MULTIPLE_CHOICE -> AnswerTypeGuards.isMultipleChoiceAnswer(answer);
            case NUMBER_RANGE -> AnswerTypeGuards.asNumberRange(answer) != null;
            case DATE_RANGE -> AnswerTypeGuards.asDateRange(answer) != null;
        };
    }

    private ValidationResult validateText(String value, Validation rules) {
        if (rules.minLength() != null && value.length() < rules.minLength()) {
            return fail(rules, "Minimum length is " + rules.minLength() + " characters");
        }
        if (rules.maxLength() != null && value.length() > rules.maxLength()) {
            return fail(rules, "Maximum length is " + rules.maxLength() + " characters");
        }
        if (rules.pattern() != null && !rules.pattern().isEmpty()) {
            Optional<Pattern> pattern = compiled(rules.pattern());
            if (pattern.isEmpty()) {
                return ValidationResult.invalid("Invalid validation pattern");
            }
            if (!pattern.get().matcher(value).find()) {
                return fail(rules, "Invalid format");
            }
        }
        return ValidationResult.ok();
    }

    // questions appended at runtime never went through the questionnaire validator
    private Optional<Pattern> compiled(String regex) {
        Pattern cached = patterns.get(regex);
        if (cached != null) return Optional.of(cached);
        try {
            Pattern pattern = Pattern.compile(regex);
            patterns.put(regex, pattern);
            return Optional.of(pattern);
        } catch (PatternSyntaxException e) {
            log.warn("Ignoring answer check against invalid pattern {}: {}", regex, e.getDescription());
            return Optional.empty();
        }
    }

    private ValidationResult validateNumber(double value, Validation rules) {
        if (rules.min() != null && value < rules.min()) {
            return fail(rules, "Minimum value is " + format(rules.min()));
        }
        if (rules.max() != null && value > rules.max()) {
            return fail(rules, "Maximum value is " + format(rules.max()));
        }
        return ValidationResult.ok();
    }

    private ValidationResult validateNumberRange(NumberRange range, Validation rules) {
        if (!AnswerTypeGuards.isNumberRangeAnswer(range)) {
            return ValidationResult.invalid("Both minimum and maximum values are required");
        }
        double min = range.min();
        double max = range.max();
        if (min > max) {
            return ValidationResult.invalid("Minimum value cannot be greater than maximum value");
        }
        if (rules.min() != null && (min < rules.min() || max < rules.min())) {
            return fail(rules, "Values must be at least " + format(rules.min()));
        }
        if (rules.max() != null && (min > rules.max() || max > rules.max())) {
            return fail(rules, "Values must be at most " + format(rules.max()));
        }
        return ValidationResult.ok();
    }

    private ValidationResult validateDate(String value, Validation rules) {
        Optional<ParsedDate> parsed = DateValues.parse(value);
        if (parsed.isEmpty()) {
            return ValidationResult.invalid("Invalid date");
        }
        LocalDate date = parsed.get().utcDate();

        Optional<LocalDate> minDate = resolveBound(rules.minDate());
        if (minDate.isPresent() && date.isBefore(minDate.get())) {
            return fail(rules, "Date must be " + (TODAY.equals(rules.minDate()) ? "today or later" : "after " + rules.minDate()));
        }

        Optional<LocalDate> maxDate = resolveBound(rules.maxDate());
        if (maxDate.isPresent() && date.isAfter(maxDate.get())) {
            return fail(rules, "Date must be " + (TODAY.equals(rules.maxDate()) ? "today or earlier" : "before " + rules.maxDate()));
        }
        return ValidationResult.ok();
    }

    private ValidationResult validateDateRange(DateRange range, Validation rules) {
        if (isBlank(range.start()) || isBlank(range.end())) {
            return ValidationResult.invalid("Both start and end dates are required");
        }

        Optional<ParsedDate> start = DateValues.parse(range.start());
        Optional<ParsedDate> end = DateValues.parse(range.end());
        if (start.isEmpty() || end.isEmpty()) {
            return ValidationResult.invalid("Invalid date format");
        }
        if (start.get().instant().isAfter(end.get().instant())) {
            return ValidationResult.invalid("Start date cannot be after end date");
        }

        ValidationResult startResult = validateDate(range.start(), rules);
        if (!startResult.valid()) {
            return ValidationResult.invalid("Start date: " + startResult.error());
        }
        ValidationResult endResult = validateDate(range.end(), rules);
        if (!endResult.valid()) {
            return ValidationResult.invalid("End date: " + endResult.error());
        }
        return ValidationResult.ok();
    }

    /** A bound that does not parse is ignored here; the questionnaire validator reports it at load time. */
    private Optional<LocalDate> resolveBound(String bound) {
        if (bound == null || bound.isBlank()) return Optional.empty();
        if (TODAY.equals(bound)) return Optional.of(LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC));
        return DateValues.parse(bound).map(ParsedDate::utcDate);
    }

    private ValidationResult fail(Validation rules, String defaultMessage) {
        String custom = rules.customMessage();
        return ValidationResult.invalid(custom == null || custom.isEmpty() ? defaultMessage : custom);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isEmpty();
    }

    static String format(double value) {
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }
}
