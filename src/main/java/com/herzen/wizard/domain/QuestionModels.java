package com.herzen.wizard.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.List;

public class QuestionModels {

    public enum QuestionType {
        TEXT("text"),
        BOOLEAN("boolean"),
        NUMBER("number"),
        MULTIPLE_CHOICE("multiple-choice"),
        NUMBER_RANGE("number-range"),
        DATE("date"),
        DATE_RANGE("date-range");

        private final String wireName;

        QuestionType(String wireName) {
            this.wireName = wireName;
        }

        @JsonValue
        public String wireName() {
            return wireName;
        }
    }

    public enum ConditionOperator {
        EQUALS("equals"),
        CONTAINS("contains"),
        GREATER_THAN("greaterThan"),
        LESS_THAN("lessThan"),
        BETWEEN("between");

        private final String wireName;

        ConditionOperator(String wireName) {
            this.wireName = wireName;
        }

        @JsonValue
        public String wireName() {
            return wireName;
        }
    }

    public record Option(String value, String label, String image) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Validation(Double min, Double max,
                             Integer minLength, Integer maxLength, String pattern,
                             String minDate, String maxDate,
                             String customMessage) {
        public static final Validation NONE = new Validation(null, null, null, null, null, null, null, null);

        public static Validation range(Double min, Double max) {
            return new Validation(min, max, null, null, null, null, null, null);
        }

        public static Validation length(Integer minLength, Integer maxLength) {
            return new Validation(null, null, minLength, maxLength, null, null, null, null);
        }

        public static Validation matching(String pattern) {
            return new Validation(null, null, null, null, pattern, null, null, null);
        }

        public static Validation dates(String minDate, String maxDate) {
            return new Validation(null, null, null, null, null, minDate, maxDate, null);
        }

        public Validation withCustomMessage(String message) {
            return new Validation(min, max, minLength, maxLength, pattern, minDate, maxDate, message);
        }
    }

    /** For {@link ConditionOperator#BETWEEN} the value is a two-element list {@code [low, high]}. */
    public record Condition(ConditionOperator operator, Object value) {}

    public record ConditionalQuestion(Condition condition, Question question) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Question(String id,
                           QuestionType type,
                           String question,
                           boolean required,
                           String helpText,
                           List<Option> options,
                           Boolean allowMultiple,
                           Validation validation,
                           @JsonProperty("default") Object defaultValue,
                           List<ConditionalQuestion> conditionalQuestions) {
        public Question {
            options = options == null ? List.of() : List.copyOf(options);
            conditionalQuestions = conditionalQuestions == null ? List.of() : List.copyOf(conditionalQuestions);
        }

        public static Question of(String id, QuestionType type, String prompt, boolean required) {
            return new Question(id, type, prompt, required, null, null, null, null, null, null);
        }

        public Question withValidation(Validation rules) {
            return new Question(id, type, question, required, helpText, options, allowMultiple, rules, defaultValue, conditionalQuestions);
        }

        public Question withOptions(List<Option> choices, boolean multiple) {
            return new Question(id, type, question, required, helpText, choices, multiple, validation, defaultValue, conditionalQuestions);
        }

        public Question withConditionals(ConditionalQuestion... children) {
            List<ConditionalQuestion> all = new ArrayList<>(conditionalQuestions);
            all.addAll(List.of(children));
            return new Question(id, type, question, required, helpText, options, allowMultiple, validation, defaultValue, all);
        }

        public Validation rules() {
            return validation == null ? Validation.NONE : validation;
        }
    }

    public record NumberRange(Double min, Double max) {}

    public record DateRange(String start, String end) {}

    public record Answer(String questionId, Object value) {}

    public record AnsweredQuestion(Question question, Object answer) {}

    public record FlattenedQuestion(Question question, String conditionalParentId) {
        public String id() {
            return question.id();
        }

        public boolean conditional() {
            return conditionalParentId != null;
        }
    }

    public record ValidationResult(String questionId, boolean valid, String error) {
        public static ValidationResult ok() {
            return new ValidationResult(null, true, null);
        }

        public static ValidationResult invalid(String error) {
            return new ValidationResult(null, false, error);
        }

        public ValidationResult forQuestion(String id) {
            return new ValidationResult(id, valid, error);
        }
    }

    public record ProgressReport(int current, int total, double percentage) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record WizardConfig(String wizardId, String title, String description, List<Question> questions) {
        public WizardConfig {
            questions = questions == null ? List.of() : List.copyOf(questions);
        }
    }

    public record WizardSnapshot(int currentQuestionIndex,
                                 List<Answer> answers,
                                 List<String> visitedQuestions,
                                 boolean complete) {}
}
