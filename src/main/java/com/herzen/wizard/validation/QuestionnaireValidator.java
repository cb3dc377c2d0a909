package com.herzen.wizard.validation;

import com.herzen.wizard.domain.QuestionModels.Condition;
import com.herzen.wizard.domain.QuestionModels.ConditionOperator;
import com.herzen.wizard.domain.QuestionModels.ConditionalQuestion;
import com.herzen.wizard.domain.QuestionModels.Question;
import com.herzen.wizard.domain.QuestionModels.Validation;
import com.herzen.wizard.domain.QuestionModels.WizardConfig;
import com.herzen.wizard.questionnaire.QuestionnaireModels.ConfigIssue;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;

@Component
public class QuestionnaireValidator {
    public List<ConfigIssue> validate(WizardConfig config) {
        List<ConfigIssue> errors = new ArrayList<>();
        if (config.wizardId() == null || config.wizardId().isBlank()) {
            errors.add(new ConfigIssue("MISSING_WIZARD_ID", "Questionnaire must declare a wizardId", null, true));
        }

        List<Row> rows = new ArrayList<>();
        Deque<Row> pending = new ArrayDeque<>();
        config.questions().forEach(q -> pending.addLast(new Row(q, null)));
        while (!pending.isEmpty()) {
            Row row = pending.pollFirst();
            rows.add(row);
            List<ConditionalQuestion> children = row.question().conditionalQuestions();
            for (int i = children.size() - 1; i >= 0; i--) {
                ConditionalQuestion child = children.get(i);
                checkCondition(child.condition(), row.question().id(), errors);
                if (child.question() == null) {
                    errors.add(new ConfigIssue("MISSING_ID", "Conditional entry under " + row.question().id() + " has no question", row.question().id(), true));
                } else {
                    pending.addFirst(new Row(child.question(), row.question().id()));
                }
            }
        }

        rows.forEach(r -> {
            Question q = r.question();
            if (q.id() == null || q.id().isBlank()) {
                errors.add(new ConfigIssue("MISSING_ID", "Question has no id" + (r.parentId() == null ? "" : " (under " + r.parentId() + ")"), null, true));
            }
            if (q.type() == null) {
                errors.add(new ConfigIssue("MISSING_TYPE", "Question has no supported type: " + q.id(), q.id(), true));
            }
            checkRules(q, errors);
        });

        duplicate(rows, errors);
        return errors;
    }

    private void checkCondition(Condition condition, String anchorId, List<ConfigIssue> errors) {
        if (condition == null) {
            errors.add(new ConfigIssue("MISSING_CONDITION", "Conditional question under " + anchorId + " has no condition", anchorId, true));
            return;
        }
        if (condition.operator() == null) {
            errors.add(new ConfigIssue("UNKNOWN_OPERATOR", "Condition under " + anchorId + " has no supported operator; its question stays hidden", anchorId, false));
            return;
        }
        if (condition.operator() == ConditionOperator.BETWEEN
                && !(condition.value() instanceof List<?> bounds && bounds.size() == 2
                && bounds.stream().allMatch(b -> b instanceof Number))) {
            errors.add(new ConfigIssue("INVALID_BETWEEN", "between expects two numeric bounds under " + anchorId, anchorId, true));
        }
    }

    private void checkRules(Question q, List<ConfigIssue> errors) {
        Validation rules = q.rules();
        if (rules.pattern() != null) {
            try {
                Pattern.compile(rules.pattern());
            } catch (PatternSyntaxException e) {
                errors.add(new ConfigIssue("INVALID_PATTERN", "Pattern does not compile: " + e.getDescription(), q.id(), true));
            }
        }
        for (String bound : Arrays.asList(rules.minDate(), rules.maxDate())) {
            if (bound != null && !AnswerValidator.TODAY.equals(bound) && !DateValues.isValid(bound)) {
                errors.add(new ConfigIssue("INVALID_DATE_BOUND", "Date bound is neither an ISO date nor 'today': " + bound, q.id(), true));
            }
        }
    }

    private void duplicate(List<Row> rows, List<ConfigIssue> errors) {
        Map<String, Long> counts = rows.stream()
                .filter(r -> r.question().id() != null)
                .collect(Collectors.groupingBy(r -> r.question().id(), Collectors.counting()));
        counts.forEach((id, count) -> {
            if (count > 1) {
                errors.add(new ConfigIssue("DUPLICATE_QUESTION", "Duplicate question id: " + id + " (" + count + " occurrences)", id, true));
            }
        });
    }

    private record Row(Question question, String parentId) {}
}
