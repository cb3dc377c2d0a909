package com.herzen.wizard.engine;

import com.herzen.wizard.domain.QuestionModels.ConditionalQuestion;
import com.herzen.wizard.domain.QuestionModels.FlattenedQuestion;
import com.herzen.wizard.domain.QuestionModels.Question;
import com.herzen.wizard.domain.QuestionModels.QuestionType;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;

public final class QuestionFlattener {

    private QuestionFlattener() {}

    public static List<FlattenedQuestion> rebuild(List<Question> questions, Map<String, Object> answers) {
        List<FlattenedQuestion> visible = new ArrayList<>();
        Deque<FlattenedQuestion> pending = new ArrayDeque<>();
        pushAll(pending, questions, null);

        while (!pending.isEmpty()) {
            FlattenedQuestion entry = pending.pop();
            visible.add(entry);
            pushAll(pending, visibleChildren(entry.question(), answers), entry.id());
        }
        return visible;
    }

    static List<Question> visibleChildren(Question question, Map<String, Object> answers) {
        List<ConditionalQuestion> children = question.conditionalQuestions();
        if (children.isEmpty()) return List.of();

        if (!answers.containsKey(question.id())) {
            // an unanswered yes/no question shows its whole branch up front
            if (question.type() != QuestionType.BOOLEAN) return List.of();
            return children.stream().map(ConditionalQuestion::question).toList();
        }

        Object answer = answers.get(question.id());
        return children.stream()
                .filter(c -> ConditionEvaluator.evaluate(c.condition(), answer))
                .map(ConditionalQuestion::question)
                .toList();
    }

    // reversed so that entries pop in declaration order
    private static void pushAll(Deque<FlattenedQuestion> pending, List<Question> questions, String parentId) {
        for (int i = questions.size() - 1; i >= 0; i--) {
            pending.push(new FlattenedQuestion(questions.get(i), parentId));
        }
    }
}
