package com.herzen.wizard.engine;

import com.herzen.wizard.domain.QuestionModels.Answer;
import com.herzen.wizard.domain.QuestionModels.AnsweredQuestion;
import com.herzen.wizard.domain.QuestionModels.FlattenedQuestion;
import com.herzen.wizard.domain.QuestionModels.Question;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

public final class WizardQueries {

    private WizardQueries() {}

    public static List<Question> getQuestionSet(WizardState state) {
        return getQuestionSet(state, state.getCurrentQuestionIndex());
    }

    /**
     * The entry at {@code index} followed by the contiguous run of visible entries descending from
     * it. Empty when the index is out of bounds.
     */
    public static List<Question> getQuestionSet(WizardState state, int index) {
        List<FlattenedQuestion> questions = state.getFlattenedQuestions();
        if (index < 0 || index >= questions.size()) return List.of();

        FlattenedQuestion anchor = questions.get(index);
        List<Question> set = new ArrayList<>();
        set.add(anchor.question());
        Set<String> members = new HashSet<>();
        members.add(anchor.id());

        for (int i = index + 1; i < questions.size(); i++) {
            FlattenedQuestion entry = questions.get(i);
            if (!entry.conditional() || !members.contains(entry.conditionalParentId())) break;
            set.add(entry.question());
            members.add(entry.id());
        }
        return set;
    }

    public static List<Object> getCurrentAnswers(WizardState state, List<Question> questions) {
        Map<String, Object> answers = state.getAnswers();
        List<Object> values = new ArrayList<>(questions.size());
        for (Question q : questions) {
            values.add(answers.get(q.id()));
        }
        return values;
    }

    public static List<Answer> getAnswers(WizardState state) {
        return state.getAnswers().entrySet().stream()
                .map(e -> new Answer(e.getKey(), e.getValue()))
                .toList();
    }

    /** Includes answers of questions that are currently hidden. */
    public static Map<String, Object> getAnswersObject(WizardState state) {
        return new LinkedHashMap<>(state.getAnswers());
    }

    public static List<AnsweredQuestion> getAnsweredQuestions(WizardState state) {
        Map<String, Object> answers = state.getAnswers();
        return state.getFlattenedQuestions().stream()
                .filter(f -> answers.containsKey(f.id()))
                .map(f -> new AnsweredQuestion(f.question(), answers.get(f.id())))
                .toList();
    }
}
