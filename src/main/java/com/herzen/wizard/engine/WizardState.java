package com.herzen.wizard.engine;

import com.herzen.wizard.domain.QuestionModels.FlattenedQuestion;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** {@code currentQuestionIndex == flattenedQuestions.size()} marks the end. */
public class WizardState {
    private int currentQuestionIndex;
    private final Map<String, Object> answers = new LinkedHashMap<>();
    private List<FlattenedQuestion> flattenedQuestions = List.of();
    private final List<String> visitedQuestions = new ArrayList<>();
    private boolean complete;

    WizardState() {
    }

    public int getCurrentQuestionIndex() {
        return currentQuestionIndex;
    }

    public Map<String, Object> getAnswers() {
        return Collections.unmodifiableMap(answers);
    }

    public List<FlattenedQuestion> getFlattenedQuestions() {
        return flattenedQuestions;
    }

    public List<String> getVisitedQuestions() {
        return Collections.unmodifiableList(visitedQuestions);
    }

    public boolean isComplete() {
        return complete;
    }

    void setCurrentQuestionIndex(int currentQuestionIndex) {
        this.currentQuestionIndex = currentQuestionIndex;
    }

    void setComplete(boolean complete) {
        this.complete = complete;
    }

    void setFlattenedQuestions(List<FlattenedQuestion> flattenedQuestions) {
        this.flattenedQuestions = List.copyOf(flattenedQuestions);
    }

    Map<String, Object> answerStore() {
        return answers;
    }

    void markVisited(String questionId) {
        if (!visitedQuestions.contains(questionId)) {
            visitedQuestions.add(questionId);
        }
    }

    void clearVisited() {
        visitedQuestions.clear();
    }
}
