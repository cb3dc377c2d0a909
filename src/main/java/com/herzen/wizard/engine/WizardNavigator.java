package com.herzen.wizard.engine;

import com.herzen.wizard.domain.QuestionModels.FlattenedQuestion;
import com.herzen.wizard.domain.QuestionModels.ProgressReport;

import java.util.List;

public final class WizardNavigator {

    private WizardNavigator() {}

    public static Integer findNextIndex(WizardState state) {
        List<FlattenedQuestion> questions = state.getFlattenedQuestions();
        int current = state.getCurrentQuestionIndex();
        if (current >= questions.size() - 1) return null;

        for (int i = current + 1; i < questions.size(); i++) {
            if (!questions.get(i).conditional()) return i;
        }
        return null;
    }

    public static Integer findPrevIndex(WizardState state) {
        List<FlattenedQuestion> questions = state.getFlattenedQuestions();
        int current = state.getCurrentQuestionIndex();
        if (current < 1) return null;

        for (int i = Math.min(current, questions.size()) - 1; i >= 0; i--) {
            if (!questions.get(i).conditional()) return i;
        }
        return null;
    }

    public static boolean next(WizardState state) {
        Integer nextIndex = findNextIndex(state);
        if (nextIndex == null) {
            state.setComplete(true);
            state.setCurrentQuestionIndex(state.getFlattenedQuestions().size());
            return false;
        }
        state.setCurrentQuestionIndex(nextIndex);
        state.markVisited(state.getFlattenedQuestions().get(nextIndex).id());
        return true;
    }

    /** Leaves {@code complete} as it is. */
    public static boolean back(WizardState state) {
        Integer prevIndex = findPrevIndex(state);
        if (prevIndex == null) return false;
        state.setCurrentQuestionIndex(prevIndex);
        return true;
    }

    public static boolean canGoNext(WizardState state) {
        return findNextIndex(state) != null;
    }

    public static boolean canGoBack(WizardState state) {
        return findPrevIndex(state) != null;
    }

    public static ProgressReport getProgress(WizardState state) {
        int total = state.getFlattenedQuestions().size();
        int current = Math.min(state.getCurrentQuestionIndex() + 1, total);
        double percentage = total > 0 ? (double) current / total * 100 : 0;
        return new ProgressReport(current, total, percentage);
    }

    /** Clamps the index to {@code [0, N]} and moves it off conditional entries onto their anchor. */
    static void settle(WizardState state) {
        List<FlattenedQuestion> questions = state.getFlattenedQuestions();
        int index = Math.max(0, Math.min(state.getCurrentQuestionIndex(), questions.size()));
        while (index > 0 && index < questions.size() && questions.get(index).conditional()) {
            index--;
        }
        state.setCurrentQuestionIndex(index);
    }
}
