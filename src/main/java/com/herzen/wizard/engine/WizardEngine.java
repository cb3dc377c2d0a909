package com.herzen.wizard.engine;

import com.herzen.wizard.domain.QuestionModels.Answer;
import com.herzen.wizard.domain.QuestionModels.ConditionalQuestion;
import com.herzen.wizard.domain.QuestionModels.Question;
import com.herzen.wizard.domain.QuestionModels.ValidationResult;
import com.herzen.wizard.domain.QuestionModels.WizardSnapshot;
import com.herzen.wizard.validation.AnswerValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

public class WizardEngine {
    private static final Logger log = LoggerFactory.getLogger(WizardEngine.class);

    private final List<Question> questions;
    private final AnswerValidator validator;

    public WizardEngine(List<Question> questions, AnswerValidator validator) {
        this.questions = new ArrayList<>(Objects.requireNonNull(questions, "questions must not be null"));
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
    }

    public List<Question> getQuestions() {
        return Collections.unmodifiableList(questions);
    }

    public WizardState initState() {
        return initState(List.of());
    }

    /** Seed answers are stored as given, without validation. */
    public WizardState initState(List<Answer> answers) {
        WizardState state = new WizardState();
        seed(state, answers);
        rebuild(state);
        return state;
    }

    /**
     * Validates and stores each answer whose question exists anywhere in the forest, then rebuilds
     * the visible list once. Answers for unknown ids are dropped without a result; invalid ones
     * are reported and not stored.
     */
    public List<ValidationResult> answerQuestions(WizardState state, List<Answer> answers) {
        List<ValidationResult> results = new ArrayList<>();
        for (Answer answer : answers) {
            Optional<Question> question = findQuestionById(answer.questionId());
            if (question.isEmpty()) {
                log.debug("Dropping answer for unknown question {}", answer.questionId());
                continue;
            }

            ValidationResult result = validator.validate(question.get(), answer.value())
                    .forQuestion(answer.questionId());
            if (result.valid()) {
                state.answerStore().put(answer.questionId(), answer.value());
            }
            results.add(result);
        }
        rebuild(state);
        return results;
    }

    public void reset(WizardState state) {
        reset(state, List.of());
    }

    public void reset(WizardState state, List<Answer> newAnswers) {
        state.setCurrentQuestionIndex(0);
        state.setComplete(false);
        state.clearVisited();
        state.answerStore().clear();
        seed(state, newAnswers);
        rebuild(state);
    }

    public void addQuestions(WizardState state, List<Question> newQuestions) {
        questions.addAll(newQuestions);
        rebuild(state);
    }

    /** First match in a depth-first walk over the whole forest, conditional questions included. */
    public Optional<Question> findQuestionById(String id) {
        if (id == null) return Optional.empty();
        Deque<Question> pending = new ArrayDeque<>(questions);
        while (!pending.isEmpty()) {
            Question q = pending.pollFirst();
            if (id.equals(q.id())) return Optional.of(q);
            List<ConditionalQuestion> children = q.conditionalQuestions();
            for (int i = children.size() - 1; i >= 0; i--) {
                pending.addFirst(children.get(i).question());
            }
        }
        return Optional.empty();
    }

    public WizardSnapshot snapshot(WizardState state) {
        return new WizardSnapshot(state.getCurrentQuestionIndex(),
                WizardQueries.getAnswers(state),
                List.copyOf(state.getVisitedQuestions()),
                state.isComplete());
    }

    /** Builds a fresh state from a snapshot; the visible list is recomputed from this engine's forest. */
    public WizardState restore(WizardSnapshot snapshot) {
        WizardState state = initState(snapshot.answers() == null ? List.of() : snapshot.answers());
        if (snapshot.visitedQuestions() != null) {
            snapshot.visitedQuestions().forEach(state::markVisited);
        }
        state.setComplete(snapshot.complete());
        state.setCurrentQuestionIndex(snapshot.currentQuestionIndex());
        WizardNavigator.settle(state);
        return state;
    }

    private void seed(WizardState state, List<Answer> answers) {
        if (answers == null) return;
        for (Answer answer : answers) {
            if (answer.questionId() != null) {
                state.answerStore().put(answer.questionId(), answer.value());
            }
        }
    }

    private void rebuild(WizardState state) {
        state.setFlattenedQuestions(QuestionFlattener.rebuild(questions, state.answerStore()));
        WizardNavigator.settle(state);
        int size = state.getFlattenedQuestions().size();
        log.debug("Rebuilt visible questions: {} of {} top-level, {} answers",
                size, questions.size(), state.answerStore().size());
    }
}
