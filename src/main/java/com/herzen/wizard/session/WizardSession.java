package com.herzen.wizard.session;

import com.herzen.wizard.domain.QuestionModels.Answer;
import com.herzen.wizard.domain.QuestionModels.FlattenedQuestion;
import com.herzen.wizard.domain.QuestionModels.ProgressReport;
import com.herzen.wizard.domain.QuestionModels.Question;
import com.herzen.wizard.domain.QuestionModels.ValidationResult;
import com.herzen.wizard.domain.QuestionModels.WizardSnapshot;
import com.herzen.wizard.engine.WizardEngine;
import com.herzen.wizard.engine.WizardNavigator;
import com.herzen.wizard.engine.WizardQueries;
import com.herzen.wizard.engine.WizardState;
import com.herzen.wizard.session.SessionModels.SubmitOutcome;
import com.herzen.wizard.session.SessionModels.WizardCompletion;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

public class WizardSession {
    private final String sessionId;
    private final String wizardId;
    private final Instant startedAt;
    private final WizardEngine engine;
    private final List<Answer> seedAnswers;
    private final WizardState state;
    private final Map<String, String> validationErrors = new LinkedHashMap<>();

    WizardSession(String sessionId, String wizardId, Instant startedAt,
                  WizardEngine engine, List<Answer> seedAnswers, WizardState state) {
        this.sessionId = sessionId;
        this.wizardId = wizardId;
        this.startedAt = startedAt;
        this.engine = engine;
        this.seedAnswers = List.copyOf(seedAnswers);
        this.state = state;
    }

    public String sessionId() {
        return sessionId;
    }

    public String wizardId() {
        return wizardId;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public synchronized List<Question> currentQuestions() {
        return WizardQueries.getQuestionSet(state);
    }

    public synchronized List<Object> currentAnswers() {
        return WizardQueries.getCurrentAnswers(state, WizardQueries.getQuestionSet(state));
    }

    public synchronized ProgressReport progress() {
        return WizardNavigator.getProgress(state);
    }

    public synchronized boolean canGoNext() {
        return WizardNavigator.canGoNext(state);
    }

    public synchronized boolean canGoBack() {
        return WizardNavigator.canGoBack(state);
    }

    public synchronized boolean isComplete() {
        return state.isComplete();
    }

    /**
     * Stores the answers and moves on only if every answer to a still visible question was valid.
     * Failures on questions hidden by the same submission are dropped.
     */
    public synchronized SubmitOutcome submit(List<Answer> answers) {
        List<ValidationResult> results = engine.answerQuestions(state, answers);
        Set<String> visible = state.getFlattenedQuestions().stream()
                .map(FlattenedQuestion::id)
                .collect(Collectors.toSet());

        boolean advance = true;
        for (ValidationResult result : results) {
            if (result.valid() || !visible.contains(result.questionId())) {
                validationErrors.remove(result.questionId());
            } else {
                validationErrors.put(result.questionId(), result.error());
                advance = false;
            }
        }
        if (advance) {
            WizardNavigator.next(state);
        }
        return new SubmitOutcome(results, advance);
    }

    /**
     * Answers the current question set positionally; questions without a value are submitted as
     * unanswered so that required ones are reported.
     */
    public synchronized SubmitOutcome answerCurrent(List<Object> values) {
        List<Question> questions = WizardQueries.getQuestionSet(state);
        List<Answer> answers = new ArrayList<>(questions.size());
        for (int i = 0; i < questions.size(); i++) {
            answers.add(new Answer(questions.get(i).id(), i < values.size() ? values.get(i) : null));
        }
        return submit(answers);
    }

    public synchronized boolean goBack() {
        return WizardNavigator.back(state);
    }

    public synchronized boolean skip() {
        return WizardNavigator.next(state);
    }

    public synchronized void addQuestions(List<Question> questions) {
        engine.addQuestions(state, questions);
    }

    public synchronized Optional<String> getValidationError(String questionId) {
        return Optional.ofNullable(validationErrors.get(questionId));
    }

    public synchronized Map<String, String> validationErrors() {
        return Map.copyOf(validationErrors);
    }

    public synchronized void clearValidationErrors() {
        validationErrors.clear();
    }

    /** Without new answers the session goes back to the answers it was started with. */
    public synchronized void reset(List<Answer> newAnswers) {
        engine.reset(state, newAnswers == null ? seedAnswers : newAnswers);
        validationErrors.clear();
    }

    public synchronized List<Answer> answers() {
        return WizardQueries.getAnswers(state);
    }

    public synchronized WizardCompletion complete() {
        return new WizardCompletion(sessionId, wizardId, WizardQueries.getAnswers(state), WizardQueries.getAnswersObject(state));
    }

    public synchronized WizardSnapshot snapshot() {
        return engine.snapshot(state);
    }
}
