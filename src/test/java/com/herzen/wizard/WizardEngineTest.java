package com.herzen.wizard;

import com.herzen.wizard.domain.QuestionModels.Answer;
import com.herzen.wizard.domain.QuestionModels.AnsweredQuestion;
import com.herzen.wizard.domain.QuestionModels.Condition;
import com.herzen.wizard.domain.QuestionModels.ConditionOperator;
import com.herzen.wizard.domain.QuestionModels.ConditionalQuestion;
import com.herzen.wizard.domain.QuestionModels.ProgressReport;
import com.herzen.wizard.domain.QuestionModels.Question;
import com.herzen.wizard.domain.QuestionModels.QuestionType;
import com.herzen.wizard.domain.QuestionModels.Validation;
import com.herzen.wizard.domain.QuestionModels.ValidationResult;
import com.herzen.wizard.domain.QuestionModels.WizardSnapshot;
import com.herzen.wizard.engine.WizardEngine;
import com.herzen.wizard.engine.WizardNavigator;
import com.herzen.wizard.engine.WizardQueries;
import com.herzen.wizard.engine.WizardState;
import com.herzen.wizard.validation.AnswerValidator;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class WizardEngineTest {
    private final AnswerValidator validator = new AnswerValidator(Clock.systemUTC());

    private static ConditionalQuestion whenTrue(Question question) {
        return new ConditionalQuestion(new Condition(ConditionOperator.EQUALS, true), question);
    }

    private static List<String> ids(List<Question> questions) {
        return questions.stream().map(Question::id).toList();
    }

    private WizardEngine nestedEngine() {
        Question level3 = Question.of("l3", QuestionType.TEXT, "Level 3", false);
        Question level2 = Question.of("l2", QuestionType.BOOLEAN, "Level 2", false).withConditionals(whenTrue(level3));
        Question level1 = Question.of("l1", QuestionType.BOOLEAN, "Level 1", true).withConditionals(whenTrue(level2));
        return new WizardEngine(List.of(level1, Question.of("last", QuestionType.TEXT, "Last", false)), validator);
    }

    @Test
    void answersAndAdvancesThroughTwoQuestions() {
        WizardEngine engine = new WizardEngine(List.of(
                Question.of("q1", QuestionType.TEXT, "Name?", true),
                Question.of("q2", QuestionType.NUMBER, "Age?", true)), validator);
        WizardState state = engine.initState();

        assertEquals(List.of("q1"), ids(WizardQueries.getQuestionSet(state)));
        assertEquals(new ProgressReport(1, 2, 50.0), WizardNavigator.getProgress(state));

        List<ValidationResult> results = engine.answerQuestions(state, List.of(new Answer("q1", "J")));
        assertEquals(1, results.size());
        assertTrue(results.get(0).valid());
        assertEquals("q1", results.get(0).questionId());

        assertTrue(WizardNavigator.next(state));
        assertEquals(new ProgressReport(2, 2, 100.0), WizardNavigator.getProgress(state));
        assertEquals(List.of("q2"), ids(WizardQueries.getQuestionSet(state)));
    }

    @Test
    void reansweringAnEarlierQuestionKeepsTheIndexOffConditionalEntries() {
        Question pets = Question.of("q1", QuestionType.BOOLEAN, "Do you have pets?", true)
                .withConditionals(whenTrue(Question.of("c1", QuestionType.TEXT, "Pet name?", false)));
        WizardEngine engine = new WizardEngine(List.of(
                pets,
                Question.of("q2", QuestionType.TEXT, "Name?", false),
                Question.of("q3", QuestionType.TEXT, "City?", false)), validator);
        WizardState state = engine.initState();
        engine.answerQuestions(state, List.of(new Answer("q1", false)));
        assertTrue(WizardNavigator.next(state));
        assertEquals(1, state.getCurrentQuestionIndex());

        engine.answerQuestions(state, List.of(new Answer("q1", true)));

        int index = state.getCurrentQuestionIndex();
        assertFalse(state.getFlattenedQuestions().get(index).conditional());
        assertEquals(0, index);
        assertEquals(List.of("q1", "c1"), ids(WizardQueries.getQuestionSet(state)));
    }

    @Test
    void appendedQuestionWithBrokenPatternIsReportedNotThrown() {
        WizardEngine engine = new WizardEngine(List.of(Question.of("q1", QuestionType.TEXT, "Name?", false)), validator);
        WizardState state = engine.initState();
        engine.addQuestions(state, List.of(
                Question.of("t", QuestionType.TEXT, "Code?", true).withValidation(Validation.matching("[a-"))));

        List<ValidationResult> results = engine.answerQuestions(state, List.of(new Answer("t", "abc")));

        assertEquals(1, results.size());
        assertFalse(results.get(0).valid());
        assertEquals("Invalid validation pattern", results.get(0).error());
        assertFalse(state.getAnswers().containsKey("t"));
    }

    @Test
    void invalidAnswersAreReportedAndNotStored() {
        WizardEngine engine = new WizardEngine(List.of(Question.of("q2", QuestionType.NUMBER, "Age?", true)), validator);
        WizardState state = engine.initState();

        List<ValidationResult> results = engine.answerQuestions(state, List.of(new Answer("q2", "abc")));

        assertFalse(results.get(0).valid());
        assertEquals("Expected a number, but received String", results.get(0).error());
        assertFalse(state.getAnswers().containsKey("q2"));
    }

    @Test
    void answersForUnknownQuestionsAreDropped() {
        WizardEngine engine = nestedEngine();
        WizardState state = engine.initState();

        List<ValidationResult> results = engine.answerQuestions(state,
                List.of(new Answer("missing", "x"), new Answer("l3", "found nested")));

        assertEquals(1, results.size());
        assertEquals("l3", results.get(0).questionId());
        assertFalse(state.getAnswers().containsKey("missing"));
        assertEquals("found nested", state.getAnswers().get("l3"));
    }

    @Test
    void hiddenAnswersAreKept() {
        WizardEngine engine = nestedEngine();
        WizardState state = engine.initState();
        engine.answerQuestions(state, List.of(
                new Answer("l1", true), new Answer("l2", true), new Answer("l3", "deep")));
        assertEquals(List.of("l1", "l2", "l3"), ids(WizardQueries.getQuestionSet(state)));

        engine.answerQuestions(state, List.of(new Answer("l1", false)));

        assertEquals(List.of("l1", "last"), state.getFlattenedQuestions().stream().map(f -> f.id()).toList());
        Map<String, Object> all = WizardQueries.getAnswersObject(state);
        assertEquals(false, all.get("l1"));
        assertEquals(true, all.get("l2"));
        assertEquals("deep", all.get("l3"));
        assertEquals(List.of("l1"), WizardQueries.getAnsweredQuestions(state).stream()
                .map(AnsweredQuestion::question).map(Question::id).toList());
    }

    @Test
    void questionSetCoversTheWholeVisibleBranch() {
        WizardEngine engine = nestedEngine();
        WizardState state = engine.initState();

        assertEquals(List.of("l1", "l2", "l3"), ids(WizardQueries.getQuestionSet(state)));
        assertEquals(List.of("l2", "l3"), ids(WizardQueries.getQuestionSet(state, 1)));
        assertEquals(List.of("last"), ids(WizardQueries.getQuestionSet(state, 3)));
        assertTrue(WizardQueries.getQuestionSet(state, 4).isEmpty());
        assertTrue(WizardQueries.getQuestionSet(state, -1).isEmpty());

        engine.answerQuestions(state, List.of(new Answer("l2", true)));
        List<Question> set = WizardQueries.getQuestionSet(state);
        assertEquals(Arrays.asList(null, true, null), WizardQueries.getCurrentAnswers(state, set));
    }

    @Test
    void seedAnswersAreStoredInOrder() {
        WizardEngine engine = nestedEngine();
        WizardState state = engine.initState(List.of(new Answer("last", "x"), new Answer("l1", false)));

        assertEquals(List.of(new Answer("last", "x"), new Answer("l1", false)), WizardQueries.getAnswers(state));
        assertEquals(List.of("l1", "last"), state.getFlattenedQuestions().stream().map(f -> f.id()).toList());
        assertEquals(0, state.getCurrentQuestionIndex());
        assertFalse(state.isComplete());
        assertTrue(state.getVisitedQuestions().isEmpty());
    }

    @Test
    void resetStartsOverWithNewAnswers() {
        WizardEngine engine = nestedEngine();
        WizardState state = engine.initState();
        engine.answerQuestions(state, List.of(new Answer("l1", false)));
        while (WizardNavigator.next(state)) {
            // walk to the end
        }
        assertTrue(state.isComplete());

        engine.reset(state, List.of(new Answer("last", "again")));

        assertEquals(0, state.getCurrentQuestionIndex());
        assertFalse(state.isComplete());
        assertTrue(state.getVisitedQuestions().isEmpty());
        assertEquals(Map.of("last", "again"), state.getAnswers());
        assertEquals(4, state.getFlattenedQuestions().size());

        engine.reset(state);
        assertTrue(state.getAnswers().isEmpty());
    }

    @Test
    void addedQuestionsAppendWithoutMovingTheIndex() {
        WizardEngine engine = nestedEngine();
        WizardState state = engine.initState(List.of(new Answer("l1", false)));
        WizardNavigator.next(state);
        assertEquals(1, state.getCurrentQuestionIndex());

        engine.addQuestions(state, List.of(Question.of("extra", QuestionType.DATE, "When?", false)));

        assertEquals(1, state.getCurrentQuestionIndex());
        assertEquals(List.of("last"), state.getVisitedQuestions());
        assertEquals(List.of("l1", "last", "extra"), state.getFlattenedQuestions().stream().map(f -> f.id()).toList());
        assertTrue(WizardNavigator.canGoNext(state));
        assertTrue(engine.findQuestionById("extra").isPresent());
    }

    @Test
    void findsNestedQuestionsById() {
        WizardEngine engine = nestedEngine();

        assertEquals("Level 3", engine.findQuestionById("l3").orElseThrow().question());
        assertTrue(engine.findQuestionById("nope").isEmpty());
        assertTrue(engine.findQuestionById(null).isEmpty());
    }

    @Test
    void snapshotRestoresTheSameProgress() {
        WizardEngine engine = nestedEngine();
        WizardState state = engine.initState();
        engine.answerQuestions(state, List.of(new Answer("l1", true), new Answer("l2", false)));
        WizardNavigator.next(state);

        WizardSnapshot snapshot = engine.snapshot(state);
        WizardState restored = engine.restore(snapshot);

        assertEquals(state.getCurrentQuestionIndex(), restored.getCurrentQuestionIndex());
        assertEquals(state.getAnswers(), restored.getAnswers());
        assertEquals(state.getVisitedQuestions(), restored.getVisitedQuestions());
        assertEquals(state.isComplete(), restored.isComplete());
        assertEquals(state.getFlattenedQuestions(), restored.getFlattenedQuestions());
    }

    @Test
    void restoreMovesOffConditionalEntries() {
        WizardEngine engine = nestedEngine();

        WizardState onChild = engine.restore(new WizardSnapshot(2, List.of(), List.of(), false));
        assertEquals(0, onChild.getCurrentQuestionIndex());

        WizardState pastEnd = engine.restore(new WizardSnapshot(99, List.of(new Answer("l1", false)), List.of("last"), true));
        assertEquals(2, pastEnd.getCurrentQuestionIndex());
        assertTrue(pastEnd.isComplete());
    }
}
