package com.herzen.wizard.session;

import com.herzen.wizard.domain.QuestionModels.Answer;
import com.herzen.wizard.domain.QuestionModels.ValidationResult;

import java.util.List;
import java.util.Map;

public class SessionModels {
    public record SubmitOutcome(List<ValidationResult> results, boolean advanced) {}

    public record WizardCompletion(String sessionId, String wizardId, List<Answer> answers, Map<String, Object> answersObject) {}
}
