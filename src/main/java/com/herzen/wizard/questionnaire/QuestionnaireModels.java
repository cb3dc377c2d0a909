package com.herzen.wizard.questionnaire;

import java.util.List;

public class QuestionnaireModels {
    /** A problem found in a questionnaire definition; blocking issues keep it from being registered. */
    public record ConfigIssue(String code, String message, String questionId, boolean blocking) {}

    public record RegistrationResult(String wizardId, boolean accepted, List<ConfigIssue> issues) {}
}
