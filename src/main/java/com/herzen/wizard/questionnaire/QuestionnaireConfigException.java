package com.herzen.wizard.questionnaire;

public class QuestionnaireConfigException extends RuntimeException {

    public QuestionnaireConfigException(String message) {
        super(message);
    }

    public QuestionnaireConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
