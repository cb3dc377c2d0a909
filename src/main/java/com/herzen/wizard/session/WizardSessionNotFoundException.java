package com.herzen.wizard.session;

public class WizardSessionNotFoundException extends RuntimeException {

    public WizardSessionNotFoundException(String sessionId) {
        super("Unknown wizard session: " + sessionId);
    }
}
