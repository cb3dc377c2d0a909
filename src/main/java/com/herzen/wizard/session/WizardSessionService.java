package com.herzen.wizard.session;

import com.herzen.wizard.config.WizardProperties;
import com.herzen.wizard.domain.QuestionModels.Answer;
import com.herzen.wizard.domain.QuestionModels.WizardConfig;
import com.herzen.wizard.domain.QuestionModels.WizardSnapshot;
import com.herzen.wizard.engine.WizardEngine;
import com.herzen.wizard.engine.WizardState;
import com.herzen.wizard.questionnaire.QuestionnaireRegistry;
import com.herzen.wizard.validation.AnswerValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

@Service
public class WizardSessionService {
    private static final Logger log = LoggerFactory.getLogger(WizardSessionService.class);

    private final QuestionnaireRegistry registry;
    private final AnswerValidator validator;
    private final WizardProperties properties;
    private final Clock clock;

    private final Map<String, WizardSession> sessions = new ConcurrentHashMap<>();

    public WizardSessionService(QuestionnaireRegistry registry,
                                AnswerValidator validator,
                                WizardProperties properties,
                                Clock clock) {
        this.registry = registry;
        this.validator = validator;
        this.properties = properties;
        this.clock = clock;
    }

    public WizardSession start(String wizardId, List<Answer> seedAnswers) {
        WizardEngine engine = newEngine(wizardId);
        List<Answer> seed = seedAnswers == null ? List.of() : seedAnswers;
        return open(wizardId, engine, seed, engine.initState(seed));
    }

    public WizardSession resume(String wizardId, WizardSnapshot snapshot) {
        WizardEngine engine = newEngine(wizardId);
        return open(wizardId, engine, List.of(), engine.restore(snapshot));
    }

    public WizardSession get(String sessionId) {
        return find(sessionId).orElseThrow(() -> new WizardSessionNotFoundException(sessionId));
    }

    public Optional<WizardSession> find(String sessionId) {
        return Optional.ofNullable(sessionId).map(sessions::get);
    }

    public void close(String sessionId) {
        if (sessions.remove(sessionId) != null) {
            log.info("Closed wizard session {}", sessionId);
        }
    }

    public int openSessions() {
        return sessions.size();
    }

    private WizardEngine newEngine(String wizardId) {
        WizardConfig config = registry.require(wizardId);
        return new WizardEngine(config.questions(), validator);
    }

    private synchronized WizardSession open(String wizardId, WizardEngine engine, List<Answer> seed, WizardState state) {
        if (sessions.size() >= properties.getSession().getMaxSessions()) {
            throw new IllegalStateException("Wizard session limit reached: " + properties.getSession().getMaxSessions());
        }
        String sessionId = UUID.randomUUID().toString();
        WizardSession session = new WizardSession(sessionId, wizardId, clock.instant(), engine, seed, state);
        sessions.put(sessionId, session);
        log.info("Started wizard session {} for questionnaire {}", sessionId, wizardId);
        return session;
    }
}
