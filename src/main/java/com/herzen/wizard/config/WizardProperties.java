package com.herzen.wizard.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "wizard")
public class WizardProperties {

    private List<String> questionnaires = new ArrayList<>(List.of("classpath*:questionnaires/*.json"));
    private boolean failOnInvalid = true;
    private Session session = new Session();

    public List<String> getQuestionnaires() {
        return questionnaires;
    }

    public void setQuestionnaires(List<String> questionnaires) {
        this.questionnaires = questionnaires == null ? new ArrayList<>() : questionnaires;
    }

    public boolean isFailOnInvalid() {
        return failOnInvalid;
    }

    public void setFailOnInvalid(boolean failOnInvalid) {
        this.failOnInvalid = failOnInvalid;
    }

    public Session getSession() {
        return session;
    }

    public void setSession(Session session) {
        this.session = session == null ? new Session() : session;
    }

    public static class Session {
        private int maxSessions = 10_000;

        public int getMaxSessions() {
            return maxSessions;
        }

        public void setMaxSessions(int maxSessions) {
            this.maxSessions = maxSessions;
        }
    }
}
