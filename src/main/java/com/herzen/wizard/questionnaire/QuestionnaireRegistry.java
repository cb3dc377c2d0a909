package com.herzen.wizard.questionnaire;

import com.herzen.wizard.config.WizardProperties;
import com.herzen.wizard.domain.QuestionModels.WizardConfig;
import com.herzen.wizard.questionnaire.QuestionnaireModels.ConfigIssue;
import com.herzen.wizard.questionnaire.QuestionnaireModels.RegistrationResult;
import com.herzen.wizard.validation.QuestionnaireValidator;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.core.io.support.ResourcePatternResolver;
import org.springframework.core.io.support.ResourcePatternUtils;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

@Service
public class QuestionnaireRegistry {
    private static final Logger log = LoggerFactory.getLogger(QuestionnaireRegistry.class);

    private final QuestionnaireLoader loader;
    private final QuestionnaireValidator validator;
    private final WizardProperties properties;
    private final ResourcePatternResolver resolver;

    private final Map<String, WizardConfig> configs = new ConcurrentHashMap<>();

    public QuestionnaireRegistry(QuestionnaireLoader loader,
                                 QuestionnaireValidator validator,
                                 WizardProperties properties,
                                 ResourceLoader resourceLoader) {
        this.loader = loader;
        this.validator = validator;
        this.properties = properties;
        this.resolver = ResourcePatternUtils.getResourcePatternResolver(resourceLoader);
    }

    @PostConstruct
    public void loadConfigured() {
        for (String location : properties.getQuestionnaires()) {
            for (Resource resource : resolve(location)) {
                RegistrationResult result = register(loader.load(resource));
                if (!result.accepted()) {
                    String summary = summarize(result.issues());
                    if (properties.isFailOnInvalid()) {
                        throw new QuestionnaireConfigException("Questionnaire " + resource.getDescription() + " rejected: " + summary);
                    }
                    log.warn("Skipping questionnaire {}: {}", resource.getDescription(), summary);
                }
            }
        }
        log.info("Loaded {} questionnaire(s): {}", configs.size(), new TreeSet<>(configs.keySet()));
    }

    public RegistrationResult register(WizardConfig config) {
        List<ConfigIssue> issues = new ArrayList<>(validator.validate(config));
        if (config.wizardId() != null && configs.containsKey(config.wizardId())) {
            issues.add(new ConfigIssue("DUPLICATE_WIZARD_ID", "Questionnaire already registered: " + config.wizardId(), null, true));
        }

        boolean accepted = issues.stream().noneMatch(ConfigIssue::blocking);
        if (accepted) {
            configs.put(config.wizardId(), config);
            if (!issues.isEmpty()) {
                log.warn("Questionnaire {} registered with warnings: {}", config.wizardId(), summarize(issues));
            }
        }
        return new RegistrationResult(config.wizardId(), accepted, issues);
    }

    public Optional<WizardConfig> find(String wizardId) {
        return Optional.ofNullable(wizardId).map(configs::get);
    }

    public WizardConfig require(String wizardId) {
        return find(wizardId).orElseThrow(() -> new QuestionnaireConfigException("Unknown questionnaire: " + wizardId));
    }

    public Set<String> wizardIds() {
        return Set.copyOf(configs.keySet());
    }

    private Resource[] resolve(String location) {
        try {
            return resolver.getResources(location);
        } catch (IOException e) {
            throw new QuestionnaireConfigException("Cannot resolve questionnaire location " + location, e);
        }
    }

    private String summarize(List<ConfigIssue> issues) {
        return issues.stream().map(i -> i.code() + " " + i.message()).reduce((a, b) -> a + "; " + b).orElse("");
    }
}
