package com.herzen.wizard.questionnaire;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.herzen.wizard.domain.QuestionModels.WizardConfig;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;

/**
 * Reads questionnaire definitions from JSON. Unknown question types and condition operators are
 * read as null so that the validator can report them instead of the parser failing.
 */
@Component
public class QuestionnaireLoader {
    private final ObjectReader reader;

    public QuestionnaireLoader(ObjectMapper objectMapper) {
        this.reader = objectMapper.readerFor(WizardConfig.class)
                .with(DeserializationFeature.READ_UNKNOWN_ENUM_VALUES_AS_NULL)
                .without(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public WizardConfig load(Resource resource) {
        try (InputStream in = resource.getInputStream()) {
            return reader.readValue(in);
        } catch (IOException e) {
            throw new QuestionnaireConfigException("Cannot read questionnaire " + resource.getDescription(), e);
        }
    }

    public WizardConfig parse(String json) {
        try {
            return reader.readValue(json);
        } catch (IOException e) {
            throw new QuestionnaireConfigException("Cannot parse questionnaire definition", e);
        }
    }
}
