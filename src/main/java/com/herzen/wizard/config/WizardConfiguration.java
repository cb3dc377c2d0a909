package com.herzen.wizard.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class WizardConfiguration {

    /** Source of "today" for date bounds; always UTC. */
    @Bean
    public Clock wizardClock() {
        return Clock.systemUTC();
    }
}
