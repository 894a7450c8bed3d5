package com.lms.backend.global.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Checks the settings the daemon cannot run without once the context is up.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    private static final String[] REQUIRED_PROPERTIES = {
            "spring.datasource.url",
            "spring.mail.host",
            "lms.reports.directory"
    };

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> missingVars = new ArrayList<>();
        List<String> invalidVars = new ArrayList<>();

        for (String var : REQUIRED_PROPERTIES) {
            Optional<String> value = Optional.ofNullable(environment.getProperty(var));
            if (value.map(String::trim).orElse("").isEmpty()) {
                missingVars.add(var);
            }
        }

        validatePositiveInt("lms.inactivity.threshold-days", invalidVars);
        validatePositiveInt("lms.inactivity.dispatch.workers", invalidVars);

        if (!missingVars.isEmpty() || !invalidVars.isEmpty()) {
            if (!missingVars.isEmpty()) {
                log.error("Missing required settings: {}", String.join(", ", missingVars));
            }
            invalidVars.forEach(message -> log.error("Invalid setting: {}", message));
            throw new IllegalStateException("Environment validation failed: missing=" + missingVars
                    + ", invalid=" + invalidVars);
        }

        log.info("Environment validation passed");
    }

    private void validatePositiveInt(String key, List<String> invalidVars) {
        String raw = environment.getProperty(key);
        if (raw == null) {
            return;
        }
        try {
            if (Integer.parseInt(raw.trim()) <= 0) {
                invalidVars.add(key + ": must be greater than zero");
            }
        } catch (NumberFormatException e) {
            invalidVars.add(key + ": must be a number");
        }
    }
}
