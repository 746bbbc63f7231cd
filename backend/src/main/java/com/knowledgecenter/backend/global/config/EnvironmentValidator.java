package com.knowledgecenter.backend.global.config;

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
 * Fails startup when required settings are missing or unsafe.
 * Key length is enforced earlier, when {@code JwtTokenProvider} is created.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    static final String PLACEHOLDER_SECRET = "change-me-to-a-random-secret-of-32-bytes-or-more";

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> problems = validate();
        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Environment validation failed: {}", problem));
            throw new IllegalStateException("Invalid environment configuration: " + String.join("; ", problems));
        }
        log.info("Environment validation passed (app.env={})", environment.getProperty("app.env", "local"));
    }

    List<String> validate() {
        List<String> problems = new ArrayList<>();

        String[] requiredVars = {
            "spring.datasource.url",
            "app.env"
        };
        for (String var : requiredVars) {
            Optional<String> value = Optional.ofNullable(environment.getProperty(var));
            if (value.map(String::trim).orElse("").isEmpty()) {
                problems.add("missing required property " + var);
            }
        }

        Optional<String> jwtSecret = Optional.ofNullable(environment.getProperty("jwt.secret"))
                .filter(secret -> !secret.isBlank());
        if (jwtSecret.filter(PLACEHOLDER_SECRET::equals).isPresent()) {
            problems.add("jwt.secret still holds the placeholder value");
        }
        if (jwtSecret.isEmpty()) {
            problems.add("missing required property jwt.secret");
        }

        String maxConcurrent = environment.getProperty("app.security.password-hashing.max-concurrent");
        if (maxConcurrent != null && !maxConcurrent.isBlank()) {
            try {
                if (Integer.parseInt(maxConcurrent.trim()) < 0) {
                    problems.add("app.security.password-hashing.max-concurrent must be >= 0");
                }
            } catch (NumberFormatException e) {
                problems.add("app.security.password-hashing.max-concurrent must be a number");
            }
        }
        return problems;
    }
}
