package com.taskvault.backend.global.config;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Reports missing or suspicious settings once the application is up.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    private static final String[] REQUIRED_KEYS = {
            "spring.datasource.url",
            "jwt.secret"
    };
    private static final Set<String> REVOCATION_STORES = Set.of("memory", "redis");
    private static final int MIN_SECRET_BYTES = 32;

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> problems = validate();
        if (problems.isEmpty()) {
            log.info("Environment validation passed");
            return;
        }
        problems.forEach(problem -> log.warn("Environment check: {}", problem));
    }

    List<String> validate() {
        List<String> problems = new ArrayList<>();

        for (String key : REQUIRED_KEYS) {
            String value = environment.getProperty(key);
            if (value == null || value.isBlank()) {
                problems.add(key + " is not set");
            }
        }

        Optional.ofNullable(environment.getProperty("jwt.secret"))
                .filter(secret -> !secret.startsWith("base64:"))
                .filter(secret -> !secret.isBlank())
                .filter(secret -> secret.getBytes(StandardCharsets.UTF_8).length < MIN_SECRET_BYTES)
                .ifPresent(secret -> problems.add("jwt.secret is shorter than " + MIN_SECRET_BYTES + " bytes"));

        String ttl = environment.getProperty("jwt.access-token-ttl-hours");
        if (ttl != null) {
            try {
                if (Long.parseLong(ttl.trim()) <= 0) {
                    problems.add("jwt.access-token-ttl-hours must be positive");
                }
            } catch (NumberFormatException e) {
                problems.add("jwt.access-token-ttl-hours must be a number");
            }
        }

        String store = environment.getProperty("app.auth.revocation.store", "memory");
        if (!REVOCATION_STORES.contains(store)) {
            problems.add("app.auth.revocation.store must be one of " + REVOCATION_STORES);
        }
        return problems;
    }
}
