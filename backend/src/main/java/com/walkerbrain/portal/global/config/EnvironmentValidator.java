package com.walkerbrain.portal.global.config;

import java.time.Duration;
import java.time.format.DateTimeParseException;
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
 * Checks required settings once the context is ready and refuses to serve with a broken configuration.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    private static final String[] REQUIRED_KEYS = {
            "spring.datasource.url",
            "app.auth.allowed-email-domains",
            "app.cors.allowed-origins"
    };

    private static final String[] DURATION_KEYS = {
            "app.session.ttl",
            "app.session.sweep-interval",
            "app.query.timeout",
            "app.cache.ttl.dictionary",
            "app.cache.ttl.rows",
            "app.cache.ttl.count",
            "app.cache.ttl.aggregate"
    };

    private static final int MIN_TOKEN_BYTES = 32;

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> problems = validate();
        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Configuration problem: {}", problem));
            throw new IllegalStateException("Invalid configuration: " + String.join("; ", problems));
        }
        log.info("Configuration validated");
    }

    List<String> validate() {
        List<String> problems = new ArrayList<>();

        for (String key : REQUIRED_KEYS) {
            String value = Optional.ofNullable(environment.getProperty(key)).map(String::trim).orElse("");
            if (value.isEmpty()) {
                problems.add(key + " is required");
            }
        }

        for (String key : DURATION_KEYS) {
            String raw = environment.getProperty(key);
            if (raw == null) {
                continue;
            }
            try {
                Duration duration = Duration.parse(raw.trim());
                if (duration.isNegative() || duration.isZero()) {
                    problems.add(key + " must be a positive duration");
                }
            } catch (DateTimeParseException e) {
                problems.add(key + " must be an ISO-8601 duration such as PT5M");
            }
        }

        String tokenBytes = environment.getProperty("app.session.token-bytes");
        if (tokenBytes != null) {
            try {
                if (Integer.parseInt(tokenBytes.trim()) < MIN_TOKEN_BYTES) {
                    problems.add("app.session.token-bytes must be at least " + MIN_TOKEN_BYTES);
                }
            } catch (NumberFormatException e) {
                problems.add("app.session.token-bytes must be a number");
            }
        }
        return problems;
    }
}
