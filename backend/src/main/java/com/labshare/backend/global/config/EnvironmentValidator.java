package com.labshare.backend.global.config;

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
 * 애플리케이션 시작 시 필수 설정 검증.
 * Missing keys abort startup; risky-but-legal values only produce warnings.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    private static final String[] REQUIRED_KEYS = {
            "spring.datasource.url",
            "jwt.secret",
            "jwt.expiration",
            "app.cors.allowed-origins"
    };

    private static final long MIN_TOKEN_TTL_MILLIS = 60_000L;
    private static final long MAX_TOKEN_TTL_MILLIS = 30L * 24 * 60 * 60 * 1000;

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> problems = new ArrayList<>();

        for (String key : REQUIRED_KEYS) {
            if (valueOf(key).isEmpty()) {
                problems.add(key + ": missing");
            }
        }

        valueOf("jwt.expiration").ifPresent(raw -> {
            try {
                long ttl = Long.parseLong(raw);
                if (ttl < MIN_TOKEN_TTL_MILLIS || ttl > MAX_TOKEN_TTL_MILLIS) {
                    problems.add("jwt.expiration: must be between 60000 and 2592000000 milliseconds");
                }
            } catch (NumberFormatException e) {
                problems.add("jwt.expiration: must be a number of milliseconds");
            }
        });

        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Invalid configuration - {}", problem));
            throw new IllegalStateException("Configuration validation failed: " + String.join("; ", problems));
        }

        if (valueOf("labshare.auth.cleanup.api-key").isEmpty()) {
            log.warn("labshare.auth.cleanup.api-key is not set; the manual cleanup endpoint is disabled");
        }
        if (!environment.getProperty("labshare.auth.cookies.secure", Boolean.class, true)) {
            log.warn("Auth cookies are issued without the Secure flag");
        }
        log.info("Configuration validated");
    }

    private Optional<String> valueOf(String key) {
        return Optional.ofNullable(environment.getProperty(key))
                .map(String::trim)
                .filter(value -> !value.isEmpty());
    }
}
