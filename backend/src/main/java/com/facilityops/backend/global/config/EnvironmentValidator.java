package com.facilityops.backend.global.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.facilityops.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * 애플리케이션 시작 시 필수 설정 검증. 누락/오류가 있으면 기동을 중단한다.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    static final int MIN_SECRET_BYTES = JwtTokenProvider.MIN_KEY_BYTES;
    private static final long MIN_ACCESS_TTL_MS = 300_000L;
    private static final long MAX_ACCESS_TTL_MS = 86_400_000L;

    private static final String[] REQUIRED_KEYS = {
            "spring.datasource.url",
            "jwt.secret",
            "jwt.refresh-secret",
            "jwt.expiration",
            "app.cors.allowed-origins"
    };

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> problems = collectProblems();
        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Configuration problem: {}", problem));
            throw new IllegalStateException("Configuration validation failed: " + String.join("; ", problems));
        }
        log.info("Configuration validated");
    }

    List<String> collectProblems() {
        List<String> problems = new ArrayList<>();

        for (String key : REQUIRED_KEYS) {
            if (property(key).isEmpty()) {
                problems.add(key + ": missing");
            }
        }

        Optional<String> accessSecret = property("jwt.secret");
        Optional<String> refreshSecret = property("jwt.refresh-secret");
        accessSecret.filter(EnvironmentValidator::tooShort)
                .ifPresent(secret -> problems.add("jwt.secret: must be at least " + MIN_SECRET_BYTES + " bytes after decoding"));
        refreshSecret.filter(EnvironmentValidator::tooShort)
                .ifPresent(secret -> problems.add("jwt.refresh-secret: must be at least " + MIN_SECRET_BYTES + " bytes after decoding"));
        if (accessSecret.isPresent() && accessSecret.equals(refreshSecret)) {
            problems.add("jwt.refresh-secret: must differ from jwt.secret");
        }

        property("jwt.expiration").ifPresent(raw -> {
            try {
                long expiration = Long.parseLong(raw);
                if (expiration < MIN_ACCESS_TTL_MS || expiration > MAX_ACCESS_TTL_MS) {
                    problems.add("jwt.expiration: must be within 300000-86400000 ms");
                }
            } catch (NumberFormatException e) {
                problems.add("jwt.expiration: must be numeric");
            }
        });
        return problems;
    }

    private Optional<String> property(String key) {
        return Optional.ofNullable(environment.getProperty(key))
                .map(String::trim)
                .filter(value -> !value.isEmpty());
    }

    private static boolean tooShort(String secret) {
        return JwtTokenProvider.decodeSecret(secret).length < MIN_SECRET_BYTES;
    }
}
