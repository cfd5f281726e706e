package com.sessiongate.backend.global.config;

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
 * 애플리케이션 기동 시 필수 설정 검증. 누락되거나 잘못된 값이 있으면 기동을 중단한다.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    static final String DEV_SECRET = "dev-only-session-gate-secret-change-me-before-deploying";

    private static final String[] REQUIRED_PROPERTIES = {
            "spring.datasource.url",
            "spring.data.redis.host",
            "app.auth.secret"
    };

    private final Environment environment;
    private final AuthProperties authProperties;

    public EnvironmentValidator(Environment environment, AuthProperties authProperties) {
        this.environment = environment;
        this.authProperties = authProperties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> problems = new ArrayList<>();

        for (String property : REQUIRED_PROPERTIES) {
            Optional<String> value = Optional.ofNullable(environment.getProperty(property));
            if (value.map(String::trim).orElse("").isEmpty()) {
                problems.add(property + ": 필수 설정이 비어 있습니다");
            }
        }

        if (authProperties.accessTokenTtl().isNegative() || authProperties.accessTokenTtl().isZero()) {
            problems.add("app.auth.access-token-ttl: 0보다 커야 합니다");
        }
        if (authProperties.refreshTokenTtl().compareTo(authProperties.accessTokenTtl()) <= 0) {
            problems.add("app.auth.refresh-token-ttl: access-token-ttl 보다 길어야 합니다");
        }

        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Environment validation failed: {}", problem));
            throw new IllegalStateException("Environment validation failed: " + String.join(", ", problems));
        }

        if (DEV_SECRET.equals(authProperties.secret())) {
            log.warn("app.auth.secret is the development default; set AUTH_SECRET before deploying");
        }
        log.info("Environment validation passed");
    }
}
