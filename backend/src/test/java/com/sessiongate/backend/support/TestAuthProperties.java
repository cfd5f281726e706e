package com.sessiongate.backend.support;

import java.time.Duration;
import java.util.List;

import com.sessiongate.backend.global.config.AuthProperties;

public final class TestAuthProperties {

    public static final String SECRET = "test-secret-for-session-gate-unit-tests-0123456789";

    private TestAuthProperties() {
    }

    public static AuthProperties defaults() {
        return withSecret(SECRET, "HS256");
    }

    public static AuthProperties withSecret(String secret, String algorithm) {
        return new AuthProperties(
                secret,
                algorithm,
                Duration.ofMinutes(15),
                Duration.ofDays(7),
                routes(),
                new AuthProperties.Cookies(true, "Lax")
        );
    }

    public static AuthProperties.Routes routes() {
        return new AuthProperties.Routes(
                "/login",
                "/auth/refresh",
                "/",
                List.of("/", "/login", "/register", "/auth/login", "/auth/register", "/auth/refresh",
                        "/healthz", "/readyz", "/error"),
                List.of("/static/", "/v3/api-docs", "/swagger-ui", "/actuator/health"),
                List.of("/admin")
        );
    }
}
