package com.sessiongate.backend.global.config;

import java.time.Duration;
import java.util.List;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * {@code app.auth.*} settings: signing secret and algorithm, token lifetimes,
 * the routes the access gate redirects to and the cookie attributes.
 */
@Validated
@ConfigurationProperties(prefix = "app.auth")
public record AuthProperties(
        @NotBlank String secret,
        @DefaultValue("HS256") @NotBlank String algorithm,
        @DefaultValue("15m") @NotNull Duration accessTokenTtl,
        @DefaultValue("7d") @NotNull Duration refreshTokenTtl,
        @DefaultValue @Valid Routes routes,
        @DefaultValue @Valid Cookies cookies
) {

    public record Routes(
            @DefaultValue("/login") @NotBlank String login,
            @DefaultValue("/auth/refresh") @NotBlank String refresh,
            @DefaultValue("/") @NotBlank String home,
            @DefaultValue({"/", "/login", "/register", "/auth/login", "/auth/register", "/auth/refresh",
                    "/healthz", "/readyz", "/error"}) List<String> publicPaths,
            @DefaultValue({"/static/", "/v3/api-docs", "/swagger-ui", "/actuator/health"}) List<String> publicPrefixes,
            @DefaultValue("/admin") List<String> adminPrefixes
    ) {
    }

    public record Cookies(
            @DefaultValue("true") boolean secure,
            @DefaultValue("Lax") @NotBlank String sameSite
    ) {
    }
}
