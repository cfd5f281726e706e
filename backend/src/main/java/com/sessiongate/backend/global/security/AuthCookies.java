package com.sessiongate.backend.global.security;

import java.time.Duration;
import java.util.Arrays;
import java.util.Optional;

import com.sessiongate.backend.global.config.AuthProperties;
import com.sessiongate.backend.modules.auth.domain.TokenPair;

import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseCookie;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Reads and writes the {@code access_token} / {@code refresh_token} cookies.
 */
@Component
public class AuthCookies {

    public static final String ACCESS_TOKEN_COOKIE = "access_token";
    public static final String REFRESH_TOKEN_COOKIE = "refresh_token";

    private final AuthProperties.Cookies settings;

    public AuthCookies(AuthProperties properties) {
        this.settings = properties.cookies();
    }

    public void write(HttpServletResponse response, TokenPair tokens) {
        addCookie(response, ACCESS_TOKEN_COOKIE, tokens.accessToken(),
                Duration.ofSeconds(tokens.accessExpiresInSeconds()));
        addCookie(response, REFRESH_TOKEN_COOKIE, tokens.refreshToken(),
                Duration.ofSeconds(tokens.refreshExpiresInSeconds()));
    }

    public void clear(HttpServletResponse response) {
        addCookie(response, ACCESS_TOKEN_COOKIE, "", Duration.ZERO);
        addCookie(response, REFRESH_TOKEN_COOKIE, "", Duration.ZERO);
    }

    public static Optional<String> read(HttpServletRequest request, String name) {
        Cookie[] cookies = request.getCookies();
        if (cookies == null) {
            return Optional.empty();
        }
        return Arrays.stream(cookies)
                .filter(cookie -> name.equals(cookie.getName()))
                .map(Cookie::getValue)
                .filter(StringUtils::hasText)
                .findFirst();
    }

    private void addCookie(HttpServletResponse response, String name, String value, Duration maxAge) {
        ResponseCookie cookie = ResponseCookie.from(name, value)
                .httpOnly(true)
                .secure(settings.secure())
                .sameSite(settings.sameSite())
                .path("/")
                .maxAge(maxAge)
                .build();
        response.addHeader(HttpHeaders.SET_COOKIE, cookie.toString());
    }
}
