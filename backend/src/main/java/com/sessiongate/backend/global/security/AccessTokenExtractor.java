package com.sessiongate.backend.global.security;

import java.util.Optional;

import jakarta.servlet.http.HttpServletRequest;

import org.springframework.http.HttpHeaders;

/**
 * Finds the access token on a request: the {@code access_token} cookie wins over
 * an {@code Authorization: Bearer} header.
 */
public final class AccessTokenExtractor {

    private static final String BEARER_PREFIX = "Bearer ";

    private AccessTokenExtractor() {
    }

    public static Optional<String> extract(HttpServletRequest request) {
        Optional<String> fromCookie = AuthCookies.read(request, AuthCookies.ACCESS_TOKEN_COOKIE);
        if (fromCookie.isPresent()) {
            return fromCookie;
        }
        String authorization = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (authorization != null && authorization.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            String token = authorization.substring(BEARER_PREFIX.length()).trim();
            return token.isEmpty() ? Optional.empty() : Optional.of(token);
        }
        return Optional.empty();
    }
}
