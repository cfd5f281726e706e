package com.sessiongate.backend.modules.auth.presentation.dto;

/**
 * Body of {@code POST /auth/refresh}. The token may instead come from the refresh cookie.
 */
public record RefreshRequest(String refreshToken) {
}
