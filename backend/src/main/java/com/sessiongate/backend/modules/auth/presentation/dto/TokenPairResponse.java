package com.sessiongate.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import com.sessiongate.backend.modules.auth.domain.TokenPair;

public record TokenPairResponse(
        String accessToken,
        String tokenType,
        long expiresIn,
        String refreshToken,
        long refreshExpiresIn,
        OffsetDateTime issuedAt
) {
    public static final String DEFAULT_TOKEN_TYPE = "Bearer";

    public static TokenPairResponse from(TokenPair tokens) {
        return new TokenPairResponse(
                tokens.accessToken(),
                DEFAULT_TOKEN_TYPE,
                tokens.accessExpiresInSeconds(),
                tokens.refreshToken(),
                tokens.refreshExpiresInSeconds(),
                OffsetDateTime.ofInstant(tokens.issuedAt(), ZoneOffset.UTC)
        );
    }
}
