package com.sessiongate.backend.modules.auth.domain;

import java.time.Instant;

public record TokenPair(
        String accessToken,
        String refreshToken,
        long accessExpiresInSeconds,
        long refreshExpiresInSeconds,
        Instant issuedAt
) {
}
