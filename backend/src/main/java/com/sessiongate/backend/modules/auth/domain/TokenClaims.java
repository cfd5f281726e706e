package com.sessiongate.backend.modules.auth.domain;

import java.time.Instant;
import java.util.UUID;

public record TokenClaims(UUID userId, TokenKind kind, Instant issuedAt, Instant expiresAt, String tokenId) {
}
