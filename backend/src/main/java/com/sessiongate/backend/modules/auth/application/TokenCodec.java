package com.sessiongate.backend.modules.auth.application;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import com.sessiongate.backend.global.config.AuthProperties;
import com.sessiongate.backend.modules.auth.domain.AuthErrorKind;
import com.sessiongate.backend.modules.auth.domain.AuthResult;
import com.sessiongate.backend.modules.auth.domain.TokenClaims;
import com.sessiongate.backend.modules.auth.domain.TokenKind;
import com.sessiongate.backend.modules.auth.domain.TokenPair;
import com.sessiongate.backend.modules.auth.infrastructure.jwt.JwtKeyProvider;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.UnsupportedJwtException;

import org.springframework.stereotype.Service;

/**
 * Issues and verifies the signed access/refresh tokens. Stateless: the only
 * inputs are the configured key, the lifetimes and the clock.
 */
@Service
public class TokenCodec {

    static final String TYPE_CLAIM = "type";

    private final JwtKeyProvider keyProvider;
    private final Duration accessTokenTtl;
    private final Duration refreshTokenTtl;
    private final Clock clock;

    public TokenCodec(JwtKeyProvider keyProvider, AuthProperties properties, Clock clock) {
        this.keyProvider = keyProvider;
        this.accessTokenTtl = properties.accessTokenTtl();
        this.refreshTokenTtl = properties.refreshTokenTtl();
        this.clock = clock;
    }

    public TokenPair issuePair(UUID userId) {
        Instant now = clock.instant();
        return new TokenPair(
                issue(userId, TokenKind.ACCESS, now, accessTokenTtl),
                issue(userId, TokenKind.REFRESH, now, refreshTokenTtl),
                accessTokenTtl.toSeconds(),
                refreshTokenTtl.toSeconds(),
                now
        );
    }

    String issueAccess(UUID userId) {
        return issue(userId, TokenKind.ACCESS, clock.instant(), accessTokenTtl);
    }

    String issueRefresh(UUID userId) {
        return issue(userId, TokenKind.REFRESH, clock.instant(), refreshTokenTtl);
    }

    String issue(UUID userId, TokenKind kind) {
        return kind == TokenKind.ACCESS ? issueAccess(userId) : issueRefresh(userId);
    }

    /**
     * Signs arbitrary claims with {@code iat = now} and {@code exp = now + ttl}. Those two
     * claims are always set here and override any values in {@code claims}.
     */
    public String issue(Map<String, ?> claims, Duration ttl) {
        Instant now = clock.instant();
        return Jwts.builder()
                .claims(claims)
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plus(ttl)))
                .signWith(keyProvider.getSecretKey(), keyProvider.getAlgorithm())
                .compact();
    }

    /**
     * Checks the signature first, then the expiry, then the claim shape. A token
     * that fails any check yields no claims at all.
     */
    public AuthResult<TokenClaims> verify(String token) {
        return parse(token, null);
    }

    /**
     * Verifies the token and additionally requires it to be of {@code expected} kind.
     * A signed token of the wrong kind fails {@code INVALID_TOKEN_TYPE} even when it
     * has also expired.
     */
    public AuthResult<TokenClaims> verify(String token, TokenKind expected) {
        return parse(token, expected).flatMap(claims -> claims.kind() == expected
                ? AuthResult.success(claims)
                : AuthResult.failure(AuthErrorKind.INVALID_TOKEN_TYPE));
    }

    private AuthResult<TokenClaims> parse(String token, TokenKind expected) {
        if (token == null || token.isBlank()) {
            return AuthResult.failure(AuthErrorKind.MALFORMED_TOKEN);
        }
        Claims claims;
        try {
            claims = Jwts.parser()
                    .verifyWith(keyProvider.getSecretKey())
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
        } catch (ExpiredJwtException ex) {
            // signature already verified by the time expiry is checked
            boolean wrongKind = expected != null
                    && kindOf(ex.getClaims()).filter(kind -> kind != expected).isPresent();
            return AuthResult.failure(wrongKind ? AuthErrorKind.INVALID_TOKEN_TYPE : AuthErrorKind.EXPIRED_SIGNATURE);
        } catch (io.jsonwebtoken.security.SecurityException | UnsupportedJwtException ex) {
            return AuthResult.failure(AuthErrorKind.INVALID_SIGNATURE);
        } catch (JwtException | IllegalArgumentException ex) {
            return AuthResult.failure(AuthErrorKind.MALFORMED_TOKEN);
        }
        return toTokenClaims(claims)
                .map(AuthResult::success)
                .orElseGet(() -> AuthResult.failure(AuthErrorKind.MALFORMED_TOKEN));
    }

    private String issue(UUID userId, TokenKind kind, Instant issuedAt, Duration ttl) {
        return Jwts.builder()
                .subject(userId.toString())
                .id(UUID.randomUUID().toString())
                .claim(TYPE_CLAIM, kind.claimValue())
                .issuedAt(Date.from(issuedAt))
                .expiration(Date.from(issuedAt.plus(ttl)))
                .signWith(keyProvider.getSecretKey(), keyProvider.getAlgorithm())
                .compact();
    }

    private static Optional<TokenClaims> toTokenClaims(Claims claims) {
        if (claims.getSubject() == null || claims.getExpiration() == null) {
            return Optional.empty();
        }
        Optional<TokenKind> kind = kindOf(claims);
        if (kind.isEmpty()) {
            return Optional.empty();
        }
        UUID userId;
        try {
            userId = UUID.fromString(claims.getSubject());
        } catch (IllegalArgumentException ex) {
            return Optional.empty();
        }
        Instant issuedAt = claims.getIssuedAt() != null ? claims.getIssuedAt().toInstant() : null;
        return Optional.of(new TokenClaims(userId, kind.get(), issuedAt,
                claims.getExpiration().toInstant(), claims.getId()));
    }

    private static Optional<TokenKind> kindOf(Claims claims) {
        if (claims == null) {
            return Optional.empty();
        }
        Object type = claims.get(TYPE_CLAIM);
        return type instanceof String value ? TokenKind.fromClaim(value) : Optional.empty();
    }
}
