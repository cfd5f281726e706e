package com.sessiongate.backend.modules.auth.application;

import java.util.Optional;
import java.util.UUID;

import com.sessiongate.backend.modules.auth.domain.AppUser;
import com.sessiongate.backend.modules.auth.domain.AuthErrorKind;
import com.sessiongate.backend.modules.auth.domain.AuthResult;
import com.sessiongate.backend.modules.auth.domain.TokenClaims;
import com.sessiongate.backend.modules.auth.domain.TokenKind;
import com.sessiongate.backend.modules.auth.domain.TokenPair;
import com.sessiongate.backend.modules.auth.domain.UserIdentity;
import com.sessiongate.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.sessiongate.backend.modules.auth.infrastructure.redis.SessionStore;
import com.sessiongate.backend.modules.auth.infrastructure.redis.SessionStoreUnavailableException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

/**
 * Login, refresh, identity resolution and logout on top of the single-session
 * marker. A user's tokens are only honoured while their marker exists, so a logout
 * or an administrative termination invalidates everything issued before it.
 */
@Service
public class SessionManager {

    private static final Logger log = LoggerFactory.getLogger(SessionManager.class);

    private static final String DUMMY_PASSWORD = "session-gate-timing-guard";

    private final AppUserRepository userRepository;
    private final SessionStore sessionStore;
    private final TokenCodec tokenCodec;
    private final PasswordEncoder passwordEncoder;
    private final String dummyPasswordHash;

    public SessionManager(
            AppUserRepository userRepository,
            SessionStore sessionStore,
            TokenCodec tokenCodec,
            PasswordEncoder passwordEncoder
    ) {
        this.userRepository = userRepository;
        this.sessionStore = sessionStore;
        this.tokenCodec = tokenCodec;
        this.passwordEncoder = passwordEncoder;
        this.dummyPasswordHash = passwordEncoder.encode(DUMMY_PASSWORD);
    }

    /**
     * Checks the credentials, overwrites the user's marker and issues a fresh pair.
     * Unknown usernames still pay for one hash comparison.
     */
    public AuthResult<TokenPair> login(String username, String password) {
        Optional<AppUser> candidate;
        try {
            candidate = userRepository.findByUsernameIgnoreCase(username);
        } catch (DataAccessException ex) {
            log.error("User lookup failed during login", ex);
            return AuthResult.failure(AuthErrorKind.STORE_UNAVAILABLE);
        }

        if (candidate.isEmpty()) {
            passwordEncoder.matches(password, dummyPasswordHash);
            log.debug("Login rejected: unknown username");
            return AuthResult.failure(AuthErrorKind.NOT_AUTHENTICATED);
        }

        AppUser user = candidate.get();
        if (!passwordEncoder.matches(password, user.getPasswordHash())) {
            log.debug("Login rejected: bad password for user {}", user.getId());
            return AuthResult.failure(AuthErrorKind.NOT_AUTHENTICATED);
        }

        TokenPair tokens = tokenCodec.issuePair(user.getId());
        try {
            sessionStore.putMarker(user.getId().toString());
        } catch (SessionStoreUnavailableException ex) {
            log.error("Could not record session for user {}", user.getId(), ex);
            return AuthResult.failure(AuthErrorKind.STORE_UNAVAILABLE);
        }
        log.info("User {} logged in", user.getId());
        return AuthResult.success(tokens);
    }

    /**
     * Exchanges a refresh token for a new pair. The marker is left as it is, so the
     * old refresh token stays usable until it expires or the session ends.
     */
    public AuthResult<TokenPair> refresh(String refreshToken) {
        return tokenCodec.verify(refreshToken, TokenKind.REFRESH)
                .flatMap(this::requireMatchingMarker)
                .map(claims -> tokenCodec.issuePair(claims.userId()));
    }

    /**
     * Resolves an access token to the account it belongs to. Read-only.
     */
    public AuthResult<UserIdentity> resolveIdentity(String accessToken) {
        return tokenCodec.verify(accessToken, TokenKind.ACCESS)
                .flatMap(this::requireMarker)
                .flatMap(claims -> loadIdentity(claims.userId()));
    }

    /**
     * Deletes the user's marker. Calling it for a user without a session is not an error.
     *
     * @return whether a marker was removed
     */
    public AuthResult<Boolean> logout(UUID userId) {
        try {
            boolean removed = sessionStore.deleteMarker(userId.toString());
            log.info("User {} logged out (session present: {})", userId, removed);
            return AuthResult.success(removed);
        } catch (SessionStoreUnavailableException ex) {
            log.error("Could not delete session for user {}", userId, ex);
            return AuthResult.failure(AuthErrorKind.STORE_UNAVAILABLE);
        }
    }

    private AuthResult<TokenClaims> requireMarker(TokenClaims claims) {
        return readMarker(claims.userId()).flatMap(marker -> marker.isPresent()
                ? AuthResult.success(claims)
                : AuthResult.failure(AuthErrorKind.SESSION_NOT_FOUND));
    }

    private AuthResult<TokenClaims> requireMatchingMarker(TokenClaims claims) {
        String expected = claims.userId().toString();
        return readMarker(claims.userId()).flatMap(marker -> marker.filter(expected::equals).isPresent()
                ? AuthResult.success(claims)
                : AuthResult.failure(AuthErrorKind.SESSION_NOT_FOUND));
    }

    private AuthResult<Optional<String>> readMarker(UUID userId) {
        try {
            return AuthResult.success(sessionStore.findMarker(userId.toString()));
        } catch (SessionStoreUnavailableException ex) {
            log.error("Could not read session for user {}", userId, ex);
            return AuthResult.failure(AuthErrorKind.STORE_UNAVAILABLE);
        }
    }

    private AuthResult<UserIdentity> loadIdentity(UUID userId) {
        try {
            return userRepository.findById(userId)
                    .map(UserIdentity::from)
                    .map(AuthResult::success)
                    .orElseGet(() -> AuthResult.failure(AuthErrorKind.USER_NOT_FOUND));
        } catch (DataAccessException ex) {
            log.error("User lookup failed for {}", userId, ex);
            return AuthResult.failure(AuthErrorKind.STORE_UNAVAILABLE);
        }
    }
}
