package com.sessiongate.backend.modules.admin.application;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import com.sessiongate.backend.modules.auth.domain.AuthErrorKind;
import com.sessiongate.backend.modules.auth.domain.AuthResult;
import com.sessiongate.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.sessiongate.backend.modules.auth.infrastructure.redis.SessionStore;
import com.sessiongate.backend.modules.auth.infrastructure.redis.SessionStoreUnavailableException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * 관리자용 세션 조회/강제 종료.
 * 스캔 도중 개별 항목 조회에 실패하면 해당 항목만 건너뛰고 로그를 남긴다.
 */
@Service
public class AdminSessionService {

    private static final Logger log = LoggerFactory.getLogger(AdminSessionService.class);

    private final SessionStore sessionStore;
    private final AppUserRepository userRepository;

    public AdminSessionService(SessionStore sessionStore, AppUserRepository userRepository) {
        this.sessionStore = sessionStore;
        this.userRepository = userRepository;
    }

    /**
     * Lists every user with a live marker, ordered by username. Markers whose value
     * is not a user id, or whose user no longer exists, are left out.
     */
    public AuthResult<List<ActiveSession>> listActiveSessions() {
        List<ActiveSession> sessions = new ArrayList<>();
        try {
            sessionStore.scanMarkers(userId -> describe(userId).ifPresent(sessions::add));
        } catch (SessionStoreUnavailableException ex) {
            log.error("Session scan aborted after {} entries", sessions.size(), ex);
            return AuthResult.failure(AuthErrorKind.STORE_UNAVAILABLE);
        }
        sessions.sort(Comparator.comparing(ActiveSession::username, String.CASE_INSENSITIVE_ORDER));
        return AuthResult.success(sessions);
    }

    /**
     * @return whether the user had a session to terminate
     */
    public AuthResult<Boolean> terminateSession(UUID userId) {
        try {
            boolean removed = sessionStore.deleteMarker(userId.toString());
            if (removed) {
                log.info("Admin terminated session of user {}", userId);
            } else {
                log.warn("Admin asked to terminate user {} but no session was found", userId);
            }
            return AuthResult.success(removed);
        } catch (SessionStoreUnavailableException ex) {
            log.error("Could not terminate session of user {}", userId, ex);
            return AuthResult.failure(AuthErrorKind.STORE_UNAVAILABLE);
        }
    }

    /**
     * Collects the marker keys with one full scan, then deletes them. A login that lands
     * after the scan has finished is never touched. A login that lands while the scan is
     * still walking the key space may be picked up and deleted with the rest.
     *
     * @return the number of markers deleted
     */
    public AuthResult<Integer> terminateAllSessions() {
        Set<String> snapshot = new LinkedHashSet<>();
        try {
            sessionStore.scanMarkers(snapshot::add);
        } catch (SessionStoreUnavailableException ex) {
            log.error("Session scan aborted after collecting {} sessions", snapshot.size(), ex);
            return AuthResult.failure(AuthErrorKind.STORE_UNAVAILABLE);
        }
        int terminated = 0;
        for (String userIdPart : snapshot) {
            if (deleteQuietly(userIdPart)) {
                terminated++;
            }
        }
        log.info("Admin terminated {} of {} sessions", terminated, snapshot.size());
        return AuthResult.success(terminated);
    }

    private Optional<ActiveSession> describe(String userIdPart) {
        try {
            Optional<String> marker = sessionStore.findMarker(userIdPart);
            if (marker.isEmpty()) {
                return Optional.empty();
            }
            UUID userId = UUID.fromString(marker.get());
            Optional<ActiveSession> session = userRepository.findById(userId)
                    .map(user -> new ActiveSession(user.getId(), user.getUsername()));
            if (session.isEmpty()) {
                log.debug("Skipping session of missing user {}", userId);
            }
            return session;
        } catch (IllegalArgumentException ex) {
            log.warn("Skipping session marker with unexpected value for key part {}", userIdPart);
            return Optional.empty();
        } catch (SessionStoreUnavailableException | DataAccessException ex) {
            log.warn("Skipping session {} after lookup failure", userIdPart, ex);
            return Optional.empty();
        }
    }

    private boolean deleteQuietly(String userIdPart) {
        try {
            return sessionStore.deleteMarker(userIdPart);
        } catch (SessionStoreUnavailableException ex) {
            log.warn("Could not delete session {}", userIdPart, ex);
            return false;
        }
    }
}
