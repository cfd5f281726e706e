package com.sessiongate.backend.modules.admin.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;

import com.sessiongate.backend.modules.auth.domain.AppUser;
import com.sessiongate.backend.modules.auth.domain.AuthErrorKind;
import com.sessiongate.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.sessiongate.backend.support.InMemorySessionStore;
import com.sessiongate.backend.support.TestUsers;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

class AdminSessionServiceTest {

    private final BCryptPasswordEncoder passwordEncoder = new BCryptPasswordEncoder(4);

    private InMemorySessionStore sessionStore;
    private AppUserRepository userRepository;
    private AdminSessionService service;
    private AppUser bob;
    private AppUser alice;

    @BeforeEach
    void setUp() {
        sessionStore = new InMemorySessionStore();
        userRepository = mock(AppUserRepository.class);
        service = new AdminSessionService(sessionStore, userRepository);

        bob = TestUsers.user("bob", "secret123", passwordEncoder);
        alice = TestUsers.user("alice", "secret123", passwordEncoder);
        when(userRepository.findById(any(UUID.class))).thenReturn(Optional.empty());
        when(userRepository.findById(bob.getId())).thenReturn(Optional.of(bob));
        when(userRepository.findById(alice.getId())).thenReturn(Optional.of(alice));
    }

    @Test
    void listsLiveSessionsOrderedByUsername() {
        sessionStore.putMarker(bob.getId().toString());
        sessionStore.putMarker(alice.getId().toString());

        List<ActiveSession> sessions = service.listActiveSessions().orElseThrow();

        assertThat(sessions).extracting(ActiveSession::username).containsExactly("alice", "bob");
        assertThat(sessions).extracting(ActiveSession::userId).containsExactly(alice.getId(), bob.getId());
    }

    @Test
    void skipsOrphanedGarbledAndUnreadableMarkers() {
        sessionStore.putMarker(alice.getId().toString());
        sessionStore.putMarker(UUID.randomUUID().toString());
        sessionStore.putRaw("legacy", "not-a-uuid");
        sessionStore.putMarker(bob.getId().toString());
        sessionStore.failReadsFor(bob.getId().toString());

        List<ActiveSession> sessions = service.listActiveSessions().orElseThrow();

        assertThat(sessions).extracting(ActiveSession::username).containsExactly("alice");
    }

    @Test
    void listingFailsWhenTheScanItselfFails() {
        sessionStore.setUnavailable(true);

        assertThat(service.listActiveSessions().error()).isEqualTo(AuthErrorKind.STORE_UNAVAILABLE);
    }

    @Test
    void terminatingASessionRemovesOnlyThatMarker() {
        sessionStore.putMarker(alice.getId().toString());
        sessionStore.putMarker(bob.getId().toString());

        assertThat(service.terminateSession(alice.getId()).orElseThrow()).isTrue();

        assertThat(sessionStore.contains(alice.getId().toString())).isFalse();
        assertThat(sessionStore.contains(bob.getId().toString())).isTrue();
    }

    @Test
    void terminatingAMissingSessionIsNotAnError() {
        assertThat(service.terminateSession(UUID.randomUUID()).orElseThrow()).isFalse();
    }

    @Test
    void terminateAllDeletesEveryMarkerAndCountsThem() {
        sessionStore.putMarker(alice.getId().toString());
        sessionStore.putMarker(bob.getId().toString());
        sessionStore.putRaw("legacy", "not-a-uuid");

        assertThat(service.terminateAllSessions().orElseThrow()).isEqualTo(3);
        assertThat(sessionStore.size()).isZero();
    }

    @Test
    void terminateAllLeavesALoginThatLandsDuringTheDeletesAlone() {
        sessionStore.putMarker("00-first");
        sessionStore.putMarker("01-second");
        sessionStore.onDelete(() -> sessionStore.putMarker("99-late-login"));

        assertThat(service.terminateAllSessions().orElseThrow()).isEqualTo(2);
        assertThat(sessionStore.contains("99-late-login")).isTrue();
        assertThat(sessionStore.size()).isEqualTo(1);
    }

    @Test
    void terminateAllCountsEachMarkerOnceWhenTheScanRepeatsIt() {
        InMemorySessionStore repeating = new InMemorySessionStore() {
            @Override
            public void scanMarkers(Consumer<String> action) {
                super.scanMarkers(action);
                super.scanMarkers(action);
            }
        };
        repeating.putMarker(alice.getId().toString());
        repeating.putMarker(bob.getId().toString());

        assertThat(new AdminSessionService(repeating, userRepository).terminateAllSessions().orElseThrow())
                .isEqualTo(2);
        assertThat(repeating.size()).isZero();
    }

    @Test
    void terminateAllReportsAnUnreachableStore() {
        sessionStore.setUnavailable(true);

        assertThat(service.terminateAllSessions().error()).isEqualTo(AuthErrorKind.STORE_UNAVAILABLE);
    }
}
