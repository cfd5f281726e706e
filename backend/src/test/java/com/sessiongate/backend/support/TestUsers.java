package com.sessiongate.backend.support;

import java.util.UUID;

import com.sessiongate.backend.modules.auth.domain.AppUser;

import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.test.util.ReflectionTestUtils;

/**
 * Builds detached {@link AppUser} instances with an id, for tests that never touch the database.
 */
public final class TestUsers {

    private TestUsers() {
    }

    public static AppUser user(String username, String rawPassword, PasswordEncoder encoder) {
        return user(username, rawPassword, encoder, false);
    }

    public static AppUser user(String username, String rawPassword, PasswordEncoder encoder, boolean superuser) {
        AppUser user = new AppUser();
        ReflectionTestUtils.setField(user, "id", UUID.randomUUID());
        user.setUsername(username);
        user.setEmail(username + "@example.com");
        user.setPasswordHash(encoder.encode(rawPassword));
        user.setSuperuser(superuser);
        return user;
    }
}
