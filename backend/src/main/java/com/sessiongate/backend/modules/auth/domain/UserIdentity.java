package com.sessiongate.backend.modules.auth.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Read-only snapshot of an account, attached to a request once the access gate
 * has resolved it. Never carries the password hash.
 */
public record UserIdentity(
        UUID id,
        String username,
        String email,
        boolean active,
        boolean superuser,
        boolean verified,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static UserIdentity from(AppUser user) {
        return new UserIdentity(
                user.getId(),
                user.getUsername(),
                user.getEmail(),
                user.isActive(),
                user.isSuperuser(),
                user.isVerified(),
                user.getCreatedAt(),
                user.getUpdatedAt()
        );
    }
}
