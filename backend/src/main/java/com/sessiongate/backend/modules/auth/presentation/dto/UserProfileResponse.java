package com.sessiongate.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.sessiongate.backend.modules.auth.domain.UserIdentity;

public record UserProfileResponse(
        UUID id,
        String username,
        String email,
        boolean isActive,
        boolean isSuperuser,
        boolean isVerified,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static UserProfileResponse from(UserIdentity identity) {
        return new UserProfileResponse(
                identity.id(),
                identity.username(),
                identity.email(),
                identity.active(),
                identity.superuser(),
                identity.verified(),
                identity.createdAt(),
                identity.updatedAt()
        );
    }
}
