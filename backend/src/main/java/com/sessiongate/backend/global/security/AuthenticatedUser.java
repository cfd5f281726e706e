package com.sessiongate.backend.global.security;

import java.util.UUID;

public record AuthenticatedUser(UUID userId, String username, boolean superuser) {
}
