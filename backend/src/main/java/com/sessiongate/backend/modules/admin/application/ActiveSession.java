package com.sessiongate.backend.modules.admin.application;

import java.util.UUID;

public record ActiveSession(UUID userId, String username) {
}
