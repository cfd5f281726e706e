package com.sessiongate.backend.modules.auth.presentation.dto;

import java.util.UUID;

public record RegisterResponse(UUID id, String username, String message) {
}
