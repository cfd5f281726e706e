package com.sessiongate.backend.modules.auth.presentation.dto;

public record MessageResponse(String message) {
}
