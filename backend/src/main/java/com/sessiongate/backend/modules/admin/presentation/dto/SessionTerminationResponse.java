package com.sessiongate.backend.modules.admin.presentation.dto;

public record SessionTerminationResponse(String message, int terminated) {
}
