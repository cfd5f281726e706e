package com.sessiongate.backend.modules.admin.presentation.dto;

import java.util.UUID;

import com.sessiongate.backend.modules.admin.application.ActiveSession;

public record ActiveSessionResponse(UUID userId, String username) {

    public static ActiveSessionResponse from(ActiveSession session) {
        return new ActiveSessionResponse(session.userId(), session.username());
    }
}
