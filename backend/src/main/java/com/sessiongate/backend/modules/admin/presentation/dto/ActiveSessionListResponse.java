package com.sessiongate.backend.modules.admin.presentation.dto;

import java.util.List;

public record ActiveSessionListResponse(List<ActiveSessionResponse> sessions, int total) {
}
