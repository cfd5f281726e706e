package com.sessiongate.backend.modules.admin.presentation;

import java.util.List;
import java.util.UUID;

import com.sessiongate.backend.modules.admin.application.AdminSessionService;
import com.sessiongate.backend.modules.admin.presentation.dto.ActiveSessionListResponse;
import com.sessiongate.backend.modules.admin.presentation.dto.ActiveSessionResponse;
import com.sessiongate.backend.modules.admin.presentation.dto.SessionTerminationResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/admin/sessions")
public class AdminSessionController {

    private final AdminSessionService adminSessionService;

    public AdminSessionController(AdminSessionService adminSessionService) {
        this.adminSessionService = adminSessionService;
    }

    @Operation(summary = "활성 세션 목록", description = "세션 마커가 남아 있는 사용자 목록을 조회한다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "조회 성공"),
            @ApiResponse(responseCode = "403", description = "관리자 권한 필요")
    })
    @GetMapping
    public ResponseEntity<ActiveSessionListResponse> listSessions() {
        List<ActiveSessionResponse> sessions = adminSessionService.listActiveSessions().orElseThrow().stream()
                .map(ActiveSessionResponse::from)
                .toList();
        return ResponseEntity.ok(new ActiveSessionListResponse(sessions, sessions.size()));
    }

    @Operation(summary = "사용자 세션 강제 종료", description = "지정한 사용자의 세션을 종료한다. 세션이 없어도 성공으로 응답한다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "종료 처리"),
            @ApiResponse(responseCode = "403", description = "관리자 권한 필요")
    })
    @DeleteMapping("/{userId}")
    public ResponseEntity<SessionTerminationResponse> terminateSession(@PathVariable UUID userId) {
        boolean removed = adminSessionService.terminateSession(userId).orElseThrow();
        String message = removed ? "Session terminated" : "No active session";
        return ResponseEntity.ok(new SessionTerminationResponse(message, removed ? 1 : 0));
    }

    @Operation(summary = "전체 세션 강제 종료", description = "모든 사용자의 세션을 종료한다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "종료 처리"),
            @ApiResponse(responseCode = "403", description = "관리자 권한 필요")
    })
    @DeleteMapping
    public ResponseEntity<SessionTerminationResponse> terminateAllSessions() {
        int terminated = adminSessionService.terminateAllSessions().orElseThrow();
        return ResponseEntity.ok(new SessionTerminationResponse("All sessions terminated", terminated));
    }
}
