package com.sessiongate.backend.modules.auth.presentation;

import com.sessiongate.backend.global.security.AccessGateFilter;
import com.sessiongate.backend.modules.auth.domain.UserIdentity;
import com.sessiongate.backend.modules.auth.presentation.dto.UserProfileResponse;

import io.swagger.v3.oas.annotations.Operation;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class UserController {

    @Operation(summary = "내 정보 조회", description = "access gate 가 확인한 현재 사용자 정보를 반환한다.")
    @GetMapping("/users/info")
    public ResponseEntity<UserProfileResponse> info(
            @RequestAttribute(AccessGateFilter.IDENTITY_ATTRIBUTE) UserIdentity identity) {
        return ResponseEntity.ok(UserProfileResponse.from(identity));
    }
}
