package com.sessiongate.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record RegisterRequest(
        @NotBlank(message = "username is required") @Size(max = 20) String username,
        @NotBlank(message = "email is required") @Email @Size(max = 255) String email,
        @NotBlank(message = "password is required") @Size(min = 8, max = 72) String password
) {
}
