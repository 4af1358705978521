package com.taskvault.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.NotNull;

public record RegisterRequest(
        @NotNull(message = "email is required") String email,
        @NotNull(message = "password is required") String password,
        @NotNull(message = "confirmPassword is required") String confirmPassword
) {
}
