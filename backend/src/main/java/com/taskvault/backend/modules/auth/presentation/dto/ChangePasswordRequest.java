package com.taskvault.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.NotNull;

public record ChangePasswordRequest(
        @NotNull(message = "currentPassword is required") String currentPassword,
        @NotNull(message = "newPassword is required") String newPassword,
        @NotNull(message = "confirmPassword is required") String confirmPassword
) {
}
