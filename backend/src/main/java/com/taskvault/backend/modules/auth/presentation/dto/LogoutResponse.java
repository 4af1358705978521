package com.taskvault.backend.modules.auth.presentation.dto;

import java.util.UUID;

public record LogoutResponse(String message, UUID userId) {
}
