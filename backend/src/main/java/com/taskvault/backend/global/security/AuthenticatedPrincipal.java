package com.taskvault.backend.global.security;

import java.util.UUID;

import com.taskvault.backend.modules.auth.domain.UserRole;

public record AuthenticatedPrincipal(UUID userId, String email, UserRole role) {
}
