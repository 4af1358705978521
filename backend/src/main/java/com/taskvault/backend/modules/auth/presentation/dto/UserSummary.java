package com.taskvault.backend.modules.auth.presentation.dto;

import java.util.UUID;

public record UserSummary(UUID id, String email) {
}
