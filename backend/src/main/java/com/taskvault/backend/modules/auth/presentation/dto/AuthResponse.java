package com.taskvault.backend.modules.auth.presentation.dto;

public record AuthResponse(
        boolean success,
        String accessToken,
        String refreshToken,
        String tokenType,
        long expiresIn,
        UserSummary user
) {

    public static AuthResponse of(TokenPairResponse tokens, UserSummary user) {
        return new AuthResponse(
                true,
                tokens.accessToken(),
                tokens.refreshToken(),
                tokens.tokenType(),
                tokens.expiresIn(),
                user
        );
    }
}
