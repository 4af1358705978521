package com.taskvault.backend.modules.auth.application;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

public record TokenClaims(
        UUID userId,
        String email,
        TokenType type,
        String tokenId,
        Instant issuedAt,
        Instant expiresAt
) {

    /**
     * Time left before natural expiry, never negative.
     */
    public Duration remainingLifetime(Instant now) {
        Duration left = Duration.between(now, expiresAt);
        return left.isNegative() ? Duration.ZERO : left;
    }
}
