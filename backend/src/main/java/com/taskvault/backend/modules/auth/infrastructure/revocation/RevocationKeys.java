package com.taskvault.backend.modules.auth.infrastructure.revocation;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.UUID;

/**
 * Store keys for revocation entries. Tokens are keyed by their SHA-256 so raw bearer
 * credentials never land in the store.
 */
final class RevocationKeys {

    static final String TOKEN_PREFIX = "revoked_token:";
    static final String USER_PREFIX = "user_logout:";

    private RevocationKeys() {
    }

    static String forToken(String token) {
        return TOKEN_PREFIX + sha256Hex(token);
    }

    static String forUser(UUID userId) {
        return USER_PREFIX + userId;
    }

    private static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }
}
