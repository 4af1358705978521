package com.taskvault.backend.global.security;

import java.util.Optional;

import org.springframework.util.StringUtils;

public final class BearerTokens {

    private static final String SCHEME = "Bearer";

    private BearerTokens() {
    }

    /**
     * Extracts the credential from an {@code Authorization} header value.
     * The scheme is matched case-insensitively; anything else yields empty.
     */
    public static Optional<String> extract(String authorizationHeader) {
        if (!StringUtils.hasText(authorizationHeader)) {
            return Optional.empty();
        }
        String header = authorizationHeader.trim();
        if (header.length() <= SCHEME.length()
                || !header.regionMatches(true, 0, SCHEME, 0, SCHEME.length())
                || !Character.isWhitespace(header.charAt(SCHEME.length()))) {
            return Optional.empty();
        }
        String token = header.substring(SCHEME.length()).trim();
        return token.isEmpty() || token.contains(" ") ? Optional.empty() : Optional.of(token);
    }
}
