package com.taskvault.backend.modules.auth.infrastructure.jwt;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * HMAC signing key derived from {@code jwt.secret}.
 *
 * <p>A {@code base64:} prefix selects decoded bytes. Secrets shorter than 32 bytes are accepted
 * with a warning and stretched through SHA-256 so HS256 always gets a 256-bit key.
 */
@Component
public class JwtTokenProvider {

    private static final Logger log = LoggerFactory.getLogger(JwtTokenProvider.class);

    public static final int RECOMMENDED_SECRET_BYTES = 32;
    private static final String HMAC_SHA_256 = "HmacSHA256";
    private static final String BASE64_PREFIX = "base64:";

    private final SecretKey secretKey;

    public JwtTokenProvider(@Value("${jwt.secret}") String secretString) {
        if (secretString == null || secretString.isBlank()) {
            throw new IllegalStateException("jwt.secret must be configured");
        }
        byte[] keyBytes;
        if (secretString.startsWith(BASE64_PREFIX)) {
            keyBytes = Base64.getDecoder().decode(secretString.substring(BASE64_PREFIX.length()));
        } else {
            keyBytes = secretString.getBytes(StandardCharsets.UTF_8);
        }
        if (keyBytes.length < RECOMMENDED_SECRET_BYTES) {
            log.warn("jwt.secret is shorter than {} bytes; use a longer random secret in production",
                    RECOMMENDED_SECRET_BYTES);
            keyBytes = sha256(keyBytes);
        }
        this.secretKey = new SecretKeySpec(keyBytes, HMAC_SHA_256);
    }

    public SecretKey getSecretKey() {
        return secretKey;
    }

    private static byte[] sha256(byte[] input) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(input);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }
}
