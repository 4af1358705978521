package com.taskvault.backend.modules.auth.application;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

/**
 * One-way password hashing over the configured {@link PasswordEncoder}.
 * Comparison is always delegated to the encoder; a stored hash in an unknown or broken format never matches.
 */
@Component
public class PasswordHasher {

    private static final Logger log = LoggerFactory.getLogger(PasswordHasher.class);

    private final PasswordEncoder passwordEncoder;
    private final String dummyHash;

    public PasswordHasher(PasswordEncoder passwordEncoder) {
        this.passwordEncoder = passwordEncoder;
        this.dummyHash = passwordEncoder.encode("dummy-password-for-timing");
    }

    public String hash(String plaintext) {
        return passwordEncoder.encode(plaintext);
    }

    public boolean verify(String plaintext, String storedHash) {
        if (plaintext == null || storedHash == null || storedHash.isBlank()) {
            return false;
        }
        try {
            return passwordEncoder.matches(plaintext, storedHash);
        } catch (IllegalArgumentException ex) {
            log.warn("Stored password hash has an unrecognized format");
            return false;
        }
    }

    public boolean needsRehash(String storedHash) {
        if (storedHash == null || storedHash.isBlank()) {
            return false;
        }
        try {
            return passwordEncoder.upgradeEncoding(storedHash);
        } catch (IllegalArgumentException ex) {
            return false;
        }
    }

    /**
     * Burns one verification against a throwaway hash so an unknown account costs
     * about as much as a wrong password.
     */
    public void verifyAgainstDummy(String plaintext) {
        verify(plaintext == null ? "" : plaintext, dummyHash);
    }
}
