package com.taskvault.backend.modules.auth.application;

import java.util.Optional;
import java.util.UUID;

import com.taskvault.backend.modules.auth.domain.AppUser;
import com.taskvault.backend.modules.auth.domain.UserRole;

/**
 * User identity and password-hash persistence consumed by the auth core.
 *
 * <p>Implementations translate store outages into a retryable 503 problem and a unique-email
 * violation on {@link #insert} into a duplicate-resource problem.
 */
public interface CredentialStore {

    Optional<AppUser> findByEmail(String normalizedEmail);

    Optional<AppUser> findById(UUID userId);

    AppUser insert(String normalizedEmail, String passwordHash, UserRole role);

    /**
     * @return {@code false} when no such user exists
     */
    boolean updatePassword(UUID userId, String passwordHash);

    /**
     * @return {@code false} when no such user exists
     */
    boolean setActive(UUID userId, boolean active);
}
