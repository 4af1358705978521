package com.taskvault.backend.modules.auth.application;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Makes an otherwise valid, unexpired token unusable. Entries only need to live as long as the
 * token they shadow and expire on their own.
 *
 * <p>Implementations must tolerate concurrent callers; every write is keyed and every read is a
 * point lookup.
 */
public interface TokenRevocationRegistry {

    void revoke(String token, Duration ttl);

    boolean isRevoked(String token);

    /**
     * Atomically revokes the token unless it is already revoked.
     *
     * @return true when this call made the revocation, false when another caller got there first
     */
    boolean revokeIfAbsent(String token, Duration ttl);

    /**
     * Records that every token of this user issued up to now is void ("log out everywhere").
     */
    void revokeAllForUser(UUID userId, Duration ttl);

    Optional<Instant> loggedOutSince(UUID userId);

    default boolean isUserLoggedOut(UUID userId) {
        return loggedOutSince(userId).isPresent();
    }

    /**
     * True when the token was issued at or before the user's last "log out everywhere".
     * Both instants are compared at millisecond precision.
     */
    default boolean isIssuedBeforeUserLogout(UUID userId, Instant issuedAt) {
        Optional<Instant> cutoff = loggedOutSince(userId);
        if (cutoff.isEmpty()) {
            return false;
        }
        return issuedAt == null || !issuedAt.isAfter(cutoff.get());
    }

    /**
     * Drops expired entries held in this process.
     *
     * @return number of entries dropped
     */
    default int purgeExpired() {
        return 0;
    }
}
