package com.taskvault.backend.modules.auth.infrastructure.revocation;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

import com.taskvault.backend.modules.auth.application.TokenRevocationRegistry;

/**
 * Process-local revocation entries.
 *
 * <p>Only correct for single-instance deployments: a token revoked here stays valid on every
 * other instance. Expired entries are dropped lazily on lookup and by {@link #purgeExpired()}.
 */
public class InMemoryTokenRevocationRegistry implements TokenRevocationRegistry {

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryTokenRevocationRegistry(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void revoke(String token, Duration ttl) {
        Instant now = clock.instant();
        entries.put(RevocationKeys.forToken(token), new Entry(now, now.plus(ttl)));
    }

    @Override
    public boolean isRevoked(String token) {
        return lookup(RevocationKeys.forToken(token)).isPresent();
    }

    @Override
    public boolean revokeIfAbsent(String token, Duration ttl) {
        Instant now = clock.instant();
        Entry claim = new Entry(now, now.plus(ttl));
        Entry winner = entries.compute(RevocationKeys.forToken(token),
                (key, existing) -> existing != null && existing.expiresAt().isAfter(now) ? existing : claim);
        return winner == claim;
    }

    @Override
    public void revokeAllForUser(UUID userId, Duration ttl) {
        // same precision as the iat_ms claim and the Redis marker
        Instant now = clock.instant().truncatedTo(ChronoUnit.MILLIS);
        entries.put(RevocationKeys.forUser(userId), new Entry(now, now.plus(ttl)));
    }

    @Override
    public Optional<Instant> loggedOutSince(UUID userId) {
        return lookup(RevocationKeys.forUser(userId)).map(Entry::recordedAt);
    }

    @Override
    public int purgeExpired() {
        Instant now = clock.instant();
        int before = entries.size();
        entries.values().removeIf(entry -> !entry.expiresAt().isAfter(now));
        return Math.max(0, before - entries.size());
    }

    public int size() {
        return entries.size();
    }

    private Optional<Entry> lookup(String key) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (!entry.expiresAt().isAfter(clock.instant())) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry);
    }

    private record Entry(Instant recordedAt, Instant expiresAt) {
    }
}
