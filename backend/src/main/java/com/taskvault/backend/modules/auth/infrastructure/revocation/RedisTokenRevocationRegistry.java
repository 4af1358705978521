package com.taskvault.backend.modules.auth.infrastructure.revocation;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import com.taskvault.backend.global.error.RetryableProblemException;
import com.taskvault.backend.modules.auth.application.TokenRevocationRegistry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Revocation entries in Redis with {@code SET ... EX ttl}, visible to every instance.
 *
 * <p>When Redis rejects a write the entry is kept in a local {@link InMemoryTokenRevocationRegistry}
 * and a warning is logged, so the revocation at least holds on this instance. Reads consult the
 * local entries first; a Redis read failure is reported as a retryable 503 rather than treating
 * the token as clean.
 */
public class RedisTokenRevocationRegistry implements TokenRevocationRegistry {

    private static final Logger log = LoggerFactory.getLogger(RedisTokenRevocationRegistry.class);
    private static final String STORE_NAME = "Revocation store";
    private static final String TOKEN_MARKER = "1";

    private final StringRedisTemplate redisTemplate;
    private final InMemoryTokenRevocationRegistry localFallback;
    private final Clock clock;

    public RedisTokenRevocationRegistry(StringRedisTemplate redisTemplate, Clock clock) {
        this(redisTemplate, new InMemoryTokenRevocationRegistry(clock), clock);
    }

    RedisTokenRevocationRegistry(StringRedisTemplate redisTemplate, InMemoryTokenRevocationRegistry localFallback, Clock clock) {
        this.redisTemplate = redisTemplate;
        this.localFallback = localFallback;
        this.clock = clock;
    }

    @Override
    public void revoke(String token, Duration ttl) {
        if (!isPositive(ttl)) {
            return;
        }
        try {
            redisTemplate.opsForValue().set(RevocationKeys.forToken(token), TOKEN_MARKER, ttl);
        } catch (DataAccessException ex) {
            log.warn("Redis rejected token revocation, keeping it in local memory only: {}", ex.getClass().getSimpleName());
            localFallback.revoke(token, ttl);
        }
    }

    @Override
    public boolean isRevoked(String token) {
        if (localFallback.isRevoked(token)) {
            return true;
        }
        try {
            return Boolean.TRUE.equals(redisTemplate.hasKey(RevocationKeys.forToken(token)));
        } catch (DataAccessException ex) {
            throw RetryableProblemException.storeUnavailable(STORE_NAME, ex);
        }
    }

    /**
     * {@code SET ... NX EX ttl}. A Redis failure degrades to a local claim like any other write.
     */
    @Override
    public boolean revokeIfAbsent(String token, Duration ttl) {
        if (!isPositive(ttl)) {
            return false;
        }
        if (localFallback.isRevoked(token)) {
            return false;
        }
        try {
            return Boolean.TRUE.equals(
                    redisTemplate.opsForValue().setIfAbsent(RevocationKeys.forToken(token), TOKEN_MARKER, ttl));
        } catch (DataAccessException ex) {
            log.warn("Redis rejected token claim, keeping it in local memory only: {}", ex.getClass().getSimpleName());
            return localFallback.revokeIfAbsent(token, ttl);
        }
    }

    @Override
    public void revokeAllForUser(UUID userId, Duration ttl) {
        if (!isPositive(ttl)) {
            return;
        }
        String recordedAt = String.valueOf(clock.instant().toEpochMilli());
        try {
            redisTemplate.opsForValue().set(RevocationKeys.forUser(userId), recordedAt, ttl);
        } catch (DataAccessException ex) {
            log.warn("Redis rejected user-wide revocation for user {}, keeping it in local memory only: {}",
                    userId, ex.getClass().getSimpleName());
            localFallback.revokeAllForUser(userId, ttl);
        }
    }

    @Override
    public Optional<Instant> loggedOutSince(UUID userId) {
        Optional<Instant> local = localFallback.loggedOutSince(userId);
        String value;
        try {
            value = redisTemplate.opsForValue().get(RevocationKeys.forUser(userId));
        } catch (DataAccessException ex) {
            if (local.isPresent()) {
                return local;
            }
            throw RetryableProblemException.storeUnavailable(STORE_NAME, ex);
        }
        Optional<Instant> remote = parseInstant(value);
        if (local.isPresent() && remote.isPresent()) {
            return local.get().isAfter(remote.get()) ? local : remote;
        }
        return remote.isPresent() ? remote : local;
    }

    /**
     * Purges entries written locally while Redis was unreachable; Redis expires its own keys.
     */
    @Override
    public int purgeExpired() {
        return localFallback.purgeExpired();
    }

    private Optional<Instant> parseInstant(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Instant.ofEpochMilli(Long.parseLong(value.trim())));
        } catch (NumberFormatException ex) {
            // unreadable marker still means the user logged out; treat everything so far as void
            log.warn("Unreadable user logout marker in Redis");
            return Optional.of(clock.instant());
        }
    }

    private static boolean isPositive(Duration ttl) {
        return ttl != null && !ttl.isNegative() && !ttl.isZero();
    }
}
