package com.taskvault.backend.modules.auth.application;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.Date;
import java.util.UUID;

import com.taskvault.backend.modules.auth.application.TokenVerification.RejectionReason;
import com.taskvault.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;
import com.taskvault.backend.modules.auth.presentation.dto.TokenPairResponse;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.Jwts.SIG;
import io.jsonwebtoken.security.SecurityException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Issues and verifies HS256 bearer tokens carrying {@code sub}, {@code email}, {@code exp} and {@code type}.
 *
 * <p>Expiry is checked strictly ({@code exp > now}) against this service's clock with no skew allowance.
 * A refresh token never verifies as an access token and vice versa.
 */
@Service
public class JwtTokenService {

    private static final Logger log = LoggerFactory.getLogger(JwtTokenService.class);

    public static final String CLAIM_EMAIL = "email";
    public static final String CLAIM_TYPE = "type";
    /** Issue time in epoch millis; {@code iat} alone is second precision. */
    public static final String CLAIM_ISSUED_AT_MILLIS = "iat_ms";
    public static final Duration REFRESH_TOKEN_TTL = Duration.ofDays(7);

    private final JwtTokenProvider tokenProvider;
    private final Duration accessTokenTtl;
    private final Clock clock;

    public JwtTokenService(
            JwtTokenProvider tokenProvider,
            @Value("${jwt.access-token-ttl-hours:24}") long accessTokenTtlHours,
            Clock clock
    ) {
        if (accessTokenTtlHours <= 0) {
            throw new IllegalArgumentException("jwt.access-token-ttl-hours must be > 0");
        }
        this.tokenProvider = tokenProvider;
        this.accessTokenTtl = Duration.ofHours(accessTokenTtlHours);
        this.clock = clock;
    }

    public String issueAccessToken(UUID userId, String email) {
        return issueAccessToken(userId, email, accessTokenTtl);
    }

    public String issueAccessToken(UUID userId, String email, Duration ttl) {
        return buildToken(userId, email, TokenType.ACCESS, clock.instant(), ttl);
    }

    public String issueRefreshToken(UUID userId, String email) {
        return issueRefreshToken(userId, email, REFRESH_TOKEN_TTL);
    }

    public String issueRefreshToken(UUID userId, String email, Duration ttl) {
        return buildToken(userId, email, TokenType.REFRESH, clock.instant(), ttl);
    }

    public TokenPairResponse issueTokenPair(UUID userId, String email) {
        Instant now = clock.instant();
        String accessToken = buildToken(userId, email, TokenType.ACCESS, now, accessTokenTtl);
        String refreshToken = buildToken(userId, email, TokenType.REFRESH, now, REFRESH_TOKEN_TTL);
        return new TokenPairResponse(
                accessToken,
                TokenPairResponse.DEFAULT_TOKEN_TYPE,
                accessTokenTtl.toSeconds(),
                refreshToken,
                REFRESH_TOKEN_TTL.toSeconds(),
                OffsetDateTime.ofInstant(now, clock.getZone())
        );
    }

    public TokenVerification verifyAccessToken(String token) {
        return verify(token, TokenType.ACCESS);
    }

    public TokenVerification verifyRefreshToken(String token) {
        return verify(token, TokenType.REFRESH);
    }

    public Duration getAccessTokenTtl() {
        return accessTokenTtl;
    }

    public Duration getRefreshTokenTtl() {
        return REFRESH_TOKEN_TTL;
    }

    private String buildToken(UUID userId, String email, TokenType type, Instant now, Duration ttl) {
        if (userId == null || email == null) {
            throw new IllegalArgumentException("userId and email are required to issue a token");
        }
        return Jwts.builder()
                .id(UUID.randomUUID().toString())
                .subject(userId.toString())
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plus(ttl)))
                .claim(CLAIM_EMAIL, email)
                .claim(CLAIM_TYPE, type.claimValue())
                .claim(CLAIM_ISSUED_AT_MILLIS, now.toEpochMilli())
                .signWith(tokenProvider.getSecretKey(), SIG.HS256)
                .compact();
    }

    private TokenVerification verify(String token, TokenType expectedType) {
        if (token == null || token.isBlank()) {
            return reject(RejectionReason.MALFORMED);
        }
        Claims claims;
        try {
            claims = Jwts.parser()
                    .verifyWith(tokenProvider.getSecretKey())
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
        } catch (ExpiredJwtException ex) {
            return reject(RejectionReason.EXPIRED);
        } catch (SecurityException ex) {
            return reject(RejectionReason.BAD_SIGNATURE);
        } catch (JwtException | IllegalArgumentException ex) {
            return reject(RejectionReason.MALFORMED);
        }

        Date expiration = claims.getExpiration();
        if (expiration == null) {
            return reject(RejectionReason.MISSING_CLAIMS);
        }
        Instant expiresAt = expiration.toInstant();
        if (!expiresAt.isAfter(clock.instant())) {
            return reject(RejectionReason.EXPIRED);
        }

        TokenType actualType = TokenType.fromClaim(claims.get(CLAIM_TYPE, String.class));
        if (actualType != expectedType) {
            return reject(RejectionReason.WRONG_TYPE);
        }

        String subject = claims.getSubject();
        String email = claims.get(CLAIM_EMAIL, String.class);
        if (subject == null || email == null || email.isBlank()) {
            return reject(RejectionReason.MISSING_CLAIMS);
        }
        UUID userId;
        try {
            userId = UUID.fromString(subject);
        } catch (IllegalArgumentException ex) {
            return reject(RejectionReason.MISSING_CLAIMS);
        }

        return TokenVerification.verified(new TokenClaims(
                userId,
                email,
                actualType,
                claims.getId(),
                issuedAt(claims),
                expiresAt
        ));
    }

    private static Instant issuedAt(Claims claims) {
        Object millis = claims.get(CLAIM_ISSUED_AT_MILLIS);
        if (millis instanceof Number number) {
            return Instant.ofEpochMilli(number.longValue());
        }
        return claims.getIssuedAt() != null ? claims.getIssuedAt().toInstant() : null;
    }

    private static TokenVerification reject(RejectionReason reason) {
        log.debug("Token rejected: {}", reason);
        return TokenVerification.rejected(reason);
    }
}
