package com.taskvault.backend.modules.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import com.taskvault.backend.modules.auth.application.JwtTokenService;
import com.taskvault.backend.modules.auth.application.TokenClaims;
import com.taskvault.backend.modules.auth.application.TokenType;
import com.taskvault.backend.modules.auth.application.TokenVerification.RejectionReason;
import com.taskvault.backend.modules.auth.application.TokenVerification;
import com.taskvault.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;
import com.taskvault.backend.modules.auth.presentation.dto.TokenPairResponse;
import com.taskvault.backend.support.MutableClock;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class JwtTokenServiceTest {

    private static final String SECRET = "unit-test-signing-secret-0123456789abcdef";
    private static final UUID USER_ID = UUID.fromString("00000000-0000-0000-0000-000000000101");
    private static final String EMAIL = "alice@example.com";

    private MutableClock clock;
    private JwtTokenService tokenService;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
        tokenService = new JwtTokenService(new JwtTokenProvider(SECRET), 24, clock);
    }

    @Test
    void accessTokenRoundTripsClaims() {
        String token = tokenService.issueAccessToken(USER_ID, EMAIL);

        TokenVerification verification = tokenService.verifyAccessToken(token);

        assertThat(verification).isInstanceOf(TokenVerification.Verified.class);
        TokenClaims claims = ((TokenVerification.Verified) verification).claims();
        assertThat(claims.userId()).isEqualTo(USER_ID);
        assertThat(claims.email()).isEqualTo(EMAIL);
        assertThat(claims.type()).isEqualTo(TokenType.ACCESS);
        assertThat(claims.issuedAt()).isEqualTo(clock.instant());
        assertThat(claims.expiresAt()).isEqualTo(clock.instant().plus(Duration.ofHours(24)));
        assertThat(claims.tokenId()).isNotBlank();
    }

    @Test
    void tokenWithNegativeTtlIsExpired() {
        String token = tokenService.issueAccessToken(USER_ID, EMAIL, Duration.ofSeconds(-1));

        assertThat(rejection(tokenService.verifyAccessToken(token))).isEqualTo(RejectionReason.EXPIRED);
    }

    @Test
    void tokenExpiringExactlyNowIsRejected() {
        String token = tokenService.issueAccessToken(USER_ID, EMAIL, Duration.ofHours(1));
        clock.advance(Duration.ofHours(1));

        assertThat(rejection(tokenService.verifyAccessToken(token))).isEqualTo(RejectionReason.EXPIRED);
    }

    @Test
    void tokenIsValidUntilJustBeforeExpiry() {
        String token = tokenService.issueAccessToken(USER_ID, EMAIL, Duration.ofHours(1));
        clock.advance(Duration.ofMinutes(59));

        assertThat(tokenService.verifyAccessToken(token).isVerified()).isTrue();
    }

    @Test
    void refreshTokenIsNotAcceptedAsAccessToken() {
        String refreshToken = tokenService.issueRefreshToken(USER_ID, EMAIL);

        assertThat(rejection(tokenService.verifyAccessToken(refreshToken))).isEqualTo(RejectionReason.WRONG_TYPE);
        assertThat(tokenService.verifyRefreshToken(refreshToken).isVerified()).isTrue();
    }

    @Test
    void accessTokenIsNotAcceptedAsRefreshToken() {
        String accessToken = tokenService.issueAccessToken(USER_ID, EMAIL);

        assertThat(rejection(tokenService.verifyRefreshToken(accessToken))).isEqualTo(RejectionReason.WRONG_TYPE);
    }

    @Test
    void refreshTokenLivesSevenDays() {
        String refreshToken = tokenService.issueRefreshToken(USER_ID, EMAIL);

        clock.advance(Duration.ofDays(7).minusSeconds(1));
        assertThat(tokenService.verifyRefreshToken(refreshToken).isVerified()).isTrue();

        clock.advance(Duration.ofSeconds(1));
        assertThat(rejection(tokenService.verifyRefreshToken(refreshToken))).isEqualTo(RejectionReason.EXPIRED);
    }

    @Test
    void tokenSignedWithAnotherKeyIsRejected() {
        JwtTokenService foreign = new JwtTokenService(
                new JwtTokenProvider("another-signing-secret-0123456789abcdef"), 24, clock);
        String token = foreign.issueAccessToken(USER_ID, EMAIL);

        assertThat(rejection(tokenService.verifyAccessToken(token))).isEqualTo(RejectionReason.BAD_SIGNATURE);
    }

    @Test
    void garbageIsMalformed() {
        assertThat(rejection(tokenService.verifyAccessToken("not-a-jwt"))).isEqualTo(RejectionReason.MALFORMED);
        assertThat(rejection(tokenService.verifyAccessToken(""))).isEqualTo(RejectionReason.MALFORMED);
        assertThat(rejection(tokenService.verifyAccessToken(null))).isEqualTo(RejectionReason.MALFORMED);
    }

    @Test
    void tokensIssuedInTheSameSecondDiffer() {
        String first = tokenService.issueAccessToken(USER_ID, EMAIL);
        String second = tokenService.issueAccessToken(USER_ID, EMAIL);

        assertThat(first).isNotEqualTo(second);
    }

    @Test
    void shortSecretStillSignsAndVerifies() {
        JwtTokenService weakKeyed = new JwtTokenService(new JwtTokenProvider("short"), 24, clock);
        String token = weakKeyed.issueAccessToken(USER_ID, EMAIL);

        assertThat(weakKeyed.verifyAccessToken(token).isVerified()).isTrue();
    }

    @Test
    void tokenPairReportsLifetimesInSeconds() {
        TokenPairResponse pair = tokenService.issueTokenPair(USER_ID, EMAIL);

        assertThat(pair.tokenType()).isEqualTo("Bearer");
        assertThat(pair.expiresIn()).isEqualTo(Duration.ofHours(24).toSeconds());
        assertThat(pair.refreshExpiresIn()).isEqualTo(Duration.ofDays(7).toSeconds());
        assertThat(tokenService.verifyAccessToken(pair.accessToken()).isVerified()).isTrue();
        assertThat(tokenService.verifyRefreshToken(pair.refreshToken()).isVerified()).isTrue();
    }

    @Test
    void nonPositiveAccessTtlIsRefused() {
        JwtTokenProvider provider = new JwtTokenProvider(SECRET);
        assertThrows(IllegalArgumentException.class, () -> new JwtTokenService(provider, 0, clock));
    }

    private static RejectionReason rejection(TokenVerification verification) {
        assertThat(verification).isInstanceOf(TokenVerification.Rejected.class);
        return ((TokenVerification.Rejected) verification).reason();
    }
}
