package com.taskvault.backend.modules.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.BrokenBarrierException;
import java.util.concurrent.Callable;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import com.taskvault.backend.global.error.ErrorKind;
import com.taskvault.backend.global.error.ProblemException;
import com.taskvault.backend.global.security.AuthenticatedAccess;
import com.taskvault.backend.global.security.AuthenticatedPrincipal;
import com.taskvault.backend.global.security.SecurityConfig;
import com.taskvault.backend.modules.auth.application.AuthService;
import com.taskvault.backend.modules.auth.application.CredentialStore;
import com.taskvault.backend.modules.auth.application.JwtTokenService;
import com.taskvault.backend.modules.auth.application.PasswordHasher;
import com.taskvault.backend.modules.auth.application.TokenClaims;
import com.taskvault.backend.modules.auth.application.TokenRevocationRegistry;
import com.taskvault.backend.modules.auth.application.TokenVerification;
import com.taskvault.backend.modules.auth.domain.AppUser;
import com.taskvault.backend.modules.auth.domain.UserRole;
import com.taskvault.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;
import com.taskvault.backend.modules.auth.infrastructure.revocation.InMemoryTokenRevocationRegistry;
import com.taskvault.backend.modules.auth.presentation.dto.AuthResponse;
import com.taskvault.backend.modules.auth.presentation.dto.ChangePasswordRequest;
import com.taskvault.backend.modules.auth.presentation.dto.LoginRequest;
import com.taskvault.backend.modules.auth.presentation.dto.LogoutResponse;
import com.taskvault.backend.modules.auth.presentation.dto.RefreshRequest;
import com.taskvault.backend.modules.auth.presentation.dto.RegisterRequest;
import com.taskvault.backend.modules.auth.presentation.dto.TokenPairResponse;
import com.taskvault.backend.support.MutableClock;
import com.taskvault.backend.support.TestEntities;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

@ExtendWith(MockitoExtension.class)
class AuthServiceTest {

    private static final UUID USER_ID = UUID.fromString("00000000-0000-0000-0000-000000000401");
    private static final String EMAIL = "alice@example.com";
    private static final String PASSWORD = "Password123";

    private static PasswordHasher passwordHasher;
    private static String storedHash;

    @Mock
    private CredentialStore credentialStore;

    private MutableClock clock;
    private JwtTokenService jwtTokenService;
    private InMemoryTokenRevocationRegistry revocationRegistry;
    private AuthService authService;

    @BeforeAll
    static void hashOnce() {
        passwordHasher = new PasswordHasher(SecurityConfig.createPasswordEncoder());
        storedHash = passwordHasher.hash(PASSWORD);
    }

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
        jwtTokenService = new JwtTokenService(
                new JwtTokenProvider("unit-test-signing-secret-0123456789abcdef"), 24, clock);
        revocationRegistry = new InMemoryTokenRevocationRegistry(clock);
        authService = new AuthService(credentialStore, passwordHasher, jwtTokenService, revocationRegistry, clock);
    }

    @Test
    void registerNormalizesEmailAndIssuesTokens() {
        when(credentialStore.findByEmail(EMAIL)).thenReturn(Optional.empty());
        when(credentialStore.insert(eq(EMAIL), anyString(), eq(UserRole.USER)))
                .thenAnswer(invocation -> TestEntities.user(USER_ID, invocation.getArgument(0), invocation.getArgument(1)));

        AuthResponse response = authService.register(new RegisterRequest("  Alice@Example.COM ", PASSWORD, PASSWORD));

        assertThat(response.success()).isTrue();
        assertThat(response.tokenType()).isEqualTo("Bearer");
        assertThat(response.user().id()).isEqualTo(USER_ID);
        assertThat(response.user().email()).isEqualTo(EMAIL);
        assertThat(jwtTokenService.verifyAccessToken(response.accessToken()).isVerified()).isTrue();
        assertThat(jwtTokenService.verifyRefreshToken(response.refreshToken()).isVerified()).isTrue();
    }

    @Test
    void registerRejectsExistingEmail() {
        when(credentialStore.findByEmail(EMAIL)).thenReturn(Optional.of(TestEntities.user(USER_ID, EMAIL, storedHash)));

        ProblemException ex = assertThrows(ProblemException.class,
                () -> authService.register(new RegisterRequest("ALICE@example.com", PASSWORD, PASSWORD)));

        assertThat(ex.getKind()).isEqualTo(ErrorKind.DUPLICATE_RESOURCE);
        verify(credentialStore, never()).insert(anyString(), anyString(), any());
    }

    @Test
    void registerRejectsWeakPasswordBeforeTouchingTheStore() {
        ProblemException ex = assertThrows(ProblemException.class,
                () -> authService.register(new RegisterRequest(EMAIL, "abcdefg1", "abcdefg1")));

        assertThat(ex.getKind()).isEqualTo(ErrorKind.INVALID_INPUT);
        assertThat(ex.getCode()).isEqualTo("WEAK_PASSWORD");
        verify(credentialStore, never()).findByEmail(anyString());
    }

    @Test
    void registerRejectsMismatchedConfirmation() {
        ProblemException ex = assertThrows(ProblemException.class,
                () -> authService.register(new RegisterRequest(EMAIL, PASSWORD, PASSWORD + "x")));

        assertThat(ex.getCode()).isEqualTo("PASSWORD_MISMATCH");
    }

    @Test
    void registerRejectsMalformedEmail() {
        ProblemException ex = assertThrows(ProblemException.class,
                () -> authService.register(new RegisterRequest("not-an-email", PASSWORD, PASSWORD)));

        assertThat(ex.getKind()).isEqualTo(ErrorKind.INVALID_INPUT);
        assertThat(ex.getCode()).isEqualTo("INVALID_EMAIL");
    }

    @Test
    void loginSucceedsWithCorrectPassword() {
        when(credentialStore.findByEmail(EMAIL)).thenReturn(Optional.of(TestEntities.user(USER_ID, EMAIL, storedHash)));

        AuthResponse response = authService.login(new LoginRequest("Alice@example.com", PASSWORD));

        assertThat(response.user().id()).isEqualTo(USER_ID);
        verify(credentialStore, never()).updatePassword(any(), anyString());
    }

    @Test
    void loginFailuresAreIndistinguishable() {
        AppUser inactive = TestEntities.user(UUID.randomUUID(), "bob@example.com", storedHash);
        inactive.setActive(false);
        when(credentialStore.findByEmail(EMAIL)).thenReturn(Optional.of(TestEntities.user(USER_ID, EMAIL, storedHash)));
        when(credentialStore.findByEmail("nobody@example.com")).thenReturn(Optional.empty());
        when(credentialStore.findByEmail("bob@example.com")).thenReturn(Optional.of(inactive));

        ProblemException wrongPassword = assertThrows(ProblemException.class,
                () -> authService.login(new LoginRequest(EMAIL, "Wrong12345")));
        ProblemException unknownUser = assertThrows(ProblemException.class,
                () -> authService.login(new LoginRequest("nobody@example.com", PASSWORD)));
        ProblemException inactiveUser = assertThrows(ProblemException.class,
                () -> authService.login(new LoginRequest("bob@example.com", PASSWORD)));

        for (ProblemException ex : new ProblemException[]{wrongPassword, unknownUser, inactiveUser}) {
            assertThat(ex.getKind()).isEqualTo(ErrorKind.AUTHENTICATION_FAILED);
            assertThat(ex.getCode()).isEqualTo(wrongPassword.getCode());
            assertThat(ex.getDetailMessage()).isEqualTo(wrongPassword.getDetailMessage());
        }
    }

    @Test
    void loginUpgradesLegacyHash() {
        String legacy = new BCryptPasswordEncoder().encode(PASSWORD);
        when(credentialStore.findByEmail(EMAIL)).thenReturn(Optional.of(TestEntities.user(USER_ID, EMAIL, legacy)));

        authService.login(new LoginRequest(EMAIL, PASSWORD));

        verify(credentialStore).updatePassword(eq(USER_ID), org.mockito.ArgumentMatchers.startsWith("{bcrypt}"));
    }

    @Test
    void refreshRotatesAndOldRefreshTokenStopsWorking() {
        when(credentialStore.findById(USER_ID)).thenReturn(Optional.of(TestEntities.user(USER_ID, EMAIL, storedHash)));
        String original = jwtTokenService.issueRefreshToken(USER_ID, EMAIL);

        TokenPairResponse rotated = authService.refresh(new RefreshRequest(original));

        assertThat(rotated.refreshToken()).isNotEqualTo(original);
        assertThat(jwtTokenService.verifyAccessToken(rotated.accessToken()).isVerified()).isTrue();
        ProblemException replay = assertThrows(ProblemException.class,
                () -> authService.refresh(new RefreshRequest(original)));
        assertThat(replay.getKind()).isEqualTo(ErrorKind.UNAUTHENTICATED);
    }

    @Test
    void concurrentRefreshesOfOneTokenRedeemItOnce() throws Exception {
        when(credentialStore.findById(USER_ID)).thenReturn(Optional.of(TestEntities.user(USER_ID, EMAIL, storedHash)));
        String original = jwtTokenService.issueRefreshToken(USER_ID, EMAIL);
        CyclicBarrier bothChecked = new CyclicBarrier(2);
        InMemoryTokenRevocationRegistry racingRegistry = new InMemoryTokenRevocationRegistry(clock) {
            @Override
            public boolean isRevoked(String token) {
                boolean revoked = super.isRevoked(token);
                try {
                    bothChecked.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException | BrokenBarrierException | TimeoutException ex) {
                    throw new IllegalStateException(ex);
                }
                return revoked;
            }
        };
        AuthService racingService = new AuthService(credentialStore, passwordHasher, jwtTokenService, racingRegistry, clock);
        Callable<Boolean> redeem = () -> {
            try {
                racingService.refresh(new RefreshRequest(original));
                return true;
            } catch (ProblemException ex) {
                return false;
            }
        };

        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            List<Future<Boolean>> results = pool.invokeAll(List.of(redeem, redeem));
            int redeemed = 0;
            for (Future<Boolean> result : results) {
                if (result.get()) {
                    redeemed++;
                }
            }
            assertThat(redeemed).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void refreshRejectsAccessToken() {
        String access = jwtTokenService.issueAccessToken(USER_ID, EMAIL);

        ProblemException ex = assertThrows(ProblemException.class,
                () -> authService.refresh(new RefreshRequest(access)));

        assertThat(ex.getKind()).isEqualTo(ErrorKind.UNAUTHENTICATED);
    }

    @Test
    void refreshRejectsTokenIssuedBeforeLogoutEverywhere() {
        String refreshToken = jwtTokenService.issueRefreshToken(USER_ID, EMAIL);
        authService.logoutEverywhere(USER_ID);

        assertThrows(ProblemException.class, () -> authService.refresh(new RefreshRequest(refreshToken)));
    }

    @Test
    void refreshRejectsInactiveUser() {
        AppUser user = TestEntities.user(USER_ID, EMAIL, storedHash);
        user.setActive(false);
        when(credentialStore.findById(USER_ID)).thenReturn(Optional.of(user));
        String refreshToken = jwtTokenService.issueRefreshToken(USER_ID, EMAIL);

        assertThrows(ProblemException.class, () -> authService.refresh(new RefreshRequest(refreshToken)));
    }

    @Test
    void logoutRevokesTheAccessTokenForItsRemainingLifetime() {
        AuthenticatedAccess access = accessFor(jwtTokenService.issueAccessToken(USER_ID, EMAIL));

        LogoutResponse response = authService.logout(access);

        assertThat(response.userId()).isEqualTo(USER_ID);
        assertThat(revocationRegistry.isRevoked(access.rawToken())).isTrue();
        clock.advance(Duration.ofHours(24));
        assertThat(revocationRegistry.isRevoked(access.rawToken())).isFalse();
    }

    @Test
    void logoutSucceedsEvenWhenRevocationFails() {
        TokenRevocationRegistry failing = mock(TokenRevocationRegistry.class);
        doThrow(new IllegalStateException("store down")).when(failing).revoke(anyString(), any());
        AuthService service = new AuthService(credentialStore, passwordHasher, jwtTokenService, failing, clock);

        LogoutResponse response = service.logout(accessFor(jwtTokenService.issueAccessToken(USER_ID, EMAIL)));

        assertThat(response.message()).isNotBlank();
    }

    @Test
    void changePasswordStoresNewHashAndLogsOutEverywhere() {
        when(credentialStore.findById(USER_ID)).thenReturn(Optional.of(TestEntities.user(USER_ID, EMAIL, storedHash)));
        when(credentialStore.updatePassword(eq(USER_ID), anyString())).thenReturn(true);

        authService.changePassword(USER_ID, new ChangePasswordRequest(PASSWORD, "NewPassword456", "NewPassword456"));

        verify(credentialStore).updatePassword(eq(USER_ID), anyString());
        assertThat(revocationRegistry.isUserLoggedOut(USER_ID)).isTrue();
    }

    @Test
    void changePasswordRequiresCurrentPassword() {
        when(credentialStore.findById(USER_ID)).thenReturn(Optional.of(TestEntities.user(USER_ID, EMAIL, storedHash)));

        ProblemException ex = assertThrows(ProblemException.class,
                () -> authService.changePassword(USER_ID,
                        new ChangePasswordRequest("Wrong12345", "NewPassword456", "NewPassword456")));

        assertThat(ex.getKind()).isEqualTo(ErrorKind.AUTHENTICATION_FAILED);
        verify(credentialStore, never()).updatePassword(any(), anyString());
    }

    private AuthenticatedAccess accessFor(String token) {
        TokenClaims claims = ((TokenVerification.Verified) jwtTokenService.verifyAccessToken(token)).claims();
        return new AuthenticatedAccess(new AuthenticatedPrincipal(USER_ID, EMAIL, UserRole.USER), claims, token);
    }
}
