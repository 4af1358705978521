package com.taskvault.backend.modules.auth.application;

import java.time.Clock;
import java.time.Duration;
import java.util.UUID;

import com.taskvault.backend.global.error.ErrorKind;
import com.taskvault.backend.global.error.ProblemException;
import com.taskvault.backend.global.security.AuthenticatedAccess;
import com.taskvault.backend.modules.auth.domain.AppUser;
import com.taskvault.backend.modules.auth.domain.UserRole;
import com.taskvault.backend.modules.auth.presentation.dto.AuthResponse;
import com.taskvault.backend.modules.auth.presentation.dto.ChangePasswordRequest;
import com.taskvault.backend.modules.auth.presentation.dto.LoginRequest;
import com.taskvault.backend.modules.auth.presentation.dto.LogoutResponse;
import com.taskvault.backend.modules.auth.presentation.dto.RefreshRequest;
import com.taskvault.backend.modules.auth.presentation.dto.RegisterRequest;
import com.taskvault.backend.modules.auth.presentation.dto.TokenPairResponse;
import com.taskvault.backend.modules.auth.presentation.dto.UserProfileResponse;
import com.taskvault.backend.modules.auth.presentation.dto.UserSummary;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    private static final String INVALID_REFRESH_TOKEN = "INVALID_REFRESH_TOKEN";

    private final CredentialStore credentialStore;
    private final PasswordHasher passwordHasher;
    private final JwtTokenService jwtTokenService;
    private final TokenRevocationRegistry revocationRegistry;
    private final Clock clock;

    public AuthService(
            CredentialStore credentialStore,
            PasswordHasher passwordHasher,
            JwtTokenService jwtTokenService,
            TokenRevocationRegistry revocationRegistry,
            Clock clock
    ) {
        this.credentialStore = credentialStore;
        this.passwordHasher = passwordHasher;
        this.jwtTokenService = jwtTokenService;
        this.revocationRegistry = revocationRegistry;
        this.clock = clock;
    }

    public AuthResponse register(RegisterRequest request) {
        String email = CredentialPolicy.normalizeEmail(request.email());
        CredentialPolicy.requireStrongPassword(request.password());
        CredentialPolicy.requireMatching(request.password(), request.confirmPassword());

        if (credentialStore.findByEmail(email).isPresent()) {
            throw new ProblemException(ErrorKind.DUPLICATE_RESOURCE, "EMAIL_ALREADY_REGISTERED", "Email already exists");
        }

        AppUser user = credentialStore.insert(email, passwordHasher.hash(request.password()), UserRole.USER);
        log.info("Registered user {}", user.getId());
        return authResponse(user);
    }

    public AuthResponse login(LoginRequest request) {
        String email = CredentialPolicy.normalizeEmail(request.email());

        AppUser user = credentialStore.findByEmail(email).orElse(null);
        if (user == null) {
            passwordHasher.verifyAgainstDummy(request.password());
            throw loginFailed(null, "unknown email");
        }
        if (!passwordHasher.verify(request.password(), user.getPasswordHash())) {
            throw loginFailed(user.getId(), "wrong password");
        }
        if (!user.isActive()) {
            throw loginFailed(user.getId(), "account inactive");
        }

        if (passwordHasher.needsRehash(user.getPasswordHash())) {
            credentialStore.updatePassword(user.getId(), passwordHasher.hash(request.password()));
            log.info("Upgraded password hash for user {}", user.getId());
        }

        log.info("User {} logged in", user.getId());
        return authResponse(user);
    }

    /**
     * Exchanges a refresh token for a new pair. The presented refresh token is revoked so it
     * cannot be replayed.
     */
    public TokenPairResponse refresh(RefreshRequest request) {
        String refreshToken = request.refreshToken();
        TokenVerification verification = jwtTokenService.verifyRefreshToken(refreshToken);
        if (!(verification instanceof TokenVerification.Verified verified)) {
            throw invalidRefresh("refresh token rejected");
        }
        TokenClaims claims = verified.claims();

        if (revocationRegistry.isRevoked(refreshToken)) {
            throw invalidRefresh("refresh token already used or revoked");
        }
        if (revocationRegistry.isIssuedBeforeUserLogout(claims.userId(), claims.issuedAt())) {
            throw invalidRefresh("refresh token predates user-wide logout");
        }

        AppUser user = credentialStore.findById(claims.userId())
                .filter(AppUser::isActive)
                .orElseThrow(() -> invalidRefresh("subject missing or inactive"));

        if (!revocationRegistry.revokeIfAbsent(refreshToken, claims.remainingLifetime(clock.instant()))) {
            throw invalidRefresh("refresh token redeemed concurrently");
        }
        log.info("Rotated refresh token for user {}", user.getId());
        return jwtTokenService.issueTokenPair(user.getId(), user.getEmail());
    }

    /**
     * Revokes the access token used for this request. A registry failure is logged and the
     * logout still succeeds.
     */
    public LogoutResponse logout(AuthenticatedAccess access) {
        UUID userId = access.principal().userId();
        Duration ttl = access.claims().remainingLifetime(clock.instant());
        if (ttl.isZero()) {
            ttl = jwtTokenService.getAccessTokenTtl();
        }
        try {
            revocationRegistry.revoke(access.rawToken(), ttl);
            log.info("User {} logged out", userId);
        } catch (RuntimeException ex) {
            log.warn("Could not revoke token on logout for user {}", userId, ex);
        }
        return new LogoutResponse("Successfully logged out", userId);
    }

    public void logoutEverywhere(UUID userId) {
        try {
            revocationRegistry.revokeAllForUser(userId, jwtTokenService.getRefreshTokenTtl());
            log.info("User {} logged out everywhere", userId);
        } catch (RuntimeException ex) {
            log.warn("Could not record user-wide logout for user {}", userId, ex);
        }
    }

    /**
     * Replaces the password and voids every token issued so far, including the caller's own.
     */
    public void changePassword(UUID userId, ChangePasswordRequest request) {
        AppUser user = credentialStore.findById(userId)
                .orElseThrow(ProblemException::unauthenticated);

        if (!passwordHasher.verify(request.currentPassword(), user.getPasswordHash())) {
            throw new ProblemException(ErrorKind.AUTHENTICATION_FAILED, ErrorKind.AUTHENTICATION_FAILED.defaultCode(),
                    "Current password is incorrect");
        }
        CredentialPolicy.requireStrongPassword(request.newPassword());
        CredentialPolicy.requireMatching(request.newPassword(), request.confirmPassword());

        if (!credentialStore.updatePassword(userId, passwordHasher.hash(request.newPassword()))) {
            throw ProblemException.notFound("USER_NOT_FOUND");
        }
        log.info("Password changed for user {}", userId);
        logoutEverywhere(userId);
    }

    public UserProfileResponse loadProfile(UUID userId) {
        AppUser user = credentialStore.findById(userId)
                .orElseThrow(() -> ProblemException.notFound("USER_NOT_FOUND"));
        return toProfile(user);
    }

    static UserProfileResponse toProfile(AppUser user) {
        return new UserProfileResponse(
                user.getId(),
                user.getEmail(),
                user.getRole().name(),
                user.isActive(),
                user.getCreatedAt(),
                user.getUpdatedAt()
        );
    }

    private AuthResponse authResponse(AppUser user) {
        TokenPairResponse tokens = jwtTokenService.issueTokenPair(user.getId(), user.getEmail());
        return AuthResponse.of(tokens, new UserSummary(user.getId(), user.getEmail()));
    }

    private static ProblemException loginFailed(UUID userId, String diagnostic) {
        log.info("Login failed for user {}: {}", userId, diagnostic);
        return new ProblemException(ErrorKind.AUTHENTICATION_FAILED, ErrorKind.AUTHENTICATION_FAILED.defaultCode(),
                "Invalid email or password");
    }

    private static ProblemException invalidRefresh(String diagnostic) {
        log.debug("Refresh denied: {}", diagnostic);
        return new ProblemException(ErrorKind.UNAUTHENTICATED, INVALID_REFRESH_TOKEN, "Invalid or expired refresh token");
    }
}
