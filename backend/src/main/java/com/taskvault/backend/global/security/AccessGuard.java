package com.taskvault.backend.global.security;

import com.taskvault.backend.global.error.ProblemException;
import com.taskvault.backend.modules.auth.application.CredentialStore;
import com.taskvault.backend.modules.auth.application.JwtTokenService;
import com.taskvault.backend.modules.auth.application.TokenClaims;
import com.taskvault.backend.modules.auth.application.TokenRevocationRegistry;
import com.taskvault.backend.modules.auth.application.TokenVerification;
import com.taskvault.backend.modules.auth.domain.AppUser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Resolves the caller behind a bearer token before any protected operation runs.
 *
 * <p>Every failure (missing header, bad or expired token, revoked token, vanished or
 * inactive user) surfaces as the same {@code UNAUTHENTICATED} problem. Backing-store outages
 * propagate as retryable 503 problems instead.
 */
@Component
public class AccessGuard {

    private static final Logger log = LoggerFactory.getLogger(AccessGuard.class);

    private final JwtTokenService jwtTokenService;
    private final TokenRevocationRegistry revocationRegistry;
    private final CredentialStore credentialStore;

    public AccessGuard(
            JwtTokenService jwtTokenService,
            TokenRevocationRegistry revocationRegistry,
            CredentialStore credentialStore
    ) {
        this.jwtTokenService = jwtTokenService;
        this.revocationRegistry = revocationRegistry;
        this.credentialStore = credentialStore;
    }

    public AuthenticatedAccess authenticate(String authorizationHeader) {
        String token = BearerTokens.extract(authorizationHeader)
                .orElseThrow(() -> deny("missing or malformed Authorization header"));
        return verifyAccess(token);
    }

    public AuthenticatedAccess verifyAccess(String token) {
        TokenVerification verification = jwtTokenService.verifyAccessToken(token);
        if (!(verification instanceof TokenVerification.Verified verified)) {
            throw deny("access token rejected");
        }
        TokenClaims claims = verified.claims();

        if (revocationRegistry.isRevoked(token)) {
            throw deny("token revoked");
        }
        if (revocationRegistry.isIssuedBeforeUserLogout(claims.userId(), claims.issuedAt())) {
            throw deny("token predates user-wide logout");
        }

        AppUser user = credentialStore.findById(claims.userId())
                .orElseThrow(() -> deny("subject no longer exists"));
        if (!user.isActive()) {
            throw deny("subject is inactive");
        }

        AuthenticatedPrincipal principal = new AuthenticatedPrincipal(user.getId(), user.getEmail(), user.getRole());
        return new AuthenticatedAccess(principal, claims, token);
    }

    private static ProblemException deny(String diagnostic) {
        log.debug("Access denied: {}", diagnostic);
        return ProblemException.unauthenticated();
    }
}
