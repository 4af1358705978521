package com.taskvault.backend.modules.auth.application;

import java.util.UUID;

import com.taskvault.backend.global.error.ErrorKind;
import com.taskvault.backend.global.error.ProblemException;
import com.taskvault.backend.global.security.AuthenticatedPrincipal;
import com.taskvault.backend.modules.auth.domain.AppUser;
import com.taskvault.backend.modules.auth.presentation.dto.UserProfileResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class UserAdministrationService {

    private static final Logger log = LoggerFactory.getLogger(UserAdministrationService.class);

    private final CredentialStore credentialStore;
    private final AuthService authService;

    public UserAdministrationService(CredentialStore credentialStore, AuthService authService) {
        this.credentialStore = credentialStore;
        this.authService = authService;
    }

    /**
     * Activates or deactivates an account. Deactivation also voids every token the user holds.
     */
    public UserProfileResponse setActive(AuthenticatedPrincipal actor, UUID userId, boolean active) {
        if (actor == null || actor.role() == null || !actor.role().canManageUsers()) {
            throw new ProblemException(ErrorKind.FORBIDDEN);
        }
        if (!credentialStore.setActive(userId, active)) {
            throw ProblemException.notFound("USER_NOT_FOUND");
        }
        log.info("User {} set account {} active={}", actor.userId(), userId, active);
        if (!active) {
            authService.logoutEverywhere(userId);
        }
        AppUser user = credentialStore.findById(userId)
                .orElseThrow(() -> ProblemException.notFound("USER_NOT_FOUND"));
        return AuthService.toProfile(user);
    }
}
