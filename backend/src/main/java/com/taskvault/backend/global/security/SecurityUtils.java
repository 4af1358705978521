package com.taskvault.backend.global.security;

import java.util.UUID;

import com.taskvault.backend.global.error.ProblemException;

import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

public final class SecurityUtils {

    private SecurityUtils() {
    }

    public static AuthenticatedPrincipal getCurrentPrincipal() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null || !(authentication.getPrincipal() instanceof AuthenticatedPrincipal principal)) {
            throw ProblemException.unauthenticated();
        }
        return principal;
    }

    public static UUID getCurrentUserId() {
        return getCurrentPrincipal().userId();
    }

    /**
     * The guard's full result for this request, including the raw token it validated.
     */
    public static AuthenticatedAccess getCurrentAccess() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null || !(authentication.getCredentials() instanceof AuthenticatedAccess access)) {
            throw ProblemException.unauthenticated();
        }
        return access;
    }
}
