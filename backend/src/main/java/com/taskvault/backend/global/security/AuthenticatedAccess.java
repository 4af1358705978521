package com.taskvault.backend.global.security;

import com.taskvault.backend.modules.auth.application.TokenClaims;

/**
 * Everything the guard resolved for one request: who the caller is and which token proved it.
 * The raw token is kept so logout can revoke exactly that credential.
 */
public record AuthenticatedAccess(AuthenticatedPrincipal principal, TokenClaims claims, String rawToken) {
}
