package com.taskvault.backend.modules.auth.application;

/**
 * Outcome of checking a token's signature, expiry and type. Callers must handle both branches;
 * the rejection reason is for diagnostics only and never reaches the client.
 */
public sealed interface TokenVerification permits TokenVerification.Verified, TokenVerification.Rejected {

    record Verified(TokenClaims claims) implements TokenVerification {
    }

    record Rejected(RejectionReason reason) implements TokenVerification {
    }

    enum RejectionReason {
        MALFORMED,
        BAD_SIGNATURE,
        EXPIRED,
        MISSING_CLAIMS,
        WRONG_TYPE
    }

    static TokenVerification verified(TokenClaims claims) {
        return new Verified(claims);
    }

    static TokenVerification rejected(RejectionReason reason) {
        return new Rejected(reason);
    }

    default boolean isVerified() {
        return this instanceof Verified;
    }
}
