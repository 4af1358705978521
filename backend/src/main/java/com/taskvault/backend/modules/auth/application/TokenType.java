package com.taskvault.backend.modules.auth.application;

public enum TokenType {
    ACCESS("access"),
    REFRESH("refresh");

    private final String claimValue;

    TokenType(String claimValue) {
        this.claimValue = claimValue;
    }

    public String claimValue() {
        return claimValue;
    }

    public static TokenType fromClaim(String value) {
        if (REFRESH.claimValue.equals(value)) {
            return REFRESH;
        }
        return ACCESS;
    }
}
