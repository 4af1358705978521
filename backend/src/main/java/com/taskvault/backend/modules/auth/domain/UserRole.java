package com.taskvault.backend.modules.auth.domain;

/**
 * Closed set of account roles. Capabilities are asked of the role, never inferred from other attributes.
 */
public enum UserRole {
    USER,
    ADMIN;

    public boolean canManageUsers() {
        return this == ADMIN;
    }

    public String authority() {
        return "ROLE_" + name();
    }
}
