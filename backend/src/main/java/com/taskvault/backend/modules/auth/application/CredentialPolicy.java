package com.taskvault.backend.modules.auth.application;

import java.util.Locale;
import java.util.regex.Pattern;

import com.taskvault.backend.global.error.ProblemException;

/**
 * Email shape and password strength rules applied before anything touches the store.
 */
public final class CredentialPolicy {

    public static final int MIN_PASSWORD_LENGTH = 8;

    private static final Pattern EMAIL = Pattern.compile("^[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}$");

    private CredentialPolicy() {
    }

    /**
     * Trims, lower-cases and checks the address.
     */
    public static String normalizeEmail(String rawEmail) {
        String email = rawEmail == null ? "" : rawEmail.trim().toLowerCase(Locale.ROOT);
        if (!EMAIL.matcher(email).matches()) {
            throw ProblemException.invalidInput("INVALID_EMAIL", "Invalid email format");
        }
        return email;
    }

    public static void requireStrongPassword(String password) {
        if (password == null || password.length() < MIN_PASSWORD_LENGTH) {
            throw weak("Password must be at least " + MIN_PASSWORD_LENGTH + " characters long");
        }
        boolean upper = false;
        boolean lower = false;
        boolean digit = false;
        for (int i = 0; i < password.length(); i++) {
            char c = password.charAt(i);
            if (Character.isUpperCase(c)) {
                upper = true;
            } else if (Character.isLowerCase(c)) {
                lower = true;
            } else if (Character.isDigit(c)) {
                digit = true;
            }
        }
        if (!upper) {
            throw weak("Password must contain at least one uppercase letter");
        }
        if (!lower) {
            throw weak("Password must contain at least one lowercase letter");
        }
        if (!digit) {
            throw weak("Password must contain at least one digit");
        }
    }

    public static void requireMatching(String password, String confirmation) {
        if (password == null || !password.equals(confirmation)) {
            throw ProblemException.invalidInput("PASSWORD_MISMATCH", "Passwords do not match");
        }
    }

    private static ProblemException weak(String detail) {
        return ProblemException.invalidInput("WEAK_PASSWORD", detail);
    }
}
