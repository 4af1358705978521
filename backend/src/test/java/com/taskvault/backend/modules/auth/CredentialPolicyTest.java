package com.taskvault.backend.modules.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.taskvault.backend.global.error.ProblemException;
import com.taskvault.backend.modules.auth.application.CredentialPolicy;

import org.junit.jupiter.api.Test;

class CredentialPolicyTest {

    @Test
    void emailIsTrimmedAndLowerCased() {
        assertThat(CredentialPolicy.normalizeEmail("  Dave.Smith+tag@Example.ORG ")).isEqualTo("dave.smith+tag@example.org");
    }

    @Test
    void malformedEmailsAreRejected() {
        for (String email : new String[]{"", "plain", "a@b", "a@b.c", "@example.com", null}) {
            ProblemException ex = assertThrows(ProblemException.class, () -> CredentialPolicy.normalizeEmail(email));
            assertThat(ex.getCode()).isEqualTo("INVALID_EMAIL");
        }
    }

    @Test
    void passwordNeedsLengthAndCharacterClasses() {
        for (String weak : new String[]{"Ab1", "abcdefg1", "ABCDEFG1", "Abcdefgh", null}) {
            ProblemException ex = assertThrows(ProblemException.class, () -> CredentialPolicy.requireStrongPassword(weak));
            assertThat(ex.getCode()).isEqualTo("WEAK_PASSWORD");
        }
        assertThatCode(() -> CredentialPolicy.requireStrongPassword("Abcdefg1")).doesNotThrowAnyException();
    }
}
