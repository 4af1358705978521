package com.taskvault.backend.modules.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import com.taskvault.backend.global.error.ErrorKind;
import com.taskvault.backend.global.error.ProblemException;
import com.taskvault.backend.global.security.AuthenticatedPrincipal;
import com.taskvault.backend.modules.auth.application.AuthService;
import com.taskvault.backend.modules.auth.application.CredentialStore;
import com.taskvault.backend.modules.auth.application.JwtTokenService;
import com.taskvault.backend.modules.auth.application.PasswordHasher;
import com.taskvault.backend.modules.auth.application.TokenRevocationRegistry;
import com.taskvault.backend.modules.auth.application.UserAdministrationService;
import com.taskvault.backend.modules.auth.domain.AppUser;
import com.taskvault.backend.modules.auth.domain.UserRole;
import com.taskvault.backend.modules.auth.presentation.dto.UserProfileResponse;
import com.taskvault.backend.support.TestEntities;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class UserAdministrationServiceTest {

    private static final UUID ADMIN_ID = UUID.fromString("00000000-0000-0000-0000-000000000601");
    private static final UUID TARGET_ID = UUID.fromString("00000000-0000-0000-0000-000000000602");

    @Mock
    private CredentialStore credentialStore;

    @Mock
    private TokenRevocationRegistry revocationRegistry;

    @Mock
    private PasswordHasher passwordHasher;

    @Mock
    private JwtTokenService jwtTokenService;

    private UserAdministrationService service;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2025-01-01T00:00:00Z"), ZoneOffset.UTC);
        AuthService authService = new AuthService(credentialStore, passwordHasher, jwtTokenService, revocationRegistry, clock);
        service = new UserAdministrationService(credentialStore, authService);
    }

    @Test
    void regularUserCannotManageAccounts() {
        AuthenticatedPrincipal actor = new AuthenticatedPrincipal(UUID.randomUUID(), "u@example.com", UserRole.USER);

        ProblemException ex = assertThrows(ProblemException.class, () -> service.setActive(actor, TARGET_ID, false));

        assertThat(ex.getKind()).isEqualTo(ErrorKind.FORBIDDEN);
        verify(credentialStore, never()).setActive(any(), anyBoolean());
    }

    @Test
    void unknownUserIsNotFound() {
        when(credentialStore.setActive(TARGET_ID, false)).thenReturn(false);

        ProblemException ex = assertThrows(ProblemException.class, () -> service.setActive(admin(), TARGET_ID, false));

        assertThat(ex.getKind()).isEqualTo(ErrorKind.NOT_FOUND);
        assertThat(ex.getCode()).isEqualTo("USER_NOT_FOUND");
    }

    @Test
    void deactivationRevokesEveryTokenOfTheUser() {
        AppUser target = TestEntities.user(TARGET_ID, "target@example.com", "hash");
        target.setActive(false);
        when(credentialStore.setActive(TARGET_ID, false)).thenReturn(true);
        when(credentialStore.findById(TARGET_ID)).thenReturn(Optional.of(target));
        when(jwtTokenService.getRefreshTokenTtl()).thenReturn(Duration.ofDays(7));

        UserProfileResponse profile = service.setActive(admin(), TARGET_ID, false);

        assertThat(profile.active()).isFalse();
        verify(revocationRegistry).revokeAllForUser(TARGET_ID, Duration.ofDays(7));
    }

    @Test
    void activationDoesNotTouchTokens() {
        when(credentialStore.setActive(TARGET_ID, true)).thenReturn(true);
        when(credentialStore.findById(TARGET_ID))
                .thenReturn(Optional.of(TestEntities.user(TARGET_ID, "target@example.com", "hash")));

        UserProfileResponse profile = service.setActive(admin(), TARGET_ID, true);

        assertThat(profile.active()).isTrue();
        verify(revocationRegistry, never()).revokeAllForUser(any(), any());
    }

    private static AuthenticatedPrincipal admin() {
        return new AuthenticatedPrincipal(ADMIN_ID, "admin@example.com", UserRole.ADMIN);
    }
}
