package com.taskvault.backend.modules.auth.presentation;

import com.taskvault.backend.global.security.AuthenticatedPrincipal;
import com.taskvault.backend.modules.auth.application.AuthService;
import com.taskvault.backend.modules.auth.presentation.dto.ChangePasswordRequest;
import com.taskvault.backend.modules.auth.presentation.dto.UserProfileResponse;

import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ProfileController {

    private final AuthService authService;

    public ProfileController(AuthService authService) {
        this.authService = authService;
    }

    @GetMapping("/profile/me")
    public ResponseEntity<UserProfileResponse> currentUser(@AuthenticationPrincipal AuthenticatedPrincipal principal) {
        return ResponseEntity.ok(authService.loadProfile(principal.userId()));
    }

    @PostMapping("/profile/password")
    public ResponseEntity<Void> changePassword(
            @AuthenticationPrincipal AuthenticatedPrincipal principal,
            @Valid @RequestBody ChangePasswordRequest request
    ) {
        authService.changePassword(principal.userId(), request);
        return ResponseEntity.noContent().build();
    }
}
