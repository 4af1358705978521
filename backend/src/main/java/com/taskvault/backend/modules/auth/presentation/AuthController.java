package com.taskvault.backend.modules.auth.presentation;

import com.taskvault.backend.global.security.AuthenticatedPrincipal;
import com.taskvault.backend.global.security.SecurityUtils;
import com.taskvault.backend.modules.auth.application.AuthService;
import com.taskvault.backend.modules.auth.presentation.dto.AuthResponse;
import com.taskvault.backend.modules.auth.presentation.dto.LoginRequest;
import com.taskvault.backend.modules.auth.presentation.dto.LogoutResponse;
import com.taskvault.backend.modules.auth.presentation.dto.RefreshRequest;
import com.taskvault.backend.modules.auth.presentation.dto.RegisterRequest;
import com.taskvault.backend.modules.auth.presentation.dto.TokenPairResponse;

import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class AuthController {

    private final AuthService authService;

    public AuthController(AuthService authService) {
        this.authService = authService;
    }

    @PostMapping("/auth/register")
    public ResponseEntity<AuthResponse> register(@Valid @RequestBody RegisterRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(authService.register(request));
    }

    @PostMapping("/auth/login")
    public ResponseEntity<AuthResponse> login(@Valid @RequestBody LoginRequest request) {
        return ResponseEntity.ok(authService.login(request));
    }

    @PostMapping("/auth/refresh")
    public ResponseEntity<TokenPairResponse> refresh(@Valid @RequestBody RefreshRequest request) {
        return ResponseEntity.ok(authService.refresh(request));
    }

    @PostMapping("/auth/logout")
    public ResponseEntity<LogoutResponse> logout() {
        return ResponseEntity.ok(authService.logout(SecurityUtils.getCurrentAccess()));
    }

    @PostMapping("/auth/logout-all")
    public ResponseEntity<Void> logoutAll(@AuthenticationPrincipal AuthenticatedPrincipal principal) {
        authService.logoutEverywhere(principal.userId());
        return ResponseEntity.noContent().build();
    }
}
