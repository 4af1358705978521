package com.taskvault.backend.modules.auth.presentation;

import java.util.UUID;

import com.taskvault.backend.global.security.AuthenticatedPrincipal;
import com.taskvault.backend.modules.auth.application.UserAdministrationService;
import com.taskvault.backend.modules.auth.presentation.dto.UpdateUserStatusRequest;
import com.taskvault.backend.modules.auth.presentation.dto.UserProfileResponse;

import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/admin/users")
public class AdminUserController {

    private final UserAdministrationService userAdministrationService;

    public AdminUserController(UserAdministrationService userAdministrationService) {
        this.userAdministrationService = userAdministrationService;
    }

    @PatchMapping("/{userId}/status")
    public ResponseEntity<UserProfileResponse> updateStatus(
            @AuthenticationPrincipal AuthenticatedPrincipal principal,
            @PathVariable UUID userId,
            @Valid @RequestBody UpdateUserStatusRequest request
    ) {
        return ResponseEntity.ok(userAdministrationService.setActive(principal, userId, request.active()));
    }
}
