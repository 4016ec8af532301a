package com.facilityops.backend.modules.auth.presentation;

import com.facilityops.backend.global.security.JwtAuthenticationPrincipal;
import com.facilityops.backend.modules.account.presentation.dto.AccountResponse;
import com.facilityops.backend.modules.auth.application.AuthService;
import com.facilityops.backend.modules.auth.presentation.dto.SessionStatusResponse;

import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ProfileController {

    private final AuthService authService;

    public ProfileController(AuthService authService) {
        this.authService = authService;
    }

    @GetMapping("/auth/me")
    public ResponseEntity<AccountResponse> currentAccount(@AuthenticationPrincipal JwtAuthenticationPrincipal principal) {
        return ResponseEntity.ok(authService.loadProfile(principal.accountId()));
    }

    @GetMapping("/auth/session")
    public ResponseEntity<SessionStatusResponse> session(@AuthenticationPrincipal JwtAuthenticationPrincipal principal) {
        return ResponseEntity.ok(authService.sessionStatus(principal));
    }
}
