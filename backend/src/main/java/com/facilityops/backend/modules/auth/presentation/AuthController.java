package com.facilityops.backend.modules.auth.presentation;

import com.facilityops.backend.global.security.JwtAuthenticationPrincipal;
import com.facilityops.backend.global.security.SecurityUtils;
import com.facilityops.backend.modules.auth.application.AuthService;
import com.facilityops.backend.modules.auth.presentation.dto.ChangePasswordRequest;
import com.facilityops.backend.modules.auth.presentation.dto.ForgotPasswordRequest;
import com.facilityops.backend.modules.auth.presentation.dto.ForgotPasswordResponse;
import com.facilityops.backend.modules.auth.presentation.dto.LoginRequest;
import com.facilityops.backend.modules.auth.presentation.dto.LoginResponse;
import com.facilityops.backend.modules.auth.presentation.dto.RefreshRequest;
import com.facilityops.backend.modules.auth.presentation.dto.RefreshResponse;
import com.facilityops.backend.modules.auth.presentation.dto.ResetPasswordRequest;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class AuthController {

    private final AuthService authService;

    public AuthController(AuthService authService) {
        this.authService = authService;
    }

    @PostMapping("/auth/login")
    public ResponseEntity<LoginResponse> login(@Valid @RequestBody LoginRequest request,
                                               HttpServletRequest httpRequest) {
        return ResponseEntity.ok(authService.login(request, ClientInfoResolver.resolve(httpRequest)));
    }

    @PostMapping("/auth/refresh")
    public ResponseEntity<RefreshResponse> refresh(@Valid @RequestBody RefreshRequest request,
                                                   HttpServletRequest httpRequest) {
        return ResponseEntity.ok(authService.refresh(request.refreshToken(), ClientInfoResolver.resolve(httpRequest)));
    }

    @PostMapping("/auth/logout")
    public ResponseEntity<Void> logout(@AuthenticationPrincipal JwtAuthenticationPrincipal principal) {
        authService.logout(principal.accountId(), SecurityUtils.getCurrentAccessToken());
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/auth/logout-all")
    public ResponseEntity<Void> logoutAll(@AuthenticationPrincipal JwtAuthenticationPrincipal principal) {
        authService.logoutAll(principal.accountId());
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/auth/change-password")
    public ResponseEntity<Void> changePassword(@AuthenticationPrincipal JwtAuthenticationPrincipal principal,
                                               @Valid @RequestBody ChangePasswordRequest request) {
        authService.changePassword(principal.accountId(), request);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/auth/verify-email/{token}")
    public ResponseEntity<Void> verifyEmail(@PathVariable String token) {
        authService.verifyEmail(token);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/auth/forgot-password")
    public ResponseEntity<ForgotPasswordResponse> forgotPassword(@Valid @RequestBody ForgotPasswordRequest request) {
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(authService.forgotPassword(request.email()));
    }

    @PostMapping("/auth/reset-password/{token}")
    public ResponseEntity<Void> resetPassword(@PathVariable String token,
                                              @Valid @RequestBody ResetPasswordRequest request) {
        authService.resetPassword(token, request.password());
        return ResponseEntity.noContent().build();
    }
}
