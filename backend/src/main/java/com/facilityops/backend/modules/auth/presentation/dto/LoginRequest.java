package com.facilityops.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;

public record LoginRequest(
        String email,
        String username,
        @NotBlank(message = "password is required") String password,
        Boolean rememberMe
) {

    @AssertTrue(message = "email or username is required")
    public boolean isIdentifierPresent() {
        return (email != null && !email.isBlank()) || (username != null && !username.isBlank());
    }

    public boolean rememberMeRequested() {
        return Boolean.TRUE.equals(rememberMe);
    }
}
