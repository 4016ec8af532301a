package com.facilityops.backend.modules.auth.presentation.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

public record ForgotPasswordResponse(
        String message,
        @JsonInclude(JsonInclude.Include.NON_NULL) String resetToken
) {
    public static final String GENERIC_MESSAGE = "If the email exists, a password reset link has been sent";
}
