package com.facilityops.backend.modules.auth.presentation.dto;

import com.facilityops.backend.modules.account.presentation.dto.PasswordRules;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record ChangePasswordRequest(
        @NotBlank(message = "currentPassword is required") String currentPassword,
        @NotBlank(message = "newPassword is required")
        @Size(min = PasswordRules.MIN_LENGTH, max = PasswordRules.MAX_LENGTH)
        @Pattern(regexp = PasswordRules.PATTERN, message = "New password " + PasswordRules.MESSAGE) String newPassword,
        Boolean logoutAllDevices
) {
}
