package com.facilityops.backend.modules.account.presentation.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record CreateAccountRequest(
        @NotBlank(message = "email is required") @Email @Size(max = 320) String email,
        @Size(min = 3, max = 30) @Pattern(regexp = "^[A-Za-z0-9_.-]+$") String username,
        @NotBlank(message = "password is required")
        @Size(min = PasswordRules.MIN_LENGTH, max = PasswordRules.MAX_LENGTH)
        @Pattern(regexp = PasswordRules.PATTERN, message = PasswordRules.MESSAGE) String password,
        @NotBlank(message = "firstName is required") @Size(max = 50) String firstName,
        @NotBlank(message = "lastName is required") @Size(max = 50) String lastName,
        @Size(max = 32) String phone,
        String role
) {
}
