package com.facilityops.backend.modules.account.presentation.dto;

import jakarta.validation.constraints.NotBlank;

public record UpdateRoleRequest(@NotBlank(message = "role is required") String role) {
}
