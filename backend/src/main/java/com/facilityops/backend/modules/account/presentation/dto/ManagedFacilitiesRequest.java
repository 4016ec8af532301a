package com.facilityops.backend.modules.account.presentation.dto;

import java.util.Set;
import java.util.UUID;

import jakarta.validation.constraints.NotNull;

public record ManagedFacilitiesRequest(@NotNull(message = "facilityIds is required") Set<UUID> facilityIds) {
}
