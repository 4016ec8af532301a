package com.facilityops.backend.modules.auth.presentation.dto;

public record RefreshResponse(TokenPairResponse tokens) {
}
