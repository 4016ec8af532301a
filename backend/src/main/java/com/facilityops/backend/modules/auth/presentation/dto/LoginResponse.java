package com.facilityops.backend.modules.auth.presentation.dto;

import com.facilityops.backend.modules.account.presentation.dto.AccountResponse;

public record LoginResponse(TokenPairResponse tokens, AccountResponse user) {
}
