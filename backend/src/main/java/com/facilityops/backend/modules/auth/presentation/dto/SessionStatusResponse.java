package com.facilityops.backend.modules.auth.presentation.dto;

import com.facilityops.backend.modules.account.presentation.dto.AccountResponse;
import com.fasterxml.jackson.annotation.JsonInclude;

public record SessionStatusResponse(
        boolean authenticated,
        @JsonInclude(JsonInclude.Include.NON_NULL) AccountResponse user
) {
}
