package com.facilityops.backend.modules.account.presentation.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

public record CreateAccountResponse(
        AccountResponse account,
        @JsonInclude(JsonInclude.Include.NON_NULL) String verificationToken
) {
}
