package com.facilityops.backend.modules.account.presentation.dto;

import java.util.List;

public record AccountPageResponse(
        List<AccountResponse> items,
        int page,
        int size,
        long totalElements,
        int totalPages
) {
}
