package com.facilityops.backend.modules.account.domain;

import java.util.Arrays;
import java.util.Optional;

public enum AccountStatus {
    ACTIVE("active"),
    INACTIVE("inactive"),
    SUSPENDED("suspended"),
    PENDING("pending"),
    BLOCKED("blocked");

    private final String code;

    AccountStatus(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public boolean isActive() {
        return this == ACTIVE;
    }

    public static Optional<AccountStatus> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        String normalized = code.trim();
        return Arrays.stream(values())
                .filter(status -> status.code.equalsIgnoreCase(normalized))
                .findFirst();
    }
}
