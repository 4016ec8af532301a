package com.facilityops.backend.modules.account.domain;

import java.util.Arrays;
import java.util.Optional;

public enum AccountRole {
    SUPER_ADMIN("super_admin"),
    ADMIN("admin"),
    FACILITY_MANAGER("facility_manager"),
    SUPERVISOR("supervisor"),
    TECHNICIAN("technician"),
    HOUSEKEEPING("housekeeping"),
    USER("user"),
    GUEST("guest");

    private final String code;

    AccountRole(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public boolean isAdministrative() {
        return this == SUPER_ADMIN || this == ADMIN;
    }

    public static Optional<AccountRole> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        String normalized = code.trim();
        return Arrays.stream(values())
                .filter(role -> role.code.equalsIgnoreCase(normalized) || role.name().equalsIgnoreCase(normalized))
                .findFirst();
    }
}
