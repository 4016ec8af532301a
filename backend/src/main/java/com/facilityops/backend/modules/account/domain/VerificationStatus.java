package com.facilityops.backend.modules.account.domain;

import java.util.Locale;

public enum VerificationStatus {
    PENDING,
    VERIFIED,
    REJECTED;

    public String getCode() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isVerified() {
        return this == VERIFIED;
    }
}
