package com.facilityops.backend.global.security;

import java.util.List;
import java.util.Set;
import java.util.UUID;

import com.facilityops.backend.modules.account.domain.AccountRole;
import com.facilityops.backend.modules.account.domain.Capability;

/**
 * 인증된 요청에 부착되는 계정 신원. 요청 범위 동안만 유효하다.
 */
public record JwtAuthenticationPrincipal(
        UUID accountId,
        String email,
        AccountRole role,
        Set<Capability> capabilities,
        List<String> overrides,
        Set<UUID> managedFacilities
) {

    public JwtAuthenticationPrincipal {
        capabilities = capabilities == null ? Set.of() : Set.copyOf(capabilities);
        overrides = overrides == null ? List.of() : List.copyOf(overrides);
        managedFacilities = managedFacilities == null ? Set.of() : Set.copyOf(managedFacilities);
    }

    public boolean hasRole(AccountRole candidate) {
        return role == candidate;
    }

    public boolean isSuperAdmin() {
        return role == AccountRole.SUPER_ADMIN;
    }

    public boolean isAdministrative() {
        return role != null && role.isAdministrative();
    }

    public boolean hasCapability(Capability capability) {
        return capabilities.contains(capability);
    }

    public boolean managesFacility(UUID facilityId) {
        return facilityId != null && managedFacilities.contains(facilityId);
    }
}
