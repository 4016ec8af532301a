package com.facilityops.backend.modules.account.presentation.dto;

import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import com.facilityops.backend.modules.account.domain.Account;
import com.facilityops.backend.modules.account.domain.Capability;
import com.facilityops.backend.modules.account.domain.SecurityState;

/**
 * 외부로 내보내는 계정 표현. 비밀번호 해시, 2FA 시크릿, 세션 토큰, 일회성 토큰 해시는 포함하지 않는다.
 */
public record AccountResponse(
        UUID id,
        String email,
        String username,
        String firstName,
        String lastName,
        String fullName,
        String phone,
        String role,
        String status,
        String verificationStatus,
        PermissionsView permissions,
        SecurityView security,
        Set<UUID> managedFacilities,
        boolean deleted,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static AccountResponse from(Account account, Set<Capability> effective) {
        return new AccountResponse(
                account.getId(),
                account.getEmail(),
                account.getUsername(),
                account.getFirstName(),
                account.getLastName(),
                account.getFullName(),
                account.getPhone(),
                account.getRole().getCode(),
                account.getStatus().getCode(),
                account.getVerificationStatus().getCode(),
                PermissionsView.from(account, effective),
                SecurityView.from(account.getSecurity()),
                Set.copyOf(account.getManagedFacilities()),
                account.isDeleted(),
                account.getCreatedAt(),
                account.getUpdatedAt()
        );
    }

    public record PermissionsView(Map<String, Boolean> grants, List<String> overrides, List<String> effective) {

        static PermissionsView from(Account account, Set<Capability> effective) {
            Map<String, Boolean> grants = new LinkedHashMap<>();
            account.getPermissions().asMap().forEach((capability, granted) -> grants.put(capability.getKey(), granted));
            List<String> effectiveKeys = effective.stream()
                    .sorted()
                    .map(Capability::getKey)
                    .toList();
            return new PermissionsView(grants, List.copyOf(account.getPermissions().getOverrides()), effectiveKeys);
        }
    }

    public record SecurityView(
            OffsetDateTime lastPasswordChange,
            int failedLoginAttempts,
            OffsetDateTime lockoutUntil,
            OffsetDateTime lastLoginAt,
            String lastLoginIp,
            boolean twoFactorEnabled,
            int activeSessions
    ) {

        static SecurityView from(SecurityState state) {
            return new SecurityView(
                    state.getLastPasswordChange(),
                    state.getFailedLoginAttempts(),
                    state.getLockoutUntil(),
                    state.getLastLoginAt(),
                    state.getLastLoginIp(),
                    state.isTwoFactorEnabled(),
                    state.getSessionTokens().size()
            );
        }
    }
}
