package com.facilityops.backend.global.security;

import java.util.Arrays;
import java.util.UUID;

import com.facilityops.backend.global.error.ProblemException;
import com.facilityops.backend.modules.account.domain.AccountRole;
import com.facilityops.backend.modules.account.domain.Capability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * 부착된 신원에 대한 역할/소유권/시설 범위 검사.
 * super_admin은 역할 검사를 항상 통과한다.
 */
@Component
public class AccessGuard {

    private static final Logger log = LoggerFactory.getLogger(AccessGuard.class);

    public void authorize(JwtAuthenticationPrincipal principal, AccountRole... allowedRoles) {
        guard("role check", () -> {
            JwtAuthenticationPrincipal current = requirePrincipal(principal);
            if (current.isSuperAdmin()) {
                return;
            }
            boolean allowed = Arrays.stream(allowedRoles).anyMatch(current::hasRole);
            if (!allowed) {
                throw AuthFailure.INSUFFICIENT_ROLE.exception();
            }
        });
    }

    public void requireSuperAdmin(JwtAuthenticationPrincipal principal) {
        authorize(principal, AccountRole.SUPER_ADMIN);
    }

    public void requireAdmin(JwtAuthenticationPrincipal principal) {
        authorize(principal, AccountRole.SUPER_ADMIN, AccountRole.ADMIN);
    }

    public void requireManager(JwtAuthenticationPrincipal principal) {
        authorize(principal, AccountRole.SUPER_ADMIN, AccountRole.ADMIN, AccountRole.FACILITY_MANAGER);
    }

    public void requireSupervisor(JwtAuthenticationPrincipal principal) {
        authorize(principal, AccountRole.SUPER_ADMIN, AccountRole.ADMIN, AccountRole.FACILITY_MANAGER,
                AccountRole.SUPERVISOR);
    }

    /**
     * 관리자, 본인, 그리고 시설 관리자/감독자를 허용한다.
     * 시설 관리자/감독자의 하위 직원 판별은 아직 없으므로 일괄 허용한다.
     */
    public void requireOwnershipOrAdmin(JwtAuthenticationPrincipal principal, UUID targetAccountId) {
        guard("ownership check", () -> {
            JwtAuthenticationPrincipal current = requirePrincipal(principal);
            if (current.isAdministrative() || current.accountId().equals(targetAccountId)) {
                return;
            }
            if (current.hasRole(AccountRole.FACILITY_MANAGER) || current.hasRole(AccountRole.SUPERVISOR)) {
                // TODO: restrict to accounts assigned to the caller's facilities once rosters are modelled
                log.debug("Ownership check permitted for {} on {} via role {}",
                        current.accountId(), targetAccountId, current.role().getCode());
                return;
            }
            throw AuthFailure.ACCESS_DENIED.exception("Access denied. You can only access your own resources");
        });
    }

    public void requireFacilityAccess(JwtAuthenticationPrincipal principal, UUID facilityId) {
        guard("facility access check", () -> {
            JwtAuthenticationPrincipal current = requirePrincipal(principal);
            if (current.isAdministrative() || current.managesFacility(facilityId)) {
                return;
            }
            throw AuthFailure.ACCESS_DENIED.exception(
                    "Access denied. You do not have permission to access this facility");
        });
    }

    public void requireCapability(JwtAuthenticationPrincipal principal, Capability capability) {
        guard("capability check", () -> {
            JwtAuthenticationPrincipal current = requirePrincipal(principal);
            if (!current.hasCapability(capability)) {
                throw AuthFailure.INSUFFICIENT_ROLE.exception();
            }
        });
    }

    private static JwtAuthenticationPrincipal requirePrincipal(JwtAuthenticationPrincipal principal) {
        if (principal == null) {
            throw AuthFailure.UNAUTHENTICATED.exception();
        }
        return principal;
    }

    private static void guard(String operation, Runnable check) {
        try {
            check.run();
        } catch (ProblemException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            log.error("Unexpected failure during {}", operation, ex);
            throw AuthFailure.INTERNAL_FAILURE.exception("Authorization failed");
        }
    }
}
