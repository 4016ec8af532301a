package com.facilityops.backend.global.security;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Set;
import java.util.UUID;

import com.facilityops.backend.global.error.ProblemException;
import com.facilityops.backend.modules.account.domain.AccountRole;
import com.facilityops.backend.modules.account.domain.Capability;
import com.facilityops.backend.support.TestAccounts;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;

class AccessGuardTest {

    private final AccessGuard accessGuard = new AccessGuard();

    @Test
    @DisplayName("기술자는 매니저 전용 작업에서 InsufficientRole")
    void technicianIsNotManager() {
        JwtAuthenticationPrincipal technician = TestAccounts.principal(UUID.randomUUID(), AccountRole.TECHNICIAN);

        assertFailure(() -> accessGuard.requireManager(technician), AuthFailure.INSUFFICIENT_ROLE);
    }

    @Test
    @DisplayName("super_admin은 어떤 역할 목록이든 통과한다")
    void superAdminBypassesRoleChecks() {
        JwtAuthenticationPrincipal superAdmin = TestAccounts.principal(UUID.randomUUID(), AccountRole.SUPER_ADMIN);

        assertThatCode(() -> accessGuard.authorize(superAdmin, AccountRole.GUEST)).doesNotThrowAnyException();
        assertThatCode(() -> accessGuard.authorize(superAdmin)).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("역할 계층: supervisor는 감독자 작업만, admin은 super_admin 전용 작업에서 거부")
    void roleHierarchy() {
        JwtAuthenticationPrincipal supervisor = TestAccounts.principal(UUID.randomUUID(), AccountRole.SUPERVISOR);
        JwtAuthenticationPrincipal admin = TestAccounts.principal(UUID.randomUUID(), AccountRole.ADMIN);

        assertThatCode(() -> accessGuard.requireSupervisor(supervisor)).doesNotThrowAnyException();
        assertFailure(() -> accessGuard.requireManager(supervisor), AuthFailure.INSUFFICIENT_ROLE);
        assertThatCode(() -> accessGuard.requireAdmin(admin)).doesNotThrowAnyException();
        assertFailure(() -> accessGuard.requireSuperAdmin(admin), AuthFailure.INSUFFICIENT_ROLE);
    }

    @Test
    @DisplayName("신원이 없으면 Unauthenticated")
    void missingPrincipal() {
        assertFailure(() -> accessGuard.requireAdmin(null), AuthFailure.UNAUTHENTICATED);
        assertFailure(() -> accessGuard.requireOwnershipOrAdmin(null, UUID.randomUUID()), AuthFailure.UNAUTHENTICATED);
    }

    @Test
    @DisplayName("본인 리소스는 접근 가능하고 타인 리소스는 AccessDenied")
    void ownership() {
        UUID selfId = UUID.randomUUID();
        JwtAuthenticationPrincipal user = TestAccounts.principal(selfId, AccountRole.USER);

        assertThatCode(() -> accessGuard.requireOwnershipOrAdmin(user, selfId)).doesNotThrowAnyException();
        assertFailure(() -> accessGuard.requireOwnershipOrAdmin(user, UUID.randomUUID()), AuthFailure.ACCESS_DENIED);
    }

    @Test
    @DisplayName("관리자와 시설 관리자/감독자는 타인 리소스도 통과한다")
    void ownershipAllowsAdministrativeAndManagers() {
        UUID target = UUID.randomUUID();

        for (AccountRole role : Set.of(AccountRole.ADMIN, AccountRole.SUPER_ADMIN,
                AccountRole.FACILITY_MANAGER, AccountRole.SUPERVISOR)) {
            JwtAuthenticationPrincipal principal = TestAccounts.principal(UUID.randomUUID(), role);
            assertThatCode(() -> accessGuard.requireOwnershipOrAdmin(principal, target)).doesNotThrowAnyException();
        }
        JwtAuthenticationPrincipal housekeeping = TestAccounts.principal(UUID.randomUUID(), AccountRole.HOUSEKEEPING);
        assertFailure(() -> accessGuard.requireOwnershipOrAdmin(housekeeping, target), AuthFailure.ACCESS_DENIED);
    }

    @Test
    @DisplayName("시설 접근은 관리자이거나 관리 시설 목록에 있을 때만")
    void facilityAccess() {
        UUID managed = UUID.randomUUID();
        UUID other = UUID.randomUUID();
        JwtAuthenticationPrincipal manager =
                TestAccounts.principal(UUID.randomUUID(), AccountRole.FACILITY_MANAGER, Set.of(managed));
        JwtAuthenticationPrincipal admin = TestAccounts.principal(UUID.randomUUID(), AccountRole.ADMIN);

        assertThatCode(() -> accessGuard.requireFacilityAccess(manager, managed)).doesNotThrowAnyException();
        assertFailure(() -> accessGuard.requireFacilityAccess(manager, other), AuthFailure.ACCESS_DENIED);
        assertThatCode(() -> accessGuard.requireFacilityAccess(admin, other)).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("능력 검사는 유효 권한 기준")
    void capabilityCheck() {
        JwtAuthenticationPrincipal technician = TestAccounts.principal(UUID.randomUUID(), AccountRole.TECHNICIAN);

        assertThatCode(() -> accessGuard.requireCapability(technician, Capability.MANAGE_IOT))
                .doesNotThrowAnyException();
        assertFailure(() -> accessGuard.requireCapability(technician, Capability.MANAGE_USERS),
                AuthFailure.INSUFFICIENT_ROLE);
    }

    private static void assertFailure(Executable call, AuthFailure expected) {
        assertThatThrownBy(call::execute)
                .isInstanceOf(ProblemException.class)
                .matches(ex -> expected.matches((ProblemException) ex), expected.getCode());
    }
}
