package com.facilityops.backend.modules.account.domain;

import static com.facilityops.backend.modules.account.domain.Capability.ACCESS_AUDIT_LOGS;
import static com.facilityops.backend.modules.account.domain.Capability.APPROVE_LEAVES;
import static com.facilityops.backend.modules.account.domain.Capability.MANAGE_ATTENDANCE;
import static com.facilityops.backend.modules.account.domain.Capability.MANAGE_BILLING;
import static com.facilityops.backend.modules.account.domain.Capability.MANAGE_DOCUMENTS;
import static com.facilityops.backend.modules.account.domain.Capability.MANAGE_EMPLOYEES;
import static com.facilityops.backend.modules.account.domain.Capability.MANAGE_FACILITIES;
import static com.facilityops.backend.modules.account.domain.Capability.MANAGE_IOT;
import static com.facilityops.backend.modules.account.domain.Capability.MANAGE_PAYROLL;
import static com.facilityops.backend.modules.account.domain.Capability.MANAGE_SERVICES;
import static com.facilityops.backend.modules.account.domain.Capability.MANAGE_SETTINGS;
import static com.facilityops.backend.modules.account.domain.Capability.MANAGE_SHIFTS;
import static com.facilityops.backend.modules.account.domain.Capability.MANAGE_USERS;
import static com.facilityops.backend.modules.account.domain.Capability.VIEW_EMPLOYEE_REPORTS;
import static com.facilityops.backend.modules.account.domain.Capability.VIEW_REPORTS;
import static com.facilityops.backend.modules.account.domain.Capability.VIEW_SALARY_INFO;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 역할별 기본 권한 표. 읽기 전용이며 조회할 때마다 새 {@link PermissionSet}을 돌려준다.
 */
public final class RolePermissionMatrix {

    private static final Map<AccountRole, Map<Capability, Boolean>> GRANTS = Map.of(
            AccountRole.SUPER_ADMIN, grants(Capability.values()),
            AccountRole.ADMIN, grants(Capability.values()),
            AccountRole.FACILITY_MANAGER, grants(
                    MANAGE_FACILITIES, MANAGE_SERVICES, MANAGE_IOT, VIEW_REPORTS,
                    MANAGE_EMPLOYEES, VIEW_EMPLOYEE_REPORTS, APPROVE_LEAVES,
                    MANAGE_ATTENDANCE, MANAGE_SHIFTS, MANAGE_DOCUMENTS),
            AccountRole.SUPERVISOR, grants(
                    MANAGE_SERVICES, MANAGE_IOT, VIEW_REPORTS,
                    VIEW_EMPLOYEE_REPORTS, MANAGE_ATTENDANCE, MANAGE_SHIFTS),
            AccountRole.TECHNICIAN, grants(MANAGE_IOT, VIEW_REPORTS),
            AccountRole.HOUSEKEEPING, grants(VIEW_REPORTS),
            AccountRole.USER, grants(VIEW_REPORTS),
            AccountRole.GUEST, grants()
    );

    private static final Map<AccountRole, List<String>> OVERRIDES = Map.of(
            AccountRole.SUPER_ADMIN, List.of(PermissionSet.ALL_OVERRIDE)
    );

    private RolePermissionMatrix() {
    }

    public static PermissionSet defaultsFor(AccountRole role) {
        Map<Capability, Boolean> grants = GRANTS.getOrDefault(role, grants());
        List<String> overrides = OVERRIDES.getOrDefault(role, List.of());
        return PermissionSet.of(grants, overrides);
    }

    private static Map<Capability, Boolean> grants(Capability... granted) {
        Set<Capability> grantedSet = Set.copyOf(Arrays.asList(granted));
        Map<Capability, Boolean> table = new EnumMap<>(Capability.class);
        for (Capability capability : Capability.values()) {
            table.put(capability, grantedSet.contains(capability));
        }
        return Collections.unmodifiableMap(table);
    }
}
