package com.facilityops.backend.modules.account.domain;

import java.util.Arrays;
import java.util.Optional;

/**
 * 계정 권한 매트릭스에 존재하는 이름 있는 권한 목록.
 * {@link #getKey()} 값은 오버라이드 목록에 문자열로 기록될 때 사용한다.
 */
public enum Capability {
    MANAGE_USERS("canManageUsers"),
    MANAGE_FACILITIES("canManageFacilities"),
    MANAGE_SERVICES("canManageServices"),
    MANAGE_IOT("canManageIOT"),
    VIEW_REPORTS("canViewReports"),
    MANAGE_SETTINGS("canManageSettings"),
    MANAGE_BILLING("canManageBilling"),
    ACCESS_AUDIT_LOGS("canAccessAuditLogs"),
    MANAGE_EMPLOYEES("canManageEmployees"),
    VIEW_EMPLOYEE_REPORTS("canViewEmployeeReports"),
    APPROVE_LEAVES("canApproveLeaves"),
    MANAGE_ATTENDANCE("canManageAttendance"),
    MANAGE_SHIFTS("canManageShifts"),
    MANAGE_PAYROLL("canManagePayroll"),
    VIEW_SALARY_INFO("canViewSalaryInfo"),
    MANAGE_DOCUMENTS("canManageDocuments");

    private final String key;

    Capability(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    public static Optional<Capability> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(capability -> capability.key.equals(key) || capability.name().equals(key))
                .findFirst();
    }
}
