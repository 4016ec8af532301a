package com.facilityops.backend.modules.account.presentation.dto;

/**
 * 새 비밀번호 규칙. 요청 레코드의 Bean Validation 애노테이션에서 공유한다.
 */
public final class PasswordRules {

    public static final int MIN_LENGTH = 8;
    public static final int MAX_LENGTH = 128;
    public static final String PATTERN = "^(?=.*[a-z])(?=.*[A-Z])(?=.*\\d)(?=.*[@$!%*?&])[A-Za-z\\d@$!%*?&].*$";
    public static final String MESSAGE = "must contain at least one lowercase letter, one uppercase letter, "
            + "one number, and one special character (@$!%*?&)";

    private PasswordRules() {
    }
}
