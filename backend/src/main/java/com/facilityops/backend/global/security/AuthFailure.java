package com.facilityops.backend.global.security;

import org.springframework.http.HttpStatus;

import com.facilityops.backend.global.error.ProblemException;
import com.facilityops.backend.global.error.RetryableProblemException;

/**
 * 요청 게이트 체인이 거부할 때 사용하는 실패 분류.
 * 각 항목은 HTTP 상태, 문제 코드, 사용자 메시지를 고정으로 가진다.
 */
public enum AuthFailure {

    UNAUTHENTICATED(HttpStatus.UNAUTHORIZED, "auth.unauthenticated",
            "Authentication required. Please provide a valid token"),
    TOKEN_EXPIRED(HttpStatus.UNAUTHORIZED, "auth.token_expired", "Token has expired. Please login again"),
    TOKEN_INVALID(HttpStatus.UNAUTHORIZED, "auth.token_invalid", "Invalid token. Please login again"),
    ACCOUNT_GONE(HttpStatus.UNAUTHORIZED, "auth.account_gone", "User no longer exists. Please login again"),
    ACCOUNT_NOT_ACTIVE(HttpStatus.FORBIDDEN, "auth.account_not_active",
            "Account is %s. Please contact administrator"),
    ACCOUNT_LOCKED(HttpStatus.FORBIDDEN, "auth.account_locked", "Account is locked. Try again in %d minutes"),
    SESSION_INVALID(HttpStatus.UNAUTHORIZED, "auth.session_invalid",
            "Session is no longer valid. Please login again"),
    INSUFFICIENT_ROLE(HttpStatus.FORBIDDEN, "auth.insufficient_role",
            "Insufficient permissions to access this resource"),
    ACCESS_DENIED(HttpStatus.FORBIDDEN, "auth.access_denied", "Access denied"),
    INTERNAL_FAILURE(HttpStatus.INTERNAL_SERVER_ERROR, "auth.internal_failure", "Authentication failed");

    private final HttpStatus status;
    private final String code;
    private final String message;

    AuthFailure(HttpStatus status, String code, String message) {
        this.status = status;
        this.code = code;
        this.message = message;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getCode() {
        return code;
    }

    public ProblemException exception() {
        return new ProblemException(status, code, message);
    }

    public ProblemException exception(String detail) {
        return new ProblemException(status, code, detail);
    }

    public static ProblemException notActive(String statusCode) {
        return ACCOUNT_NOT_ACTIVE.exception(ACCOUNT_NOT_ACTIVE.message.formatted(statusCode));
    }

    public static RetryableProblemException locked(long remainingMinutes) {
        long minutes = Math.max(remainingMinutes, 1);
        return new RetryableProblemException(ACCOUNT_LOCKED.status, ACCOUNT_LOCKED.code,
                ACCOUNT_LOCKED.message.formatted(minutes), minutes * 60);
    }

    public boolean matches(ProblemException ex) {
        return ex != null && code.equals(ex.getCode());
    }
}
