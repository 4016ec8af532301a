package com.facilityops.backend.global.error;

import org.springframework.http.HttpStatus;

/**
 * 잠금처럼 기다리면 풀리는 오류. 응답에 Retry-After 헤더를 싣는다.
 */
public class RetryableProblemException extends ProblemException {

    private final long retryAfterSeconds;

    public RetryableProblemException(HttpStatus status, String code, String detail, long retryAfterSeconds) {
        super(status, code, detail);
        if (retryAfterSeconds < 0) {
            throw new IllegalArgumentException("retryAfterSeconds must be >= 0");
        }
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}
