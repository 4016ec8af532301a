package com.facilityops.backend.modules.account.domain;

import java.time.Duration;
import java.time.OffsetDateTime;

/**
 * 연속 로그인 실패에 따른 계정 잠금 정책.
 * 잠금 여부는 저장하지 않고 {@code lockoutUntil}과 현재 시각으로 계산한다.
 */
public final class LockoutPolicy {

    public static final int DEFAULT_THRESHOLD = 5;
    public static final Duration DEFAULT_DURATION = Duration.ofMinutes(30);

    private static final long MILLIS_PER_MINUTE = 60_000L;

    private final int threshold;
    private final Duration duration;

    public LockoutPolicy(int threshold, Duration duration) {
        if (threshold < 1) {
            throw new IllegalArgumentException("lockout threshold must be >= 1");
        }
        if (duration == null || duration.isNegative() || duration.isZero()) {
            throw new IllegalArgumentException("lockout duration must be positive");
        }
        this.threshold = threshold;
        this.duration = duration;
    }

    public static LockoutPolicy defaults() {
        return new LockoutPolicy(DEFAULT_THRESHOLD, DEFAULT_DURATION);
    }

    public static boolean isLocked(SecurityState state, OffsetDateTime now) {
        OffsetDateTime until = state.getLockoutUntil();
        return until != null && until.isAfter(now);
    }

    public static long remainingMinutes(SecurityState state, OffsetDateTime now) {
        if (!isLocked(state, now)) {
            return 0;
        }
        long millis = Duration.between(now, state.getLockoutUntil()).toMillis();
        return (millis + MILLIS_PER_MINUTE - 1) / MILLIS_PER_MINUTE;
    }

    /**
     * 실패 1회를 기록한다.
     *
     * @return 기록 후 계정이 잠금 상태이면 {@code true}
     */
    public boolean recordFailure(SecurityState state, OffsetDateTime now) {
        int attempts = state.getFailedLoginAttempts() + 1;
        state.setFailedLoginAttempts(attempts);
        if (attempts >= threshold) {
            state.setLockoutUntil(now.plus(duration));
        }
        return isLocked(state, now);
    }

    public void recordSuccess(SecurityState state) {
        state.setFailedLoginAttempts(0);
        state.setLockoutUntil(null);
    }

    public int getThreshold() {
        return threshold;
    }

    public Duration getDuration() {
        return duration;
    }
}
