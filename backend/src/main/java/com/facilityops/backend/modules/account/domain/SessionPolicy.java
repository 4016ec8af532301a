package com.facilityops.backend.modules.account.domain;

import java.time.Duration;
import java.time.OffsetDateTime;

/**
 * 계정별 세션 목록 정책. 용량을 넘으면 가장 오래 추가된 세션부터 제거한다.
 * 사용 시점에 따른 갱신은 하지 않는다.
 */
public final class SessionPolicy {

    public static final int DEFAULT_CAPACITY = 5;
    public static final Duration DEFAULT_TTL = Duration.ofDays(7);

    private final int capacity;
    private final Duration ttl;

    public SessionPolicy(int capacity, Duration ttl) {
        if (capacity < 1) {
            throw new IllegalArgumentException("session capacity must be >= 1");
        }
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("session ttl must be positive");
        }
        this.capacity = capacity;
        this.ttl = ttl;
    }

    public static SessionPolicy defaults() {
        return new SessionPolicy(DEFAULT_CAPACITY, DEFAULT_TTL);
    }

    public SessionToken add(SecurityState state, String token, String device, String ip, OffsetDateTime now) {
        SessionToken session = new SessionToken(token, now, now.plus(ttl), device, ip);
        state.appendSession(session, capacity);
        return session;
    }

    public void remove(SecurityState state, String token) {
        state.removeSession(token);
    }

    public void clearAll(SecurityState state) {
        state.clearSessions();
    }

    public boolean contains(SecurityState state, String token) {
        return state.hasSession(token);
    }

    public int getCapacity() {
        return capacity;
    }

    public Duration getTtl() {
        return ttl;
    }
}
