package com.facilityops.backend.global.config;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;

import com.facilityops.backend.modules.account.domain.LockoutPolicy;
import com.facilityops.backend.modules.account.domain.SessionPolicy;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 잠금/세션 정책과 공용 UTC 시계를 제공한다.
 */
@Configuration
public class AccessControlConfig {

    @Bean
    public Clock utcClock() {
        return Clock.system(ZoneOffset.UTC);
    }

    @Bean
    public LockoutPolicy lockoutPolicy(
            @Value("${auth.lockout.threshold:5}") int threshold,
            @Value("${auth.lockout.duration:PT30M}") Duration duration
    ) {
        return new LockoutPolicy(threshold, duration);
    }

    @Bean
    public SessionPolicy sessionPolicy(
            @Value("${auth.session.capacity:5}") int capacity,
            @Value("${auth.session.ttl:P7D}") Duration ttl
    ) {
        return new SessionPolicy(capacity, ttl);
    }
}
