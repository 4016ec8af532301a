package com.facilityops.backend.global.config;

import java.util.Optional;
import java.util.UUID;

import com.facilityops.backend.global.security.SecurityUtils;

import org.springframework.data.domain.AuditorAware;
import org.springframework.lang.NonNull;

/**
 * JPA 감사용 현재 행위자(계정 id). 인증 신원이 없으면 비어 있다.
 */
public class FacilityOpsAuditorAware implements AuditorAware<UUID> {

    @Override
    @NonNull
    public Optional<UUID> getCurrentAuditor() {
        return SecurityUtils.findCurrentPrincipal().map(principal -> principal.accountId());
    }
}
