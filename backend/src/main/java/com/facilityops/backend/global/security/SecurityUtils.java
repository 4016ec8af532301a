package com.facilityops.backend.global.security;

import java.util.Optional;

import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

public final class SecurityUtils {

    private SecurityUtils() {
    }

    public static Optional<JwtAuthenticationPrincipal> findCurrentPrincipal() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication != null && authentication.getPrincipal() instanceof JwtAuthenticationPrincipal principal) {
            return Optional.of(principal);
        }
        return Optional.empty();
    }

    /**
     * 현재 요청에 제시된 액세스 토큰. 로그아웃 시 세션 항목을 찾는 데 쓴다.
     */
    public static String getCurrentAccessToken() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null || !(authentication.getCredentials() instanceof String token) || token.isBlank()) {
            throw AuthFailure.UNAUTHENTICATED.exception();
        }
        return token;
    }
}
